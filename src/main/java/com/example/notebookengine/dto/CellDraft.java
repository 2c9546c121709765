package com.example.notebookengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Fields of a cell to create or update. Null fields are left unchanged on update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CellDraft {

    private String cellType;
    private String title;
    private String content;
    private Set<String> dependencies;

    /** Position to insert at; appended when null */
    private Integer insertAt;
}
