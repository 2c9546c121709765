package com.example.notebookengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateNotebookRequest {

    private String title;
    private String description;

    @Builder.Default
    private List<CellDraft> cells = new ArrayList<>();
}
