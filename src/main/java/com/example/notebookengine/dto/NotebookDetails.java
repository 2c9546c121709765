package com.example.notebookengine.dto;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.NotebookCell;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotebookDetails {

    private Notebook notebook;
    private List<NotebookCell> cells;
}
