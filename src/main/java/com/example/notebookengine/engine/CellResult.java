package com.example.notebookengine.engine;

import com.example.notebookengine.domain.NotebookCell;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-cell outcome of a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellResult {

    private String cellId;
    private int cellIndex;
    private String cellType;
    private NotebookCell.CellStatus status;
    private Object output;
    private String error;
    private long executionTimeMs;

    public static CellResult skipped(NotebookCell cell) {
        return CellResult.builder()
                .cellId(cell.getId())
                .cellIndex(cell.getCellIndex())
                .cellType(cell.getCellType())
                .status(NotebookCell.CellStatus.SKIPPED)
                .build();
    }
}
