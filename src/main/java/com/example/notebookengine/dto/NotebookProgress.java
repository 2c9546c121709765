package com.example.notebookengine.dto;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.NotebookCell;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a notebook's run state, for polling clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotebookProgress {

    private String notebookId;
    private Notebook.NotebookStatus status;
    private String pausedAtCellId;
    private Integer resumeFromIndex;
    private String rejectedAtCellId;
    private boolean cancelRequested;
    private String errorMessage;
    private Instant lastRunAt;
    private Map<NotebookCell.CellStatus, Long> counts;
    private List<CellProgress> cells;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CellProgress {
        private String cellId;
        private int cellIndex;
        private String cellType;
        private NotebookCell.CellStatus status;
        private Long durationMs;
        private String errorMessage;
    }
}
