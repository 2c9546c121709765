package com.example.notebookengine.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Result of one run invocation: final status, aggregate counts, per-cell outcomes
 * and the final variable snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunResult {

    private String notebookId;
    private String notebookTitle;
    private String runId;
    private RunOutcome status;
    private int cellsTotal;
    private int cellsCompleted;
    private int cellsFailed;
    private int cellsSkipped;
    private String pausedAtCellId;
    private String error;
    private long durationMs;

    @Builder.Default
    private List<CellResult> results = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> variables = Map.of();
}
