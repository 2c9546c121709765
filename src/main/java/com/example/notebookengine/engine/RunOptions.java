package com.example.notebookengine.engine;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Options for one run invocation.
 */
@Data
@Builder(toBuilder = true)
public class RunOptions {

    /** Caller inputs seeded into the variable context. */
    @Builder.Default
    private Map<String, Object> variables = Map.of();

    /** Index of the first cell to execute; lower cells are reported as skipped. */
    private int startFromCell;

    /** Halt on the first cell error and skip the remainder. */
    @Builder.Default
    private boolean stopOnError = true;

    /** "manual", "api" or "job"; recorded on the run history. */
    @Builder.Default
    private String triggerType = "manual";

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }
}
