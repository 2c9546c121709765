package com.example.notebookengine.engine;

import com.example.notebookengine.domain.NotebookCell;

import java.util.Map;

/**
 * Performs a cell's actual work: a prompt call, a tool call, a code run.
 *
 * Implementations may call out over the network or have other side effects.
 * Failures are reported through {@link InvocationResult#failure(String)}, not thrown;
 * resolving placeholders in the cell content against the variables is also the
 * invoker's concern.
 */
public interface ToolInvoker {

    /**
     * @param cell      the cell to execute
     * @param variables immutable snapshot of the run's variable context
     */
    InvocationResult execute(NotebookCell cell, Map<String, Object> variables);
}
