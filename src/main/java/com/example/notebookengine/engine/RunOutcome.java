package com.example.notebookengine.engine;

/**
 * How a run invocation ended, as reported to the caller.
 */
public enum RunOutcome {
    /** Every executed cell completed. */
    COMPLETED,
    /** The run went through to the end with stopOnError off, but at least one cell errored. */
    PARTIAL,
    /** A cell errored with stopOnError on, or the run was rejected or aborted. */
    FAILED,
    /** Suspended at an approval cell. */
    PAUSED,
    /** Stopped at a cell boundary after a cancellation request. */
    CANCELLED
}
