package com.example.notebookengine.exception;

/**
 * Base class for errors the engine surfaces to its callers.
 */
public abstract class NotebookEngineException extends RuntimeException {

    protected NotebookEngineException(String message) {
        super(message);
    }

    protected NotebookEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable code reported alongside the message. */
    public abstract String getCode();
}
