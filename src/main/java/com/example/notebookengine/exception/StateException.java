package com.example.notebookengine.exception;

/**
 * Thrown when an operation is not valid for the current notebook or cell status,
 * e.g. approving a cell that is not the one the run is paused at.
 */
public class StateException extends NotebookEngineException {

    public StateException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_STATE";
    }
}
