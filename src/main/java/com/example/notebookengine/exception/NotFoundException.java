package com.example.notebookengine.exception;

/**
 * Thrown when a notebook or cell does not exist, or does not belong to the caller.
 */
public class NotFoundException extends NotebookEngineException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException notebook(String notebookId) {
        return new NotFoundException("Notebook not found: " + notebookId);
    }

    public static NotFoundException cell(String cellId) {
        return new NotFoundException("Cell not found: " + cellId);
    }

    @Override
    public String getCode() {
        return "NOT_FOUND";
    }
}
