package com.example.notebookengine.exception;

/**
 * Thrown when a run is requested while another run of the same notebook is in flight.
 * The caller may retry later.
 */
public class ConflictException extends NotebookEngineException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "CONFLICT";
    }
}
