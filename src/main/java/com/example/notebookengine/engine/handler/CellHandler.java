package com.example.notebookengine.engine.handler;

import com.example.notebookengine.domain.NotebookCell;

import java.util.Map;

/**
 * Behaviour of one cell type. Handlers are registered in the
 * {@link CellHandlerRegistry} at startup under their type tag.
 */
public interface CellHandler {

    /** Type tag this handler serves, e.g. "command" or "approve". */
    String getCellType();

    /** Short human-readable description. */
    String getDescription();

    /**
     * Execute the cell against a snapshot of the run's variables.
     * Must not throw for ordinary failures; report them as {@link CellOutcome#error(String)}.
     */
    CellOutcome handle(NotebookCell cell, Map<String, Object> variables);

    /**
     * Whether reaching a cell of this type suspends the run until a human decision.
     * Such cells are never handled by the engine and cannot be run individually.
     */
    default boolean suspendsRun() {
        return false;
    }
}
