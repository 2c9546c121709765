package com.example.notebookengine.engine.handler;

import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.exception.StateException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Human-in-the-loop gate: suspends the run until the cell is approved or rejected.
 */
@Component
public class ApprovalCellHandler implements CellHandler {

    public static final String CELL_TYPE = "approve";

    @Override
    public String getCellType() {
        return CELL_TYPE;
    }

    @Override
    public String getDescription() {
        return "Human approval gate";
    }

    @Override
    public CellOutcome handle(NotebookCell cell, Map<String, Object> variables) {
        throw new StateException("Approval cell " + cell.getId() + " is decided by approve or reject, not executed");
    }

    @Override
    public boolean suspendsRun() {
        return true;
    }
}
