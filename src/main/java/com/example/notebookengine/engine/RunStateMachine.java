package com.example.notebookengine.engine;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.Notebook.NotebookStatus;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.domain.NotebookCell.CellStatus;
import com.example.notebookengine.exception.StateException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal status transitions for notebooks (run level) and cells.
 *
 * Run: idle → running → {completed, failed, paused, cancelled}; from paused only
 * running (approve and resume), completed (approved last cell) or failed (reject),
 * plus idle through a reset. Entering RUNNING is never done through here but through
 * the store's compare-and-set, from one of {@link #STARTABLE_STATUSES}.
 */
public final class RunStateMachine {

    /** Notebook statuses from which a new run may take the lock. */
    public static final Set<NotebookStatus> STARTABLE_STATUSES = EnumSet.of(
            NotebookStatus.IDLE, NotebookStatus.COMPLETED, NotebookStatus.FAILED, NotebookStatus.CANCELLED);

    /** Cell statuses a run never revisits on its own. */
    public static final Set<CellStatus> TERMINAL_CELL_STATUSES = EnumSet.of(
            CellStatus.COMPLETED, CellStatus.ERROR, CellStatus.SKIPPED);

    private static final Map<NotebookStatus, Set<NotebookStatus>> RUN_TRANSITIONS = new EnumMap<>(NotebookStatus.class);
    private static final Map<CellStatus, Set<CellStatus>> CELL_TRANSITIONS = new EnumMap<>(CellStatus.class);

    static {
        RUN_TRANSITIONS.put(NotebookStatus.IDLE, EnumSet.of(NotebookStatus.RUNNING, NotebookStatus.IDLE));
        // RUNNING may also fall back to whatever preceded a single-cell run
        RUN_TRANSITIONS.put(NotebookStatus.RUNNING, EnumSet.complementOf(EnumSet.of(NotebookStatus.RUNNING)));
        RUN_TRANSITIONS.put(NotebookStatus.PAUSED, EnumSet.of(
                NotebookStatus.RUNNING, NotebookStatus.COMPLETED, NotebookStatus.FAILED, NotebookStatus.IDLE));
        for (NotebookStatus terminal : EnumSet.of(
                NotebookStatus.COMPLETED, NotebookStatus.FAILED, NotebookStatus.CANCELLED)) {
            RUN_TRANSITIONS.put(terminal, EnumSet.of(NotebookStatus.RUNNING, NotebookStatus.IDLE));
        }

        CELL_TRANSITIONS.put(CellStatus.IDLE, EnumSet.of(
                CellStatus.IDLE, CellStatus.QUEUED, CellStatus.RUNNING, CellStatus.SKIPPED));
        CELL_TRANSITIONS.put(CellStatus.QUEUED, EnumSet.of(
                CellStatus.IDLE, CellStatus.QUEUED, CellStatus.RUNNING, CellStatus.PAUSED, CellStatus.SKIPPED));
        CELL_TRANSITIONS.put(CellStatus.RUNNING, EnumSet.of(
                CellStatus.COMPLETED, CellStatus.ERROR, CellStatus.SKIPPED));
        CELL_TRANSITIONS.put(CellStatus.PAUSED, EnumSet.of(
                CellStatus.IDLE, CellStatus.COMPLETED, CellStatus.ERROR));
        CELL_TRANSITIONS.put(CellStatus.COMPLETED, EnumSet.of(
                CellStatus.IDLE, CellStatus.QUEUED, CellStatus.RUNNING));
        CELL_TRANSITIONS.put(CellStatus.ERROR, EnumSet.of(
                CellStatus.IDLE, CellStatus.QUEUED, CellStatus.RUNNING, CellStatus.SKIPPED));
        CELL_TRANSITIONS.put(CellStatus.SKIPPED, EnumSet.of(
                CellStatus.IDLE, CellStatus.QUEUED, CellStatus.RUNNING, CellStatus.SKIPPED));
    }

    private RunStateMachine() {
    }

    public static boolean canTransition(NotebookStatus from, NotebookStatus to) {
        return RUN_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public static boolean canTransition(CellStatus from, CellStatus to) {
        return CELL_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public static void requireTransition(NotebookStatus from, NotebookStatus to) {
        if (!canTransition(from, to)) {
            throw new StateException("Notebook cannot move from " + from + " to " + to);
        }
    }

    public static void requireTransition(CellStatus from, CellStatus to) {
        if (!canTransition(from, to)) {
            throw new StateException("Cell cannot move from " + from + " to " + to);
        }
    }

    public static boolean isTerminal(CellStatus status) {
        return TERMINAL_CELL_STATUSES.contains(status);
    }

    /**
     * Move the notebook to {@code next}.
     *
     * @throws StateException if the transition is not allowed
     */
    public static void transition(Notebook notebook, NotebookStatus next) {
        if (!canTransition(notebook.getStatus(), next)) {
            throw new StateException(String.format("Notebook %s cannot move from %s to %s",
                    notebook.getId(), notebook.getStatus(), next));
        }
        notebook.setStatus(next);
    }

    /**
     * Move the cell to {@code next}.
     *
     * @throws StateException if the transition is not allowed
     */
    public static void transition(NotebookCell cell, CellStatus next) {
        if (!canTransition(cell.getStatus(), next)) {
            throw new StateException(String.format("Cell %s cannot move from %s to %s",
                    cell.getId(), cell.getStatus(), next));
        }
        cell.setStatus(next);
    }
}
