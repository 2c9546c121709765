package com.example.notebookengine.engine;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.Notebook.NotebookStatus;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.domain.NotebookCell.CellStatus;
import com.example.notebookengine.exception.StateException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class RunStateMachineTest {

    @ParameterizedTest
    @EnumSource(value = NotebookStatus.class, names = {"IDLE", "COMPLETED", "FAILED", "CANCELLED"})
    void startableStatusesMayEnterRunning(NotebookStatus status) {
        assertTrue(RunStateMachine.STARTABLE_STATUSES.contains(status));
        assertTrue(RunStateMachine.canTransition(status, NotebookStatus.RUNNING));
    }

    @Test
    void runningAndPausedAreNotStartable() {
        assertFalse(RunStateMachine.STARTABLE_STATUSES.contains(NotebookStatus.RUNNING));
        assertFalse(RunStateMachine.STARTABLE_STATUSES.contains(NotebookStatus.PAUSED));
        assertFalse(RunStateMachine.canTransition(NotebookStatus.RUNNING, NotebookStatus.RUNNING));
    }

    @Test
    void pausedNotebookCannotBeCancelled() {
        assertFalse(RunStateMachine.canTransition(NotebookStatus.PAUSED, NotebookStatus.CANCELLED));
        assertThrows(StateException.class,
                () -> RunStateMachine.requireTransition(NotebookStatus.PAUSED, NotebookStatus.CANCELLED));
    }

    @Test
    void completedCellCannotBecomePausedOrError() {
        assertFalse(RunStateMachine.canTransition(CellStatus.COMPLETED, CellStatus.PAUSED));
        assertFalse(RunStateMachine.canTransition(CellStatus.COMPLETED, CellStatus.ERROR));
        assertTrue(RunStateMachine.canTransition(CellStatus.COMPLETED, CellStatus.QUEUED));
    }

    @Test
    void pausedCellResolvesOnlyThroughADecisionOrReset() {
        assertTrue(RunStateMachine.canTransition(CellStatus.PAUSED, CellStatus.COMPLETED));
        assertTrue(RunStateMachine.canTransition(CellStatus.PAUSED, CellStatus.ERROR));
        assertTrue(RunStateMachine.canTransition(CellStatus.PAUSED, CellStatus.IDLE));
        assertFalse(RunStateMachine.canTransition(CellStatus.PAUSED, CellStatus.RUNNING));
        assertFalse(RunStateMachine.canTransition(CellStatus.PAUSED, CellStatus.SKIPPED));
    }

    @Test
    void terminalCellStatuses() {
        assertTrue(RunStateMachine.isTerminal(CellStatus.COMPLETED));
        assertTrue(RunStateMachine.isTerminal(CellStatus.ERROR));
        assertTrue(RunStateMachine.isTerminal(CellStatus.SKIPPED));
        assertFalse(RunStateMachine.isTerminal(CellStatus.PAUSED));
        assertFalse(RunStateMachine.isTerminal(CellStatus.QUEUED));
    }

    @Test
    void transitionMutatesOnlyWhenAllowed() {
        NotebookCell cell = NotebookCell.builder().id("c1").status(CellStatus.RUNNING).build();
        RunStateMachine.transition(cell, CellStatus.COMPLETED);
        assertEquals(CellStatus.COMPLETED, cell.getStatus());

        StateException e = assertThrows(StateException.class,
                () -> RunStateMachine.transition(cell, CellStatus.PAUSED));
        assertTrue(e.getMessage().contains("c1"));
        assertEquals(CellStatus.COMPLETED, cell.getStatus());

        Notebook notebook = Notebook.builder().id("n1").status(NotebookStatus.IDLE).build();
        assertThrows(StateException.class, () -> RunStateMachine.transition(notebook, NotebookStatus.COMPLETED));
        assertEquals(NotebookStatus.IDLE, notebook.getStatus());
    }
}
