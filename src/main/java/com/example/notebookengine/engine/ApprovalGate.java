package com.example.notebookengine.engine;

import com.example.notebookengine.domain.ExecutionLogEntry;
import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.Notebook.NotebookStatus;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.domain.NotebookCell.CellStatus;
import com.example.notebookengine.domain.NotebookRun;
import com.example.notebookengine.exception.NotFoundException;
import com.example.notebookengine.exception.StateException;
import com.example.notebookengine.gateway.RunEventBroadcaster;
import com.example.notebookengine.store.CellStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides a paused approval cell. Both decisions are validated and applied while
 * holding the notebook row lock, so of two concurrent decisions exactly one wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalGate {

    private static final String DEFAULT_REJECTION = "Rejected by user";

    private final CellStore store;
    private final RunHistory runHistory;
    private final RunEventBroadcaster broadcaster;

    /**
     * Approve the cell the run is paused at. The notebook stays PAUSED until a run
     * continues from {@link ApprovalDecision#getContinueFrom()}; when the gate was the
     * last cell the notebook completes instead.
     *
     * @throws StateException if the notebook is not paused at this cell
     */
    public ApprovalDecision approve(String notebookId, String ownerId, String cellId, String feedback) {
        NotebookCell cell = requireCell(notebookId, ownerId, cellId);
        AtomicReference<Integer> continueFrom = new AtomicReference<>();

        Notebook notebook = store.updateNotebookStatus(notebookId, n -> {
            requirePausedAt(n, cell);
            int cellCount = store.loadCells(notebookId).size();
            boolean last = cell.getCellIndex() + 1 >= cellCount;

            store.updateCellStatus(cellId, c -> {
                RunStateMachine.transition(c, CellStatus.COMPLETED);
                c.setCompletedAt(Instant.now());
                c.appendLog(ExecutionLogEntry.humanReview(ApprovalDecision.APPROVED, feedback));
            });

            n.setPausedAtCellId(null);
            if (last) {
                RunStateMachine.transition(n, NotebookStatus.COMPLETED);
                n.setResumeFromIndex(null);
                n.setErrorMessage(null);
            } else {
                n.setResumeFromIndex(cell.getCellIndex() + 1);
                continueFrom.set(cell.getCellIndex() + 1);
            }
        });

        runHistory.closePaused(notebookId, NotebookRun.RunStatus.COMPLETED, null);
        log.info("Cell {} [{}] of notebook {} approved; {}", cellId, cell.getCellIndex(), notebookId,
                continueFrom.get() != null ? "continue from " + continueFrom.get() : "notebook completed");
        broadcaster.broadcast(RunEventBroadcaster.CELL_FINISHED, Map.of(
                "notebookId", notebookId,
                "cellId", cellId,
                "cellIndex", cell.getCellIndex(),
                "status", CellStatus.COMPLETED.name()));
        if (continueFrom.get() == null) {
            broadcaster.broadcast(RunEventBroadcaster.RUN_FINISHED, Map.of(
                    "notebookId", notebookId,
                    "status", RunOutcome.COMPLETED.name()));
        }

        return ApprovalDecision.builder()
                .cellId(cellId)
                .action(ApprovalDecision.APPROVED)
                .continueFrom(continueFrom.get())
                .notebookStatus(notebook.getStatus())
                .build();
    }

    /**
     * Reject the cell the run is paused at: the cell errors, every later cell is
     * skipped and the notebook fails. A new run needs a reset first.
     *
     * @throws StateException if the notebook is not paused at this cell
     */
    public ApprovalDecision reject(String notebookId, String ownerId, String cellId, String feedback) {
        NotebookCell cell = requireCell(notebookId, ownerId, cellId);
        String reason = feedback != null && !feedback.isBlank() ? feedback : DEFAULT_REJECTION;
        String notebookError = "Rejected at cell " + cell.getCellIndex() + ": " + reason;

        Notebook notebook = store.updateNotebookStatus(notebookId, n -> {
            requirePausedAt(n, cell);

            store.updateCellStatus(cellId, c -> {
                RunStateMachine.transition(c, CellStatus.ERROR);
                c.setErrorMessage(reason);
                c.setCompletedAt(Instant.now());
                c.appendLog(ExecutionLogEntry.humanReview(ApprovalDecision.REJECTED, feedback));
            });
            store.updateCells(notebookId,
                    c -> c.getCellIndex() > cell.getCellIndex(),
                    c -> RunStateMachine.transition(c, CellStatus.SKIPPED));

            RunStateMachine.transition(n, NotebookStatus.FAILED);
            n.setErrorMessage(notebookError);
            n.setPausedAtCellId(null);
            n.setResumeFromIndex(null);
            n.setRejectedAtCellId(cellId);
        });

        runHistory.closePaused(notebookId, NotebookRun.RunStatus.FAILED, notebookError);
        log.info("Cell {} [{}] of notebook {} rejected: {}", cellId, cell.getCellIndex(), notebookId, reason);
        broadcaster.broadcast(RunEventBroadcaster.RUN_FINISHED, Map.of(
                "notebookId", notebookId,
                "status", RunOutcome.FAILED.name(),
                "error", notebookError));

        return ApprovalDecision.builder()
                .cellId(cellId)
                .action(ApprovalDecision.REJECTED)
                .notebookStatus(notebook.getStatus())
                .build();
    }

    private NotebookCell requireCell(String notebookId, String ownerId, String cellId) {
        store.loadNotebook(notebookId)
                .filter(n -> n.getOwnerId().equals(ownerId))
                .orElseThrow(() -> NotFoundException.notebook(notebookId));
        return store.loadCell(cellId)
                .filter(c -> notebookId.equals(c.getNotebookId()))
                .orElseThrow(() -> NotFoundException.cell(cellId));
    }

    private void requirePausedAt(Notebook notebook, NotebookCell cell) {
        if (notebook.getStatus() != NotebookStatus.PAUSED || !cell.getId().equals(notebook.getPausedAtCellId())) {
            throw new StateException("Notebook " + notebook.getId() + " is not paused at cell " + cell.getId()
                    + " (status " + notebook.getStatus() + ")");
        }
        CellStatus current = store.loadCell(cell.getId()).map(NotebookCell::getStatus).orElse(null);
        if (current != CellStatus.PAUSED) {
            throw new StateException("Cell " + cell.getId() + " is not awaiting approval (status " + current + ")");
        }
    }
}
