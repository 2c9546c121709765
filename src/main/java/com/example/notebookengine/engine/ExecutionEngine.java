package com.example.notebookengine.engine;

import com.example.notebookengine.config.EngineProperties;
import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.Notebook.NotebookStatus;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.domain.NotebookCell.CellStatus;
import com.example.notebookengine.domain.NotebookRun;
import com.example.notebookengine.engine.handler.CellHandler;
import com.example.notebookengine.engine.handler.CellHandlerRegistry;
import com.example.notebookengine.engine.handler.CellOutcome;
import com.example.notebookengine.exception.ConflictException;
import com.example.notebookengine.exception.NotFoundException;
import com.example.notebookengine.exception.StateException;
import com.example.notebookengine.gateway.RunEventBroadcaster;
import com.example.notebookengine.store.CellStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Execution Engine - runs the cells of a notebook one at a time, in index order.
 *
 * Features:
 * - At most one run per notebook, enforced by a compare-and-set on the notebook row
 * - Cell outputs threaded to later cells through a {@link VariableContext}
 * - Approval cells suspend the run durably; a resume is a new run from the next index
 * - Stop-on-error or continue-on-error failure policy
 * - Cooperative cancellation, checked between cells
 * - Optional critic review of every completed cell
 *
 * Every status change goes through the {@link CellStore} as it happens, so
 * progress is observable while the run is in flight.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionEngine {

    private final CellStore store;
    private final CellHandlerRegistry handlerRegistry;
    private final RunHistory runHistory;
    private final RunEventBroadcaster broadcaster;
    private final ObjectProvider<CriticReviewer> criticReviewer;
    private final RunMetrics metrics;
    private final EngineProperties properties;

    /**
     * Run the notebook from {@code options.startFromCell} to its end, or until it pauses
     * at an approval cell, halts on an error, or observes a cancellation request.
     *
     * @throws NotFoundException if the notebook does not exist or is not owned by {@code ownerId}
     * @throws ConflictException if another run of the notebook is in flight
     * @throws StateException    if the notebook was rejected and not reset, or the start index is out of range
     */
    public RunResult run(String notebookId, String ownerId, RunOptions options) {
        RunOptions opts = options != null ? options : RunOptions.defaults();
        Notebook notebook = requireOwned(notebookId, ownerId);
        if (notebook.getRejectedAtCellId() != null) {
            throw new StateException("Notebook " + notebookId + " was rejected at cell "
                    + notebook.getRejectedAtCellId() + "; reset it before running again");
        }

        int startFrom = opts.getStartFromCell();
        List<NotebookCell> cells = store.loadCells(notebookId);
        if (startFrom < 0 || (startFrom > 0 && startFrom >= cells.size())) {
            throw new StateException("startFromCell " + startFrom + " is out of range for "
                    + cells.size() + " cells");
        }

        if (!store.tryAcquireRun(notebookId)) {
            throw lockRefused(notebookId, notebook);
        }

        long startedAt = System.currentTimeMillis();
        boolean resume = startFrom > 0;
        String runId = null;
        try {
            notebook = store.updateNotebookStatus(notebookId, n -> {
                n.setErrorMessage(null);
                n.setPausedAtCellId(null);
                n.setResumeFromIndex(null);
                if (!resume) {
                    n.setRunVariables(null);
                }
            });

            VariableContext context = seedContext(notebook, cells, startFrom, opts.getVariables());
            queueCells(notebookId, startFrom);
            cells = store.loadCells(notebookId);

            NotebookRun run = runHistory.open(notebook, opts, cells.size());
            runId = run.getId();

            log.info("Run #{} of notebook {} started at cell {} ({} cells, stopOnError={}, trigger={})",
                    run.getRunNumber(), notebookId, startFrom, cells.size(), opts.isStopOnError(), opts.getTriggerType());
            broadcaster.broadcast(RunEventBroadcaster.RUN_STARTED, Map.of(
                    "notebookId", notebookId,
                    "runId", runId,
                    "startFromCell", startFrom,
                    "cellsTotal", cells.size()));

            RunResult result = executeCells(notebook, run, cells, context, opts, startedAt);
            if (result.getStatus() != RunOutcome.PAUSED) {
                broadcaster.broadcast(RunEventBroadcaster.RUN_FINISHED, Map.of(
                        "notebookId", notebookId,
                        "runId", runId,
                        "status", result.getStatus().name(),
                        "durationMs", result.getDurationMs()));
            }
            return result;
        } catch (RuntimeException e) {
            abort(notebookId, runId, e);
            throw e;
        }
    }

    /**
     * Execute a single cell outside a full run, against the notebook's persisted variables
     * and the outputs of the completed cells before it. Takes the same run lock as
     * {@link #run} and restores the notebook's previous status afterwards.
     */
    public CellResult runCell(String notebookId, String ownerId, String cellId) {
        Notebook notebook = requireOwned(notebookId, ownerId);
        NotebookCell cell = store.loadCell(cellId)
                .filter(c -> notebookId.equals(c.getNotebookId()))
                .orElseThrow(() -> NotFoundException.cell(cellId));
        Optional<CellHandler> handler = handlerRegistry.getHandler(cell.getCellType());
        if (handler.isPresent() && handler.get().suspendsRun()) {
            throw new StateException("Cell " + cellId + " is an approval gate and cannot be run individually");
        }

        NotebookStatus previousStatus = notebook.getStatus();
        Instant previousLastRunAt = notebook.getLastRunAt();
        if (!store.tryAcquireRun(notebookId)) {
            throw lockRefused(notebookId, notebook);
        }

        try {
            VariableContext context = VariableContext.of(notebook.getRunVariables());
            for (NotebookCell other : store.loadCells(notebookId)) {
                if (other.getCellIndex() < cell.getCellIndex()
                        && other.getStatus() == CellStatus.COMPLETED) {
                    context.recordOutput(other.getCellIndex(), other.getOutput());
                }
            }
            log.info("Running cell {} [{}] of notebook {} individually", cellId, cell.getCellIndex(), notebookId);
            return executeCell(notebookId, cell, handler.orElse(null), context);
        } finally {
            store.updateNotebookStatus(notebookId, n -> {
                RunStateMachine.transition(n, previousStatus);
                n.setLastRunAt(previousLastRunAt);
                n.setCancelRequested(false);
            });
        }
    }

    /**
     * Ask the in-flight run to stop before its next cell.
     *
     * @throws StateException if the notebook is not running
     */
    public void requestCancel(String notebookId, String ownerId) {
        requireOwned(notebookId, ownerId);
        store.updateNotebookStatus(notebookId, n -> {
            if (n.getStatus() != NotebookStatus.RUNNING) {
                throw new StateException("Notebook " + notebookId + " is not running (status " + n.getStatus() + ")");
            }
            n.setCancelRequested(true);
        });
        log.info("Cancellation requested for notebook {}", notebookId);
    }

    /**
     * Why the run lock was refused: a rejection that landed after the pre-checks,
     * or another run in flight.
     */
    private RuntimeException lockRefused(String notebookId, Notebook fallback) {
        Notebook current = store.loadNotebook(notebookId).orElse(fallback);
        if (current.getRejectedAtCellId() != null) {
            return new StateException("Notebook " + notebookId + " was rejected at cell "
                    + current.getRejectedAtCellId() + "; reset it before running again");
        }
        return new ConflictException("Notebook " + notebookId + " already has a run in flight (status "
                + current.getStatus() + ")");
    }

    Notebook requireOwned(String notebookId, String ownerId) {
        return store.loadNotebook(notebookId)
                .filter(n -> n.getOwnerId().equals(ownerId))
                .orElseThrow(() -> NotFoundException.notebook(notebookId));
    }

    private RunResult executeCells(Notebook notebook, NotebookRun run, List<NotebookCell> cells,
                                   VariableContext context, RunOptions opts, long startedAt) {
        String notebookId = notebook.getId();
        int startFrom = opts.getStartFromCell();
        List<CellResult> results = new ArrayList<>();
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        String firstError = null;
        String errorCellId = null;
        RunOutcome outcome = null;

        for (NotebookCell cell : cells.subList(0, startFrom)) {
            results.add(CellResult.skipped(cell));
            skipped++;
        }

        for (int i = startFrom; i < cells.size(); i++) {
            NotebookCell cell = cells.get(i);

            if (isCancelRequested(notebookId)) {
                skipped += skipRemaining(notebookId, cells, i, results);
                outcome = RunOutcome.CANCELLED;
                log.info("Notebook {} cancelled before cell {}", notebookId, i);
                break;
            }

            CellHandler handler = handlerRegistry.getHandler(cell.getCellType()).orElse(null);
            if (handler != null && handler.suspendsRun()) {
                pause(notebookId, cell, context);
                long durationMs = System.currentTimeMillis() - startedAt;
                RunResult result = RunResult.builder()
                        .notebookId(notebookId)
                        .notebookTitle(notebook.getTitle())
                        .runId(run.getId())
                        .status(RunOutcome.PAUSED)
                        .cellsTotal(cells.size())
                        .cellsCompleted(completed)
                        .cellsFailed(failed)
                        .cellsSkipped(skipped)
                        .pausedAtCellId(cell.getId())
                        .results(results)
                        .variables(context.snapshot())
                        .durationMs(durationMs)
                        .build();
                runHistory.close(run.getId(), result, null);
                metrics.recordRun(RunOutcome.PAUSED, opts.getTriggerType(), durationMs);
                return result;
            }

            CellResult cellResult = executeCell(notebookId, cell, handler, context);
            results.add(cellResult);
            if (cellResult.getStatus() == CellStatus.COMPLETED) {
                completed++;
                continue;
            }

            failed++;
            if (firstError == null) {
                firstError = cellResult.getError();
                errorCellId = cell.getId();
            }
            if (opts.isStopOnError()) {
                skipped += skipRemaining(notebookId, cells, i + 1, results);
                outcome = RunOutcome.FAILED;
                break;
            }
        }

        if (outcome == null) {
            outcome = failed > 0 ? RunOutcome.PARTIAL : RunOutcome.COMPLETED;
        }

        long durationMs = System.currentTimeMillis() - startedAt;
        String error = switch (outcome) {
            case FAILED -> firstError;
            case PARTIAL -> String.format("%d of %d cells failed; first error: %s", failed, cells.size(), firstError);
            case CANCELLED -> "Cancelled by user";
            default -> null;
        };
        NotebookStatus finalStatus = switch (outcome) {
            case FAILED -> NotebookStatus.FAILED;
            case CANCELLED -> NotebookStatus.CANCELLED;
            default -> NotebookStatus.COMPLETED;
        };
        store.updateNotebookStatus(notebookId, n -> {
            RunStateMachine.transition(n, finalStatus);
            n.setErrorMessage(error);
            n.setLastRunDurationMs(durationMs);
            n.setCancelRequested(false);
            n.setResumeFromIndex(null);
            if (properties.getExecution().isPersistVariables()) {
                n.setRunVariables(context.snapshot());
            }
        });

        RunResult result = RunResult.builder()
                .notebookId(notebookId)
                .notebookTitle(notebook.getTitle())
                .runId(run.getId())
                .status(outcome)
                .cellsTotal(cells.size())
                .cellsCompleted(completed)
                .cellsFailed(failed)
                .cellsSkipped(skipped)
                .error(error)
                .results(results)
                .variables(context.snapshot())
                .durationMs(durationMs)
                .build();
        runHistory.close(run.getId(), result, errorCellId);
        metrics.recordRun(outcome, opts.getTriggerType(), durationMs);
        log.info("Notebook {} {}: {}/{} cells completed, {} failed, {} skipped in {}ms",
                notebookId, outcome, completed, cells.size(), failed, skipped, durationMs);
        return result;
    }

    /**
     * Run one cell through its handler and record the outcome on the cell.
     * Never throws for handler or invoker failures; those become an ERROR cell.
     */
    private CellResult executeCell(String notebookId, NotebookCell cell, CellHandler handler,
                                   VariableContext context) {
        int index = cell.getCellIndex();
        store.updateCellStatus(cell.getId(), c -> {
            if (c.getStatus() != CellStatus.QUEUED) {
                c.clearExecution();
            }
            RunStateMachine.transition(c, CellStatus.RUNNING);
            c.setStartedAt(Instant.now());
        });
        log.info("Executing cell {} [{}] of notebook {}: {}", cell.getId(), index, notebookId, cell.getCellType());
        broadcaster.broadcast(RunEventBroadcaster.CELL_STARTED, Map.of(
                "notebookId", notebookId,
                "cellId", cell.getId(),
                "cellIndex", index,
                "cellType", cell.getCellType()));

        long t0 = System.currentTimeMillis();
        CellOutcome outcome;
        if (handler == null) {
            outcome = CellOutcome.error("Unsupported cell type: " + cell.getCellType());
        } else {
            try {
                outcome = handler.handle(cell, context.snapshot());
            } catch (RuntimeException e) {
                log.warn("Handler for cell {} [{}] threw: {}", cell.getId(), index, e.getMessage());
                outcome = CellOutcome.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            if (outcome == null) {
                outcome = CellOutcome.error("Cell handler returned no outcome");
            }
        }
        long durationMs = System.currentTimeMillis() - t0;

        CellResult.CellResultBuilder result = CellResult.builder()
                .cellId(cell.getId())
                .cellIndex(index)
                .cellType(cell.getCellType())
                .executionTimeMs(durationMs);

        if (outcome.isSuccess()) {
            CellOutcome done = outcome;
            NotebookCell saved = store.updateCellStatus(cell.getId(), c -> {
                RunStateMachine.transition(c, CellStatus.COMPLETED);
                c.setOutput(done.getOutput());
                c.setOutputType(done.getOutput() == null ? null
                        : done.getOutputType() != null ? done.getOutputType() : "text");
                c.setReasoning(done.getReasoning());
                c.setToolsUsed(done.getToolsUsed());
                c.setErrorMessage(null);
                c.setDurationMs(durationMs);
                c.setCompletedAt(Instant.now());
            });
            context.recordOutput(index, done.getOutput());
            log.info("Cell {} [{}] completed in {}ms", cell.getId(), index, durationMs);
            review(saved, done.getOutput());
            result.status(CellStatus.COMPLETED).output(done.getOutput());
        } else {
            String error = outcome.getError() != null ? outcome.getError() : "Execution failed";
            store.updateCellStatus(cell.getId(), c -> {
                RunStateMachine.transition(c, CellStatus.ERROR);
                c.setErrorMessage(error);
                c.setDurationMs(durationMs);
                c.setCompletedAt(Instant.now());
            });
            log.info("Cell {} [{}] failed in {}ms: {}", cell.getId(), index, durationMs, error);
            result.status(CellStatus.ERROR).error(error);
        }

        CellResult cellResult = result.build();
        metrics.recordCell(cell.getCellType(), cellResult.getStatus(), durationMs);
        Map<String, Object> event = new HashMap<>();
        event.put("notebookId", notebookId);
        event.put("cellId", cell.getId());
        event.put("cellIndex", index);
        event.put("status", cellResult.getStatus().name());
        event.put("executionTimeMs", durationMs);
        if (cellResult.getError() != null) {
            event.put("error", cellResult.getError());
        }
        broadcaster.broadcast(RunEventBroadcaster.CELL_FINISHED, event);
        return cellResult;
    }

    private void review(NotebookCell cell, Object output) {
        CriticReviewer reviewer = criticReviewer.getIfAvailable();
        if (reviewer == null) {
            return;
        }
        try {
            CriticReview review = reviewer.review(cell, output);
            if (review == null) {
                return;
            }
            store.updateCellStatus(cell.getId(), c -> c.appendLog(review.toLogEntry()));
            if (review.getConfidence() < properties.getCritic().getLowConfidenceThreshold()) {
                log.warn("Critic has low confidence ({}) in cell {} [{}]: {}",
                        review.getConfidence(), cell.getId(), cell.getCellIndex(), review.getIssues());
            }
        } catch (RuntimeException e) {
            log.warn("Critic review of cell {} failed: {}", cell.getId(), e.getMessage());
        }
    }

    private void pause(String notebookId, NotebookCell cell, VariableContext context) {
        store.updateCellStatus(cell.getId(), c -> RunStateMachine.transition(c, CellStatus.PAUSED));
        store.updateNotebookStatus(notebookId, n -> {
            RunStateMachine.transition(n, NotebookStatus.PAUSED);
            n.setPausedAtCellId(cell.getId());
            n.setCancelRequested(false);
            if (properties.getExecution().isPersistVariables()) {
                n.setRunVariables(context.snapshot());
            }
        });
        log.info("Notebook {} paused for approval at cell {} [{}]", notebookId, cell.getId(), cell.getCellIndex());
        broadcaster.broadcast(RunEventBroadcaster.RUN_PAUSED, Map.of(
                "notebookId", notebookId,
                "cellId", cell.getId(),
                "cellIndex", cell.getCellIndex()));
    }

    /**
     * Seed the context for a run. A resume restores the completed outputs below the
     * start index and the persisted variables; caller inputs always win.
     */
    private VariableContext seedContext(Notebook notebook, List<NotebookCell> cells, int startFrom,
                                        Map<String, Object> inputs) {
        VariableContext context = new VariableContext();
        if (startFrom > 0) {
            for (NotebookCell cell : cells.subList(0, startFrom)) {
                if (cell.getStatus() == CellStatus.COMPLETED) {
                    context.recordOutput(cell.getCellIndex(), cell.getOutput());
                }
            }
            context.seed(notebook.getRunVariables());
        }
        context.seed(inputs);
        return context;
    }

    private void queueCells(String notebookId, int startFrom) {
        store.updateCells(notebookId, c -> true, c -> {
            if (c.getCellIndex() >= startFrom) {
                c.clearExecution();
                RunStateMachine.transition(c, CellStatus.QUEUED);
            } else if (c.getStatus() != CellStatus.COMPLETED) {
                RunStateMachine.transition(c, CellStatus.SKIPPED);
            }
        });
    }

    private int skipRemaining(String notebookId, List<NotebookCell> cells, int from, List<CellResult> results) {
        if (from >= cells.size()) {
            return 0;
        }
        int fromIndex = cells.get(from).getCellIndex();
        store.updateCells(notebookId,
                c -> c.getCellIndex() >= fromIndex,
                c -> RunStateMachine.transition(c, CellStatus.SKIPPED));
        for (NotebookCell cell : cells.subList(from, cells.size())) {
            results.add(CellResult.skipped(cell));
        }
        return cells.size() - from;
    }

    private boolean isCancelRequested(String notebookId) {
        return store.loadNotebook(notebookId).map(Notebook::isCancelRequested).orElse(false);
    }

    /**
     * Leave the notebook startable after the loop died unexpectedly: notebook FAILED,
     * every non-terminal cell SKIPPED, run record closed.
     */
    private void abort(String notebookId, String runId, RuntimeException cause) {
        String message = "Run aborted: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        log.error("Notebook {} run aborted", notebookId, cause);
        try {
            store.updateCells(notebookId,
                    c -> c.getStatus() == CellStatus.QUEUED || c.getStatus() == CellStatus.RUNNING,
                    c -> RunStateMachine.transition(c, CellStatus.SKIPPED));
            store.updateNotebookStatus(notebookId, n -> {
                if (n.getStatus() == NotebookStatus.RUNNING) {
                    RunStateMachine.transition(n, NotebookStatus.FAILED);
                    n.setErrorMessage(message);
                    n.setCancelRequested(false);
                }
            });
            if (runId != null) {
                runHistory.abort(runId, message);
            }
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }
}
