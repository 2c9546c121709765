package com.example.notebookengine.service;

import com.example.notebookengine.config.EngineProperties;
import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.domain.NotebookRun;
import com.example.notebookengine.dto.ApprovalActionRequest;
import com.example.notebookengine.dto.ApprovalResponse;
import com.example.notebookengine.dto.NotebookProgress;
import com.example.notebookengine.dto.RunRequest;
import com.example.notebookengine.engine.ApprovalDecision;
import com.example.notebookengine.engine.ApprovalGate;
import com.example.notebookengine.engine.CellResult;
import com.example.notebookengine.engine.ExecutionEngine;
import com.example.notebookengine.engine.RunHistory;
import com.example.notebookengine.engine.RunOptions;
import com.example.notebookengine.engine.RunResult;
import com.example.notebookengine.exception.ConflictException;
import com.example.notebookengine.exception.NotFoundException;
import com.example.notebookengine.store.CellStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Run API surface: run, run cell, approve/reject, reset, cancel, progress and history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotebookRunService {

    private final ExecutionEngine engine;
    private final ApprovalGate approvalGate;
    private final NotebookJobRunner jobRunner;
    private final RunHistory runHistory;
    private final CellStore store;
    private final EngineProperties properties;

    public RunResult run(String notebookId, String ownerId, RunRequest request) {
        return engine.run(notebookId, ownerId, toOptions(request, "api"));
    }

    /**
     * Hand the run to the background job host. Ownership is checked before queueing;
     * everything else surfaces on the job.
     */
    public RunJob submit(String notebookId, String ownerId, RunRequest request) {
        requireOwned(notebookId, ownerId);
        RunJob job = jobRunner.createJob(notebookId, ownerId, toOptions(request, "job"));
        jobRunner.execute(job);
        log.info("Queued job {} for notebook {}", job.getId(), notebookId);
        return job;
    }

    public RunJob getJob(String notebookId, String ownerId, String jobId) {
        requireOwned(notebookId, ownerId);
        return jobRunner.getJob(jobId)
                .filter(job -> job.getNotebookId().equals(notebookId))
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }

    public CellResult runCell(String notebookId, String ownerId, String cellId) {
        return engine.runCell(notebookId, ownerId, cellId);
    }

    /**
     * Approve or reject the paused cell. With {@code autoResume} an approval continues
     * the run from the next cell in the same call.
     */
    public ApprovalResponse decide(String notebookId, String ownerId, ApprovalActionRequest request) {
        if (request.getCellId() == null || request.getCellId().isBlank()) {
            throw new IllegalArgumentException("cellId is required");
        }
        String action = request.getAction() != null ? request.getAction().toLowerCase() : "approve";
        ApprovalDecision decision = switch (action) {
            case "approve", "approved" ->
                    approvalGate.approve(notebookId, ownerId, request.getCellId(), request.getFeedback());
            case "reject", "rejected" ->
                    approvalGate.reject(notebookId, ownerId, request.getCellId(), request.getFeedback());
            default -> throw new IllegalArgumentException("Unknown approval action: " + request.getAction());
        };

        RunResult resumed = null;
        if (request.isAutoResume() && decision.getContinueFrom() != null) {
            RunOptions options = RunOptions.builder()
                    .startFromCell(decision.getContinueFrom())
                    .stopOnError(properties.getExecution().isDefaultStopOnError())
                    .triggerType("api")
                    .build();
            resumed = engine.run(notebookId, ownerId, options);
        }
        return ApprovalResponse.builder().decision(decision).resumedRun(resumed).build();
    }

    public void cancel(String notebookId, String ownerId) {
        engine.requestCancel(notebookId, ownerId);
    }

    /**
     * Return the notebook and every cell to a fresh state. Refused while a run is executing;
     * a paused, failed or rejected notebook may always be reset.
     */
    public NotebookProgress reset(String notebookId, String ownerId) {
        requireOwned(notebookId, ownerId);
        store.updateNotebookStatus(notebookId, n -> {
            if (n.getStatus() == Notebook.NotebookStatus.RUNNING) {
                throw new ConflictException("Notebook " + notebookId + " is running; cancel it before resetting");
            }
            store.updateCells(notebookId, c -> true, c -> {
                c.clearExecution();
                c.setStatus(NotebookCell.CellStatus.IDLE);
            });
            n.clearRunState();
        });
        runHistory.closePaused(notebookId, NotebookRun.RunStatus.CANCELLED, "Reset");
        log.info("Notebook {} reset", notebookId);
        return progress(notebookId, ownerId);
    }

    public NotebookProgress progress(String notebookId, String ownerId) {
        Notebook notebook = requireOwned(notebookId, ownerId);
        List<NotebookCell> cells = store.loadCells(notebookId);

        Map<NotebookCell.CellStatus, Long> counts = new EnumMap<>(NotebookCell.CellStatus.class);
        counts.putAll(cells.stream().collect(Collectors.groupingBy(NotebookCell::getStatus, HashMap::new,
                Collectors.counting())));

        return NotebookProgress.builder()
                .notebookId(notebookId)
                .status(notebook.getStatus())
                .pausedAtCellId(notebook.getPausedAtCellId())
                .resumeFromIndex(notebook.getResumeFromIndex())
                .rejectedAtCellId(notebook.getRejectedAtCellId())
                .cancelRequested(notebook.isCancelRequested())
                .errorMessage(notebook.getErrorMessage())
                .lastRunAt(notebook.getLastRunAt())
                .counts(counts)
                .cells(cells.stream()
                        .map(c -> NotebookProgress.CellProgress.builder()
                                .cellId(c.getId())
                                .cellIndex(c.getCellIndex())
                                .cellType(c.getCellType())
                                .status(c.getStatus())
                                .durationMs(c.getDurationMs())
                                .errorMessage(c.getErrorMessage())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    public List<NotebookRun> runs(String notebookId, String ownerId) {
        requireOwned(notebookId, ownerId);
        return runHistory.list(notebookId);
    }

    private RunOptions toOptions(RunRequest request, String triggerType) {
        RunRequest req = request != null ? request : new RunRequest();
        return RunOptions.builder()
                .variables(req.getVariables() != null ? req.getVariables() : Map.of())
                .startFromCell(req.getStartFromCell())
                .stopOnError(req.getStopOnError() != null
                        ? req.getStopOnError() : properties.getExecution().isDefaultStopOnError())
                .triggerType(triggerType)
                .build();
    }

    private Notebook requireOwned(String notebookId, String ownerId) {
        return store.loadNotebook(notebookId)
                .filter(n -> n.getOwnerId().equals(ownerId))
                .orElseThrow(() -> NotFoundException.notebook(notebookId));
    }
}
