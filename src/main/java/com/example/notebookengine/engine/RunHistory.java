package com.example.notebookengine.engine;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.NotebookRun;
import com.example.notebookengine.repository.NotebookRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Writes the NotebookRun history records. One record per run invocation; a
 * resume after an approval opens a new one. Control flow never reads them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.REQUIRES_NEW)
public class RunHistory {

    private final NotebookRunRepository runRepository;

    public NotebookRun open(Notebook notebook, RunOptions options, int cellsTotal) {
        NotebookRun run = NotebookRun.builder()
                .notebookId(notebook.getId())
                .runNumber(runRepository.findMaxRunNumber(notebook.getId()) + 1)
                .triggerType(options.getTriggerType())
                .startFromCell(options.getStartFromCell())
                .stopOnError(options.isStopOnError())
                .cellsTotal(cellsTotal)
                .startedAt(Instant.now())
                .build();
        NotebookRun saved = runRepository.save(run);
        log.debug("Opened run #{} ({}) for notebook {}", saved.getRunNumber(), saved.getId(), notebook.getId());
        return saved;
    }

    /** Record the final counts and status of a run invocation. */
    public void close(String runId, RunResult result, String errorCellId) {
        runRepository.findById(runId).ifPresent(run -> {
            run.setStatus(NotebookRun.RunStatus.valueOf(result.getStatus().name()));
            run.setCellsTotal(result.getCellsTotal());
            run.setCellsCompleted(result.getCellsCompleted());
            run.setCellsFailed(result.getCellsFailed());
            run.setCellsSkipped(result.getCellsSkipped());
            run.setErrorCellId(errorCellId);
            run.setErrorMessage(result.getError());
            finish(run);
            runRepository.save(run);
        });
    }

    /** Close a run record that died without producing a result. */
    public void abort(String runId, String errorMessage) {
        runRepository.findById(runId).ifPresent(run -> {
            run.setStatus(NotebookRun.RunStatus.FAILED);
            run.setErrorMessage(errorMessage);
            finish(run);
            runRepository.save(run);
        });
    }

    /**
     * Close the latest record still marked PAUSED, once its approval gate is decided
     * or the notebook is reset.
     */
    public void closePaused(String notebookId, NotebookRun.RunStatus status, String errorMessage) {
        runRepository.findFirstByNotebookIdAndStatusOrderByRunNumberDesc(notebookId, NotebookRun.RunStatus.PAUSED)
                .ifPresent(run -> {
                    run.setStatus(status);
                    if (errorMessage != null) {
                        run.setErrorMessage(errorMessage);
                    }
                    run.setCompletedAt(Instant.now());
                    runRepository.save(run);
                    log.debug("Closed paused run #{} of notebook {} as {}", run.getRunNumber(), notebookId, status);
                });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<NotebookRun> list(String notebookId) {
        return runRepository.findByNotebookIdOrderByRunNumberDesc(notebookId);
    }

    private void finish(NotebookRun run) {
        Instant now = Instant.now();
        run.setCompletedAt(now);
        run.setDurationMs(Duration.between(run.getStartedAt(), now).toMillis());
    }
}
