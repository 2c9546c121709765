package com.example.notebookengine.service;

import com.example.notebookengine.config.EngineProperties;
import com.example.notebookengine.engine.ExecutionEngine;
import com.example.notebookengine.engine.RunOptions;
import com.example.notebookengine.engine.RunResult;
import com.example.notebookengine.exception.NotebookEngineException;
import com.example.notebookengine.exception.StateException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Background job host for whole-notebook runs.
 *
 * - Runs on the "notebookExecutor" pool
 * - Retries attempts that die on an unexpected exception, with bounded exponential backoff
 * - Domain errors (conflict, not found, invalid state) are never retried
 * - A watchdog requests cancellation once a job exceeds the maximum duration
 * - Jobs stay pollable for the configured retention, then expire
 */
@Slf4j
@Service
public class NotebookJobRunner {

    private final ExecutionEngine engine;
    private final EngineProperties properties;

    private final Cache<String, RunJob> jobs;

    public NotebookJobRunner(ExecutionEngine engine, EngineProperties properties) {
        this.engine = engine;
        this.properties = properties;
        this.jobs = Caffeine.newBuilder()
                .maximumSize(properties.getJobs().getMaxRetainedJobs())
                .expireAfterWrite(properties.getJobs().getRetentionMinutes(), TimeUnit.MINUTES)
                .build();
    }

    public RunJob createJob(String notebookId, String ownerId, RunOptions options) {
        RunJob job = new RunJob(notebookId, ownerId, options.toBuilder().triggerType("job").build());
        jobs.put(job.getId(), job);
        return job;
    }

    public Optional<RunJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.getIfPresent(jobId));
    }

    @Async("notebookExecutor")
    public void execute(RunJob job) {
        EngineProperties.JobConfig config = properties.getJobs();
        int maxAttempts = Math.max(1, config.getMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            job.startAttempt(attempt);
            log.info("Job {} attempt {}/{} for notebook {}", job.getId(), attempt, maxAttempts, job.getNotebookId());
            try {
                RunResult result = engine.run(job.getNotebookId(), job.getOwnerId(), job.getOptions());
                job.succeed(result);
                log.info("Job {} finished: {}", job.getId(), result.getStatus());
                return;
            } catch (NotebookEngineException e) {
                log.warn("Job {} failed with {}: {}", job.getId(), e.getCode(), e.getMessage());
                job.fail(e.getMessage());
                return;
            } catch (RuntimeException e) {
                log.error("Job {} attempt {} failed", job.getId(), attempt, e);
                if (attempt == maxAttempts) {
                    job.fail(e.getMessage());
                    return;
                }
                job.retrying(e.getMessage());
                long backoff = backoffMs(attempt);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    job.fail("Interrupted while waiting to retry");
                    return;
                }
            }
        }
    }

    /**
     * Delay before retry number {@code attempt}: doubles from the minimum, capped at the maximum.
     */
    long backoffMs(int attempt) {
        EngineProperties.JobConfig config = properties.getJobs();
        long delay = config.getMinBackoffMs() * (1L << Math.min(attempt - 1, 20));
        return Math.min(delay, config.getMaxBackoffMs());
    }

    @Scheduled(fixedDelayString = "${notebook-engine.jobs.watchdog-interval-ms:5000}")
    public void enforceMaxDuration() {
        Duration maxDuration = Duration.ofSeconds(properties.getJobs().getMaxDurationSeconds());
        Instant now = Instant.now();
        for (RunJob job : jobs.asMap().values()) {
            if (job.isFinished() || job.isTimedOut() || job.getStartedAt() == null) {
                continue;
            }
            if (Duration.between(job.getStartedAt(), now).compareTo(maxDuration) > 0) {
                job.markTimedOut();
                log.warn("Job {} exceeded {}s, cancelling notebook {}", job.getId(),
                        maxDuration.getSeconds(), job.getNotebookId());
                try {
                    engine.requestCancel(job.getNotebookId(), job.getOwnerId());
                } catch (StateException e) {
                    log.debug("Notebook {} not running, nothing to cancel: {}", job.getNotebookId(), e.getMessage());
                }
            }
        }
    }
}
