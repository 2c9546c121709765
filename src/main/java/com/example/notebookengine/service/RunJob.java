package com.example.notebookengine.service;

import com.example.notebookengine.engine.RunOptions;
import com.example.notebookengine.engine.RunResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * A notebook run executing in the background job host. State is written by the
 * executing thread and read by pollers.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunJob {

    public enum JobStatus {
        PENDING, RUNNING, RETRYING, SUCCEEDED, FAILED, TIMED_OUT
    }

    private final String id = UUID.randomUUID().toString();
    private final String notebookId;
    @JsonIgnore
    private final String ownerId;
    private final RunOptions options;
    private final Instant createdAt = Instant.now();

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile int attempts;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile RunResult result;
    private volatile String error;
    private volatile boolean timedOut;

    public RunJob(String notebookId, String ownerId, RunOptions options) {
        this.notebookId = notebookId;
        this.ownerId = ownerId;
        this.options = options;
    }

    void startAttempt(int attempt) {
        this.attempts = attempt;
        this.status = JobStatus.RUNNING;
        if (startedAt == null) {
            startedAt = Instant.now();
        }
    }

    void retrying(String error) {
        this.error = error;
        this.status = JobStatus.RETRYING;
    }

    void succeed(RunResult result) {
        this.result = result;
        this.error = result.getError();
        this.status = timedOut ? JobStatus.TIMED_OUT : JobStatus.SUCCEEDED;
        this.finishedAt = Instant.now();
    }

    void fail(String error) {
        this.error = error;
        this.status = timedOut ? JobStatus.TIMED_OUT : JobStatus.FAILED;
        this.finishedAt = Instant.now();
    }

    void markTimedOut() {
        this.timedOut = true;
    }

    @JsonIgnore
    public boolean isFinished() {
        return finishedAt != null;
    }
}
