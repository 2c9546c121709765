package com.example.notebookengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Notebook Execution Engine.
 *
 * Runs the ordered cells of a notebook one at a time, threading a variable
 * context between them, suspending at approval cells until a human decides,
 * and applying a stop-or-continue failure policy.
 *
 * Architecture:
 * - Execution Engine → sequential loop over cells, failure policy, cancellation
 * - Approval Gate → approve/reject decisions on a paused cell
 * - Cell Store → durable notebook and cell records (JPA)
 * - Cell handlers → per-type behaviour resolved from a registry
 * - Job host → background runs with bounded retries and a maximum duration
 * - Gateway → WebSocket push of live run progress
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class NotebookEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotebookEngineApplication.class, args);
    }
}
