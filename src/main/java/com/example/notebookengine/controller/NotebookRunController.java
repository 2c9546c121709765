package com.example.notebookengine.controller;

import com.example.notebookengine.domain.NotebookRun;
import com.example.notebookengine.dto.ApprovalActionRequest;
import com.example.notebookengine.dto.ApprovalResponse;
import com.example.notebookengine.dto.NotebookProgress;
import com.example.notebookengine.dto.RunRequest;
import com.example.notebookengine.engine.CellResult;
import com.example.notebookengine.service.NotebookRunService;
import com.example.notebookengine.service.RunJob;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

import static com.example.notebookengine.controller.NotebookController.DEFAULT_USER;
import static com.example.notebookengine.controller.NotebookController.USER_HEADER;

/**
 * Run API: execute, approve or reject, reset, cancel and observe notebook runs.
 */
@RestController
@RequestMapping("/api/notebooks/{id}")
@RequiredArgsConstructor
public class NotebookRunController {

    private final NotebookRunService runService;

    /**
     * Run the notebook. With {@code async} the run is queued on the job host and
     * the job is returned with 202.
     */
    @PostMapping("/run")
    public ResponseEntity<?> run(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id,
            @RequestBody(required = false) RunRequest request) {
        RunRequest req = request != null ? request : new RunRequest();
        if (req.isAsync()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(runService.submit(id, userId, req));
        }
        return ResponseEntity.ok(runService.run(id, userId, req));
    }

    @PostMapping("/cells/{cellId}/run")
    public ResponseEntity<CellResult> runCell(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id,
            @PathVariable String cellId) {
        return ResponseEntity.ok(runService.runCell(id, userId, cellId));
    }

    @PostMapping("/approve")
    public ResponseEntity<ApprovalResponse> approve(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id,
            @RequestBody ApprovalActionRequest request) {
        return ResponseEntity.ok(runService.decide(id, userId, request));
    }

    @PostMapping("/reset")
    public ResponseEntity<NotebookProgress> reset(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id) {
        return ResponseEntity.ok(runService.reset(id, userId));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id) {
        runService.cancel(id, userId);
        return ResponseEntity.accepted().body(Map.of("notebookId", id, "cancelRequested", true));
    }

    @GetMapping("/progress")
    public ResponseEntity<NotebookProgress> progress(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id) {
        return ResponseEntity.ok(runService.progress(id, userId));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<NotebookRun>> runs(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id) {
        return ResponseEntity.ok(runService.runs(id, userId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<RunJob> job(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id,
            @PathVariable String jobId) {
        return ResponseEntity.ok(runService.getJob(id, userId, jobId));
    }
}
