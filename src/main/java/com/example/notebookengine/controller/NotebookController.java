package com.example.notebookengine.controller;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.dto.CellDraft;
import com.example.notebookengine.dto.CreateNotebookRequest;
import com.example.notebookengine.dto.NotebookDetails;
import com.example.notebookengine.dto.ReorderRequest;
import com.example.notebookengine.engine.handler.CellHandlerRegistry;
import com.example.notebookengine.service.NotebookService;
import com.example.notebookengine.template.NotebookTemplate;
import com.example.notebookengine.template.NotebookTemplateService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Notebook and cell management REST API.
 */
@RestController
@RequestMapping("/api/notebooks")
@RequiredArgsConstructor
public class NotebookController {

    static final String USER_HEADER = "X-User-Id";
    static final String DEFAULT_USER = "local";

    private final NotebookService notebookService;
    private final NotebookTemplateService templateService;
    private final CellHandlerRegistry handlerRegistry;

    @GetMapping
    public ResponseEntity<List<Notebook>> listNotebooks(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId) {
        return ResponseEntity.ok(notebookService.listNotebooks(userId));
    }

    @PostMapping
    public ResponseEntity<NotebookDetails> createNotebook(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @RequestBody CreateNotebookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(notebookService.createNotebook(userId, request));
    }

    /**
     * Cell types the engine can execute.
     */
    @GetMapping("/cell-types")
    public ResponseEntity<Map<String, String>> cellTypes() {
        return ResponseEntity.ok(handlerRegistry.listCellTypes());
    }

    @GetMapping("/templates")
    public ResponseEntity<List<NotebookTemplate>> listTemplates(@RequestParam(required = false) String category) {
        return ResponseEntity.ok(templateService.listTemplates(category));
    }

    @PostMapping("/templates/reload")
    public ResponseEntity<Map<String, Integer>> reloadTemplates() {
        return ResponseEntity.ok(Map.of("loaded", templateService.loadTemplates()));
    }

    @PostMapping("/templates/{templateId}/instantiate")
    public ResponseEntity<NotebookDetails> instantiateTemplate(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String templateId,
            @RequestBody(required = false) Map<String, String> body) {
        String title = body != null ? body.get("title") : null;
        return ResponseEntity.status(HttpStatus.CREATED).body(templateService.instantiate(templateId, userId, title));
    }

    @GetMapping("/{id}")
    public ResponseEntity<NotebookDetails> getNotebook(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id) {
        return ResponseEntity.ok(notebookService.getNotebook(id, userId));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Notebook> updateNotebook(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id,
            @RequestBody Map<String, String> body) {
        return ResponseEntity.ok(notebookService.updateNotebook(id, userId, body.get("title"), body.get("description")));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteNotebook(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id) {
        notebookService.deleteNotebook(id, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/cells")
    public ResponseEntity<NotebookCell> addCell(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id,
            @RequestBody CellDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED).body(notebookService.addCell(id, userId, draft));
    }

    @PutMapping("/{id}/cells/{cellId}")
    public ResponseEntity<NotebookCell> updateCell(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id,
            @PathVariable String cellId,
            @RequestBody CellDraft draft) {
        return ResponseEntity.ok(notebookService.updateCell(id, userId, cellId, draft));
    }

    @DeleteMapping("/{id}/cells/{cellId}")
    public ResponseEntity<Void> deleteCell(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id,
            @PathVariable String cellId) {
        notebookService.deleteCell(id, userId, cellId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/cells/order")
    public ResponseEntity<List<NotebookCell>> reorderCells(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String id,
            @RequestBody ReorderRequest request) {
        return ResponseEntity.ok(notebookService.reorderCells(id, userId, request.getCellIds()));
    }
}
