package com.example.notebookengine.service;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.dto.CellDraft;
import com.example.notebookengine.dto.CreateNotebookRequest;
import com.example.notebookengine.dto.NotebookDetails;
import com.example.notebookengine.exception.ConflictException;
import com.example.notebookengine.exception.NotFoundException;
import com.example.notebookengine.repository.NotebookCellRepository;
import com.example.notebookengine.repository.NotebookRepository;
import com.example.notebookengine.repository.NotebookRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Notebook Service - notebook and cell management.
 *
 * Cell indices stay dense and zero-based through every insert, delete and reorder.
 * Structural edits lock the notebook row and are refused while a run is in flight.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class NotebookService {

    private static final String DEFAULT_CELL_TYPE = "command";

    private final NotebookRepository notebookRepository;
    private final NotebookCellRepository cellRepository;
    private final NotebookRunRepository runRepository;

    @Transactional(readOnly = true)
    public List<Notebook> listNotebooks(String ownerId) {
        return notebookRepository.findByOwnerIdOrderByUpdatedAtDesc(ownerId);
    }

    public NotebookDetails createNotebook(String ownerId, CreateNotebookRequest request) {
        Notebook notebook = Notebook.builder()
                .ownerId(ownerId)
                .title(request.getTitle() != null && !request.getTitle().isBlank()
                        ? request.getTitle() : "Untitled Notebook")
                .description(request.getDescription())
                .build();
        notebook = notebookRepository.save(notebook);

        List<CellDraft> drafts = request.getCells() != null ? request.getCells() : List.of();
        for (int i = 0; i < drafts.size(); i++) {
            CellDraft draft = drafts.get(i);
            cellRepository.save(NotebookCell.builder()
                    .notebookId(notebook.getId())
                    .cellIndex(i)
                    .cellType(draft.getCellType() != null ? draft.getCellType() : DEFAULT_CELL_TYPE)
                    .title(draft.getTitle())
                    .content(draft.getContent() != null ? draft.getContent() : "")
                    .build());
        }
        log.info("Created notebook {} '{}' with {} cells for {}", notebook.getId(), notebook.getTitle(),
                drafts.size(), ownerId);
        return new NotebookDetails(notebook, cellRepository.findByNotebookIdOrderByCellIndexAsc(notebook.getId()));
    }

    @Transactional(readOnly = true)
    public NotebookDetails getNotebook(String notebookId, String ownerId) {
        Notebook notebook = requireOwned(notebookId, ownerId);
        return new NotebookDetails(notebook, cellRepository.findByNotebookIdOrderByCellIndexAsc(notebookId));
    }

    public Notebook updateNotebook(String notebookId, String ownerId, String title, String description) {
        Notebook notebook = requireOwned(notebookId, ownerId);
        if (title != null) {
            if (title.isBlank()) {
                throw new IllegalArgumentException("Title must not be blank");
            }
            notebook.setTitle(title);
        }
        if (description != null) {
            notebook.setDescription(description);
        }
        return notebookRepository.save(notebook);
    }

    public void deleteNotebook(String notebookId, String ownerId) {
        Notebook notebook = lockForEdit(notebookId, ownerId);
        cellRepository.deleteByNotebookId(notebookId);
        runRepository.deleteByNotebookId(notebookId);
        notebookRepository.delete(notebook);
        log.info("Deleted notebook {}", notebookId);
    }

    /**
     * Add a cell at {@code insertAt} (appended when null), shifting later cells up by one.
     */
    public NotebookCell addCell(String notebookId, String ownerId, CellDraft draft) {
        lockForEdit(notebookId, ownerId);
        List<NotebookCell> cells = cellRepository.findByNotebookIdOrderByCellIndexAsc(notebookId);
        int position = draft.getInsertAt() != null ? draft.getInsertAt() : cells.size();
        if (position < 0 || position > cells.size()) {
            throw new IllegalArgumentException("insertAt " + position + " is out of range 0.." + cells.size());
        }

        for (NotebookCell cell : cells) {
            if (cell.getCellIndex() >= position) {
                cell.setCellIndex(cell.getCellIndex() + 1);
            }
        }
        cellRepository.saveAll(cells);

        NotebookCell cell = NotebookCell.builder()
                .notebookId(notebookId)
                .cellIndex(position)
                .cellType(draft.getCellType() != null ? draft.getCellType() : DEFAULT_CELL_TYPE)
                .title(draft.getTitle())
                .content(draft.getContent() != null ? draft.getContent() : "")
                .dependencies(validDependencies(draft.getDependencies(), cells, null))
                .build();
        NotebookCell saved = cellRepository.save(cell);
        log.info("Added {} cell {} at index {} of notebook {}", saved.getCellType(), saved.getId(), position, notebookId);
        return saved;
    }

    public NotebookCell updateCell(String notebookId, String ownerId, String cellId, CellDraft draft) {
        lockForEdit(notebookId, ownerId);
        NotebookCell cell = cellRepository.findByIdAndNotebookId(cellId, notebookId)
                .orElseThrow(() -> NotFoundException.cell(cellId));
        if (draft.getCellType() != null) {
            cell.setCellType(draft.getCellType());
        }
        if (draft.getTitle() != null) {
            cell.setTitle(draft.getTitle());
        }
        if (draft.getContent() != null) {
            cell.setContent(draft.getContent());
        }
        if (draft.getDependencies() != null) {
            List<NotebookCell> cells = cellRepository.findByNotebookIdOrderByCellIndexAsc(notebookId);
            cell.setDependencies(validDependencies(draft.getDependencies(), cells, cellId));
        }
        return cellRepository.save(cell);
    }

    /**
     * Delete a cell, re-pack the indices of the remaining cells and purge the
     * deleted id from every dependency set.
     */
    public void deleteCell(String notebookId, String ownerId, String cellId) {
        lockForEdit(notebookId, ownerId);
        NotebookCell target = cellRepository.findByIdAndNotebookId(cellId, notebookId)
                .orElseThrow(() -> NotFoundException.cell(cellId));
        cellRepository.delete(target);

        List<NotebookCell> remaining = cellRepository.findByNotebookIdOrderByCellIndexAsc(notebookId).stream()
                .filter(c -> !c.getId().equals(cellId))
                .collect(Collectors.toList());
        for (int i = 0; i < remaining.size(); i++) {
            NotebookCell cell = remaining.get(i);
            cell.setCellIndex(i);
            cell.getDependencies().remove(cellId);
        }
        cellRepository.saveAll(remaining);
        log.info("Deleted cell {} from notebook {} ({} cells left)", cellId, notebookId, remaining.size());
    }

    /**
     * Rewrite the cell order. {@code cellIds} must name every cell of the notebook exactly once.
     */
    public List<NotebookCell> reorderCells(String notebookId, String ownerId, List<String> cellIds) {
        lockForEdit(notebookId, ownerId);
        List<NotebookCell> cells = cellRepository.findByNotebookIdOrderByCellIndexAsc(notebookId);
        if (cellIds == null || cellIds.size() != cells.size() || new HashSet<>(cellIds).size() != cellIds.size()) {
            throw new IllegalArgumentException("Reorder must list every cell of the notebook exactly once");
        }
        Map<String, NotebookCell> byId = cells.stream()
                .collect(Collectors.toMap(NotebookCell::getId, Function.identity()));
        for (int i = 0; i < cellIds.size(); i++) {
            NotebookCell cell = byId.get(cellIds.get(i));
            if (cell == null) {
                throw new IllegalArgumentException("Unknown cell id: " + cellIds.get(i));
            }
            cell.setCellIndex(i);
        }
        cellRepository.saveAll(cells);
        return cellRepository.findByNotebookIdOrderByCellIndexAsc(notebookId);
    }

    private Notebook requireOwned(String notebookId, String ownerId) {
        return notebookRepository.findById(notebookId)
                .filter(n -> n.getOwnerId().equals(ownerId))
                .orElseThrow(() -> NotFoundException.notebook(notebookId));
    }

    private Notebook lockForEdit(String notebookId, String ownerId) {
        Notebook notebook = notebookRepository.findByIdForUpdate(notebookId)
                .filter(n -> n.getOwnerId().equals(ownerId))
                .orElseThrow(() -> NotFoundException.notebook(notebookId));
        if (notebook.isRunInFlight()) {
            throw new ConflictException("Notebook " + notebookId + " cannot be edited while a run is in flight (status "
                    + notebook.getStatus() + ")");
        }
        return notebook;
    }

    private Set<String> validDependencies(Set<String> requested, List<NotebookCell> cells, String selfId) {
        Set<String> dependencies = new LinkedHashSet<>();
        if (requested == null) {
            return dependencies;
        }
        Set<String> known = cells.stream().map(NotebookCell::getId).collect(Collectors.toSet());
        for (String id : requested) {
            if (id.equals(selfId) || !known.contains(id)) {
                throw new IllegalArgumentException("Invalid dependency: " + id);
            }
            dependencies.add(id);
        }
        return dependencies;
    }
}
