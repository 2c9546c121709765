package com.example.notebookengine.store;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.engine.RunStateMachine;
import com.example.notebookengine.exception.NotFoundException;
import com.example.notebookengine.repository.NotebookCellRepository;
import com.example.notebookengine.repository.NotebookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Cell Store backed by the JPA repositories. Each method runs in its own
 * transaction so that every write commits before the engine moves on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.REQUIRES_NEW)
public class JpaCellStore implements CellStore {

    private final NotebookRepository notebookRepository;
    private final NotebookCellRepository cellRepository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<Notebook> loadNotebook(String notebookId) {
        return notebookRepository.findById(notebookId);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<NotebookCell> loadCells(String notebookId) {
        return cellRepository.findByNotebookIdOrderByCellIndexAsc(notebookId);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<NotebookCell> loadCell(String cellId) {
        return cellRepository.findById(cellId);
    }

    @Override
    public NotebookCell updateCellStatus(String cellId, Consumer<NotebookCell> fields) {
        NotebookCell cell = cellRepository.findById(cellId)
                .orElseThrow(() -> NotFoundException.cell(cellId));
        fields.accept(cell);
        NotebookCell saved = cellRepository.save(cell);
        log.debug("Cell {} [{}] -> {}", cellId, saved.getCellIndex(), saved.getStatus());
        return saved;
    }

    @Override
    public int updateCells(String notebookId, Predicate<NotebookCell> filter, Consumer<NotebookCell> fields) {
        int changed = 0;
        for (NotebookCell cell : cellRepository.findByNotebookIdOrderByCellIndexAsc(notebookId)) {
            if (filter.test(cell)) {
                fields.accept(cell);
                cellRepository.save(cell);
                changed++;
            }
        }
        log.debug("Updated {} cells of notebook {}", changed, notebookId);
        return changed;
    }

    @Override
    public Notebook updateNotebookStatus(String notebookId, Consumer<Notebook> fields) {
        Notebook notebook = notebookRepository.findByIdForUpdate(notebookId)
                .orElseThrow(() -> NotFoundException.notebook(notebookId));
        fields.accept(notebook);
        Notebook saved = notebookRepository.save(notebook);
        log.debug("Notebook {} -> {}", notebookId, saved.getStatus());
        return saved;
    }

    @Override
    public boolean tryAcquireRun(String notebookId) {
        int updated = notebookRepository.acquireRun(notebookId,
                Notebook.NotebookStatus.RUNNING,
                RunStateMachine.STARTABLE_STATUSES,
                Notebook.NotebookStatus.PAUSED,
                Instant.now());
        return updated == 1;
    }
}
