package com.example.notebookengine.store;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.NotebookCell;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Durable read/write access to notebook and cell records used by the engine.
 *
 * Every call applies atomically and is visible to the next read, so observers
 * polling the store mid-run see live progress and the engine can rely on its own writes.
 */
public interface CellStore {

    Optional<Notebook> loadNotebook(String notebookId);

    /** Cells of the notebook in ascending index order. */
    List<NotebookCell> loadCells(String notebookId);

    Optional<NotebookCell> loadCell(String cellId);

    /**
     * Apply field changes to one cell.
     *
     * @throws com.example.notebookengine.exception.NotFoundException if the cell does not exist
     */
    NotebookCell updateCellStatus(String cellId, Consumer<NotebookCell> fields);

    /**
     * Apply field changes to every cell of the notebook matching the filter, in one transaction.
     *
     * @return number of cells changed
     */
    int updateCells(String notebookId, Predicate<NotebookCell> filter, Consumer<NotebookCell> fields);

    /**
     * Apply field changes to the notebook under a row lock. An exception thrown by
     * {@code fields} aborts the change.
     *
     * @throws com.example.notebookengine.exception.NotFoundException if the notebook does not exist
     */
    Notebook updateNotebookStatus(String notebookId, Consumer<Notebook> fields);

    /**
     * Atomically move the notebook into RUNNING if no other run is in flight.
     *
     * @return true when this caller now owns the run
     */
    boolean tryAcquireRun(String notebookId);
}
