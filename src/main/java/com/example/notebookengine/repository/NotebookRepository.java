package com.example.notebookengine.repository;

import com.example.notebookengine.domain.Notebook;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NotebookRepository extends JpaRepository<Notebook, String> {

    List<Notebook> findByOwnerIdOrderByUpdatedAtDesc(String ownerId);

    List<Notebook> findByStatus(Notebook.NotebookStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT n FROM Notebook n WHERE n.id = :id")
    Optional<Notebook> findByIdForUpdate(String id);

    /**
     * Compare-and-set the notebook into RUNNING. Succeeds only from a startable status,
     * or from PAUSED once the gate has been decided (no paused cell recorded).
     * A rejected notebook never takes the lock until it is reset.
     *
     * @return number of rows updated: 1 when the run lock was taken, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Notebook n SET n.status = :running, n.lastRunAt = :now, n.cancelRequested = false " +
            "WHERE n.id = :id AND n.rejectedAtCellId IS NULL AND (n.status IN :startable " +
            "OR (n.status = :paused AND n.pausedAtCellId IS NULL))")
    int acquireRun(String id, Notebook.NotebookStatus running, Collection<Notebook.NotebookStatus> startable,
                   Notebook.NotebookStatus paused, Instant now);
}
