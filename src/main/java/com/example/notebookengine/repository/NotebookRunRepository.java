package com.example.notebookengine.repository;

import com.example.notebookengine.domain.NotebookRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface NotebookRunRepository extends JpaRepository<NotebookRun, String> {

    List<NotebookRun> findByNotebookIdOrderByRunNumberDesc(String notebookId);

    Optional<NotebookRun> findFirstByNotebookIdAndStatusOrderByRunNumberDesc(String notebookId,
                                                                              NotebookRun.RunStatus status);

    @Query("SELECT COALESCE(MAX(r.runNumber), 0) FROM NotebookRun r WHERE r.notebookId = :notebookId")
    int findMaxRunNumber(String notebookId);

    void deleteByNotebookId(String notebookId);
}
