package com.example.notebookengine.repository;

import com.example.notebookengine.domain.NotebookCell;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface NotebookCellRepository extends JpaRepository<NotebookCell, String> {

    List<NotebookCell> findByNotebookIdOrderByCellIndexAsc(String notebookId);

    Optional<NotebookCell> findByIdAndNotebookId(String id, String notebookId);

    long countByNotebookId(String notebookId);

    void deleteByNotebookId(String notebookId);
}
