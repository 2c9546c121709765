package com.example.notebookengine.engine;

import com.example.notebookengine.domain.NotebookCell;

/**
 * Optional post-execution reviewer. Its verdict is recorded on the cell's
 * execution log and never pauses or fails a run.
 */
public interface CriticReviewer {

    CriticReview review(NotebookCell cell, Object output);
}
