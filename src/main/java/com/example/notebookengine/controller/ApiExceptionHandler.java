package com.example.notebookengine.controller;

import com.example.notebookengine.exception.ConflictException;
import com.example.notebookengine.exception.NotFoundException;
import com.example.notebookengine.exception.NotebookEngineException;
import com.example.notebookengine.exception.StateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps engine errors to {@code {"error": ..., "code": ...}} responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(ConflictException ex) {
        return body(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(StateException.class)
    public ResponseEntity<Map<String, String>> handleState(StateException ex) {
        return body(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", ex.getMessage() != null ? ex.getMessage() : "Bad request",
                "code", "BAD_REQUEST"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleOther(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "error", "Internal error",
                "code", "INTERNAL_ERROR"));
    }

    private ResponseEntity<Map<String, String>> body(HttpStatus status, NotebookEngineException ex) {
        log.debug("{} {}: {}", status.value(), ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(Map.of("error", ex.getMessage(), "code", ex.getCode()));
    }
}
