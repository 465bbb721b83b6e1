package com.blockflow.blockflow_backend.controller;

import com.blockflow.blockflow_backend.model.graph.BlockNotFoundException;
import com.blockflow.blockflow_backend.model.graph.InvalidGraphException;
import com.blockflow.blockflow_backend.session.WorkflowNotFoundException;
import com.blockflow.blockflow_backend.trigger.WorkflowValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the editor and execution exceptions to JSON error bodies of the form {@code {"error": "..."}}.
 * Validation failures also carry the identity of the block to highlight.
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WorkflowValidationException ex) {
        Map<String, Object> body = error(ex.getMessage());
        body.put("blockId", ex.getBlockId());
        body.put("blockName", ex.getBlockName());
        body.put("blockType", ex.getBlockType());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({InvalidGraphException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        return ResponseEntity.badRequest().body(error(ex.getMessage()));
    }

    @ExceptionHandler({WorkflowNotFoundException.class, BlockNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(ex.getMessage()));
    }

    // A run is already open, or a debug command arrived without a paused session
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(IllegalStateException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error(ex.getMessage()));
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message != null ? message : "Request failed");
        return body;
    }
}
