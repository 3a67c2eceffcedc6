package org.camunda.bpm.getstarted.migration.web;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.BpmnParseException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.IOException;
import java.util.Map;

/**
 * Maps upload and analysis failures to {@code {"error": ...}} responses. Also sees multipart
 * errors raised before a handler is selected.
 */
@RestControllerAdvice
@Slf4j
public class AnalysisExceptionHandler {

    @ExceptionHandler(InvalidUploadException.class)
    public ResponseEntity<Map<String, String>> handleInvalidUpload(InvalidUploadException e) {
        log.warn("Rejected upload: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleTooLarge(MaxUploadSizeExceededException e) {
        log.warn("Rejected upload: {}", e.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "File too large. Maximum size is 16MB");
    }

    @ExceptionHandler(BpmnParseException.class)
    public ResponseEntity<Map<String, String>> handleParseFailure(BpmnParseException e) {
        log.warn("Could not parse upload {}: {}", e.getSource(), e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Analysis failed: " + e.getMessage());
    }

    @ExceptionHandler({IOException.class, RuntimeException.class})
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        log.error("Analysis failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Analysis failed: " + e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(message)));
    }
}
