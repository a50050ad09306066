package com.hvac.anomaly.controller;

import com.hvac.anomaly.exception.InsufficientDataException;
import com.hvac.anomaly.exception.ModelNotTrainedException;
import com.hvac.anomaly.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Malformed input: unsorted or duplicate readings, unreadable body.
     */
    @ExceptionHandler({ValidationException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Object> handleValidation(Exception ex) {
        log.warn("Rejected input: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid readings", ex.getMessage());
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<Object> handleInsufficientData(InsufficientDataException ex) {
        log.warn("Training refused: {}", ex.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient training data", ex.getMessage());
    }

    @ExceptionHandler(ModelNotTrainedException.class)
    public ResponseEntity<Object> handleModelNotTrained(ModelNotTrainedException ex) {
        log.warn("Scoring refused: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, "Model not trained", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected error", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support referencing this timestamp.");
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now().toString(),
                "status", status.value(),
                "error", error,
                "message", message == null ? "" : message
        ));
    }
}
