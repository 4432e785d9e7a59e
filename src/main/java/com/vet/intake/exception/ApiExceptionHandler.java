package com.vet.intake.exception;

import com.vet.intake.config.RequestIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        log.warn("Invalid intake input: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    /** Jackson wraps constructor validation failures; surface the original message. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        Throwable root = ex.getMostSpecificCause();
        String message = root instanceof IllegalArgumentException ? root.getMessage() : "Malformed request body";
        log.warn("Unreadable request body: {}", root.getMessage());
        return build(HttpStatus.BAD_REQUEST, message, null);
    }

    @ExceptionHandler(SubmissionConflictException.class)
    public ResponseEntity<Map<String, Object>> conflict(SubmissionConflictException ex) {
        log.warn("Intake conflict: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(IntakeSessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> sessionNotFound(IntakeSessionNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NoResourceFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "Endpoint does not exist.", null);
    }

    @ExceptionHandler(CatalogResolutionException.class)
    public ResponseEntity<Map<String, Object>> catalog(CatalogResolutionException ex) {
        log.warn("Catalog unavailable for {}: {}", ex.getField(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<Map<String, Object>> backend(BackendUnavailableException ex) {
        log.error("Scheduling backend failure: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "We could not send your request right now. Please try again.", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> any(Exception ex) {
        log.error("Unhandled exception", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.", null);
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, String message, String field) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message == null ? "(no message)" : message);
        if (field != null) body.put("field", field);
        body.put("trace_id", MDC.get(RequestIdFilter.MDC_KEY));
        return ResponseEntity.status(status).body(body);
    }
}
