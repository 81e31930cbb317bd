package com.hostpanel.orchestrator.api;

import com.hostpanel.orchestrator.discovery.DiscoveryException;
import com.hostpanel.orchestrator.service.JobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps failures to HTTP responses with a body of the form
 * {"error": "&lt;KIND&gt;", "message": "..."}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(JobException.class)
    public ResponseEntity<Map<String, String>> handleJobException(JobException e) {
        HttpStatus status = switch (e.getKind()) {
            case INVALID_INPUT, ALREADY_TERMINAL -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND                       -> HttpStatus.NOT_FOUND;
            case SOURCE_UNREACHABLE              -> HttpStatus.BAD_GATEWAY;
            default                              -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        }
        return ResponseEntity.status(status).body(body(e.getKind().name(), e.getMessage()));
    }

    @ExceptionHandler(DiscoveryException.class)
    public ResponseEntity<Map<String, String>> handleDiscoveryException(DiscoveryException e) {
        log.error("Discovery failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("DISCOVERY_FAILED", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body(body(JobException.Kind.INVALID_INPUT.name(),
                "Invalid value '" + e.getValue() + "' for " + e.getName()));
    }

    private static Map<String, String> body(String error, String message) {
        return Map.of("error", error, "message", message == null ? "" : message);
    }
}
