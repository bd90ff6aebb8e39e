package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.common.CloutException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for consistent error responses across all controllers.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps domain failures to status codes by error kind.
     */
    @ExceptionHandler(CloutException.class)
    public ResponseEntity<Map<String, Object>> handleCloutException(CloutException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.warn("Request failed: {} {}", ex.code(), ex.getMessage());
        } else {
            log.debug("Request rejected: {} {}", ex.code(), ex.getMessage());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.code());
        body.put("message", ex.getMessage());
        if (!ex.fieldErrors().isEmpty()) {
            body.put("details", ex.fieldErrors());
        }
        if (ex.blobId() != null) {
            body.put("blobId", ex.blobId());
        }
        if (ex.queueName() != null) {
            body.put("queue", ex.queueName());
        }
        if (ex.functionName() != null) {
            body.put("function", ex.functionName());
        }
        if (ex.maxBytes() >= 0) {
            body.put("maxBytes", ex.maxBytes());
        }
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Handles validation errors from WebFlux binding of request bodies.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleWebExchangeBindException(
            WebExchangeBindException ex) {
        List<String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();

        log.debug("Validation failed: {}", errors);

        Map<String, Object> body = Map.of(
                "error", "VALIDATION_FAILED",
                "message", "Request validation failed",
                "details", errors
        );

        return ResponseEntity.badRequest().body(body);
    }

    /**
     * Handles constraint violations from @Validated annotations on path/query params.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(
            ConstraintViolationException ex) {
        List<String> errors = ex.getConstraintViolations()
                .stream()
                .map(v -> {
                    String path = v.getPropertyPath().toString();
                    // "next.count" -> "count"
                    int lastDot = path.lastIndexOf('.');
                    String paramName = lastDot >= 0 ? path.substring(lastDot + 1) : path;
                    return paramName + ": " + v.getMessage();
                })
                .toList();

        log.debug("Constraint violation: {}", errors);

        Map<String, Object> body = Map.of(
                "error", "VALIDATION_FAILED",
                "message", "Request validation failed",
                "details", errors
        );

        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleServerWebInputException(
            ServerWebInputException ex) {
        log.debug("Bad request: {}", ex.getMessage());
        Map<String, Object> body = Map.of(
                "error", "BAD_REQUEST",
                "message", ex.getReason() != null ? ex.getReason() : "Invalid request"
        );
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatusException(
            ResponseStatusException ex) {
        log.debug("Response status exception: {} {}", ex.getStatusCode(), ex.getReason());
        Map<String, Object> body = Map.of(
                "error", ex.getStatusCode().toString(),
                "message", ex.getReason() != null ? ex.getReason() : "Request error"
        );
        return ResponseEntity.status(ex.getStatusCode()).body(body);
    }

    /**
     * Handles unexpected exceptions with a generic error response.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        Map<String, Object> body = Map.of(
                "error", "INTERNAL_ERROR",
                "message", "An unexpected error occurred"
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    static HttpStatus statusFor(CloutException ex) {
        return switch (ex.kind()) {
            case BLOB_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION_FAILED -> HttpStatus.BAD_REQUEST;
            case QUEUE_QUOTA_EXCEEDED -> HttpStatus.INSUFFICIENT_STORAGE;
            case QUEUE_OPERATION_FAILED -> HttpStatus.CONFLICT;
            case FUNCTION_EXECUTION_FAILED -> HttpStatus.BAD_GATEWAY;
            case BLOB_OPERATION_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
