package io.devdash.dashboard.api;

import io.devdash.common.module.ContentNotFoundException;
import io.devdash.dashboard.navigation.NavigationAggregationException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;
import java.util.Locale;

/**
 * Maps every failure, including unmatched routes, to the error envelope.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String NOT_FOUND = "not found";
    static final String INVALID_REQUEST = "invalid request";

    private final ErrorResponses errors;

    public GlobalExceptionHandler(ErrorResponses errors) {
        this.errors = errors;
    }

    @ExceptionHandler(ContentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleContentNotFound(ContentNotFoundException ex) {
        log.debug("Content not found: {}", ex.getMessage());
        return errors.entity(HttpStatus.NOT_FOUND, NOT_FOUND);
    }

    @ExceptionHandler(NavigationAggregationException.class)
    public ResponseEntity<ErrorResponse> handleNavigationAggregation(NavigationAggregationException ex) {
        log.error("Generating navigation failed in module {}", ex.module(), ex.getCause());
        return errors.entity(HttpStatus.INTERNAL_SERVER_ERROR, "unable to generate navigation sections");
    }

    @ExceptionHandler(ClusterAccessException.class)
    public ResponseEntity<ErrorResponse> handleClusterAccess(ClusterAccessException ex) {
        log.error("Cluster access failed: {}", ex.getMessage(), ex.getCause());
        return errors.entity(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    /**
     * Handles validation errors from WebFlux binding of request bodies.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleWebExchangeBindException(WebExchangeBindException ex) {
        List<String> details = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        log.debug("Validation failed: {}", details);
        return errors.entity(HttpStatus.BAD_REQUEST, INVALID_REQUEST);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        log.debug("Constraint violation: {}", ex.getMessage());
        return errors.entity(HttpStatus.BAD_REQUEST, INVALID_REQUEST);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleServerWebInputException(ServerWebInputException ex) {
        log.debug("Bad request: {}", ex.getReason());
        return errors.entity(HttpStatus.BAD_REQUEST, INVALID_REQUEST);
    }

    /**
     * Covers routing failures raised before any controller runs: no matching route (404),
     * unsupported method (405) and unsupported media types.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        log.debug("Response status exception: {} {}", status, ex.getReason());
        return errors.entity(status, messageFor(status));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return errors.entity(HttpStatus.INTERNAL_SERVER_ERROR, "internal server error");
    }

    static String messageFor(HttpStatusCode status) {
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            return NOT_FOUND;
        }
        HttpStatus known = HttpStatus.resolve(status.value());
        if (known == null) {
            return "request failed";
        }
        return known.getReasonPhrase().toLowerCase(Locale.ROOT);
    }
}
