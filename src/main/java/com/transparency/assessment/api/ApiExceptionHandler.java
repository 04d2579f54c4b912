package com.transparency.assessment.api;

import com.transparency.assessment.assessment.*;
import com.transparency.assessment.validation.ValidationError;
import jakarta.servlet.ServletException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiError> invalid(InvalidRequestException e) {
        return respond(HttpStatus.BAD_REQUEST, e.code(), e.getMessage(), e.errors());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> unreadable(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is missing or malformed", List.of());
    }

    @ExceptionHandler({SessionNotFoundException.class, ProductNotFoundException.class})
    public ResponseEntity<ApiError> notFound(AssessmentException e) {
        return respond(HttpStatus.NOT_FOUND, e.code(), e.getMessage(), List.of());
    }

    @ExceptionHandler({DuplicateProductException.class, ConcurrentSubmissionException.class})
    public ResponseEntity<ApiError> conflict(AssessmentException e) {
        log.info("{}: {}", e.code(), e.getMessage());
        return respond(HttpStatus.CONFLICT, e.code(), e.getMessage(), List.of());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> persistence(DataAccessException e) {
        log.error("Persistence failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "PERSISTENCE_ERROR", "The operation could not be stored", List.of());
    }

    @ExceptionHandler(ServletException.class)
    public ResponseEntity<ApiError> framework(ServletException e) {
        if (e instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            return respond(status, status.name(), e.getMessage(), List.of());
        }
        return unexpected(e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> unexpected(Exception e) {
        log.error("Unhandled failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error", List.of());
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String code, String message, List<ValidationError> details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    public record ApiError(String error, String message, List<ValidationError> details, Instant timestamp) {}
}
