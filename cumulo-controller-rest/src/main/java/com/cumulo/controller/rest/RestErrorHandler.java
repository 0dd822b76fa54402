package com.cumulo.controller.rest;

import com.cumulo.service.core.error.ReplayConflictException;
import com.cumulo.service.core.error.RunRejectedException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global REST exception mapper. Produces consistent JSON payloads for client-visible errors. */
@ControllerAdvice
@Slf4j
public class RestErrorHandler {

    @ExceptionHandler({RunRejectedException.class, ReplayConflictException.class})
    public ResponseEntity<ErrorPayload> handleConflict(IllegalStateException ex, WebRequest request) {
        log.warn("Rejected request: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ex, ex.getMessage(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeParseException.class})
    public ResponseEntity<ErrorPayload> handleBadRequest(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorPayload> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex, "Invalid value for parameter '" + ex.getName() + "'", request);
    }

    private ResponseEntity<ErrorPayload> build(
            HttpStatus status, Exception ex, String message, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body = new ErrorPayload(
                Instant.now(), status.value(), status.getReasonPhrase(), ex.getClass().getSimpleName(), message, path);
        return ResponseEntity.status(status).body(body);
    }
}
