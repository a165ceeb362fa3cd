package com.dtoollookup.web;

import com.dtoollookup.errors.AuthenticationException;
import com.dtoollookup.errors.RegistrationConflictException;
import com.dtoollookup.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain errors to HTTP statuses with a {@code {"error": message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> validation(ValidationException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<Map<String, String>> authentication(AuthenticationException e) {
        log.debug("Unauthenticated request: {}", e.getMessage());
        return error(HttpStatus.UNAUTHORIZED, e);
    }

    @ExceptionHandler(RegistrationConflictException.class)
    public ResponseEntity<Map<String, String>> conflict(RegistrationConflictException e) {
        log.warn("Registration conflict: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("error", e.getMessage()));
    }
}
