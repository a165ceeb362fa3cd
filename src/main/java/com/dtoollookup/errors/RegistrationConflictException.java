package com.dtoollookup.errors;

/**
 * A concurrent registration won the race for the same dataset URI.
 * Nothing after the failed write was applied; the whole request can be retried.
 */
public class RegistrationConflictException extends RuntimeException {

    public RegistrationConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
