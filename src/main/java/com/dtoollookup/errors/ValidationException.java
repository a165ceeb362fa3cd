package com.dtoollookup.errors;

/**
 * A registration payload, base URI or permission target failed validation.
 * The message is safe to return to the client.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
