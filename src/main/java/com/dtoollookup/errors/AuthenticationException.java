package com.dtoollookup.errors;

/**
 * The username a request refers to is not known to the admin store.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public static AuthenticationException unknownUser(String username) {
        return new AuthenticationException("User not registered: " + username);
    }
}
