package com.dtoollookup.web;

import com.dtoollookup.errors.AuthenticationException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Turns an inbound request into the username it was authenticated as.
 * Authentication itself happens upstream.
 */
public interface UsernameResolver {

    /**
     * @throws AuthenticationException if the request carries no identity
     */
    String resolve(HttpServletRequest request);
}
