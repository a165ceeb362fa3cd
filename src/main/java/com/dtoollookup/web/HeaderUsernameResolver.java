package com.dtoollookup.web;

import com.dtoollookup.errors.AuthenticationException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Reads the username from a header set by the authenticating gateway.
 */
@Component
public class HeaderUsernameResolver implements UsernameResolver {

    public static final String DEFAULT_HEADER = "X-Lookup-User";

    private final String headerName;

    public HeaderUsernameResolver(@Value("${lookup.auth.username-header:" + DEFAULT_HEADER + "}") String headerName) {
        this.headerName = headerName;
    }

    @Override
    public String resolve(HttpServletRequest request) {
        var username = request.getHeader(headerName);
        if (username == null || username.isBlank()) {
            throw new AuthenticationException("Missing " + headerName + " header");
        }
        return username.trim();
    }
}
