package com.cronium.runtime.auth;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Typed accessor for the claims attached to the current request.
 *
 * The attribute name is private to this class, so nothing else can read or
 * overwrite the claims by guessing a string key.
 */
public final class RequestClaims {

    private static final String ATTRIBUTE = RequestClaims.class.getName() + ".CLAIMS";

    private RequestClaims() {}

    static void set(HttpServletRequest request, ExecutionClaims claims) {
        request.setAttribute(ATTRIBUTE, claims);
    }

    public static Optional<ExecutionClaims> get(HttpServletRequest request) {
        Object value = request.getAttribute(ATTRIBUTE);
        return value instanceof ExecutionClaims claims ? Optional.of(claims) : Optional.empty();
    }
}
