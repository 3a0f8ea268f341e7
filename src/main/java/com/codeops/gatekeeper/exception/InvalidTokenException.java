package com.codeops.gatekeeper.exception;

import com.codeops.gatekeeper.security.AuthenticationFailure;

/**
 * Thrown when a bearer token fails any stage of verification.
 * The {@link AuthenticationFailure} is kept for logging only and is never returned to the caller.
 * Maps to HTTP 401 Unauthorized.
 */
public class InvalidTokenException extends GatekeeperException {

    private final AuthenticationFailure failure;

    /**
     * Creates a new InvalidTokenException for the given failure.
     *
     * @param failure the internal failure classification
     * @param message the detail message
     */
    public InvalidTokenException(AuthenticationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    /**
     * Creates a new InvalidTokenException for the given failure and cause.
     *
     * @param failure the internal failure classification
     * @param message the detail message
     * @param cause   the root cause
     */
    public InvalidTokenException(AuthenticationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public AuthenticationFailure getFailure() {
        return failure;
    }
}
