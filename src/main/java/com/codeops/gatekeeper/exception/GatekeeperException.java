package com.codeops.gatekeeper.exception;

/**
 * Base exception for all CodeOps-Gatekeeper service exceptions.
 * Maps to HTTP 500 Internal Server Error when not caught by a more specific handler.
 */
public class GatekeeperException extends RuntimeException {

    /**
     * Creates a new GatekeeperException with the specified message.
     *
     * @param message the detail message
     */
    public GatekeeperException(String message) {
        super(message);
    }

    /**
     * Creates a new GatekeeperException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause   the root cause
     */
    public GatekeeperException(String message, Throwable cause) {
        super(message, cause);
    }
}
