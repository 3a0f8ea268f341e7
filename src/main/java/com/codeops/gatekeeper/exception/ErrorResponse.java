package com.codeops.gatekeeper.exception;

/**
 * Standard error response body returned by the authentication middleware and route error handler.
 *
 * @param status  the HTTP status code
 * @param message the human-readable error message
 */
public record ErrorResponse(int status, String message) {}
