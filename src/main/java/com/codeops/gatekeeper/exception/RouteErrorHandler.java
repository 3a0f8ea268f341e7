package com.codeops.gatekeeper.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Maps exceptions thrown by route handlers to {@link ErrorResponse} bodies.
 * Internal details are logged and never returned to the client.
 */
@Slf4j
public class RouteErrorHandler {

    /**
     * Maps a handler exception to a response.
     *
     * @param ex      the exception
     * @param request the request being handled
     * @return a 400 response for {@link IllegalArgumentException}, 500 otherwise
     */
    public ServerResponse handle(Throwable ex, ServerRequest request) {
        if (ex instanceof IllegalArgumentException) {
            log.warn("Invalid request {} {}: {}", request.method(), request.path(), ex.getMessage());
            return error(HttpStatus.BAD_REQUEST, "Invalid request");
        }
        if (ex instanceof GatekeeperException) {
            log.error("Gatekeeper error on {} {}", request.method(), request.path(), ex);
        } else {
            log.error("Unhandled error on {} {}", request.method(), request.path(), ex);
        }
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An internal error occurred");
    }

    private static ServerResponse error(HttpStatus status, String message) {
        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(status.value(), message));
    }
}
