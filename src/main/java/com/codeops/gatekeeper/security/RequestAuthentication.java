package com.codeops.gatekeeper.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.servlet.function.ServerRequest;

import java.util.Optional;

/**
 * Stores and reads the {@link AuthenticationContext} of a request. The context lives in
 * a request attribute, so it is scoped to that request and disappears with it.
 */
public final class RequestAuthentication {

    public static final String ATTRIBUTE = AuthenticationContext.class.getName();

    private RequestAuthentication() {}

    public static void attach(HttpServletRequest request, AuthenticationContext context) {
        request.setAttribute(ATTRIBUTE, context);
    }

    public static Optional<AuthenticationContext> find(HttpServletRequest request) {
        return asContext(request.getAttribute(ATTRIBUTE));
    }

    public static Optional<AuthenticationContext> find(ServerRequest request) {
        return request.attribute(ATTRIBUTE).flatMap(RequestAuthentication::asContext);
    }

    private static Optional<AuthenticationContext> asContext(Object value) {
        return value instanceof AuthenticationContext context ? Optional.of(context) : Optional.empty();
    }
}
