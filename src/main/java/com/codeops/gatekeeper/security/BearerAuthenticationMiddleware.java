package com.codeops.gatekeeper.security;

import com.codeops.gatekeeper.exception.ErrorResponse;
import com.codeops.gatekeeper.middleware.Middleware;
import com.codeops.gatekeeper.middleware.MiddlewareChain;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.time.Clock;

/**
 * Middleware that authenticates bearer tokens. Authenticated requests get their
 * {@link AuthenticationContext} attached; rejected requests end here with a 401 JSON body.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerAuthenticationMiddleware implements Middleware {

    private final BearerTokenInterceptor interceptor;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, MiddlewareChain next)
            throws IOException, ServletException {
        InterceptionOutcome outcome = interceptor.intercept(request.getHeader(HttpHeaders.AUTHORIZATION), clock.instant());

        if (outcome instanceof InterceptionOutcome.Rejected rejected) {
            log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), rejected.failure());
            response.setStatus(rejected.status());
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(rejected.status(), rejected.message()));
            return;
        }
        if (outcome instanceof InterceptionOutcome.Authenticated authenticated) {
            RequestAuthentication.attach(request, authenticated.context());
            log.debug("Authenticated {} for {} {}", authenticated.context().principal(),
                    request.getMethod(), request.getRequestURI());
        }
        next.proceed(request, response);
    }
}
