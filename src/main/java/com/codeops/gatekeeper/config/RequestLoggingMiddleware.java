package com.codeops.gatekeeper.config;

import com.codeops.gatekeeper.middleware.Middleware;
import com.codeops.gatekeeper.middleware.MiddlewareChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Logs each request with its final status and duration.
 */
@Slf4j
public class RequestLoggingMiddleware implements Middleware {

    public static final String START_TIME_ATTR = "requestStartTime";

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, MiddlewareChain next)
            throws IOException, ServletException {
        long startTime = System.currentTimeMillis();
        request.setAttribute(START_TIME_ATTR, startTime);
        log.debug("Incoming {} {}", request.getMethod(), request.getRequestURI());
        try {
            next.proceed(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            log.info("{} {} completed with {} in {}ms", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), duration);
        }
    }
}
