package com.codeops.gatekeeper.config;

import com.codeops.gatekeeper.middleware.Middleware;
import com.codeops.gatekeeper.middleware.MiddlewareChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Assigns every request a correlation id, taken from {@code X-Correlation-ID} when the caller
 * sends a sane one, and exposes it to logging through the MDC for the duration of the request.
 */
public class RequestCorrelationMiddleware implements Middleware {

    public static final String CORRELATION_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String REQUEST_PATH_KEY = "requestPath";
    public static final String REQUEST_METHOD_KEY = "requestMethod";

    private static final Pattern SAFE_CORRELATION_ID = Pattern.compile("[A-Za-z0-9._-]+");

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, MiddlewareChain next)
            throws IOException, ServletException {
        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_HEADER));
        MDC.put(CORRELATION_ID_KEY, correlationId);
        MDC.put(REQUEST_PATH_KEY, request.getRequestURI());
        MDC.put(REQUEST_METHOD_KEY, request.getMethod());
        response.setHeader(CORRELATION_HEADER, correlationId);
        try {
            next.proceed(request, response);
        } finally {
            MDC.remove(CORRELATION_ID_KEY);
            MDC.remove(REQUEST_PATH_KEY);
            MDC.remove(REQUEST_METHOD_KEY);
        }
    }

    private static String resolveCorrelationId(String header) {
        if (header == null || header.isBlank() || header.length() > AppConstants.MAX_CORRELATION_ID_LENGTH
                || !SAFE_CORRELATION_ID.matcher(header).matches()) {
            return UUID.randomUUID().toString();
        }
        return header;
    }
}
