package com.codeops.gatekeeper.config;

import com.codeops.gatekeeper.middleware.MiddlewarePipeline;
import com.codeops.gatekeeper.security.BearerAuthenticationMiddleware;
import com.codeops.gatekeeper.security.BearerTokenInterceptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Composes the request middleware in the order it runs:
 * correlation, request logging, bearer authentication.
 */
@Configuration
public class MiddlewareConfig {

    @Bean
    public MiddlewarePipeline middlewarePipeline(BearerTokenInterceptor bearerTokenInterceptor, Clock clock,
                                                 ObjectMapper objectMapper) {
        return new MiddlewarePipeline(List.of(
                new RequestCorrelationMiddleware(),
                new RequestLoggingMiddleware(),
                new BearerAuthenticationMiddleware(bearerTokenInterceptor, clock, objectMapper)));
    }
}
