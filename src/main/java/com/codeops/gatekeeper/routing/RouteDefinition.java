package com.codeops.gatekeeper.routing;

import org.springframework.http.HttpMethod;
import org.springframework.web.servlet.function.HandlerFunction;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * One entry of the route table.
 *
 * @param method  the HTTP method
 * @param pattern the path pattern, e.g. {@code /api/v1/gatekeeper/health}
 * @param access  whether an authenticated context is required
 * @param handler the handler, already guarded when {@code access} is {@link Access#AUTHENTICATED}
 */
public record RouteDefinition(HttpMethod method, String pattern, Access access, HandlerFunction<ServerResponse> handler) {}
