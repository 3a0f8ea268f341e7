package com.codeops.gatekeeper.routing;

import com.codeops.gatekeeper.exception.ErrorResponse;
import com.codeops.gatekeeper.exception.RouteErrorHandler;
import com.codeops.gatekeeper.security.AuthenticationContext;
import com.codeops.gatekeeper.security.RequestAuthentication;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.HandlerFunction;
import org.springframework.web.servlet.function.RequestPredicates;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Explicit registration of every route the service exposes, built once at startup.
 * Authenticated routes receive the request's {@link AuthenticationContext}; when a request
 * reaches one without a context it is answered with 401 before the handler runs.
 */
public final class RouteTable {

    public static final String MISSING_TOKEN_MESSAGE = "missing token";

    private final List<RouteDefinition> routes = new ArrayList<>();

    public RouteTable publicRoute(HttpMethod method, String pattern, HandlerFunction<ServerResponse> handler) {
        routes.add(new RouteDefinition(method, pattern, Access.PUBLIC, handler));
        return this;
    }

    public RouteTable authenticatedRoute(HttpMethod method, String pattern, AuthenticatedHandler handler) {
        HandlerFunction<ServerResponse> guarded = request -> {
            Optional<AuthenticationContext> context = RequestAuthentication.find(request);
            if (context.isEmpty()) {
                return unauthorized();
            }
            return handler.handle(request, context.get());
        };
        routes.add(new RouteDefinition(method, pattern, Access.AUTHENTICATED, guarded));
        return this;
    }

    public List<RouteDefinition> getRoutes() {
        return List.copyOf(routes);
    }

    /**
     * Builds the router consulted for every request, in registration order.
     *
     * @param errorHandler maps handler exceptions to error responses
     * @return the router function
     */
    public RouterFunction<ServerResponse> toRouterFunction(RouteErrorHandler errorHandler) {
        if (routes.isEmpty()) {
            throw new IllegalStateException("Route table is empty");
        }
        RouterFunctions.Builder builder = RouterFunctions.route();
        for (RouteDefinition route : routes) {
            builder.route(RequestPredicates.method(route.method()).and(RequestPredicates.path(route.pattern())),
                    route.handler());
        }
        return builder.onError(Exception.class, errorHandler::handle).build();
    }

    private static ServerResponse unauthorized() {
        return ServerResponse.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(HttpStatus.UNAUTHORIZED.value(), MISSING_TOKEN_MESSAGE));
    }
}
