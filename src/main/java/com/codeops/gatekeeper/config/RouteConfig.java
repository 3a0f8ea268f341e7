package com.codeops.gatekeeper.config;

import com.codeops.gatekeeper.exception.RouteErrorHandler;
import com.codeops.gatekeeper.handler.HealthHandler;
import com.codeops.gatekeeper.handler.PrincipalHandler;
import com.codeops.gatekeeper.routing.RouteTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Registers every HTTP route of the service.
 */
@Configuration
public class RouteConfig {

    @Bean
    public RouteTable routeTable(HealthHandler healthHandler, PrincipalHandler principalHandler) {
        return new RouteTable()
                .publicRoute(HttpMethod.GET, AppConstants.API_PREFIX + "/health", healthHandler::health)
                .authenticatedRoute(HttpMethod.GET, AppConstants.API_PREFIX + "/me", principalHandler::currentPrincipal);
    }

    @Bean
    public RouterFunction<ServerResponse> gatekeeperRoutes(RouteTable routeTable) {
        return routeTable.toRouterFunction(new RouteErrorHandler());
    }
}
