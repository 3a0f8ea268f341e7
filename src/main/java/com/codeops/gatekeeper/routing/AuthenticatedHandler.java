package com.codeops.gatekeeper.routing;

import com.codeops.gatekeeper.security.AuthenticationContext;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Handler for a route that requires authentication. The context is passed in explicitly.
 */
@FunctionalInterface
public interface AuthenticatedHandler {

    ServerResponse handle(ServerRequest request, AuthenticationContext context) throws Exception;
}
