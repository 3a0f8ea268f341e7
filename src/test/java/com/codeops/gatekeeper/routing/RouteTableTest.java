package com.codeops.gatekeeper.routing;

import com.codeops.gatekeeper.exception.ErrorResponse;
import com.codeops.gatekeeper.exception.RouteErrorHandler;
import com.codeops.gatekeeper.security.AuthenticationContext;
import com.codeops.gatekeeper.security.RequestAuthentication;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.function.EntityResponse;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for RouteTable covering registration, access guarding and error mapping.
 */
class RouteTableTest {

    private final RouteTable table = new RouteTable()
            .publicRoute(HttpMethod.GET, "/open", request -> ServerResponse.ok().body("open"))
            .authenticatedRoute(HttpMethod.GET, "/secure",
                    (request, context) -> ServerResponse.ok().body(context.principal()))
            .publicRoute(HttpMethod.GET, "/broken", request -> {
                throw new IllegalArgumentException("bad input");
            })
            .publicRoute(HttpMethod.GET, "/failing", request -> {
                throw new IllegalStateException("boom");
            });

    private final RouterFunction<ServerResponse> router = table.toRouterFunction(new RouteErrorHandler());

    @Test
    void getRoutes_listsRoutesInRegistrationOrder() {
        assertThat(table.getRoutes())
                .extracting(RouteDefinition::pattern, RouteDefinition::access)
                .containsExactly(
                        tuple("/open", Access.PUBLIC),
                        tuple("/secure", Access.AUTHENTICATED),
                        tuple("/broken", Access.PUBLIC),
                        tuple("/failing", Access.PUBLIC));
    }

    @Test
    void publicRoute_runsWithoutContext() throws Exception {
        ServerResponse response = dispatch(new MockHttpServletRequest("GET", "/open"));

        assertThat(response.statusCode().value()).isEqualTo(200);
    }

    @Test
    void authenticatedRoute_withoutContext_returnsMissingToken() throws Exception {
        ServerResponse response = dispatch(new MockHttpServletRequest("GET", "/secure"));

        assertThat(response.statusCode().value()).isEqualTo(401);
        assertThat(response.headers().getFirst("WWW-Authenticate")).isEqualTo("Bearer");
        assertThat(entity(response)).isEqualTo(new ErrorResponse(401, "missing token"));
    }

    @Test
    void authenticatedRoute_receivesContext() throws Exception {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/secure");
        RequestAuthentication.attach(servletRequest, new AuthenticationContext("alice", Set.of()));

        ServerResponse response = dispatch(servletRequest);

        assertThat(response.statusCode().value()).isEqualTo(200);
        assertThat(entity(response)).isEqualTo("alice");
    }

    @Test
    void handlerErrors_areMappedToErrorResponses() throws Exception {
        ServerResponse badRequest = dispatch(new MockHttpServletRequest("GET", "/broken"));
        ServerResponse internal = dispatch(new MockHttpServletRequest("GET", "/failing"));

        assertThat(entity(badRequest)).isEqualTo(new ErrorResponse(400, "Invalid request"));
        assertThat(entity(internal)).isEqualTo(new ErrorResponse(500, "An internal error occurred"));
    }

    @Test
    void unknownPathOrMethod_doesNotMatch() {
        assertThat(router.route(request(new MockHttpServletRequest("GET", "/missing")))).isEmpty();
        assertThat(router.route(request(new MockHttpServletRequest("POST", "/open")))).isEmpty();
    }

    @Test
    void emptyTable_cannotBuildRouter() {
        assertThatThrownBy(() -> new RouteTable().toRouterFunction(new RouteErrorHandler()))
                .isInstanceOf(IllegalStateException.class);
    }

    private ServerResponse dispatch(MockHttpServletRequest servletRequest) throws Exception {
        ServerRequest request = request(servletRequest);
        return router.route(request).orElseThrow().handle(request);
    }

    private static ServerRequest request(MockHttpServletRequest servletRequest) {
        return ServerRequest.create(servletRequest, List.of(new StringHttpMessageConverter()));
    }

    private static Object entity(ServerResponse response) {
        return ((EntityResponse<?>) response).entity();
    }
}
