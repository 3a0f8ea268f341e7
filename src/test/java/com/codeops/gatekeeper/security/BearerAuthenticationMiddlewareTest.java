package com.codeops.gatekeeper.security;

import com.codeops.gatekeeper.middleware.MiddlewareChain;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for BearerAuthenticationMiddleware covering context attachment and 401 responses.
 */
@ExtendWith(MockitoExtension.class)
class BearerAuthenticationMiddlewareTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    @Mock
    private BearerTokenInterceptor interceptor;

    @Mock
    private MiddlewareChain next;

    private BearerAuthenticationMiddleware middleware;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        middleware = new BearerAuthenticationMiddleware(interceptor, Clock.fixed(NOW, ZoneOffset.UTC), new ObjectMapper());
        request = new MockHttpServletRequest("GET", "/api/v1/gatekeeper/me");
        response = new MockHttpServletResponse();
    }

    @Test
    void authenticated_attachesContextAndContinues() throws Exception {
        AuthenticationContext context = new AuthenticationContext("alice", Set.of());
        request.addHeader("Authorization", "Bearer abc.def.ghi");
        when(interceptor.intercept("Bearer abc.def.ghi", NOW)).thenReturn(new InterceptionOutcome.Authenticated(context));

        middleware.handle(request, response, next);

        assertThat(RequestAuthentication.find(request)).contains(context);
        verify(next).proceed(request, response);
    }

    @Test
    void passThrough_continuesWithoutContext() throws Exception {
        when(interceptor.intercept(null, NOW)).thenReturn(new InterceptionOutcome.PassThrough());

        middleware.handle(request, response, next);

        assertThat(RequestAuthentication.find(request)).isEmpty();
        verify(next).proceed(request, response);
    }

    @Test
    void rejected_writesUnauthorizedResponseAndStops() throws Exception {
        request.addHeader("Authorization", "Bearer expired");
        when(interceptor.intercept("Bearer expired", NOW)).thenReturn(
                new InterceptionOutcome.Rejected(401, "invalid token", AuthenticationFailure.EXPIRED));

        middleware.handle(request, response, next);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getHeader("WWW-Authenticate")).isEqualTo("Bearer");
        assertThat(response.getContentType()).startsWith("application/json");
        assertThat(response.getContentAsString())
                .isEqualTo("{\"status\":401,\"message\":\"invalid token\"}")
                .doesNotContain("EXPIRED");
        assertThat(RequestAuthentication.find(request)).isEmpty();
        verify(next, never()).proceed(any(), any());
    }
}
