package com.codeops.gatekeeper.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Turns the {@code Authorization} header of one request into an {@link InterceptionOutcome}.
 *
 * <ul>
 *   <li>no header: {@link InterceptionOutcome.PassThrough}</li>
 *   <li>header without the case-sensitive {@code "Bearer "} prefix: rejected as a malformed header</li>
 *   <li>any token failure: rejected with the same generic message, whatever the cause</li>
 *   <li>otherwise: {@link InterceptionOutcome.Authenticated}</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenInterceptor {

    public static final String BEARER_PREFIX = "Bearer ";
    public static final String MALFORMED_HEADER_MESSAGE = "malformed authorization header";
    public static final String INVALID_TOKEN_MESSAGE = "invalid token";

    private static final int UNAUTHORIZED = 401;

    private final TokenValidator tokenValidator;

    /**
     * Evaluates one request's credential.
     *
     * @param authorizationHeader the raw header value, or null when absent
     * @param now                 the validation instant
     * @return the terminal state for this request
     */
    public InterceptionOutcome intercept(String authorizationHeader, Instant now) {
        if (authorizationHeader == null) {
            return new InterceptionOutcome.PassThrough();
        }
        if (!authorizationHeader.startsWith(BEARER_PREFIX)) {
            log.debug("Authorization header does not use the Bearer scheme");
            return new InterceptionOutcome.Rejected(UNAUTHORIZED, MALFORMED_HEADER_MESSAGE,
                    AuthenticationFailure.MISSING_OR_MALFORMED_HEADER);
        }

        String token = authorizationHeader.substring(BEARER_PREFIX.length());
        ValidationOutcome outcome = tokenValidator.validate(token, now);
        if (outcome instanceof ValidationOutcome.Accepted accepted) {
            return new InterceptionOutcome.Authenticated(accepted.context());
        }
        AuthenticationFailure failure = ((ValidationOutcome.Rejected) outcome).failure();
        return new InterceptionOutcome.Rejected(UNAUTHORIZED, INVALID_TOKEN_MESSAGE, failure);
    }
}
