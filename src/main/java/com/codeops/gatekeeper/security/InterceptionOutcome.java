package com.codeops.gatekeeper.security;

/**
 * Terminal state of the bearer-token interceptor for one request.
 */
public sealed interface InterceptionOutcome {

    /** Token accepted; the context is attached and processing continues. */
    record Authenticated(AuthenticationContext context) implements InterceptionOutcome {}

    /**
     * Request stops here with {@code status} and a generic {@code message}.
     * {@code failure} is the internal reason and is only logged.
     */
    record Rejected(int status, String message, AuthenticationFailure failure) implements InterceptionOutcome {}

    /** No credential; the route decides whether one is required. */
    record PassThrough() implements InterceptionOutcome {}
}
