package com.codeops.gatekeeper.security;

/**
 * Result of validating one raw token: either fully accepted or rejected, never in between.
 */
public sealed interface ValidationOutcome {

    record Accepted(AuthenticationContext context) implements ValidationOutcome {}

    record Rejected(AuthenticationFailure failure) implements ValidationOutcome {}
}
