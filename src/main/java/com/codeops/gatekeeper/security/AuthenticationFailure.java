package com.codeops.gatekeeper.security;

/**
 * Internal classification of why a request could not be authenticated.
 * Used for logging only; every value collapses to the same 401 response.
 */
public enum AuthenticationFailure {
    MISSING_OR_MALFORMED_HEADER,
    MALFORMED_TOKEN,
    UNSUPPORTED_ALGORITHM,
    SIGNATURE_MISMATCH,
    MISSING_SUBJECT,
    MISSING_EXPIRY,
    ISSUED_AFTER_EXPIRY,
    EXPIRED,
    NOT_YET_VALID,
    ISSUER_MISMATCH,
    AUDIENCE_MISMATCH
}
