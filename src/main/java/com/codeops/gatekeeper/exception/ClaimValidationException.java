package com.codeops.gatekeeper.exception;

import com.codeops.gatekeeper.security.AuthenticationFailure;

/**
 * Thrown when a correctly signed token carries claims that are not acceptable
 * at the validation instant (expired, not yet valid, missing subject, ...).
 */
public class ClaimValidationException extends InvalidTokenException {

    public ClaimValidationException(AuthenticationFailure failure, String message) {
        super(failure, message);
    }
}
