package com.codeops.gatekeeper.exception;

import com.codeops.gatekeeper.security.AuthenticationFailure;

/**
 * Thrown when a token signature cannot be verified, either because the algorithm
 * is not accepted or because the recomputed signature differs.
 */
public class TokenSignatureException extends InvalidTokenException {

    public TokenSignatureException(AuthenticationFailure failure, String message) {
        super(failure, message);
    }

    public TokenSignatureException(AuthenticationFailure failure, String message, Throwable cause) {
        super(failure, message, cause);
    }
}
