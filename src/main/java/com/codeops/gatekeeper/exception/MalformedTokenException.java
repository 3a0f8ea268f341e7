package com.codeops.gatekeeper.exception;

import com.codeops.gatekeeper.security.AuthenticationFailure;

/**
 * Thrown when a token cannot be decoded: wrong segment count, invalid base64url,
 * or a header or payload that is not a well-formed JSON object.
 */
public class MalformedTokenException extends InvalidTokenException {

    public MalformedTokenException(String message) {
        super(AuthenticationFailure.MALFORMED_TOKEN, message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(AuthenticationFailure.MALFORMED_TOKEN, message, cause);
    }
}
