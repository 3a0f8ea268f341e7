package com.codeops.gatekeeper.token;

import com.codeops.gatekeeper.exception.ClaimValidationException;
import com.codeops.gatekeeper.security.AuthenticationFailure;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Checks the time-based and structural claims of a token whose signature is already verified.
 *
 * <p>The validation instant is always passed in. With the default zero clock skew a token is
 * expired when {@code now >= expiresAt} and not yet valid when {@code now < notBefore};
 * a positive skew widens both windows by that amount.</p>
 */
public class ClaimValidator {

    private final Duration clockSkew;
    private final String expectedIssuer;
    private final String expectedAudience;

    public ClaimValidator() {
        this(Duration.ZERO, null, null);
    }

    /**
     * @param clockSkew        tolerated clock difference, not negative
     * @param expectedIssuer   required {@code issuer} value, or null to accept any
     * @param expectedAudience value that must appear in {@code audience}, or null to accept any
     */
    public ClaimValidator(Duration clockSkew, String expectedIssuer, String expectedAudience) {
        Objects.requireNonNull(clockSkew, "clockSkew");
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("Clock skew must not be negative");
        }
        this.clockSkew = clockSkew;
        this.expectedIssuer = expectedIssuer;
        this.expectedAudience = expectedAudience;
    }

    /**
     * Validates {@code claims} at {@code now}.
     *
     * @param claims the token claims
     * @param now    the validation instant
     * @throws ClaimValidationException on the first failing check
     */
    public void validate(ClaimSet claims, Instant now) {
        Objects.requireNonNull(now, "now");
        Instant expiresAt = claims.expiresAt().orElse(null);

        if (expiresAt != null && !shift(now, clockSkew.negated()).isBefore(expiresAt)) {
            throw new ClaimValidationException(AuthenticationFailure.EXPIRED, "Token expired at " + expiresAt);
        }
        String subject = claims.subject().orElse(null);
        if (subject == null || subject.isBlank()) {
            throw new ClaimValidationException(AuthenticationFailure.MISSING_SUBJECT, "Token has no subject");
        }
        if (expiresAt == null) {
            throw new ClaimValidationException(AuthenticationFailure.MISSING_EXPIRY, "Token has no expiry");
        }
        Instant issuedAt = claims.issuedAt().orElse(null);
        if (issuedAt != null && issuedAt.isAfter(expiresAt)) {
            throw new ClaimValidationException(AuthenticationFailure.ISSUED_AFTER_EXPIRY,
                    "Token issued at " + issuedAt + " after its expiry " + expiresAt);
        }
        Instant notBefore = claims.notBefore().orElse(null);
        if (notBefore != null && shift(now, clockSkew).isBefore(notBefore)) {
            throw new ClaimValidationException(AuthenticationFailure.NOT_YET_VALID, "Token not valid before " + notBefore);
        }
        if (expectedIssuer != null && !expectedIssuer.equals(claims.issuer().orElse(null))) {
            throw new ClaimValidationException(AuthenticationFailure.ISSUER_MISMATCH,
                    "Token issuer " + claims.issuer().orElse(null) + " is not " + expectedIssuer);
        }
        if (expectedAudience != null && !claims.audience().contains(expectedAudience)) {
            throw new ClaimValidationException(AuthenticationFailure.AUDIENCE_MISMATCH,
                    "Token audience " + claims.audience() + " does not contain " + expectedAudience);
        }
    }

    /** {@code instant + amount}, clamped to the {@link Instant} range. */
    private static Instant shift(Instant instant, Duration amount) {
        try {
            return instant.plus(amount);
        } catch (DateTimeException | ArithmeticException e) {
            return amount.isNegative() ? Instant.MIN : Instant.MAX;
        }
    }
}
