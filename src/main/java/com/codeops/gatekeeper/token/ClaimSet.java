package com.codeops.gatekeeper.token;

import com.codeops.gatekeeper.exception.MalformedTokenException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The claims carried in a token payload.
 *
 * <p>Known claims are read under their descriptive names ({@code subject}, {@code expiresAt}, ...)
 * and, when those are absent, under the registered JWT names ({@code sub}, {@code exp}, ...).
 * Timestamps are epoch seconds. A known claim with the wrong JSON type makes the whole
 * claim set malformed; unknown claims are kept untouched in {@link #asMap()}.</p>
 */
public final class ClaimSet {

    public static final String SUBJECT = "subject";
    public static final String EXPIRES_AT = "expiresAt";
    public static final String ISSUED_AT = "issuedAt";
    public static final String NOT_BEFORE = "notBefore";
    public static final String ISSUER = "issuer";
    public static final String AUDIENCE = "audience";
    public static final String AUTHORITIES = "authorities";
    public static final String ROLES = "roles";

    private static final Map<String, String> REGISTERED_ALIASES = Map.of(
            SUBJECT, "sub",
            EXPIRES_AT, "exp",
            ISSUED_AT, "iat",
            NOT_BEFORE, "nbf",
            ISSUER, "iss",
            AUDIENCE, "aud");

    private final Map<String, Object> claims;
    private final String subject;
    private final Instant expiresAt;
    private final Instant issuedAt;
    private final Instant notBefore;
    private final String issuer;
    private final List<String> audience;
    private final Set<String> authorities;
    private final Set<String> roles;

    private ClaimSet(Map<String, Object> claims) {
        this.claims = Collections.unmodifiableMap(new LinkedHashMap<>(claims));
        this.subject = readString(SUBJECT);
        this.expiresAt = readInstant(EXPIRES_AT);
        this.issuedAt = readInstant(ISSUED_AT);
        this.notBefore = readInstant(NOT_BEFORE);
        this.issuer = readString(ISSUER);
        this.audience = List.copyOf(readStrings(AUDIENCE, lookup(AUDIENCE)));
        this.authorities = Collections.unmodifiableSet(readStrings(AUTHORITIES, claims.get(AUTHORITIES)));
        this.roles = Collections.unmodifiableSet(readStrings(ROLES, claims.get(ROLES)));
    }

    /**
     * Wraps a decoded payload object.
     *
     * @param claims the payload as a JSON object
     * @return the claim set
     * @throws MalformedTokenException if a known claim has the wrong type
     */
    public static ClaimSet of(Map<String, Object> claims) {
        return new ClaimSet(claims);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> subject() {
        return Optional.ofNullable(subject);
    }

    public Optional<Instant> expiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public Optional<Instant> issuedAt() {
        return Optional.ofNullable(issuedAt);
    }

    public Optional<Instant> notBefore() {
        return Optional.ofNullable(notBefore);
    }

    public Optional<String> issuer() {
        return Optional.ofNullable(issuer);
    }

    /** Audience values; empty when the claim is absent. */
    public List<String> audience() {
        return audience;
    }

    /** Values of the {@code authorities} claim; empty when absent. */
    public Set<String> authorities() {
        return authorities;
    }

    /** Values of the {@code roles} claim; empty when absent. */
    public Set<String> roles() {
        return roles;
    }

    /** Every claim in the payload, in payload order. */
    public Map<String, Object> asMap() {
        return claims;
    }

    @Override
    public String toString() {
        return "ClaimSet" + claims;
    }

    private Object lookup(String name) {
        if (claims.containsKey(name)) {
            return claims.get(name);
        }
        String alias = REGISTERED_ALIASES.get(name);
        return alias == null ? null : claims.get(alias);
    }

    private String readString(String name) {
        Object value = lookup(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new MalformedTokenException("Claim '" + name + "' must be a string");
        }
        return s;
    }

    private Instant readInstant(String name) {
        Object value = lookup(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new MalformedTokenException("Claim '" + name + "' must be a numeric date");
        }
        try {
            if (number instanceof Integer || number instanceof Long) {
                return Instant.ofEpochSecond(number.longValue());
            }
            if (number instanceof BigInteger big) {
                return Instant.ofEpochSecond(big.longValueExact());
            }
            BigDecimal millis = new BigDecimal(number.toString()).movePointRight(3).setScale(0, RoundingMode.DOWN);
            return Instant.ofEpochMilli(millis.longValueExact());
        } catch (ArithmeticException | DateTimeException | NumberFormatException e) {
            throw new MalformedTokenException("Claim '" + name + "' is out of range", e);
        }
    }

    private static Set<String> readStrings(String name, Object value) {
        Set<String> result = new LinkedHashSet<>();
        if (value == null) {
            return result;
        }
        if (value instanceof String single) {
            for (String part : single.trim().split("\\s+")) {
                if (!part.isEmpty()) {
                    result.add(part);
                }
            }
            return result;
        }
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (!(item instanceof String s)) {
                    throw new MalformedTokenException("Claim '" + name + "' must contain only strings");
                }
                if (!s.isBlank()) {
                    result.add(s.trim());
                }
            }
            return result;
        }
        throw new MalformedTokenException("Claim '" + name + "' must be a string or an array of strings");
    }

    /**
     * Assembles a claim set using the descriptive claim names. Timestamps are written as epoch seconds.
     */
    public static final class Builder {

        private final Map<String, Object> claims = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder subject(String subject) {
            return claim(SUBJECT, subject);
        }

        public Builder expiresAt(Instant expiresAt) {
            return claim(EXPIRES_AT, expiresAt == null ? null : expiresAt.getEpochSecond());
        }

        public Builder issuedAt(Instant issuedAt) {
            return claim(ISSUED_AT, issuedAt == null ? null : issuedAt.getEpochSecond());
        }

        public Builder notBefore(Instant notBefore) {
            return claim(NOT_BEFORE, notBefore == null ? null : notBefore.getEpochSecond());
        }

        public Builder issuer(String issuer) {
            return claim(ISSUER, issuer);
        }

        public Builder audience(String... audience) {
            return claim(AUDIENCE, new ArrayList<>(Arrays.asList(audience)));
        }

        public Builder authorities(String... authorities) {
            return claim(AUTHORITIES, new ArrayList<>(Arrays.asList(authorities)));
        }

        public Builder roles(String... roles) {
            return claim(ROLES, new ArrayList<>(Arrays.asList(roles)));
        }

        /**
         * Sets an arbitrary claim; a null value removes it.
         */
        public Builder claim(String name, Object value) {
            if (value == null) {
                claims.remove(name);
            } else {
                claims.put(name, value);
            }
            return this;
        }

        public ClaimSet build() {
            return new ClaimSet(claims);
        }
    }
}
