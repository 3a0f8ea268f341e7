package com.codeops.gatekeeper.token;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import io.jsonwebtoken.security.SecureDigestAlgorithm;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.security.Key;
import java.util.Optional;

/**
 * Signature algorithms accepted in the {@code alg} token header, backed by the matching
 * {@link Jwts.SIG} algorithm. Anything not listed here, {@code none} included, is rejected.
 */
@Getter
@RequiredArgsConstructor
public enum SignatureAlgorithm {
    HS256("HmacSHA256", Family.HMAC, Jwts.SIG.HS256),
    HS384("HmacSHA384", Family.HMAC, Jwts.SIG.HS384),
    HS512("HmacSHA512", Family.HMAC, Jwts.SIG.HS512),
    RS256("SHA256withRSA", Family.RSA, Jwts.SIG.RS256),
    RS384("SHA384withRSA", Family.RSA, Jwts.SIG.RS384),
    RS512("SHA512withRSA", Family.RSA, Jwts.SIG.RS512);

    /** Key family an algorithm operates on. */
    public enum Family { HMAC, RSA }

    private final String jcaName;
    private final Family family;
    @Getter(AccessLevel.NONE)
    private final SecureDigestAlgorithm<?, ?> digestAlgorithm;

    /**
     * Looks up an algorithm by its exact, case-sensitive header name.
     *
     * @param headerName the {@code alg} header value
     * @return the algorithm, or empty when it is not supported
     */
    public static Optional<SignatureAlgorithm> fromHeaderName(String headerName) {
        if (headerName == null) {
            return Optional.empty();
        }
        for (SignatureAlgorithm algorithm : values()) {
            if (algorithm.name().equals(headerName)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the jjwt algorithm used to sign and verify with this algorithm.
     *
     * @param <K> the key type the caller signs or verifies with
     * @return the digest algorithm
     */
    @SuppressWarnings("unchecked")
    public <K extends Key> SecureDigestAlgorithm<K, ?> digestAlgorithm() {
        return (SecureDigestAlgorithm<K, ?>) digestAlgorithm;
    }

    /**
     * Smallest HMAC secret, in bytes, the algorithm accepts under RFC 7518 section 3.2.
     * Zero for RSA algorithms.
     */
    public int minimumSecretBytes() {
        return digestAlgorithm instanceof MacAlgorithm mac ? mac.getKeyBitLength() / Byte.SIZE : 0;
    }
}
