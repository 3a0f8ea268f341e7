package com.codeops.gatekeeper.token;

import com.codeops.gatekeeper.exception.GatekeeperException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;

import java.security.Key;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces signed compact tokens with jjwt. Issuance belongs to another service; this exists
 * so tests and local tooling can mint tokens the verifier accepts.
 */
public class TokenSigner {

    /**
     * Signs {@code claims} with a header naming the key's algorithm.
     *
     * @param claims the claims
     * @param key    a key holding a secret or private key
     * @return the compact token
     */
    public String sign(ClaimSet claims, SigningKey key) {
        return sign(TokenHeader.of(key.getAlgorithm().name()), claims, key);
    }

    /**
     * Signs {@code claims} under an explicit header. Header parameters other than {@code alg}
     * are copied as-is; {@code alg} is written by jjwt.
     *
     * @param header the header; its {@code alg} must be a supported algorithm
     * @param claims the claims
     * @param key    a key holding a secret or private key
     * @return the compact token
     */
    public String sign(TokenHeader header, ClaimSet claims, SigningKey key) {
        SignatureAlgorithm algorithm = SignatureAlgorithm.fromHeaderName(header.algorithm())
                .orElseThrow(() -> new IllegalArgumentException("Cannot sign with algorithm " + header.algorithm()));
        Key signingKey = key.getSigningKey()
                .orElseThrow(() -> new IllegalStateException("Signing key for " + key.getAlgorithm() + " is verification-only"));

        Map<String, Object> parameters = new LinkedHashMap<>(header.parameters());
        parameters.remove(TokenHeader.ALGORITHM);
        try {
            return Jwts.builder()
                    .header().add(parameters).and()
                    .claims(claims.asMap())
                    .signWith(signingKey, algorithm.<Key>digestAlgorithm())
                    .compact();
        } catch (JwtException e) {
            throw new GatekeeperException("Failed to sign token with " + algorithm, e);
        }
    }
}
