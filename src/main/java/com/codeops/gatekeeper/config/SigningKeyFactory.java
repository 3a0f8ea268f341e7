package com.codeops.gatekeeper.config;

import com.codeops.gatekeeper.token.PemKeys;
import com.codeops.gatekeeper.token.SignatureAlgorithm;
import com.codeops.gatekeeper.token.SigningKey;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Builds the process-wide {@link SigningKey} from {@link JwtProperties}, failing startup
 * when the configuration cannot verify anything.
 */
@Slf4j
public final class SigningKeyFactory {

    private SigningKeyFactory() {}

    /**
     * @param properties the bound JWT properties
     * @return the signing key
     * @throws IllegalStateException if the secret or public key is missing or unusable
     */
    public static SigningKey create(JwtProperties properties) {
        SignatureAlgorithm algorithm = properties.getAlgorithm();
        if (algorithm == null) {
            throw new IllegalStateException("JWT algorithm must be configured (codeops.gatekeeper.jwt.algorithm)");
        }
        SigningKey key = switch (algorithm.getFamily()) {
            case HMAC -> hmacKey(algorithm, properties.getSecret());
            case RSA -> rsaKey(algorithm, properties.getPublicKey());
        };
        log.info("Bearer tokens will be verified with {}", algorithm);
        return key;
    }

    private static SigningKey hmacKey(SignatureAlgorithm algorithm, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must be configured (codeops.gatekeeper.jwt.secret)");
        }
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        int minimum = Math.max(AppConstants.MIN_HMAC_SECRET_LENGTH, algorithm.minimumSecretBytes());
        if (secretBytes.length < minimum) {
            throw new IllegalStateException("JWT secret must be at least " + minimum + " bytes for " + algorithm);
        }
        return SigningKey.hmac(algorithm, secretBytes);
    }

    private static SigningKey rsaKey(SignatureAlgorithm algorithm, String publicKeyPem) {
        if (publicKeyPem == null || publicKeyPem.isBlank()) {
            throw new IllegalStateException("JWT public key must be configured for " + algorithm
                    + " (codeops.gatekeeper.jwt.public-key)");
        }
        try {
            return SigningKey.rsa(algorithm, PemKeys.parseRsaPublicKey(publicKeyPem));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("JWT public key is not a valid RSA public key", e);
        }
    }
}
