package com.codeops.gatekeeper.token;

import lombok.Getter;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-wide key material used to verify token signatures, together with the single
 * algorithm it is configured for. Instances are immutable and safe to share between requests.
 */
@Getter
public final class SigningKey {

    private final SignatureAlgorithm algorithm;
    private final Key verificationKey;
    @Getter(lombok.AccessLevel.NONE)
    private final Key signingKey;

    private SigningKey(SignatureAlgorithm algorithm, Key verificationKey, Key signingKey) {
        this.algorithm = algorithm;
        this.verificationKey = verificationKey;
        this.signingKey = signingKey;
    }

    /**
     * Creates an HS256 key from a UTF-8 secret.
     *
     * @param secret the shared secret
     * @return the signing key
     */
    public static SigningKey hmac(String secret) {
        Objects.requireNonNull(secret, "secret");
        return hmac(SignatureAlgorithm.HS256, secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates an HMAC key for the given algorithm. The secret bytes are copied.
     *
     * @param algorithm an HMAC algorithm
     * @param secret    the shared secret, not empty
     * @return the signing key
     */
    public static SigningKey hmac(SignatureAlgorithm algorithm, byte[] secret) {
        requireFamily(algorithm, SignatureAlgorithm.Family.HMAC);
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("HMAC secret must not be empty");
        }
        SecretKeySpec key = new SecretKeySpec(secret, algorithm.getJcaName());
        return new SigningKey(algorithm, key, key);
    }

    /**
     * Creates a verification-only RSA key.
     *
     * @param algorithm an RSA algorithm
     * @param publicKey the RSA public key
     * @return the signing key
     */
    public static SigningKey rsa(SignatureAlgorithm algorithm, PublicKey publicKey) {
        requireFamily(algorithm, SignatureAlgorithm.Family.RSA);
        requireRsa(publicKey);
        return new SigningKey(algorithm, publicKey, null);
    }

    /**
     * Creates an RSA key that can also sign, for tests and local tooling.
     *
     * @param algorithm an RSA algorithm
     * @param keyPair   the RSA key pair
     * @return the signing key
     */
    public static SigningKey rsa(SignatureAlgorithm algorithm, KeyPair keyPair) {
        requireFamily(algorithm, SignatureAlgorithm.Family.RSA);
        requireRsa(keyPair.getPublic());
        return new SigningKey(algorithm, keyPair.getPublic(), keyPair.getPrivate());
    }

    /**
     * Returns the key used to produce signatures, when this instance holds one.
     *
     * @return the secret or private key, empty for verification-only keys
     */
    public Optional<Key> getSigningKey() {
        return Optional.ofNullable(signingKey);
    }

    @Override
    public String toString() {
        return "SigningKey[" + algorithm + "]";
    }

    private static void requireFamily(SignatureAlgorithm algorithm, SignatureAlgorithm.Family family) {
        Objects.requireNonNull(algorithm, "algorithm");
        if (algorithm.getFamily() != family) {
            throw new IllegalArgumentException(algorithm + " is not an " + family + " algorithm");
        }
    }

    private static void requireRsa(PublicKey publicKey) {
        Objects.requireNonNull(publicKey, "publicKey");
        if (!"RSA".equals(publicKey.getAlgorithm())) {
            throw new IllegalArgumentException("Expected an RSA public key but got " + publicKey.getAlgorithm());
        }
    }
}
