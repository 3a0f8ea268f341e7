package com.codeops.gatekeeper.config;

import com.codeops.gatekeeper.token.SignatureAlgorithm;
import com.codeops.gatekeeper.token.SigningKey;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for SigningKeyFactory covering HMAC and RSA configuration and startup failures.
 */
class SigningKeyFactoryTest {

    private static final String SECRET = "test-secret-key-minimum-32-characters-long-for-hs256-testing";

    @Test
    void create_buildsHmacKey() {
        JwtProperties properties = new JwtProperties();
        properties.setSecret(SECRET);

        SigningKey key = SigningKeyFactory.create(properties);

        assertThat(key.getAlgorithm()).isEqualTo(SignatureAlgorithm.HS256);
        assertThat(key.getVerificationKey().getEncoded()).isEqualTo(SECRET.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void create_rejectsMissingSecret() {
        assertThatThrownBy(() -> SigningKeyFactory.create(new JwtProperties()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("codeops.gatekeeper.jwt.secret");
    }

    @Test
    void create_rejectsShortSecret() {
        JwtProperties properties = new JwtProperties();
        properties.setSecret("too-short");

        assertThatThrownBy(() -> SigningKeyFactory.create(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least 32 bytes");
    }

    @Test
    void create_requiresLongerSecretForHs512() {
        JwtProperties properties = new JwtProperties();
        properties.setAlgorithm(SignatureAlgorithm.HS512);
        properties.setSecret(SECRET);

        assertThatThrownBy(() -> SigningKeyFactory.create(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least 64 bytes for HS512");
    }

    @Test
    void create_buildsRsaKeyFromPem() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        KeyPair keyPair = generator.generateKeyPair();
        JwtProperties properties = new JwtProperties();
        properties.setAlgorithm(SignatureAlgorithm.RS256);
        properties.setPublicKey("-----BEGIN PUBLIC KEY-----\n"
                + Base64.getMimeEncoder().encodeToString(keyPair.getPublic().getEncoded())
                + "\n-----END PUBLIC KEY-----");

        SigningKey key = SigningKeyFactory.create(properties);

        assertThat(key.getAlgorithm()).isEqualTo(SignatureAlgorithm.RS256);
        assertThat(key.getVerificationKey()).isEqualTo(keyPair.getPublic());
        assertThat(key.getSigningKey()).isEmpty();
    }

    @Test
    void create_rejectsMissingOrInvalidPublicKey() {
        JwtProperties properties = new JwtProperties();
        properties.setAlgorithm(SignatureAlgorithm.RS256);
        properties.setSecret(SECRET);

        assertThatThrownBy(() -> SigningKeyFactory.create(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("public key must be configured");

        properties.setPublicKey("-----BEGIN PUBLIC KEY-----\nAAAA\n-----END PUBLIC KEY-----");

        assertThatThrownBy(() -> SigningKeyFactory.create(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("JWT public key is not a valid RSA public key");
    }
}
