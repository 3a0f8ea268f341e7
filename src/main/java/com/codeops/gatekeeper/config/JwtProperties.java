package com.codeops.gatekeeper.config;

import com.codeops.gatekeeper.token.SignatureAlgorithm;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for bearer token verification, bound to the
 * {@code codeops.gatekeeper.jwt} prefix in application properties.
 *
 * <p>The Gatekeeper service only validates tokens; it never issues them. For HMAC
 * algorithms {@code secret} must match the issuer's signing secret; for RSA algorithms
 * {@code publicKey} holds the issuer's PEM-encoded public key.</p>
 *
 * @see SigningKeyFactory
 */
@ConfigurationProperties(prefix = "codeops.gatekeeper.jwt")
@Validated
@Getter
@Setter
public class JwtProperties {

    @NotNull
    private SignatureAlgorithm algorithm = SignatureAlgorithm.HS256;

    private String secret;

    private String publicKey;

    @PositiveOrZero
    private long clockSkewSeconds = 0;

    private String issuer;

    private String audience;
}
