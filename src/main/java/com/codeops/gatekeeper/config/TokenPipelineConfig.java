package com.codeops.gatekeeper.config;

import com.codeops.gatekeeper.security.BearerTokenInterceptor;
import com.codeops.gatekeeper.security.TokenValidator;
import com.codeops.gatekeeper.token.ClaimValidator;
import com.codeops.gatekeeper.token.SignatureVerifier;
import com.codeops.gatekeeper.token.SigningKey;
import com.codeops.gatekeeper.token.TokenCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the token verification pipeline. Every bean here is stateless or immutable
 * and shared by all requests.
 */
@Configuration
public class TokenPipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SigningKey signingKey(JwtProperties jwtProperties) {
        return SigningKeyFactory.create(jwtProperties);
    }

    @Bean
    public TokenCodec tokenCodec() {
        return new TokenCodec();
    }

    @Bean
    public SignatureVerifier signatureVerifier() {
        return new SignatureVerifier();
    }

    @Bean
    public ClaimValidator claimValidator(JwtProperties jwtProperties) {
        return new ClaimValidator(
                Duration.ofSeconds(jwtProperties.getClockSkewSeconds()),
                blankToNull(jwtProperties.getIssuer()),
                blankToNull(jwtProperties.getAudience()));
    }

    @Bean
    public TokenValidator tokenValidator(TokenCodec tokenCodec, SignatureVerifier signatureVerifier,
                                         ClaimValidator claimValidator, SigningKey signingKey) {
        return new TokenValidator(tokenCodec, signatureVerifier, claimValidator, signingKey);
    }

    @Bean
    public BearerTokenInterceptor bearerTokenInterceptor(TokenValidator tokenValidator) {
        return new BearerTokenInterceptor(tokenValidator);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
