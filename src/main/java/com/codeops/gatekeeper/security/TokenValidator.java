package com.codeops.gatekeeper.security;

import com.codeops.gatekeeper.exception.InvalidTokenException;
import com.codeops.gatekeeper.token.ClaimSet;
import com.codeops.gatekeeper.token.ClaimValidator;
import com.codeops.gatekeeper.token.DecodedToken;
import com.codeops.gatekeeper.token.SignatureVerifier;
import com.codeops.gatekeeper.token.SigningKey;
import com.codeops.gatekeeper.token.TokenCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Validates a raw bearer token: decode, verify the signature, then check the claims.
 * The first failing stage decides the rejection; later stages never run.
 *
 * <p>Granted authorities are the {@code authorities} claim values as-is plus the
 * {@code roles} claim values with a {@code ROLE_} prefix.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class TokenValidator {

    static final String ROLE_PREFIX = "ROLE_";

    private final TokenCodec codec;
    private final SignatureVerifier signatureVerifier;
    private final ClaimValidator claimValidator;
    private final SigningKey signingKey;

    /**
     * Validates {@code rawToken} at {@code now}.
     *
     * @param rawToken the compact token, without the scheme prefix
     * @param now      the validation instant
     * @return the outcome
     */
    public ValidationOutcome validate(String rawToken, Instant now) {
        try {
            DecodedToken token = codec.decode(rawToken);
            signatureVerifier.verify(token, signingKey);
            claimValidator.validate(token.claims(), now);
            return new ValidationOutcome.Accepted(toContext(token.claims()));
        } catch (InvalidTokenException e) {
            log.debug("Token rejected ({}): {}", e.getFailure(), e.getMessage());
            return new ValidationOutcome.Rejected(e.getFailure());
        }
    }

    private static AuthenticationContext toContext(ClaimSet claims) {
        Set<GrantedAuthority> authorities = new LinkedHashSet<>();
        claims.authorities().forEach(authority -> authorities.add(new SimpleGrantedAuthority(authority)));
        for (String role : claims.roles()) {
            String authority = role.startsWith(ROLE_PREFIX) ? role : ROLE_PREFIX + role;
            authorities.add(new SimpleGrantedAuthority(authority));
        }
        return new AuthenticationContext(claims.subject().orElseThrow(), authorities);
    }
}
