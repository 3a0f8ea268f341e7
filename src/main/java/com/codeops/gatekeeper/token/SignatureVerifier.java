package com.codeops.gatekeeper.token;

import com.codeops.gatekeeper.exception.TokenSignatureException;
import com.codeops.gatekeeper.security.AuthenticationFailure;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.MessageDigest;
import java.security.PublicKey;

/**
 * Checks token signatures against the configured {@link SigningKey}.
 * Only the algorithm the key is configured for is accepted; everything else fails closed.
 *
 * <p>Verification runs through jjwt over the compact text as received. jjwt refuses HMAC
 * secrets shorter than RFC 7518 allows, so those are checked with a plain constant-time
 * {@link Mac} comparison instead. Expiry and not-before are left to {@link ClaimValidator}.</p>
 */
@Slf4j
public class SignatureVerifier {

    /**
     * Verifies the signature of a decoded token.
     *
     * @param token the decoded token
     * @param key   the configured key
     * @throws TokenSignatureException if the algorithm is not accepted or the signature differs
     */
    public void verify(DecodedToken token, SigningKey key) {
        String algorithmName = token.header().algorithm();
        SignatureAlgorithm algorithm = SignatureAlgorithm.fromHeaderName(algorithmName)
                .orElseThrow(() -> new TokenSignatureException(AuthenticationFailure.UNSUPPORTED_ALGORITHM,
                        "Unsupported token algorithm: " + algorithmName));
        if (algorithm != key.getAlgorithm()) {
            throw new TokenSignatureException(AuthenticationFailure.UNSUPPORTED_ALGORITHM,
                    "Token algorithm " + algorithm + " does not match configured " + key.getAlgorithm());
        }

        Key verificationKey = key.getVerificationKey();
        if (algorithm.getFamily() == SignatureAlgorithm.Family.HMAC
                && verificationKey.getEncoded().length < algorithm.minimumSecretBytes()) {
            verifyShortSecret(algorithm, token, verificationKey);
            return;
        }

        try {
            parserFor(verificationKey).build().parseSignedClaims(token.compact());
        } catch (ExpiredJwtException | PrematureJwtException e) {
            // jjwt checks exp/nbf only after the signature matched
            log.trace("Signature verified; leaving token timing to claim validation: {}", e.getMessage());
        } catch (UnsupportedJwtException e) {
            throw new TokenSignatureException(AuthenticationFailure.UNSUPPORTED_ALGORITHM,
                    "Token algorithm " + algorithm + " is not usable with the configured key", e);
        } catch (JwtException e) {
            throw new TokenSignatureException(AuthenticationFailure.SIGNATURE_MISMATCH,
                    "Token signature is not valid for " + algorithm, e);
        }
    }

    private static JwtParserBuilder parserFor(Key key) {
        if (key instanceof SecretKey secretKey) {
            return Jwts.parser().verifyWith(secretKey);
        }
        return Jwts.parser().verifyWith((PublicKey) key);
    }

    private static void verifyShortSecret(SignatureAlgorithm algorithm, DecodedToken token, Key key) {
        byte[] expected;
        try {
            Mac mac = Mac.getInstance(algorithm.getJcaName());
            mac.init(key);
            expected = mac.doFinal(token.signingInputBytes());
        } catch (GeneralSecurityException e) {
            throw new TokenSignatureException(AuthenticationFailure.UNSUPPORTED_ALGORITHM,
                    "Token algorithm " + algorithm + " is not usable with the configured key", e);
        }
        if (!MessageDigest.isEqual(expected, token.signature())) {
            throw new TokenSignatureException(AuthenticationFailure.SIGNATURE_MISMATCH, "Token signature does not match");
        }
    }
}
