package com.codeops.gatekeeper.token;

import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Reads RSA public keys from PEM text.
 */
public final class PemKeys {

    private static final String PUBLIC_KEY = "PUBLIC KEY";

    private PemKeys() {}

    /**
     * Parses an X.509 {@code -----BEGIN PUBLIC KEY-----} block.
     *
     * @param pem the PEM text
     * @return the RSA public key
     * @throws IllegalArgumentException if the text is empty or not an RSA public key
     */
    public static PublicKey parseRsaPublicKey(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("Public key PEM is empty");
        }
        String content = pem
                .replace("-----BEGIN " + PUBLIC_KEY + "-----", "")
                .replace("-----END " + PUBLIC_KEY + "-----", "")
                .replaceAll("\\s+", "");
        try {
            byte[] der = Base64.getDecoder().decode(content.getBytes(StandardCharsets.US_ASCII));
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (IllegalArgumentException | InvalidKeySpecException e) {
            throw new IllegalArgumentException("Failed to parse RSA public key from PEM", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA not available", e);
        }
    }
}
