package com.codeops.gatekeeper.token;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * A token split into its parts, before any signature or claim checks.
 * The signature array is copied on the way in and out, so instances are immutable.
 *
 * @param header       the decoded header
 * @param claims       the decoded payload
 * @param signature    the raw signature bytes
 * @param signingInput the {@code header.payload} segments exactly as received
 */
public record DecodedToken(TokenHeader header, ClaimSet claims, byte[] signature, String signingInput) {

    public DecodedToken {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(signingInput, "signingInput");
        signature = signature.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }

    public byte[] signingInputBytes() {
        return signingInput.getBytes(StandardCharsets.US_ASCII);
    }

    /** The compact form: signing input, a dot, and the base64url signature. */
    public String compact() {
        return signingInput + TokenCodec.DELIMITER + Base64.getUrlEncoder().withoutPadding().encodeToString(signature);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecodedToken other)) {
            return false;
        }
        return signingInput.equals(other.signingInput) && Arrays.equals(signature, other.signature);
    }

    @Override
    public int hashCode() {
        return 31 * signingInput.hashCode() + Arrays.hashCode(signature);
    }

    @Override
    public String toString() {
        return "DecodedToken[header=" + header + ", claims=" + claims + ", signature=" + signature.length + " bytes]";
    }
}
