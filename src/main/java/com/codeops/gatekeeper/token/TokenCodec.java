package com.codeops.gatekeeper.token;

import com.codeops.gatekeeper.exception.MalformedTokenException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between the compact {@code header.payload.signature} form and its decoded parts.
 *
 * <p>Each segment is unpadded base64url. Header and payload must be JSON objects; duplicate
 * keys and trailing content are rejected. The codec is stateless and thread-safe.</p>
 */
public class TokenCodec {

    static final char DELIMITER = '.';

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public TokenCodec() {
        this.mapper = JsonMapper.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    /**
     * Splits and decodes a compact token.
     *
     * @param raw the token text, without any scheme prefix
     * @return the decoded parts
     * @throws MalformedTokenException if the token does not have three valid segments
     */
    public DecodedToken decode(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new MalformedTokenException("Token is empty");
        }
        String[] segments = raw.split("\\.", -1);
        if (segments.length != 3) {
            throw new MalformedTokenException("Token must have 3 segments but has " + segments.length);
        }

        TokenHeader header = TokenHeader.fromMap(readObject(decodeSegment(segments[0], "header"), "header"));
        ClaimSet claims = ClaimSet.of(readObject(decodeSegment(segments[1], "payload"), "payload"));
        byte[] signature = decodeSegment(segments[2], "signature");

        return new DecodedToken(header, claims, signature, segments[0] + DELIMITER + segments[1]);
    }

    /**
     * Serializes the parts back into compact form. Inverse of {@link #decode(String)}.
     *
     * @param header    the header
     * @param claims    the claims
     * @param signature the signature bytes, not empty
     * @return the compact token
     */
    public String encode(TokenHeader header, ClaimSet claims, byte[] signature) {
        if (signature == null || signature.length == 0) {
            throw new IllegalArgumentException("Signature must not be empty");
        }
        return signingInput(header, claims) + DELIMITER + ENCODER.encodeToString(signature);
    }

    /**
     * Returns the text a signature is computed over: the encoded header and payload joined by a dot.
     *
     * @param header the header
     * @param claims the claims
     * @return the signing input
     */
    public String signingInput(TokenHeader header, ClaimSet claims) {
        return encodeJson(header.parameters()) + DELIMITER + encodeJson(claims.asMap());
    }

    private byte[] decodeSegment(String segment, String part) {
        if (segment.isEmpty()) {
            throw new MalformedTokenException("Token " + part + " segment is empty");
        }
        if (segment.indexOf('=') >= 0) {
            throw new MalformedTokenException("Token " + part + " segment must not be padded");
        }
        byte[] bytes;
        try {
            bytes = DECODER.decode(segment);
        } catch (IllegalArgumentException e) {
            throw new MalformedTokenException("Token " + part + " segment is not valid base64url", e);
        }
        // the decoder ignores unused trailing bits, so only the canonical spelling is accepted
        if (!ENCODER.encodeToString(bytes).equals(segment)) {
            throw new MalformedTokenException("Token " + part + " segment is not canonical base64url");
        }
        return bytes;
    }

    private Map<String, Object> readObject(byte[] json, String part) {
        Map<String, Object> value;
        try {
            value = mapper.readValue(json, JSON_OBJECT);
        } catch (IOException e) {
            throw new MalformedTokenException("Token " + part + " is not a JSON object", e);
        }
        if (value == null) {
            throw new MalformedTokenException("Token " + part + " is not a JSON object");
        }
        return value;
    }

    private String encodeJson(Map<String, Object> value) {
        try {
            return ENCODER.encodeToString(mapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Token content is not serializable as JSON", e);
        }
    }
}
