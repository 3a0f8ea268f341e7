package com.codeops.gatekeeper.token;

import com.codeops.gatekeeper.exception.MalformedTokenException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decoded token header. {@code alg} is mandatory; all other parameters are kept as-is.
 *
 * @param algorithm  the {@code alg} parameter, exactly as written in the token
 * @param parameters every header parameter, {@code alg} included
 */
public record TokenHeader(String algorithm, Map<String, Object> parameters) {

    public static final String ALGORITHM = "alg";
    public static final String TYPE = "typ";
    public static final String KEY_ID = "kid";

    public TokenHeader {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Creates a header carrying only the {@code alg} parameter.
     *
     * @param algorithm the algorithm name
     * @return the header
     */
    public static TokenHeader of(String algorithm) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(ALGORITHM, algorithm);
        return new TokenHeader(algorithm, parameters);
    }

    /**
     * Builds a header from decoded JSON.
     *
     * @param parameters the header object
     * @return the header
     * @throws MalformedTokenException if {@code alg} is missing or not a non-empty string
     */
    public static TokenHeader fromMap(Map<String, Object> parameters) {
        Object algorithm = parameters.get(ALGORITHM);
        if (!(algorithm instanceof String name) || name.isEmpty()) {
            throw new MalformedTokenException("Token header has no valid 'alg' parameter");
        }
        return new TokenHeader(name, parameters);
    }

    public Optional<String> type() {
        return stringParameter(TYPE);
    }

    public Optional<String> keyId() {
        return stringParameter(KEY_ID);
    }

    private Optional<String> stringParameter(String name) {
        Object value = parameters.get(name);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }
}
