package com.codeops.gatekeeper.config;

/**
 * Application-wide constants for the CodeOps-Gatekeeper service.
 */
public final class AppConstants {

    private AppConstants() {}

    /** Base path prefix for all Gatekeeper API endpoints. */
    public static final String API_PREFIX = "/api/v1/gatekeeper";

    /** Service name used in health checks and structured logging. */
    public static final String SERVICE_NAME = "codeops-gatekeeper";

    /** Minimum size in bytes of a configured HMAC secret; HS384 and HS512 require more. */
    public static final int MIN_HMAC_SECRET_LENGTH = 32;

    /** Longest inbound correlation id that is propagated as-is. */
    public static final int MAX_CORRELATION_ID_LENGTH = 128;
}
