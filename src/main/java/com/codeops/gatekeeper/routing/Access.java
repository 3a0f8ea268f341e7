package com.codeops.gatekeeper.routing;

/**
 * Whether a route can be reached without an authenticated context.
 */
public enum Access {
    PUBLIC,
    AUTHENTICATED
}
