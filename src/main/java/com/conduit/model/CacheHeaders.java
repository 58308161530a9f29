package com.conduit.model;

/**
 * HTTP header names for cache control and provenance.
 */
public final class CacheHeaders {

    private CacheHeaders() {
    }

    // Request headers
    public static final String CACHE_BYPASS = "x-cache-bypass";
    public static final String CACHE_STORE = "x-cache-store";

    // Response headers
    public static final String CACHE_HIT = "x-cache-hit";
    public static final String PROVIDER = "x-provider";
    public static final String REQUEST_ID = "x-request-id";
}
