package com.conduit.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-request cache control preferences, usually taken from request headers.
 */
@Value
@Builder
public class CacheControlContext {

    /**
     * Skip cache lookup and always go to a provider.
     */
    @Builder.Default
    boolean bypass = false;

    /**
     * Store the provider response in the cache.
     * Disabled for sensitive queries that shouldn't be cached.
     */
    @Builder.Default
    boolean store = true;

    public static CacheControlContext defaults() {
        return CacheControlContext.builder().build();
    }

    public boolean shouldLookup() {
        return !bypass;
    }
}
