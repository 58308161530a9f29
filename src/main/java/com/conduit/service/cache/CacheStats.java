package com.conduit.service.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Response cache counters since startup.
 */
@Value
@Builder
public class CacheStats {

    @JsonProperty("store")
    String store;

    @JsonProperty("entries")
    long entries;

    @JsonProperty("hits")
    long hits;

    @JsonProperty("misses")
    long misses;

    @JsonProperty("puts")
    long puts;

    @JsonProperty("expired")
    long expired;

    @JsonProperty("capacity_evictions")
    long capacityEvictions;

    @JsonProperty("store_errors")
    long storeErrors;

    @JsonProperty("hit_rate")
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
