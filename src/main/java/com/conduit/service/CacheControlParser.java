package com.conduit.service;

import com.conduit.model.CacheControlContext;
import com.conduit.model.CacheHeaders;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Parses cache control headers from HTTP requests:
 * - x-cache-bypass: skip cache lookup
 * - x-cache-store: control response storage
 */
@Slf4j
@Service
public class CacheControlParser {

    /**
     * @param headers HTTP request headers
     * @return parsed cache control context (never null)
     */
    public CacheControlContext parse(HttpHeaders headers) {
        CacheControlContext.CacheControlContextBuilder builder = CacheControlContext.builder();

        String bypass = headers.getFirst(CacheHeaders.CACHE_BYPASS);
        if (bypass != null) {
            boolean value = parseBoolean(bypass, false);
            builder.bypass(value);
            if (value) {
                log.debug("Cache bypass requested via header");
            }
        }

        String store = headers.getFirst(CacheHeaders.CACHE_STORE);
        if (store != null) {
            boolean value = parseBoolean(store, true);
            builder.store(value);
            if (!value) {
                log.debug("Cache storage disabled via header");
            }
        }

        return builder.build();
    }

    /**
     * Accepts true/false, 1/0, yes/no, on/off (case-insensitive).
     */
    private boolean parseBoolean(String value, boolean defaultValue) {
        if (value.isBlank()) {
            return defaultValue;
        }

        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> {
                log.warn("Invalid boolean value: {}, using default: {}", value, defaultValue);
                yield defaultValue;
            }
        };
    }
}
