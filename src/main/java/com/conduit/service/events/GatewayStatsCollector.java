package com.conduit.service.events;

import com.conduit.model.GatewayEvent;
import com.conduit.model.GatewayEventType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts events by type and by provider for the admin API.
 */
@Component
public class GatewayStatsCollector implements GatewayEventListener {

    private final Map<GatewayEventType, AtomicLong> byType = new EnumMap<>(GatewayEventType.class);
    private final ConcurrentMap<String, ConcurrentMap<GatewayEventType, AtomicLong>> byProvider = new ConcurrentHashMap<>();

    public GatewayStatsCollector() {
        for (GatewayEventType type : GatewayEventType.values()) {
            byType.put(type, new AtomicLong());
        }
    }

    @Override
    public void onEvent(GatewayEvent event) {
        byType.get(event.getType()).incrementAndGet();
        if (event.getProviderName() != null) {
            byProvider.computeIfAbsent(event.getProviderName(), name -> new ConcurrentHashMap<>())
                    .computeIfAbsent(event.getType(), type -> new AtomicLong())
                    .incrementAndGet();
        }
    }

    public long count(GatewayEventType type) {
        return byType.get(type).get();
    }

    public long count(String provider, GatewayEventType type) {
        Map<GatewayEventType, AtomicLong> counters = byProvider.get(provider);
        if (counters == null) {
            return 0;
        }
        AtomicLong counter = counters.get(type);
        return counter == null ? 0 : counter.get();
    }

    public Map<GatewayEventType, Long> totals() {
        Map<GatewayEventType, Long> totals = new EnumMap<>(GatewayEventType.class);
        byType.forEach((type, counter) -> totals.put(type, counter.get()));
        return totals;
    }

    public Map<String, Map<GatewayEventType, Long>> perProvider() {
        Map<String, Map<GatewayEventType, Long>> result = new TreeMap<>();
        byProvider.forEach((provider, counters) -> {
            Map<GatewayEventType, Long> copy = new EnumMap<>(GatewayEventType.class);
            counters.forEach((type, counter) -> copy.put(type, counter.get()));
            result.put(provider, copy);
        });
        return result;
    }
}
