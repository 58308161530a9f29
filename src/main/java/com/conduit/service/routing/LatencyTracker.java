package com.conduit.service.routing;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling average of the last {@code windowSize} call latencies per provider.
 */
public class LatencyTracker {

    private final int windowSize;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public LatencyTracker(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("latency-window must be at least 1");
        }
        this.windowSize = windowSize;
    }

    public void record(String provider, Duration latency) {
        windows.computeIfAbsent(provider, name -> new Window()).add(latency.toMillis());
    }

    /**
     * Average latency in milliseconds, empty if the provider has no samples yet.
     */
    public Optional<Double> averageMillis(String provider) {
        Window window = windows.get(provider);
        return window == null ? Optional.empty() : window.average();
    }

    private final class Window {
        private final Deque<Long> samples = new ArrayDeque<>();
        private long sum;

        synchronized void add(long millis) {
            samples.addLast(millis);
            sum += millis;
            if (samples.size() > windowSize) {
                sum -= samples.pollFirst();
            }
        }

        synchronized Optional<Double> average() {
            return samples.isEmpty() ? Optional.empty() : Optional.of((double) sum / samples.size());
        }
    }
}
