package com.conduit.service.registry;

import com.conduit.exception.CapacityExceededException;
import com.conduit.model.CircuitState;
import com.conduit.model.ProviderDescriptor;
import com.conduit.provider.ProviderAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds configured providers, their capability metadata and in-flight counters.
 * Registration is static: the set is fixed at construction.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final ProviderHealthView health;

    public ProviderRegistry(List<RegisteredProvider> providers, ProviderHealthView health) {
        this.health = health;
        int order = 0;
        for (RegisteredProvider provider : providers) {
            if (provider.getName() == null || provider.getName().isBlank()) {
                throw new IllegalArgumentException("Provider name must not be blank");
            }
            if (provider.getMaxConcurrency() <= 0) {
                throw new IllegalArgumentException("Provider " + provider.getName() + " needs max-concurrency > 0");
            }
            if (slots.containsKey(provider.getName())) {
                throw new IllegalArgumentException("Duplicate provider name: " + provider.getName());
            }
            slots.put(provider.getName(), new Slot(provider, order++));
        }

        log.info("Initialized ProviderRegistry with {} providers: {}", slots.size(), slots.keySet());
    }

    /**
     * Providers advertising {@code tag} whose circuit is not open, in registration order.
     */
    public List<ProviderDescriptor> listCapable(String tag) {
        return listCapable(Set.of(tag));
    }

    /**
     * Providers advertising every tag whose circuit is not open, in registration order.
     */
    public List<ProviderDescriptor> listCapable(Collection<String> tags) {
        List<ProviderDescriptor> capable = new ArrayList<>();
        for (Slot slot : slots.values()) {
            ProviderDescriptor descriptor = slot.describe();
            if (!descriptor.supportsAll(tags)) {
                continue;
            }
            if (descriptor.getHealthState() == CircuitState.OPEN) {
                log.debug("Skipping provider {}: circuit open", descriptor.getName());
                continue;
            }
            capable.add(descriptor);
        }
        return capable;
    }

    /**
     * Take an in-flight slot on a provider.
     *
     * @throws CapacityExceededException if the provider is at max concurrency
     */
    public ProviderLease reserve(String name) {
        Slot slot = slot(name);
        int max = slot.provider.getMaxConcurrency();
        while (true) {
            int current = slot.inflight.get();
            if (current >= max) {
                throw new CapacityExceededException(name, max);
            }
            if (slot.inflight.compareAndSet(current, current + 1)) {
                return new ProviderLease(name, () -> release(name));
            }
        }
    }

    /**
     * Return an in-flight slot. Prefer {@link ProviderLease#close()}, which guards against double release.
     */
    public void release(String name) {
        Slot slot = slot(name);
        int after = slot.inflight.updateAndGet(current -> Math.max(0, current - 1));
        log.trace("Released slot on {}, inflight={}", name, after);
    }

    public ProviderAdapter adapterFor(String name) {
        return slot(name).provider.getAdapter();
    }

    public Optional<ProviderDescriptor> find(String name) {
        Slot slot = slots.get(name);
        return slot == null ? Optional.empty() : Optional.of(slot.describe());
    }

    /**
     * Snapshot of every provider, including unhealthy ones.
     */
    public List<ProviderDescriptor> descriptors() {
        List<ProviderDescriptor> all = new ArrayList<>();
        slots.values().forEach(slot -> all.add(slot.describe()));
        return Collections.unmodifiableList(all);
    }

    public int size() {
        return slots.size();
    }

    private Slot slot(String name) {
        Slot slot = slots.get(name);
        if (slot == null) {
            throw new IllegalArgumentException("Unknown provider: " + name);
        }
        return slot;
    }

    private final class Slot {
        private final RegisteredProvider provider;
        private final int order;
        private final Set<String> capabilities;
        private final AtomicInteger inflight = new AtomicInteger();

        private Slot(RegisteredProvider provider, int order) {
            this.provider = provider;
            this.order = order;
            this.capabilities = provider.getCapabilities() == null
                    ? Set.of()
                    : Collections.unmodifiableSet(new LinkedHashSet<>(provider.getCapabilities()));
        }

        private ProviderDescriptor describe() {
            return ProviderDescriptor.builder()
                    .name(provider.getName())
                    .capabilities(capabilities)
                    .costPer1kInput(provider.getCostPer1kInput())
                    .costPer1kOutput(provider.getCostPer1kOutput())
                    .maxConcurrency(provider.getMaxConcurrency())
                    .currentInflight(inflight.get())
                    .healthState(health.stateOf(provider.getName()))
                    .registrationOrder(order)
                    .build();
        }
    }
}
