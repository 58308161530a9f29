package com.conduit.service.registry;

import com.conduit.provider.ProviderAdapter;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Static registration of one provider: capability metadata plus its adapter.
 */
@Value
@Builder
public class RegisteredProvider {

    String name;

    Set<String> capabilities;

    @Builder.Default
    BigDecimal costPer1kInput = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal costPer1kOutput = BigDecimal.ZERO;

    @Builder.Default
    int maxConcurrency = 16;

    ProviderAdapter adapter;
}
