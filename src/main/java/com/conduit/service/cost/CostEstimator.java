package com.conduit.service.cost;

import com.conduit.model.CompletionRequest;
import com.conduit.model.ProviderDescriptor;
import com.conduit.model.TokenUsage;
import com.conduit.provider.TokenEstimator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prices a request or a completed call against a provider's per-1k-token rates.
 * Estimates assume the full {@code maxTokens} of output, so they bound the actual cost
 * from above as long as the input estimate holds.
 */
public class CostEstimator {

    public static final int SCALE = 6;
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final int defaultMaxTokens;

    public CostEstimator(int defaultMaxTokens) {
        this.defaultMaxTokens = defaultMaxTokens;
    }

    public BigDecimal estimate(CompletionRequest request, ProviderDescriptor provider) {
        long inputTokens = TokenEstimator.estimateInput(request);
        long outputTokens = request.getMaxTokens() != null ? request.getMaxTokens() : defaultMaxTokens;
        return price(provider, inputTokens, outputTokens);
    }

    public BigDecimal actual(ProviderDescriptor provider, TokenUsage usage) {
        return price(provider, usage.getInputTokens(), usage.getOutputTokens());
    }

    public static BigDecimal price(ProviderDescriptor provider, long inputTokens, long outputTokens) {
        BigDecimal input = provider.getCostPer1kInput().multiply(BigDecimal.valueOf(inputTokens));
        BigDecimal output = provider.getCostPer1kOutput().multiply(BigDecimal.valueOf(outputTokens));
        return input.add(output).divide(THOUSAND, SCALE, RoundingMode.HALF_UP);
    }
}
