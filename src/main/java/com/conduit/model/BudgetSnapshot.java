package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time view of a principal's budget.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BudgetSnapshot {

    @JsonProperty("principal")
    String principal;

    @JsonProperty("period")
    BudgetPeriod period;

    /**
     * Null when the principal is unlimited.
     */
    @JsonProperty("limit")
    BigDecimal limit;

    @JsonProperty("spent_so_far")
    BigDecimal spentSoFar;

    @JsonProperty("period_start")
    Instant periodStart;

    @JsonProperty("remaining")
    public BigDecimal remaining() {
        return limit == null ? null : limit.subtract(spentSoFar);
    }
}
