package com.conduit.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Reservation would push the principal past its budget limit.
 */
@Getter
public class BudgetExceededException extends GatewayException {

    private final String principal;
    private final BigDecimal requested;
    private final BigDecimal remaining;

    public BudgetExceededException(String principal, BigDecimal requested, BigDecimal remaining) {
        super(ErrorKind.BUDGET_EXCEEDED,
                "Budget exceeded for principal " + principal
                        + ": requested " + requested.toPlainString()
                        + ", remaining " + remaining.toPlainString());
        this.principal = principal;
        this.requested = requested;
        this.remaining = remaining;
    }
}
