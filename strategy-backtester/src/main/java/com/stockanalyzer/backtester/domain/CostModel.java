package com.stockanalyzer.backtester.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Transaction cost applied to every fill.
 */
public enum CostModel {
    NONE,
    FIXED_FEE,
    PROPORTIONAL,
    BOTH;

    /**
     * Cost of a fill with the given notional value, rounded to 4 decimals.
     */
    public BigDecimal cost(BigDecimal notional, BigDecimal fixedFee, BigDecimal proportionalRate) {
        BigDecimal cost = switch (this) {
            case NONE -> BigDecimal.ZERO;
            case FIXED_FEE -> fixedFee;
            case PROPORTIONAL -> notional.multiply(proportionalRate);
            case BOTH -> fixedFee.add(notional.multiply(proportionalRate));
        };
        return cost.setScale(4, RoundingMode.HALF_UP);
    }

    public boolean chargesFixedFee() {
        return this == FIXED_FEE || this == BOTH;
    }

    public boolean chargesProportional() {
        return this == PROPORTIONAL || this == BOTH;
    }
}
