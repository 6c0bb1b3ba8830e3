package com.stockanalyzer.backtester.domain;

public enum SizingPolicy {
    /** Spend a fraction of available cash; the action's own fraction wins when given. */
    FIXED_FRACTION,
    /** Spend all available cash. */
    ALL_IN,
    /** Buy a configured number of shares. */
    FIXED_QUANTITY
}
