package com.stockanalyzer.backtester.domain;

/**
 * Price at which an order decided on bar {@code t} executes. Orders always execute on
 * bar {@code t + 1}; the signal bar's own close is never used.
 */
public enum FillPolicy {
    /** Open of the bar after the signal. */
    NEXT_OPEN,
    /** Close of the execution bar, one bar after the signal. */
    SAME_CLOSE
}
