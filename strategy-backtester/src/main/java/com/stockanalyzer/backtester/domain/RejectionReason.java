package com.stockanalyzer.backtester.domain;

/**
 * Why the engine degraded a strategy's action to HOLD.
 */
public enum RejectionReason {
    /** SELL issued without an open position. */
    NO_POSITION,
    /** Not enough cash to pay for the order and its costs. */
    INSUFFICIENT_CASH,
    /** Sizing rounded the order down to zero shares. */
    ZERO_QUANTITY,
    /** Signal on the last bar, nothing left to fill on. */
    NO_FILL_BAR,
    /** The position already holds as many shares as a {@code long} can count. */
    POSITION_LIMIT
}
