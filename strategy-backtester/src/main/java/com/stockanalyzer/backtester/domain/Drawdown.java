package com.stockanalyzer.backtester.domain;

import lombok.Value;

/**
 * Largest peak-to-trough decline of an equity curve.
 */
@Value
public class Drawdown {

    public static final Drawdown NONE = new Drawdown(0.0, 0, 0, 0);

    /** Decline as a fraction of the peak, 0 when equity never fell. */
    double depth;
    int peakIndex;
    int troughIndex;
    /** Longest run of bars spent below a previous peak. */
    int longestDurationBars;
}
