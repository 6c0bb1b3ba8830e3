package com.stockanalyzer.backtester.domain.strategy;

/**
 * Indicator keys produced by the signal provider.
 */
public final class Indicators {

    public static final String SMA_5 = "SMA_5";
    public static final String SMA_25 = "SMA_25";
    public static final String SMA_75 = "SMA_75";
    public static final String RSI = "RSI";
    public static final String MACD_HISTOGRAM = "MACD_histogram";
    public static final String BB_UPPER = "BB_upper";
    public static final String BB_LOWER = "BB_lower";
    public static final String STOCH_K = "Stoch_k";
    public static final String STOCH_D = "Stoch_d";

    private Indicators() {
    }
}
