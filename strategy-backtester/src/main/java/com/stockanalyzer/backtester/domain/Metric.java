package com.stockanalyzer.backtester.domain;

/**
 * Metrics of a {@link PerformanceReport} that can be undefined.
 */
public enum Metric {
    ANNUALIZED_RETURN,
    VOLATILITY,
    SHARPE_RATIO,
    SORTINO_RATIO,
    CALMAR_RATIO,
    VALUE_AT_RISK,
    CONDITIONAL_VALUE_AT_RISK,
    WIN_RATE,
    AVERAGE_WIN,
    AVERAGE_LOSS,
    LARGEST_WIN,
    LARGEST_LOSS,
    PROFIT_FACTOR,
    PAYOFF_RATIO,
    EXPECTANCY,
    AVERAGE_HOLDING_BARS,
    MONTHLY_WIN_RATE,
    AVERAGE_MONTHLY_PNL,
    BEST_MONTH_PNL,
    WORST_MONTH_PNL,
    MONTHLY_PNL_VOLATILITY,
    TRADE_RETURN_MIN,
    TRADE_RETURN_MAX,
    TRADE_RETURN_MEDIAN,
    TRADE_RETURN_STD,
    TRADE_RETURN_SKEWNESS,
    TRADE_RETURN_KURTOSIS
}
