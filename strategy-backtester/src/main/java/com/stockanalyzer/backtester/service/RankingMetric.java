package com.stockanalyzer.backtester.service;

import com.stockanalyzer.backtester.domain.BacktestConfigurationException;
import com.stockanalyzer.backtester.domain.PerformanceReport;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.function.Function;

/**
 * Report metrics a comparison can be ranked by.
 */
public enum RankingMetric {

    TOTAL_RETURN("totalReturn", PerformanceReport::getTotalReturnPct, false),
    ANNUALIZED_RETURN("annualizedReturn", PerformanceReport::getAnnualizedReturnPct, false),
    SHARPE_RATIO("sharpeRatio", PerformanceReport::getSharpeRatio, false),
    SORTINO_RATIO("sortinoRatio", PerformanceReport::getSortinoRatio, false),
    WIN_RATE("winRate", PerformanceReport::getWinRate, false),
    PROFIT_FACTOR("profitFactor", PerformanceReport::getProfitFactor, false),
    MAX_DRAWDOWN("maxDrawdown", PerformanceReport::getMaxDrawdownPct, true);

    private final String key;
    private final Function<PerformanceReport, BigDecimal> extractor;
    private final boolean lowerIsBetter;

    RankingMetric(String key, Function<PerformanceReport, BigDecimal> extractor, boolean lowerIsBetter) {
        this.key = key;
        this.extractor = extractor;
        this.lowerIsBetter = lowerIsBetter;
    }

    public String getKey() {
        return key;
    }

    public boolean isLowerBetter() {
        return lowerIsBetter;
    }

    /**
     * Value of this metric in the report, {@code null} when it is undefined.
     */
    public BigDecimal valueOf(PerformanceReport report) {
        return extractor.apply(report);
    }

    /**
     * Look up a metric by its key ({@code "sharpeRatio"}) or constant name ({@code "SHARPE_RATIO"}).
     *
     * @throws BacktestConfigurationException for an unknown name
     */
    public static RankingMetric fromName(String name) {
        if (name == null || name.isBlank()) {
            return SHARPE_RATIO;
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(m -> m.key.equalsIgnoreCase(trimmed) || m.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new BacktestConfigurationException("Unknown optimization metric: " + name));
    }
}
