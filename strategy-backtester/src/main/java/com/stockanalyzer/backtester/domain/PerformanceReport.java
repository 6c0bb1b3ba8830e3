package com.stockanalyzer.backtester.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Summary statistics of one finished run.
 * <p>
 * Percent fields are already multiplied by 100. A metric that cannot be computed (zero
 * denominator, no closing trades) is {@code null} and listed in {@link #undefinedMetrics}.
 */
@Value
@Builder
public class PerformanceReport {

    BigDecimal initialCash;
    BigDecimal finalEquity;
    BigDecimal totalReturnPct;
    BigDecimal annualizedReturnPct;
    BigDecimal volatilityPct;
    BigDecimal sharpeRatio;
    BigDecimal sortinoRatio;
    BigDecimal calmarRatio;

    BigDecimal maxDrawdownPct;
    int maxDrawdownPeakIndex;
    int maxDrawdownTroughIndex;
    int maxDrawdownDurationBars;

    BigDecimal valueAtRisk95Pct;
    BigDecimal conditionalValueAtRisk95Pct;

    int totalTrades;
    int closingTrades;
    int winningTrades;
    int losingTrades;
    int rejectedActions;

    BigDecimal winRate;
    BigDecimal averageWin;
    BigDecimal averageLoss;
    BigDecimal largestWin;
    BigDecimal largestLoss;
    BigDecimal grossProfit;
    BigDecimal grossLoss;
    BigDecimal profitFactor;
    BigDecimal payoffRatio;
    BigDecimal expectancy;
    int maxConsecutiveWins;
    int maxConsecutiveLosses;
    BigDecimal averageHoldingBars;
    BigDecimal totalCosts;
    BigDecimal exposurePct;

    BigDecimal buyAndHoldReturnPct;
    BigDecimal alphaPct;

    int totalMonths;
    int winningMonths;
    BigDecimal monthlyWinRate;
    BigDecimal averageMonthlyPnl;
    BigDecimal bestMonthPnl;
    BigDecimal worstMonthPnl;
    BigDecimal monthlyPnlVolatility;

    BigDecimal tradeReturnMinPct;
    BigDecimal tradeReturnMaxPct;
    BigDecimal tradeReturnMedianPct;
    BigDecimal tradeReturnStdPct;
    BigDecimal tradeReturnSkewness;
    BigDecimal tradeReturnKurtosis;

    @Singular
    Set<Metric> undefinedMetrics;

    List<EquityPoint> equityCurve;
    TradeLog tradeLog;

    public boolean isUndefined(Metric metric) {
        return undefinedMetrics.contains(metric);
    }
}
