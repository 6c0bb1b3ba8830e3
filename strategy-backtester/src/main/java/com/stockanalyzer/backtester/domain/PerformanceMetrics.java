package com.stockanalyzer.backtester.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Calculator for backtest performance statistics.
 * All functions are pure; undefined results come back as {@code NaN}.
 */
public final class PerformanceMetrics {

    private PerformanceMetrics() {
    }

    /**
     * Per-step simple returns of the equity curve. Steps starting from non-positive equity are skipped.
     */
    public static double[] calculateReturns(List<EquityPoint> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1).getEquity().doubleValue();
            double current = equityCurve.get(i).getEquity().doubleValue();
            if (previous > 0) {
                returns.add((current - previous) / previous);
            }
        }
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Calculate total return percentage.
     */
    public static double calculateTotalReturn(BigDecimal initialCapital, BigDecimal finalValue) {
        if (initialCapital.signum() == 0) {
            return Double.NaN;
        }
        return finalValue.subtract(initialCapital)
                .divide(initialCapital, 10, RoundingMode.HALF_UP)
                .doubleValue() * 100;
    }

    /**
     * Compound annual growth rate in percent over {@code steps} periods.
     */
    public static double calculateAnnualizedReturn(BigDecimal initialCapital, BigDecimal finalValue,
                                                   int steps, int periodsPerYear) {
        if (steps <= 0 || initialCapital.signum() <= 0) {
            return Double.NaN;
        }
        double growth = finalValue.doubleValue() / initialCapital.doubleValue();
        if (growth <= 0) {
            return -100.0;
        }
        double years = (double) steps / periodsPerYear;
        return (Math.pow(growth, 1.0 / years) - 1.0) * 100;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return Arrays.stream(values).sum() / values.length;
    }

    /**
     * Population standard deviation.
     */
    public static double standardDeviation(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sumSquaredDiff = Arrays.stream(values).map(v -> (v - mean) * (v - mean)).sum();
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Root mean square of the negative returns, with zero as the target.
     */
    public static double downsideDeviation(double[] returns) {
        if (returns.length == 0) {
            return Double.NaN;
        }
        double sum = Arrays.stream(returns).map(r -> Math.min(r, 0.0)).map(r -> r * r).sum();
        return Math.sqrt(sum / returns.length);
    }

    /**
     * Annualized volatility in percent.
     */
    public static double calculateVolatility(double[] returns, int periodsPerYear) {
        return standardDeviation(returns) * Math.sqrt(periodsPerYear) * 100;
    }

    /**
     * Sharpe ratio: mean excess return over per-step volatility, annualized.
     * Undefined when volatility is zero.
     */
    public static double calculateSharpeRatio(double[] returns, double riskFreeRate, int periodsPerYear) {
        double stdDev = standardDeviation(returns);
        if (Double.isNaN(stdDev) || stdDev == 0) {
            return Double.NaN;
        }
        double excess = mean(returns) - riskFreeRate / periodsPerYear;
        return excess / stdDev * Math.sqrt(periodsPerYear);
    }

    /**
     * Sortino ratio: like Sharpe but divided by the downside deviation only.
     */
    public static double calculateSortinoRatio(double[] returns, double riskFreeRate, int periodsPerYear) {
        double downside = downsideDeviation(returns);
        if (Double.isNaN(downside) || downside == 0) {
            return Double.NaN;
        }
        double excess = mean(returns) - riskFreeRate / periodsPerYear;
        return excess / downside * Math.sqrt(periodsPerYear);
    }

    /**
     * Calculate maximum drawdown with its peak and trough positions.
     */
    public static Drawdown calculateMaxDrawdown(List<EquityPoint> equityCurve) {
        if (equityCurve.isEmpty()) {
            return Drawdown.NONE;
        }

        double maxDepth = 0.0;
        int maxPeak = 0;
        int maxTrough = 0;
        int longestDuration = 0;

        double peak = equityCurve.get(0).getEquity().doubleValue();
        int peakIndex = 0;
        int duration = 0;

        for (int i = 1; i < equityCurve.size(); i++) {
            double value = equityCurve.get(i).getEquity().doubleValue();
            if (value >= peak) {
                peak = value;
                peakIndex = i;
                duration = 0;
                continue;
            }
            duration++;
            longestDuration = Math.max(longestDuration, duration);
            if (peak > 0) {
                double depth = (peak - value) / peak;
                if (depth > maxDepth) {
                    maxDepth = depth;
                    maxPeak = peakIndex;
                    maxTrough = i;
                }
            }
        }

        return new Drawdown(maxDepth, maxPeak, maxTrough, longestDuration);
    }

    /**
     * Historical percentile with linear interpolation between closest ranks.
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * Mean of the returns at or below the given percentile.
     */
    public static double conditionalValueAtRisk(double[] returns, double percentile) {
        double threshold = percentile(returns, percentile);
        if (Double.isNaN(threshold)) {
            return Double.NaN;
        }
        return mean(Arrays.stream(returns).filter(r -> r <= threshold).toArray());
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    /**
     * Sample-adjusted skewness over the population standard deviation.
     * Undefined for fewer than three values or zero dispersion.
     */
    public static double skewness(double[] values) {
        int n = values.length;
        double std = standardDeviation(values);
        if (n < 3 || !(std > 0)) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sum = Arrays.stream(values).map(v -> Math.pow((v - mean) / std, 3)).sum();
        return (double) n / ((n - 1) * (n - 2)) * sum;
    }

    /**
     * Sample-adjusted excess kurtosis over the population standard deviation.
     * Undefined for fewer than four values or zero dispersion.
     */
    public static double kurtosis(double[] values) {
        int n = values.length;
        double std = standardDeviation(values);
        if (n < 4 || !(std > 0)) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sum = Arrays.stream(values).map(v -> Math.pow((v - mean) / std, 4)).sum();
        double scale = (double) n * (n + 1) / ((double) (n - 1) * (n - 2) * (n - 3));
        double correction = 3.0 * (n - 1) * (n - 1) / ((double) (n - 2) * (n - 3));
        return scale * sum - correction;
    }

    /**
     * Realized P&amp;L of closing trades summed per calendar month of the exit date.
     */
    public static SortedMap<YearMonth, BigDecimal> calculateMonthlyPnl(List<Trade> closingTrades) {
        SortedMap<YearMonth, BigDecimal> monthly = new TreeMap<>();
        for (Trade trade : closingTrades) {
            monthly.merge(YearMonth.from(trade.getDate()), trade.getRealizedPnl(), BigDecimal::add);
        }
        return monthly;
    }

    /**
     * Longest streaks of winning and of non-winning closing trades, in that order.
     */
    public static int[] calculateConsecutiveStreaks(List<Trade> closingTrades) {
        int maxWins = 0;
        int maxLosses = 0;
        int wins = 0;
        int losses = 0;
        for (Trade trade : closingTrades) {
            if (trade.getRealizedPnl().signum() > 0) {
                wins++;
                losses = 0;
            } else {
                losses++;
                wins = 0;
            }
            maxWins = Math.max(maxWins, wins);
            maxLosses = Math.max(maxLosses, losses);
        }
        return new int[]{maxWins, maxLosses};
    }

    /**
     * Round to 4 decimals; {@code null} for NaN or infinite values.
     */
    public static BigDecimal toMetric(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }
}
