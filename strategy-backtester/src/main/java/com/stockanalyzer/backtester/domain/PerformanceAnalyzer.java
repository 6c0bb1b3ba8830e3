package com.stockanalyzer.backtester.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns an equity curve and trade log into a {@link PerformanceReport}.
 * Stateless: the risk-free rate and sampling frequency are fixed at construction.
 */
@Slf4j
public class PerformanceAnalyzer {

    private static final double VAR_PERCENTILE = 5.0;

    private final double riskFreeRate;
    private final int periodsPerYear;

    public PerformanceAnalyzer(double riskFreeRate, int periodsPerYear) {
        if (periodsPerYear <= 0) {
            throw new IllegalArgumentException("Periods per year must be positive, got " + periodsPerYear);
        }
        this.riskFreeRate = riskFreeRate;
        this.periodsPerYear = periodsPerYear;
    }

    public static PerformanceAnalyzer forConfig(BacktestConfig config) {
        return new PerformanceAnalyzer(config.getRiskFreeRate(), config.getPeriodsPerYear());
    }

    public PerformanceReport analyze(BacktestResult result) {
        return analyze(result.getEquityCurve(), result.getTradeLog(), result.getConfig().getInitialCash());
    }

    public PerformanceReport analyze(List<EquityPoint> equityCurve, TradeLog tradeLog, BigDecimal initialCash) {
        if (equityCurve == null || equityCurve.isEmpty()) {
            throw new IllegalArgumentException("Equity curve is empty");
        }
        if (initialCash == null || initialCash.signum() <= 0) {
            throw new IllegalArgumentException("Initial cash must be positive, got " + initialCash);
        }

        Set<Metric> undefined = EnumSet.noneOf(Metric.class);
        EquityPoint first = equityCurve.get(0);
        EquityPoint last = equityCurve.get(equityCurve.size() - 1);
        BigDecimal finalEquity = last.getEquity();

        double[] returns = PerformanceMetrics.calculateReturns(equityCurve);
        double totalReturn = PerformanceMetrics.calculateTotalReturn(initialCash, finalEquity);
        double annualized = PerformanceMetrics.calculateAnnualizedReturn(
                initialCash, finalEquity, equityCurve.size() - 1, periodsPerYear);
        Drawdown drawdown = PerformanceMetrics.calculateMaxDrawdown(equityCurve);
        double maxDrawdownPct = drawdown.getDepth() * 100;
        double calmar = maxDrawdownPct > 0 ? annualized / maxDrawdownPct : Double.NaN;

        List<Trade> closing = tradeLog.getClosingTrades();
        List<BigDecimal> wins = closing.stream().map(Trade::getRealizedPnl).filter(p -> p.signum() > 0).toList();
        List<BigDecimal> losses = closing.stream().map(Trade::getRealizedPnl).filter(p -> p.signum() < 0).toList();
        BigDecimal grossProfit = sum(wins);
        BigDecimal grossLoss = sum(losses).abs();
        BigDecimal averageWin = average(wins);
        BigDecimal averageLoss = average(losses);
        BigDecimal netRealized = closing.stream().map(Trade::getRealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
        int[] streaks = PerformanceMetrics.calculateConsecutiveStreaks(closing);

        BigDecimal totalCosts = tradeLog.getTrades().stream()
                .map(Trade::getCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        List<BigDecimal> monthly = new ArrayList<>(PerformanceMetrics.calculateMonthlyPnl(closing).values());
        long winningMonths = monthly.stream().filter(p -> p.signum() > 0).count();
        double[] monthlyValues = monthly.stream().mapToDouble(BigDecimal::doubleValue).toArray();
        double[] tradeReturns = closing.stream()
                .map(Trade::getRealizedPnlPct)
                .filter(Objects::nonNull)
                .mapToDouble(BigDecimal::doubleValue)
                .toArray();

        long investedBars = equityCurve.stream().filter(EquityPoint::isInvested).count();
        double buyAndHold = (last.getClose().doubleValue() - first.getClose().doubleValue())
                / first.getClose().doubleValue() * 100;

        PerformanceReport report = PerformanceReport.builder()
                .initialCash(initialCash)
                .finalEquity(finalEquity)
                .totalReturnPct(PerformanceMetrics.toMetric(totalReturn))
                .annualizedReturnPct(metric(Metric.ANNUALIZED_RETURN, annualized, undefined))
                .volatilityPct(metric(Metric.VOLATILITY,
                        PerformanceMetrics.calculateVolatility(returns, periodsPerYear), undefined))
                .sharpeRatio(metric(Metric.SHARPE_RATIO,
                        PerformanceMetrics.calculateSharpeRatio(returns, riskFreeRate, periodsPerYear), undefined))
                .sortinoRatio(metric(Metric.SORTINO_RATIO,
                        PerformanceMetrics.calculateSortinoRatio(returns, riskFreeRate, periodsPerYear), undefined))
                .calmarRatio(metric(Metric.CALMAR_RATIO, calmar, undefined))
                .maxDrawdownPct(PerformanceMetrics.toMetric(maxDrawdownPct))
                .maxDrawdownPeakIndex(drawdown.getPeakIndex())
                .maxDrawdownTroughIndex(drawdown.getTroughIndex())
                .maxDrawdownDurationBars(drawdown.getLongestDurationBars())
                .valueAtRisk95Pct(metric(Metric.VALUE_AT_RISK,
                        PerformanceMetrics.percentile(returns, VAR_PERCENTILE) * 100, undefined))
                .conditionalValueAtRisk95Pct(metric(Metric.CONDITIONAL_VALUE_AT_RISK,
                        PerformanceMetrics.conditionalValueAtRisk(returns, VAR_PERCENTILE) * 100, undefined))
                .totalTrades(tradeLog.getTrades().size())
                .closingTrades(closing.size())
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .rejectedActions(tradeLog.getRejections().size())
                .winRate(closing.isEmpty() ? undefined(Metric.WIN_RATE, undefined)
                        : ratio(BigDecimal.valueOf(wins.size()), BigDecimal.valueOf(closing.size())))
                .averageWin(defined(Metric.AVERAGE_WIN, averageWin, undefined))
                .averageLoss(defined(Metric.AVERAGE_LOSS, averageLoss, undefined))
                .largestWin(defined(Metric.LARGEST_WIN,
                        wins.stream().max(BigDecimal::compareTo).orElse(null), undefined))
                .largestLoss(defined(Metric.LARGEST_LOSS,
                        losses.stream().min(BigDecimal::compareTo).orElse(null), undefined))
                .grossProfit(grossProfit)
                .grossLoss(grossLoss)
                .profitFactor(grossLoss.signum() == 0 ? undefined(Metric.PROFIT_FACTOR, undefined)
                        : ratio(grossProfit, grossLoss))
                .payoffRatio(averageWin == null || averageLoss == null ? undefined(Metric.PAYOFF_RATIO, undefined)
                        : ratio(averageWin, averageLoss.abs()))
                .expectancy(closing.isEmpty() ? undefined(Metric.EXPECTANCY, undefined)
                        : ratio(netRealized, BigDecimal.valueOf(closing.size())))
                .maxConsecutiveWins(streaks[0])
                .maxConsecutiveLosses(streaks[1])
                .averageHoldingBars(closing.isEmpty() ? undefined(Metric.AVERAGE_HOLDING_BARS, undefined)
                        : PerformanceMetrics.toMetric(closing.stream()
                                .filter(t -> t.getHoldingBars() != null)
                                .mapToInt(Trade::getHoldingBars)
                                .average()
                                .orElse(Double.NaN)))
                .totalCosts(totalCosts)
                .exposurePct(PerformanceMetrics.toMetric((double) investedBars / equityCurve.size() * 100))
                .buyAndHoldReturnPct(PerformanceMetrics.toMetric(buyAndHold))
                .alphaPct(PerformanceMetrics.toMetric(totalReturn - buyAndHold))
                .totalMonths(monthly.size())
                .winningMonths((int) winningMonths)
                .monthlyWinRate(monthly.isEmpty() ? undefined(Metric.MONTHLY_WIN_RATE, undefined)
                        : ratio(BigDecimal.valueOf(winningMonths), BigDecimal.valueOf(monthly.size())))
                .averageMonthlyPnl(defined(Metric.AVERAGE_MONTHLY_PNL, average(monthly), undefined))
                .bestMonthPnl(defined(Metric.BEST_MONTH_PNL,
                        monthly.stream().max(BigDecimal::compareTo).orElse(null), undefined))
                .worstMonthPnl(defined(Metric.WORST_MONTH_PNL,
                        monthly.stream().min(BigDecimal::compareTo).orElse(null), undefined))
                .monthlyPnlVolatility(metric(Metric.MONTHLY_PNL_VOLATILITY,
                        PerformanceMetrics.standardDeviation(monthlyValues), undefined))
                .tradeReturnMinPct(metric(Metric.TRADE_RETURN_MIN,
                        Arrays.stream(tradeReturns).min().orElse(Double.NaN), undefined))
                .tradeReturnMaxPct(metric(Metric.TRADE_RETURN_MAX,
                        Arrays.stream(tradeReturns).max().orElse(Double.NaN), undefined))
                .tradeReturnMedianPct(metric(Metric.TRADE_RETURN_MEDIAN,
                        PerformanceMetrics.median(tradeReturns), undefined))
                .tradeReturnStdPct(metric(Metric.TRADE_RETURN_STD,
                        PerformanceMetrics.standardDeviation(tradeReturns), undefined))
                .tradeReturnSkewness(metric(Metric.TRADE_RETURN_SKEWNESS,
                        PerformanceMetrics.skewness(tradeReturns), undefined))
                .tradeReturnKurtosis(metric(Metric.TRADE_RETURN_KURTOSIS,
                        PerformanceMetrics.kurtosis(tradeReturns), undefined))
                .undefinedMetrics(undefined)
                .equityCurve(equityCurve)
                .tradeLog(tradeLog)
                .build();

        log.debug("Performance - Total Return: {}%, CAGR: {}%, Sharpe: {}, Max DD: {}%, Win Rate: {}, Undefined: {}",
                report.getTotalReturnPct(), report.getAnnualizedReturnPct(), report.getSharpeRatio(),
                report.getMaxDrawdownPct(), report.getWinRate(), undefined);
        return report;
    }

    private static BigDecimal metric(Metric metric, double value, Set<Metric> undefined) {
        return defined(metric, PerformanceMetrics.toMetric(value), undefined);
    }

    private static BigDecimal defined(Metric metric, BigDecimal value, Set<Metric> undefined) {
        if (value == null) {
            undefined.add(metric);
        }
        return value;
    }

    private static BigDecimal undefined(Metric metric, Set<Metric> undefined) {
        undefined.add(metric);
        return null;
    }

    private static BigDecimal sum(List<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return null;
        }
        return ratio(sum(values), BigDecimal.valueOf(values.size()));
    }

    private static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, 4, RoundingMode.HALF_UP);
    }
}
