package com.stockanalyzer.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Engine settings for one run. Validated before the first bar is processed.
 */
@Value
@Builder(toBuilder = true)
public class BacktestConfig {

    @Builder.Default
    BigDecimal initialCash = new BigDecimal("1000000");

    @Builder.Default
    CostModel costModel = CostModel.NONE;

    @Builder.Default
    BigDecimal fixedFee = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal proportionalRate = BigDecimal.ZERO;

    @Builder.Default
    FillPolicy fillPolicy = FillPolicy.NEXT_OPEN;

    @Builder.Default
    SizingPolicy sizingPolicy = SizingPolicy.FIXED_FRACTION;

    @Builder.Default
    BigDecimal positionFraction = new BigDecimal("0.95");

    @Builder.Default
    long fixedQuantity = 0;

    @Builder.Default
    boolean closeAtEnd = false;

    /** Annual risk-free rate used by the risk-adjusted ratios. */
    @Builder.Default
    double riskFreeRate = 0.001;

    /** Bars per year of the series, e.g. 252 for daily bars. */
    @Builder.Default
    int periodsPerYear = 252;

    public static BacktestConfig defaults() {
        return BacktestConfig.builder().build();
    }

    /**
     * Cost of a fill with the given notional value under this configuration.
     */
    public BigDecimal costOf(BigDecimal notional) {
        return costModel.cost(notional, fixedFee, proportionalRate);
    }

    /**
     * @throws BacktestConfigurationException describing the first invalid setting
     */
    public void validate() {
        if (initialCash == null || initialCash.signum() <= 0) {
            throw new BacktestConfigurationException("Initial cash must be positive, got " + initialCash);
        }
        if (costModel == null) {
            throw new BacktestConfigurationException("Cost model is required");
        }
        if (fillPolicy == null) {
            throw new BacktestConfigurationException("Fill policy is required");
        }
        if (sizingPolicy == null) {
            throw new BacktestConfigurationException("Sizing policy is required");
        }
        if (fixedFee == null || fixedFee.signum() < 0) {
            throw new BacktestConfigurationException("Fixed fee must be zero or positive, got " + fixedFee);
        }
        if (proportionalRate == null || proportionalRate.signum() < 0
                || proportionalRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new BacktestConfigurationException("Proportional rate must be in [0, 1), got " + proportionalRate);
        }
        if (costModel.chargesFixedFee() && fixedFee.signum() == 0) {
            throw new BacktestConfigurationException("Cost model " + costModel + " needs a positive fixed fee");
        }
        if (costModel.chargesProportional() && proportionalRate.signum() == 0) {
            throw new BacktestConfigurationException("Cost model " + costModel + " needs a positive proportional rate");
        }
        if (positionFraction == null || positionFraction.signum() <= 0
                || positionFraction.compareTo(BigDecimal.ONE) > 0) {
            throw new BacktestConfigurationException("Position fraction must be in (0, 1], got " + positionFraction);
        }
        if (sizingPolicy == SizingPolicy.FIXED_QUANTITY && fixedQuantity <= 0) {
            throw new BacktestConfigurationException("Fixed quantity sizing needs a positive quantity, got " + fixedQuantity);
        }
        if (Double.isNaN(riskFreeRate) || Double.isInfinite(riskFreeRate)) {
            throw new BacktestConfigurationException("Risk-free rate must be a finite number");
        }
        if (periodsPerYear <= 0) {
            throw new BacktestConfigurationException("Periods per year must be positive, got " + periodsPerYear);
        }
    }

    /**
     * Parse a policy name such as {@code "next-open"} or {@code "NEXT_OPEN"}.
     *
     * @throws BacktestConfigurationException for names that match no constant
     */
    public static <E extends Enum<E>> E parsePolicy(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            throw new BacktestConfigurationException(type.getSimpleName() + " must not be blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new BacktestConfigurationException("Unknown " + type.getSimpleName() + ": " + value, e);
        }
    }
}
