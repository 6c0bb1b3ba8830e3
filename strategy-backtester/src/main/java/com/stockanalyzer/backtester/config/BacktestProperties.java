package com.stockanalyzer.backtester.config;

import com.stockanalyzer.backtester.domain.BacktestConfig;
import com.stockanalyzer.backtester.domain.CostModel;
import com.stockanalyzer.backtester.domain.FillPolicy;
import com.stockanalyzer.backtester.domain.SizingPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Default run settings bound from {@code backtest.*}. Request overrides are applied on top of these.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    @NotNull(message = "Initial cash is required")
    @Positive(message = "Initial cash must be positive")
    private BigDecimal initialCash = new BigDecimal("1000000");

    @NotBlank(message = "Cost model is required")
    private String costModel = "none";

    @NotNull
    @PositiveOrZero(message = "Fixed fee cannot be negative")
    private BigDecimal fixedFee = BigDecimal.ZERO;

    @NotNull
    @DecimalMin(value = "0", message = "Proportional rate cannot be negative")
    @DecimalMax(value = "1", inclusive = false, message = "Proportional rate must be below 1")
    private BigDecimal proportionalRate = BigDecimal.ZERO;

    @NotBlank(message = "Fill policy is required")
    private String fillPolicy = "next-open";

    @NotBlank(message = "Sizing policy is required")
    private String sizingPolicy = "fixed-fraction";

    @NotNull
    @DecimalMin(value = "0", inclusive = false, message = "Position fraction must be positive")
    @DecimalMax(value = "1", message = "Position fraction cannot exceed 1")
    private BigDecimal positionFraction = new BigDecimal("0.95");

    @PositiveOrZero
    private long fixedQuantity = 0;

    private boolean closeAtEnd = false;

    private double riskFreeRate = 0.001;

    @Positive(message = "Periods per year must be positive")
    private int periodsPerYear = 252;

    /**
     * @throws com.stockanalyzer.backtester.domain.BacktestConfigurationException for unknown policy names
     */
    public BacktestConfig toConfig() {
        return BacktestConfig.builder()
                .initialCash(initialCash)
                .costModel(BacktestConfig.parsePolicy(CostModel.class, costModel))
                .fixedFee(fixedFee)
                .proportionalRate(proportionalRate)
                .fillPolicy(BacktestConfig.parsePolicy(FillPolicy.class, fillPolicy))
                .sizingPolicy(BacktestConfig.parsePolicy(SizingPolicy.class, sizingPolicy))
                .positionFraction(positionFraction)
                .fixedQuantity(fixedQuantity)
                .closeAtEnd(closeAtEnd)
                .riskFreeRate(riskFreeRate)
                .periodsPerYear(periodsPerYear)
                .build();
    }
}
