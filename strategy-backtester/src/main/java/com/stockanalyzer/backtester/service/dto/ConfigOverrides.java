package com.stockanalyzer.backtester.service.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-request settings. Every field is optional; a {@code null} keeps the configured default.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConfigOverrides {

    @Positive(message = "Initial cash must be positive")
    private BigDecimal initialCash;

    private String costModel; // "none", "fixed-fee", "proportional", "both"

    @PositiveOrZero(message = "Fixed fee cannot be negative")
    private BigDecimal fixedFee;

    @DecimalMin(value = "0", message = "Proportional rate cannot be negative")
    @DecimalMax(value = "1", inclusive = false, message = "Proportional rate must be below 1")
    private BigDecimal proportionalRate;

    private String fillPolicy; // "next-open", "same-close"

    private String sizingPolicy; // "fixed-fraction", "all-in", "fixed-quantity"

    @DecimalMin(value = "0", inclusive = false, message = "Position fraction must be positive")
    @DecimalMax(value = "1", message = "Position fraction cannot exceed 1")
    private BigDecimal positionFraction;

    @Positive(message = "Fixed quantity must be positive")
    private Long fixedQuantity;

    private Boolean closeAtEnd;

    private Double riskFreeRate;

    @Positive(message = "Periods per year must be positive")
    private Integer periodsPerYear;
}
