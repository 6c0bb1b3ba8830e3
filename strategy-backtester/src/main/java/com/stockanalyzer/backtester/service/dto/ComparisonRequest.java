package com.stockanalyzer.backtester.service.dto;

import com.stockanalyzer.backtester.domain.Bar;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Several strategies run over the same bars and ranked by one metric.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ComparisonRequest {

    @NotEmpty(message = "At least one strategy is required")
    private List<@Valid StrategySelection> strategies;

    @NotEmpty(message = "At least one bar is required")
    private List<@NotNull(message = "Bars cannot contain null entries") Bar> bars;

    @Builder.Default
    private String optimizationMetric = "sharpeRatio"; // "totalReturn", "sortinoRatio", "maxDrawdown", etc.

    @Valid
    private ConfigOverrides overrides;

    /**
     * One strategy id with its parameters.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class StrategySelection {

        @NotBlank(message = "Strategy name is required")
        private String strategyName;

        private Map<String, Object> parameters;
    }
}
