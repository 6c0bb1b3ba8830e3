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
 * A single backtest: one strategy over one bar series.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRequest {

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    private Map<String, Object> parameters;

    @NotEmpty(message = "At least one bar is required")
    private List<@NotNull(message = "Bars cannot contain null entries") Bar> bars;

    @Valid
    private ConfigOverrides overrides;
}
