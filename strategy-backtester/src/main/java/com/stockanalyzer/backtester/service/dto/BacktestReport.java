package com.stockanalyzer.backtester.service.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.stockanalyzer.backtester.domain.BacktestConfig;
import com.stockanalyzer.backtester.domain.PerformanceReport;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Outcome of one backtest as returned to callers.
 */
@Value
@Builder
public class BacktestReport {

    String runId;
    String strategyId;
    String strategyName;
    Map<String, Object> parameters;
    BacktestConfig config;
    int barCount;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate startDate;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate endDate;
    long executionTimeMs;
    PerformanceReport performance;
}
