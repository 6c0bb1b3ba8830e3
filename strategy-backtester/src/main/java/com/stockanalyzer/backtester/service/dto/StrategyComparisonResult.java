package com.stockanalyzer.backtester.service.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Ranked outcome of a comparison. Successful runs come first in rank order, failed runs last.
 */
@Value
@Builder
public class StrategyComparisonResult {

    String optimizationMetric;
    int completedRuns;
    int failedRuns;
    List<Entry> entries;

    public Optional<Entry> getBest() {
        return entries.stream().filter(e -> !e.isFailed()).findFirst();
    }

    @Value
    @Builder(toBuilder = true)
    public static class Entry {
        /** 1-based rank, {@code null} for a failed run. */
        Integer rank;
        String strategyId;
        String strategyName;
        BigDecimal metricValue;
        BacktestReport report;
        String error;

        public boolean isFailed() {
            return error != null;
        }
    }
}
