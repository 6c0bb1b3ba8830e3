package com.stockanalyzer.backtester.service;

import com.stockanalyzer.backtester.domain.BacktestConfigurationException;
import com.stockanalyzer.backtester.domain.BacktestException;
import com.stockanalyzer.backtester.domain.DataIntegrityException;
import com.stockanalyzer.backtester.service.dto.BacktestReport;
import com.stockanalyzer.backtester.service.dto.BacktestRequest;
import com.stockanalyzer.backtester.service.dto.ComparisonRequest;
import com.stockanalyzer.backtester.service.dto.StrategyComparisonResult;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs several strategies over the same bars on the worker pool and ranks them by one metric.
 */
@Service
@Validated
@Slf4j
public class StrategyComparisonService {

    private final BacktestService backtestService;
    private final BacktestMetricsService metricsService;
    private final ExecutorService executorService;

    public StrategyComparisonService(BacktestService backtestService,
                                     BacktestMetricsService metricsService,
                                     @Qualifier("backtestExecutorService") ExecutorService executorService) {
        this.backtestService = backtestService;
        this.metricsService = metricsService;
        this.executorService = executorService;
    }

    /**
     * Run every requested strategy and rank the successful runs. Undefined metric values rank
     * after defined ones; a run that fails is reported with its error after all ranked runs.
     *
     * @throws BacktestConfigurationException for an unknown ranking metric or a missing strategy list
     * @throws DataIntegrityException when no bars are given
     */
    public StrategyComparisonResult compare(@Valid ComparisonRequest request) {
        checkRequest(request);
        RankingMetric metric = RankingMetric.fromName(request.getOptimizationMetric());
        log.info("Comparing {} strategies over {} bars by {}",
                request.getStrategies().size(), request.getBars().size(), metric.getKey());

        List<Future<BacktestReport>> futures = new ArrayList<>();
        for (ComparisonRequest.StrategySelection selection : request.getStrategies()) {
            BacktestRequest runRequest = BacktestRequest.builder()
                    .strategyName(selection.getStrategyName())
                    .parameters(selection.getParameters())
                    .bars(request.getBars())
                    .overrides(request.getOverrides())
                    .build();
            futures.add(executorService.submit(() -> backtestService.runBacktest(runRequest)));
        }

        List<StrategyComparisonResult.Entry> completed = new ArrayList<>();
        List<StrategyComparisonResult.Entry> failed = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String strategyId = request.getStrategies().get(i).getStrategyName();
            try {
                BacktestReport report = futures.get(i).get();
                completed.add(StrategyComparisonResult.Entry.builder()
                        .strategyId(strategyId)
                        .strategyName(report.getStrategyName())
                        .metricValue(metric.valueOf(report.getPerformance()))
                        .report(report)
                        .build());
            } catch (ExecutionException e) {
                failed.add(failedEntry(strategyId, e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for strategy comparison", e);
            }
        }

        Comparator<BigDecimal> order = metric.isLowerBetter()
                ? Comparator.naturalOrder()
                : Comparator.reverseOrder();
        completed.sort(Comparator.comparing(StrategyComparisonResult.Entry::getMetricValue,
                Comparator.nullsLast(order)));

        List<StrategyComparisonResult.Entry> entries = new ArrayList<>();
        for (int i = 0; i < completed.size(); i++) {
            entries.add(completed.get(i).toBuilder().rank(i + 1).build());
        }
        entries.addAll(failed);

        if (!completed.isEmpty()) {
            log.info("Best strategy by {}: {} ({})", metric.getKey(),
                    entries.get(0).getStrategyName(), entries.get(0).getMetricValue());
        }
        log.info("Comparison finished: {} completed, {} failed. {}",
                completed.size(), failed.size(), metricsService.getMetricsSummary());

        return StrategyComparisonResult.builder()
                .optimizationMetric(metric.getKey())
                .completedRuns(completed.size())
                .failedRuns(failed.size())
                .entries(entries)
                .build();
    }

    private static void checkRequest(ComparisonRequest request) {
        if (request == null) {
            throw new BacktestConfigurationException("Comparison request is required");
        }
        if (request.getStrategies() == null || request.getStrategies().isEmpty()) {
            throw new BacktestConfigurationException("At least one strategy is required");
        }
        if (request.getStrategies().stream().anyMatch(Objects::isNull)) {
            throw new BacktestConfigurationException("Strategy selections cannot contain null entries");
        }
        if (request.getBars() == null || request.getBars().isEmpty()) {
            throw new DataIntegrityException("At least one bar is required");
        }
    }

    private static StrategyComparisonResult.Entry failedEntry(String strategyId, Throwable cause) {
        if (cause instanceof BacktestException) {
            log.warn("Strategy {} failed: {}", strategyId, cause.getMessage());
        } else {
            log.error("Strategy {} failed unexpectedly", strategyId, cause);
        }
        return StrategyComparisonResult.Entry.builder()
                .strategyId(strategyId)
                .error(cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage())
                .build();
    }
}
