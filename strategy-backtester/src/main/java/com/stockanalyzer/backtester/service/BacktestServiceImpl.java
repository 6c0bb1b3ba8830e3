package com.stockanalyzer.backtester.service;

import com.stockanalyzer.backtester.config.BacktestProperties;
import com.stockanalyzer.backtester.domain.BacktestConfig;
import com.stockanalyzer.backtester.domain.BacktestEngine;
import com.stockanalyzer.backtester.domain.BacktestException;
import com.stockanalyzer.backtester.domain.BacktestResult;
import com.stockanalyzer.backtester.domain.CostModel;
import com.stockanalyzer.backtester.domain.FillPolicy;
import com.stockanalyzer.backtester.domain.PerformanceAnalyzer;
import com.stockanalyzer.backtester.domain.PerformanceReport;
import com.stockanalyzer.backtester.domain.SizingPolicy;
import com.stockanalyzer.backtester.domain.Strategy;
import com.stockanalyzer.backtester.service.dto.BacktestReport;
import com.stockanalyzer.backtester.service.dto.BacktestRequest;
import com.stockanalyzer.backtester.service.dto.ConfigOverrides;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.Map;
import java.util.UUID;

/**
 * Builds the strategy and configuration for a request, runs the engine and analyzes the result.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    static final String RUN_ID_KEY = "runId";

    private final StrategyFactory strategyFactory;
    private final BacktestProperties properties;
    private final BacktestMetricsService metricsService;

    private final BacktestEngine backtestEngine = new BacktestEngine();

    @Override
    public BacktestReport runBacktest(BacktestRequest request) {
        String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID_KEY, runId);

        try {
            return runBacktestInternal(runId, request);
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    private BacktestReport runBacktestInternal(String runId, BacktestRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Started: strategy={}, bars={}", request.getStrategyName(),
                request.getBars() == null ? 0 : request.getBars().size());

        try {
            Strategy strategy = strategyFactory.createStrategy(request.getStrategyName(), request.getParameters());
            BacktestConfig config = resolveConfig(request.getOverrides());

            BacktestResult result = backtestEngine.runBacktest(strategy, request.getBars(), config);
            PerformanceReport performance = PerformanceAnalyzer.forConfig(config).analyze(result);

            long executionTime = System.currentTimeMillis() - startTime;
            metricsService.recordRunCompleted(executionTime,
                    result.getTradeLog().getTrades().size(),
                    result.getTradeLog().getRejections().size());

            log.info("Completed in {}ms: return={}%, sharpe={}, maxDrawdown={}%, trades={}, rejected={}",
                    executionTime, performance.getTotalReturnPct(), performance.getSharpeRatio(),
                    performance.getMaxDrawdownPct(), performance.getTotalTrades(), performance.getRejectedActions());

            return BacktestReport.builder()
                    .runId(runId)
                    .strategyId(request.getStrategyName())
                    .strategyName(strategy.getName())
                    .parameters(request.getParameters() == null ? Map.of() : request.getParameters())
                    .config(config)
                    .barCount(result.getBarCount())
                    .startDate(request.getBars().get(0).getDate())
                    .endDate(request.getBars().get(request.getBars().size() - 1).getDate())
                    .executionTimeMs(executionTime)
                    .performance(performance)
                    .build();

        } catch (BacktestException e) {
            metricsService.recordRunFailed();
            log.error("Failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metricsService.recordRunFailed();
            log.error("Failed unexpectedly", e);
            throw e;
        }
    }

    /**
     * Configured defaults with the request's non-null overrides applied on top.
     *
     * @throws com.stockanalyzer.backtester.domain.BacktestConfigurationException for unknown policy names
     */
    BacktestConfig resolveConfig(ConfigOverrides overrides) {
        BacktestConfig defaults = properties.toConfig();
        if (overrides == null) {
            return defaults;
        }

        BacktestConfig.BacktestConfigBuilder builder = defaults.toBuilder();
        if (overrides.getInitialCash() != null) {
            builder.initialCash(overrides.getInitialCash());
        }
        if (overrides.getCostModel() != null) {
            builder.costModel(BacktestConfig.parsePolicy(CostModel.class, overrides.getCostModel()));
        }
        if (overrides.getFixedFee() != null) {
            builder.fixedFee(overrides.getFixedFee());
        }
        if (overrides.getProportionalRate() != null) {
            builder.proportionalRate(overrides.getProportionalRate());
        }
        if (overrides.getFillPolicy() != null) {
            builder.fillPolicy(BacktestConfig.parsePolicy(FillPolicy.class, overrides.getFillPolicy()));
        }
        if (overrides.getSizingPolicy() != null) {
            builder.sizingPolicy(BacktestConfig.parsePolicy(SizingPolicy.class, overrides.getSizingPolicy()));
        }
        if (overrides.getPositionFraction() != null) {
            builder.positionFraction(overrides.getPositionFraction());
        }
        if (overrides.getFixedQuantity() != null) {
            builder.fixedQuantity(overrides.getFixedQuantity());
        }
        if (overrides.getCloseAtEnd() != null) {
            builder.closeAtEnd(overrides.getCloseAtEnd());
        }
        if (overrides.getRiskFreeRate() != null) {
            builder.riskFreeRate(overrides.getRiskFreeRate());
        }
        if (overrides.getPeriodsPerYear() != null) {
            builder.periodsPerYear(overrides.getPeriodsPerYear());
        }
        return builder.build();
    }
}
