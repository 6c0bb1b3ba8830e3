package com.stockanalyzer.backtester.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Tracks backtest run counts and durations through Micrometer.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter tradesExecutedCounter;
    private final Counter actionsRejectedCounter;
    private final Timer runTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs completed")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of backtest runs aborted by a configuration or data error")
                .register(meterRegistry);

        this.tradesExecutedCounter = Counter.builder("backtest.trades.executed")
                .description("Total number of simulated fills")
                .register(meterRegistry);

        this.actionsRejectedCounter = Counter.builder("backtest.actions.rejected")
                .description("Total number of strategy actions rejected by the engine")
                .register(meterRegistry);

        this.runTimer = Timer.builder("backtest.run.duration")
                .description("Backtest run duration")
                .register(meterRegistry);

        log.debug("BacktestMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a completed run with its duration and trade log size.
     */
    public void recordRunCompleted(long executionTimeMs, int trades, int rejections) {
        runsCompletedCounter.increment();
        tradesExecutedCounter.increment(trades);
        actionsRejectedCounter.increment(rejections);
        runTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    public String getMetricsSummary() {
        return String.format("Metrics: Completed=%d, Failed=%d, Trades=%d, Rejected=%d, AvgRunTime=%.3fs",
                (long) runsCompletedCounter.count(),
                (long) runsFailedCounter.count(),
                (long) tradesExecutedCounter.count(),
                (long) actionsRejectedCounter.count(),
                runTimer.mean(TimeUnit.SECONDS));
    }
}
