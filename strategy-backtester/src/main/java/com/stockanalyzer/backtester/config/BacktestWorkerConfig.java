package com.stockanalyzer.backtester.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker pool for running independent backtests side by side.
 */
@Configuration
@EnableConfigurationProperties(BacktestProperties.class)
public class BacktestWorkerConfig {

    @Value("${backtest.worker.thread-count:4}")
    private int workerThreadCount;

    @Bean(name = "backtestExecutorService", destroyMethod = "shutdown")
    public ExecutorService backtestExecutorService() {
        return Executors.newFixedThreadPool(workerThreadCount,
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("BacktestWorker-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
