package com.stockanalyzer.backtester.service;

import com.stockanalyzer.backtester.service.dto.BacktestReport;
import com.stockanalyzer.backtester.service.dto.BacktestRequest;
import jakarta.validation.Valid;

/**
 * Runs single backtests.
 */
public interface BacktestService {

    /**
     * Run one strategy over the request's bars and analyze the outcome.
     *
     * @param request strategy id, parameters, bars and optional setting overrides
     * @return the trade log, equity curve and performance report of the run
     * @throws com.stockanalyzer.backtester.domain.BacktestConfigurationException for invalid settings or strategy
     * @throws com.stockanalyzer.backtester.domain.DataIntegrityException for a malformed bar series
     * @throws jakarta.validation.ConstraintViolationException for a request that violates its constraints,
     *         when called through the Spring proxy
     */
    BacktestReport runBacktest(@Valid BacktestRequest request);
}
