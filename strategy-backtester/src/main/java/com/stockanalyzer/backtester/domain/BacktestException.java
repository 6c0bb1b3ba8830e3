package com.stockanalyzer.backtester.domain;

/**
 * Fatal problem that stops a backtest before its first step.
 */
public abstract class BacktestException extends RuntimeException {

    protected BacktestException(String message) {
        super(message);
    }

    protected BacktestException(String message, Throwable cause) {
        super(message, cause);
    }
}
