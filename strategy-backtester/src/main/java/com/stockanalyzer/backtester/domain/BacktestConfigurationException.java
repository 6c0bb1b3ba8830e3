package com.stockanalyzer.backtester.domain;

/**
 * Invalid engine configuration, unknown strategy or strategy parameter, or an indicator
 * the strategy requires that the bars do not carry.
 */
public class BacktestConfigurationException extends BacktestException {

    public BacktestConfigurationException(String message) {
        super(message);
    }

    public BacktestConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
