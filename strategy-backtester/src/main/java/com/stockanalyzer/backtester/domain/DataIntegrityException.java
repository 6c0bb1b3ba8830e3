package com.stockanalyzer.backtester.domain;

/**
 * Malformed bar sequence: empty, out of order, or with missing prices.
 */
public class DataIntegrityException extends BacktestException {

    public DataIntegrityException(String message) {
        super(message);
    }
}
