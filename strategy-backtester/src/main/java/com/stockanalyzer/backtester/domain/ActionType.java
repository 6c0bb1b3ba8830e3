package com.stockanalyzer.backtester.domain;

public enum ActionType {
    BUY, SELL, HOLD
}
