package com.stockanalyzer.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of one engine run: the trade log, the equity curve and the final portfolio.
 */
@Value
@Builder
public class BacktestResult {

    String strategyName;
    BacktestConfig config;
    int barCount;
    TradeLog tradeLog;
    List<EquityPoint> equityCurve;
    PortfolioSnapshot finalPortfolio;
}
