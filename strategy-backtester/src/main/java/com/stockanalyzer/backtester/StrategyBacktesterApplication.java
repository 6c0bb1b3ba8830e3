package com.stockanalyzer.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Strategy backtester application.
 * Runs trading strategies over historical bars and reports their performance.
 */
@SpringBootApplication
public class StrategyBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategyBacktesterApplication.class, args);
    }
}
