package com.stockanalyzer.backtester.domain;

import java.util.Set;

/**
 * Trading strategy: a pure decision function evaluated once per bar.
 * <p>
 * Implementations must be deterministic and must not keep state between calls other than
 * the parameters fixed at construction. The history never contains bars after the one
 * being decided on.
 */
public interface Strategy {

    /**
     * Decide what to do at the last bar of {@code history}.
     *
     * @param history   bars up to and including the current one
     * @param portfolio read-only view of the current portfolio
     * @return the action to take, never {@code null}
     */
    Action decide(BarHistory history, PortfolioSnapshot portfolio);

    /**
     * Get the strategy name.
     */
    String getName();

    /**
     * Indicator keys every bar must carry for this strategy to run.
     */
    default Set<String> requiredIndicators() {
        return Set.of();
    }
}
