package com.stockanalyzer.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable copy of the portfolio handed to a strategy. Strategies read it, they cannot
 * change the engine's state through it.
 */
@Value
@Builder
public class PortfolioSnapshot {

    BigDecimal cash;
    long positionQuantity;
    BigDecimal averageEntryPrice;
    Integer entryBarIndex;

    public boolean isFlat() {
        return positionQuantity == 0;
    }

    public boolean hasPosition() {
        return positionQuantity > 0;
    }

    public BigDecimal positionValue(BigDecimal price) {
        return price.multiply(BigDecimal.valueOf(positionQuantity));
    }

    public BigDecimal equity(BigDecimal price) {
        return cash.add(positionValue(price));
    }

    /**
     * Mark-to-market P&L of the open position against its average entry price.
     */
    public BigDecimal unrealizedPnl(BigDecimal price) {
        if (isFlat()) {
            return BigDecimal.ZERO;
        }
        return price.subtract(averageEntryPrice).multiply(BigDecimal.valueOf(positionQuantity));
    }
}
