package com.stockanalyzer.backtester.domain;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Cash and position of one simulation run. Owned by a single {@link BacktestEngine} run and
 * changed only by executed fills.
 */
@Getter
public class PortfolioState {

    private BigDecimal cash;
    private long positionQuantity;
    private BigDecimal averageEntryPrice = BigDecimal.ZERO;
    private BigDecimal openEntryCosts = BigDecimal.ZERO;
    private Integer entryBarIndex;

    PortfolioState(BigDecimal initialCash) {
        this.cash = initialCash;
    }

    /**
     * Apply a buy fill. The caller has checked that {@code notional + cost <= cash}.
     */
    void applyBuy(int barIndex, long quantity, BigDecimal price, BigDecimal cost) {
        BigDecimal notional = price.multiply(BigDecimal.valueOf(quantity));
        BigDecimal newCash = cash.subtract(notional).subtract(cost);
        if (newCash.signum() < 0) {
            throw new IllegalStateException("Buy would overdraw cash: " + newCash);
        }

        long newQuantity = positionQuantity + quantity;
        averageEntryPrice = averageEntryPrice.multiply(BigDecimal.valueOf(positionQuantity))
                .add(notional)
                .divide(BigDecimal.valueOf(newQuantity), 8, RoundingMode.HALF_UP);
        if (positionQuantity == 0) {
            entryBarIndex = barIndex;
        }
        openEntryCosts = openEntryCosts.add(cost);
        positionQuantity = newQuantity;
        cash = newCash;
    }

    /**
     * Apply a sell fill and return the entry costs allocated to the sold quantity.
     */
    BigDecimal applySell(long quantity, BigDecimal price, BigDecimal cost) {
        if (quantity > positionQuantity) {
            throw new IllegalStateException("Sell of " + quantity + " exceeds position " + positionQuantity);
        }
        BigDecimal proceeds = price.multiply(BigDecimal.valueOf(quantity)).subtract(cost);
        BigDecimal newCash = cash.add(proceeds);
        if (newCash.signum() < 0) {
            throw new IllegalStateException("Sell would overdraw cash: " + newCash);
        }

        BigDecimal allocatedEntryCost = quantity == positionQuantity
                ? openEntryCosts
                : openEntryCosts.multiply(BigDecimal.valueOf(quantity))
                        .divide(BigDecimal.valueOf(positionQuantity), 8, RoundingMode.HALF_UP);

        positionQuantity -= quantity;
        openEntryCosts = openEntryCosts.subtract(allocatedEntryCost);
        cash = newCash;
        if (positionQuantity == 0) {
            averageEntryPrice = BigDecimal.ZERO;
            openEntryCosts = BigDecimal.ZERO;
            entryBarIndex = null;
        }
        return allocatedEntryCost;
    }

    public BigDecimal getEquity(BigDecimal price) {
        return cash.add(price.multiply(BigDecimal.valueOf(positionQuantity)));
    }

    public boolean isFlat() {
        return positionQuantity == 0;
    }

    public PortfolioSnapshot snapshot() {
        return PortfolioSnapshot.builder()
                .cash(cash)
                .positionQuantity(positionQuantity)
                .averageEntryPrice(averageEntryPrice)
                .entryBarIndex(entryBarIndex)
                .build();
    }
}
