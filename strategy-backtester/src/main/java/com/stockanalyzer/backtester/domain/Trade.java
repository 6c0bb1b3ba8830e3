package com.stockanalyzer.backtester.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * An executed fill in the backtest.
 * <p>
 * Closing (SELL) trades also carry the entry side of the round trip and the realized P&amp;L.
 */
@Value
@Builder
public class Trade {

    int signalBarIndex;
    int barIndex;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    TradeType type;
    long quantity;
    BigDecimal price;
    BigDecimal cost;
    BigDecimal cashAfter;
    String reason;
    Double signalStrength;

    Integer entryBarIndex;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate entryDate;
    BigDecimal entryPrice;
    BigDecimal realizedPnl;
    BigDecimal realizedPnlPct;
    Integer holdingBars;

    public enum TradeType {
        BUY, SELL
    }

    public boolean isClosing() {
        return type == TradeType.SELL;
    }
}
