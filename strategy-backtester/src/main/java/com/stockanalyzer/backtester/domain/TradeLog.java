package com.stockanalyzer.backtester.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only record of what happened to a strategy's actions: executed trades and the
 * actions that were rejected and degraded to HOLD.
 */
public class TradeLog {

    private final List<Trade> trades = new ArrayList<>();
    private final List<RejectedAction> rejections = new ArrayList<>();

    void record(Trade trade) {
        trades.add(trade);
    }

    void reject(RejectedAction rejection) {
        rejections.add(rejection);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<RejectedAction> getRejections() {
        return Collections.unmodifiableList(rejections);
    }

    @JsonIgnore
    public List<Trade> getClosingTrades() {
        return trades.stream().filter(Trade::isClosing).toList();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return trades.isEmpty();
    }

    /**
     * Trades and rejections merged in bar order; trades come first within a bar.
     */
    @JsonIgnore
    public List<Entry> getEntries() {
        List<Entry> entries = new ArrayList<>(trades.size() + rejections.size());
        trades.forEach(t -> entries.add(new Entry(t.getBarIndex(), t, null)));
        rejections.forEach(r -> entries.add(new Entry(r.getBarIndex(), null, r)));
        entries.sort(Comparator.comparingInt(Entry::getBarIndex)
                .thenComparing(e -> e.getTrade() == null));
        return entries;
    }

    @Value
    public static class Entry {
        int barIndex;
        Trade trade;
        RejectedAction rejection;

        public boolean isRejected() {
            return rejection != null;
        }
    }
}
