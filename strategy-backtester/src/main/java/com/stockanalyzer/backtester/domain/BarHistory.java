package com.stockanalyzer.backtester.domain;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the bars a strategy may see at step {@code t}: indices 0..t.
 * Built by the engine for every step, so bars after {@code t} are unreachable.
 */
public final class BarHistory {

    private final List<Bar> visible;

    private BarHistory(List<Bar> visible) {
        this.visible = visible;
    }

    /**
     * View over {@code bars[0..currentIndex]}.
     */
    public static BarHistory upTo(List<Bar> bars, int currentIndex) {
        if (currentIndex < 0 || currentIndex >= bars.size()) {
            throw new IndexOutOfBoundsException("Bar index " + currentIndex + " outside 0.." + (bars.size() - 1));
        }
        return new BarHistory(Collections.unmodifiableList(bars.subList(0, currentIndex + 1)));
    }

    public int size() {
        return visible.size();
    }

    public int currentIndex() {
        return visible.size() - 1;
    }

    public Bar current() {
        return visible.get(visible.size() - 1);
    }

    /**
     * The bar {@code barsAgo} steps before the current one, empty when it precedes the series.
     */
    public Optional<Bar> previous(int barsAgo) {
        int index = currentIndex() - barsAgo;
        return index >= 0 ? Optional.of(visible.get(index)) : Optional.empty();
    }

    public Optional<Bar> previous() {
        return previous(1);
    }

    public Bar get(int index) {
        return visible.get(index);
    }

    public List<Bar> bars() {
        return visible;
    }

    public Optional<BigDecimal> currentIndicator(String name) {
        return current().indicator(name);
    }

    public Optional<BigDecimal> previousIndicator(String name) {
        return previous().flatMap(bar -> bar.indicator(name));
    }
}
