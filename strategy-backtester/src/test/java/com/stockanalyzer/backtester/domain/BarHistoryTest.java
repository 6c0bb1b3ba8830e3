package com.stockanalyzer.backtester.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.stockanalyzer.backtester.domain.BarFixtures.assertAmount;
import static com.stockanalyzer.backtester.domain.BarFixtures.series;
import static com.stockanalyzer.backtester.domain.BarFixtures.withIndicator;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the causal bar view handed to strategies.
 */
class BarHistoryTest {

    private final List<Bar> bars = series("10", "11", "12", "13", "14");

    @Test
    void testUpTo_ExposesOnlyBarsThroughCurrent() {
        // Act
        BarHistory history = BarHistory.upTo(bars, 2);

        // Assert
        assertEquals(3, history.size());
        assertEquals(2, history.currentIndex());
        assertAmount("12", history.current().getClose());
        assertThrows(IndexOutOfBoundsException.class, () -> history.get(3));
    }

    @Test
    void testUpTo_IsReadOnly() {
        // Arrange
        BarHistory history = BarHistory.upTo(bars, 1);

        // Act & Assert
        assertThrows(UnsupportedOperationException.class, () -> history.bars().add(bars.get(4)));
    }

    @Test
    void testPrevious_EmptyBeforeSeriesStart() {
        // Arrange
        BarHistory first = BarHistory.upTo(bars, 0);
        BarHistory third = BarHistory.upTo(bars, 2);

        // Assert
        assertTrue(first.previous().isEmpty());
        assertAmount("11", third.previous().orElseThrow().getClose());
        assertAmount("10", third.previous(2).orElseThrow().getClose());
        assertTrue(third.previous(3).isEmpty());
    }

    @Test
    void testIndicators_NullValueMeansNotYetAvailable() {
        // Arrange
        Bar warmingUp = withIndicator(bars.get(0), "RSI", null);
        Bar ready = withIndicator(bars.get(1), "RSI", "42.5");
        List<Bar> withRsi = List.of(warmingUp, ready);

        // Act
        BarHistory history = BarHistory.upTo(withRsi, 1);

        // Assert
        assertTrue(warmingUp.hasIndicator("RSI"));
        assertTrue(history.previousIndicator("RSI").isEmpty());
        assertAmount("42.5", history.currentIndicator("RSI").orElseThrow());
        assertTrue(history.currentIndicator("MACD").isEmpty());
    }

    @Test
    void testUpTo_OutOfRange_Throws() {
        assertThrows(IndexOutOfBoundsException.class, () -> BarHistory.upTo(bars, 5));
        assertThrows(IndexOutOfBoundsException.class, () -> BarHistory.upTo(bars, -1));
    }
}
