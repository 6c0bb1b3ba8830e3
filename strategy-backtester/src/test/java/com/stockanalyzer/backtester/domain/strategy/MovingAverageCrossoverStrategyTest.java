package com.stockanalyzer.backtester.domain.strategy;

import com.stockanalyzer.backtester.domain.Action;
import com.stockanalyzer.backtester.domain.ActionType;
import com.stockanalyzer.backtester.domain.Bar;
import com.stockanalyzer.backtester.domain.BarHistory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.stockanalyzer.backtester.domain.strategy.StrategyTestSupport.FLAT;
import static com.stockanalyzer.backtester.domain.strategy.StrategyTestSupport.HOLDING;
import static com.stockanalyzer.backtester.domain.strategy.StrategyTestSupport.barWith;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MovingAverageCrossoverStrategy.
 */
class MovingAverageCrossoverStrategyTest {

    private final MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy();

    private static BarHistory twoBars(String prevFast, String prevSlow, String fast, String slow) {
        List<Bar> bars = List.of(
                barWith(0, "100", Indicators.SMA_25, prevFast, Indicators.SMA_75, prevSlow),
                barWith(1, "100", Indicators.SMA_25, fast, Indicators.SMA_75, slow));
        return BarHistory.upTo(bars, 1);
    }

    @Test
    void testGoldenCross_BuysWhenFlat() {
        // Act
        Action action = strategy.decide(twoBars("99", "100", "101", "100"), FLAT);

        // Assert
        assertEquals(ActionType.BUY, action.getType());
        assertTrue(action.getReason().contains("golden cross"));
        assertEquals(MovingAverageCrossoverStrategy.STRENGTH, action.getStrength().doubleValue());
    }

    @Test
    void testGoldenCross_HoldsWhenAlreadyInvested() {
        assertTrue(strategy.decide(twoBars("99", "100", "101", "100"), HOLDING).isHold());
    }

    @Test
    void testNoCross_HoldCarriesNoStrength() {
        assertNull(strategy.decide(twoBars("101", "100", "102", "100"), FLAT).getStrength());
    }

    @Test
    void testDeadCross_SellsWhenHolding() {
        // Act
        Action action = strategy.decide(twoBars("101", "100", "99", "100"), HOLDING);

        // Assert
        assertTrue(action.isSellAll());
    }

    @Test
    void testNoCross_Holds() {
        assertTrue(strategy.decide(twoBars("101", "100", "102", "100"), FLAT).isHold());
        assertTrue(strategy.decide(twoBars("98", "100", "99", "100"), HOLDING).isHold());
    }

    @Test
    void testFirstBarOrMissingValues_Holds() {
        // Arrange
        Bar first = barWith(0, "100", Indicators.SMA_25, "101", Indicators.SMA_75, "100");

        // Assert
        assertTrue(strategy.decide(BarHistory.upTo(List.of(first), 0), FLAT).isHold());
        assertTrue(strategy.decide(twoBars(null, "100", "101", "100"), FLAT).isHold());
    }

    @Test
    void testCustomIndicators() {
        // Arrange
        MovingAverageCrossoverStrategy fast = new MovingAverageCrossoverStrategy(Indicators.SMA_5, Indicators.SMA_25);

        // Assert
        assertEquals(Set.of(Indicators.SMA_5, Indicators.SMA_25), fast.requiredIndicators());
        assertEquals("MovingAverageCrossover(SMA_5,SMA_25)", fast.getName());
    }

    @Test
    void testSameIndicatorTwice_Throws() {
        assertThrows(IllegalArgumentException.class,
                () -> new MovingAverageCrossoverStrategy(Indicators.SMA_25, Indicators.SMA_25));
    }
}
