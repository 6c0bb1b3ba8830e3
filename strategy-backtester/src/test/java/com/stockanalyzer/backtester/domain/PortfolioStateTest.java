package com.stockanalyzer.backtester.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.stockanalyzer.backtester.domain.BarFixtures.assertAmount;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PortfolioState fills.
 */
class PortfolioStateTest {

    private PortfolioState portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new PortfolioState(new BigDecimal("10000.00"));
    }

    @Test
    void testApplyBuy_UpdatesCashAndPosition() {
        // Act
        portfolio.applyBuy(3, 50, new BigDecimal("100.00"), new BigDecimal("1.50"));

        // Assert
        assertEquals(50, portfolio.getPositionQuantity());
        assertAmount("4998.50", portfolio.getCash());
        assertAmount("100", portfolio.getAverageEntryPrice());
        assertEquals(Integer.valueOf(3), portfolio.getEntryBarIndex());
        assertFalse(portfolio.isFlat());
    }

    @Test
    void testApplyBuy_SecondBuyAveragesEntryPrice() {
        // Act
        portfolio.applyBuy(1, 10, new BigDecimal("100"), BigDecimal.ZERO);
        portfolio.applyBuy(2, 30, new BigDecimal("120"), BigDecimal.ZERO);

        // Assert
        assertEquals(40, portfolio.getPositionQuantity());
        assertAmount("115", portfolio.getAverageEntryPrice());
        assertEquals(Integer.valueOf(1), portfolio.getEntryBarIndex(), "Entry bar stays at the first buy");
    }

    @Test
    void testApplyBuy_Overdraw_ThrowsAndLeavesStateUnchanged() {
        // Act & Assert
        assertThrows(IllegalStateException.class,
                () -> portfolio.applyBuy(0, 101, new BigDecimal("100"), BigDecimal.ZERO));
        assertAmount("10000", portfolio.getCash());
        assertTrue(portfolio.isFlat());
    }

    @Test
    void testApplySell_PartialAllocatesEntryCostsProRata() {
        // Arrange
        portfolio.applyBuy(0, 40, new BigDecimal("100"), new BigDecimal("8"));

        // Act
        BigDecimal allocated = portfolio.applySell(10, new BigDecimal("110"), new BigDecimal("2"));

        // Assert
        assertAmount("2", allocated);
        assertEquals(30, portfolio.getPositionQuantity());
        assertAmount("6", portfolio.getOpenEntryCosts());
        assertAmount("7090", portfolio.getCash(), "10000 - 4008 + 1100 - 2");
    }

    @Test
    void testApplySell_FullResetsEntryState() {
        // Arrange
        portfolio.applyBuy(0, 40, new BigDecimal("100"), new BigDecimal("8"));

        // Act
        BigDecimal allocated = portfolio.applySell(40, new BigDecimal("90"), BigDecimal.ZERO);

        // Assert
        assertAmount("8", allocated);
        assertTrue(portfolio.isFlat());
        assertNull(portfolio.getEntryBarIndex());
        assertAmount("0", portfolio.getAverageEntryPrice());
        assertAmount("9592", portfolio.getCash());
    }

    @Test
    void testApplySell_MoreThanHeld_Throws() {
        // Arrange
        portfolio.applyBuy(0, 5, new BigDecimal("100"), BigDecimal.ZERO);

        // Act & Assert
        assertThrows(IllegalStateException.class,
                () -> portfolio.applySell(6, new BigDecimal("100"), BigDecimal.ZERO));
    }

    @Test
    void testSnapshot_ReflectsEquityAtPrice() {
        // Arrange
        portfolio.applyBuy(0, 50, new BigDecimal("100"), BigDecimal.ZERO);

        // Act
        PortfolioSnapshot snapshot = portfolio.snapshot();

        // Assert
        assertTrue(snapshot.hasPosition());
        assertAmount("11000", snapshot.equity(new BigDecimal("120")));
        assertAmount("1000", snapshot.unrealizedPnl(new BigDecimal("120")));
        assertAmount("11000", portfolio.getEquity(new BigDecimal("120")));
    }
}
