package com.stockanalyzer.backtester.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.stockanalyzer.backtester.domain.BarFixtures.assertAmount;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for run configuration defaults, validation and cost calculation.
 */
class BacktestConfigTest {

    @Test
    void testDefaults() {
        // Act
        BacktestConfig config = BacktestConfig.defaults();

        // Assert
        assertAmount("1000000", config.getInitialCash());
        assertEquals(CostModel.NONE, config.getCostModel());
        assertEquals(FillPolicy.NEXT_OPEN, config.getFillPolicy());
        assertEquals(SizingPolicy.FIXED_FRACTION, config.getSizingPolicy());
        assertAmount("0.95", config.getPositionFraction());
        assertFalse(config.isCloseAtEnd());
        assertEquals(0.001, config.getRiskFreeRate());
        assertEquals(252, config.getPeriodsPerYear());
        assertDoesNotThrow(config::validate);
    }

    @Test
    void testCostOf_BothModel() {
        // Arrange
        BacktestConfig config = BacktestConfig.builder()
                .costModel(CostModel.BOTH)
                .fixedFee(new BigDecimal("1.5"))
                .proportionalRate(new BigDecimal("0.0005"))
                .build();

        // Act
        BigDecimal cost = config.costOf(new BigDecimal("12345.67"));

        // Assert - 1.5 + 6.172835 rounded to 4 places
        assertEquals(new BigDecimal("7.6728"), cost);
    }

    @Test
    void testValidate_RejectsNonPositiveCash() {
        BacktestConfig config = BacktestConfig.builder().initialCash(BigDecimal.ZERO).build();
        assertThrows(BacktestConfigurationException.class, config::validate);
    }

    @Test
    void testValidate_ProportionalModelNeedsRate() {
        BacktestConfig config = BacktestConfig.builder().costModel(CostModel.PROPORTIONAL).build();
        BacktestConfigurationException e = assertThrows(BacktestConfigurationException.class, config::validate);
        assertTrue(e.getMessage().contains("proportional rate"));
    }

    @Test
    void testValidate_FixedQuantityNeedsQuantity() {
        BacktestConfig config = BacktestConfig.builder().sizingPolicy(SizingPolicy.FIXED_QUANTITY).build();
        assertThrows(BacktestConfigurationException.class, config::validate);
    }

    @Test
    void testValidate_RejectsNonFiniteRiskFreeRate() {
        BacktestConfig config = BacktestConfig.builder().riskFreeRate(Double.NaN).build();
        assertThrows(BacktestConfigurationException.class, config::validate);
    }

    @Test
    void testParsePolicy_AcceptsKebabCase() {
        assertEquals(FillPolicy.NEXT_OPEN, BacktestConfig.parsePolicy(FillPolicy.class, "next-open"));
        assertEquals(SizingPolicy.ALL_IN, BacktestConfig.parsePolicy(SizingPolicy.class, "ALL_IN"));
        assertEquals(CostModel.FIXED_FEE, BacktestConfig.parsePolicy(CostModel.class, " fixed-fee "));
    }

    @Test
    void testParsePolicy_UnknownName_Throws() {
        assertThrows(BacktestConfigurationException.class,
                () -> BacktestConfig.parsePolicy(FillPolicy.class, "midpoint"));
        assertThrows(BacktestConfigurationException.class,
                () -> BacktestConfig.parsePolicy(FillPolicy.class, ""));
    }
}
