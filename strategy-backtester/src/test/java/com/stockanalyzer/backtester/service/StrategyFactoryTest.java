package com.stockanalyzer.backtester.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockanalyzer.backtester.domain.BacktestConfigurationException;
import com.stockanalyzer.backtester.domain.Strategy;
import com.stockanalyzer.backtester.domain.strategy.BuyAndHoldStrategy;
import com.stockanalyzer.backtester.domain.strategy.CompositeStrategy;
import com.stockanalyzer.backtester.domain.strategy.Indicators;
import com.stockanalyzer.backtester.domain.strategy.MovingAverageCrossoverStrategy;
import com.stockanalyzer.backtester.domain.strategy.RsiStrategy;
import com.stockanalyzer.backtester.service.dto.StrategyDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StrategyFactory.
 */
class StrategyFactoryTest {

    private StrategyFactory strategyFactory;

    @BeforeEach
    void setUp() {
        strategyFactory = new StrategyFactory(new ObjectMapper());
    }

    @Test
    void testCreateStrategy_KnownIdsWithoutParameters() {
        assertInstanceOf(BuyAndHoldStrategy.class, strategyFactory.createStrategy("buy_and_hold", (Map<String, Object>) null));
        assertInstanceOf(MovingAverageCrossoverStrategy.class, strategyFactory.createStrategy("golden_cross", Map.of()));
        assertInstanceOf(RsiStrategy.class, strategyFactory.createStrategy("RSI", Map.of()));
        assertInstanceOf(CompositeStrategy.class, strategyFactory.createStrategy("combo", Map.of()));
    }

    @Test
    void testCreateStrategy_AppliesParameters() {
        // Act
        Strategy rsi = strategyFactory.createStrategy("rsi", Map.of("oversold", 25, "overbought", 75.5));
        Strategy crossover = strategyFactory.createStrategy("ma-crossover",
                Map.of("fastIndicator", Indicators.SMA_5, "slowIndicator", Indicators.SMA_25));

        // Assert
        assertEquals("RSI(25,75.5)", rsi.getName());
        assertEquals("MovingAverageCrossover(SMA_5,SMA_25)", crossover.getName());
    }

    @Test
    void testCreateStrategy_FromJson() {
        // Act
        Strategy strategy = strategyFactory.createStrategy("stochastic", "{\"oversold\": 10, \"overbought\": 90}");

        // Assert
        assertEquals("Stochastic(10,90)", strategy.getName());
    }

    @Test
    void testCreateStrategy_UnknownId_Throws() {
        BacktestConfigurationException e = assertThrows(BacktestConfigurationException.class,
                () -> strategyFactory.createStrategy("momentum", Map.of()));
        assertTrue(e.getMessage().contains("Unknown strategy"));
    }

    @Test
    void testCreateStrategy_InvalidParameterValue_Throws() {
        assertThrows(BacktestConfigurationException.class,
                () -> strategyFactory.createStrategy("rsi", Map.of("oversold", 80, "overbought", 20)));
        assertThrows(BacktestConfigurationException.class,
                () -> strategyFactory.createStrategy("rsi", Map.of("oversold", "low")));
        assertThrows(BacktestConfigurationException.class,
                () -> strategyFactory.createStrategy("combo", Map.of("maWeight", -1)));
    }

    @Test
    void testCreateStrategy_MalformedJson_Throws() {
        assertThrows(BacktestConfigurationException.class,
                () -> strategyFactory.createStrategy("rsi", "{oversold:"));
    }

    @Test
    void testAvailableStrategies_AllCreatableWithDefaults() {
        // Act
        List<StrategyDescriptor> descriptors = strategyFactory.availableStrategies();

        // Assert
        assertEquals(7, descriptors.size());
        for (StrategyDescriptor descriptor : descriptors) {
            assertNotNull(descriptor.getDisplayName());
            assertNotNull(strategyFactory.createStrategy(descriptor.getId(), descriptor.getDefaultParameters()));
        }
    }
}
