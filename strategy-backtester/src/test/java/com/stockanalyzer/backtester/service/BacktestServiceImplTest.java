package com.stockanalyzer.backtester.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockanalyzer.backtester.config.BacktestProperties;
import com.stockanalyzer.backtester.domain.BacktestConfig;
import com.stockanalyzer.backtester.domain.BacktestConfigurationException;
import com.stockanalyzer.backtester.domain.CostModel;
import com.stockanalyzer.backtester.domain.DataIntegrityException;
import com.stockanalyzer.backtester.domain.FillPolicy;
import com.stockanalyzer.backtester.domain.Strategy;
import com.stockanalyzer.backtester.service.dto.BacktestReport;
import com.stockanalyzer.backtester.service.dto.BacktestRequest;
import com.stockanalyzer.backtester.service.dto.ConfigOverrides;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.stockanalyzer.backtester.domain.BarFixtures.assertAmount;
import static com.stockanalyzer.backtester.domain.BarFixtures.series;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BacktestServiceImpl focusing on configuration merging and run lifecycle.
 */
@ExtendWith(MockitoExtension.class)
class BacktestServiceImplTest {

    @Mock
    private BacktestMetricsService metricsService;

    private BacktestProperties properties;
    private BacktestServiceImpl backtestService;

    @BeforeEach
    void setUp() {
        properties = new BacktestProperties();
        properties.setInitialCash(new BigDecimal("10000"));
        backtestService = new BacktestServiceImpl(new StrategyFactory(new ObjectMapper()), properties, metricsService);
    }

    private BacktestRequest createValidRequest() {
        return BacktestRequest.builder()
                .strategyName("buy_and_hold")
                .bars(series("100", "100", "110", "120"))
                .overrides(ConfigOverrides.builder().closeAtEnd(true).build())
                .build();
    }

    @Test
    void testRunBacktest_Success() {
        // Arrange
        BacktestRequest request = createValidRequest();

        // Act
        BacktestReport report = backtestService.runBacktest(request);

        // Assert
        assertNotNull(report.getRunId());
        assertEquals("buy_and_hold", report.getStrategyId());
        assertEquals("BuyAndHold", report.getStrategyName());
        assertEquals(4, report.getBarCount());
        assertEquals(request.getBars().get(0).getDate(), report.getStartDate());
        assertEquals(request.getBars().get(3).getDate(), report.getEndDate());
        assertAmount("11900", report.getPerformance().getFinalEquity());
        assertAmount("19", report.getPerformance().getTotalReturnPct());
        verify(metricsService).recordRunCompleted(anyLong(), eq(2), eq(0));
        verify(metricsService, never()).recordRunFailed();
    }

    @Test
    void testRunBacktest_ClearsRunIdFromMdc() {
        // Act
        backtestService.runBacktest(createValidRequest());

        // Assert
        assertNull(MDC.get(BacktestServiceImpl.RUN_ID_KEY));
    }

    @Test
    void testRunBacktest_UnknownStrategy_RecordsFailure() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setStrategyName("martingale");

        // Act & Assert
        assertThrows(BacktestConfigurationException.class, () -> backtestService.runBacktest(request));
        verify(metricsService).recordRunFailed();
        verify(metricsService, never()).recordRunCompleted(anyLong(), anyInt(), anyInt());
        assertNull(MDC.get(BacktestServiceImpl.RUN_ID_KEY));
    }

    @Test
    void testRunBacktest_MalformedBars_Throws() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setBars(List.of(series("100", "90").get(1), series("100").get(0)));

        // Act & Assert
        assertThrows(DataIntegrityException.class, () -> backtestService.runBacktest(request));
        verify(metricsService).recordRunFailed();
    }

    @Test
    void testRunBacktest_StrategyReturningNull_RecordsFailure() {
        // Arrange - a mocked strategy answers every decision with null
        StrategyFactory strategyFactory = mock(StrategyFactory.class);
        when(strategyFactory.createStrategy(eq("broken"), nullable(Map.class))).thenReturn(mock(Strategy.class));
        BacktestServiceImpl service = new BacktestServiceImpl(strategyFactory, properties, metricsService);
        BacktestRequest request = createValidRequest();
        request.setStrategyName("broken");

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> service.runBacktest(request));
        verify(metricsService).recordRunFailed();
        verify(metricsService, never()).recordRunCompleted(anyLong(), anyInt(), anyInt());
    }

    @Test
    void testResolveConfig_NoOverridesUsesProperties() {
        // Act
        BacktestConfig config = backtestService.resolveConfig(null);

        // Assert
        assertAmount("10000", config.getInitialCash());
        assertEquals(FillPolicy.NEXT_OPEN, config.getFillPolicy());
        assertAmount("0.95", config.getPositionFraction());
    }

    @Test
    void testResolveConfig_OverridesWin() {
        // Arrange
        ConfigOverrides overrides = ConfigOverrides.builder()
                .initialCash(new BigDecimal("5000"))
                .costModel("proportional")
                .proportionalRate(new BigDecimal("0.002"))
                .fillPolicy("same-close")
                .periodsPerYear(52)
                .build();

        // Act
        BacktestConfig config = backtestService.resolveConfig(overrides);

        // Assert
        assertAmount("5000", config.getInitialCash());
        assertEquals(CostModel.PROPORTIONAL, config.getCostModel());
        assertEquals(FillPolicy.SAME_CLOSE, config.getFillPolicy());
        assertEquals(52, config.getPeriodsPerYear());
        assertEquals(0.001, config.getRiskFreeRate(), "Untouched settings keep their defaults");
    }

    @Test
    void testResolveConfig_UnknownPolicy_Throws() {
        ConfigOverrides overrides = ConfigOverrides.builder().sizingPolicy("kelly").build();
        assertThrows(BacktestConfigurationException.class, () -> backtestService.resolveConfig(overrides));
    }
}
