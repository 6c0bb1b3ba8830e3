package com.stockanalyzer.backtester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockanalyzer.backtester.config.BacktestProperties;
import com.stockanalyzer.backtester.domain.Bar;
import com.stockanalyzer.backtester.domain.FillPolicy;
import com.stockanalyzer.backtester.service.BacktestService;
import com.stockanalyzer.backtester.service.StrategyComparisonService;
import com.stockanalyzer.backtester.service.dto.BacktestReport;
import com.stockanalyzer.backtester.service.dto.BacktestRequest;
import com.stockanalyzer.backtester.service.dto.ComparisonRequest;
import com.stockanalyzer.backtester.service.dto.StrategyComparisonResult;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.stockanalyzer.backtester.domain.BarFixtures.series;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Context smoke test: configuration binding, bean wiring and report serialization.
 */
@SpringBootTest
class StrategyBacktesterApplicationTest {

    @Autowired
    private BacktestProperties properties;

    @Autowired
    private BacktestService backtestService;

    @Autowired
    private StrategyComparisonService comparisonService;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void testContextLoads_BindsDefaults() {
        assertEquals(0, properties.getInitialCash().compareTo(new BigDecimal("1000000")));
        assertEquals(FillPolicy.NEXT_OPEN, properties.toConfig().getFillPolicy());
        assertEquals(252, properties.getPeriodsPerYear());
    }

    @Test
    void testReportSerialization_UndefinedMetricsAsNull() throws Exception {
        // Arrange - never trades, so the Sharpe ratio is undefined
        BacktestRequest request = BacktestRequest.builder()
                .strategyName("macd")
                .bars(withHistogram(series("100", "101", "102")))
                .build();

        // Act
        BacktestReport report = backtestService.runBacktest(request);
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(report));

        // Assert
        JsonNode performance = json.get("performance");
        assertTrue(performance.has("sharpeRatio"));
        assertTrue(performance.get("sharpeRatio").isNull());
        assertEquals("2024-01-01", json.get("startDate").asText());
        assertEquals("2024-01-03", performance.get("equityCurve").get(2).get("date").asText());
        assertTrue(performance.get("undefinedMetrics").toString().contains("SHARPE_RATIO"));
    }

    @Test
    void testBarDeserialization() throws Exception {
        // Arrange
        String json = "{\"date\":\"2024-03-01\",\"open\":10.5,\"high\":11,\"low\":10,\"close\":10.8,"
                + "\"volume\":1200,\"indicators\":{\"RSI\":41.2}}";

        // Act
        Bar bar = objectMapper.readValue(json, Bar.class);

        // Assert
        assertEquals(LocalDate.of(2024, 3, 1), bar.getDate());
        assertEquals(0, bar.getClose().compareTo(new BigDecimal("10.8")));
        assertTrue(bar.hasIndicator("RSI"));
    }

    @Test
    void testComparisonRunsOnWorkerPool() {
        // Arrange
        ComparisonRequest request = ComparisonRequest.builder()
                .strategies(List.of(
                        ComparisonRequest.StrategySelection.builder().strategyName("buy_and_hold").build(),
                        ComparisonRequest.StrategySelection.builder().strategyName("macd").build()))
                .bars(withHistogram(series("100", "101", "103", "106")))
                .optimizationMetric("totalReturn")
                .build();

        // Act
        StrategyComparisonResult result = comparisonService.compare(request);

        // Assert
        assertEquals(2, result.getCompletedRuns());
        assertEquals("buy_and_hold", result.getBest().orElseThrow().getStrategyId());
    }

    @Test
    void testInvalidRequests_RejectedByMethodValidation() {
        // Arrange
        ComparisonRequest noBars = ComparisonRequest.builder()
                .strategies(List.of(ComparisonRequest.StrategySelection.builder().strategyName("buy_and_hold").build()))
                .build();
        BacktestRequest noStrategy = BacktestRequest.builder()
                .bars(series("100", "101"))
                .build();

        // Act & Assert
        ConstraintViolationException e = assertThrows(ConstraintViolationException.class,
                () -> comparisonService.compare(noBars));
        assertTrue(e.getMessage().contains("At least one bar is required"));
        assertThrows(ConstraintViolationException.class, () -> backtestService.runBacktest(noStrategy));
    }

    private static List<Bar> withHistogram(List<Bar> bars) {
        return bars.stream()
                .map(bar -> bar.toBuilder().indicator("MACD_histogram", BigDecimal.ONE).build())
                .toList();
    }
}
