package com.stockanalyzer.backtester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.stockanalyzer.backtester.domain.BacktestConfigurationException;
import com.stockanalyzer.backtester.domain.Strategy;
import com.stockanalyzer.backtester.domain.strategy.BollingerBandStrategy;
import com.stockanalyzer.backtester.domain.strategy.BuyAndHoldStrategy;
import com.stockanalyzer.backtester.domain.strategy.CompositeStrategy;
import com.stockanalyzer.backtester.domain.strategy.Indicators;
import com.stockanalyzer.backtester.domain.strategy.MacdStrategy;
import com.stockanalyzer.backtester.domain.strategy.MovingAverageCrossoverStrategy;
import com.stockanalyzer.backtester.domain.strategy.RsiStrategy;
import com.stockanalyzer.backtester.domain.strategy.StochasticStrategy;
import com.stockanalyzer.backtester.service.dto.StrategyDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Creates strategy instances from an id and a parameter set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyFactory {

    private final ObjectMapper objectMapper;

    /**
     * Create a strategy from its id and JSON parameters.
     *
     * @throws BacktestConfigurationException for an unknown id, malformed JSON or an invalid parameter
     */
    public Strategy createStrategy(String strategyId, String parametersJson) {
        if (parametersJson == null || parametersJson.isBlank()) {
            return createStrategy(strategyId, NullNode.getInstance());
        }
        try {
            return createStrategy(strategyId, objectMapper.readTree(parametersJson));
        } catch (JsonProcessingException e) {
            throw new BacktestConfigurationException("Malformed parameters for strategy " + strategyId
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    public Strategy createStrategy(String strategyId, Map<String, Object> parameters) {
        JsonNode params = parameters == null ? NullNode.getInstance() : objectMapper.valueToTree(parameters);
        return createStrategy(strategyId, params);
    }

    private Strategy createStrategy(String strategyId, JsonNode params) {
        if (strategyId == null || strategyId.isBlank()) {
            throw new BacktestConfigurationException("Strategy name is required");
        }
        log.debug("Creating strategy: {} with parameters: {}", strategyId, params);

        try {
            return switch (normalize(strategyId)) {
                case "buy_and_hold", "buyandhold" -> new BuyAndHoldStrategy();

                case "golden_cross", "ma_crossover", "movingaveragecrossover" -> new MovingAverageCrossoverStrategy(
                        textParam(params, "fastIndicator", Indicators.SMA_25),
                        textParam(params, "slowIndicator", Indicators.SMA_75));

                case "rsi" -> new RsiStrategy(
                        doubleParam(params, "oversold", RsiStrategy.DEFAULT_OVERSOLD),
                        doubleParam(params, "overbought", RsiStrategy.DEFAULT_OVERBOUGHT));

                case "macd" -> new MacdStrategy();

                case "bollinger", "bollinger_band" -> new BollingerBandStrategy();

                case "stochastic" -> new StochasticStrategy(
                        doubleParam(params, "oversold", StochasticStrategy.DEFAULT_OVERSOLD),
                        doubleParam(params, "overbought", StochasticStrategy.DEFAULT_OVERBOUGHT));

                case "combo", "composite" -> CompositeStrategy.withWeights(
                        doubleParam(params, "rsiWeight", CompositeStrategy.DEFAULT_RSI_WEIGHT),
                        doubleParam(params, "maWeight", CompositeStrategy.DEFAULT_MA_WEIGHT),
                        doubleParam(params, "macdWeight", CompositeStrategy.DEFAULT_MACD_WEIGHT),
                        doubleParam(params, "bbWeight", CompositeStrategy.DEFAULT_BB_WEIGHT),
                        doubleParam(params, "buyThreshold", CompositeStrategy.DEFAULT_THRESHOLD),
                        doubleParam(params, "sellThreshold", CompositeStrategy.DEFAULT_THRESHOLD));

                default -> throw new BacktestConfigurationException("Unknown strategy: " + strategyId);
            };
        } catch (IllegalArgumentException e) {
            throw new BacktestConfigurationException("Invalid parameters for strategy " + strategyId
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Strategies this factory can build, in display order.
     */
    public List<StrategyDescriptor> availableStrategies() {
        return List.of(
                descriptor("buy_and_hold", "Buy and Hold",
                        "Buys at the first opportunity and holds the position to the end", Map.of()),
                descriptor("golden_cross", "Golden Cross",
                        "Buys when the fast moving average crosses above the slow one, sells on the reverse cross",
                        params("fastIndicator", Indicators.SMA_25, "slowIndicator", Indicators.SMA_75)),
                descriptor("rsi", "RSI Reversal",
                        "Buys when RSI is oversold, sells when it is overbought",
                        params("oversold", RsiStrategy.DEFAULT_OVERSOLD, "overbought", RsiStrategy.DEFAULT_OVERBOUGHT)),
                descriptor("macd", "MACD Crossover",
                        "Buys when MACD crosses above its signal line, sells on the reverse cross", Map.of()),
                descriptor("bollinger", "Bollinger Bands",
                        "Buys at the lower band, sells at the upper band", Map.of()),
                descriptor("stochastic", "Stochastic Oscillator",
                        "Buys when %K and %D are oversold, sells when both are overbought",
                        params("oversold", StochasticStrategy.DEFAULT_OVERSOLD,
                                "overbought", StochasticStrategy.DEFAULT_OVERBOUGHT)),
                descriptor("combo", "Combined Signals",
                        "Weighted vote of RSI, moving average, MACD and Bollinger band signals",
                        comboDefaults()));
    }

    private static String normalize(String strategyId) {
        return strategyId.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private static double doubleParam(JsonNode params, String name, double defaultValue) {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isNumber()) {
            throw new BacktestConfigurationException("Parameter " + name + " must be numeric, got " + value);
        }
        return value.asDouble();
    }

    private static String textParam(JsonNode params, String name, String defaultValue) {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new BacktestConfigurationException("Parameter " + name + " must be an indicator name, got " + value);
        }
        return value.asText();
    }

    private static StrategyDescriptor descriptor(String id, String displayName, String description,
                                                 Map<String, Object> defaults) {
        return StrategyDescriptor.builder()
                .id(id)
                .displayName(displayName)
                .description(description)
                .defaultParameters(defaults)
                .build();
    }

    private static Map<String, Object> params(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(k1, v1);
        params.put(k2, v2);
        return params;
    }

    private static Map<String, Object> comboDefaults() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("rsiWeight", CompositeStrategy.DEFAULT_RSI_WEIGHT);
        params.put("maWeight", CompositeStrategy.DEFAULT_MA_WEIGHT);
        params.put("macdWeight", CompositeStrategy.DEFAULT_MACD_WEIGHT);
        params.put("bbWeight", CompositeStrategy.DEFAULT_BB_WEIGHT);
        params.put("buyThreshold", CompositeStrategy.DEFAULT_THRESHOLD);
        params.put("sellThreshold", CompositeStrategy.DEFAULT_THRESHOLD);
        return params;
    }
}
