package com.stockanalyzer.backtester.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * One trading period: OHLCV plus the indicator values attached to it.
 * <p>
 * An indicator key that is absent means the indicator was never supplied. A key
 * mapped to {@code null} means the value is not yet available for this bar
 * (insufficient lookback).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Bar {

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    Long volume;

    @Singular
    Map<String, BigDecimal> indicators;

    public boolean hasIndicator(String name) {
        return indicators.containsKey(name);
    }

    /**
     * Value of the named indicator, empty when it is absent or not yet available.
     */
    public Optional<BigDecimal> indicator(String name) {
        return Optional.ofNullable(indicators.get(name));
    }
}
