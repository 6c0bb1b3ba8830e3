package com.stockanalyzer.backtester.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Portfolio value at one bar's close. {@code equity == cash + positionQuantity * close}.
 */
@Value
@Builder(toBuilder = true)
public class EquityPoint {

    int barIndex;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    BigDecimal close;
    BigDecimal cash;
    long positionQuantity;
    BigDecimal equity;

    public boolean isInvested() {
        return positionQuantity > 0;
    }
}
