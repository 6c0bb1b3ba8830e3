package com.stockanalyzer.backtester.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class RejectedAction {

    int barIndex;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    ActionType actionType;
    String action;
    RejectionReason reason;
    String message;
}
