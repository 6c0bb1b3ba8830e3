package com.stockanalyzer.backtester.service.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A strategy the factory can build, with the parameters it uses when none are given.
 */
@Value
@Builder
public class StrategyDescriptor {

    String id;
    String displayName;
    String description;
    Map<String, Object> defaultParameters;
}
