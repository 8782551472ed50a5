package com.di.silverline.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/** Root of the strategy YAML. */
@Data
public class StrategyConfigFile {

    @JsonProperty("table_strategies")
    private Map<String, TableStrategyConfig> tableStrategies = new LinkedHashMap<>();
}
