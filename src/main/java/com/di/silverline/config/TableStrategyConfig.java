package com.di.silverline.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry under {@code table_strategies} in the strategy file. Field names follow the file's
 * snake_case keys; the short aliases ({@code pk}, {@code event_ts}, {@code updated_at}, {@code cluster_by})
 * are accepted as well.
 */
@Data
public class TableStrategyConfig {

    private String strategy;

    @JsonProperty("key_columns")
    @JsonAlias({"pk", "keys"})
    private List<String> keyColumns = new ArrayList<>();

    @JsonProperty("ordering_column")
    @JsonAlias({"event_ts", "updated_at"})
    private String orderingColumn;

    @JsonProperty("partition_field")
    private String partitionField;

    @JsonProperty("cluster_columns")
    @JsonAlias("cluster_by")
    private List<String> clusterColumns = new ArrayList<>();
}
