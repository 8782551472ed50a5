package com.di.silverline.strategy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of consolidation strategies. The config key is the value used in
 * {@code table_strategies.<table>.strategy}.
 */
public enum StrategyKind {

    /** Append-heavy operational tables: dedup by event timestamp, last writer wins per key. */
    INCREMENTAL_MERGE("incremental_merge"),
    /** Full-snapshot tables: the logical date's partition is replaced wholesale. */
    REPLACE_PARTITION("replace_partition"),
    /** Master/reference tables (SCD1): newest "last modified" row overwrites every column. */
    UPSERT_LATEST("upsert_scd1");

    private final String configKey;

    StrategyKind(String configKey) {
        this.configKey = configKey;
    }

    public String getConfigKey() {
        return configKey;
    }

    /** True for the kinds that reconcile on business keys plus an ordering column. */
    public boolean isKeyed() {
        return this != REPLACE_PARTITION;
    }

    /**
     * Resolves a config key (case-insensitive, trimmed). Unknown or blank keys resolve to empty;
     * the registry turns that into a configuration error.
     */
    public static Optional<StrategyKind> fromConfigKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.configKey.equals(normalized))
                .findFirst();
    }
}
