package com.di.silverline.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A strategy descriptor is missing a field its kind requires, names an unknown kind, or
 * references columns that do not exist. Raised at registry load for configuration errors and by
 * executors before any statement is issued.
 */
public class InvalidStrategyException extends IngestionException {

    private final Map<String, List<String>> problemsByTable;

    public InvalidStrategyException(String tableName, List<String> problems) {
        this(Map.of(String.valueOf(tableName), List.copyOf(problems)));
    }

    public InvalidStrategyException(Map<String, List<String>> problemsByTable) {
        super(ErrorKind.INVALID_STRATEGY, format(problemsByTable));
        this.problemsByTable = Collections.unmodifiableMap(new LinkedHashMap<>(problemsByTable));
    }

    public Map<String, List<String>> getProblemsByTable() {
        return problemsByTable;
    }

    private static String format(Map<String, List<String>> problemsByTable) {
        return problemsByTable.entrySet().stream()
                .map(e -> String.format("table '%s': %s", e.getKey(), String.join("; ", e.getValue())))
                .collect(Collectors.joining(" | ", "Invalid strategy configuration: ", ""));
    }
}
