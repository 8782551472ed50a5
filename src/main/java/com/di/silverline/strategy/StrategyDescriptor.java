package com.di.silverline.strategy;

import com.di.silverline.exception.InvalidStrategyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-table consolidation strategy: kind, business key, watermark column, snapshot partition field and
 * clustering hints. Immutable; built from configuration once at startup.
 *
 * <p>Which fields are mandatory depends on {@link #kind()}:
 * <ul>
 *   <li>{@code INCREMENTAL_MERGE}, {@code UPSERT_LATEST}: non-empty {@code keyColumns} and {@code orderingColumn}</li>
 *   <li>{@code REPLACE_PARTITION}: {@code partitionField}</li>
 * </ul>
 * The table name is trimmed on construction. Construction does not otherwise validate so that configuration errors can be collected per table;
 * {@link #validationErrors()} and {@link #requireValid()} do.
 */
public record StrategyDescriptor(String tableName,
                                 StrategyKind kind,
                                 List<String> keyColumns,
                                 String orderingColumn,
                                 String partitionField,
                                 List<String> clusterColumns) {

    /** BigQuery accepts at most four clustering columns. */
    public static final int MAX_CLUSTER_COLUMNS = 4;

    public StrategyDescriptor {
        tableName = tableName == null ? null : tableName.trim();
        keyColumns = immutableCopy(keyColumns);
        clusterColumns = immutableCopy(clusterColumns);
    }

    public static StrategyDescriptor incrementalMerge(String table, List<String> keys, String orderingColumn,
                                                      List<String> clusterColumns) {
        return new StrategyDescriptor(table, StrategyKind.INCREMENTAL_MERGE, keys, orderingColumn, null, clusterColumns);
    }

    public static StrategyDescriptor upsertLatest(String table, List<String> keys, String orderingColumn,
                                                  List<String> clusterColumns) {
        return new StrategyDescriptor(table, StrategyKind.UPSERT_LATEST, keys, orderingColumn, null, clusterColumns);
    }

    public static StrategyDescriptor replacePartition(String table, String partitionField, List<String> clusterColumns) {
        return new StrategyDescriptor(table, StrategyKind.REPLACE_PARTITION, List.of(), null, partitionField, clusterColumns);
    }

    /**
     * Returns every problem with this descriptor; empty when it is executable.
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();
        if (isBlank(tableName)) {
            errors.add("table name is blank");
        }
        if (kind == null) {
            errors.add("strategy kind is missing");
            return errors;
        }
        if (kind.isKeyed()) {
            if (keyColumns.isEmpty()) {
                errors.add(kind.getConfigKey() + " requires key_columns");
            }
            if (isBlank(orderingColumn)) {
                errors.add(kind.getConfigKey() + " requires ordering_column");
            } else if (keyColumns.contains(orderingColumn)) {
                errors.add("ordering_column '" + orderingColumn + "' must not be a key column");
            }
        } else if (isBlank(partitionField)) {
            errors.add(kind.getConfigKey() + " requires partition_field");
        }
        checkNames("key_columns", keyColumns, errors);
        checkNames("cluster_columns", clusterColumns, errors);
        if (clusterColumns.size() > MAX_CLUSTER_COLUMNS) {
            errors.add("at most " + MAX_CLUSTER_COLUMNS + " cluster_columns are allowed, got " + clusterColumns.size());
        }
        return errors;
    }

    public boolean isValid() {
        return validationErrors().isEmpty();
    }

    /**
     * @throws InvalidStrategyException listing every problem, if any
     */
    public StrategyDescriptor requireValid() {
        List<String> errors = validationErrors();
        if (!errors.isEmpty()) {
            throw new InvalidStrategyException(tableName, errors);
        }
        return this;
    }

    /** Columns this strategy reads from staging: keys and watermark, or nothing for replace. */
    public List<String> referencedColumns() {
        List<String> cols = new ArrayList<>(keyColumns);
        if (orderingColumn != null) {
            cols.add(orderingColumn);
        }
        return cols;
    }

    private static void checkNames(String field, List<String> names, List<String> errors) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (isBlank(name)) {
                errors.add(field + " contains a blank name");
            } else if (!seen.add(name)) {
                errors.add(field + " lists '" + name + "' more than once");
            }
        }
    }

    private static List<String> immutableCopy(List<String> source) {
        if (source == null) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
