package com.di.silverline.warehouse;

/**
 * Daily partitioning of a table. {@code expression} is the {@code PARTITION BY} expression
 * ({@code col} for a DATE column, {@code DATE(col)} for TIMESTAMP/DATETIME); {@code null} means unpartitioned.
 */
public record PartitionSpec(String field, String expression) {

    private static final PartitionSpec NONE = new PartitionSpec(null, null);

    public static PartitionSpec none() {
        return NONE;
    }

    public static PartitionSpec onDateColumn(String field) {
        return new PartitionSpec(field, "`" + field + "`");
    }

    /**
     * Derives daily partitioning from a column's type. Types that cannot drive a daily partition
     * (STRING, INT64 ...) leave the table unpartitioned.
     */
    public static PartitionSpec fromColumn(ColumnSpec column) {
        if (column == null || column.type() == null) {
            return NONE;
        }
        switch (column.type().toUpperCase()) {
            case "DATE":
                return onDateColumn(column.name());
            case "TIMESTAMP":
            case "DATETIME":
                return new PartitionSpec(column.name(), "DATE(`" + column.name() + "`)");
            default:
                return NONE;
        }
    }

    public boolean isPartitioned() {
        return field != null;
    }
}
