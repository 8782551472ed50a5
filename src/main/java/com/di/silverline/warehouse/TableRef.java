package com.di.silverline.warehouse;

import java.util.Objects;

/**
 * Fully qualified warehouse table: project, dataset, table.
 */
public record TableRef(String project, String dataset, String table) {

    public TableRef {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(table, "table");
    }

    /** {@code project.dataset.table}, or {@code dataset.table} when no project is set. */
    public String qualified() {
        return (project == null || project.isBlank() ? "" : project + ".") + dataset + "." + table;
    }

    /** Backtick-quoted form for use in GoogleSQL statements. */
    public String sql() {
        return "`" + qualified() + "`";
    }

    @Override
    public String toString() {
        return qualified();
    }
}
