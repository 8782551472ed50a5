package com.di.silverline.staging;

import com.di.silverline.warehouse.ColumnSpec;
import com.di.silverline.warehouse.TableRef;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Transient relation holding one partition's bronze rows for exactly one run.
 *
 * <p>Besides the file columns every staged row carries {@link #FILE_SEQ_COLUMN}, the 0-based
 * position of its source file in arrival order. A relation with a {@code null} {@link #ref()} is the
 * empty-partition marker: nothing was loaded and nothing needs discarding.
 *
 * @param schema data columns, in file order, excluding {@link #FILE_SEQ_COLUMN}
 */
public record StagingRelation(String ownerTable,
                              LocalDate logicalDate,
                              TableRef ref,
                              List<ColumnSpec> schema,
                              long rowCount,
                              int fileCount) {

    public static final String FILE_SEQ_COLUMN = "_ingest_file_seq";

    public StagingRelation {
        schema = schema == null ? List.of() : List.copyOf(schema);
    }

    public static StagingRelation empty(String ownerTable, LocalDate logicalDate) {
        return new StagingRelation(ownerTable, logicalDate, null, List.of(), 0L, 0);
    }

    public boolean isEmptyPartition() {
        return ref == null;
    }

    public List<String> columnNames() {
        return schema.stream().map(ColumnSpec::name).toList();
    }

    public boolean hasColumn(String name) {
        return column(name).isPresent();
    }

    public Optional<ColumnSpec> column(String name) {
        return schema.stream().filter(c -> c.name().equalsIgnoreCase(name)).findFirst();
    }
}
