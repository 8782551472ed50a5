package com.di.silverline.warehouse;

import com.di.silverline.warehouse.sql.WarehouseStatement;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Everything the engine asks of the analytical warehouse. {@link BigQueryWarehouse} is the production
 * implementation; tests use an in-memory one.
 *
 * <p>All methods throw {@link com.di.silverline.exception.IngestionException} subclasses:
 * {@code TimeoutExceededException} when a job outlives its budget, {@code IngestionCancelledException}
 * when the calling thread is interrupted (the job is cancelled first), {@code WarehouseException}
 * for anything the warehouse rejects.
 */
public interface Warehouse {

    /** Creates the dataset if missing. Existing datasets are left untouched. */
    void ensureDataset(String dataset);

    /** Reads the schema of a single Parquet file without loading it. */
    List<ColumnSpec> inferFileSchema(String uri, Duration timeout);

    /**
     * Loads the given files into {@code staging} (replacing any content) and adds an integer
     * {@code _ingest_file_seq} column holding each row's file position in {@code uris}.
     *
     * @return rows loaded
     */
    long loadStaging(TableRef staging, List<String> uris, Duration timeout);

    Optional<TargetRelation> describeTable(TableRef ref);

    /**
     * Runs one DML/DDL statement.
     *
     * @return rows affected (0 for DDL)
     */
    long execute(WarehouseStatement statement, Duration timeout);

    /** Drops the table if it exists. */
    void dropTable(TableRef ref);
}
