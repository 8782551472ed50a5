package com.di.silverline.exception;

import java.time.LocalDate;

/**
 * Replace-partition deleted the target partition but the insert did not complete.
 * The partition is left empty until the table is re-run for the same date.
 */
public class PartialReplaceException extends IngestionException {

    private final LocalDate partitionDate;
    private final long deletedRows;

    public PartialReplaceException(String tableName, LocalDate partitionDate, long deletedRows, Throwable cause) {
        super(ErrorKind.PARTIAL_REPLACE,
                String.format("Partition %s of '%s' was cleared (%d rows deleted) but the insert failed: %s. "
                                + "Re-run the table for this date.",
                        partitionDate, tableName, deletedRows, cause == null ? "unknown" : cause.getMessage()),
                cause);
        this.partitionDate = partitionDate;
        this.deletedRows = deletedRows;
    }

    public LocalDate getPartitionDate() {
        return partitionDate;
    }

    public long getDeletedRows() {
        return deletedRows;
    }
}
