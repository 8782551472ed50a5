package com.di.silverline.exception;

import java.time.LocalDate;

/**
 * Another run for the identical (table, logical date) is still active in this process.
 */
public class RunInProgressException extends IngestionException {

    public RunInProgressException(String tableName, LocalDate logicalDate) {
        super(ErrorKind.RUN_IN_PROGRESS,
                String.format("A run for '%s' on %s is already in progress", tableName, logicalDate));
    }
}
