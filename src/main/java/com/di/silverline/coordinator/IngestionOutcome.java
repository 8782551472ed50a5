package com.di.silverline.coordinator;

import com.di.silverline.exception.ErrorKind;
import com.di.silverline.strategy.StrategyKind;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * What happened to one table in one run. Failed outcomes always carry {@code errorKind} and
 * {@code errorDetail}; Skipped outcomes carry the reason in {@code message}.
 */
@Value
@Builder(toBuilder = true)
public class IngestionOutcome {

    String tableName;
    LocalDate logicalDate;
    OutcomeStatus status;

    /** Strategy that was (or would have been) applied; null when the table is not configured. */
    StrategyKind strategy;

    long rowsAffected;
    int filesProcessed;
    long durationMs;

    /** Set on Failed outcomes, and on Skipped ones for unconfigured tables. */
    ErrorKind errorKind;
    /** Failed only. */
    String errorDetail;

    String message;

    public static IngestionOutcome success(String tableName, LocalDate logicalDate, StrategyKind strategy,
                                           long rowsAffected, int filesProcessed) {
        return IngestionOutcome.builder()
                .tableName(tableName)
                .logicalDate(logicalDate)
                .status(OutcomeStatus.SUCCESS)
                .strategy(strategy)
                .rowsAffected(rowsAffected)
                .filesProcessed(filesProcessed)
                .build();
    }

    public static IngestionOutcome skipped(String tableName, LocalDate logicalDate, StrategyKind strategy,
                                           String reason) {
        return IngestionOutcome.builder()
                .tableName(tableName)
                .logicalDate(logicalDate)
                .status(OutcomeStatus.SKIPPED)
                .strategy(strategy)
                .message(reason)
                .build();
    }

    public static IngestionOutcome failed(String tableName, LocalDate logicalDate, StrategyKind strategy,
                                          Throwable error) {
        return IngestionOutcome.builder()
                .tableName(tableName)
                .logicalDate(logicalDate)
                .status(OutcomeStatus.FAILED)
                .strategy(strategy)
                .errorKind(ErrorKind.categorize(error))
                .errorDetail(detailOf(error))
                .build();
    }

    public boolean isFailed() {
        return status == OutcomeStatus.FAILED;
    }

    private static String detailOf(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
