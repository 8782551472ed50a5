package com.di.silverline.exception;

import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.storage.StorageException;

import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Error taxonomy for per-table ingestion outcomes.
 * <p>Usage: {@code ErrorKind kind = ErrorKind.categorize(exception);}
 * <p>{@link IngestionException}s carry their own kind; anything else is matched against
 * {@link #MATCHERS} in order, falling back to {@link #UNKNOWN}.
 */
public enum ErrorKind {

    INVALID_STRATEGY("Invalid strategy", "Strategy descriptor is missing a field required by its kind"),
    NOT_CONFIGURED("Not configured", "Table has no strategy in the registry"),
    SOURCE_UNAVAILABLE("Source unavailable", "Bronze partition listing could not be performed"),
    SCHEMA_CONFLICT("Schema conflict", "Files of one partition have incompatible schemas"),
    PARTIAL_REPLACE("Partial replace", "Partition was deleted but the re-insert did not complete"),
    TIMEOUT_EXCEEDED("Timeout exceeded", "A step exceeded its time budget"),
    CANCELLED("Cancelled", "The run was cancelled while the step was in flight"),
    RUN_IN_PROGRESS("Run in progress", "Another run for the same table and date is active"),
    WAREHOUSE_ERROR("Warehouse error", "A warehouse job or metadata call failed"),
    UNKNOWN("Unknown error", "Unclassified error");

    private final String name;
    private final String description;

    ErrorKind(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorKind> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorKind::isTimeout, TIMEOUT_EXCEEDED);
        MATCHERS.put(ErrorKind::isCancellation, CANCELLED);
        MATCHERS.put(t -> t instanceof StorageException, SOURCE_UNAVAILABLE);
        MATCHERS.put(t -> t instanceof BigQueryException, WAREHOUSE_ERROR);
    }

    public static ErrorKind categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof IngestionException) {
            return ((IngestionException) exception).getKind();
        }
        for (Map.Entry<Predicate<Throwable>, ErrorKind> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        Throwable cause = exception.getCause();
        if (cause != null && cause != exception) {
            return categorize(cause);
        }
        return UNKNOWN;
    }

    private static boolean isTimeout(Throwable t) {
        if (t instanceof TimeoutException || t instanceof SocketTimeoutException) {
            return true;
        }
        String msg = t.getMessage();
        if (msg == null) {
            return false;
        }
        String lower = msg.toLowerCase(Locale.ROOT);
        return lower.contains("timed out") || lower.contains("timeout");
    }

    private static boolean isCancellation(Throwable t) {
        return t instanceof InterruptedException || t instanceof CancellationException;
    }

    @Override
    public String toString() {
        return name();
    }
}
