package com.di.silverline.exception;

import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.storage.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorKind Tests")
class ErrorKindTest {

    // ============================================
    // Ingestion exceptions carry their own kind
    // ============================================

    @Test
    @DisplayName("Ingestion exceptions should map to their declared kind")
    void testIngestionExceptions() {
        assertEquals(ErrorKind.INVALID_STRATEGY,
                ErrorKind.categorize(new InvalidStrategyException("t", List.of("bad"))));
        assertEquals(ErrorKind.SOURCE_UNAVAILABLE,
                ErrorKind.categorize(new SourceUnavailableException("down", null)));
        assertEquals(ErrorKind.SCHEMA_CONFLICT,
                ErrorKind.categorize(new SchemaConflictException("t", "gs://a", Map.of("gs://b", "extra: x"))));
        assertEquals(ErrorKind.PARTIAL_REPLACE,
                ErrorKind.categorize(new PartialReplaceException("t", LocalDate.of(2025, 8, 18), 3, null)));
        assertEquals(ErrorKind.TIMEOUT_EXCEEDED,
                ErrorKind.categorize(new TimeoutExceededException("apply", Duration.ofSeconds(1))));
        assertEquals(ErrorKind.CANCELLED, ErrorKind.categorize(new IngestionCancelledException("stop")));
        assertEquals(ErrorKind.RUN_IN_PROGRESS,
                ErrorKind.categorize(new RunInProgressException("t", LocalDate.of(2025, 1, 1))));
        assertEquals(ErrorKind.WAREHOUSE_ERROR, ErrorKind.categorize(new WarehouseException("boom")));
    }

    @Test
    @DisplayName("Warehouse error mentioning a timeout keeps its declared kind")
    void testDeclaredKindWins() {
        assertEquals(ErrorKind.WAREHOUSE_ERROR, ErrorKind.categorize(new WarehouseException("connection timeout")));
    }

    // ============================================
    // Foreign exceptions
    // ============================================

    @Test
    @DisplayName("Should categorize client library and JDK exceptions")
    void testForeignExceptions() {
        assertEquals(ErrorKind.TIMEOUT_EXCEEDED, ErrorKind.categorize(new TimeoutException()));
        assertEquals(ErrorKind.TIMEOUT_EXCEEDED, ErrorKind.categorize(new SocketTimeoutException("read")));
        assertEquals(ErrorKind.TIMEOUT_EXCEEDED, ErrorKind.categorize(new RuntimeException("Job timed out")));
        assertEquals(ErrorKind.CANCELLED, ErrorKind.categorize(new InterruptedException()));
        assertEquals(ErrorKind.CANCELLED, ErrorKind.categorize(new CancellationException()));
        assertEquals(ErrorKind.SOURCE_UNAVAILABLE, ErrorKind.categorize(new StorageException(503, "unavailable")));
        assertEquals(ErrorKind.WAREHOUSE_ERROR, ErrorKind.categorize(new BigQueryException(400, "bad query")));
    }

    @Test
    @DisplayName("Should look through wrapping exceptions")
    void testCauseChain() {
        Exception wrapped = new ExecutionException(new IllegalStateException("wrap",
                new SchemaConflictException("t", "gs://a", Map.of("gs://b", "type: x"))));
        assertEquals(ErrorKind.SCHEMA_CONFLICT, ErrorKind.categorize(wrapped));
    }

    @Test
    @DisplayName("Unrecognized or null should be UNKNOWN")
    void testUnknown() {
        assertEquals(ErrorKind.UNKNOWN, ErrorKind.categorize(new IllegalStateException("odd")));
        assertEquals(ErrorKind.UNKNOWN, ErrorKind.categorize(null));
    }

    @Test
    @DisplayName("Schema conflict should name the conflicting files")
    void testSchemaConflictMessage() {
        SchemaConflictException ex = new SchemaConflictException("alm_his_1", "gs://b/f1.parquet",
                Map.of("gs://b/f2.parquet", "missing: f_fecha"));
        assertTrue(ex.getMessage().contains("gs://b/f1.parquet"));
        assertTrue(ex.getMessage().contains("gs://b/f2.parquet"));
        assertEquals(List.of("gs://b/f2.parquet"), ex.getConflictingFiles());
    }
}
