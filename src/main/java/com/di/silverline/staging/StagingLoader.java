package com.di.silverline.staging;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.exception.SchemaConflictException;
import com.di.silverline.locate.PartitionRef;
import com.di.silverline.warehouse.ColumnSpec;
import com.di.silverline.warehouse.TableRef;
import com.di.silverline.warehouse.Warehouse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Materializes a located partition into a uniquely named staging table and discards it afterwards.
 *
 * <p>All files must share the first file's schema (same column names and types; column order and
 * nullability may differ). A mismatch fails the load with {@link SchemaConflictException} before
 * anything is written. Staging names are {@code <table>__stg_<yyyyMMdd>_<8 hex>}, so two runs never
 * share a relation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StagingLoader {

    private static final DateTimeFormatter NAME_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Warehouse warehouse;
    private final SilverlineProperties properties;

    public StagingRelation load(PartitionRef partition) {
        if (partition.isEmpty()) {
            log.info("[STAGING] {} {}: empty partition, nothing staged", partition.tableName(), partition.logicalDate());
            return StagingRelation.empty(partition.tableName(), partition.logicalDate());
        }
        Duration budget = properties.getTimeouts().getStaging();
        List<String> uris = partition.uris();

        List<ColumnSpec> schema = unifySchemas(partition.tableName(), uris, budget);

        TableRef ref = properties.stagingTable(stagingName(partition));
        long rows;
        try {
            rows = warehouse.loadStaging(ref, uris, budget);
        } catch (RuntimeException e) {
            log.error("[STAGING] {} {}: load into {} failed: {}", partition.tableName(), partition.logicalDate(),
                    ref, e.getMessage());
            dropWithInterruptCleared(ref);
            throw e;
        }
        log.info("[STAGING] {} {}: {} rows from {} file(s) staged in {}", partition.tableName(),
                partition.logicalDate(), rows, uris.size(), ref);
        return new StagingRelation(partition.tableName(), partition.logicalDate(), ref, schema, rows, uris.size());
    }

    /**
     * Drops the staging relation. Never throws; a failed drop is logged and left to the table's expiration.
     * Safe to call from an interrupted thread: the interrupt flag is cleared for the drop and restored after.
     */
    public void discard(StagingRelation staging) {
        if (staging == null || staging.isEmptyPartition()) {
            return;
        }
        dropWithInterruptCleared(staging.ref());
    }

    private void dropWithInterruptCleared(TableRef ref) {
        boolean interrupted = Thread.interrupted();
        try {
            dropQuietly(ref);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void dropQuietly(TableRef ref) {
        try {
            warehouse.dropTable(ref);
            log.debug("[STAGING] dropped {}", ref);
        } catch (RuntimeException e) {
            log.warn("[STAGING] could not drop {} (it will expire): {}", ref, e.getMessage());
        }
    }

    private List<ColumnSpec> unifySchemas(String tableName, List<String> uris, Duration budget) {
        String referenceUri = uris.get(0);
        List<ColumnSpec> reference = warehouse.inferFileSchema(referenceUri, budget);
        Map<String, String> conflicts = new LinkedHashMap<>();

        if (findColumn(reference, StagingRelation.FILE_SEQ_COLUMN).isPresent()) {
            conflicts.put(referenceUri, "uses reserved column " + StagingRelation.FILE_SEQ_COLUMN);
        }
        for (String uri : uris.subList(1, uris.size())) {
            String mismatch = describeMismatch(reference, warehouse.inferFileSchema(uri, budget));
            if (mismatch != null) {
                conflicts.put(uri, mismatch);
            }
        }
        if (!conflicts.isEmpty()) {
            throw new SchemaConflictException(tableName, referenceUri, conflicts);
        }
        return reference;
    }

    static String describeMismatch(List<ColumnSpec> reference, List<ColumnSpec> candidate) {
        List<String> missing = reference.stream()
                .filter(c -> findColumn(candidate, c.name()).isEmpty())
                .map(ColumnSpec::name).toList();
        List<String> extra = candidate.stream()
                .filter(c -> findColumn(reference, c.name()).isEmpty())
                .map(ColumnSpec::name).toList();
        List<String> retyped = reference.stream()
                .filter(c -> findColumn(candidate, c.name()).map(o -> !o.sameTypeAs(c)).orElse(false))
                .map(c -> c.name() + " " + c.type() + "->" + findColumn(candidate, c.name()).get().type())
                .toList();
        if (missing.isEmpty() && extra.isEmpty() && retyped.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        append(sb, "missing", missing);
        append(sb, "extra", extra);
        append(sb, "type", retyped);
        return sb.toString();
    }

    private static void append(StringBuilder sb, String label, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append("; ");
        }
        sb.append(label).append(": ").append(String.join(", ", items));
    }

    private static Optional<ColumnSpec> findColumn(List<ColumnSpec> schema, String name) {
        return schema.stream().filter(c -> c.name().equalsIgnoreCase(name)).findFirst();
    }

    private static String stagingName(PartitionRef partition) {
        return partition.tableName() + "__stg_" + partition.logicalDate().format(NAME_DATE) + "_"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
