package com.di.silverline.warehouse;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.exception.IngestionCancelledException;
import com.di.silverline.exception.TimeoutExceededException;
import com.di.silverline.exception.WarehouseException;
import com.di.silverline.staging.StagingRelation;
import com.di.silverline.warehouse.sql.WarehouseStatement;
import com.google.cloud.RetryOption;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Clustering;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.DatasetInfo;
import com.google.cloud.bigquery.ExternalTableDefinition;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FormatOptions;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableDefinition;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TimePartitioning;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * {@link Warehouse} backed by BigQuery query jobs.
 *
 * <p>Every job gets a readable id ({@code silverline-<label>-<uuid>}), a server-side timeout and a
 * client-side wait bounded by the same budget. When the wait is interrupted or runs out, the job
 * is cancelled before the exception propagates so no statement keeps running unattended.
 * Bronze files are read through a temporary external table definition, never a permanent table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BigQueryWarehouse implements Warehouse {

    private static final String BRONZE_ALIAS = "bronze_files";
    private static final int HTTP_CONFLICT = 409;

    private final BigQuery bigQuery;
    private final SilverlineProperties properties;

    // ------------------------------------------------------------------ //
    // Datasets and metadata                                               //
    // ------------------------------------------------------------------ //

    @Override
    public void ensureDataset(String dataset) {
        DatasetId id = DatasetId.of(properties.getProjectId(), dataset);
        try {
            if (bigQuery.getDataset(id) != null) {
                log.debug("[TARGET] dataset {} exists", id);
                return;
            }
            bigQuery.create(DatasetInfo.newBuilder(id).setLocation(properties.getLocation()).build());
            log.info("[TARGET] created dataset {} in {}", id, properties.getLocation());
        } catch (BigQueryException e) {
            if (e.getCode() == HTTP_CONFLICT) {
                log.debug("[TARGET] dataset {} created concurrently", id);
                return;
            }
            throw new WarehouseException("Cannot ensure dataset " + dataset + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<TargetRelation> describeTable(TableRef ref) {
        Table table;
        try {
            table = bigQuery.getTable(tableId(ref));
        } catch (BigQueryException e) {
            throw new WarehouseException("Cannot describe " + ref + ": " + e.getMessage(), e);
        }
        if (table == null) {
            return Optional.empty();
        }
        TableDefinition definition = table.getDefinition();
        List<ColumnSpec> schema = toColumns(definition.getSchema());
        PartitionSpec partition = PartitionSpec.none();
        List<String> clusterColumns = List.of();
        if (definition instanceof StandardTableDefinition std) {
            partition = partitionOf(std.getTimePartitioning(), schema);
            Clustering clustering = std.getClustering();
            if (clustering != null && clustering.getFields() != null) {
                clusterColumns = clustering.getFields();
            }
        }
        Long numRows = table.getNumRows() == null ? null : table.getNumRows().longValue();
        return Optional.of(new TargetRelation(ref, schema, partition, clusterColumns, numRows));
    }

    @Override
    public void dropTable(TableRef ref) {
        try {
            boolean deleted = bigQuery.delete(tableId(ref));
            log.debug("[TARGET] drop {} -> {}", ref, deleted ? "deleted" : "absent");
        } catch (BigQueryException e) {
            throw new WarehouseException("Cannot drop " + ref + ": " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------ //
    // Bronze reads                                                        //
    // ------------------------------------------------------------------ //

    @Override
    public List<ColumnSpec> inferFileSchema(String uri, Duration timeout) {
        QueryJobConfiguration config = QueryJobConfiguration.newBuilder("SELECT * FROM " + BRONZE_ALIAS)
                .setTableDefinitions(Map.of(BRONZE_ALIAS, bronzeDefinition(List.of(uri))))
                .setUseLegacySql(false)
                .setDryRun(true)
                .build();
        try {
            Job dryRun = bigQuery.create(JobInfo.of(config));
            JobStatistics.QueryStatistics stats = dryRun.getStatistics();
            Schema schema = stats == null ? null : stats.getSchema();
            if (schema == null) {
                throw new WarehouseException("Dry run returned no schema for " + uri);
            }
            return toColumns(schema);
        } catch (BigQueryException e) {
            throw new WarehouseException("Cannot read schema of " + uri + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long loadStaging(TableRef staging, List<String> uris, Duration timeout) {
        QueryJobConfiguration config = QueryJobConfiguration.newBuilder(stagingSql(uris))
                .setTableDefinitions(Map.of(BRONZE_ALIAS, bronzeDefinition(uris)))
                .setDestinationTable(tableId(staging))
                .setWriteDisposition(JobInfo.WriteDisposition.WRITE_TRUNCATE)
                .setCreateDisposition(JobInfo.CreateDisposition.CREATE_IF_NEEDED)
                .setUseLegacySql(false)
                .setJobTimeoutMs(timeout.toMillis())
                .build();
        runJob(config, "stage-" + staging.table(), timeout);

        try {
            Table table = bigQuery.getTable(tableId(staging));
            if (table == null) {
                throw new WarehouseException("Staging table " + staging + " missing after load");
            }
            long expiresAt = System.currentTimeMillis() + properties.getStaging().getExpiration().toMillis();
            bigQuery.update(table.toBuilder().setExpirationTime(expiresAt).build());
            return table.getNumRows() == null ? 0L : table.getNumRows().longValue();
        } catch (BigQueryException e) {
            throw new WarehouseException("Cannot finalize staging " + staging + ": " + e.getMessage(), e);
        }
    }

    static String stagingSql(List<String> uris) {
        StringBuilder seq = new StringBuilder("CASE _FILE_NAME");
        for (int i = 0; i < uris.size(); i++) {
            seq.append(" WHEN '").append(uris.get(i).replace("'", "\\'")).append("' THEN ").append(i);
        }
        seq.append(" END");
        return "SELECT src.*, " + seq + " AS `" + StagingRelation.FILE_SEQ_COLUMN + "` FROM " + BRONZE_ALIAS + " AS src";
    }

    // ------------------------------------------------------------------ //
    // Statements                                                          //
    // ------------------------------------------------------------------ //

    @Override
    public long execute(WarehouseStatement statement, Duration timeout) {
        log.debug("[TARGET] {} on {}:\n{}", statement.label(), statement.target(), statement.sql());
        QueryJobConfiguration config = QueryJobConfiguration.newBuilder(statement.sql())
                .setUseLegacySql(false)
                .setJobTimeoutMs(timeout.toMillis())
                .build();
        Job job = runJob(config, statement.label(), timeout);
        JobStatistics.QueryStatistics stats = job.getStatistics();
        Long affected = stats == null ? null : stats.getNumDmlAffectedRows();
        return affected == null ? 0L : affected;
    }

    private Job runJob(QueryJobConfiguration config, String label, Duration timeout) {
        JobId jobId = JobId.newBuilder()
                .setProject(properties.getProjectId())
                .setLocation(properties.getLocation())
                .setJob("silverline-" + sanitize(label) + "-" + UUID.randomUUID())
                .build();
        long started = System.nanoTime();
        Job job;
        try {
            job = bigQuery.create(JobInfo.newBuilder(config).setJobId(jobId).build());
            job = job.waitFor(RetryOption.totalTimeout(org.threeten.bp.Duration.ofMillis(timeout.toMillis())));
        } catch (InterruptedException e) {
            cancel(jobId);
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException("Interrupted while waiting for BigQuery job " + jobId.getJob(), e);
        } catch (BigQueryException e) {
            cancel(jobId);
            if (elapsed(started).compareTo(timeout) >= 0) {
                throw new TimeoutExceededException(label, timeout);
            }
            throw new WarehouseException("BigQuery job " + jobId.getJob() + " failed: " + e.getMessage(), e);
        }

        if (job == null) {
            throw new WarehouseException("BigQuery job " + jobId.getJob() + " no longer exists");
        }
        if (!job.isDone()) {
            cancel(jobId);
            throw new TimeoutExceededException(label, timeout);
        }
        BigQueryError error = job.getStatus().getError();
        if (error != null) {
            if (elapsed(started).compareTo(timeout) >= 0) {
                throw new TimeoutExceededException(label, timeout);
            }
            throw new WarehouseException("BigQuery job " + jobId.getJob() + " failed: " + error.getMessage());
        }
        log.debug("[TARGET] job {} done in {} ms", jobId.getJob(), elapsed(started).toMillis());
        return job;
    }

    private void cancel(JobId jobId) {
        boolean interrupted = Thread.interrupted();
        try {
            boolean cancelled = bigQuery.cancel(jobId);
            log.warn("[TARGET] cancel requested for job {} (accepted={})", jobId.getJob(), cancelled);
        } catch (BigQueryException e) {
            log.warn("[TARGET] could not cancel job {}: {}", jobId.getJob(), e.getMessage());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ------------------------------------------------------------------ //
    // Helpers                                                             //
    // ------------------------------------------------------------------ //

    /** Parquet carries its own schema, so none is given. */
    static ExternalTableDefinition bronzeDefinition(List<String> uris) {
        return ExternalTableDefinition.newBuilder(uris, (Schema) null, FormatOptions.parquet()).build();
    }

    private TableId tableId(TableRef ref) {
        String project = ref.project() == null ? properties.getProjectId() : ref.project();
        return TableId.of(project, ref.dataset(), ref.table());
    }

    private static PartitionSpec partitionOf(TimePartitioning tp, List<ColumnSpec> schema) {
        if (tp == null) {
            return PartitionSpec.none();
        }
        if (tp.getField() == null) {
            return new PartitionSpec("_PARTITIONDATE", "_PARTITIONDATE");
        }
        return schema.stream()
                .filter(c -> c.name().equalsIgnoreCase(tp.getField()))
                .findFirst()
                .map(PartitionSpec::fromColumn)
                .orElse(PartitionSpec.onDateColumn(tp.getField()));
    }

    static List<ColumnSpec> toColumns(Schema schema) {
        List<ColumnSpec> columns = new ArrayList<>();
        if (schema == null) {
            return columns;
        }
        for (Field field : schema.getFields()) {
            columns.add(new ColumnSpec(field.getName(), typeOf(field), field.getMode() == Field.Mode.REQUIRED));
        }
        return columns;
    }

    private static String typeOf(Field field) {
        String base;
        FieldList sub = field.getSubFields();
        if (sub != null && !sub.isEmpty()) {
            base = sub.stream()
                    .map(f -> "`" + f.getName() + "` " + typeOf(f))
                    .collect(Collectors.joining(", ", "STRUCT<", ">"));
        } else {
            base = field.getType().getStandardType().name();
        }
        return field.getMode() == Field.Mode.REPEATED ? "ARRAY<" + base + ">" : base;
    }

    private static String sanitize(String label) {
        return label.toLowerCase().replaceAll("[^a-z0-9_-]", "_");
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
