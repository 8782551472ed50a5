package com.di.silverline.config;

import com.di.silverline.warehouse.TableRef;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Single binding for the ingestion engine's environment: where bronze files live, which
 * datasets to write, which tables to process and how long each step may take.
 * Per-table strategies are not here; they live in the file named by {@code strategies-file}.
 *
 * <pre>
 * silverline:
 *   project-id: dwh-building
 *   location: EU
 *   bronze-bucket: valsurtruck-dwh-bronze
 *   bronze-root: bronze
 *   source-database: pk_gest_xer
 *   file-suffix: .parquet
 *   zone-id: UTC
 *   datasets:
 *     bronze: bronze1
 *     silver: silver1
 *   tables: alm_his_1,alm_his_2
 *   parallelism: 4
 *   timeouts:
 *     listing: 2m
 *     staging: 30m
 *     apply: 60m
 *     cleanup-grace: 30s
 *   staging:
 *     expiration: 24h
 *   strategies-file: classpath:table_strategies.yml
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "silverline")
public class SilverlineProperties {

    /** GCP project that owns the datasets and runs the jobs. */
    @NotBlank
    private String projectId;

    /** Dataset location; must match the bucket's region for external reads. */
    private String location = "EU";

    /** Bucket holding bronze Parquet files. */
    @NotBlank
    private String bronzeBucket;

    /** Top-level prefix inside the bucket. */
    private String bronzeRoot = "bronze";

    /** Source database segment of the bronze path. */
    @NotBlank
    private String sourceDatabase;

    /** Only objects ending with this suffix are considered data files. */
    private String fileSuffix = ".parquet";

    /** Zone used to resolve "today" when a run is triggered without a date. */
    private String zoneId = "UTC";

    /**
     * Tables processed by a run that names none. Empty means every table in the strategy file.
     */
    private List<String> tables = new ArrayList<>();

    /** Tables processed concurrently within one run. */
    @Min(1)
    private int parallelism = 4;

    /** Location of the per-table strategy YAML (Spring resource syntax). */
    private String strategiesFile = "classpath:table_strategies.yml";

    @Valid
    @NotNull
    private Datasets datasets = new Datasets();

    @Valid
    @NotNull
    private Timeouts timeouts = new Timeouts();

    @Valid
    @NotNull
    private Staging staging = new Staging();

    public TableRef silverTable(String tableName) {
        return new TableRef(projectId, datasets.getSilver(), tableName);
    }

    /** Staging relations live next to the raw data, in the bronze dataset. */
    public TableRef stagingTable(String stagingName) {
        return new TableRef(projectId, datasets.getBronze(), stagingName);
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    @Data
    public static class Datasets {
        @NotBlank
        private String bronze = "bronze1";
        @NotBlank
        private String silver = "silver1";
    }

    @Data
    public static class Timeouts {
        /** Budget for listing one partition's files. */
        private Duration listing = Duration.ofMinutes(2);
        /** Budget for loading one partition into staging (schema checks included). */
        private Duration staging = Duration.ofMinutes(30);
        /** Budget for the strategy's statements against one target. */
        private Duration apply = Duration.ofMinutes(60);
        /** How long a timed-out or cancelled step may take to stop before it is abandoned. */
        private Duration cleanupGrace = Duration.ofSeconds(30);
    }

    @Data
    public static class Staging {
        /** Staging tables expire on their own after this, in case the process dies before dropping them. */
        private Duration expiration = Duration.ofHours(24);
    }
}
