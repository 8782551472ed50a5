package com.di.silverline.coordinator;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for ingestion outcomes.
 * <ul>
 *   <li>{@code silverline.ingestion.outcomes{status,strategy}}: one count per table outcome</li>
 *   <li>{@code silverline.ingestion.rows{strategy}}: rows affected by successful tables</li>
 *   <li>{@code silverline.ingestion.table.duration{table,status}}: wall time per table</li>
 * </ul>
 */
@Component
public class IngestionMetrics {

    static final String OUTCOMES = "silverline.ingestion.outcomes";
    static final String ROWS = "silverline.ingestion.rows";
    static final String DURATION = "silverline.ingestion.table.duration";

    private final MeterRegistry meterRegistry;

    public IngestionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void record(IngestionOutcome outcome) {
        String status = outcome.getStatus().name().toLowerCase();
        String strategy = outcome.getStrategy() == null ? "none" : outcome.getStrategy().getConfigKey();

        Counter.builder(OUTCOMES)
                .description("Table ingestion outcomes")
                .tag("status", status)
                .tag("strategy", strategy)
                .register(meterRegistry)
                .increment();

        if (outcome.getStatus() == OutcomeStatus.SUCCESS) {
            DistributionSummary.builder(ROWS)
                    .description("Rows affected per successful table ingestion")
                    .tag("strategy", strategy)
                    .register(meterRegistry)
                    .record(outcome.getRowsAffected());
        }

        Timer.builder(DURATION)
                .description("Time to ingest one table for one logical date")
                .tag("table", outcome.getTableName())
                .tag("status", status)
                .register(meterRegistry)
                .record(outcome.getDurationMs(), TimeUnit.MILLISECONDS);
    }
}
