package com.di.silverline.coordinator;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.exception.ErrorKind;
import com.di.silverline.exception.IngestionCancelledException;
import com.di.silverline.exception.RunInProgressException;
import com.di.silverline.executor.StrategyExecutors;
import com.di.silverline.locate.PartitionLocator;
import com.di.silverline.locate.PartitionRef;
import com.di.silverline.staging.StagingLoader;
import com.di.silverline.staging.StagingRelation;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.strategy.StrategyKind;
import com.di.silverline.strategy.StrategyRegistry;
import com.di.silverline.util.MdcPropagation;
import com.di.silverline.warehouse.DatasetProvisioner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one logical date across tables: resolve strategy, locate the partition, stage it, apply the
 * strategy, record the outcome, discard staging.
 *
 * <p>Every table yields exactly one {@link IngestionOutcome}; no table's failure stops another.
 * Tables run concurrently up to {@code silverline.parallelism}; the steps of one table run in order,
 * each under its own budget. Staging is discarded on every path, and only after the step reading it
 * has stopped. Interrupting the calling thread cancels in-flight tables (their staging is still
 * cleaned up) and returns a complete outcome list with the unfinished tables marked cancelled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionCoordinator {

    private final StrategyRegistry registry;
    private final PartitionLocator locator;
    private final StagingLoader stagingLoader;
    private final StrategyExecutors executors;
    private final DatasetProvisioner datasetProvisioner;
    private final StepRunner steps;
    private final InFlightRuns inFlight;
    private final IngestionMetrics metrics;
    private final SilverlineProperties properties;

    /** Runs every table in scope for {@code logicalDate}. */
    public List<IngestionOutcome> run(LocalDate logicalDate) {
        return execute(logicalDate, List.of()).getOutcomes();
    }

    /** Runs only {@code tables} (e.g. a retry of the failed ones). */
    public List<IngestionOutcome> run(LocalDate logicalDate, Collection<String> tables) {
        return execute(logicalDate, tables).getOutcomes();
    }

    /**
     * @param requestedTables tables to run; empty means {@code silverline.tables}, or every registered table
     */
    public RunSummary execute(LocalDate logicalDate, Collection<String> requestedTables) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        List<String> tables = tablesInScope(requestedTables);

        MDC.put(MdcPropagation.RUN_ID, runId);
        MDC.put(MdcPropagation.LOGICAL_DATE, logicalDate.toString());
        try {
            log.info("[COORDINATOR] run {} for {}: {} table(s) {}", runId, logicalDate, tables.size(), tables);
            List<IngestionOutcome> outcomes = tables.isEmpty() ? List.of() : processAll(runId, logicalDate, tables);

            RunSummary summary = RunSummary.builder()
                    .runId(runId)
                    .logicalDate(logicalDate)
                    .startedAt(startedAt)
                    .finishedAt(Instant.now())
                    .outcomes(outcomes)
                    .build();
            log.info("[COORDINATOR] run {} finished in {} ms: {} rows affected, {}", runId,
                    summary.getDurationMs(), summary.getTotalRowsAffected(), summary.getStatusCounts());
            return summary;
        } finally {
            MDC.remove(MdcPropagation.RUN_ID);
            MDC.remove(MdcPropagation.LOGICAL_DATE);
        }
    }

    // ------------------------------------------------------------------ //
    // Run level                                                           //
    // ------------------------------------------------------------------ //

    private List<IngestionOutcome> processAll(String runId, LocalDate logicalDate, List<String> tables) {
        try {
            datasetProvisioner.ensureDatasets();
        } catch (RuntimeException e) {
            log.error("[COORDINATOR] dataset provisioning failed, failing all tables: {}", e.getMessage());
            return tables.stream()
                    .map(t -> recorded(IngestionOutcome.failed(t, logicalDate, strategyOf(t), e)))
                    .toList();
        }

        int poolSize = Math.max(1, Math.min(properties.getParallelism(), tables.size()));
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize,
                r -> new Thread(r, "silverline-table-" + seq.incrementAndGet()));

        Map<String, Future<IngestionOutcome>> futures = new LinkedHashMap<>();
        for (String table : tables) {
            futures.put(table, pool.submit(MdcPropagation.wrapCallable(() -> processTable(table, logicalDate))));
        }
        pool.shutdown();

        List<IngestionOutcome> outcomes = new ArrayList<>(tables.size());
        boolean interrupted = false;
        for (Map.Entry<String, Future<IngestionOutcome>> entry : futures.entrySet()) {
            String table = entry.getKey();
            Future<IngestionOutcome> future = entry.getValue();
            if (!interrupted) {
                try {
                    outcomes.add(future.get());
                    continue;
                } catch (InterruptedException e) {
                    interrupted = true;
                    log.warn("[COORDINATOR] run {} interrupted, cancelling in-flight tables", runId);
                    futures.values().forEach(f -> f.cancel(true));
                } catch (ExecutionException e) {
                    outcomes.add(recorded(IngestionOutcome.failed(table, logicalDate, strategyOf(table), e.getCause())));
                    continue;
                }
            }
            outcomes.add(outcomeAfterCancel(table, logicalDate, future));
        }

        if (interrupted) {
            awaitCleanup(pool);
            Thread.currentThread().interrupt();
        }
        return outcomes;
    }

    private IngestionOutcome outcomeAfterCancel(String table, LocalDate logicalDate, Future<IngestionOutcome> future) {
        if (future.isDone() && !future.isCancelled()) {
            try {
                return future.get();
            } catch (InterruptedException | ExecutionException e) {
                return recorded(IngestionOutcome.failed(table, logicalDate, strategyOf(table), e));
            }
        }
        return recorded(IngestionOutcome.failed(table, logicalDate, strategyOf(table),
                new IngestionCancelledException("Run cancelled before table '" + table + "' completed")));
    }

    /** Lets cancelled tables finish their staging cleanup. Called with the interrupt flag cleared. */
    private void awaitCleanup(ExecutorService pool) {
        long graceMs = properties.getTimeouts().getCleanupGrace().toMillis();
        try {
            if (!pool.awaitTermination(graceMs, TimeUnit.MILLISECONDS)) {
                log.warn("[COORDINATOR] table workers still running {} ms after cancellation", graceMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------ //
    // Table level                                                         //
    // ------------------------------------------------------------------ //

    IngestionOutcome processTable(String table, LocalDate logicalDate) {
        long started = System.nanoTime();
        MDC.put(MdcPropagation.TABLE, table);
        try {
            return recorded(withDuration(processTableSteps(table, logicalDate), started));
        } finally {
            MDC.remove(MdcPropagation.TABLE);
        }
    }

    private IngestionOutcome processTableSteps(String table, LocalDate logicalDate) {
        Optional<StrategyDescriptor> resolved = registry.resolve(table);
        if (resolved.isEmpty()) {
            log.info("[COORDINATOR] {}: no strategy configured, skipped", table);
            return IngestionOutcome.skipped(table, logicalDate, null, ErrorKind.NOT_CONFIGURED.getDescription())
                    .toBuilder().errorKind(ErrorKind.NOT_CONFIGURED).build();
        }
        StrategyDescriptor descriptor = resolved.get();
        StrategyKind kind = descriptor.kind();

        if (!inFlight.tryAcquire(table, logicalDate)) {
            RunInProgressException busy = new RunInProgressException(table, logicalDate);
            log.warn("[COORDINATOR] {}", busy.getMessage());
            return IngestionOutcome.failed(table, logicalDate, kind, busy);
        }

        StagingRelation staging = null;
        StepRunner.RunningStep<StagingRelation> load = null;
        StepRunner.RunningStep<Long> apply = null;
        try {
            descriptor.requireValid();
            SilverlineProperties.Timeouts budgets = properties.getTimeouts();

            PartitionRef partition = steps.run("locate", budgets.getListing(),
                    () -> locator.locate(table, logicalDate));

            load = steps.start("stage", () -> stagingLoader.load(partition));
            staging = load.await(budgets.getStaging());
            if (staging.isEmptyPartition()) {
                return IngestionOutcome.skipped(table, logicalDate, kind, "no files for " + logicalDate);
            }

            StagingRelation staged = staging;
            apply = steps.start("apply", () -> executors.apply(table, staged, descriptor, logicalDate));
            long rows = apply.await(budgets.getApply());
            return IngestionOutcome.success(table, logicalDate, kind, rows, staging.fileCount());
        } catch (RuntimeException e) {
            ErrorKind errorKind = ErrorKind.categorize(e);
            log.error("[COORDINATOR] {} {} failed [{}]: {}", table, logicalDate, errorKind, e.getMessage());
            return IngestionOutcome.failed(table, logicalDate, kind, e).toBuilder()
                    .filesProcessed(staging == null ? 0 : staging.fileCount())
                    .build();
        } finally {
            finishAfter(table, logicalDate, load, apply, staging);
        }
    }

    /**
     * Staging and the (table, date) slot must outlive every step still touching them. A step abandoned
     * on timeout or cancellation keeps both until it stops, so a retry cannot overlap its writes.
     */
    private void finishAfter(String table, LocalDate logicalDate, StepRunner.RunningStep<StagingRelation> load,
                             StepRunner.RunningStep<Long> apply, StagingRelation staging) {
        if (apply != null && !apply.isSettled()) {
            log.warn("[COORDINATOR] {} {} still being applied, staging and run slot held until it stops",
                    table, logicalDate);
            apply.whenSettled(() -> release(table, logicalDate, load, staging));
        } else if (load != null && !load.isSettled()) {
            log.warn("[COORDINATOR] {} {} still staging, run slot held until it stops", table, logicalDate);
            load.whenSettled(() -> release(table, logicalDate, load, staging));
        } else {
            release(table, logicalDate, load, staging);
        }
    }

    private void release(String table, LocalDate logicalDate, StepRunner.RunningStep<StagingRelation> load,
                         StagingRelation staging) {
        try {
            // a stage step that finished after its budget still produced a relation to drop
            StagingRelation toDiscard = staging != null || load == null ? staging : load.succeededValue().orElse(null);
            if (toDiscard != null) {
                stagingLoader.discard(toDiscard);
            }
        } finally {
            inFlight.release(table, logicalDate);
        }
    }

    // ------------------------------------------------------------------ //
    // Helpers                                                             //
    // ------------------------------------------------------------------ //

    private List<String> tablesInScope(Collection<String> requested) {
        Collection<String> source;
        if (requested != null && !requested.isEmpty()) {
            source = requested;
        } else if (properties.getTables() != null && !properties.getTables().isEmpty()) {
            source = properties.getTables();
        } else {
            source = registry.tableNames();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String t : source) {
            if (t != null && !t.isBlank()) {
                distinct.add(t.trim());
            }
        }
        return List.copyOf(distinct);
    }

    private StrategyKind strategyOf(String table) {
        return registry.resolve(table).map(StrategyDescriptor::kind).orElse(null);
    }

    private IngestionOutcome recorded(IngestionOutcome outcome) {
        metrics.record(outcome);
        return outcome;
    }

    private static IngestionOutcome withDuration(IngestionOutcome outcome, long startedNanos) {
        return outcome.toBuilder()
                .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos))
                .build();
    }
}
