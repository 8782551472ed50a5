package com.di.silverline.coordinator;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.exception.ErrorKind;
import com.di.silverline.exception.IngestionCancelledException;
import com.di.silverline.exception.SourceUnavailableException;
import com.di.silverline.exception.WarehouseException;
import com.di.silverline.executor.IncrementalMergeExecutor;
import com.di.silverline.executor.ReplacePartitionExecutor;
import com.di.silverline.executor.StrategyExecutors;
import com.di.silverline.executor.UpsertLatestExecutor;
import com.di.silverline.locate.PartitionLocator;
import com.di.silverline.locate.PartitionPathLayout;
import com.di.silverline.staging.StagingLoader;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.strategy.StrategyRegistry;
import com.di.silverline.support.InMemoryBronzeStore;
import com.di.silverline.support.InMemoryWarehouse;
import com.di.silverline.support.TestFixtures;
import com.di.silverline.warehouse.ColumnSpec;
import com.di.silverline.warehouse.DatasetProvisioner;
import com.di.silverline.warehouse.TableRef;
import com.di.silverline.warehouse.TargetRelationManager;
import com.di.silverline.warehouse.sql.LatestWinsMergeStatement;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.di.silverline.support.TestFixtures.col;
import static com.di.silverline.support.TestFixtures.row;
import static com.di.silverline.support.TestFixtures.schema;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IngestionCoordinator Tests")
class IngestionCoordinatorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 8, 18);
    private static final Instant T0 = Instant.parse("2025-08-18T01:00:00Z");
    private static final List<ColumnSpec> HIS_SCHEMA = schema(col("id", "STRING"), col("f_fecha", "TIMESTAMP"));
    private static final List<ColumnSpec> PIE_SCHEMA = schema(col("sku", "STRING"), col("qty", "INT64"));

    private final PartitionPathLayout layout = new PartitionPathLayout("bronze", TestFixtures.SOURCE_DB);

    private InMemoryWarehouse warehouse;
    private InMemoryBronzeStore bronze;
    private SilverlineProperties props;
    private InFlightRuns inFlight;
    private SimpleMeterRegistry meters;
    private StepRunner steps;
    private IngestionCoordinator coordinator;
    private int fileSeq;

    @BeforeEach
    void setUp() {
        warehouse = new InMemoryWarehouse();
        bronze = new InMemoryBronzeStore(TestFixtures.BUCKET);
        props = TestFixtures.properties();
        props.setTables(List.of("alm_his_1", "alm_pie_1"));
        inFlight = new InFlightRuns();
        meters = new SimpleMeterRegistry();
        rebuild();
    }

    @AfterEach
    void tearDown() {
        steps.shutdown();
    }

    private void rebuild() {
        if (steps != null) {
            steps.shutdown();
        }
        StrategyRegistry registry = StrategyRegistry.of(List.of(
                StrategyDescriptor.incrementalMerge("alm_his_1", List.of("id"), "f_fecha", List.of("id")),
                StrategyDescriptor.incrementalMerge("alm_his_2", List.of("id"), "f_fecha", List.of("id")),
                StrategyDescriptor.replacePartition("alm_pie_1", "snapshot_date", null)));
        TargetRelationManager targets = new TargetRelationManager(warehouse, props);
        StrategyExecutors executors = new StrategyExecutors(List.of(
                new IncrementalMergeExecutor(warehouse, targets, props),
                new ReplacePartitionExecutor(warehouse, targets, props),
                new UpsertLatestExecutor(warehouse, targets, props)));
        steps = new StepRunner(props);
        coordinator = new IngestionCoordinator(registry, new PartitionLocator(bronze, props),
                new StagingLoader(warehouse, props), executors, new DatasetProvisioner(warehouse, props),
                steps, inFlight, new IngestionMetrics(meters), props);
    }

    @SafeVarargs
    private void bronzeFile(String table, List<ColumnSpec> fileSchema, Map<String, Object>... rows) {
        String name = layout.prefix(table, DAY) + "part-" + (fileSeq++) + ".parquet";
        String uri = bronze.put(name, T0.plusSeconds(fileSeq)).uri();
        warehouse.addFile(uri, fileSchema, List.of(rows));
    }

    private void bothTablesHaveFiles() {
        bronzeFile("alm_his_1", HIS_SCHEMA, row("id", "X", "f_fecha", T0), row("id", "Y", "f_fecha", T0));
        bronzeFile("alm_pie_1", PIE_SCHEMA, row("sku", "A", "qty", 1L));
    }

    private static Map<String, IngestionOutcome> byTable(List<IngestionOutcome> outcomes) {
        return outcomes.stream().collect(Collectors.toMap(IngestionOutcome::getTableName, Function.identity()));
    }

    private double outcomeCount(String status, String strategy) {
        Counter counter = meters.find(IngestionMetrics.OUTCOMES).tag("status", status).tag("strategy", strategy).counter();
        return counter == null ? 0 : counter.count();
    }

    // ============================================
    // Happy path
    // ============================================

    @Test
    @DisplayName("Should apply each configured table and drop its staging")
    void testSuccessfulRun() {
        bothTablesHaveFiles();

        RunSummary summary = coordinator.execute(DAY, List.of());

        assertEquals(2, summary.getOutcomes().size());
        Map<String, IngestionOutcome> outcomes = byTable(summary.getOutcomes());
        IngestionOutcome his = outcomes.get("alm_his_1");
        assertEquals(OutcomeStatus.SUCCESS, his.getStatus());
        assertEquals(2, his.getRowsAffected());
        assertEquals(1, his.getFilesProcessed());
        IngestionOutcome pie = outcomes.get("alm_pie_1");
        assertEquals(OutcomeStatus.SUCCESS, pie.getStatus());
        assertEquals(1, pie.getRowsAffected());

        assertEquals(3, summary.getTotalRowsAffected());
        assertFalse(summary.hasFailures());
        assertEquals(DAY, summary.getLogicalDate());
        assertNotNull(summary.getRunId());
        assertTrue(warehouse.liveStagingTables().isEmpty());
        assertEquals(2, warehouse.dropped().size());
        assertEquals(Set.of("bronze1", "silver1"), warehouse.datasets());
        assertEquals(1.0, outcomeCount("success", "incremental_merge"));
        assertEquals(1.0, outcomeCount("success", "replace_partition"));
        assertFalse(inFlight.isActive("alm_his_1", DAY));
    }

    @Test
    @DisplayName("Empty partition should be skipped without touching the warehouse")
    void testEmptyPartitionSkipped() {
        bronzeFile("alm_pie_1", PIE_SCHEMA, row("sku", "A", "qty", 1L));

        Map<String, IngestionOutcome> outcomes = byTable(coordinator.run(DAY));

        IngestionOutcome his = outcomes.get("alm_his_1");
        assertEquals(OutcomeStatus.SKIPPED, his.getStatus());
        assertEquals(0, his.getRowsAffected());
        assertEquals("no files for " + DAY, his.getMessage());
        assertNull(his.getErrorKind());
        assertFalse(warehouse.exists(new TableRef(TestFixtures.PROJECT, "silver1", "alm_his_1")));
        assertEquals(OutcomeStatus.SUCCESS, outcomes.get("alm_pie_1").getStatus());
        assertEquals(1, warehouse.stagingLoads().size());
    }

    @Test
    @DisplayName("Table without a strategy should be skipped as not configured")
    void testNotConfigured() {
        bothTablesHaveFiles();

        List<IngestionOutcome> outcomes = coordinator.run(DAY, List.of("alm_his_1", "unknown_table"));

        assertEquals(2, outcomes.size());
        IngestionOutcome unknown = byTable(outcomes).get("unknown_table");
        assertEquals(OutcomeStatus.SKIPPED, unknown.getStatus());
        assertEquals(ErrorKind.NOT_CONFIGURED, unknown.getErrorKind());
        assertNull(unknown.getStrategy());
        assertEquals(1.0, outcomeCount("skipped", "none"));
    }

    @Test
    @DisplayName("Explicit table list should restrict the run")
    void testSubsetRun() {
        bothTablesHaveFiles();

        List<IngestionOutcome> outcomes = coordinator.run(DAY, List.of(" alm_pie_1 ", "alm_pie_1"));

        assertEquals(1, outcomes.size());
        assertEquals("alm_pie_1", outcomes.get(0).getTableName());
        assertEquals(0, warehouse.executedCount(LatestWinsMergeStatement.class));
    }

    @Test
    @DisplayName("Registry tables should be used when none are configured")
    void testRegistryScope() {
        props.setTables(List.of());
        rebuild();

        List<IngestionOutcome> outcomes = coordinator.run(DAY);

        assertEquals(List.of("alm_his_1", "alm_his_2", "alm_pie_1"),
                outcomes.stream().map(IngestionOutcome::getTableName).toList());
        assertTrue(outcomes.stream().allMatch(o -> o.getStatus() == OutcomeStatus.SKIPPED));
    }

    // ============================================
    // Failure isolation
    // ============================================

    @Test
    @DisplayName("Schema conflict on one table should not stop the others")
    void testSchemaConflictIsolated() {
        bronzeFile("alm_his_1", HIS_SCHEMA, row("id", "X", "f_fecha", T0));
        bronzeFile("alm_his_1", schema(col("id", "INT64"), col("f_fecha", "TIMESTAMP")), row("id", 1L, "f_fecha", T0));
        bronzeFile("alm_pie_1", PIE_SCHEMA, row("sku", "A", "qty", 1L));

        RunSummary summary = coordinator.execute(DAY, List.of());

        assertEquals(2, summary.getOutcomes().size());
        Map<String, IngestionOutcome> outcomes = byTable(summary.getOutcomes());
        IngestionOutcome his = outcomes.get("alm_his_1");
        assertEquals(OutcomeStatus.FAILED, his.getStatus());
        assertEquals(ErrorKind.SCHEMA_CONFLICT, his.getErrorKind());
        assertNotNull(his.getErrorDetail());
        assertEquals(OutcomeStatus.SUCCESS, outcomes.get("alm_pie_1").getStatus());
        assertTrue(summary.hasFailures());
        assertEquals(1L, summary.getStatusCounts().get(OutcomeStatus.FAILED));
        assertTrue(warehouse.liveStagingTables().isEmpty());
    }

    @Test
    @DisplayName("Warehouse failure during apply should fail the table and still drop staging")
    void testApplyFailureCleansStaging() {
        bothTablesHaveFiles();
        warehouse.failOn(LatestWinsMergeStatement.class, new WarehouseException("quota exceeded"));

        Map<String, IngestionOutcome> outcomes = byTable(coordinator.run(DAY));

        IngestionOutcome his = outcomes.get("alm_his_1");
        assertEquals(OutcomeStatus.FAILED, his.getStatus());
        assertEquals(ErrorKind.WAREHOUSE_ERROR, his.getErrorKind());
        assertEquals("quota exceeded", his.getErrorDetail());
        assertEquals(1, his.getFilesProcessed());
        assertEquals(OutcomeStatus.SUCCESS, outcomes.get("alm_pie_1").getStatus());
        assertTrue(warehouse.liveStagingTables().isEmpty());
        assertFalse(inFlight.isActive("alm_his_1", DAY));
    }

    @Test
    @DisplayName("Listing failure should be reported as source unavailable")
    void testSourceUnavailable() {
        bronze.failWith(new SourceUnavailableException("bucket unreachable", null));

        List<IngestionOutcome> outcomes = coordinator.run(DAY);

        assertEquals(2, outcomes.size());
        assertTrue(outcomes.stream().allMatch(o -> o.getErrorKind() == ErrorKind.SOURCE_UNAVAILABLE));
        assertTrue(warehouse.stagingLoads().isEmpty());
    }

    @Test
    @DisplayName("Dataset provisioning failure should fail every table")
    void testDatasetFailure() {
        bothTablesHaveFiles();
        warehouse.failEnsureDataset(new WarehouseException("permission denied"));

        List<IngestionOutcome> outcomes = coordinator.run(DAY);

        assertEquals(2, outcomes.size());
        assertTrue(outcomes.stream().allMatch(IngestionOutcome::isFailed));
        assertTrue(outcomes.stream().allMatch(o -> o.getErrorKind() == ErrorKind.WAREHOUSE_ERROR));
        assertTrue(warehouse.stagingLoads().isEmpty());
    }

    @Test
    @DisplayName("Second run for the same table and date should be rejected while one is active")
    void testRunInProgress() {
        bothTablesHaveFiles();
        assertTrue(inFlight.tryAcquire("alm_his_1", DAY));

        Map<String, IngestionOutcome> outcomes = byTable(coordinator.run(DAY));

        IngestionOutcome his = outcomes.get("alm_his_1");
        assertEquals(OutcomeStatus.FAILED, his.getStatus());
        assertEquals(ErrorKind.RUN_IN_PROGRESS, his.getErrorKind());
        assertEquals(OutcomeStatus.SUCCESS, outcomes.get("alm_pie_1").getStatus());
        assertTrue(inFlight.isActive("alm_his_1", DAY));
        assertEquals(1, warehouse.stagingLoads().size());
    }

    // ============================================
    // Budgets and cancellation
    // ============================================

    @Test
    @DisplayName("Apply step over budget should time out and still drop staging")
    void testApplyTimeout() {
        props.getTimeouts().setApply(Duration.ofMillis(200));
        rebuild();
        bothTablesHaveFiles();
        warehouse.beforeExecute(LatestWinsMergeStatement.class, () -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IngestionCancelledException("merge job cancelled", e);
            }
        });

        Map<String, IngestionOutcome> outcomes = byTable(coordinator.run(DAY));

        IngestionOutcome his = outcomes.get("alm_his_1");
        assertEquals(OutcomeStatus.FAILED, his.getStatus());
        assertEquals(ErrorKind.TIMEOUT_EXCEEDED, his.getErrorKind());
        assertEquals(OutcomeStatus.SUCCESS, outcomes.get("alm_pie_1").getStatus());
        assertTrue(warehouse.liveStagingTables().isEmpty());
    }

    @Test
    @DisplayName("Interrupting the caller should cancel in-flight tables and clean their staging")
    void testCancellation() throws Exception {
        props.setTables(List.of("alm_his_1"));
        rebuild();
        bronzeFile("alm_his_1", HIS_SCHEMA, row("id", "X", "f_fecha", T0));
        CountDownLatch applying = new CountDownLatch(1);
        warehouse.beforeExecute(LatestWinsMergeStatement.class, () -> {
            applying.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IngestionCancelledException("merge job cancelled", e);
            }
        });

        AtomicReference<List<IngestionOutcome>> result = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            result.set(coordinator.run(DAY));
            interruptFlag.set(Thread.currentThread().isInterrupted());
        });
        caller.start();
        assertTrue(applying.await(5, TimeUnit.SECONDS));
        caller.interrupt();
        caller.join(10_000);

        assertFalse(caller.isAlive());
        assertTrue(interruptFlag.get());
        List<IngestionOutcome> outcomes = result.get();
        assertEquals(1, outcomes.size());
        assertEquals(ErrorKind.CANCELLED, outcomes.get(0).getErrorKind());
        assertTrue(warehouse.liveStagingTables().isEmpty());
    }

    /** Hook that keeps the step busy through cancellation until {@code finish} opens. */
    private static Runnable holdUntil(CountDownLatch finish, AtomicInteger interruptsIgnored) {
        return () -> {
            boolean done = false;
            while (!done) {
                try {
                    done = finish.await(10, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    interruptsIgnored.incrementAndGet();
                }
            }
        };
    }

    private static boolean eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    @Test
    @DisplayName("Run slot should stay held while an abandoned apply is still writing")
    void testAbandonedApplyHoldsRunSlot() throws Exception {
        props.getTimeouts().setApply(Duration.ofMillis(200));
        props.getTimeouts().setCleanupGrace(Duration.ofMillis(100));
        rebuild();
        bothTablesHaveFiles();
        CountDownLatch finish = new CountDownLatch(1);
        AtomicInteger interruptsIgnored = new AtomicInteger();
        warehouse.beforeExecute(LatestWinsMergeStatement.class, holdUntil(finish, interruptsIgnored));

        IngestionOutcome first = byTable(coordinator.run(DAY)).get("alm_his_1");

        assertEquals(ErrorKind.TIMEOUT_EXCEEDED, first.getErrorKind());
        assertTrue(inFlight.isActive("alm_his_1", DAY));
        assertEquals(1, warehouse.liveStagingTables().size());

        IngestionOutcome retry = coordinator.run(DAY, List.of("alm_his_1")).get(0);
        assertEquals(ErrorKind.RUN_IN_PROGRESS, retry.getErrorKind());

        finish.countDown();
        assertTrue(eventually(() -> !inFlight.isActive("alm_his_1", DAY)));
        assertTrue(warehouse.liveStagingTables().isEmpty());
        assertEquals(1, warehouse.executedCount(LatestWinsMergeStatement.class));
        assertTrue(interruptsIgnored.get() > 0);

        IngestionOutcome later = coordinator.run(DAY, List.of("alm_his_1")).get(0);
        assertEquals(OutcomeStatus.SUCCESS, later.getStatus());
    }

    @Test
    @DisplayName("Run slot should stay held while an abandoned stage step runs, and its staging dropped after")
    void testAbandonedStageHoldsRunSlot() throws Exception {
        props.setTables(List.of("alm_his_1"));
        props.getTimeouts().setStaging(Duration.ofMillis(200));
        props.getTimeouts().setCleanupGrace(Duration.ofMillis(100));
        rebuild();
        bronzeFile("alm_his_1", HIS_SCHEMA, row("id", "X", "f_fecha", T0));
        CountDownLatch finish = new CountDownLatch(1);
        warehouse.beforeLoadStaging(holdUntil(finish, new AtomicInteger()));

        IngestionOutcome first = coordinator.run(DAY).get(0);

        assertEquals(ErrorKind.TIMEOUT_EXCEEDED, first.getErrorKind());
        assertTrue(inFlight.isActive("alm_his_1", DAY));

        finish.countDown();
        assertTrue(eventually(() -> !inFlight.isActive("alm_his_1", DAY)));
        assertEquals(1, warehouse.stagingLoads().size());
        assertTrue(warehouse.liveStagingTables().isEmpty());
        assertEquals(warehouse.stagingLoads(), warehouse.dropped());
    }
}
