package com.di.silverline.executor;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.exception.InvalidStrategyException;
import com.di.silverline.staging.StagingRelation;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.warehouse.TargetRelation;
import com.di.silverline.warehouse.TargetRelationManager;
import com.di.silverline.warehouse.Warehouse;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared checks for every strategy: the descriptor must be valid and of this executor's kind,
 * an empty staging relation writes nothing, and every column the descriptor names must be staged.
 * Only then is the target ensured and {@link #reconcile} invoked.
 */
@Slf4j
public abstract class AbstractStrategyExecutor implements StrategyExecutor {

    protected final Warehouse warehouse;
    protected final TargetRelationManager targets;
    protected final SilverlineProperties properties;

    protected AbstractStrategyExecutor(Warehouse warehouse, TargetRelationManager targets,
                                       SilverlineProperties properties) {
        this.warehouse = warehouse;
        this.targets = targets;
        this.properties = properties;
    }

    @Override
    public final long apply(String tableName, StagingRelation staging, StrategyDescriptor descriptor,
                            LocalDate logicalDate) {
        descriptor.requireValid();
        if (descriptor.kind() != kind()) {
            throw new InvalidStrategyException(tableName, List.of(
                    "descriptor is " + descriptor.kind().getConfigKey() + ", executor handles " + kind().getConfigKey()));
        }
        if (!descriptor.tableName().equals(tableName)) {
            throw new InvalidStrategyException(tableName, List.of(
                    "descriptor belongs to table '" + descriptor.tableName() + "'"));
        }
        if (staging.isEmptyPartition() || staging.rowCount() == 0) {
            log.info("[{}] {} {}: no staged rows, target left untouched", logTag(), tableName, logicalDate);
            return 0L;
        }
        List<String> missing = missingColumns(staging, descriptor);
        if (!missing.isEmpty()) {
            throw new InvalidStrategyException(tableName, missing.stream()
                    .map(c -> "column '" + c + "' is not present in the staged files")
                    .toList());
        }
        TargetRelation target = targets.ensure(tableName, descriptor, staging);
        long rows = reconcile(tableName, staging, descriptor, target, logicalDate);
        log.info("[{}] {} {}: {} row(s) affected in {}", logTag(), tableName, logicalDate, rows, target.ref());
        return rows;
    }

    protected abstract long reconcile(String tableName, StagingRelation staging, StrategyDescriptor descriptor,
                                      TargetRelation target, LocalDate logicalDate);

    protected abstract String logTag();

    /** Columns this strategy must find in the staged data. */
    protected List<String> requiredColumns(StrategyDescriptor descriptor) {
        List<String> required = new ArrayList<>(descriptor.referencedColumns());
        required.addAll(descriptor.clusterColumns());
        return required;
    }

    /**
     * Staged data columns that also exist in the target, in staged order. Staged columns the target
     * lacks are dropped with a warning since existing targets are never altered.
     */
    protected List<String> writableColumns(String tableName, StagingRelation staging, TargetRelation target) {
        List<String> writable = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (String column : staging.columnNames()) {
            if (target.column(column).isPresent()) {
                writable.add(column);
            } else {
                dropped.add(column);
            }
        }
        if (!dropped.isEmpty()) {
            log.warn("[{}] {}: staged columns {} are not in {} and will not be written",
                    logTag(), tableName, dropped, target.ref());
        }
        return writable;
    }

    protected Duration applyBudget() {
        return properties.getTimeouts().getApply();
    }

    private List<String> missingColumns(StagingRelation staging, StrategyDescriptor descriptor) {
        return requiredColumns(descriptor).stream()
                .distinct()
                .filter(c -> !staging.hasColumn(c))
                .toList();
    }
}
