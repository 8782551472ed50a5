package com.di.silverline.executor;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.exception.InvalidStrategyException;
import com.di.silverline.staging.StagingRelation;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.warehouse.TargetRelation;
import com.di.silverline.warehouse.TargetRelationManager;
import com.di.silverline.warehouse.Warehouse;
import com.di.silverline.warehouse.sql.LatestWinsMergeStatement;

import java.time.LocalDate;
import java.util.List;

/**
 * Base for the keyed strategies: one latest-wins {@code MERGE} per partition.
 * Subclasses decide whether key columns are rewritten on a match.
 */
public abstract class LatestWinsMergeExecutor extends AbstractStrategyExecutor {

    protected LatestWinsMergeExecutor(Warehouse warehouse, TargetRelationManager targets,
                                      SilverlineProperties properties) {
        super(warehouse, targets, properties);
    }

    protected abstract boolean overwritesKeyColumns();

    @Override
    protected long reconcile(String tableName, StagingRelation staging, StrategyDescriptor descriptor,
                             TargetRelation target, LocalDate logicalDate) {
        List<String> missingInTarget = descriptor.referencedColumns().stream()
                .filter(c -> target.column(c).isEmpty())
                .toList();
        if (!missingInTarget.isEmpty()) {
            throw new InvalidStrategyException(tableName, missingInTarget.stream()
                    .map(c -> "column '" + c + "' is not present in " + target.ref())
                    .toList());
        }
        LatestWinsMergeStatement merge = new LatestWinsMergeStatement(
                target.ref(),
                staging.ref(),
                descriptor.keyColumns(),
                descriptor.orderingColumn(),
                writableColumns(tableName, staging, target),
                overwritesKeyColumns());
        return warehouse.execute(merge, applyBudget());
    }
}
