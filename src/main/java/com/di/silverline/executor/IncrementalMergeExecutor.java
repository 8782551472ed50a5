package com.di.silverline.executor;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.strategy.StrategyKind;
import com.di.silverline.warehouse.TargetRelationManager;
import com.di.silverline.warehouse.Warehouse;
import org.springframework.stereotype.Component;

/**
 * Incremental merge for append-heavy operational tables: per key the newest event wins and
 * updates every non-key column; unseen keys are inserted.
 */
@Component
public class IncrementalMergeExecutor extends LatestWinsMergeExecutor {

    public IncrementalMergeExecutor(Warehouse warehouse, TargetRelationManager targets,
                                    SilverlineProperties properties) {
        super(warehouse, targets, properties);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.INCREMENTAL_MERGE;
    }

    @Override
    protected boolean overwritesKeyColumns() {
        return false;
    }

    @Override
    protected String logTag() {
        return "MERGE";
    }
}
