package com.di.silverline.executor;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.strategy.StrategyKind;
import com.di.silverline.warehouse.TargetRelationManager;
import com.di.silverline.warehouse.Warehouse;
import org.springframework.stereotype.Component;

/**
 * SCD type 1 for master tables: a row whose "last modified" value is newer than the target's
 * replaces the whole target row. No history is kept.
 */
@Component
public class UpsertLatestExecutor extends LatestWinsMergeExecutor {

    public UpsertLatestExecutor(Warehouse warehouse, TargetRelationManager targets,
                                SilverlineProperties properties) {
        super(warehouse, targets, properties);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.UPSERT_LATEST;
    }

    @Override
    protected boolean overwritesKeyColumns() {
        return true;
    }

    @Override
    protected String logTag() {
        return "UPSERT";
    }
}
