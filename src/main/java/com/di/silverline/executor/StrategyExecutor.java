package com.di.silverline.executor;

import com.di.silverline.staging.StagingRelation;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.strategy.StrategyKind;

import java.time.LocalDate;

/**
 * Reconciles one staged partition into its silver table according to one {@link StrategyKind}.
 */
public interface StrategyExecutor {

    StrategyKind kind();

    /**
     * @return rows inserted or updated in the target (for replace-partition: rows inserted)
     * @throws com.di.silverline.exception.InvalidStrategyException when the descriptor is unusable for this
     *         executor or the staged data lacks a column it names; raised before the target is touched
     */
    long apply(String tableName, StagingRelation staging, StrategyDescriptor descriptor, LocalDate logicalDate);
}
