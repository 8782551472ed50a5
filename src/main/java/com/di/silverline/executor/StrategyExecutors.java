package com.di.silverline.executor;

import com.di.silverline.exception.InvalidStrategyException;
import com.di.silverline.staging.StagingRelation;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.strategy.StrategyKind;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a descriptor to the executor registered for its kind.
 */
@Component
public class StrategyExecutors {

    private final Map<StrategyKind, StrategyExecutor> byKind = new EnumMap<>(StrategyKind.class);

    public StrategyExecutors(List<StrategyExecutor> executors) {
        for (StrategyExecutor executor : executors) {
            StrategyExecutor previous = byKind.put(executor.kind(), executor);
            if (previous != null) {
                throw new IllegalStateException("Two executors for " + executor.kind() + ": "
                        + previous.getClass().getSimpleName() + ", " + executor.getClass().getSimpleName());
            }
        }
        for (StrategyKind kind : StrategyKind.values()) {
            if (!byKind.containsKey(kind)) {
                throw new IllegalStateException("No executor registered for " + kind);
            }
        }
    }

    public long apply(String tableName, StagingRelation staging, StrategyDescriptor descriptor, LocalDate logicalDate) {
        if (descriptor == null || descriptor.kind() == null) {
            throw new InvalidStrategyException(tableName, List.of("no strategy kind"));
        }
        return byKind.get(descriptor.kind()).apply(tableName, staging, descriptor, logicalDate);
    }
}
