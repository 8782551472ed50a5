package com.di.silverline.executor;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.exception.PartialReplaceException;
import com.di.silverline.staging.StagingRelation;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.strategy.StrategyKind;
import com.di.silverline.warehouse.TargetRelation;
import com.di.silverline.warehouse.TargetRelationManager;
import com.di.silverline.warehouse.Warehouse;
import com.di.silverline.warehouse.sql.DeletePartitionStatement;
import com.di.silverline.warehouse.sql.InsertPartitionStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Replaces the logical date's partition with the staged snapshot: delete the partition, then insert
 * every staged row stamped with the logical date. Other partitions are never touched.
 *
 * <p>The two statements run separately. If the insert fails after the delete succeeded the
 * partition stays empty and {@link PartialReplaceException} is raised; re-running the date repairs it.
 */
@Slf4j
@Component
public class ReplacePartitionExecutor extends AbstractStrategyExecutor {

    public ReplacePartitionExecutor(Warehouse warehouse, TargetRelationManager targets,
                                    SilverlineProperties properties) {
        super(warehouse, targets, properties);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.REPLACE_PARTITION;
    }

    @Override
    protected String logTag() {
        return "REPLACE";
    }

    @Override
    protected List<String> requiredColumns(StrategyDescriptor descriptor) {
        // the partition field is stamped, the files need not carry it
        return descriptor.clusterColumns().stream()
                .filter(c -> !c.equalsIgnoreCase(descriptor.partitionField()))
                .toList();
    }

    @Override
    protected long reconcile(String tableName, StagingRelation staging, StrategyDescriptor descriptor,
                             TargetRelation target, LocalDate logicalDate) {
        String pf = descriptor.partitionField();
        List<String> columns = writableColumns(tableName, staging, target).stream()
                .filter(c -> !c.equalsIgnoreCase(pf))
                .toList();

        long deleted = warehouse.execute(new DeletePartitionStatement(target.ref(), pf, logicalDate), applyBudget());
        log.info("[REPLACE] {} {}: {} row(s) removed from partition", tableName, logicalDate, deleted);
        try {
            return warehouse.execute(
                    new InsertPartitionStatement(target.ref(), staging.ref(), columns, pf, logicalDate), applyBudget());
        } catch (RuntimeException e) {
            log.error("[REPLACE] {} {}: insert failed after delete, partition is empty: {}",
                    tableName, logicalDate, e.getMessage());
            throw new PartialReplaceException(tableName, logicalDate, deleted, e);
        }
    }
}
