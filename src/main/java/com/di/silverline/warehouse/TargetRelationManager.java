package com.di.silverline.warehouse;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.staging.StagingRelation;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.strategy.StrategyKind;
import com.di.silverline.warehouse.sql.CreateTableStatement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Makes sure a silver table exists before a strategy writes to it.
 *
 * <p>A missing table is created from the staged schema with daily partitioning and the configured
 * clustering. For replace-partition the partition field becomes a DATE column (added when the files
 * do not carry it); for keyed strategies the table is partitioned on the ordering column when its type
 * allows daily partitioning. An existing table is never altered, even if its layout differs from what
 * would be created today. Metadata is read fresh on every call, so a table dropped or recreated outside
 * the process is picked up by the next run. Creation is serialized per table inside the process and uses
 * {@code CREATE TABLE IF NOT EXISTS} against other processes, so concurrent first touches yield one table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TargetRelationManager {

    private final Warehouse warehouse;
    private final SilverlineProperties properties;

    private final Map<TableRef, Object> locks = new ConcurrentHashMap<>();

    public TargetRelation ensure(String tableName, StrategyDescriptor descriptor, StagingRelation staging) {
        TableRef ref = properties.silverTable(tableName);
        Optional<TargetRelation> existing = warehouse.describeTable(ref);
        if (existing.isPresent()) {
            return existing(ref, existing.get());
        }
        synchronized (locks.computeIfAbsent(ref, r -> new Object())) {
            existing = warehouse.describeTable(ref);
            return existing.isPresent() ? existing(ref, existing.get()) : create(ref, descriptor, staging);
        }
    }

    private static TargetRelation existing(TableRef ref, TargetRelation relation) {
        log.debug("[TARGET] {} exists (partition={}, cluster={})", ref,
                relation.partition().field(), relation.clusterColumns());
        return relation;
    }

    /** Current metadata of a silver table. */
    public Optional<TargetRelation> describe(String tableName) {
        return warehouse.describeTable(properties.silverTable(tableName));
    }

    private TargetRelation create(TableRef ref, StrategyDescriptor descriptor, StagingRelation staging) {
        CreateTableStatement create = createStatement(ref, descriptor, staging);
        warehouse.execute(create, properties.getTimeouts().getApply());
        log.info("[TARGET] created {} (partition={}, cluster={})", ref,
                create.partition().isPartitioned() ? create.partition().expression() : "none",
                create.clusterColumns().isEmpty() ? "none" : create.clusterColumns());
        return warehouse.describeTable(ref)
                .orElseGet(() -> new TargetRelation(ref, create.columns(), create.partition(),
                        create.clusterColumns(), 0L));
    }

    static CreateTableStatement createStatement(TableRef ref, StrategyDescriptor descriptor, StagingRelation staging) {
        List<ColumnSpec> columns = new ArrayList<>();
        for (ColumnSpec c : staging.schema()) {
            columns.add(ColumnSpec.nullable(c.name(), c.type()));
        }
        PartitionSpec partition;
        if (descriptor.kind() == StrategyKind.REPLACE_PARTITION) {
            String pf = descriptor.partitionField();
            int at = indexOf(columns, pf);
            if (at >= 0) {
                columns.set(at, ColumnSpec.nullable(columns.get(at).name(), "DATE"));
            } else {
                columns.add(ColumnSpec.nullable(pf, "DATE"));
            }
            partition = PartitionSpec.onDateColumn(pf);
        } else {
            partition = PartitionSpec.fromColumn(staging.column(descriptor.orderingColumn()).orElse(null));
        }
        return new CreateTableStatement(ref, columns, partition, descriptor.clusterColumns());
    }

    private static int indexOf(List<ColumnSpec> columns, String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }
}
