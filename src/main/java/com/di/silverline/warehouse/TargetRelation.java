package com.di.silverline.warehouse;

import java.util.List;
import java.util.Optional;

/**
 * A silver table as it exists in the warehouse.
 *
 * @param numRows row count reported by table metadata, {@code null} when unknown
 */
public record TargetRelation(TableRef ref,
                             List<ColumnSpec> schema,
                             PartitionSpec partition,
                             List<String> clusterColumns,
                             Long numRows) {

    public TargetRelation {
        schema = schema == null ? List.of() : List.copyOf(schema);
        clusterColumns = clusterColumns == null ? List.of() : List.copyOf(clusterColumns);
        partition = partition == null ? PartitionSpec.none() : partition;
    }

    public Optional<ColumnSpec> column(String name) {
        return schema.stream().filter(c -> c.name().equalsIgnoreCase(name)).findFirst();
    }

    public List<String> columnNames() {
        return schema.stream().map(ColumnSpec::name).toList();
    }
}
