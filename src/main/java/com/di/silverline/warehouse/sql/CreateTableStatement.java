package com.di.silverline.warehouse.sql;

import com.di.silverline.warehouse.ColumnSpec;
import com.di.silverline.warehouse.PartitionSpec;
import com.di.silverline.warehouse.TableRef;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code CREATE TABLE IF NOT EXISTS} with explicit columns, optional daily partitioning and clustering.
 * Concurrent first-time creations of the same table converge on one table.
 */
public record CreateTableStatement(TableRef target,
                                   List<ColumnSpec> columns,
                                   PartitionSpec partition,
                                   List<String> clusterColumns) implements WarehouseStatement {

    public CreateTableStatement {
        columns = List.copyOf(columns);
        clusterColumns = clusterColumns == null ? List.of() : List.copyOf(clusterColumns);
        partition = partition == null ? PartitionSpec.none() : partition;
    }

    @Override
    public String label() {
        return "create-table";
    }

    @Override
    public String sql() {
        StringBuilder sb = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(target.sql()).append(" (\n");
        sb.append(columns.stream()
                .map(c -> "  " + Sql.ident(c.name()) + " " + c.type())
                .collect(Collectors.joining(",\n")));
        sb.append("\n)");
        if (partition.isPartitioned()) {
            sb.append("\nPARTITION BY ").append(partition.expression());
        }
        if (!clusterColumns.isEmpty()) {
            sb.append("\nCLUSTER BY ").append(Sql.identList(clusterColumns));
        }
        return sb.toString();
    }
}
