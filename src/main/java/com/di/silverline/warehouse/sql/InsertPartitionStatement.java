package com.di.silverline.warehouse.sql;

import com.di.silverline.warehouse.TableRef;

import java.time.LocalDate;
import java.util.List;

/**
 * Copies all staged rows into one partition, stamping the partition field with the logical date
 * (any value the files carried for that column is overwritten).
 *
 * @param columns staged data columns to copy, excluding the partition field
 */
public record InsertPartitionStatement(TableRef target,
                                       TableRef staging,
                                       List<String> columns,
                                       String partitionField,
                                       LocalDate partitionDate) implements WarehouseStatement {

    public InsertPartitionStatement {
        columns = List.copyOf(columns);
    }

    @Override
    public String label() {
        return "insert-partition";
    }

    @Override
    public String sql() {
        String cols = columns.isEmpty() ? "" : Sql.identList(columns) + ", ";
        return "INSERT INTO " + target.sql() + " (" + cols + Sql.ident(partitionField) + ")\n"
                + "SELECT " + cols + Sql.dateLiteral(partitionDate) + " AS " + Sql.ident(partitionField) + "\n"
                + "FROM " + staging.sql();
    }
}
