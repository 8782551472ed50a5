package com.di.silverline.warehouse.sql;

import com.di.silverline.warehouse.TableRef;

import java.time.LocalDate;

/**
 * Removes every row of one daily partition.
 */
public record DeletePartitionStatement(TableRef target, String partitionField, LocalDate partitionDate)
        implements WarehouseStatement {

    @Override
    public String label() {
        return "delete-partition";
    }

    @Override
    public String sql() {
        return "DELETE FROM " + target.sql() + "\nWHERE " + Sql.ident(partitionField) + " = " + Sql.dateLiteral(partitionDate);
    }
}
