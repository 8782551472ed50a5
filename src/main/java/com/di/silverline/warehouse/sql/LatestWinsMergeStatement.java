package com.di.silverline.warehouse.sql;

import com.di.silverline.staging.StagingRelation;
import com.di.silverline.warehouse.TableRef;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code MERGE} that keeps, per business key, the row with the greatest ordering value.
 *
 * <p>Staging is first reduced to one row per key ({@code ROW_NUMBER()} over ordering descending,
 * NULL last, then {@code _ingest_file_seq} descending so the later file wins ties). Keys are matched
 * null-safely. A matched target row is only overwritten when the staged ordering value is strictly
 * newer, so re-applying the same staging changes nothing; a NULL staged ordering value never
 * overwrites.
 *
 * @param columns          data columns written on insert (staging columns present in the target)
 * @param updateKeyColumns whether key columns are part of {@code UPDATE SET} (upsert) or not (incremental merge)
 */
public record LatestWinsMergeStatement(TableRef target,
                                       TableRef staging,
                                       List<String> keyColumns,
                                       String orderingColumn,
                                       List<String> columns,
                                       boolean updateKeyColumns) implements WarehouseStatement {

    static final String RANK_COLUMN = "_dedup_rank";

    public LatestWinsMergeStatement {
        keyColumns = List.copyOf(keyColumns);
        columns = List.copyOf(columns);
    }

    /** Columns assigned on a match. */
    public List<String> updateColumns() {
        if (updateKeyColumns) {
            return columns;
        }
        return columns.stream().filter(c -> !keyColumns.contains(c)).toList();
    }

    @Override
    public String label() {
        return "merge";
    }

    @Override
    public String sql() {
        String seq = Sql.ident(StagingRelation.FILE_SEQ_COLUMN);
        String ord = Sql.ident(orderingColumn);
        String on = keyColumns.stream()
                .map(k -> String.format("(%s = %s OR (%s IS NULL AND %s IS NULL))",
                        Sql.qualified("T", k), Sql.qualified("S", k), Sql.qualified("T", k), Sql.qualified("S", k)))
                .collect(Collectors.joining("\n   AND "));
        String set = updateColumns().stream()
                .map(c -> Sql.ident(c) + " = " + Sql.qualified("S", c))
                .collect(Collectors.joining(",\n    "));

        return "MERGE " + target.sql() + " AS T\n"
                + "USING (\n"
                + "  SELECT * EXCEPT(" + RANK_COLUMN + ", " + seq + ")\n"
                + "  FROM (\n"
                + "    SELECT *, ROW_NUMBER() OVER (\n"
                + "      PARTITION BY " + Sql.identList(keyColumns) + "\n"
                + "      ORDER BY " + ord + " DESC NULLS LAST, " + seq + " DESC\n"
                + "    ) AS " + RANK_COLUMN + "\n"
                + "    FROM " + staging.sql() + "\n"
                + "  )\n"
                + "  WHERE " + RANK_COLUMN + " = 1\n"
                + ") AS S\n"
                + "ON " + on + "\n"
                + "WHEN MATCHED AND " + Sql.qualified("S", orderingColumn) + " IS NOT NULL\n"
                + "  AND (" + Sql.qualified("T", orderingColumn) + " IS NULL OR "
                + Sql.qualified("T", orderingColumn) + " < " + Sql.qualified("S", orderingColumn) + ") THEN\n"
                + "  UPDATE SET\n    " + set + "\n"
                + "WHEN NOT MATCHED THEN\n"
                + "  INSERT (" + Sql.identList(columns) + ")\n"
                + "  VALUES (" + Sql.qualifiedList("S", columns) + ")";
    }
}
