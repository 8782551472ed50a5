package com.di.silverline.warehouse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartitionSpec Tests")
class PartitionSpecTest {

    @ParameterizedTest
    @CsvSource({
            "DATE, `c`",
            "TIMESTAMP, DATE(`c`)",
            "datetime, DATE(`c`)"
    })
    @DisplayName("Date-like columns should drive daily partitioning")
    void testDateLike(String type, String expression) {
        PartitionSpec spec = PartitionSpec.fromColumn(ColumnSpec.nullable("c", type));
        assertTrue(spec.isPartitioned());
        assertEquals("c", spec.field());
        assertEquals(expression, spec.expression());
    }

    @Test
    @DisplayName("Other types and missing columns should leave the table unpartitioned")
    void testNone() {
        assertFalse(PartitionSpec.fromColumn(ColumnSpec.nullable("c", "STRING")).isPartitioned());
        assertFalse(PartitionSpec.fromColumn(ColumnSpec.nullable("c", "INT64")).isPartitioned());
        assertFalse(PartitionSpec.fromColumn(null).isPartitioned());
    }

    @Test
    @DisplayName("Table reference should render qualified and quoted forms")
    void testTableRef() {
        TableRef ref = new TableRef("p", "silver1", "t");
        assertEquals("p.silver1.t", ref.qualified());
        assertEquals("`p.silver1.t`", ref.sql());
        assertEquals("silver1.t", new TableRef(null, "silver1", "t").qualified());
    }
}
