package com.di.silverline.warehouse.sql;

import com.di.silverline.warehouse.TableRef;

/**
 * A single GoogleSQL statement against one target table. Implementations are immutable values that
 * render their SQL on demand, so they can be inspected (and interpreted by test doubles) without parsing.
 */
public interface WarehouseStatement {

    TableRef target();

    String sql();

    /** Short lowercase tag used in job ids and logs, e.g. {@code merge}. */
    String label();
}
