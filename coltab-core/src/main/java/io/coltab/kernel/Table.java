package io.coltab.kernel;

import java.util.Collection;

/**
 * Read contract of a table: equal-length named columns.
 */
public interface Table {
    int rowCount();

    int columnCount();

    /**
     * Column with the given name, or {@code null}.
     */
    Column findColumn(String name);

    Collection<Column> columns();
}
