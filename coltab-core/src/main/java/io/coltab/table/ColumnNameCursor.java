package io.coltab.table;

import io.coltab.kernel.Column;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Single-pass cursor over a table's column names.
 * <p>
 * Names come in the table's internal order, which carries no meaning. Adding, removing or
 * renaming a column, or any row-structure change, makes the cursor fail on its next use.
 */
public final class ColumnNameCursor implements Iterator<String> {

    private final ColumnTable table;
    private final List<Column> columns;
    private final int expectedVersion;
    private int position;

    ColumnNameCursor(ColumnTable table) {
        this.table = table;
        this.columns = table.columnList();
        this.expectedVersion = table.structureVersion();
    }

    @Override
    public boolean hasNext() {
        checkVersion();
        return position < columns.size();
    }

    @Override
    public String next() {
        checkVersion();
        if (position >= columns.size()) {
            throw new NoSuchElementException();
        }
        return columns.get(position++).name();
    }

    private void checkVersion() {
        if (table.structureVersion() != expectedVersion) {
            throw new ConcurrentModificationException("table structure changed during column name iteration");
        }
    }
}
