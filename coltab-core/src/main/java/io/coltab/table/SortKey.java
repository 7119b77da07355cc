package io.coltab.table;

import io.coltab.core.ColtabException;

/**
 * One sort key: a column name and a direction.
 */
public record SortKey(String column, boolean descending) {
    public SortKey {
        if (column == null) {
            throw ColtabException.nullInput("column");
        }
    }

    public static SortKey ascending(String column) {
        return new SortKey(column, false);
    }

    public static SortKey descending(String column) {
        return new SortKey(column, true);
    }
}
