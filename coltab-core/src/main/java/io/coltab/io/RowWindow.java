package io.coltab.io;

import io.coltab.core.ColtabException;

/**
 * Range of rows to read: {@code count} rows from {@code start}.
 */
public record RowWindow(int start, int count) {

    public RowWindow {
        if (start < 0) {
            throw ColtabException.outOfRange("start", start);
        }
        if (count < 0) {
            throw ColtabException.illegal("count must be non-negative: " + count);
        }
    }

    public static RowWindow of(int start, int count) {
        return new RowWindow(start, count);
    }

    /**
     * Exclusive end row.
     */
    public int end() {
        return start + count;
    }
}
