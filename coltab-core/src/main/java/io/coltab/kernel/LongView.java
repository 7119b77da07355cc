package io.coltab.kernel;

/**
 * Raw long access to a column's backing storage. Writes bypass validity.
 */
public interface LongView {
    int size();

    long get(int row);

    void set(int row, long value);
}
