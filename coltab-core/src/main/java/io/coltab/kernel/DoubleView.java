package io.coltab.kernel;

/**
 * Raw double access to a column's backing storage. Writes bypass validity.
 */
public interface DoubleView {
    int size();

    double get(int row);

    void set(int row, double value);
}
