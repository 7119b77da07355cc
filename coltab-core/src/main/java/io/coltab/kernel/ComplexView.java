package io.coltab.kernel;

import io.coltab.core.Complex;

/**
 * Raw access to a complex column's interleaved storage. Writes bypass validity.
 */
public interface ComplexView {
    int size();

    Complex get(int row);

    void set(int row, Complex value);
}
