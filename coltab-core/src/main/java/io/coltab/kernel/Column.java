package io.coltab.kernel;

import io.coltab.core.Complex;
import io.coltab.core.ElementKind;

import java.util.BitSet;

/**
 * Named, typed, fixed-length sequence of elements, each of which may be invalid.
 * <p>
 * Scalar accessors are widened: integral kinds read and write through {@code long}, real kinds
 * through {@code double}, complex kinds through {@link Complex}. Reading an invalid element
 * returns a neutral value (0, 0.0, {@code null}); use {@link #isValid(int)} to tell the two apart.
 * <p>
 * An array column ({@link #depth()} &gt; 0) stores one cell per row; a cell is itself a scalar
 * column of the element kind whose length is the depth.
 */
public interface Column {

    String name();

    void setName(String name);

    /**
     * Element kind; for array columns the kind of the cell elements.
     */
    ElementKind kind();

    /**
     * Cell length of an array column, 0 for a scalar column.
     */
    int depth();

    default boolean isArray() {
        return depth() > 0;
    }

    /**
     * Resize the cells of an array column; new cell slots are invalid.
     */
    void setDepth(int depth);

    /**
     * Extents of an array column's cells, product equal to the depth; a single extent by default.
     */
    int[] dimensions();

    void setDimensions(int[] dimensions);

    String unit();

    void setUnit(String unit);

    String format();

    void setFormat(String format);

    int length();

    // Validity

    boolean isValid(int row);

    void setInvalid(int row);

    void setInvalid(int start, int count);

    int countInvalid();

    default boolean hasInvalid() {
        return countInvalid() > 0;
    }

    default boolean hasValid() {
        return countInvalid() < length();
    }

    // Element access

    long getLong(int row);

    double getDouble(int row);

    Complex getComplex(int row);

    String getString(int row);

    /**
     * Live cell of an array column, {@code null} when invalid.
     */
    Column getArray(int row);

    /**
     * Boxed element ({@link Long}, {@link Double}, {@link Complex}, {@link String} or {@link Column}),
     * {@code null} when invalid.
     */
    Object get(int row);

    void setLong(int row, long value);

    void setDouble(int row, double value);

    void setComplex(int row, Complex value);

    void setString(int row, String value);

    /**
     * Store a copy of the given cell; a {@code null} cell invalidates the row.
     */
    void setArray(int row, Column cell);

    /**
     * Write a literal into the storage slot of every invalid element without validating it.
     */
    void fillInvalid(double value);

    /**
     * Backing array, for raw access and for handing wrapped storage back to its owner.
     */
    Object data();

    // Whole-column copies

    Column duplicate();

    Column extract(int start, int count);

    /**
     * New column of another kind with the same validity pattern and natively converted values.
     * A scalar column becomes a depth-1 array column when {@code array} is set; a depth-1 array
     * column becomes scalar when it is not; deeper array columns stay arrays either way.
     */
    Column cast(ElementKind kind, boolean array);

    // Structural primitives

    void resize(int length);

    void eraseWindow(int start, int count);

    /**
     * Remove every row whose bit is set.
     */
    void eraseRows(BitSet rows);

    /**
     * Insert {@code count} invalid rows before {@code start}.
     */
    void insertWindow(int start, int count);

    /**
     * Splice all elements of another column of the same kind and depth before {@code row}.
     */
    void mergeAt(Column other, int row);

    /**
     * Reorder so that new row {@code i} holds old row {@code permutation[i]}.
     */
    void gather(int[] permutation);

    /**
     * Move values by {@code shift} rows; vacated rows become invalid.
     */
    void shift(int shift);

    // Elementwise arithmetic, result stored in this column

    void add(Column other);

    void subtract(Column other);

    void multiply(Column other);

    void divide(Column other);

    void addScalar(Complex value);

    void subtractScalar(Complex value);

    void multiplyScalar(Complex value);

    void divideScalar(Complex value);

    // Unary transforms; a transform that changes the kind returns a replacement column

    Column abs();

    Column logarithm(double base);

    Column exponential(double base);

    Column power(double exponent);

    Column conjugate();

    Column arg();

    Column realPart();

    Column imagPart();
}
