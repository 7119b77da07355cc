package io.coltab.storage;

import io.coltab.core.ColtabException;
import io.coltab.core.Complex;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Column;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Heap-backed column.
 * <p>
 * Scalar columns keep their elements in one primitive (or {@code String[]}) array chosen by
 * {@link ElementKind}, next to a {@link Validity} bitset. Array columns keep a {@code Column[]} of
 * cells. For string and array columns an invalid element also has a {@code null} slot, so an
 * invalidated payload is released immediately.
 * <p>
 * Structural operations replace the backing array; raw views taken before one of them
 * no longer see the column.
 */
public final class HeapColumn implements Column {

    private String name;
    private final ElementKind kind;
    private int depth;
    private int[] dimensions;
    private String unit;
    private String format;
    private int length;
    private Object data;
    private Validity validity;

    HeapColumn(String name, ElementKind kind, int depth, Object data, Validity validity) {
        this.name = name;
        this.kind = kind;
        this.depth = depth;
        this.data = data;
        this.validity = validity;
        this.length = validity.length();
    }

    // Metadata

    @Override
    public String name() {
        return name;
    }

    @Override
    public void setName(String name) {
        if (name == null) {
            throw ColtabException.nullInput("name");
        }
        this.name = name;
    }

    @Override
    public ElementKind kind() {
        return kind;
    }

    @Override
    public int depth() {
        return depth;
    }

    @Override
    public void setDepth(int newDepth) {
        if (!isArray()) {
            throw new ColtabException(ErrorCode.INVALID_TYPE, "column is not an array column: " + name);
        }
        if (newDepth < 1) {
            throw ColtabException.illegal("depth must be positive: " + newDepth);
        }
        Column[] cells = cells();
        for (Column cell : cells) {
            if (cell != null) {
                cell.resize(newDepth);
            }
        }
        depth = newDepth;
        dimensions = null;
    }

    @Override
    public int[] dimensions() {
        if (!isArray()) {
            return new int[0];
        }
        return dimensions == null ? new int[] {depth} : dimensions.clone();
    }

    @Override
    public void setDimensions(int[] newDimensions) {
        if (newDimensions == null) {
            throw ColtabException.nullInput("dimensions");
        }
        if (!isArray()) {
            throw new ColtabException(ErrorCode.INVALID_TYPE, "column is not an array column: " + name);
        }
        long product = 1;
        for (int extent : newDimensions) {
            if (extent < 1) {
                throw ColtabException.illegal("dimension must be positive: " + extent);
            }
            product *= extent;
        }
        if (newDimensions.length == 0 || product != depth) {
            throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT,
                    "dimensions " + Arrays.toString(newDimensions) + " do not match depth " + depth);
        }
        dimensions = newDimensions.length == 1 ? null : newDimensions.clone();
    }

    @Override
    public String unit() {
        return unit;
    }

    @Override
    public void setUnit(String unit) {
        this.unit = unit;
    }

    @Override
    public String format() {
        return format;
    }

    @Override
    public void setFormat(String format) {
        this.format = format;
    }

    @Override
    public int length() {
        return length;
    }

    // Validity

    @Override
    public boolean isValid(int row) {
        checkRow(row);
        return validity.isValid(row);
    }

    @Override
    public void setInvalid(int row) {
        checkRow(row);
        validity.setInvalid(row);
        releasePayload(row);
    }

    @Override
    public void setInvalid(int start, int count) {
        checkWindow(start, count);
        validity.setInvalid(start, count);
        for (int row = start; row < start + count; row++) {
            releasePayload(row);
        }
    }

    @Override
    public int countInvalid() {
        return validity.invalidCount();
    }

    // Element access

    @Override
    public long getLong(int row) {
        checkRow(row);
        requireScalar();
        if (!kind.isIntegral()) {
            throw mismatch("integral");
        }
        return validity.isValid(row) ? readLong(row) : 0L;
    }

    @Override
    public double getDouble(int row) {
        checkRow(row);
        requireScalar();
        if (!kind.isIntegral() && !kind.isReal()) {
            throw mismatch("integral or real");
        }
        return validity.isValid(row) ? readDouble(row) : 0.0;
    }

    @Override
    public Complex getComplex(int row) {
        checkRow(row);
        requireScalar();
        if (!kind.isNumeric()) {
            throw mismatch("numeric");
        }
        return validity.isValid(row) ? readComplex(row) : null;
    }

    @Override
    public String getString(int row) {
        checkRow(row);
        requireScalar();
        if (kind != ElementKind.STRING) {
            throw mismatch("string");
        }
        return ((String[]) data)[row];
    }

    @Override
    public Column getArray(int row) {
        checkRow(row);
        if (!isArray()) {
            throw mismatch("array");
        }
        return cells()[row];
    }

    @Override
    public Object get(int row) {
        checkRow(row);
        if (!validity.isValid(row)) {
            return null;
        }
        if (isArray()) {
            return cells()[row];
        }
        if (kind.isIntegral()) {
            return readLong(row);
        }
        if (kind.isReal()) {
            return readDouble(row);
        }
        if (kind.isComplex()) {
            return readComplex(row);
        }
        return ((String[]) data)[row];
    }

    @Override
    public void setLong(int row, long value) {
        checkRow(row);
        requireScalar();
        if (kind.isIntegral()) {
            writeLong(row, value);
        } else if (kind.isReal()) {
            writeDouble(row, value);
        } else if (kind.isComplex()) {
            writeComplex(row, Complex.ofReal(value));
        } else {
            throw mismatch("numeric");
        }
        validity.setValid(row);
    }

    @Override
    public void setDouble(int row, double value) {
        checkRow(row);
        requireScalar();
        if (kind.isIntegral()) {
            writeLong(row, kind.truncate(value));
        } else if (kind.isReal()) {
            writeDouble(row, value);
        } else if (kind.isComplex()) {
            writeComplex(row, Complex.ofReal(value));
        } else {
            throw mismatch("numeric");
        }
        validity.setValid(row);
    }

    @Override
    public void setComplex(int row, Complex value) {
        if (value == null) {
            throw ColtabException.nullInput("value");
        }
        checkRow(row);
        requireScalar();
        if (!kind.isComplex()) {
            throw mismatch("complex");
        }
        writeComplex(row, value);
        validity.setValid(row);
    }

    @Override
    public void setString(int row, String value) {
        checkRow(row);
        requireScalar();
        if (kind != ElementKind.STRING) {
            throw mismatch("string");
        }
        ((String[]) data)[row] = value;
        if (value == null) {
            validity.setInvalid(row);
        } else {
            validity.setValid(row);
        }
    }

    @Override
    public void setArray(int row, Column cell) {
        checkRow(row);
        if (!isArray()) {
            throw mismatch("array");
        }
        if (cell == null) {
            setInvalid(row);
            return;
        }
        if (cell.kind() != kind || cell.isArray()) {
            throw new ColtabException(ErrorCode.TYPE_MISMATCH,
                    "cell of kind " + cell.kind() + " does not fit column " + name + " of kind " + kind);
        }
        if (cell.length() != depth) {
            throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT,
                    "cell length " + cell.length() + " differs from depth " + depth);
        }
        cells()[row] = cell.duplicate();
        validity.setValid(row);
    }

    @Override
    public void fillInvalid(double value) {
        requireScalar();
        if (!kind.isNumeric()) {
            throw new ColtabException(ErrorCode.INVALID_TYPE, "column is not numeric: " + name);
        }
        for (int row = 0; row < length; row++) {
            if (validity.isValid(row)) {
                continue;
            }
            if (kind.isIntegral()) {
                writeLong(row, kind.truncate(value));
            } else if (kind.isReal()) {
                writeDouble(row, value);
            } else {
                writeComplex(row, Complex.ofReal(value));
            }
        }
    }

    @Override
    public Object data() {
        return data;
    }

    // Whole-column copies

    @Override
    public HeapColumn duplicate() {
        return copyOf(name, copyData(data), validity.copy());
    }

    @Override
    public HeapColumn extract(int start, int count) {
        checkWindow(start, count);
        Object range = Buffers.copyRange(data, slots(), start, count);
        return copyOf(name, isArray() ? deepCopyCells((Column[]) range) : range, validity.extract(start, count));
    }

    @Override
    public Column cast(ElementKind targetKind, boolean array) {
        return ColumnCasts.cast(this, targetKind, array);
    }

    // Structural primitives

    @Override
    public void resize(int newLength) {
        if (newLength < 0) {
            throw ColtabException.illegal("length must be non-negative: " + newLength);
        }
        data = Buffers.resize(data, slots(), newLength);
        validity.resize(newLength);
        length = newLength;
    }

    @Override
    public void eraseWindow(int start, int count) {
        checkWindow(start, count);
        data = Buffers.eraseWindow(data, slots(), start, count);
        validity.eraseWindow(start, count);
        length -= count;
    }

    @Override
    public void eraseRows(BitSet rows) {
        if (rows == null) {
            throw ColtabException.nullInput("rows");
        }
        data = Buffers.eraseRows(data, slots(), rows);
        validity.eraseRows(rows);
        length = validity.length();
    }

    @Override
    public void insertWindow(int start, int count) {
        if (start < 0 || start > length) {
            throw ColtabException.outOfRange("start", start);
        }
        if (count < 0) {
            throw ColtabException.illegal("count must be non-negative: " + count);
        }
        data = Buffers.insertWindow(data, slots(), start, count);
        validity.insertWindow(start, count);
        length += count;
    }

    @Override
    public void mergeAt(Column other, int row) {
        if (other == null) {
            throw ColtabException.nullInput("column");
        }
        if (!(other instanceof HeapColumn source) || source.kind != kind || source.depth != depth) {
            throw new ColtabException(ErrorCode.TYPE_MISMATCH,
                    "cannot merge " + other.kind() + " column into " + kind + " column " + name);
        }
        if (row < 0 || row > length) {
            throw ColtabException.outOfRange("row", row);
        }
        data = Buffers.splice(data, copyData(source.data), slots(), row);
        validity.splice(source.validity, row);
        length += source.length;
    }

    @Override
    public void gather(int[] permutation) {
        if (permutation == null) {
            throw ColtabException.nullInput("permutation");
        }
        if (permutation.length != length) {
            throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT,
                    "permutation length " + permutation.length + " differs from column length " + length);
        }
        data = Buffers.gather(data, slots(), permutation);
        validity.gather(permutation);
    }

    @Override
    public void shift(int shift) {
        if (shift == 0) {
            return;
        }
        data = Buffers.shift(data, slots(), shift);
        validity.shift(shift);
    }

    // Arithmetic

    @Override
    public void add(Column other) {
        ColumnMath.combine(this, other, ColumnMath.BinaryOp.ADD);
    }

    @Override
    public void subtract(Column other) {
        ColumnMath.combine(this, other, ColumnMath.BinaryOp.SUBTRACT);
    }

    @Override
    public void multiply(Column other) {
        ColumnMath.combine(this, other, ColumnMath.BinaryOp.MULTIPLY);
    }

    @Override
    public void divide(Column other) {
        ColumnMath.combine(this, other, ColumnMath.BinaryOp.DIVIDE);
    }

    @Override
    public void addScalar(Complex value) {
        ColumnMath.combineScalar(this, value, ColumnMath.BinaryOp.ADD);
    }

    @Override
    public void subtractScalar(Complex value) {
        ColumnMath.combineScalar(this, value, ColumnMath.BinaryOp.SUBTRACT);
    }

    @Override
    public void multiplyScalar(Complex value) {
        ColumnMath.combineScalar(this, value, ColumnMath.BinaryOp.MULTIPLY);
    }

    @Override
    public void divideScalar(Complex value) {
        ColumnMath.combineScalar(this, value, ColumnMath.BinaryOp.DIVIDE);
    }

    @Override
    public Column abs() {
        return ColumnMath.abs(this);
    }

    @Override
    public Column logarithm(double base) {
        return ColumnMath.logarithm(this, base);
    }

    @Override
    public Column exponential(double base) {
        return ColumnMath.exponential(this, base);
    }

    @Override
    public Column power(double exponent) {
        return ColumnMath.power(this, exponent);
    }

    @Override
    public Column conjugate() {
        return ColumnMath.conjugate(this);
    }

    @Override
    public Column arg() {
        return ColumnMath.arg(this);
    }

    @Override
    public Column realPart() {
        return ColumnMath.realPart(this);
    }

    @Override
    public Column imagPart() {
        return ColumnMath.imagPart(this);
    }

    @Override
    public String toString() {
        return "HeapColumn{" + name + ", " + kind + (isArray() ? "[" + depth + "]" : "")
                + ", length=" + length + ", invalid=" + validity.invalidCount() + "}";
    }

    // Package-private element codec used by casts and math; no range or validity checks.

    boolean valid(int row) {
        return validity.isValid(row);
    }

    void markValid(int row) {
        validity.setValid(row);
    }

    void markInvalid(int row) {
        validity.setInvalid(row);
        releasePayload(row);
    }

    Validity validity() {
        return validity;
    }

    long readLong(int row) {
        return switch (kind) {
            case BOOLEAN -> ((boolean[]) data)[row] ? 1L : 0L;
            case BYTE -> ((byte[]) data)[row];
            case UNSIGNED_BYTE -> ((byte[]) data)[row] & 0xFFL;
            case SHORT -> ((short[]) data)[row];
            case INT -> ((int[]) data)[row];
            case LONG -> ((long[]) data)[row];
            default -> throw mismatch("integral");
        };
    }

    double readDouble(int row) {
        return switch (kind) {
            case FLOAT -> ((float[]) data)[row];
            case DOUBLE -> ((double[]) data)[row];
            default -> readLong(row);
        };
    }

    Complex readComplex(int row) {
        return switch (kind) {
            case FLOAT_COMPLEX -> {
                float[] values = (float[]) data;
                yield new Complex(values[2 * row], values[2 * row + 1]);
            }
            case DOUBLE_COMPLEX -> {
                double[] values = (double[]) data;
                yield new Complex(values[2 * row], values[2 * row + 1]);
            }
            default -> Complex.ofReal(readDouble(row));
        };
    }

    void writeLong(int row, long value) {
        long narrowed = kind.narrow(value);
        switch (kind) {
            case BOOLEAN -> ((boolean[]) data)[row] = narrowed != 0;
            case BYTE, UNSIGNED_BYTE -> ((byte[]) data)[row] = (byte) narrowed;
            case SHORT -> ((short[]) data)[row] = (short) narrowed;
            case INT -> ((int[]) data)[row] = (int) narrowed;
            case LONG -> ((long[]) data)[row] = narrowed;
            default -> throw mismatch("integral");
        }
    }

    void writeDouble(int row, double value) {
        switch (kind) {
            case FLOAT -> ((float[]) data)[row] = (float) value;
            case DOUBLE -> ((double[]) data)[row] = value;
            default -> throw mismatch("real");
        }
    }

    void writeComplex(int row, Complex value) {
        switch (kind) {
            case FLOAT_COMPLEX -> {
                float[] values = (float[]) data;
                values[2 * row] = (float) value.re();
                values[2 * row + 1] = (float) value.im();
            }
            case DOUBLE_COMPLEX -> {
                double[] values = (double[]) data;
                values[2 * row] = value.re();
                values[2 * row + 1] = value.im();
            }
            default -> throw mismatch("complex");
        }
    }

    Column[] cells() {
        return (Column[]) data;
    }

    /**
     * Same metadata as this column, given storage.
     */
    HeapColumn copyOf(String newName, Object newData, Validity newValidity) {
        HeapColumn copy = new HeapColumn(newName, kind, depth, newData, newValidity);
        copy.unit = unit;
        copy.format = format;
        copy.dimensions = dimensions == null ? null : dimensions.clone();
        return copy;
    }

    /**
     * Same name and unit as this column, another kind, fresh storage with every element invalid.
     */
    HeapColumn reshaped(ElementKind newKind, int newDepth) {
        Object storage = newDepth > 0
                ? new Column[length]
                : Buffers.allocate(newKind.componentType(), newKind.slotsPerElement(), length);
        HeapColumn copy = new HeapColumn(name, newKind, newDepth, storage, Validity.allInvalid(length));
        copy.unit = unit;
        copy.format = newKind == kind ? format : null;
        return copy;
    }

    private int slots() {
        return isArray() ? 1 : kind.slotsPerElement();
    }

    private Object copyData(Object source) {
        if (isArray()) {
            return deepCopyCells((Column[]) source);
        }
        return Buffers.copyRange(source, slots(), 0, Buffers.elementCount(source, slots()));
    }

    private static Column[] deepCopyCells(Column[] cells) {
        Column[] copy = new Column[cells.length];
        for (int i = 0; i < cells.length; i++) {
            copy[i] = cells[i] == null ? null : cells[i].duplicate();
        }
        return copy;
    }

    private void releasePayload(int row) {
        if (isArray()) {
            cells()[row] = null;
        } else if (kind == ElementKind.STRING) {
            ((String[]) data)[row] = null;
        }
    }

    private void requireScalar() {
        if (isArray()) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE, "array column not accepted here: " + name);
        }
    }

    private ColtabException mismatch(String expected) {
        return new ColtabException(ErrorCode.TYPE_MISMATCH,
                "column " + name + " of kind " + kind + (isArray() ? " array" : "") + " is not " + expected);
    }

    private void checkRow(int row) {
        if (row < 0 || row >= length) {
            throw ColtabException.outOfRange("row", row);
        }
    }

    private void checkWindow(int start, int count) {
        if (start < 0 || start > length) {
            throw ColtabException.outOfRange("start", start);
        }
        if (count < 0) {
            throw ColtabException.illegal("count must be non-negative: " + count);
        }
        if (count > length - start) {
            throw ColtabException.outOfRange("window end", (long) start + count);
        }
    }
}
