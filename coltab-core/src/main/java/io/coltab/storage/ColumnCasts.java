package io.coltab.storage;

import io.coltab.core.ColtabException;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Column;

/**
 * Kind conversion between columns.
 * <p>
 * Shape rules, by source depth and requested array-ness:
 * <pre>
 * depth 0, scalar requested  -&gt; scalar
 * depth 0, array requested   -&gt; depth-1 array, one element per cell
 * depth 1, scalar requested  -&gt; scalar taken from the single cell element
 * depth 1, array requested   -&gt; depth-1 array
 * depth &gt; 1, either          -&gt; array of the same depth, elements converted
 * </pre>
 * Numeric values use Java's primitive conversions (truncation toward zero into integral kinds).
 * Strings only convert to strings, complex values only to complex kinds.
 */
final class ColumnCasts {

    private ColumnCasts() {
    }

    static HeapColumn cast(HeapColumn source, ElementKind kind, boolean array) {
        if (kind == null) {
            throw ColtabException.nullInput("kind");
        }
        checkConvertible(source.kind(), kind);
        int depth = targetDepth(source.depth(), array);
        HeapColumn result = source.reshaped(kind, depth);
        if (depth > 1) {
            result.setDimensions(source.dimensions());
        }
        int length = source.length();
        for (int row = 0; row < length; row++) {
            if (!source.valid(row)) {
                continue;
            }
            if (source.isArray() && depth > 0) {
                Column cell = source.cells()[row];
                result.cells()[row] = cell.cast(kind, false);
                result.markValid(row);
            } else if (source.isArray()) {
                Column cell = source.cells()[row];
                if (cell.isValid(0)) {
                    transfer(cell, 0, result, row);
                }
            } else if (depth > 0) {
                HeapColumn cell = Columns.create("", kind, 1);
                transfer(source, row, cell, 0);
                result.cells()[row] = cell;
                result.markValid(row);
            } else {
                transfer(source, row, result, row);
            }
        }
        return result;
    }

    static void checkConvertible(ElementKind from, ElementKind to) {
        if ((from == ElementKind.STRING) != (to == ElementKind.STRING)) {
            throw new ColtabException(ErrorCode.INVALID_TYPE, "cannot cast " + from + " to " + to);
        }
        if (from.isComplex() && !to.isComplex()) {
            throw new ColtabException(ErrorCode.INVALID_TYPE,
                    "cannot cast " + from + " to " + to + ", take the real part or modulus instead");
        }
    }

    private static int targetDepth(int sourceDepth, boolean array) {
        if (sourceDepth > 1) {
            return sourceDepth;
        }
        return array ? 1 : 0;
    }

    /**
     * Copy one valid element across kinds; the target element becomes valid.
     */
    static void transfer(Column from, int fromRow, Column to, int toRow) {
        ElementKind target = to.kind();
        ElementKind origin = from.kind();
        if (target == ElementKind.STRING) {
            to.setString(toRow, from.getString(fromRow));
        } else if (target.isComplex()) {
            to.setComplex(toRow, from.getComplex(fromRow));
        } else if (target.isIntegral() && origin.isIntegral()) {
            to.setLong(toRow, from.getLong(fromRow));
        } else {
            to.setDouble(toRow, from.getDouble(fromRow));
        }
    }
}
