package io.coltab.storage;

import io.coltab.core.ColtabException;
import io.coltab.core.Complex;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.ComplexView;
import io.coltab.kernel.DoubleView;
import io.coltab.kernel.LongView;
import io.coltab.kernel.StringView;

import java.util.function.BooleanSupplier;

/**
 * Raw views over a heap column's current backing array.
 * <p>
 * Each view holds on to the array that was current when it was created and a guard supplied by
 * the owner; once the guard reports false every access fails with {@link IllegalStateException}.
 * Views neither read nor change validity.
 */
public final class RawViews {

    private RawViews() {
    }

    public static LongView longView(HeapColumn column, BooleanSupplier alive) {
        requireScalar(column);
        if (!column.kind().isIntegral()) {
            throw mismatch(column, "integral");
        }
        Object data = column.data();
        return new LongView() {
            @Override
            public int size() {
                check(column, data, alive);
                return column.length();
            }

            @Override
            public long get(int row) {
                check(column, data, alive);
                return column.readLong(row);
            }

            @Override
            public void set(int row, long value) {
                check(column, data, alive);
                column.writeLong(row, value);
            }
        };
    }

    public static DoubleView doubleView(HeapColumn column, BooleanSupplier alive) {
        requireScalar(column);
        if (!column.kind().isReal()) {
            throw mismatch(column, "real");
        }
        Object data = column.data();
        return new DoubleView() {
            @Override
            public int size() {
                check(column, data, alive);
                return column.length();
            }

            @Override
            public double get(int row) {
                check(column, data, alive);
                return column.readDouble(row);
            }

            @Override
            public void set(int row, double value) {
                check(column, data, alive);
                column.writeDouble(row, value);
            }
        };
    }

    public static ComplexView complexView(HeapColumn column, BooleanSupplier alive) {
        requireScalar(column);
        if (!column.kind().isComplex()) {
            throw mismatch(column, "complex");
        }
        Object data = column.data();
        return new ComplexView() {
            @Override
            public int size() {
                check(column, data, alive);
                return column.length();
            }

            @Override
            public Complex get(int row) {
                check(column, data, alive);
                return column.readComplex(row);
            }

            @Override
            public void set(int row, Complex value) {
                check(column, data, alive);
                column.writeComplex(row, value);
            }
        };
    }

    public static StringView stringView(HeapColumn column, BooleanSupplier alive) {
        requireScalar(column);
        if (!(column.data() instanceof String[] strings)) {
            throw mismatch(column, "string");
        }
        return new StringView() {
            @Override
            public int size() {
                check(column, strings, alive);
                return strings.length;
            }

            @Override
            public String get(int row) {
                check(column, strings, alive);
                return strings[row];
            }
        };
    }

    private static void check(HeapColumn column, Object data, BooleanSupplier alive) {
        if (!alive.getAsBoolean() || column.data() != data) {
            throw new IllegalStateException("view of column " + column.name() + " invalidated by a structural change");
        }
    }

    private static void requireScalar(HeapColumn column) {
        if (column.isArray()) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE, "no raw view over array column " + column.name());
        }
    }

    private static ColtabException mismatch(HeapColumn column, String expected) {
        return new ColtabException(ErrorCode.TYPE_MISMATCH,
                "column " + column.name() + " of kind " + column.kind() + " is not " + expected);
    }
}
