package io.coltab.storage;

import io.coltab.core.ColtabException;
import io.coltab.core.Complex;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Column;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeapColumnTest {

    @Test
    @DisplayName("Should start with every element invalid")
    void shouldStartWithEveryElementInvalid() {
        var column = Columns.create("flux", ElementKind.DOUBLE, 3);

        assertThat(column.countInvalid()).isEqualTo(3);
        assertThat(column.hasValid()).isFalse();
        assertThat(column.getDouble(1)).isZero();
        assertThat(column.get(1)).isNull();
    }

    @Test
    void shouldMarkElementValidOnSet() {
        var column = Columns.create("n", ElementKind.INT, 2);

        column.setLong(0, 42);

        assertThat(column.isValid(0)).isTrue();
        assertThat(column.getLong(0)).isEqualTo(42);
        assertThat(column.get(0)).isEqualTo(42L);
        assertThat(column.countInvalid()).isEqualTo(1);
    }

    @Test
    void shouldNarrowValuesToKindWidth() {
        var bytes = Columns.create("b", ElementKind.BYTE, 1);
        var unsigned = Columns.create("u", ElementKind.UNSIGNED_BYTE, 1);
        var ints = Columns.create("i", ElementKind.INT, 1);
        var floats = Columns.create("f", ElementKind.FLOAT, 1);

        bytes.setLong(0, 300);
        unsigned.setLong(0, 255);
        ints.setDouble(0, -2.9);
        floats.setDouble(0, 0.1);

        assertThat(bytes.getLong(0)).isEqualTo(44);
        assertThat(unsigned.getLong(0)).isEqualTo(255);
        assertThat(ints.getLong(0)).isEqualTo(-2);
        assertThat(floats.getDouble(0)).isEqualTo((double) 0.1f);
    }

    @Test
    void shouldStoreComplexValues() {
        var column = Columns.create("z", ElementKind.DOUBLE_COMPLEX, 2);

        column.setComplex(1, Complex.of(1.0, -2.0));
        column.setLong(0, 3);

        assertThat(column.getComplex(1)).isEqualTo(Complex.of(1.0, -2.0));
        assertThat(column.getComplex(0)).isEqualTo(Complex.ofReal(3.0));
        assertThat((double[]) column.data()).containsExactly(3.0, 0.0, 1.0, -2.0);
    }

    @Test
    void shouldReleaseStringOnInvalidate() {
        var column = Columns.create("s", ElementKind.STRING, 2);
        column.setString(0, "abc");
        column.setString(1, null);

        column.setInvalid(0);

        assertThat(column.getString(0)).isNull();
        assertThat(column.isValid(1)).isFalse();
        assertThat(column.countInvalid()).isEqualTo(2);
    }

    @Test
    void shouldRejectAccessOfWrongKind() {
        var column = Columns.create("d", ElementKind.DOUBLE, 1);

        assertThatThrownBy(() -> column.getLong(0))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.TYPE_MISMATCH));
        assertThatThrownBy(() -> column.setString(0, "x"))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.TYPE_MISMATCH));
    }

    @Test
    void shouldRejectRowOutsideColumn() {
        var column = Columns.create("d", ElementKind.DOUBLE, 2);

        assertThatThrownBy(() -> column.setDouble(2, 1.0))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.ACCESS_OUT_OF_RANGE));
    }

    @Test
    @DisplayName("Should copy array cells on set")
    void shouldCopyArrayCellsOnSet() {
        var column = Columns.createArray("spectrum", ElementKind.INT, 2, 2);
        var cell = Columns.wrap("", new int[] {1, 2});

        column.setArray(0, cell);
        cell.setLong(0, 99);

        assertThat(column.getArray(0).getLong(0)).isEqualTo(1);
        assertThat(column.getArray(1)).isNull();
        assertThat(column.isArray()).isTrue();
        assertThatThrownBy(() -> column.getLong(0))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.UNSUPPORTED_MODE));
    }

    @Test
    void shouldRejectCellOfWrongLengthOrKind() {
        var column = Columns.createArray("spectrum", ElementKind.INT, 3, 1);

        assertThatThrownBy(() -> column.setArray(0, Columns.wrap("", new int[] {1, 2})))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.INCOMPATIBLE_INPUT));
        assertThatThrownBy(() -> column.setArray(0, Columns.wrap("", new double[] {1, 2, 3})))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.TYPE_MISMATCH));
    }

    @Test
    void shouldValidateDimensionsAgainstDepth() {
        var column = Columns.createArray("img", ElementKind.FLOAT, 6, 1);

        column.setDimensions(new int[] {2, 3});

        assertThat(column.dimensions()).containsExactly(2, 3);
        assertThatThrownBy(() -> column.setDimensions(new int[] {2, 2}))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.INCOMPATIBLE_INPUT));
        assertThatThrownBy(() -> Columns.create("x", ElementKind.INT, 1).setDepth(2))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.INVALID_TYPE));
    }

    @Test
    void shouldResizeCellsWhenDepthChanges() {
        var column = Columns.createArray("spectrum", ElementKind.LONG, 2, 1);
        column.setArray(0, Columns.wrap("", new long[] {5, 6}));

        column.setDepth(3);

        Column cell = column.getArray(0);
        assertThat(cell.length()).isEqualTo(3);
        assertThat(cell.getLong(1)).isEqualTo(6);
        assertThat(cell.isValid(2)).isFalse();
        assertThat(column.dimensions()).containsExactly(3);
    }

    @Test
    void shouldDuplicateDeeply() {
        var column = Columns.createArray("spectrum", ElementKind.INT, 1, 1);
        column.setArray(0, Columns.wrap("", new int[] {7}));
        column.setUnit("adu");

        var copy = column.duplicate();
        copy.getArray(0).setLong(0, 8);

        assertThat(column.getArray(0).getLong(0)).isEqualTo(7);
        assertThat(copy.unit()).isEqualTo("adu");
    }

    @Test
    void shouldGrowWithInvalidRowsAndShrink() {
        var column = Columns.wrap("n", new long[] {1, 2});

        column.resize(4);
        assertThat(column.length()).isEqualTo(4);
        assertThat(column.isValid(1)).isTrue();
        assertThat(column.isValid(3)).isFalse();

        column.resize(1);
        assertThat(column.length()).isEqualTo(1);
        assertThat(column.countInvalid()).isZero();
    }

    @Test
    void shouldEraseAndInsertWindows() {
        var column = Columns.wrap("n", new long[] {0, 1, 2, 3, 4});

        column.eraseWindow(1, 2);
        assertThat((long[]) column.data()).containsExactly(0, 3, 4);

        column.insertWindow(1, 1);
        assertThat(column.length()).isEqualTo(4);
        assertThat(column.isValid(1)).isFalse();
        assertThat(column.getLong(2)).isEqualTo(3);
    }

    @Test
    void shouldEraseRowsByMask() {
        var column = Columns.wrap("n", new long[] {0, 1, 2, 3, 4});
        column.setInvalid(3);
        var rows = new BitSet();
        rows.set(0);
        rows.set(2);

        column.eraseRows(rows);

        assertThat(column.length()).isEqualTo(3);
        assertThat(column.getLong(0)).isEqualTo(1);
        assertThat(column.isValid(1)).isFalse();
        assertThat(column.getLong(2)).isEqualTo(4);
    }

    @Test
    void shouldMergeAnotherColumn() {
        var column = Columns.wrap("n", new long[] {1, 4});
        var other = Columns.wrap("n", new long[] {2, 3});
        other.setInvalid(1);

        column.mergeAt(other, 1);

        assertThat(column.length()).isEqualTo(4);
        assertThat(column.getLong(1)).isEqualTo(2);
        assertThat(column.isValid(2)).isFalse();
        assertThat(column.getLong(3)).isEqualTo(4);
        assertThatThrownBy(() -> column.mergeAt(Columns.wrap("d", new double[] {1}), 0))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.TYPE_MISMATCH));
    }

    @Test
    void shouldGatherByPermutation() {
        var column = Columns.wrap("s", new String[] {"a", null, "c"});

        column.gather(new int[] {2, 0, 1});

        assertThat(column.getString(0)).isEqualTo("c");
        assertThat(column.getString(1)).isEqualTo("a");
        assertThat(column.isValid(2)).isFalse();
        assertThatThrownBy(() -> column.gather(new int[] {0}))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.INCOMPATIBLE_INPUT));
    }

    @Test
    void shouldShiftAndInvalidateVacatedRows() {
        var down = Columns.wrap("n", new long[] {1, 2, 3});
        var up = Columns.wrap("n", new long[] {1, 2, 3});
        var away = Columns.wrap("n", new long[] {1, 2, 3});

        down.shift(1);
        up.shift(-2);
        away.shift(5);

        assertThat(down.isValid(0)).isFalse();
        assertThat(down.getLong(1)).isEqualTo(1);
        assertThat(down.getLong(2)).isEqualTo(2);
        assertThat(up.getLong(0)).isEqualTo(3);
        assertThat(up.countInvalid()).isEqualTo(2);
        assertThat(away.countInvalid()).isEqualTo(3);
    }

    @Test
    void shouldExtractIndependentRange() {
        var column = Columns.wrap("n", new long[] {1, 2, 3, 4});

        var part = column.extract(1, 2);
        part.setLong(0, 20);

        assertThat(part.length()).isEqualTo(2);
        assertThat(part.getLong(1)).isEqualTo(3);
        assertThat(column.getLong(1)).isEqualTo(2);
        assertThatThrownBy(() -> column.extract(3, 2))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.ACCESS_OUT_OF_RANGE));
    }

    @Test
    void shouldFillInvalidStorageWithoutValidating() {
        var column = Columns.create("n", ElementKind.INT, 3);
        column.setLong(1, 5);

        column.fillInvalid(-999);

        assertThat((int[]) column.data()).containsExactly(-999, 5, -999);
        assertThat(column.countInvalid()).isEqualTo(2);
    }
}
