package io.coltab.kernel.selection;

import java.util.Arrays;
import java.util.BitSet;
import java.util.NoSuchElementException;
import java.util.function.IntPredicate;

/**
 * Per-table row selection flags.
 * <p>
 * Kept in one of three shapes:
 * <ul>
 *   <li>all rows selected (no mask)</li>
 *   <li>no row selected (no mask)</li>
 *   <li>an explicit {@link BitSet} mask plus its cardinality, only while {@code 0 < count < length}</li>
 * </ul>
 * Every mutator collapses back to a maskless shape when the count reaches 0 or the length.
 * Callers never see which shape is in use.
 */
public final class SelectionState {

    private enum Shape {
        ALL,
        NONE,
        EXPLICIT
    }

    private int length;
    private int count;
    private Shape shape;
    private BitSet mask;

    private SelectionState(int length, Shape shape, BitSet mask, int count) {
        this.length = length;
        this.shape = shape;
        this.mask = mask;
        this.count = count;
    }

    public static SelectionState allSelected(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        return new SelectionState(length, Shape.ALL, null, length);
    }

    public int length() {
        return length;
    }

    /**
     * Number of selected rows.
     */
    public int count() {
        return count;
    }

    public boolean isAllSelected() {
        return count == length;
    }

    public boolean isNoneSelected() {
        return count == 0;
    }

    public boolean isSelected(int row) {
        checkRow(row);
        return switch (shape) {
            case ALL -> true;
            case NONE -> false;
            case EXPLICIT -> mask.get(row);
        };
    }

    public void select(int row) {
        checkRow(row);
        if (isSelected(row)) {
            return;
        }
        explicitMask().set(row);
        count++;
        normalize();
    }

    public void unselect(int row) {
        checkRow(row);
        if (!isSelected(row)) {
            return;
        }
        explicitMask().clear(row);
        count--;
        normalize();
    }

    public void selectAll() {
        reset(length);
    }

    public void unselectAll() {
        shape = Shape.NONE;
        mask = null;
        count = 0;
        normalize();
    }

    /**
     * Forget the current selection and select every row of a table of the given length.
     */
    public void reset(int newLength) {
        if (newLength < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + newLength);
        }
        length = newLength;
        shape = Shape.ALL;
        mask = null;
        count = newLength;
    }

    /**
     * AND composition: keep only selected rows for which the predicate holds.
     * The predicate is evaluated on selected rows only.
     *
     * @return the resulting selected-row count
     */
    public int retainIf(IntPredicate predicate) {
        if (count == 0) {
            return 0;
        }
        BitSet next = new BitSet(length);
        int kept = 0;
        IntEnumerator rows = enumerator();
        while (rows.hasNext()) {
            int row = rows.nextInt();
            if (predicate.test(row)) {
                next.set(row);
                kept++;
            }
        }
        install(next, kept);
        return count;
    }

    /**
     * OR composition: add unselected rows for which the predicate holds.
     * The predicate is evaluated on unselected rows only.
     *
     * @return the resulting selected-row count
     */
    public int addIf(IntPredicate predicate) {
        if (count == length) {
            return count;
        }
        BitSet next = shape == Shape.EXPLICIT ? (BitSet) mask.clone() : new BitSet(length);
        int added = count;
        for (int row = 0; row < length; row++) {
            if (!next.get(row) && predicate.test(row)) {
                next.set(row);
                added++;
            }
        }
        install(next, added);
        return count;
    }

    /**
     * Flip every row's flag.
     *
     * @return the resulting selected-row count
     */
    public int complement() {
        switch (shape) {
            case ALL -> {
                shape = Shape.NONE;
                count = 0;
            }
            case NONE -> {
                shape = Shape.ALL;
                count = length;
            }
            case EXPLICIT -> {
                mask.flip(0, length);
                count = length - count;
            }
        }
        normalize();
        return count;
    }

    /**
     * Ascending indices of the selected rows.
     */
    public int[] toIntArray() {
        int[] rows = new int[count];
        int index = 0;
        IntEnumerator e = enumerator();
        while (e.hasNext()) {
            rows[index++] = e.nextInt();
        }
        return rows;
    }

    /**
     * Selected rows as a fresh mask of {@link #length()} bits.
     */
    public BitSet toBitSet() {
        return switch (shape) {
            case ALL -> {
                BitSet all = new BitSet(length);
                all.set(0, length);
                yield all;
            }
            case NONE -> new BitSet(length);
            case EXPLICIT -> (BitSet) mask.clone();
        };
    }

    public IntEnumerator enumerator() {
        return switch (shape) {
            case ALL -> new RangeEnumerator(length);
            case NONE -> new RangeEnumerator(0);
            case EXPLICIT -> new MaskEnumerator((BitSet) mask.clone());
        };
    }

    public SelectionState copy() {
        return new SelectionState(length, shape, mask == null ? null : (BitSet) mask.clone(), count);
    }

    /**
     * Whether the selection is currently backed by an explicit mask. Diagnostic only.
     */
    boolean hasExplicitMask() {
        return mask != null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SelectionState that)) {
            return false;
        }
        return length == that.length && count == that.count && toBitSet().equals(that.toBitSet());
    }

    @Override
    public int hashCode() {
        return 31 * length + count;
    }

    @Override
    public String toString() {
        return "SelectionState{" + count + "/" + length + " " + Arrays.toString(toIntArray()) + "}";
    }

    private BitSet explicitMask() {
        if (shape != Shape.EXPLICIT) {
            BitSet materialized = toBitSet();
            shape = Shape.EXPLICIT;
            mask = materialized;
        }
        return mask;
    }

    private void install(BitSet next, int nextCount) {
        shape = Shape.EXPLICIT;
        mask = next;
        count = nextCount;
        normalize();
    }

    private void normalize() {
        if (count == length) {
            shape = Shape.ALL;
            mask = null;
        } else if (count == 0) {
            shape = Shape.NONE;
            mask = null;
        }
    }

    private void checkRow(int row) {
        if (row < 0 || row >= length) {
            throw new IndexOutOfBoundsException("row out of range: " + row);
        }
    }

    private static final class RangeEnumerator implements IntEnumerator {
        private final int end;
        private int current;

        private RangeEnumerator(int end) {
            this.end = end;
        }

        @Override
        public boolean hasNext() {
            return current < end;
        }

        @Override
        public int nextInt() {
            if (current >= end) {
                throw new NoSuchElementException();
            }
            return current++;
        }
    }

    private static final class MaskEnumerator implements IntEnumerator {
        private final BitSet bits;
        private int current;

        private MaskEnumerator(BitSet bits) {
            this.bits = bits;
            this.current = bits.nextSetBit(0);
        }

        @Override
        public boolean hasNext() {
            return current >= 0;
        }

        @Override
        public int nextInt() {
            if (current < 0) {
                throw new NoSuchElementException();
            }
            int value = current;
            current = bits.nextSetBit(current + 1);
            return value;
        }
    }
}
