package io.coltab.table;

import io.coltab.core.ColtabException;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.CodePointOrder;
import io.coltab.kernel.Column;
import io.coltab.kernel.selection.SelectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Multi-key stable sort of a whole table.
 * <p>
 * Keys are compared in list order; rows equal on every key keep their current relative order.
 * Within each key, rows whose element is invalid come first regardless of direction, then valid
 * rows ascend or descend. This gives the same order as sorting by the last key first and
 * re-sorting stably by each preceding key, in a single permutation.
 * <p>
 * The permutation is applied to every column, so the table stays row-consistent, and selected
 * rows stay selected wherever they move.
 */
final class SortEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SortEngine.class);

    private SortEngine() {
    }

    static void sort(ColumnTable table, List<SortKey> keys) {
        if (keys == null) {
            throw ColtabException.nullInput("sort keys");
        }
        if (keys.isEmpty()) {
            throw ColtabException.illegal("at least one sort key required");
        }
        List<OrderKey> orderKeys = new ArrayList<>(keys.size());
        for (SortKey key : keys) {
            if (key == null) {
                throw ColtabException.nullInput("sort key");
            }
            orderKeys.add(orderKey(table.requireColumn(key.column()), key.descending()));
        }
        int rowCount = table.rowCount();
        if (rowCount < 2) {
            return;
        }
        int[] permutation = permutation(rowCount, orderKeys);
        if (isIdentity(permutation)) {
            LOG.debug("Sort by {} left {} rows in place", keys, rowCount);
            return;
        }
        for (Column column : table.columnList()) {
            column.gather(permutation);
        }
        carrySelection(table.selection(), permutation);
        table.storageChanged();
        LOG.debug("Sorted {} rows by {}", rowCount, keys);
    }

    private static int[] permutation(int rowCount, List<OrderKey> keys) {
        Integer[] rows = new Integer[rowCount];
        for (int row = 0; row < rowCount; row++) {
            rows[row] = row;
        }
        // Arrays.sort on objects is a stable merge sort
        Arrays.sort(rows, (left, right) -> compareMulti(left, right, keys));
        int[] permutation = new int[rowCount];
        for (int i = 0; i < rowCount; i++) {
            permutation[i] = rows[i];
        }
        return permutation;
    }

    private static int compareMulti(int left, int right, List<OrderKey> keys) {
        if (left == right) {
            return 0;
        }
        for (OrderKey key : keys) {
            int cmp = key.compare(left, right);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static OrderKey orderKey(Column column, boolean descending) {
        if (column.isArray()) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE, "array column cannot be a sort key: " + column.name());
        }
        ElementKind kind = column.kind();
        if (kind.isComplex()) {
            throw new ColtabException(ErrorCode.INVALID_TYPE,
                    "complex column has no ordering, cannot sort by " + column.name());
        }
        int length = column.length();
        boolean[] present = new boolean[length];
        for (int row = 0; row < length; row++) {
            present[row] = column.isValid(row);
        }
        if (kind == ElementKind.STRING) {
            String[] values = new String[length];
            for (int row = 0; row < length; row++) {
                values[row] = present[row] ? column.getString(row) : null;
            }
            return new StringOrderKey(descending, present, values);
        }
        if (kind.isIntegral()) {
            long[] values = new long[length];
            for (int row = 0; row < length; row++) {
                values[row] = column.getLong(row);
            }
            return new LongOrderKey(descending, present, values);
        }
        double[] values = new double[length];
        for (int row = 0; row < length; row++) {
            values[row] = column.getDouble(row);
        }
        return new DoubleOrderKey(descending, present, values);
    }

    /**
     * Selected rows stay selected at their new positions.
     */
    private static void carrySelection(SelectionState selection, int[] permutation) {
        if (selection.isAllSelected() || selection.isNoneSelected()) {
            return;
        }
        BitSet before = selection.toBitSet();
        selection.unselectAll();
        for (int row = 0; row < permutation.length; row++) {
            if (before.get(permutation[row])) {
                selection.select(row);
            }
        }
    }

    private static boolean isIdentity(int[] permutation) {
        for (int i = 0; i < permutation.length; i++) {
            if (permutation[i] != i) {
                return false;
            }
        }
        return true;
    }

    /**
     * Invalid elements sort first in either direction.
     */
    private static int compareNullable(boolean presentA, boolean presentB) {
        if (presentA == presentB) {
            return 0;
        }
        return presentA ? 1 : -1;
    }

    private interface OrderKey {
        int compare(int left, int right);
    }

    private static final class LongOrderKey implements OrderKey {
        private final boolean descending;
        private final boolean[] present;
        private final long[] values;

        LongOrderKey(boolean descending, boolean[] present, long[] values) {
            this.descending = descending;
            this.present = present;
            this.values = values;
        }

        @Override
        public int compare(int left, int right) {
            int nullCmp = compareNullable(present[left], present[right]);
            if (nullCmp != 0 || !present[left]) {
                return nullCmp;
            }
            int cmp = Long.compare(values[left], values[right]);
            return descending ? -cmp : cmp;
        }
    }

    private static final class DoubleOrderKey implements OrderKey {
        private final boolean descending;
        private final boolean[] present;
        private final double[] values;

        DoubleOrderKey(boolean descending, boolean[] present, double[] values) {
            this.descending = descending;
            this.present = present;
            this.values = values;
        }

        @Override
        public int compare(int left, int right) {
            int nullCmp = compareNullable(present[left], present[right]);
            if (nullCmp != 0 || !present[left]) {
                return nullCmp;
            }
            int cmp = Double.compare(values[left], values[right]);
            return descending ? -cmp : cmp;
        }
    }

    private static final class StringOrderKey implements OrderKey {
        private final boolean descending;
        private final boolean[] present;
        private final String[] values;

        StringOrderKey(boolean descending, boolean[] present, String[] values) {
            this.descending = descending;
            this.present = present;
            this.values = values;
        }

        @Override
        public int compare(int left, int right) {
            int nullCmp = compareNullable(present[left], present[right]);
            if (nullCmp != 0 || !present[left]) {
                return nullCmp;
            }
            int cmp = CodePointOrder.compare(values[left], values[right]);
            return descending ? -cmp : cmp;
        }
    }
}
