package io.coltab.table;

import io.coltab.core.ColtabException;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Column;
import io.coltab.kernel.selection.SelectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Row-structure changes applied to every column of a table in lock-step.
 * <p>
 * Arguments are validated before the first column is changed. Any operation that changes the row
 * count leaves every row selected.
 */
final class StructuralOps {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralOps.class);

    private StructuralOps() {
    }

    static void setSize(ColumnTable table, int newRowCount) {
        if (newRowCount < 0) {
            throw ColtabException.illegal("row count must be non-negative: " + newRowCount);
        }
        for (Column column : table.columnList()) {
            column.resize(newRowCount);
        }
        LOG.debug("Resized table from {} to {} rows", table.rowCount(), newRowCount);
        table.rowsChanged(newRowCount);
    }

    static void eraseWindow(ColumnTable table, int start, int count) {
        int clipped = table.clipWindow(start, count);
        for (Column column : table.columnList()) {
            column.eraseWindow(start, clipped);
        }
        LOG.debug("Erased rows [{}, {})", start, start + clipped);
        table.rowsChanged(table.rowCount() - clipped);
    }

    static void insertWindow(ColumnTable table, int start, int count) {
        if (start < 0 || start > table.rowCount()) {
            throw ColtabException.outOfRange("start", start);
        }
        if (count < 0) {
            throw ColtabException.illegal("count must be non-negative: " + count);
        }
        for (Column column : table.columnList()) {
            column.insertWindow(start, count);
        }
        LOG.debug("Inserted {} invalid rows at {}", count, start);
        table.rowsChanged(table.rowCount() + count);
    }

    static void eraseSelected(ColumnTable table) {
        SelectionState selection = table.selection();
        int erased = selection.count();
        if (erased > 0) {
            BitSet rows = selection.toBitSet();
            for (Column column : table.columnList()) {
                column.eraseRows(rows);
            }
        }
        LOG.debug("Erased {} selected rows", erased);
        table.rowsChanged(table.rowCount() - erased);
    }

    static void insert(ColumnTable target, ColumnTable source, int row) {
        if (source == null) {
            throw ColtabException.nullInput("source table");
        }
        if (row < 0) {
            throw ColtabException.outOfRange("row", row);
        }
        if (!sameStructure(target, source)) {
            throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT, "tables have different structure");
        }
        ColumnTable from = source == target ? duplicate(source) : source;
        int at = Math.min(row, target.rowCount());
        for (Column column : target.columnList()) {
            column.mergeAt(from.findColumn(column.name()), at);
        }
        LOG.debug("Inserted {} rows at {}", from.rowCount(), at);
        target.rowsChanged(target.rowCount() + from.rowCount());
    }

    static ColumnTable duplicate(ColumnTable table) {
        ColumnTable copy = ColumnTable.create(table.rowCount(), table.configuration());
        for (Column column : table.columnList()) {
            copy.appendColumn(column.duplicate());
        }
        copySelection(table.selection(), copy.selection());
        return copy;
    }

    static ColumnTable extract(ColumnTable table, int start, int count) {
        int clipped = table.clipWindow(start, count);
        ColumnTable copy = ColumnTable.create(clipped, table.configuration());
        for (Column column : table.columnList()) {
            copy.appendColumn(column.extract(start, clipped));
        }
        return copy;
    }

    static ColumnTable extractSelected(ColumnTable table) {
        SelectionState selection = table.selection();
        if (selection.isAllSelected()) {
            return duplicate(table);
        }
        BitSet dropped = selection.toBitSet();
        dropped.flip(0, table.rowCount());
        ColumnTable copy = ColumnTable.create(selection.count(), table.configuration());
        for (Column column : table.columnList()) {
            Column extracted = column.duplicate();
            extracted.eraseRows(dropped);
            copy.appendColumn(extracted);
        }
        return copy;
    }

    /**
     * Cast {@code from} into a new column {@code to}, or replace it when {@code to} is null or
     * names the same column.
     */
    static void castColumn(ColumnTable table, String from, String to, ElementKind kind, boolean array) {
        Column source = table.requireColumn(from);
        if (kind == null) {
            throw ColtabException.nullInput("kind");
        }
        boolean inPlace = to == null || to.equals(from);
        if (inPlace) {
            boolean sameShape = source.depth() > 1 || source.isArray() == array;
            if (source.kind() == kind && sameShape) {
                return;
            }
            table.replaceColumn(from, source.cast(kind, array));
        } else {
            if (table.hasColumn(to)) {
                throw new ColtabException(ErrorCode.ILLEGAL_OUTPUT, "column already exists: " + to);
            }
            Column result = source.cast(kind, array);
            result.setName(to);
            table.appendColumn(result);
        }
        LOG.debug("Cast column {} ({}) to {} {}{}", from, source.kind(), inPlace ? from : to, kind,
                array ? " array" : "");
    }

    /**
     * Drop columns with no valid element, then rows where every remaining element is invalid.
     */
    static void eraseInvalidRows(ColumnTable table) {
        if (table.rowCount() == 0) {
            return;
        }
        dropEmptyColumns(table);
        List<Column> columns = table.columnList();
        if (columns.isEmpty()) {
            table.rowsChanged(0);
            return;
        }
        BitSet rows = new BitSet(table.rowCount());
        for (int row = 0; row < table.rowCount(); row++) {
            if (allInvalid(columns, row)) {
                rows.set(row);
            }
        }
        eraseRows(table, rows);
    }

    /**
     * Drop columns with no valid element, then every row holding an invalid element.
     */
    static void eraseInvalid(ColumnTable table) {
        if (table.rowCount() == 0) {
            return;
        }
        dropEmptyColumns(table);
        List<Column> columns = table.columnList();
        if (columns.isEmpty()) {
            table.rowsChanged(0);
            return;
        }
        BitSet rows = new BitSet(table.rowCount());
        for (Column column : columns) {
            if (!column.hasInvalid()) {
                continue;
            }
            for (int row = 0; row < table.rowCount(); row++) {
                if (!column.isValid(row)) {
                    rows.set(row);
                }
            }
        }
        eraseRows(table, rows);
    }

    /**
     * Same column names with equal kind, depth and unit, in any order.
     */
    static boolean sameStructure(ColumnTable first, ColumnTable second) {
        if (second == null) {
            throw ColtabException.nullInput("table");
        }
        if (first.columnCount() != second.columnCount()) {
            return false;
        }
        for (Column column : first.columnList()) {
            Column other = second.findColumn(column.name());
            if (other == null
                    || other.kind() != column.kind()
                    || other.depth() != column.depth()
                    || !Objects.equals(other.unit(), column.unit())) {
                return false;
            }
        }
        return true;
    }

    private static void dropEmptyColumns(ColumnTable table) {
        List<String> empty = new ArrayList<>();
        for (Column column : table.columnList()) {
            if (!column.hasValid()) {
                empty.add(column.name());
            }
        }
        for (String name : empty) {
            table.extractColumn(name);
        }
        if (!empty.isEmpty()) {
            LOG.debug("Dropped columns without valid elements: {}", empty);
        }
    }

    private static boolean allInvalid(List<Column> columns, int row) {
        for (Column column : columns) {
            if (column.isValid(row)) {
                return false;
            }
        }
        return true;
    }

    private static void eraseRows(ColumnTable table, BitSet rows) {
        int erased = rows.cardinality();
        if (erased > 0) {
            for (Column column : table.columnList()) {
                column.eraseRows(rows);
            }
        }
        LOG.debug("Erased {} rows holding invalid elements", erased);
        table.rowsChanged(table.rowCount() - erased);
    }

    private static void copySelection(SelectionState from, SelectionState to) {
        if (from.isAllSelected()) {
            to.selectAll();
            return;
        }
        to.unselectAll();
        int[] rows = from.toIntArray();
        for (int row : rows) {
            to.select(row);
        }
    }
}
