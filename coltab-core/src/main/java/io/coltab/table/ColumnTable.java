package io.coltab.table;

import io.coltab.core.ColtabConfiguration;
import io.coltab.core.ColtabException;
import io.coltab.core.Complex;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Column;
import io.coltab.kernel.ComplexView;
import io.coltab.kernel.DoubleView;
import io.coltab.kernel.LongView;
import io.coltab.kernel.Operator;
import io.coltab.kernel.StringView;
import io.coltab.kernel.Table;
import io.coltab.kernel.selection.SelectionState;
import io.coltab.storage.Columns;
import io.coltab.storage.HeapColumn;
import io.coltab.storage.RawViews;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.BooleanSupplier;

/**
 * In-memory table: a set of uniquely named columns sharing one row count, plus a row selection.
 * <p>
 * Column order carries no meaning; columns are looked up by exact, case-sensitive name.
 * A new table has the declared number of rows, no columns and every row selected. Any change
 * of the row count resets the selection to all rows.
 * <p>
 * Failures throw {@link ColtabException}; every precondition of a multi-column operation is
 * checked before the first column is touched, so a failed call leaves the table unchanged.
 * <p>
 * Not thread-safe: a table must be confined to one thread or guarded by its owner.
 */
public final class ColumnTable implements Table {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnTable.class);

    private final ColtabConfiguration configuration;
    private final List<Column> columns = new ArrayList<>();
    private final Map<String, Column> columnsByName;
    private final SelectionState selection;
    private final PatternCache patterns;
    private int rowCount;
    private int structureVersion;

    private ColumnTable(int rowCount, ColtabConfiguration configuration) {
        this.configuration = configuration;
        this.rowCount = rowCount;
        this.selection = SelectionState.allSelected(rowCount);
        this.columnsByName = configuration.indexedColumnLookup() ? new HashMap<>() : null;
        this.patterns = new PatternCache(configuration.patternCacheSize());
    }

    public static ColumnTable create(int rowCount) {
        return create(rowCount, ColtabConfiguration.defaults());
    }

    public static ColumnTable create(int rowCount, ColtabConfiguration configuration) {
        if (configuration == null) {
            throw ColtabException.nullInput("configuration");
        }
        if (rowCount < 0) {
            throw ColtabException.illegal("row count must be non-negative: " + rowCount);
        }
        return new ColumnTable(rowCount, configuration);
    }

    public ColtabConfiguration configuration() {
        return configuration;
    }

    // Table contract

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public int columnCount() {
        return columns.size();
    }

    @Override
    public Column findColumn(String name) {
        if (name == null) {
            return null;
        }
        if (columnsByName != null) {
            return columnsByName.get(name);
        }
        for (Column column : columns) {
            if (column.name().equals(name)) {
                return column;
            }
        }
        return null;
    }

    @Override
    public Collection<Column> columns() {
        return Collections.unmodifiableList(columns);
    }

    public boolean hasColumn(String name) {
        return findColumn(name) != null;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.name());
        }
        return names;
    }

    /**
     * Lazy cursor over the column names, invalidated by any structural change.
     */
    public ColumnNameCursor nameCursor() {
        return new ColumnNameCursor(this);
    }

    // Column lifecycle

    public Column newColumn(String name, ElementKind kind) {
        return appendColumn(Columns.create(name, kind, rowCount));
    }

    public Column newArrayColumn(String name, ElementKind kind, int depth) {
        return appendColumn(Columns.createArray(name, kind, depth, rowCount));
    }

    /**
     * Add a column backed by a caller-owned array; see {@link Columns#wrap(String, ElementKind, Object)}.
     */
    public Column wrap(String name, ElementKind kind, Object data) {
        HeapColumn column = Columns.wrap(name, kind, data);
        return appendColumn(column);
    }

    public Column wrap(String name, int[] data) {
        return wrap(name, ElementKind.INT, data);
    }

    public Column wrap(String name, long[] data) {
        return wrap(name, ElementKind.LONG, data);
    }

    public Column wrap(String name, float[] data) {
        return wrap(name, ElementKind.FLOAT, data);
    }

    public Column wrap(String name, double[] data) {
        return wrap(name, ElementKind.DOUBLE, data);
    }

    public Column wrap(String name, String[] data) {
        return wrap(name, ElementKind.STRING, data);
    }

    /**
     * Remove a column and hand its backing array to the caller.
     */
    public Object unwrap(String name) {
        Column column = requireColumn(name);
        extractColumn(name);
        return column.data();
    }

    /**
     * Take ownership of a detached column of matching length.
     */
    public Column appendColumn(Column column) {
        if (column == null) {
            throw ColtabException.nullInput("column");
        }
        if (findColumn(column.name()) != null) {
            throw new ColtabException(ErrorCode.ILLEGAL_OUTPUT, "column already exists: " + column.name());
        }
        if (column.length() != rowCount) {
            throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT,
                    "column " + column.name() + " has " + column.length() + " rows, table has " + rowCount);
        }
        columns.add(column);
        if (columnsByName != null) {
            columnsByName.put(column.name(), column);
        }
        structureVersion++;
        return column;
    }

    /**
     * Detach a column; ownership passes to the caller. Removing the last column resets the selection.
     *
     * @return the column, or {@code null} when no column has that name
     */
    public Column extractColumn(String name) {
        Column column = findColumn(name);
        if (column == null) {
            return null;
        }
        columns.remove(column);
        if (columnsByName != null) {
            columnsByName.remove(name);
        }
        if (columns.isEmpty()) {
            selection.reset(rowCount);
        }
        structureVersion++;
        return column;
    }

    public void eraseColumn(String name) {
        requireName(name);
        if (extractColumn(name) == null) {
            throw ColtabException.columnNotFound(name);
        }
    }

    public void renameColumn(String from, String to) {
        requireName(to);
        Column column = requireColumn(from);
        if (from.equals(to)) {
            return;
        }
        if (findColumn(to) != null) {
            throw new ColtabException(ErrorCode.ILLEGAL_OUTPUT, "column already exists: " + to);
        }
        column.setName(to);
        if (columnsByName != null) {
            columnsByName.remove(from);
            columnsByName.put(to, column);
        }
        structureVersion++;
    }

    /**
     * Move a column from this table to another table of the same length.
     */
    public void moveColumn(String name, ColumnTable target) {
        if (target == null) {
            throw ColtabException.nullInput("target table");
        }
        Column column = requireColumn(name);
        if (target == this) {
            return;
        }
        if (target.rowCount != rowCount) {
            throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT,
                    "row counts differ: " + rowCount + " and " + target.rowCount);
        }
        if (target.hasColumn(name)) {
            throw new ColtabException(ErrorCode.ILLEGAL_OUTPUT, "column already exists in target: " + name);
        }
        extractColumn(name);
        target.appendColumn(column);
    }

    /**
     * Copy a column of {@code source} (possibly this table) into this table under a new name.
     */
    public Column duplicateColumn(String toName, ColumnTable source, String fromName) {
        requireName(toName);
        if (source == null) {
            throw ColtabException.nullInput("source table");
        }
        Column column = source.requireColumn(fromName);
        if (source.rowCount != rowCount) {
            throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT,
                    "row counts differ: " + rowCount + " and " + source.rowCount);
        }
        if (hasColumn(toName)) {
            throw new ColtabException(ErrorCode.ILLEGAL_OUTPUT, "column already exists: " + toName);
        }
        Column copy = column.duplicate();
        copy.setName(toName);
        return appendColumn(copy);
    }

    /**
     * Give this empty table the columns of a model table: names, kinds, depths, units and formats,
     * every element invalid.
     */
    public void copyStructure(ColumnTable model) {
        if (model == null) {
            throw ColtabException.nullInput("model table");
        }
        if (!columns.isEmpty()) {
            throw new ColtabException(ErrorCode.ILLEGAL_OUTPUT, "table already has columns");
        }
        for (Column column : model.columns) {
            appendColumn(Columns.structureOf(column, rowCount));
        }
    }

    /**
     * Same column names with equal kind, depth and unit, in any order.
     */
    public boolean sameStructure(ColumnTable other) {
        return StructuralOps.sameStructure(this, other);
    }

    public static boolean compareStructure(ColumnTable first, ColumnTable second) {
        if (first == null || second == null) {
            throw ColtabException.nullInput("table");
        }
        return first.sameStructure(second);
    }

    // Column metadata

    public ElementKind columnKind(String name) {
        return requireColumn(name).kind();
    }

    public int columnDepth(String name) {
        return requireColumn(name).depth();
    }

    public void setColumnDepth(String name, int depth) {
        requireColumn(name).setDepth(depth);
        structureVersion++;
    }

    public int[] columnDimensions(String name) {
        return requireColumn(name).dimensions();
    }

    public void setColumnDimensions(String name, int[] dimensions) {
        requireColumn(name).setDimensions(dimensions);
    }

    public String columnUnit(String name) {
        return requireColumn(name).unit();
    }

    public void setColumnUnit(String name, String unit) {
        requireColumn(name).setUnit(unit);
    }

    public String columnFormat(String name) {
        return requireColumn(name).format();
    }

    public void setColumnFormat(String name, String format) {
        requireColumn(name).setFormat(format);
    }

    // Element access

    /**
     * Integral or real element as a double, empty when invalid.
     */
    public OptionalDouble getValue(String name, int row) {
        Column column = requireColumn(name);
        return column.isValid(row) ? OptionalDouble.of(column.getDouble(row)) : OptionalDouble.empty();
    }

    /**
     * Boxed element, {@code null} when invalid.
     */
    public Object get(String name, int row) {
        return requireColumn(name).get(row);
    }

    public long getLong(String name, int row) {
        return requireColumn(name).getLong(row);
    }

    public double getDouble(String name, int row) {
        return requireColumn(name).getDouble(row);
    }

    public Complex getComplex(String name, int row) {
        return requireColumn(name).getComplex(row);
    }

    public String getString(String name, int row) {
        return requireColumn(name).getString(row);
    }

    public Column getArray(String name, int row) {
        return requireColumn(name).getArray(row);
    }

    public void setLong(String name, int row, long value) {
        requireColumn(name).setLong(row, value);
    }

    public void setDouble(String name, int row, double value) {
        requireColumn(name).setDouble(row, value);
    }

    public void setComplex(String name, int row, Complex value) {
        requireColumn(name).setComplex(row, value);
    }

    public void setString(String name, int row, String value) {
        requireColumn(name).setString(row, value);
    }

    public void setArray(String name, int row, Column cell) {
        requireColumn(name).setArray(row, cell);
    }

    public void setInvalid(String name, int row) {
        requireColumn(name).setInvalid(row);
    }

    /**
     * Invalidate a window of a column; the window is clipped at the table end.
     */
    public void setColumnInvalid(String name, int start, int count) {
        Column column = requireColumn(name);
        int clipped = clipWindow(start, count);
        column.setInvalid(start, clipped);
    }

    public boolean isValid(String name, int row) {
        return requireColumn(name).isValid(row);
    }

    public int countInvalid(String name) {
        return requireColumn(name).countInvalid();
    }

    public boolean hasInvalid(String name) {
        return requireColumn(name).hasInvalid();
    }

    public boolean hasValid(String name) {
        return requireColumn(name).hasValid();
    }

    public void fillColumnWindow(String name, int start, int count, long value) {
        Column column = requireColumn(name);
        int clipped = clipWindow(start, count);
        for (int row = start; row < start + clipped; row++) {
            column.setLong(row, value);
        }
    }

    public void fillColumnWindow(String name, int start, int count, double value) {
        Column column = requireColumn(name);
        int clipped = clipWindow(start, count);
        for (int row = start; row < start + clipped; row++) {
            column.setDouble(row, value);
        }
    }

    public void fillColumnWindow(String name, int start, int count, Complex value) {
        Column column = requireColumn(name);
        if (value == null) {
            throw ColtabException.nullInput("value");
        }
        int clipped = clipWindow(start, count);
        for (int row = start; row < start + clipped; row++) {
            column.setComplex(row, value);
        }
    }

    /**
     * Fill a window of a string column; a {@code null} value invalidates it.
     */
    public void fillColumnWindow(String name, int start, int count, String value) {
        Column column = requireColumn(name);
        int clipped = clipWindow(start, count);
        for (int row = start; row < start + clipped; row++) {
            column.setString(row, value);
        }
    }

    /**
     * Fill a window of an array column with copies of one cell; a {@code null} cell invalidates it.
     */
    public void fillColumnWindow(String name, int start, int count, Column cell) {
        Column column = requireColumn(name);
        int clipped = clipWindow(start, count);
        for (int row = start; row < start + clipped; row++) {
            column.setArray(row, cell);
        }
    }

    /**
     * Overwrite a column from a Java array of its backing type; every element becomes valid
     * (string elements: every non-null element).
     */
    public void copyData(String name, Object values) {
        if (values == null) {
            throw ColtabException.nullInput("values");
        }
        Column column = requireColumn(name);
        if (column.isArray()) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE, "cannot copy flat data into array column " + name);
        }
        HeapColumn source = Columns.wrap(name, column.kind(), values);
        if (source.length() != rowCount) {
            throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT,
                    "array holds " + source.length() + " elements, table has " + rowCount + " rows");
        }
        for (int row = 0; row < rowCount; row++) {
            if (!source.isValid(row)) {
                column.setInvalid(row);
            } else if (column.kind() == ElementKind.STRING) {
                column.setString(row, source.getString(row));
            } else if (column.kind().isComplex()) {
                column.setComplex(row, source.getComplex(row));
            } else if (column.kind().isIntegral()) {
                column.setLong(row, source.getLong(row));
            } else {
                column.setDouble(row, source.getDouble(row));
            }
        }
    }

    /**
     * Write a literal into the storage of every invalid element of a numeric column, for file
     * formats that mark integer nulls with a sentinel. The elements stay invalid.
     */
    public void fillInvalid(String name, double value) {
        requireColumn(name).fillInvalid(value);
    }

    public void shiftColumn(String name, int shift) {
        requireColumn(name).shift(shift);
    }

    // Raw views

    public LongView longView(String name) {
        return RawViews.longView(requireHeapColumn(name), guard());
    }

    public DoubleView doubleView(String name) {
        return RawViews.doubleView(requireHeapColumn(name), guard());
    }

    public ComplexView complexView(String name) {
        return RawViews.complexView(requireHeapColumn(name), guard());
    }

    public StringView stringView(String name) {
        return RawViews.stringView(requireHeapColumn(name), guard());
    }

    // Selection

    public int andSelected(String name, Operator operator, long value) {
        return SelectionEngine.compareLong(this, name, operator, value, true);
    }

    public int orSelected(String name, Operator operator, long value) {
        return SelectionEngine.compareLong(this, name, operator, value, false);
    }

    public int andSelected(String name, Operator operator, double value) {
        return SelectionEngine.compareDouble(this, name, operator, value, true);
    }

    public int orSelected(String name, Operator operator, double value) {
        return SelectionEngine.compareDouble(this, name, operator, value, false);
    }

    public int andSelected(String name, Operator operator, Complex value) {
        return SelectionEngine.compareComplex(this, name, operator, value, true);
    }

    public int orSelected(String name, Operator operator, Complex value) {
        return SelectionEngine.compareComplex(this, name, operator, value, false);
    }

    /**
     * String predicate: (in)equality is a regular-expression search, ordering is lexicographic by code point.
     */
    public int andSelectedString(String name, Operator operator, String pattern) {
        return SelectionEngine.compareString(this, name, operator, pattern, true);
    }

    public int orSelectedString(String name, Operator operator, String pattern) {
        return SelectionEngine.compareString(this, name, operator, pattern, false);
    }

    /**
     * Compare two columns row by row: {@code first <op> second}.
     */
    public int andSelectedColumns(String first, Operator operator, String second) {
        return SelectionEngine.compareColumns(this, first, operator, second, true);
    }

    public int orSelectedColumns(String first, Operator operator, String second) {
        return SelectionEngine.compareColumns(this, first, operator, second, false);
    }

    public int andSelectedInvalid(String name) {
        return SelectionEngine.invalid(this, name, true);
    }

    public int orSelectedInvalid(String name) {
        return SelectionEngine.invalid(this, name, false);
    }

    public int andSelectedWindow(int start, int count) {
        return SelectionEngine.window(this, start, count, true);
    }

    public int orSelectedWindow(int start, int count) {
        return SelectionEngine.window(this, start, count, false);
    }

    public int notSelected() {
        return selection.complement();
    }

    public void selectRow(int row) {
        checkRow(row);
        selection.select(row);
    }

    public void unselectRow(int row) {
        checkRow(row);
        selection.unselect(row);
    }

    public void selectAll() {
        selection.selectAll();
    }

    public void unselectAll() {
        selection.unselectAll();
    }

    public boolean isSelected(int row) {
        checkRow(row);
        return selection.isSelected(row);
    }

    public int countSelected() {
        return selection.count();
    }

    /**
     * Ascending indices of the selected rows.
     */
    public int[] whereSelected() {
        return selection.toIntArray();
    }

    // Sorting

    public void sort(List<SortKey> keys) {
        SortEngine.sort(this, keys);
    }

    public void sort(SortKey... keys) {
        if (keys == null) {
            throw ColtabException.nullInput("sort keys");
        }
        sort(Arrays.asList(keys));
    }

    // Structural operations

    public void setSize(int newRowCount) {
        StructuralOps.setSize(this, newRowCount);
    }

    public void eraseWindow(int start, int count) {
        StructuralOps.eraseWindow(this, start, count);
    }

    public void insertWindow(int start, int count) {
        StructuralOps.insertWindow(this, start, count);
    }

    public void eraseSelected() {
        StructuralOps.eraseSelected(this);
    }

    /**
     * Splice the rows of a structurally identical table before {@code row}; a row at or past the
     * end appends.
     */
    public void insert(ColumnTable source, int row) {
        StructuralOps.insert(this, source, row);
    }

    public void append(ColumnTable source) {
        insert(source, rowCount);
    }

    /**
     * Deep copy, selection included.
     */
    public ColumnTable duplicate() {
        return StructuralOps.duplicate(this);
    }

    public ColumnTable extract(int start, int count) {
        return StructuralOps.extract(this, start, count);
    }

    public ColumnTable extractSelected() {
        return StructuralOps.extractSelected(this);
    }

    /**
     * Cast column {@code from} into column {@code to} (or in place when {@code to} is null or equal),
     * keeping the source's array-ness.
     */
    public void castColumn(String from, String to, ElementKind kind) {
        castColumn(from, to, kind, requireColumn(from).isArray());
    }

    public void castColumn(String from, String to, ElementKind kind, boolean array) {
        StructuralOps.castColumn(this, from, to, kind, array);
    }

    public void eraseInvalidRows() {
        StructuralOps.eraseInvalidRows(this);
    }

    public void eraseInvalid() {
        StructuralOps.eraseInvalid(this);
    }

    // Arithmetic

    /**
     * {@code to = to + from}, elementwise.
     */
    public void addColumns(String to, String from) {
        requireColumn(to).add(requireColumn(from));
    }

    public void subtractColumns(String to, String from) {
        requireColumn(to).subtract(requireColumn(from));
    }

    public void multiplyColumns(String to, String from) {
        requireColumn(to).multiply(requireColumn(from));
    }

    public void divideColumns(String to, String from) {
        requireColumn(to).divide(requireColumn(from));
    }

    public void addScalar(String name, double value) {
        requireColumn(name).addScalar(Complex.ofReal(value));
    }

    public void subtractScalar(String name, double value) {
        requireColumn(name).subtractScalar(Complex.ofReal(value));
    }

    public void multiplyScalar(String name, double value) {
        requireColumn(name).multiplyScalar(Complex.ofReal(value));
    }

    public void divideScalar(String name, double value) {
        requireColumn(name).divideScalar(Complex.ofReal(value));
    }

    public void addScalar(String name, Complex value) {
        requireColumn(name).addScalar(value);
    }

    public void subtractScalar(String name, Complex value) {
        requireColumn(name).subtractScalar(value);
    }

    public void multiplyScalar(String name, Complex value) {
        requireColumn(name).multiplyScalar(value);
    }

    public void divideScalar(String name, Complex value) {
        requireColumn(name).divideScalar(value);
    }

    public void absColumn(String name) {
        replaceColumn(name, requireColumn(name).abs());
    }

    public void logarithmColumn(String name, double base) {
        replaceColumn(name, requireColumn(name).logarithm(base));
    }

    public void exponentialColumn(String name, double base) {
        replaceColumn(name, requireColumn(name).exponential(base));
    }

    public void powerColumn(String name, double exponent) {
        replaceColumn(name, requireColumn(name).power(exponent));
    }

    public void conjugateColumn(String name) {
        replaceColumn(name, requireColumn(name).conjugate());
    }

    public void argColumn(String name) {
        replaceColumn(name, requireColumn(name).arg());
    }

    public void realColumn(String name) {
        replaceColumn(name, requireColumn(name).realPart());
    }

    public void imagColumn(String name) {
        replaceColumn(name, requireColumn(name).imagPart());
    }

    // Statistics

    public double columnMax(String name) {
        return ColumnStatistics.max(requireColumn(name));
    }

    public double columnMin(String name) {
        return ColumnStatistics.min(requireColumn(name));
    }

    public int columnMaxPos(String name) {
        return ColumnStatistics.maxPos(requireColumn(name));
    }

    public int columnMinPos(String name) {
        return ColumnStatistics.minPos(requireColumn(name));
    }

    public double columnMean(String name) {
        return ColumnStatistics.mean(requireColumn(name));
    }

    public Complex columnMeanComplex(String name) {
        return ColumnStatistics.meanComplex(requireColumn(name));
    }

    public double columnMedian(String name) {
        return ColumnStatistics.median(requireColumn(name));
    }

    public double columnStdev(String name) {
        return ColumnStatistics.stdev(requireColumn(name));
    }

    // Diagnostics

    public void dumpStructure(Appendable out) {
        TableDumper.dumpStructure(this, out);
    }

    public void dump(int start, int count, Appendable out) {
        TableDumper.dump(this, start, count, out);
    }

    @Override
    public String toString() {
        return "ColumnTable{rows=" + rowCount + ", columns=" + columnNames()
                + ", selected=" + selection.count() + "}";
    }

    // Package-private state used by the engines

    Column requireColumn(String name) {
        requireName(name);
        Column column = findColumn(name);
        if (column == null) {
            throw ColtabException.columnNotFound(name);
        }
        return column;
    }

    List<Column> columnList() {
        return columns;
    }

    SelectionState selection() {
        return selection;
    }

    PatternCache patterns() {
        return patterns;
    }

    int structureVersion() {
        return structureVersion;
    }

    /**
     * Record a change of the row count; the selection starts over with every row selected.
     */
    void rowsChanged(int newRowCount) {
        rowCount = newRowCount;
        selection.reset(newRowCount);
        structureVersion++;
    }

    /**
     * Record a physical reordering or replacement of column storage.
     */
    void storageChanged() {
        structureVersion++;
    }

    /**
     * Swap the column registered under {@code name} for a replacement with the same name.
     */
    void replaceColumn(String name, Column replacement) {
        Column current = requireColumn(name);
        if (current == replacement) {
            return;
        }
        replacement.setName(name);
        columns.set(columns.indexOf(current), replacement);
        if (columnsByName != null) {
            columnsByName.put(name, replacement);
        }
        structureVersion++;
        LOG.debug("Replaced column {} ({} -> {})", name, current.kind(), replacement.kind());
    }

    /**
     * Validate a window start and return the count clipped at the table end.
     */
    int clipWindow(int start, int count) {
        if (start < 0 || start >= rowCount) {
            throw ColtabException.outOfRange("start", start);
        }
        if (count < 0) {
            throw ColtabException.illegal("count must be non-negative: " + count);
        }
        return Math.min(count, rowCount - start);
    }

    private HeapColumn requireHeapColumn(String name) {
        Column column = requireColumn(name);
        if (!(column instanceof HeapColumn heapColumn)) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE, "no raw view over column " + name);
        }
        return heapColumn;
    }

    private BooleanSupplier guard() {
        int version = structureVersion;
        return () -> structureVersion == version;
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rowCount) {
            throw ColtabException.outOfRange("row", row);
        }
    }

    private static void requireName(String name) {
        if (name == null) {
            throw ColtabException.nullInput("column name");
        }
    }
}
