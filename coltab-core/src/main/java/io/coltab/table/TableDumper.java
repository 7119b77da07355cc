package io.coltab.table;

import io.coltab.core.ColtabConfiguration;
import io.coltab.core.ColtabException;
import io.coltab.core.Complex;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Column;

import java.io.IOException;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text renderings of a table for diagnostics.
 */
final class TableDumper {

    private TableDumper() {
    }

    static void dumpStructure(ColumnTable table, Appendable out) {
        requireOut(out);
        StringBuilder text = new StringBuilder();
        text.append("Table with ").append(table.rowCount()).append(" rows and ")
                .append(table.columnCount()).append(" columns, ")
                .append(table.countSelected()).append(" selected\n");
        for (Column column : table.columnList()) {
            text.append("  ").append(column.name()).append(": ").append(column.kind());
            if (column.isArray()) {
                text.append(" array of depth ").append(column.depth());
            }
            text.append(", ").append(column.countInvalid()).append(" invalid");
            if (column.unit() != null) {
                text.append(", unit '").append(column.unit()).append('\'');
            }
            if (column.format() != null) {
                text.append(", format '").append(column.format()).append('\'');
            }
            text.append('\n');
        }
        write(out, text);
    }

    /**
     * One header line of column names, then one line per row in the window.
     */
    static void dump(ColumnTable table, int start, int count, Appendable out) {
        requireOut(out);
        int clipped = table.rowCount() == 0 && start == 0 ? 0 : table.clipWindow(start, count);
        ColtabConfiguration configuration = table.configuration();
        List<Column> columns = table.columnList();
        StringBuilder text = new StringBuilder("row");
        for (Column column : columns) {
            text.append('\t').append(column.name());
        }
        text.append('\n');
        for (int row = start; row < start + clipped; row++) {
            text.append(row);
            for (Column column : columns) {
                text.append('\t');
                if (!column.isValid(row)) {
                    text.append(configuration.dumpNullMarker());
                } else {
                    text.append(cell(column, row, configuration));
                }
            }
            text.append('\n');
        }
        write(out, text);
    }

    private static String cell(Column column, int row, ColtabConfiguration configuration) {
        if (column.isArray()) {
            return "(array of " + column.depth() + ")";
        }
        ElementKind kind = column.kind();
        String format = column.format() != null ? column.format() : configuration.defaultFormat(kind);
        try {
            if (kind == ElementKind.STRING) {
                return String.format(Locale.ROOT, format, column.getString(row));
            }
            if (kind.isComplex()) {
                Complex value = column.getComplex(row);
                return String.format(Locale.ROOT, format, value.re(), value.im());
            }
            if (kind.isIntegral()) {
                return String.format(Locale.ROOT, format, column.getLong(row));
            }
            return String.format(Locale.ROOT, format, column.getDouble(row));
        } catch (IllegalFormatException e) {
            throw new ColtabException(ErrorCode.ILLEGAL_INPUT,
                    "format '" + format + "' does not fit " + kind + " column " + column.name(), e);
        }
    }

    private static void write(Appendable out, CharSequence text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new ColtabException(ErrorCode.FILE_IO, "failed to write table dump", e);
        }
    }

    private static void requireOut(Appendable out) {
        if (out == null) {
            throw ColtabException.nullInput("output");
        }
    }
}
