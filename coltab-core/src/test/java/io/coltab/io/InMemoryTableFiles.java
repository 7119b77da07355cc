package io.coltab.io;

import io.coltab.core.ColtabException;
import io.coltab.core.ErrorCode;
import io.coltab.table.ColumnTable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reader and writer over an in-memory map of "files", each a list of table extensions.
 */
final class InMemoryTableFiles implements TableReader, TableWriter {

    private final Map<Path, List<ColumnTable>> files = new HashMap<>();

    @Override
    public void save(ColumnTable table, Map<String, Object> primaryHeader, Map<String, Object> extensionHeader,
                     Path destination, SaveMode mode) {
        if (table == null || destination == null || mode == null) {
            throw ColtabException.nullInput("table, destination and mode");
        }
        List<ColumnTable> extensions = files.get(destination);
        switch (mode) {
            case CREATE -> {
                List<ColumnTable> created = new ArrayList<>();
                created.add(table.duplicate());
                files.put(destination, created);
            }
            case APPEND_EXTENSION -> requireFile(extensions, destination).add(table.duplicate());
            case APPEND_ROWS -> {
                List<ColumnTable> existing = requireFile(extensions, destination);
                ColumnTable last = existing.get(existing.size() - 1);
                if (!last.sameStructure(table)) {
                    throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT, "structure differs from " + destination);
                }
                last.append(table);
            }
        }
    }

    @Override
    public ColumnTable load(Path source, int extension, boolean checkNulls, List<String> columns, RowWindow window) {
        List<ColumnTable> extensions = requireFile(files.get(source), source);
        if (extension < 1 || extension > extensions.size()) {
            throw ColtabException.outOfRange("extension", extension);
        }
        ColumnTable stored = extensions.get(extension - 1);
        ColumnTable table = window == null
                ? stored.duplicate()
                : stored.extract(window.start(), window.count());
        table.selectAll();
        if (columns != null) {
            for (String name : columns) {
                if (!table.hasColumn(name)) {
                    throw ColtabException.columnNotFound(name);
                }
            }
            for (String name : table.columnNames()) {
                if (!columns.contains(name)) {
                    table.eraseColumn(name);
                }
            }
        }
        return table;
    }

    private static List<ColumnTable> requireFile(List<ColumnTable> extensions, Path path) {
        if (extensions == null) {
            throw new ColtabException(ErrorCode.FILE_NOT_FOUND, "no such file: " + path);
        }
        return extensions;
    }
}
