package io.coltab.io;

import io.coltab.table.ColumnTable;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads one table extension of a binary table file.
 * <p>
 * On-disk nulls map to invalid elements: empty strings, NaN for floating and complex columns,
 * and the per-column integer sentinel recorded in the extension header.
 */
public interface TableReader {

    /**
     * Load a table.
     *
     * @param source     file to read
     * @param extension  extension number, 1 for the first table extension
     * @param checkNulls whether on-disk null markers become invalid elements
     * @param columns    names of the columns to load, or {@code null} for all of them
     * @param window     rows to load, or {@code null} for all of them
     * @return a new table with every row selected
     * @throws io.coltab.core.ColtabException with FILE_NOT_FOUND, BAD_FILE_FORMAT, FILE_IO,
     *                                        DATA_NOT_FOUND (unknown column) or ACCESS_OUT_OF_RANGE
     */
    ColumnTable load(Path source, int extension, boolean checkNulls, List<String> columns, RowWindow window);

    default ColumnTable load(Path source, int extension) {
        return load(source, extension, true, null, null);
    }
}
