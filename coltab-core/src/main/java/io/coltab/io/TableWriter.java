package io.coltab.io;

import io.coltab.table.ColumnTable;

import java.nio.file.Path;
import java.util.Map;

/**
 * Writes tables to a binary table file.
 * <p>
 * Invalid string elements are written as empty strings and invalid floating or complex elements
 * as NaN. Integer columns have no spare value, so callers mark their nulls with a sentinel: fill the
 * storage of invalid elements with {@link ColumnTable#fillInvalid(String, double)} and record the
 * same literal in the extension header. Without it the values written for invalid integer elements
 * are whatever the storage happens to hold.
 */
public interface TableWriter {

    /**
     * Save a table.
     *
     * @param table           table to write
     * @param primaryHeader   primary header entries, or {@code null}
     * @param extensionHeader header entries of the table extension, or {@code null}
     * @param destination     file to write
     * @param mode            create, add an extension, or append rows
     * @throws io.coltab.core.ColtabException with FILE_NOT_CREATED, FILE_NOT_FOUND, FILE_IO or,
     *                                        in {@link SaveMode#APPEND_ROWS}, INCOMPATIBLE_INPUT
     */
    void save(ColumnTable table, Map<String, Object> primaryHeader, Map<String, Object> extensionHeader,
              Path destination, SaveMode mode);
}
