package io.coltab.io;

/**
 * Where {@link TableWriter#save} puts a table.
 */
public enum SaveMode {
    /**
     * Write a new file, replacing any existing one.
     */
    CREATE,
    /**
     * Add the table as a new extension at the end of an existing file.
     */
    APPEND_EXTENSION,
    /**
     * Append the rows to the last extension of an existing file, which must hold a table of the
     * same structure.
     */
    APPEND_ROWS
}
