package io.coltab.core;

/**
 * Failure kinds reported by {@link ColtabException}.
 * <p>
 * The file codes are only raised by implementations of the serialization boundary
 * in {@code io.coltab.io}.
 */
public enum ErrorCode {
    /** A required argument was null. */
    NULL_INPUT,
    /** A named column does not exist, or a statistic has no valid element to work on. */
    DATA_NOT_FOUND,
    /** Operand kinds do not fit together. */
    TYPE_MISMATCH,
    /** The column kind cannot take part in the operation at all (string, array, complex). */
    INVALID_TYPE,
    /** Negative length or count, unsupported operator, non-positive base. */
    ILLEGAL_INPUT,
    /** The result would collide with existing data, e.g. a duplicate column name. */
    ILLEGAL_OUTPUT,
    /** Row, window or column index outside the table. */
    ACCESS_OUT_OF_RANGE,
    /** Structures of two tables differ. */
    INCOMPATIBLE_INPUT,
    /** An array column was used where only scalar columns are accepted. */
    UNSUPPORTED_MODE,
    DIVISION_BY_ZERO,
    FILE_NOT_FOUND,
    BAD_FILE_FORMAT,
    FILE_NOT_CREATED,
    FILE_IO
}
