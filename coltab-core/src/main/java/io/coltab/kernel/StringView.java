package io.coltab.kernel;

/**
 * Raw access to a string column's storage; a {@code null} slot is an invalid element.
 */
public interface StringView {
    int size();

    String get(int row);
}
