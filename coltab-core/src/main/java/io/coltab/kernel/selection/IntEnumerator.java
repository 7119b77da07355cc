package io.coltab.kernel.selection;

/**
 * Primitive iterator over row indices, ascending.
 */
public interface IntEnumerator {
    boolean hasNext();

    int nextInt();
}
