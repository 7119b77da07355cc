package io.coltab.storage;

import java.lang.reflect.Array;
import java.util.BitSet;

/**
 * Structural operations on backing arrays of any component type.
 * <p>
 * {@code slots} is the number of array slots per element (2 for interleaved complex data).
 * Every method returns a new array and leaves its input untouched; new slots hold the
 * component type's default value.
 */
final class Buffers {

    private Buffers() {
    }

    static Object allocate(Class<?> componentType, int slots, int length) {
        return Array.newInstance(componentType, Math.multiplyExact(slots, length));
    }

    static int elementCount(Object data, int slots) {
        return Array.getLength(data) / slots;
    }

    static Object copyRange(Object data, int slots, int start, int count) {
        Object result = allocate(data.getClass().getComponentType(), slots, count);
        System.arraycopy(data, start * slots, result, 0, count * slots);
        return result;
    }

    static Object resize(Object data, int slots, int newLength) {
        int oldLength = elementCount(data, slots);
        Object result = allocate(data.getClass().getComponentType(), slots, newLength);
        System.arraycopy(data, 0, result, 0, Math.min(oldLength, newLength) * slots);
        return result;
    }

    static Object eraseWindow(Object data, int slots, int start, int count) {
        int length = elementCount(data, slots);
        Object result = allocate(data.getClass().getComponentType(), slots, length - count);
        System.arraycopy(data, 0, result, 0, start * slots);
        System.arraycopy(data, (start + count) * slots, result, start * slots,
                (length - start - count) * slots);
        return result;
    }

    static Object eraseRows(Object data, int slots, BitSet rows) {
        int length = elementCount(data, slots);
        int erased = rows.get(0, length).cardinality();
        Object result = allocate(data.getClass().getComponentType(), slots, length - erased);
        int target = 0;
        int row = 0;
        while (row < length) {
            int next = rows.nextSetBit(row);
            int runEnd = next < 0 || next > length ? length : next;
            int run = runEnd - row;
            System.arraycopy(data, row * slots, result, target * slots, run * slots);
            target += run;
            if (runEnd == length) {
                break;
            }
            row = rows.nextClearBit(runEnd);
        }
        return result;
    }

    static Object insertWindow(Object data, int slots, int start, int count) {
        int length = elementCount(data, slots);
        Object result = allocate(data.getClass().getComponentType(), slots, length + count);
        System.arraycopy(data, 0, result, 0, start * slots);
        System.arraycopy(data, start * slots, result, (start + count) * slots, (length - start) * slots);
        return result;
    }

    static Object splice(Object data, Object other, int slots, int row) {
        int length = elementCount(data, slots);
        int otherLength = elementCount(other, slots);
        Object result = allocate(data.getClass().getComponentType(), slots, length + otherLength);
        System.arraycopy(data, 0, result, 0, row * slots);
        System.arraycopy(other, 0, result, row * slots, otherLength * slots);
        System.arraycopy(data, row * slots, result, (row + otherLength) * slots, (length - row) * slots);
        return result;
    }

    static Object gather(Object data, int slots, int[] permutation) {
        Object result = allocate(data.getClass().getComponentType(), slots, permutation.length);
        for (int i = 0; i < permutation.length; i++) {
            System.arraycopy(data, permutation[i] * slots, result, i * slots, slots);
        }
        return result;
    }

    /**
     * Move elements by {@code shift} positions; vacated slots get default values.
     */
    static Object shift(Object data, int slots, int shift) {
        int length = elementCount(data, slots);
        Object result = allocate(data.getClass().getComponentType(), slots, length);
        int distance = Math.abs(shift);
        if (distance >= length) {
            return result;
        }
        if (shift >= 0) {
            System.arraycopy(data, 0, result, distance * slots, (length - distance) * slots);
        } else {
            System.arraycopy(data, distance * slots, result, 0, (length - distance) * slots);
        }
        return result;
    }
}
