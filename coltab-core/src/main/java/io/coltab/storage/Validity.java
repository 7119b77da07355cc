package io.coltab.storage;

import java.util.BitSet;

/**
 * Per-element invalid flags of one column.
 * <p>
 * Bits mark invalid elements; {@code invalidCount} always equals the cardinality of the set.
 * New rows introduced by resize or insertion start invalid.
 */
final class Validity {

    private BitSet invalid;
    private int length;
    private int invalidCount;

    private Validity(BitSet invalid, int length, int invalidCount) {
        this.invalid = invalid;
        this.length = length;
        this.invalidCount = invalidCount;
    }

    static Validity allInvalid(int length) {
        BitSet bits = new BitSet(length);
        bits.set(0, length);
        return new Validity(bits, length, length);
    }

    static Validity allValid(int length) {
        return new Validity(new BitSet(length), length, 0);
    }

    int length() {
        return length;
    }

    int invalidCount() {
        return invalidCount;
    }

    boolean isValid(int row) {
        return !invalid.get(row);
    }

    void setValid(int row) {
        if (invalid.get(row)) {
            invalid.clear(row);
            invalidCount--;
        }
    }

    void setInvalid(int row) {
        if (!invalid.get(row)) {
            invalid.set(row);
            invalidCount++;
        }
    }

    void setInvalid(int start, int count) {
        invalid.set(start, start + count);
        invalidCount = invalid.cardinality();
    }

    void setValid(int start, int count) {
        invalid.clear(start, start + count);
        invalidCount = invalid.cardinality();
    }

    Validity copy() {
        return new Validity((BitSet) invalid.clone(), length, invalidCount);
    }

    Validity extract(int start, int count) {
        BitSet bits = invalid.get(start, start + count);
        return new Validity(bits, count, bits.cardinality());
    }

    void resize(int newLength) {
        if (newLength < length) {
            invalid.clear(newLength, length);
        } else {
            invalid.set(length, newLength);
        }
        length = newLength;
        invalidCount = invalid.cardinality();
    }

    void eraseWindow(int start, int count) {
        BitSet next = invalid.get(0, start);
        BitSet tail = invalid.get(start + count, length);
        for (int bit = tail.nextSetBit(0); bit >= 0; bit = tail.nextSetBit(bit + 1)) {
            next.set(start + bit);
        }
        install(next, length - count);
    }

    void eraseRows(BitSet rows) {
        BitSet next = new BitSet(length);
        int target = 0;
        for (int row = 0; row < length; row++) {
            if (rows.get(row)) {
                continue;
            }
            if (invalid.get(row)) {
                next.set(target);
            }
            target++;
        }
        install(next, target);
    }

    void insertWindow(int start, int count) {
        BitSet next = invalid.get(0, start);
        next.set(start, start + count);
        BitSet tail = invalid.get(start, length);
        for (int bit = tail.nextSetBit(0); bit >= 0; bit = tail.nextSetBit(bit + 1)) {
            next.set(start + count + bit);
        }
        install(next, length + count);
    }

    void splice(Validity other, int row) {
        BitSet next = invalid.get(0, row);
        for (int bit = other.invalid.nextSetBit(0); bit >= 0; bit = other.invalid.nextSetBit(bit + 1)) {
            next.set(row + bit);
        }
        for (int bit = invalid.nextSetBit(row); bit >= 0; bit = invalid.nextSetBit(bit + 1)) {
            next.set(other.length + bit);
        }
        install(next, length + other.length);
    }

    void gather(int[] permutation) {
        BitSet next = new BitSet(length);
        for (int i = 0; i < permutation.length; i++) {
            if (invalid.get(permutation[i])) {
                next.set(i);
            }
        }
        install(next, length);
    }

    /**
     * Move flags by {@code shift} rows; vacated rows become invalid.
     */
    void shift(int shift) {
        BitSet next = new BitSet(length);
        for (int row = 0; row < length; row++) {
            int source = row - shift;
            if (source < 0 || source >= length || invalid.get(source)) {
                next.set(row);
            }
        }
        install(next, length);
    }

    private void install(BitSet next, int newLength) {
        invalid = next;
        length = newLength;
        invalidCount = next.cardinality();
    }
}
