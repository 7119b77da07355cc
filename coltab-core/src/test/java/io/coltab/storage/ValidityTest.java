package io.coltab.storage;

import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.assertj.core.api.Assertions.assertThat;

class ValidityTest {

    @Test
    void shouldTrackInvalidCount() {
        var validity = Validity.allValid(5);

        validity.setInvalid(1);
        validity.setInvalid(1);
        validity.setInvalid(3, 2);

        assertThat(validity.invalidCount()).isEqualTo(3);
        validity.setValid(4);
        assertThat(validity.invalidCount()).isEqualTo(2);
        assertThat(validity.isValid(4)).isTrue();
    }

    @Test
    void shouldInsertInvalidRows() {
        var validity = Validity.allValid(3);

        validity.insertWindow(1, 2);

        assertThat(validity.length()).isEqualTo(5);
        assertThat(validity.isValid(0)).isTrue();
        assertThat(validity.isValid(1)).isFalse();
        assertThat(validity.isValid(2)).isFalse();
        assertThat(validity.isValid(3)).isTrue();
        assertThat(validity.invalidCount()).isEqualTo(2);
    }

    @Test
    void shouldSpliceFlagsOfAnotherColumn() {
        var validity = Validity.allValid(2);
        validity.setInvalid(1);
        var other = Validity.allInvalid(2);

        validity.splice(other, 1);

        assertThat(validity.length()).isEqualTo(4);
        assertThat(validity.isValid(0)).isTrue();
        assertThat(validity.isValid(1)).isFalse();
        assertThat(validity.isValid(2)).isFalse();
        assertThat(validity.isValid(3)).isFalse();
    }

    @Test
    void shouldEraseRowsAndWindows() {
        var validity = Validity.allValid(6);
        validity.setInvalid(2);
        validity.setInvalid(5);
        var rows = new BitSet();
        rows.set(0);

        validity.eraseRows(rows);
        validity.eraseWindow(0, 1);

        assertThat(validity.length()).isEqualTo(4);
        assertThat(validity.isValid(0)).isFalse();
        assertThat(validity.isValid(3)).isFalse();
        assertThat(validity.invalidCount()).isEqualTo(2);
    }

    @Test
    void shouldGatherFlags() {
        var validity = Validity.allValid(3);
        validity.setInvalid(0);

        validity.gather(new int[] {1, 2, 0});

        assertThat(validity.isValid(2)).isFalse();
        assertThat(validity.invalidCount()).isEqualTo(1);
    }

    @Test
    void shouldExtractAndResize() {
        var validity = Validity.allValid(4);
        validity.setInvalid(2);

        var part = validity.extract(1, 2);
        validity.resize(6);

        assertThat(part.length()).isEqualTo(2);
        assertThat(part.isValid(1)).isFalse();
        assertThat(validity.invalidCount()).isEqualTo(3);
    }
}
