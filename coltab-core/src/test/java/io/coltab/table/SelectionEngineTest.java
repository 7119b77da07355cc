package io.coltab.table;

import io.coltab.core.ColtabConfiguration;
import io.coltab.core.ColtabException;
import io.coltab.core.Complex;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Operator;
import io.coltab.testutil.Tables;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectionEngineTest {

    @Test
    @DisplayName("AND with a constant keeps the matching rows")
    void shouldSelectRowsGreaterThanConstant() {
        var table = Tables.longs("n", 5L, -2L, 7L);

        int count = table.andSelected("n", Operator.GREATER_THAN, 0L);

        assertThat(count).isEqualTo(2);
        assertThat(table.whereSelected()).containsExactly(0, 2);
    }

    @Test
    void shouldIntersectChainedPredicates() {
        var table = Tables.longs("a", 1L, 2L, 3L, 4L, 5L, 6L);
        Tables.addDoubles(table, "b", 0.5, 1.5, null, 3.5, 0.1, 9.0);

        table.andSelected("a", Operator.NOT_LESS_THAN, 2L);
        table.andSelected("b", Operator.GREATER_THAN, 1.0);
        table.andSelected("a", Operator.NOT_EQUAL_TO, 4L);

        assertThat(table.whereSelected()).containsExactly(1, 5);
    }

    @Test
    void shouldNeverSelectInvalidOperand() {
        var table = Tables.longs("n", 1L, null, 3L);

        table.andSelected("n", Operator.NOT_EQUAL_TO, 99L);
        assertThat(table.whereSelected()).containsExactly(0, 2);

        table.unselectAll();
        table.orSelected("n", Operator.NOT_EQUAL_TO, 99L);
        assertThat(table.whereSelected()).containsExactly(0, 2);
    }

    @Test
    void shouldOnlyAddRowsWithOr() {
        var table = Tables.longs("n", 1L, 2L, 3L, 4L);
        table.andSelected("n", Operator.EQUAL_TO, 1L);

        int count = table.orSelected("n", Operator.NOT_LESS_THAN, 4L);

        assertThat(count).isEqualTo(2);
        assertThat(table.whereSelected()).containsExactly(0, 3);
    }

    @Test
    void shouldCompareIntegralColumnWithFractionalConstant() {
        var table = Tables.longs("n", 1L, 2L, 3L);

        table.andSelected("n", Operator.LESS_THAN, 2.5);

        assertThat(table.whereSelected()).containsExactly(0, 1);
    }

    @Test
    void shouldMatchStringsAsRegularExpression() {
        var table = Tables.strings("s", "alpha", "beta", null, "gamma");

        table.andSelectedString("s", Operator.EQUAL_TO, "^[ab]");

        assertThat(table.whereSelected()).containsExactly(0, 1);

        table.selectAll();
        table.andSelectedString("s", Operator.NOT_EQUAL_TO, "ta$");
        assertThat(table.whereSelected()).containsExactly(0, 3);
    }

    @Test
    void shouldOrderStringsLexicographically() {
        var table = Tables.strings("s", "apple", "banana", "cherry");

        table.andSelectedString("s", Operator.NOT_GREATER_THAN, "banana");

        assertThat(table.whereSelected()).containsExactly(0, 1);
    }

    @Test
    void shouldRejectMalformedPattern() {
        var table = Tables.strings("s", "x");

        assertThatThrownBy(() -> table.andSelectedString("s", Operator.EQUAL_TO, "(["))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.ILLEGAL_INPUT));
        assertThat(table.countSelected()).isEqualTo(1);
    }

    @Test
    void shouldCacheCompiledPatterns() {
        var table = Tables.strings("s", "a", "b");

        table.andSelectedString("s", Operator.EQUAL_TO, "a");
        table.orSelectedString("s", Operator.EQUAL_TO, "a");
        table.orSelectedString("s", Operator.EQUAL_TO, "b");

        assertThat(table.patterns().size()).isEqualTo(2);
    }

    @Test
    void shouldCompileWithoutCacheWhenDisabled() {
        var config = ColtabConfiguration.builder().patternCacheSize(0).build();
        var table = ColumnTable.create(1, config);
        table.newColumn("s", ElementKind.STRING);
        table.setString("s", 0, "abc");

        table.andSelectedString("s", Operator.EQUAL_TO, "b");

        assertThat(table.countSelected()).isEqualTo(1);
        assertThat(table.patterns().size()).isZero();
    }

    @Test
    void shouldCompareColumnsAfterPromotion() {
        var table = ColumnTable.create(3);
        Tables.addLongs(table, "i", ElementKind.INT, 1L, 2L, 3L);
        Tables.addDoubles(table, "d", 1.5, 2.0, null);

        table.andSelectedColumns("i", Operator.NOT_LESS_THAN, "d");

        assertThat(table.whereSelected()).containsExactly(1);
    }

    @Test
    void shouldCompareStringColumns() {
        var table = Tables.strings("a", "x", "b", "m");
        Tables.addStrings(table, "b", "a", "c", "m");

        table.andSelectedColumns("a", Operator.EQUAL_TO, "b");
        assertThat(table.whereSelected()).containsExactly(2);

        table.orSelectedColumns("a", Operator.GREATER_THAN, "b");
        assertThat(table.whereSelected()).containsExactly(0, 2);
    }

    @Test
    void shouldRejectStringAgainstNumericColumn() {
        var table = Tables.strings("s", "1");
        Tables.addLongs(table, "n", 1L);

        assertThatThrownBy(() -> table.andSelectedColumns("s", Operator.EQUAL_TO, "n"))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.TYPE_MISMATCH));
    }

    @Test
    void shouldTestComplexEquality() {
        var table = ColumnTable.create(3);
        table.newColumn("z", ElementKind.DOUBLE_COMPLEX);
        table.setComplex("z", 0, Complex.of(1.0, 2.0));
        table.setComplex("z", 1, Complex.of(1.0, 0.0));

        table.andSelected("z", Operator.EQUAL_TO, Complex.of(1.0, 2.0));
        assertThat(table.whereSelected()).containsExactly(0);

        table.orSelected("z", Operator.EQUAL_TO, 1L);
        assertThat(table.whereSelected()).containsExactly(0, 1);
    }

    @Test
    void shouldRejectOrderingOnComplexColumn() {
        var table = ColumnTable.create(1);
        table.newColumn("z", ElementKind.FLOAT_COMPLEX);

        assertThatThrownBy(() -> table.andSelected("z", Operator.LESS_THAN, Complex.ZERO))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.ILLEGAL_INPUT));
    }

    @Test
    void shouldRejectNumericPredicateOnStringColumn() {
        var table = Tables.strings("s", "a");

        assertThatThrownBy(() -> table.andSelected("s", Operator.EQUAL_TO, 1L))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.TYPE_MISMATCH));
    }

    @Test
    void shouldRejectArrayColumn() {
        var table = ColumnTable.create(1);
        table.newArrayColumn("a", ElementKind.INT, 3);

        assertThatThrownBy(() -> table.andSelected("a", Operator.EQUAL_TO, 1L))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.UNSUPPORTED_MODE));
    }

    @Test
    void shouldFailOnUnknownColumn() {
        var table = Tables.longs("n", 1L);

        assertThatThrownBy(() -> table.andSelected("missing", Operator.EQUAL_TO, 1L))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.DATA_NOT_FOUND));
    }

    @Test
    void shouldSelectInvalidElements() {
        var table = Tables.longs("n", null, 2L, null);

        assertThat(table.andSelectedInvalid("n")).isEqualTo(2);
        assertThat(table.whereSelected()).containsExactly(0, 2);

        table.unselectAll();
        assertThat(table.orSelectedInvalid("n")).isEqualTo(2);
    }

    @Test
    void shouldSelectClippedWindow() {
        var table = Tables.longs("n", 0L, 1L, 2L, 3L, 4L);

        assertThat(table.andSelectedWindow(3, 10)).isEqualTo(2);
        assertThat(table.orSelectedWindow(0, 1)).isEqualTo(3);
        assertThat(table.whereSelected()).containsExactly(0, 3, 4);
        assertThatThrownBy(() -> table.andSelectedWindow(5, 1))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.ACCESS_OUT_OF_RANGE));
    }

    @Test
    void shouldInvertSelection() {
        var table = Tables.longs("n", 1L, 2L, 3L);
        table.andSelected("n", Operator.EQUAL_TO, 2L);

        assertThat(table.notSelected()).isEqualTo(2);
        assertThat(table.whereSelected()).containsExactly(0, 2);
    }

    @Test
    void shouldToggleSingleRows() {
        var table = ColumnTable.create(3);

        table.unselectRow(1);
        assertThat(table.isSelected(1)).isFalse();
        assertThat(table.countSelected()).isEqualTo(2);

        table.selectRow(1);
        assertThat(table.countSelected()).isEqualTo(3);
        assertThatThrownBy(() -> table.selectRow(3))
                .isInstanceOfSatisfying(ColtabException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.ACCESS_OUT_OF_RANGE));
    }

    @Test
    void shouldKeepEmptySelectionUnderAnd() {
        var table = Tables.longs("n", 1L, 2L);
        table.unselectAll();

        assertThat(table.andSelected("n", Operator.GREATER_THAN, 0L)).isZero();
    }

    @Test
    @DisplayName("Conjugated real values still equal the real literal")
    void shouldMatchConjugatedComplexWithRealLiteral() {
        var table = ColumnTable.create(2);
        table.newColumn("z", ElementKind.DOUBLE_COMPLEX);
        table.setComplex("z", 0, Complex.of(5.0, 0.0));
        table.setComplex("z", 1, Complex.of(6.0, 0.0));

        table.conjugateColumn("z");

        assertThat(table.andSelected("z", Operator.EQUAL_TO, 5L)).isEqualTo(1);
        assertThat(table.whereSelected()).containsExactly(0);
    }

    @Test
    void shouldCompareComplexColumnsNumerically() {
        var table = ColumnTable.create(2);
        table.newColumn("a", ElementKind.DOUBLE_COMPLEX);
        table.newColumn("b", ElementKind.DOUBLE_COMPLEX);
        table.setComplex("a", 0, Complex.of(1.0, -0.0));
        table.setComplex("b", 0, Complex.of(1.0, 0.0));
        table.setComplex("a", 1, Complex.of(Double.NaN, 0.0));
        table.setComplex("b", 1, Complex.of(Double.NaN, 0.0));

        table.andSelectedColumns("a", Operator.EQUAL_TO, "b");

        assertThat(table.whereSelected()).containsExactly(0);
    }

    @Test
    void shouldCompareFloatColumnAtFloatPrecision() {
        var table = ColumnTable.create(2);
        table.newColumn("f", ElementKind.FLOAT);
        table.setDouble("f", 0, 0.1);
        table.setDouble("f", 1, 0.2);

        assertThat(table.andSelected("f", Operator.EQUAL_TO, 0.1)).isEqualTo(1);

        table.selectAll();
        assertThat(table.andSelected("f", Operator.NOT_GREATER_THAN, 0.1)).isEqualTo(1);
    }

    @Test
    void shouldCompareFloatComplexColumnAtFloatPrecision() {
        var table = ColumnTable.create(1);
        table.newColumn("z", ElementKind.FLOAT_COMPLEX);
        table.setComplex("z", 0, Complex.of(0.1, 0.3));

        assertThat(table.andSelected("z", Operator.EQUAL_TO, Complex.of(0.1, 0.3))).isEqualTo(1);
    }

    @Test
    void shouldOrderStringsByCodePoint() {
        var table = Tables.strings("s", "\uD83D\uDE00", "\uFF61");
        Tables.addStrings(table, "t", "\uFF61", "\uD83D\uDE00");

        table.andSelectedString("s", Operator.GREATER_THAN, "\uFF61");
        assertThat(table.whereSelected()).containsExactly(0);

        table.selectAll();
        table.andSelectedColumns("s", Operator.LESS_THAN, "t");
        assertThat(table.whereSelected()).containsExactly(1);
    }
}
