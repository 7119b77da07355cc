package io.coltab.kernel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorTest {

    @Test
    void shouldApplyOperatorsToComparisonSign() {
        assertThat(Operator.EQUAL_TO.test(0)).isTrue();
        assertThat(Operator.NOT_EQUAL_TO.test(-3)).isTrue();
        assertThat(Operator.GREATER_THAN.test(1)).isTrue();
        assertThat(Operator.NOT_GREATER_THAN.test(0)).isTrue();
        assertThat(Operator.LESS_THAN.test(0)).isFalse();
        assertThat(Operator.NOT_LESS_THAN.test(-1)).isFalse();
    }

    @Test
    void shouldCompareIntegralValues() {
        assertThat(Operator.GREATER_THAN.test(5L, 0L)).isTrue();
        assertThat(Operator.LESS_THAN.test(Long.MIN_VALUE, Long.MAX_VALUE)).isTrue();
        assertThat(Operator.NOT_LESS_THAN.test(3L, 3L)).isTrue();
    }

    @Test
    void shouldOnlySatisfyNotEqualWithNaN() {
        for (Operator operator : Operator.values()) {
            assertThat(operator.test(Double.NaN, 1.0))
                    .as(operator.symbol())
                    .isEqualTo(operator == Operator.NOT_EQUAL_TO);
        }
    }

    @Test
    void shouldFlagEqualityOperators() {
        assertThat(Operator.EQUAL_TO.isEquality()).isTrue();
        assertThat(Operator.NOT_EQUAL_TO.isEquality()).isTrue();
        assertThat(Operator.GREATER_THAN.isEquality()).isFalse();
        assertThat(Operator.NOT_LESS_THAN.symbol()).isEqualTo(">=");
    }
}
