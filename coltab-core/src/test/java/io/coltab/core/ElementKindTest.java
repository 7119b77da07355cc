package io.coltab.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElementKindTest {

    @Test
    void shouldClassifyKinds() {
        assertThat(ElementKind.UNSIGNED_BYTE.isIntegral()).isTrue();
        assertThat(ElementKind.FLOAT.isReal()).isTrue();
        assertThat(ElementKind.FLOAT_COMPLEX.isComplex()).isTrue();
        assertThat(ElementKind.STRING.isNumeric()).isFalse();
        assertThat(ElementKind.DOUBLE_COMPLEX.slotsPerElement()).isEqualTo(2);
        assertThat(ElementKind.DOUBLE_COMPLEX.componentType()).isEqualTo(double.class);
    }

    @Test
    void shouldMapRealAndComplexCounterparts() {
        assertThat(ElementKind.FLOAT_COMPLEX.realPart()).isEqualTo(ElementKind.FLOAT);
        assertThat(ElementKind.INT.realPart()).isEqualTo(ElementKind.INT);
        assertThat(ElementKind.FLOAT.complexCounterpart()).isEqualTo(ElementKind.FLOAT_COMPLEX);
        assertThat(ElementKind.SHORT.complexCounterpart()).isEqualTo(ElementKind.DOUBLE_COMPLEX);
        assertThatThrownBy(ElementKind.STRING::complexCounterpart)
                .isInstanceOf(ColtabException.class)
                .extracting(e -> ((ColtabException) e).code())
                .isEqualTo(ErrorCode.INVALID_TYPE);
    }

    @Test
    void shouldNarrowToKindWidth() {
        assertThat(ElementKind.BYTE.narrow(200)).isEqualTo(-56);
        assertThat(ElementKind.UNSIGNED_BYTE.narrow(-1)).isEqualTo(255);
        assertThat(ElementKind.SHORT.narrow(70000)).isEqualTo(4464);
        assertThat(ElementKind.BOOLEAN.narrow(42)).isEqualTo(1);
        assertThat(ElementKind.INT.truncate(-2.9)).isEqualTo(-2);
    }
}
