package com.phillippitts.gatesentry.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldValueTest {

    @Test
    void unsetAndUnknownAreMissingButDistinct() {
        assertThat(FieldValue.unset().isMissing()).isTrue();
        assertThat(FieldValue.unknown().isMissing()).isTrue();
        assertThat(FieldValue.unset()).isNotEqualTo(FieldValue.unknown());
        assertThat(FieldValue.unknown().value()).isEmpty();
    }

    @Test
    void concreteValueExposesContent() {
        FieldValue v = FieldValue.of("Bob Jones");

        assertThat(v.isValue()).isTrue();
        assertThat(v.value()).contains("Bob Jones");
        assertThat(v.orElse("x")).isEqualTo("Bob Jones");
        assertThat(v).isEqualTo(FieldValue.of("Bob Jones"));
    }

    @Test
    void rejectsBlankValue() {
        assertThatThrownBy(() -> FieldValue.of("  "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldValue.of(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
