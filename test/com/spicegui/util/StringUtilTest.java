package com.spicegui.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StringUtilTest {

    @Test
    void formatsSequentialAndPositionalArguments() {
        assertThat(StringUtil.format("%s tiene %s pines", "X1", "3")).isEqualTo("X1 tiene 3 pines");
        assertThat(StringUtil.format("%$2 antes que %$1", "a", "b")).isEqualTo("b antes que a");
        assertThat(StringUtil.format("100%% y 5%", "x")).isEqualTo("100% y 5%");
        assertThat(StringUtil.format("falta %s")).isEqualTo("falta (null)");
        assertThat(StringUtil.format(null)).isEmpty();
    }

    @Test
    void trailingNumber() {
        assertThat(StringUtil.trailingNumber("R12")).hasValue(12);
        assertThat(StringUtil.trailingNumber("GND")).isEmpty();
        assertThat(StringUtil.trailingNumber("X1234567890")).isEmpty();
        assertThat(StringUtil.trailingNumber(null)).isEmpty();
    }
}
