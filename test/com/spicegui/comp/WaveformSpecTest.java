package com.spicegui.comp;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WaveformSpecTest {

    @Test
    void findsCallInsideLongerValue() {
        WaveformSpec.Match m = WaveformSpec.find("AC 1 SIN(0 1 1k)").orElseThrow();
        assertThat(m.type()).isEqualTo("SIN");
        assertThat(m.text()).isEqualTo("SIN(0 1 1k)");
    }

    @Test
    void sineIsNormalized() {
        assertThat(WaveformSpec.find("sine (0 2 50)")).map(WaveformSpec.Match::type).contains("SIN");
    }

    @Test
    void wordsWithoutParenthesesAreNotWaveforms() {
        assertThat(WaveformSpec.isWaveform("DC 5")).isFalse();
        assertThat(WaveformSpec.isWaveform("EXPECTED")).isFalse();
        assertThat(WaveformSpec.isWaveform("PWL(0 0 1m 5)")).isTrue();
    }

    @Test
    void missingParamsTakeDefaults() {
        Map<String, String> p = WaveformSpec.parseParams("PULSE", "PULSE(0 3.3 1u)");
        assertThat(p).containsEntry("v2", "3.3").containsEntry("td", "1u").containsEntry("per", "1m");
        assertThat(WaveformSpec.parseParams("PWL", "PWL(0 0 1 1)")).isEmpty();
    }

    @Test
    void spiceValueIsBuiltFromStoredParams() {
        ComponentInstance vw = new ComponentInstance("VW1", ComponentType.WAVEFORM_SOURCE, "");
        assertThat(vw.spiceValue()).isEqualTo("SIN(0 5 1k 0 0 0)");
        vw.setWaveformType("EXP");
        assertThat(vw.spiceValue()).isEqualTo("EXP(0 5 0 1u 2u 2u)");
    }
}
