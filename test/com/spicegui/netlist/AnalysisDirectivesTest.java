package com.spicegui.netlist;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisDirectivesTest {

    @Test
    void tranUsesStepThenStop() {
        Analysis a = AnalysisDirectives.parse(".tran 1u 10m 2m").orElseThrow();
        assertThat(a.type()).isEqualTo(AnalysisType.TRANSIENT);
        assertThat(a.params()).containsEntry("step", "1u").containsEntry("duration", "10m")
                .containsEntry("start", "2m");
        assertThat(AnalysisDirectives.emit(a, Optional.empty())).containsExactly(".tran 1u 10m 2m");
    }

    @Test
    void singleTranArgumentIsStepAndStop() {
        Analysis a = AnalysisDirectives.parse(".TRAN 5m UIC").orElseThrow();
        assertThat(a.params()).containsEntry("step", "5m").containsEntry("duration", "5m");
    }

    @Test
    void acAndDcRoundTrip() {
        for (String line : new String[] {".ac dec 100 1 1e6", ".dc V1 0 5 0.5", ".op",
                ".sens v(out)", ".tf v(out) Vin", ".pz 1 0 2 0 vol pz"}) {
            Analysis a = AnalysisDirectives.parse(line).orElseThrow();
            assertThat(AnalysisDirectives.emit(a, Optional.of("V9"))).containsExactly(line);
        }
    }

    @Test
    void noiseProbeIsUnwrapped() {
        Analysis a = AnalysisDirectives.parse(".noise v(out,0) Vin oct 10 10 100k").orElseThrow();
        assertThat(a.param("output_node")).isEqualTo("out");
        assertThat(AnalysisDirectives.emit(a, Optional.empty()))
                .containsExactly(".noise v(out) Vin oct 10 10 100k");
    }

    @Test
    void temperatureSweepEmitsOpPlusStep() {
        Analysis a = new Analysis(AnalysisType.TEMPERATURE_SWEEP, Map.of());
        assertThat(AnalysisDirectives.emit(a, Optional.empty())).containsExactly(".op", ".step temp -40 85 25");
        assertThat(AnalysisDirectives.parse(".step temp 0 100 10")).get()
                .extracting(Analysis::type).isEqualTo(AnalysisType.TEMPERATURE_SWEEP);
    }

    @Test
    void dcSweepWithoutSourceFallsBackToOp() {
        Analysis a = new Analysis(AnalysisType.DC_SWEEP, Map.of());
        assertThat(AnalysisDirectives.emit(a, Optional.empty()))
                .containsExactly("* Warning: DC Sweep requires a voltage source", ".op");
    }

    @Test
    void nonAnalysisDirectivesAreIgnored() {
        assertThat(AnalysisDirectives.parse(".model D1 D(IS=1n)")).isEmpty();
        assertThat(AnalysisDirectives.parse("R1 1 0 1k")).isEmpty();
        assertThat(AnalysisDirectives.parse(".step param R 1 2 1")).isEmpty();
    }
}
