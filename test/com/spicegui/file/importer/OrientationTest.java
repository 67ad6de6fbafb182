package com.spicegui.file.importer;

import com.spicegui.comp.ComponentType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class OrientationTest {

    private static final GridPoint P = new GridPoint(16, 64);
    private static final GridPoint ORIGIN = new GridPoint(320, -48);

    /** Tipos con la misma disposición de pines, orientación y puntos absolutos desde ORIGIN. */
    private static final String[][] PIN_TABLE = {
            {"RESISTOR INDUCTOR", "R0", "320,-48 320,32"},
            {"RESISTOR INDUCTOR", "R90", "320,-48 400,-48"},
            {"RESISTOR INDUCTOR", "R180", "320,-48 320,-128"},
            {"RESISTOR INDUCTOR", "R270", "320,-48 240,-48"},
            {"RESISTOR INDUCTOR", "M0", "320,-48 320,32"},
            {"RESISTOR INDUCTOR", "M90", "320,-48 400,-48"},
            {"RESISTOR INDUCTOR", "M180", "320,-48 320,-128"},
            {"RESISTOR INDUCTOR", "M270", "320,-48 240,-48"},
            {"CAPACITOR DIODE LED ZENER_DIODE", "R0", "320,-48 320,16"},
            {"CAPACITOR DIODE LED ZENER_DIODE", "R90", "320,-48 384,-48"},
            {"CAPACITOR DIODE LED ZENER_DIODE", "R180", "320,-48 320,-112"},
            {"CAPACITOR DIODE LED ZENER_DIODE", "R270", "320,-48 256,-48"},
            {"CAPACITOR DIODE LED ZENER_DIODE", "M0", "320,-48 320,16"},
            {"CAPACITOR DIODE LED ZENER_DIODE", "M90", "320,-48 384,-48"},
            {"CAPACITOR DIODE LED ZENER_DIODE", "M180", "320,-48 320,-112"},
            {"CAPACITOR DIODE LED ZENER_DIODE", "M270", "320,-48 256,-48"},
            {"VOLTAGE_SOURCE CURRENT_SOURCE WAVEFORM_SOURCE", "R0", "320,-48 320,64"},
            {"VOLTAGE_SOURCE CURRENT_SOURCE WAVEFORM_SOURCE", "R90", "320,-48 432,-48"},
            {"VOLTAGE_SOURCE CURRENT_SOURCE WAVEFORM_SOURCE", "R180", "320,-48 320,-160"},
            {"VOLTAGE_SOURCE CURRENT_SOURCE WAVEFORM_SOURCE", "R270", "320,-48 208,-48"},
            {"VOLTAGE_SOURCE CURRENT_SOURCE WAVEFORM_SOURCE", "M0", "320,-48 320,64"},
            {"VOLTAGE_SOURCE CURRENT_SOURCE WAVEFORM_SOURCE", "M90", "320,-48 432,-48"},
            {"VOLTAGE_SOURCE CURRENT_SOURCE WAVEFORM_SOURCE", "M180", "320,-48 320,-160"},
            {"VOLTAGE_SOURCE CURRENT_SOURCE WAVEFORM_SOURCE", "M270", "320,-48 208,-48"},
            {"BJT_NPN MOSFET_NMOS", "R0", "336,-48 304,-16 336,16"},
            {"BJT_NPN MOSFET_NMOS", "R90", "320,-64 352,-32 384,-64"},
            {"BJT_NPN MOSFET_NMOS", "R180", "304,-48 336,-80 304,-112"},
            {"BJT_NPN MOSFET_NMOS", "R270", "320,-32 288,-64 256,-32"},
            {"BJT_NPN MOSFET_NMOS", "M0", "304,-48 336,-16 304,16"},
            {"BJT_NPN MOSFET_NMOS", "M90", "320,-32 352,-64 384,-32"},
            {"BJT_NPN MOSFET_NMOS", "M180", "336,-48 304,-80 336,-112"},
            {"BJT_NPN MOSFET_NMOS", "M270", "320,-64 288,-32 256,-64"},
            {"BJT_PNP MOSFET_PMOS", "R0", "336,16 304,-16 336,-48"},
            {"BJT_PNP MOSFET_PMOS", "R90", "384,-64 352,-32 320,-64"},
            {"BJT_PNP MOSFET_PMOS", "R180", "304,-112 336,-80 304,-48"},
            {"BJT_PNP MOSFET_PMOS", "R270", "256,-32 288,-64 320,-32"},
            {"BJT_PNP MOSFET_PMOS", "M0", "304,16 336,-16 304,-48"},
            {"BJT_PNP MOSFET_PMOS", "M90", "384,-32 352,-64 320,-32"},
            {"BJT_PNP MOSFET_PMOS", "M180", "336,-112 304,-80 336,-48"},
            {"BJT_PNP MOSFET_PMOS", "M270", "256,-64 288,-32 320,-64"},
            {"OP_AMP", "R0", "288,-80 288,-16 352,-48"},
            {"OP_AMP", "R90", "288,-16 352,-16 320,-80"},
            {"OP_AMP", "R180", "352,-16 352,-80 288,-48"},
            {"OP_AMP", "R270", "352,-80 288,-80 320,-16"},
            {"OP_AMP", "M0", "352,-80 352,-16 288,-48"},
            {"OP_AMP", "M90", "288,-80 352,-80 320,-16"},
            {"OP_AMP", "M180", "288,-16 288,-80 352,-48"},
            {"OP_AMP", "M270", "352,-16 288,-16 320,-80"},
            {"VCVS CCVS VCCS CCCS", "R0", "288,-16 288,-80 352,-80 352,-16"},
            {"VCVS CCVS VCCS CCCS", "R90", "352,-16 288,-16 288,-80 352,-80"},
            {"VCVS CCVS VCCS CCCS", "R180", "352,-80 352,-16 288,-16 288,-80"},
            {"VCVS CCVS VCCS CCCS", "R270", "288,-80 352,-80 352,-16 288,-16"},
            {"VCVS CCVS VCCS CCCS", "M0", "352,-16 352,-80 288,-80 288,-16"},
            {"VCVS CCVS VCCS CCCS", "M90", "352,-80 288,-80 288,-16 352,-16"},
            {"VCVS CCVS VCCS CCCS", "M180", "288,-80 288,-16 352,-16 352,-80"},
            {"VCVS CCVS VCCS CCCS", "M270", "288,-16 352,-16 352,-80 288,-80"}
    };

    static Stream<Arguments> pinTable() {
        List<Arguments> out = new ArrayList<>();
        for (String[] row : PIN_TABLE) {
            for (String type : row[0].split(" ")) {
                out.add(Arguments.of(ComponentType.valueOf(type), Orientation.valueOf(row[1]), row[2]));
            }
        }
        return out.stream();
    }

    private static List<GridPoint> points(String text) {
        List<GridPoint> out = new ArrayList<>();
        for (String xy : text.split(" ")) {
            String[] p = xy.split(",");
            out.add(new GridPoint(Integer.parseInt(p[0]), Integer.parseInt(p[1])));
        }
        return out;
    }

    @Test
    void compositionMatchesSequentialApplication() {
        for (Orientation a : Orientation.values()) {
            for (Orientation b : Orientation.values()) {
                assertThat(a.then(b).apply(P)).as("%s · %s", a, b).isEqualTo(b.apply(a.apply(P)));
            }
        }
    }

    @Test
    void everyOrientationHasAnInverse() {
        for (Orientation o : Orientation.values()) {
            assertThat(o.inverse().apply(o.apply(P))).isEqualTo(P);
            assertThat(o.then(o.inverse())).isEqualTo(Orientation.R0);
        }
    }

    @Test
    void rotationsAreQuarterTurns() {
        GridPoint down = new GridPoint(0, 80);
        assertThat(Orientation.R90.apply(down)).isEqualTo(new GridPoint(80, 0));
        assertThat(Orientation.R180.apply(down)).isEqualTo(new GridPoint(0, -80));
        assertThat(Orientation.R270.apply(down)).isEqualTo(new GridPoint(-80, 0));
        assertThat(Orientation.M0.apply(new GridPoint(16, 0))).isEqualTo(new GridPoint(-16, 0));
        assertThat(Orientation.R90.then(Orientation.R90).then(Orientation.R90).then(Orientation.R90))
                .isEqualTo(Orientation.R0);
    }

    @Test
    void parseAcceptsCodesAndRejectsGarbage() {
        assertThat(Orientation.parse("m270")).contains(Orientation.M270);
        assertThat(Orientation.parse("")).contains(Orientation.R0);
        assertThat(Orientation.parse("R45")).isEmpty();
    }

    @Test
    void editorFlagsMapToOrientation() {
        assertThat(Orientation.of(90, false, false)).isEqualTo(Orientation.R90);
        assertThat(Orientation.of(-90, true, false)).isEqualTo(Orientation.M270);
        assertThat(Orientation.of(0, false, true)).isEqualTo(Orientation.M180);
        assertThat(Orientation.of(0, true, true)).isEqualTo(Orientation.R180);
    }

    @Test
    void referencePointFollowsRotateAfterMirror() {
        GridPoint p = new GridPoint(10, 20);
        assertThat(Orientation.R0.apply(p)).isEqualTo(p);
        assertThat(Orientation.R90.apply(p)).isEqualTo(new GridPoint(20, -10));
        assertThat(Orientation.R180.apply(p)).isEqualTo(new GridPoint(-10, -20));
        assertThat(Orientation.R270.apply(p)).isEqualTo(new GridPoint(-20, 10));
        assertThat(Orientation.M0.apply(p)).isEqualTo(new GridPoint(-10, 20));
        assertThat(Orientation.M90.apply(p)).isEqualTo(new GridPoint(20, 10));
        assertThat(Orientation.M180.apply(p)).isEqualTo(new GridPoint(10, -20));
        assertThat(Orientation.M270.apply(p)).isEqualTo(new GridPoint(-20, -10));
    }

    @Test
    void oppositeTurnsAndDoubleMirrorCancel() {
        assertThat(Orientation.R90.then(Orientation.R270)).isEqualTo(Orientation.R0);
        assertThat(Orientation.R270.then(Orientation.R90)).isEqualTo(Orientation.R0);
        assertThat(Orientation.R180.then(Orientation.R180)).isEqualTo(Orientation.R0);
        assertThat(Orientation.M0.then(Orientation.M0)).isEqualTo(Orientation.R0);
        assertThat(Orientation.M90.then(Orientation.M90)).isEqualTo(Orientation.R0);
        assertThat(Orientation.M0.then(Orientation.R90)).isEqualTo(Orientation.M90);
        assertThat(Orientation.R90.then(Orientation.M0)).isEqualTo(Orientation.M270);
    }

    @ParameterizedTest(name = "{0} {1}")
    @MethodSource("pinTable")
    void pinsLandOnTheExpectedPoints(ComponentType type, Orientation o, String expected) {
        List<GridPoint> want = points(expected);
        assertThat(AscSymbolTable.pinOffsets(type)).hasSameSizeAs(want);
        for (int t = 0; t < want.size(); t++) {
            assertThat(AscSymbolTable.pinAt(type, t, ORIGIN, o)).as("%s pin %d %s", type, t, o)
                    .isEqualTo(want.get(t));
        }
    }

    @Test
    void pinTableCoversEverySymbolInEveryOrientation() {
        Set<String> covered = new HashSet<>();
        for (String[] row : PIN_TABLE) {
            for (String type : row[0].split(" ")) covered.add(type + " " + row[1]);
        }
        for (ComponentType type : ComponentType.values()) {
            if (AscSymbolTable.symbolFor(type).isEmpty()) continue;
            for (Orientation o : Orientation.values()) {
                assertThat(covered).contains(type + " " + o);
            }
        }
        assertThat(Arrays.stream(PIN_TABLE).map(r -> r[1]).distinct()).hasSize(Orientation.values().length);
    }

    @ParameterizedTest
    @EnumSource(Orientation.class)
    void pinOffsetsStayDistinctAndKeepLengthInEveryOrientation(Orientation o) {
        GridPoint origin = ORIGIN;
        for (ComponentType type : ComponentType.values()) {
            if (AscSymbolTable.symbolFor(type).isEmpty()) continue;
            List<GridPoint> offsets = AscSymbolTable.pinOffsets(type);
            Set<GridPoint> placed = new HashSet<>();
            for (int t = 0; t < offsets.size(); t++) {
                GridPoint at = AscSymbolTable.pinAt(type, t, origin, o);
                GridPoint d = offsets.get(t);
                int dx = at.x() - origin.x();
                int dy = at.y() - origin.y();
                assertThat(dx * dx + dy * dy).as("%s pin %d %s", type, t, o)
                        .isEqualTo(d.x() * d.x() + d.y() * d.y());
                placed.add(at);
            }
            assertThat(placed).as("%s %s", type, o).hasSize(offsets.size());
        }
    }

    @Test
    void symbolLookupIgnoresLibraryPathAndCase() {
        assertThat(AscSymbolTable.typeFor("Opamps\\opamp2")).contains(ComponentType.OP_AMP);
        assertThat(AscSymbolTable.typeFor("RES")).contains(ComponentType.RESISTOR);
        assertThat(AscSymbolTable.typeFor("misc/LED")).contains(ComponentType.LED);
        assertThat(AscSymbolTable.typeFor("sw")).isEmpty();
    }
}
