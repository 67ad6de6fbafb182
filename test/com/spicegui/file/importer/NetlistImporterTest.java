package com.spicegui.file.importer;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.circuit.Node;
import com.spicegui.circuit.TerminalRef;
import com.spicegui.comp.ComponentCatalog;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentType;
import com.spicegui.layout.LayoutRunner;
import com.spicegui.netlist.AnalysisType;
import com.spicegui.netlist.NetlistGenerator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetlistImporterTest {

    private final ComponentCatalog catalog = ComponentCatalog.standard();
    private final NetlistImporter importer = new NetlistImporter(catalog, false);

    private static ComponentInstance get(CircuitGraph g, String id) {
        return g.getComponent(id).orElseThrow(() -> new AssertionError("falta " + id));
    }

    private static long count(CircuitGraph g, ComponentType type) {
        return g.getComponents().stream().filter(c -> c.type() == type).count();
    }

    private static boolean sameNode(CircuitGraph g, String a, int ta, String b, int tb) {
        return g.nodeOf(a, ta).equals(g.nodeOf(b, tb));
    }

    @Test
    void voltageDividerScenario() {
        ImportResult r = importer.importNetlist("Title\nVin 1 0 DC 10\nR1 1 2 250\nR2 2 0 500\n.op\n.end\n");
        CircuitGraph g = r.graph();

        ComponentInstance vin = get(g, "Vin");
        assertThat(vin.type()).isEqualTo(ComponentType.VOLTAGE_SOURCE);
        assertThat(vin.value()).isEqualTo("10");
        assertThat(get(g, "R1").value()).isEqualTo("250");
        assertThat(get(g, "R2").value()).isEqualTo("500");
        assertThat(count(g, ComponentType.GROUND)).isEqualTo(2);

        assertThat(sameNode(g, "Vin", 0, "R1", 0)).isTrue();
        assertThat(sameNode(g, "R1", 1, "R2", 0)).isTrue();
        assertThat(g.nodeOf("Vin", 1)).get().extracting(Node::ground).isEqualTo(true);
        assertThat(g.nodeOf("R2", 1)).get().extracting(Node::ground).isEqualTo(true);

        assertThat(r.analysis()).get().extracting(a -> a.type()).isEqualTo(AnalysisType.OPERATING_POINT);
        assertThat(r.warnings()).isEmpty();
    }

    @Test
    void generatedNetlistRoundTrips() {
        CircuitGraph original = new CircuitGraph();
        add(original, "V1", ComponentType.VOLTAGE_SOURCE, "5");
        add(original, "R1", ComponentType.RESISTOR, "1k");
        add(original, "C1", ComponentType.CAPACITOR, "10n");
        add(original, "E1", ComponentType.VCVS, "3");
        add(original, "OA1", ComponentType.OP_AMP, "Ideal");
        add(original, "Q1", ComponentType.BJT_PNP, "2N3906");
        add(original, "D1", ComponentType.ZENER_DIODE, "IS=1e-14 N=1 BV=5.1 IBV=1e-3");
        add(original, "GND1", ComponentType.GROUND, "0V");
        add(original, "GND2", ComponentType.GROUND, "0V");
        wire(original, "V1", 0, "R1", 0);
        wire(original, "R1", 1, "C1", 0);
        wire(original, "C1", 1, "GND1", 0);
        wire(original, "V1", 1, "GND1", 0);
        wire(original, "E1", 0, "R1", 1);
        wire(original, "E1", 1, "GND2", 0);
        wire(original, "E1", 3, "GND2", 0);
        wire(original, "E1", 2, "OA1", 1);
        wire(original, "OA1", 0, "OA1", 2);
        wire(original, "Q1", 1, "OA1", 2);
        wire(original, "Q1", 0, "GND1", 0);
        wire(original, "D1", 0, "Q1", 2);
        wire(original, "D1", 1, "GND2", 0);
        original.setNodeLabel(new TerminalRef("OA1", 2), "out");

        String netlist = new NetlistGenerator().generate(original);
        ImportResult r = importer.importNetlist(netlist);
        CircuitGraph imported = r.graph();
        assertThat(r.warnings()).isEmpty();

        // mismos componentes (salvo tierras), por nombre de tarjeta
        Map<String, ComponentInstance> byCard = new HashMap<>();
        for (ComponentInstance c : original.getComponents()) {
            if (c.type() != ComponentType.GROUND) byCard.put(catalog.cardName(c), c);
        }
        assertThat(imported.getComponents().stream().filter(c -> c.type() != ComponentType.GROUND))
                .hasSize(byCard.size())
                .allSatisfy(c -> {
                    assertThat(byCard).containsKey(c.id());
                    assertThat(c.type()).isEqualTo(byCard.get(c.id()).type());
                });

        // misma partición, con todas las tierras fundidas en una
        List<TerminalRef[]> pairs = new ArrayList<>();
        for (ComponentInstance a : byCard.values()) {
            for (int ta = 0; ta < catalog.terminalCount(a); ta++) {
                for (ComponentInstance b : byCard.values()) {
                    for (int tb = 0; tb < catalog.terminalCount(b); tb++) {
                        pairs.add(new TerminalRef[] {new TerminalRef(a.id(), ta), new TerminalRef(b.id(), tb)});
                    }
                }
            }
        }
        for (TerminalRef[] p : pairs) {
            boolean before = merged(original, p[0], p[1]);
            boolean after = merged(imported, rename(p[0]), rename(p[1]));
            assertThat(after).as("%s ~ %s", p[0], p[1]).isEqualTo(before);
        }
        assertThat(imported.nodeOf(rename(new TerminalRef("OA1", 2)))).get()
                .extracting(Node::label).isEqualTo("out");
    }

    private TerminalRef rename(TerminalRef t) {
        return t.componentId().equals("OA1") ? new TerminalRef("XOA1", t.terminal()) : t;
    }

    private static boolean merged(CircuitGraph g, TerminalRef a, TerminalRef b) {
        Node na = g.nodeOf(a).orElseThrow();
        Node nb = g.nodeOf(b).orElseThrow();
        return na.equals(nb) || (na.ground() && nb.ground());
    }

    private static void add(CircuitGraph g, String id, ComponentType type, String value) {
        g.addComponent(new ComponentInstance(id, type, value));
    }

    private static void wire(CircuitGraph g, String a, int ta, String b, int tb) {
        g.connect(new TerminalRef(a, ta), new TerminalRef(b, tb));
    }

    @Test
    void senseSourceIsAbsorbedIntoCurrentControlledSource() {
        String text = "t\nVsense_H1 a 0 0\nH1 out 0 Vsense_H1 1k\nR1 a 0 1k\nR2 out 0 1k\n.end";
        CircuitGraph g = importer.importNetlist(text).graph();

        assertThat(g.hasComponent("Vsense_H1")).isFalse();
        ComponentInstance h = get(g, "H1");
        assertThat(h.type()).isEqualTo(ComponentType.CCVS);
        assertThat(h.value()).isEqualTo("1k");
        assertThat(sameNode(g, "H1", 0, "R1", 0)).isTrue();
        assertThat(sameNode(g, "H1", 2, "R2", 0)).isTrue();
    }

    @Test
    void ordinaryVoltageSourceKeepsTheControlPairInItsCurrentPath() {
        String text = "t\nV1 a 0 5\nR3 a 0 1k\nF1 c 0 V1 2\nR2 c 0 1k\n.end";
        ImportResult r = importer.importNetlist(text);
        CircuitGraph g = r.graph();

        assertThat(r.warnings()).isEmpty();
        assertThat(get(g, "V1").value()).isEqualTo("5");
        // [ctrl+, ctrl-] entre la red original de V1+ y el propio V1+
        assertThat(sameNode(g, "F1", 0, "R3", 0)).isTrue();
        assertThat(sameNode(g, "F1", 1, "V1", 0)).isTrue();
        assertThat(sameNode(g, "V1", 0, "R3", 0)).isFalse();
        assertThat(g.nodeOf("V1", 0)).get().satisfies(n -> {
            assertThat(n.terminals()).containsExactlyInAnyOrder(
                    new TerminalRef("F1", 1), new TerminalRef("V1", 0));
            assertThat(n.customLabel()).isNull();
        });
        assertThat(sameNode(g, "F1", 2, "R2", 0)).isTrue();
        assertThat(g.nodeOf("F1", 3)).get().extracting(Node::ground).isEqualTo(true);

        String netlist = new NetlistGenerator().generate(g);
        assertThat(netlist).contains("Vsense_F1 ").doesNotContain("#sense");

        CircuitGraph again = importer.importNetlist(netlist).graph();
        assertThat(again.hasComponent("Vsense_F1")).isFalse();
        assertThat(sameNode(again, "F1", 0, "R3", 0)).isTrue();
        assertThat(sameNode(again, "F1", 1, "V1", 0)).isTrue();
        assertThat(sameNode(again, "V1", 0, "R3", 0)).isFalse();
    }

    @Test
    void oneSourceControllingTwoCardsChainsBothPairs() {
        String text = "t\nV1 a 0 5\nR1 a 0 1k\nF1 c 0 V1 2\nH2 d 0 V1 1k\nR2 c 0 1k\nR3 d 0 1k\n.end";
        ImportResult r = importer.importNetlist(text);
        CircuitGraph g = r.graph();

        assertThat(r.warnings()).isEmpty();
        assertThat(sameNode(g, "F1", 0, "R1", 0)).isTrue();
        assertThat(sameNode(g, "F1", 1, "H2", 0)).isTrue();
        assertThat(sameNode(g, "H2", 1, "V1", 0)).isTrue();
    }

    @Test
    void missingControlSourceLeavesPinsOpenWithWarning() {
        String text = "t\nF1 out 0 Vx 2\nR1 out 0 1k\n.end";
        ImportResult r = importer.importNetlist(text);

        assertThat(r.warnings()).anyMatch(w -> w.contains("F1") && w.contains("Vx"));
        assertThat(r.graph().nodeOf("F1", 0)).get().extracting(n -> n.terminals().size()).isEqualTo(1);
        assertThat(sameNode(r.graph(), "F1", 2, "R1", 0)).isTrue();
    }

    @Test
    void couplingMergesInductorsIntoTransformer() {
        String text = "t\nL_prim_T1 a 0 1m\nL_sec_T1 b 0 4m\nK_T1 L_prim_T1 L_sec_T1 0.95\nR1 a b 1k\n.end";
        CircuitGraph g = importer.importNetlist(text).graph();

        ComponentInstance t = get(g, "T1");
        assertThat(t.type()).isEqualTo(ComponentType.TRANSFORMER);
        assertThat(t.value()).isEqualTo("1m 4m 0.95");
        assertThat(count(g, ComponentType.INDUCTOR)).isZero();
        assertThat(sameNode(g, "T1", 0, "R1", 0)).isTrue();
        assertThat(sameNode(g, "T1", 2, "R1", 1)).isTrue();
    }

    @Test
    void couplingToUnknownInductorWarns() {
        ImportResult r = importer.importNetlist("t\nL1 a 0 1m\nK1 L1 L9 0.9\n.end");
        assertThat(r.warnings()).anyMatch(w -> w.contains("K1"));
        assertThat(get(r.graph(), "L1").type()).isEqualTo(ComponentType.INDUCTOR);
    }

    @Test
    void unsupportedAndMalformedLinesAreSkipped() {
        ImportResult r = importer.importNetlist("t\nR1 a 0 1k\nB1 a 0 V=1\nR2 a\n.end");
        assertThat(r.graph().hasComponent("R1")).isTrue();
        assertThat(r.graph().hasComponent("B1")).isFalse();
        assertThat(r.warnings()).hasSize(2);
    }

    @Test
    void emptyOrComponentlessNetlistFails() {
        assertThatThrownBy(() -> importer.importNetlist("  "))
                .isInstanceOf(NetlistParseException.class);
        assertThatThrownBy(() -> importer.importNetlist("title\n.tran 1u 1m\n.end"))
                .isInstanceOf(NetlistParseException.class)
                .hasMessageContaining("No components");
    }

    @Test
    void namedNodesBecomeLabelsAndGndIsGround() {
        CircuitGraph g = importer.importNetlist("t\nR1 in out 1k\nR2 OUT gnd 2k\n.end").graph();
        assertThat(g.nodeOf("R1", 1)).get().extracting(Node::label).isEqualTo("out");
        assertThat(sameNode(g, "R1", 1, "R2", 0)).isTrue();
        assertThat(g.nodeOf("R2", 1)).get().extracting(Node::ground).isEqualTo(true);
    }

    @Test
    void waveformSourceIsDetected() {
        CircuitGraph g = importer.importNetlist("t\nV1 in 0 SINE(0 1 50)\nR1 in 0 1k\n.tran 1m 100m\n.end").graph();
        ComponentInstance v = get(g, "V1");
        assertThat(v.type()).isEqualTo(ComponentType.WAVEFORM_SOURCE);
        assertThat(v.waveformType()).isEqualTo("SIN");
        assertThat(v.waveformParams().get("SIN")).containsEntry("amplitude", "1").containsEntry("frequency", "50");
        assertThat(g.getAnalysis().type()).isEqualTo(AnalysisType.TRANSIENT);
    }

    @Test
    void continuationCommentsAndControlBlockAreHandled() {
        String text = "t\n* comment\nR1 a 0\n+ 4.7k ; tail\n.control\nrun\nR9 x y 1\n.endc\n.end";
        CircuitGraph g = importer.importNetlist(text).graph();
        assertThat(get(g, "R1").value()).isEqualTo("4.7k");
        assertThat(g.hasComponent("R9")).isFalse();
    }

    @Test
    void devicesAreRefinedByModel() {
        String text = String.join("\n", "t",
                ".model DZ D(IS=1e-14 BV=6.2)",
                ".model MYLED D(IS=1e-20 N=1.8)",
                ".model QP PNP(BF=100)",
                ".model MP PMOS(VTO=-1)",
                ".model SW1 SW(VT=1 RON=1 ROFF=1meg)",
                "D1 a 0 DZ", "D2 a 0 MYLED", "D3 a 0 1N4148",
                "Q1 c b 0 QP", "Q2 c b 0 2N3904",
                "M1 d g 0 0 MP",
                "S1 o 0 c 0 SW1",
                ".end");
        CircuitGraph g = importer.importNetlist(text).graph();

        assertThat(get(g, "D1").type()).isEqualTo(ComponentType.ZENER_DIODE);
        assertThat(get(g, "D1").value()).isEqualTo("IS=1e-14 BV=6.2");
        assertThat(get(g, "D2").type()).isEqualTo(ComponentType.LED);
        assertThat(get(g, "D3").type()).isEqualTo(ComponentType.DIODE);
        assertThat(get(g, "D3").value()).isEqualTo("1N4148");
        assertThat(get(g, "Q1").type()).isEqualTo(ComponentType.BJT_PNP);
        assertThat(get(g, "Q2").type()).isEqualTo(ComponentType.BJT_NPN);
        assertThat(get(g, "M1").type()).isEqualTo(ComponentType.MOSFET_PMOS);
        assertThat(get(g, "S1").value()).isEqualTo("VT=1 RON=1 ROFF=1meg");
    }

    @Test
    void subcircuitInstancesKeepTheirDefinition() {
        String text = String.join("\n", "t",
                ".subckt FILT in out",
                "R1 in out 1k",
                "C1 out 0 1u",
                ".ends FILT",
                "X1 a b FILT",
                "X2 a b c FILT",
                "X3 a b MISSING",
                "V1 a 0 1",
                ".end");
        ImportResult r = importer.importNetlist(text);
        CircuitGraph g = r.graph();

        ComponentInstance x1 = get(g, "X1");
        assertThat(x1.type()).isEqualTo(ComponentType.SUBCIRCUIT);
        assertThat(x1.subcircuitName()).isEqualTo("FILT");
        assertThat(x1.subcircuitPins()).containsExactly("in", "out");
        assertThat(g.findSubcircuitDefinition("filt")).isPresent();
        // las tarjetas internas no son componentes del circuito
        assertThat(g.hasComponent("C1")).isFalse();
        assertThat(r.warnings()).anyMatch(w -> w.contains("X2")).anyMatch(w -> w.contains("MISSING"));
    }

    @Test
    void opAmpInstanceMapsInputsBack() {
        CircuitGraph g = importer.importNetlist("t\nXU1 0 inv out OPAMP_IDEAL\nR1 inv out 10k\n.end").graph();
        ComponentInstance u = get(g, "XU1");
        assertThat(u.type()).isEqualTo(ComponentType.OP_AMP);
        assertThat(g.nodeOf("XU1", 1)).get().extracting(Node::ground).isEqualTo(true);
        assertThat(sameNode(g, "XU1", 0, "R1", 0)).isTrue();
        assertThat(sameNode(g, "XU1", 2, "R1", 1)).isTrue();
    }

    @Test
    void parametersAreStored() {
        CircuitGraph g = importer.importNetlist("t\n.param Rload=2k\nR1 a 0 {Rload}\n.end").graph();
        assertThat(g.getParameters()).containsEntry("Rload", "2k");
        assertThat(get(g, "R1").value()).isEqualTo("{Rload}");
    }

    @Test
    void autoLayoutPlacesComponentsOnTheGrid() {
        NetlistImporter withLayout = new NetlistImporter();
        CircuitGraph g = withLayout.importNetlist("t\nV1 1 0 5\nR1 1 2 1k\nR2 2 0 1k\n.end").graph();
        assertThat(g.getComponents()).allSatisfy(c -> {
            assertThat(Math.abs(c.position().x() % LayoutRunner.GRID)).isEqualTo(0.0);
            assertThat(Math.abs(c.position().y() % LayoutRunner.GRID)).isEqualTo(0.0);
        });
    }
}
