package com.spicegui.layout;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.circuit.TerminalRef;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LayoutRunnerTest {

    private static CircuitGraph ladder() {
        CircuitGraph g = new CircuitGraph();
        g.addComponent(new ComponentInstance("V1", ComponentType.VOLTAGE_SOURCE, "5"));
        g.addComponent(new ComponentInstance("R1", ComponentType.RESISTOR, "1k"));
        g.addComponent(new ComponentInstance("R2", ComponentType.RESISTOR, "1k"));
        g.addComponent(new ComponentInstance("C1", ComponentType.CAPACITOR, "1u"));
        g.addComponent(new ComponentInstance("GND1", ComponentType.GROUND, "0V"));
        g.connect(new TerminalRef("V1", 0), new TerminalRef("R1", 0));
        g.connect(new TerminalRef("R1", 1), new TerminalRef("R2", 0));
        g.connect(new TerminalRef("R2", 1), new TerminalRef("C1", 0));
        g.connect(new TerminalRef("C1", 1), new TerminalRef("GND1", 0));
        g.connect(new TerminalRef("V1", 1), new TerminalRef("GND1", 0));
        return g;
    }

    @Test
    void snapRoundsToNearestGridPoint() {
        assertThat(LayoutRunner.snap(0)).isZero();
        assertThat(LayoutRunner.snap(29)).isEqualTo(20);
        assertThat(LayoutRunner.snap(31)).isEqualTo(40);
        assertThat(LayoutRunner.snap(-49)).isEqualTo(-40);
    }

    @Test
    void gridFallbackFillsRowsOfFive() {
        List<ComponentInstance> comps = new ArrayList<>();
        for (int i = 1; i <= 7; i++) comps.add(new ComponentInstance("R" + i, ComponentType.RESISTOR, "1k"));
        LayoutRunner.placeOnGrid(comps);

        assertThat(comps.get(0).position()).isEqualTo(
                new ComponentInstance.Position(LayoutRunner.snap(LayoutRunner.START_X), LayoutRunner.snap(LayoutRunner.START_Y)));
        assertThat(comps.get(4).position().y()).isEqualTo(comps.get(0).position().y());
        assertThat(comps.get(5).position().x()).isEqualTo(comps.get(0).position().x());
        assertThat(comps.get(5).position().y()).isGreaterThan(comps.get(0).position().y());
    }

    @Test
    void placeMovesFreeComponentsOntoTheGrid() {
        CircuitGraph g = ladder();
        ComponentInstance pinned = g.getComponent("C1").orElseThrow();
        pinned.setPosition(333, 777);
        pinned.setLocked(true);

        LayoutRunner.place(g);

        assertThat(pinned.position()).isEqualTo(new ComponentInstance.Position(333, 777));
        for (ComponentInstance c : g.getComponents()) {
            if (c.locked()) continue;
            assertThat(Math.abs(c.position().x() % LayoutRunner.GRID)).as(c.id()).isEqualTo(0.0);
            assertThat(Math.abs(c.position().y() % LayoutRunner.GRID)).as(c.id()).isEqualTo(0.0);
        }
        long distinct = g.getComponents().stream().filter(c -> !c.locked())
                .map(ComponentInstance::position).distinct().count();
        assertThat(distinct).isEqualTo(4);
    }

    @Test
    void layoutGraphHasOneNodePerComponentAndEdgesPerSharedNet() {
        CircuitGraph g = ladder();
        LayoutBuilder.Result r = LayoutBuilder.build(g, g.getComponents());

        assertThat(r.componentNode).containsOnlyKeys("V1", "R1", "R2", "C1", "GND1");
        assertThat(r.root.getChildren()).hasSize(5);
        assertThat(r.root.getContainedEdges()).hasSize(5);
        assertThat(r.componentNode.get("GND1").getWidth()).isEqualTo(LayoutBuilder.GROUND_SIZE);
    }

    @Test
    void emptySelectionIsANoOp() {
        CircuitGraph g = new CircuitGraph();
        ComponentInstance r = new ComponentInstance("R1", ComponentType.RESISTOR, "1k");
        r.setLocked(true);
        g.addComponent(r);
        assertThat(LayoutRunner.place(g)).isTrue();
        assertThat(r.position()).isEqualTo(ComponentInstance.Position.ORIGIN);
    }
}
