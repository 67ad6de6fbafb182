package com.spicegui.circuit;

import com.spicegui.comp.ComponentInstance.Position;

import java.util.List;
import java.util.Objects;

/**
 * Conexión entre dos terminales. Los puntos intermedios sólo son geometría.
 */
public record Wire(String startComponentId, int startTerminal,
                   String endComponentId, int endTerminal,
                   List<Position> waypoints) {

    public Wire {
        Objects.requireNonNull(startComponentId, "startComponentId");
        Objects.requireNonNull(endComponentId, "endComponentId");
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
    }

    public Wire(String startComponentId, int startTerminal, String endComponentId, int endTerminal) {
        this(startComponentId, startTerminal, endComponentId, endTerminal, List.of());
    }

    public static Wire between(TerminalRef a, TerminalRef b) {
        return new Wire(a.componentId(), a.terminal(), b.componentId(), b.terminal());
    }

    public TerminalRef start() { return new TerminalRef(startComponentId, startTerminal); }

    public TerminalRef end() { return new TerminalRef(endComponentId, endTerminal); }

    public boolean touches(String componentId) {
        return startComponentId.equals(componentId) || endComponentId.equals(componentId);
    }
}
