package com.spicegui.circuit;

import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentType;
import com.spicegui.file.Strings;
import com.spicegui.netlist.AnalysisType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Comprobaciones estructurales antes de simular. No evalúa nada eléctrico: sólo mira
 * si hay componentes, tierra, terminales sueltos y fuentes.
 */
public final class CircuitValidator {

    private CircuitValidator() { }

    public static ValidationResult validate(CircuitGraph graph, AnalysisType analysis) {
        Objects.requireNonNull(graph, "graph");
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        // 1) algo que simular además de la tierra
        boolean anyNonGround = graph.getComponents().stream()
                .anyMatch(c -> c.type() != ComponentType.GROUND);
        if (!anyNonGround) {
            errors.add(Strings.get("validate.error.noComponents"));
            return new ValidationResult(errors, warnings);
        }

        // 2) tierra
        boolean hasGround = graph.getComponents().stream()
                .anyMatch(c -> c.type() == ComponentType.GROUND);
        if (!hasGround) errors.add(Strings.get("validate.error.noGround"));

        // 3) terminales sin cable
        Set<TerminalRef> wired = new HashSet<>();
        for (Wire w : graph.getWires()) {
            wired.add(w.start());
            wired.add(w.end());
        }
        for (ComponentInstance c : graph.getComponents()) {
            if (c.type() == ComponentType.GROUND) continue;
            int n = graph.terminalCount(c);
            List<Integer> loose = new ArrayList<>();
            for (int t = 0; t < n; t++) {
                if (!wired.contains(new TerminalRef(c.id(), t))) loose.add(t);
            }
            if (loose.size() == n) {
                errors.add(Strings.get("validate.error.isolated", c.id(), c.type().displayName()));
            } else if (!loose.isEmpty()) {
                warnings.add(Strings.get("validate.warn.unconnected",
                        c.id(), c.type().displayName(), loose.toString()));
            }
        }

        // 4) fuentes
        if (analysis == AnalysisType.DC_SWEEP && !has(graph, ComponentType.VOLTAGE_SOURCE)) {
            errors.add(Strings.get("validate.error.noSweepSource"));
        }
        if (!has(graph, ComponentType.VOLTAGE_SOURCE) && !has(graph, ComponentType.WAVEFORM_SOURCE)
                && !has(graph, ComponentType.CURRENT_SOURCE)) {
            warnings.add(Strings.get("validate.warn.noSources"));
        }
        return new ValidationResult(errors, warnings);
    }

    private static boolean has(CircuitGraph graph, ComponentType type) {
        return graph.getComponents().stream().anyMatch(c -> c.type() == type);
    }
}
