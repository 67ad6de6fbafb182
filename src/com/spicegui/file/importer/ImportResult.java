package com.spicegui.file.importer;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.netlist.Analysis;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resultado de una importación.
 *
 * @param graph    circuito reconstruido
 * @param analysis última directiva de análisis encontrada, si hubo alguna
 * @param warnings avisos no fatales, en orden de aparición
 */
public record ImportResult(CircuitGraph graph, Optional<Analysis> analysis, List<String> warnings) {

    public ImportResult {
        Objects.requireNonNull(graph, "graph");
        analysis = analysis == null ? Optional.empty() : analysis;
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
