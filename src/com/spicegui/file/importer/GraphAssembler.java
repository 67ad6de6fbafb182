package com.spicegui.file.importer;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.circuit.TerminalRef;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentInstance.Position;
import com.spicegui.comp.ComponentType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Convierte redes con nombre (o con un punto representativo) en cables y tierras.
 * Lo comparten los dos importadores.
 *
 * @param <K> clave de red: nombre de nodo o punto de la rejilla
 */
final class GraphAssembler<K> {

    private final CircuitGraph graph;
    private final Map<K, List<TerminalRef>> nets = new LinkedHashMap<>();
    private final Set<K> groundNets = new HashSet<>();
    private final Map<K, String> labels = new HashMap<>();

    GraphAssembler(CircuitGraph graph) {
        this.graph = graph;
    }

    void attach(K net, TerminalRef t) {
        nets.computeIfAbsent(net, k -> new ArrayList<>()).add(t);
    }

    void markGround(K net) {
        groundNets.add(net);
    }

    void label(K net, String label) {
        labels.putIfAbsent(net, label);
    }

    /**
     * Une en cadena los terminales de cada red que no es tierra y aplica las etiquetas.
     * @return cables añadidos
     */
    int wireNets() {
        int added = 0;
        for (Map.Entry<K, List<TerminalRef>> e : nets.entrySet()) {
            if (groundNets.contains(e.getKey())) continue;
            List<TerminalRef> ts = e.getValue();
            for (int i = 0; i + 1 < ts.size(); i++) {
                graph.connect(ts.get(i), ts.get(i + 1));
                added++;
            }
            String label = labels.get(e.getKey());
            if (label != null && !ts.isEmpty()) graph.setNodeLabel(ts.get(0), label);
        }
        return added;
    }

    /**
     * Una tierra propia, con su cable, por cada terminal en una red de tierra.
     * @param placement posición de la tierra a partir del terminal al que se conecta
     * @return tierras creadas
     */
    List<ComponentInstance> addGrounds(Function<TerminalRef, Position> placement) {
        List<ComponentInstance> grounds = new ArrayList<>();
        for (Map.Entry<K, List<TerminalRef>> e : nets.entrySet()) {
            if (!groundNets.contains(e.getKey())) continue;
            for (TerminalRef t : e.getValue()) {
                String id = graph.nextComponentId(ComponentType.GROUND);
                ComponentInstance gnd = ComponentInstance.withDefaults(id, ComponentType.GROUND, graph.catalog());
                gnd.setPosition(placement.apply(t));
                graph.addComponent(gnd);
                graph.connect(t, new TerminalRef(id, 0));
                grounds.add(gnd);
            }
        }
        return grounds;
    }
}
