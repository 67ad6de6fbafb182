package com.spicegui.circuit;

import com.spicegui.comp.ComponentCatalog;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Calcula la partición de terminales en redes a partir de los cables.
 * <p>
 * La salida es determinista: los nodos se ordenan por su terminal más bajo (id de
 * componente, luego índice) y en ese orden reciben nodeA, nodeB, ... Reconstruir sin
 * cambios en el grafo devuelve exactamente la misma partición y las mismas etiquetas.
 */
public final class NodeBuilder {

    /** Resultado de una construcción. */
    public record Result(List<Node> nodes, Map<TerminalRef, Integer> terminalToNode) {
        public Result {
            nodes = List.copyOf(nodes);
            terminalToNode = Map.copyOf(terminalToNode);
        }
    }

    private final ComponentCatalog catalog;

    public NodeBuilder(ComponentCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * @param components   componentes del circuito
     * @param wires        cables; el índice en la lista es el que se guarda en cada nodo
     * @param customLabels etiquetas de usuario por terminal
     */
    public Result build(Collection<ComponentInstance> components,
                        List<Wire> wires,
                        Map<TerminalRef, String> customLabels) {
        // 1) Un elemento por terminal, en orden estable
        List<ComponentInstance> sorted = new ArrayList<>(components);
        sorted.sort(Comparator.comparing(ComponentInstance::id));

        DisjointSet<TerminalRef> sets = new DisjointSet<>();
        Set<String> groundIds = new HashSet<>();
        for (ComponentInstance c : sorted) {
            int n = catalog.terminalCount(c);
            for (int t = 0; t < n; t++) sets.add(new TerminalRef(c.id(), t));
            if (c.type() == ComponentType.GROUND) groundIds.add(c.id());
        }

        // 2) Cada cable une sus dos extremos
        for (Wire w : wires) {
            sets.union(w.start(), w.end());
        }

        // 3) Agrupar y ordenar
        List<List<TerminalRef>> groups = new ArrayList<>();
        for (List<TerminalRef> g : sets.groups()) {
            List<TerminalRef> copy = new ArrayList<>(g);
            copy.sort(null);
            groups.add(copy);
        }
        groups.sort(Comparator.comparing(g -> g.get(0)));

        Map<TerminalRef, Integer> terminalToNode = new HashMap<>();
        for (int i = 0; i < groups.size(); i++) {
            for (TerminalRef t : groups.get(i)) terminalToNode.put(t, i);
        }

        List<Set<Integer>> wiresByNode = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) wiresByNode.add(new HashSet<>());
        for (int w = 0; w < wires.size(); w++) {
            Integer node = terminalToNode.get(wires.get(w).start());
            if (node != null) wiresByNode.get(node).add(w);
        }

        // 4) Etiquetas
        List<Node> nodes = new ArrayList<>(groups.size());
        int next = 0;
        for (int i = 0; i < groups.size(); i++) {
            List<TerminalRef> g = groups.get(i);
            boolean ground = g.stream().anyMatch(t -> groundIds.contains(t.componentId()));
            String auto = ground ? "0" : autoLabel(next++);
            String custom = null;
            for (TerminalRef t : g) {
                String l = customLabels.get(t);
                if (l != null && !l.isBlank()) {
                    custom = l.trim();
                    break;
                }
            }
            nodes.add(new Node(g, wiresByNode.get(i), ground, auto, custom));
        }
        return new Result(nodes, terminalToNode);
    }

    /** 0 → nodeA, 25 → nodeZ, 26 → nodeAA, 27 → nodeAB ... */
    public static String autoLabel(int index) {
        if (index < 0) throw new IllegalArgumentException("índice negativo: " + index);
        StringBuilder sb = new StringBuilder();
        int n = index;
        do {
            sb.append((char) ('A' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return "node" + sb.reverse();
    }
}
