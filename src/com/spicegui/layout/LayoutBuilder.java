package com.spicegui.layout;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.circuit.Node;
import com.spicegui.circuit.TerminalRef;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentType;
import org.eclipse.elk.alg.layered.options.LayeredOptions;
import org.eclipse.elk.core.options.CoreOptions;
import org.eclipse.elk.core.options.Direction;
import org.eclipse.elk.core.options.EdgeRouting;
import org.eclipse.elk.graph.ElkLabel;
import org.eclipse.elk.graph.ElkNode;
import org.eclipse.elk.graph.util.ElkGraphUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Construye el grafo ELK de un circuito: un nodo por componente y una arista por par
 * de componentes que comparten un nodo eléctrico.
 */
public final class LayoutBuilder {

    static final double NODE_SIZE = 80.0;
    static final double GROUND_SIZE = 40.0;

    public static final class Result {
        public final ElkNode root;
        public final Map<String, ElkNode> componentNode = new LinkedHashMap<>();
        Result(ElkNode root) { this.root = root; }
    }

    /** Par no dirigido de componentes, para no duplicar aristas. */
    private record Pair(String a, String b) {
        static Pair of(String x, String y) {
            return x.compareTo(y) <= 0 ? new Pair(x, y) : new Pair(y, x);
        }
    }

    private LayoutBuilder() { }

    /**
     * @param graph      circuito con los nodos ya calculados
     * @param components componentes a colocar; el resto no aparece en el grafo ELK
     */
    public static Result build(CircuitGraph graph, Collection<ComponentInstance> components) {
        Objects.requireNonNull(graph, "graph");
        // --- Grafo raíz y opciones ELK ---
        ElkNode root = ElkGraphUtil.createGraph();
        root.setProperty(CoreOptions.ALGORITHM, "org.eclipse.elk.layered");
        root.setProperty(LayeredOptions.SPACING_NODE_NODE, 70.0);
        root.setProperty(CoreOptions.SPACING_COMPONENT_COMPONENT, 80.0);
        root.setProperty(LayeredOptions.EDGE_ROUTING, EdgeRouting.ORTHOGONAL);
        root.setProperty(CoreOptions.DIRECTION, Direction.RIGHT);

        Result r = new Result(root);

        // --- 1) Componentes como nodos ---
        for (ComponentInstance c : components) {
            ElkNode n = ElkGraphUtil.createNode(root);
            double size = c.type() == ComponentType.GROUND ? GROUND_SIZE : NODE_SIZE;
            n.setWidth(size);
            n.setHeight(size);
            ElkLabel lbl = ElkGraphUtil.createLabel(n);
            lbl.setText(c.id());
            r.componentNode.put(c.id(), n);
        }

        // --- 2) Aristas: estrella desde el primer componente de cada nodo ---
        Set<Pair> seen = new HashSet<>();
        for (Node node : graph.getNodes()) {
            List<String> owners = new ArrayList<>(new LinkedHashSet<>(ownersOf(node, r)));
            for (int i = 1; i < owners.size(); i++) {
                Pair p = Pair.of(owners.get(0), owners.get(i));
                if (!seen.add(p)) continue;
                ElkGraphUtil.createSimpleEdge(r.componentNode.get(owners.get(0)), r.componentNode.get(owners.get(i)));
            }
        }
        return r;
    }

    private static List<String> ownersOf(Node node, Result r) {
        List<String> out = new ArrayList<>();
        for (TerminalRef t : node.terminals()) {
            if (r.componentNode.containsKey(t.componentId())) out.add(t.componentId());
        }
        return out;
    }
}
