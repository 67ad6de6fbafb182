package com.spicegui.circuit;

import java.util.List;
import java.util.Set;

/**
 * Red eléctrica: conjunto maximal de terminales unidos por cables. Es estado derivado;
 * lo produce {@link NodeBuilder} y se descarta en cada reconstrucción.
 *
 * @param terminals   terminales ordenados (componente, índice)
 * @param wireIndices índices en {@link CircuitGraph#getWires()} de los cables de esta red
 * @param ground      la red contiene un terminal de Ground
 * @param autoLabel   "0" para tierra, si no nodeA, nodeB, ...
 * @param customLabel etiqueta del usuario, o {@code null}
 */
public record Node(List<TerminalRef> terminals,
                   Set<Integer> wireIndices,
                   boolean ground,
                   String autoLabel,
                   String customLabel) {

    public Node {
        terminals = List.copyOf(terminals);
        wireIndices = Set.copyOf(wireIndices);
    }

    /** Etiqueta visible: la del usuario si existe. */
    public String label() {
        return customLabel != null ? customLabel : autoLabel;
    }

    /**
     * Nombre del nodo en la netlist. La tierra es siempre "0"; las etiquetas de usuario
     * se limpian de espacios.
     */
    public String spiceName() {
        if (ground) return "0";
        if (customLabel == null) return autoLabel;
        return customLabel.trim().replaceAll("\\s+", "_");
    }
}
