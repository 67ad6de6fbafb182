package com.spicegui.layout;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.comp.ComponentInstance;
import org.eclipse.elk.core.RecursiveGraphLayoutEngine;
import org.eclipse.elk.core.util.BasicProgressMonitor;
import org.eclipse.elk.graph.ElkNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Coloca automáticamente los componentes de un circuito sin geometría (p.ej. importado
 * de una netlist). Usa el algoritmo "layered" de ELK; si ELK falla se reparte en una
 * rejilla de {@value #GRID_COLS} columnas. Las posiciones quedan ajustadas a {@value #GRID}.
 */
public final class LayoutRunner {

    private static final Logger log = LoggerFactory.getLogger(LayoutRunner.class);

    public static final int GRID = 20;
    public static final int GRID_SPACING = 150;
    static final int GRID_COLS = 5;
    static final int START_X = -300;
    static final int START_Y = -200;

    private LayoutRunner() { }

    /**
     * Coloca todos los componentes no bloqueados.
     * @return {@code true} si se usó ELK, {@code false} si se cayó a la rejilla
     */
    public static boolean place(CircuitGraph graph) {
        List<ComponentInstance> free = new ArrayList<>();
        for (ComponentInstance c : graph.getComponents()) {
            if (!c.locked()) free.add(c);
        }
        if (free.isEmpty()) return true;

        LayoutBuilder.Result elk = LayoutBuilder.build(graph, free);
        try {
            run(elk.root);
        } catch (RuntimeException ex) {
            log.warn("Layout ELK falló ({}); se usa la rejilla", ex.toString());
            placeOnGrid(free);
            return false;
        }
        for (ComponentInstance c : free) {
            ElkNode n = elk.componentNode.get(c.id());
            c.setPosition(snap(START_X + n.getX()), snap(START_Y + n.getY()));
        }
        log.debug("Layout ELK: {} componentes", free.size());
        return true;
    }

    static void run(ElkNode root) {
        new RecursiveGraphLayoutEngine().layout(root, new BasicProgressMonitor());
    }

    /** Rejilla fila a fila en el orden recibido. */
    public static void placeOnGrid(List<ComponentInstance> components) {
        for (int i = 0; i < components.size(); i++) {
            int row = i / GRID_COLS;
            int col = i % GRID_COLS;
            components.get(i).setPosition(snap(START_X + col * GRID_SPACING), snap(START_Y + row * GRID_SPACING));
        }
    }

    /** Redondea al punto de rejilla más cercano. */
    public static int snap(double v) {
        return (int) Math.round(v / GRID) * GRID;
    }
}
