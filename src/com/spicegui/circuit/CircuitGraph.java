package com.spicegui.circuit;

import com.spicegui.comp.CatalogEntry;
import com.spicegui.comp.ComponentCatalog;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentType;
import com.spicegui.comp.SubcircuitDefinition;
import com.spicegui.netlist.Analysis;
import com.spicegui.util.StringUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Modelo de un circuito: componentes, cables y redes derivadas.
 * <p>
 * Cualquier mutación invalida las redes; se recalculan al leerlas o al llamar a
 * {@link #rebuildNodes()}. No es seguro para varios hilos: el llamador es dueño del grafo.
 */
public final class CircuitGraph {

    private final ComponentCatalog catalog;
    private final NodeBuilder nodeBuilder;

    private final Map<String, ComponentInstance> components = new LinkedHashMap<>();
    private final List<Wire> wires = new ArrayList<>();
    private final Map<TerminalRef, String> customLabels = new LinkedHashMap<>();
    private final Map<String, SubcircuitDefinition> subcircuits = new LinkedHashMap<>();
    private final Map<String, Integer> componentCounter = new LinkedHashMap<>();
    private final Map<String, String> parameters = new LinkedHashMap<>();
    private Analysis analysis = Analysis.OPERATING_POINT;

    // null = hay que recalcular
    private NodeBuilder.Result nodeState;

    public CircuitGraph() {
        this(ComponentCatalog.standard());
    }

    public CircuitGraph(ComponentCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.nodeBuilder = new NodeBuilder(catalog);
    }

    public ComponentCatalog catalog() {
        return catalog;
    }

    /* ===== Componentes ===== */

    /**
     * Añade un componente.
     * @throws IllegalArgumentException si ya existe otro con el mismo id
     */
    public void addComponent(ComponentInstance c) {
        Objects.requireNonNull(c, "component");
        if (components.containsKey(c.id())) {
            throw new IllegalArgumentException("Ya existe un componente con id " + c.id());
        }
        components.put(c.id(), c);
        noteComponentId(c.type(), c.id());
        invalidate();
    }

    /**
     * Quita un componente junto con sus cables y las etiquetas de sus terminales.
     * @return el componente quitado, o vacío si no existía
     */
    public Optional<ComponentInstance> removeComponent(String id) {
        ComponentInstance removed = components.remove(id);
        if (removed == null) return Optional.empty();
        wires.removeIf(w -> w.touches(id));
        customLabels.keySet().removeIf(t -> t.componentId().equals(id));
        invalidate();
        return Optional.of(removed);
    }

    public Optional<ComponentInstance> getComponent(String id) {
        return Optional.ofNullable(components.get(id));
    }

    public boolean hasComponent(String id) {
        return components.containsKey(id);
    }

    /** Componentes en orden de inserción (vista inmodificable). */
    public Collection<ComponentInstance> getComponents() {
        return Collections.unmodifiableCollection(components.values());
    }

    public int terminalCount(ComponentInstance c) {
        return catalog.terminalCount(c);
    }

    /* ===== Cables ===== */

    /**
     * Añade un cable entre dos terminales existentes.
     * @return índice del cable
     * @throws IllegalArgumentException si un extremo no existe
     */
    public int addWire(Wire w) {
        Objects.requireNonNull(w, "wire");
        checkTerminal(w.startComponentId(), w.startTerminal());
        checkTerminal(w.endComponentId(), w.endTerminal());
        wires.add(w);
        invalidate();
        return wires.size() - 1;
    }

    public int connect(TerminalRef a, TerminalRef b) {
        return addWire(Wire.between(a, b));
    }

    public Wire removeWire(int index) {
        Wire w = wires.remove(index);
        invalidate();
        return w;
    }

    public boolean removeWire(Wire w) {
        boolean removed = wires.remove(w);
        if (removed) invalidate();
        return removed;
    }

    public List<Wire> getWires() {
        return Collections.unmodifiableList(wires);
    }

    private void checkTerminal(String componentId, int terminal) {
        ComponentInstance c = components.get(componentId);
        if (c == null) {
            throw new IllegalArgumentException("El cable referencia un componente inexistente: " + componentId);
        }
        int n = catalog.terminalCount(c);
        if (terminal < 0 || terminal >= n) {
            throw new IllegalArgumentException("Terminal " + terminal + " fuera de rango para "
                    + componentId + " (" + n + " terminales)");
        }
    }

    /* ===== Redes ===== */

    /** Recalcula la partición en redes. */
    public void rebuildNodes() {
        nodeState = nodeBuilder.build(components.values(), wires, customLabels);
    }

    private NodeBuilder.Result nodes() {
        if (nodeState == null) rebuildNodes();
        return nodeState;
    }

    private void invalidate() {
        nodeState = null;
    }

    public List<Node> getNodes() {
        return nodes().nodes();
    }

    public Map<TerminalRef, Integer> getTerminalToNode() {
        return nodes().terminalToNode();
    }

    /** Índice en {@link #getNodes()} de la red del terminal; vacío si el terminal no existe. */
    public OptionalInt nodeIndexOf(TerminalRef t) {
        Integer i = nodes().terminalToNode().get(t);
        return i == null ? OptionalInt.empty() : OptionalInt.of(i);
    }

    public Optional<Node> nodeOf(TerminalRef t) {
        OptionalInt i = nodeIndexOf(t);
        return i.isEmpty() ? Optional.empty() : Optional.of(nodes().nodes().get(i.getAsInt()));
    }

    public Optional<Node> nodeOf(String componentId, int terminal) {
        return nodeOf(new TerminalRef(componentId, terminal));
    }

    /**
     * Fija la etiqueta de la red a la que pertenece el terminal. Se guarda por terminal, así
     * que sobrevive a las reconstrucciones mientras el terminal siga en esa red.
     */
    public void setNodeLabel(TerminalRef t, String label) {
        checkTerminal(t.componentId(), t.terminal());
        // una sola etiqueta por red: se quitan las de los demás terminales de la red
        Optional<Node> node = nodeOf(t);
        node.ifPresent(n -> n.terminals().forEach(customLabels::remove));
        if (label == null || label.isBlank()) {
            customLabels.remove(t);
        } else {
            customLabels.put(t, label.trim());
        }
        invalidate();
    }

    public Map<TerminalRef, String> getCustomLabels() {
        return Collections.unmodifiableMap(customLabels);
    }

    /* ===== Subcircuitos, parámetros, análisis ===== */

    public void putSubcircuitDefinition(SubcircuitDefinition def) {
        subcircuits.put(def.name(), def);
    }

    public Map<String, SubcircuitDefinition> getSubcircuitDefinitions() {
        return Collections.unmodifiableMap(subcircuits);
    }

    public Optional<SubcircuitDefinition> findSubcircuitDefinition(String name) {
        if (name == null) return Optional.empty();
        SubcircuitDefinition exact = subcircuits.get(name);
        if (exact != null) return Optional.of(exact);
        String key = name.toUpperCase(Locale.ROOT);
        return subcircuits.values().stream().filter(d -> d.key().equals(key)).findFirst();
    }

    public void defineParameter(String name, String rawValue) {
        parameters.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(rawValue, "rawValue").trim());
    }

    public void removeParameter(String name) {
        parameters.remove(name);
    }

    /** Definiciones {@code .param} crudas en orden de definición. */
    public Map<String, String> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis == null ? Analysis.OPERATING_POINT : analysis;
    }

    /* ===== Identificadores ===== */

    /** Mayor número usado por prefijo de id ("R" → 12). */
    public Map<String, Integer> getComponentCounter() {
        return Collections.unmodifiableMap(componentCounter);
    }

    public void setComponentCounter(String prefix, int value) {
        componentCounter.merge(prefix, value, Math::max);
    }

    /** Registra el número final de un id para que {@link #nextComponentId} no lo repita. */
    public void noteComponentId(ComponentType type, String id) {
        OptionalInt n = StringUtil.trailingNumber(id);
        if (n.isEmpty()) return;
        setComponentCounter(catalog.entry(type).idPrefix(), n.getAsInt());
    }

    /** Siguiente id libre para el tipo: "R13", "GND2"... */
    public String nextComponentId(ComponentType type) {
        CatalogEntry e = catalog.entry(type);
        int n = componentCounter.getOrDefault(e.idPrefix(), 0);
        String id;
        do {
            n++;
            id = e.idPrefix() + n;
        } while (components.containsKey(id));
        componentCounter.put(e.idPrefix(), n);
        return id;
    }

    /** Vacía el circuito. */
    public void clear() {
        components.clear();
        wires.clear();
        customLabels.clear();
        subcircuits.clear();
        componentCounter.clear();
        parameters.clear();
        analysis = Analysis.OPERATING_POINT;
        invalidate();
    }

    /** Cables que tocan un componente, en orden. */
    public List<Wire> wiresOf(String componentId) {
        List<Wire> out = new ArrayList<>();
        for (Wire w : wires) {
            if (w.touches(componentId)) out.add(w);
        }
        return out;
    }
}
