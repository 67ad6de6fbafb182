package com.spicegui.file.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spicegui.circuit.CircuitGraph;
import com.spicegui.circuit.TerminalRef;
import com.spicegui.circuit.Wire;
import com.spicegui.comp.ComponentCatalog;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentInstance.Position;
import com.spicegui.comp.ComponentType;
import com.spicegui.comp.SubcircuitDefinition;
import com.spicegui.file.CircuitFileException;
import com.spicegui.file.Strings;
import com.spicegui.netlist.Analysis;
import com.spicegui.netlist.AnalysisType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lee y escribe el archivo de circuito JSON.
 * <p>
 * Claves de primer nivel: {@code components}, {@code wires}, {@code counters},
 * {@code net_names} ("R1:0" → etiqueta), {@code subcircuit_definitions} (nombre → texto),
 * {@code parameters} y, si el análisis no es el punto de operación por defecto,
 * {@code analysis_type} / {@code analysis_params}.
 */
public final class CircuitJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(CircuitJsonCodec.class);

    private final ObjectMapper mapper;
    private final ComponentCatalog catalog;

    public CircuitJsonCodec() {
        this(ComponentCatalog.standard());
    }

    public CircuitJsonCodec(ComponentCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /* ===================== Escritura ===================== */

    public String write(CircuitGraph graph) {
        try {
            return mapper.writeValueAsString(toTree(graph));
        } catch (JsonProcessingException ex) {
            throw new CircuitFileException(Strings.get("file.error.format", ex.getOriginalMessage()), ex);
        }
    }

    public void write(CircuitGraph graph, Path file) {
        String json = write(graph);
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CircuitFileException(Strings.get("file.error.write", String.valueOf(file)), ex);
        }
        log.info("Circuito guardado en {}", file);
    }

    ObjectNode toTree(CircuitGraph graph) {
        ObjectNode root = mapper.createObjectNode();

        ArrayNode comps = root.putArray("components");
        for (ComponentInstance c : graph.getComponents()) {
            comps.add(component(c));
        }

        ArrayNode wires = root.putArray("wires");
        for (Wire w : graph.getWires()) {
            ObjectNode n = wires.addObject();
            n.put("start_comp", w.startComponentId());
            n.put("start_term", w.startTerminal());
            n.put("end_comp", w.endComponentId());
            n.put("end_term", w.endTerminal());
            if (!w.waypoints().isEmpty()) {
                ArrayNode pts = n.putArray("waypoints");
                for (Position p : w.waypoints()) {
                    pts.addObject().put("x", p.x()).put("y", p.y());
                }
            }
        }

        ObjectNode counters = root.putObject("counters");
        graph.getComponentCounter().forEach(counters::put);

        Analysis a = graph.getAnalysis();
        if (a.type() != AnalysisType.OPERATING_POINT || !a.params().isEmpty()) {
            root.put("analysis_type", a.type().displayName());
            ObjectNode ap = root.putObject("analysis_params");
            a.params().forEach(ap::put);
        }

        if (!graph.getCustomLabels().isEmpty()) {
            ObjectNode names = root.putObject("net_names");
            graph.getCustomLabels().forEach((t, label) -> names.put(t.key(), label));
        }

        if (!graph.getSubcircuitDefinitions().isEmpty()) {
            ObjectNode defs = root.putObject("subcircuit_definitions");
            graph.getSubcircuitDefinitions().forEach((name, def) -> defs.put(name, def.definition()));
        }

        if (!graph.getParameters().isEmpty()) {
            ObjectNode params = root.putObject("parameters");
            graph.getParameters().forEach(params::put);
        }
        return root;
    }

    private ObjectNode component(ComponentInstance c) {
        ObjectNode n = mapper.createObjectNode();
        n.put("type", c.type().className());
        n.put("id", c.id());
        n.put("value", c.value());
        n.putObject("pos").put("x", c.position().x()).put("y", c.position().y());
        n.put("rotation", c.rotation());
        n.put("flip_h", c.flipH());
        n.put("flip_v", c.flipV());
        if (c.locked()) n.put("locked", true);
        if (c.initialCondition() != null) n.put("initial_condition", c.initialCondition());

        if (c.type() == ComponentType.WAVEFORM_SOURCE) {
            n.put("waveform_type", c.waveformType());
            if (c.waveformParams() != null) {
                ObjectNode wp = n.putObject("waveform_params");
                c.waveformParams().forEach((fn, params) -> {
                    ObjectNode inner = wp.putObject(fn);
                    params.forEach(inner::put);
                });
            }
        }
        if (c.type() == ComponentType.SUBCIRCUIT) {
            n.put("subcircuit_name", c.subcircuitName());
            ArrayNode pins = n.putArray("subcircuit_pins");
            c.subcircuitPins().forEach(pins::add);
            if (c.subcircuitDefinition() != null) n.put("subcircuit_definition", c.subcircuitDefinition());
        }
        return n;
    }

    /* ===================== Lectura ===================== */

    public CircuitGraph read(Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CircuitFileException(Strings.get("file.error.read", String.valueOf(file)), ex);
        }
        return read(json);
    }

    /**
     * @throws CircuitFileException si el JSON está mal formado o referencia componentes,
     *         terminales o tipos que no existen
     */
    public CircuitGraph read(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json == null ? "" : json);
        } catch (JsonProcessingException ex) {
            throw new CircuitFileException(Strings.get("file.error.format", ex.getOriginalMessage()), ex);
        }
        if (root == null || !root.isObject()) {
            throw new CircuitFileException(Strings.get("file.error.format", "root is not an object"));
        }
        try {
            return fromTree(root);
        } catch (IllegalArgumentException ex) {
            throw new CircuitFileException(Strings.get("file.error.format", ex.getMessage()), ex);
        }
    }

    private CircuitGraph fromTree(JsonNode root) {
        CircuitGraph graph = new CircuitGraph(catalog);

        // 1) subcircuitos, antes que los componentes que los usan
        JsonNode defs = root.path("subcircuit_definitions");
        if (defs.isObject()) {
            defs.fields().forEachRemaining(e -> graph.putSubcircuitDefinition(
                    SubcircuitDefinition.parse(e.getValue().asText())));
        }

        // 2) componentes
        for (JsonNode n : root.path("components")) {
            ComponentInstance c = component(n);
            graph.addComponent(c);
        }

        // 3) cables
        for (JsonNode n : root.path("wires")) {
            List<Position> waypoints = new ArrayList<>();
            for (JsonNode p : n.path("waypoints")) {
                waypoints.add(new Position(p.path("x").asDouble(), p.path("y").asDouble()));
            }
            graph.addWire(new Wire(required(n, "start_comp").asText(), required(n, "start_term").asInt(),
                    required(n, "end_comp").asText(), required(n, "end_term").asInt(), waypoints));
        }

        // 4) contadores, etiquetas, parámetros, análisis
        JsonNode counters = root.path("counters");
        if (counters.isObject()) {
            counters.fields().forEachRemaining(e -> graph.setComponentCounter(e.getKey(), e.getValue().asInt()));
        }
        JsonNode names = root.path("net_names");
        if (names.isObject()) {
            names.fields().forEachRemaining(e ->
                    graph.setNodeLabel(TerminalRef.parseKey(e.getKey()), e.getValue().asText()));
        }
        JsonNode params = root.path("parameters");
        if (params.isObject()) {
            params.fields().forEachRemaining(e -> graph.defineParameter(e.getKey(), e.getValue().asText()));
        }
        if (root.hasNonNull("analysis_type")) {
            String name = root.get("analysis_type").asText();
            AnalysisType type = AnalysisType.fromName(name)
                    .orElseThrow(() -> new IllegalArgumentException("unknown analysis type " + name));
            graph.setAnalysis(new Analysis(type, strings(root.path("analysis_params"))));
        }

        graph.rebuildNodes();
        log.debug("Circuito leído: {} componentes, {} cables",
                graph.getComponents().size(), graph.getWires().size());
        return graph;
    }

    private ComponentInstance component(JsonNode n) {
        String typeName = required(n, "type").asText();
        ComponentType type = ComponentType.fromName(typeName)
                .orElseThrow(() -> new IllegalArgumentException("unknown component type " + typeName));
        String value = n.hasNonNull("value") ? n.get("value").asText() : catalog.entry(type).defaultValue();

        ComponentInstance c = new ComponentInstance(required(n, "id").asText(), type, value);
        JsonNode pos = n.path("pos");
        c.setPosition(pos.path("x").asDouble(0), pos.path("y").asDouble(0));
        c.setRotation(n.path("rotation").asInt(0));
        c.setFlipH(n.path("flip_h").asBoolean(false));
        c.setFlipV(n.path("flip_v").asBoolean(false));
        c.setLocked(n.path("locked").asBoolean(false));
        if (n.hasNonNull("initial_condition")) c.setInitialCondition(n.get("initial_condition").asText());

        if (type == ComponentType.WAVEFORM_SOURCE) {
            if (n.hasNonNull("waveform_type")) c.setWaveformType(n.get("waveform_type").asText());
            JsonNode wp = n.path("waveform_params");
            if (wp.isObject()) {
                Map<String, Map<String, String>> all = new LinkedHashMap<>();
                wp.fields().forEachRemaining(e -> all.put(e.getKey(), strings(e.getValue())));
                c.setWaveformParams(all);
            }
        }
        if (type == ComponentType.SUBCIRCUIT) {
            if (n.hasNonNull("subcircuit_name")) c.setSubcircuitName(n.get("subcircuit_name").asText());
            List<String> pins = new ArrayList<>();
            n.path("subcircuit_pins").forEach(p -> pins.add(p.asText()));
            c.setSubcircuitPins(pins);
            if (n.hasNonNull("subcircuit_definition")) c.setSubcircuitDefinition(n.get("subcircuit_definition").asText());
        }
        return c;
    }

    private static JsonNode required(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) throw new IllegalArgumentException("missing field '" + field + "'");
        return v;
    }

    private static Map<String, String> strings(JsonNode obj) {
        Map<String, String> out = new LinkedHashMap<>();
        if (obj.isObject()) obj.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().asText()));
        return out;
    }
}
