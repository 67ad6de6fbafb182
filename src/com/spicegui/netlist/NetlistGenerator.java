package com.spicegui.netlist;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.circuit.Node;
import com.spicegui.circuit.TerminalRef;
import com.spicegui.comp.ComponentCatalog;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentType;
import com.spicegui.comp.DeviceModels;
import com.spicegui.comp.DeviceModels.ModelCard;
import com.spicegui.comp.OpAmpModels;
import com.spicegui.comp.PinOrder;
import com.spicegui.comp.SubcircuitDefinition;
import com.spicegui.comp.WaveformSpec;
import com.spicegui.param.ParamProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Genera el texto SPICE de un {@link CircuitGraph}.
 * <p>
 * Es una función pura del grafo y las opciones: los componentes se emiten ordenados por
 * id, los subcircuitos y las tarjetas {@code .model} una sola vez por nombre, y el
 * resultado termina siempre en {@code .end}.
 */
public final class NetlistGenerator {

    private static final Logger log = LoggerFactory.getLogger(NetlistGenerator.class);

    private final ComponentCatalog catalog;

    public NetlistGenerator() {
        this(ComponentCatalog.standard());
    }

    public NetlistGenerator(ComponentCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /** Genera con el análisis guardado en el grafo y las opciones por defecto. */
    public String generate(CircuitGraph graph) {
        return generate(graph, graph.getAnalysis(), NetlistOptions.defaults());
    }

    /**
     * @param graph          circuito
     * @param analysisType   nombre del análisis ("Transient", "AC Sweep"...)
     * @param analysisParams parámetros del análisis
     * @throws IllegalArgumentException si el análisis no se reconoce
     */
    public String generate(CircuitGraph graph, String analysisType, Map<String, String> analysisParams) {
        AnalysisType type = AnalysisType.fromName(analysisType)
                .orElseThrow(() -> new IllegalArgumentException("Análisis desconocido: " + analysisType));
        return generate(graph, new Analysis(type, analysisParams), NetlistOptions.defaults());
    }

    /**
     * @throws com.spicegui.param.ParamResolutionException si los {@code .param} del circuito no se resuelven
     */
    public String generate(CircuitGraph graph, Analysis analysis, NetlistOptions options) {
        Objects.requireNonNull(graph, "graph");
        Analysis a = analysis == null ? Analysis.OPERATING_POINT : analysis;
        NetlistOptions opts = options == null ? NetlistOptions.defaults() : options;

        Emission em = new Emission(graph);
        List<String> lines = new ArrayList<>();
        lines.add(opts.title());
        lines.add("* Generated netlist");
        lines.add("");

        // 1) .param primero
        if (!graph.getParameters().isEmpty()) {
            ParamProcessor params = new ParamProcessor(graph.getParameters());
            params.resolveAll();
            lines.addAll(params.emitDirectives());
            lines.add("");
        }

        // 2) tarjetas de componentes (llenan subcircuitos y modelos)
        List<ComponentInstance> sorted = new ArrayList<>(graph.getComponents());
        sorted.sort(Comparator.comparing(ComponentInstance::id));
        List<String> cards = new ArrayList<>();
        for (ComponentInstance c : sorted) {
            emitComponent(c, em, cards);
        }

        for (Map.Entry<String, String> s : em.subcircuits.entrySet()) {
            lines.add(s.getValue());
            lines.add("");
        }
        lines.addAll(cards);

        if (!em.models.isEmpty()) {
            lines.add("");
            for (ModelCard m : em.models.values()) lines.add(m.line());
        }

        // 3) opciones, análisis, medidas
        if (!opts.spiceOptions().isEmpty()) {
            StringBuilder sb = new StringBuilder(".options");
            opts.spiceOptions().forEach((k, v) -> {
                sb.append(' ').append(k);
                if (v != null && !v.isBlank()) sb.append('=').append(v.trim());
            });
            lines.add("");
            lines.add(sb.toString());
        }

        lines.add("");
        lines.addAll(AnalysisDirectives.emit(a, firstVoltageSource(sorted)));

        if (!opts.measurements().isEmpty()) {
            lines.add("");
            lines.add("* Measurement Directives");
            for (String m : opts.measurements()) {
                lines.add(m.toLowerCase(Locale.ROOT).startsWith(".meas") ? m : ".meas " + m);
            }
        }

        if (opts.controlBlock() || a.type() == AnalysisType.NOISE) {
            lines.add("");
            lines.addAll(controlBlock(graph, a, opts));
        }

        lines.add("");
        lines.add(".end");
        log.debug("Netlist generada: {} componentes, {} cables", sorted.size(), graph.getWires().size());
        return String.join("\n", lines) + "\n";
    }

    /* ===================== Componentes ===================== */

    /** Estado de una generación: subcircuitos y modelos ya emitidos. */
    private static final class Emission {
        final CircuitGraph graph;
        final Map<String, String> subcircuits = new LinkedHashMap<>();
        final Map<String, ModelCard> models = new LinkedHashMap<>();

        Emission(CircuitGraph graph) {
            this.graph = graph;
        }

        void subcircuit(String name, String definition) {
            subcircuits.putIfAbsent(name.toUpperCase(Locale.ROOT), definition);
        }

        /** Registra un modelo; si el nombre ya existe con otro cuerpo se usa {@code fallback}. */
        String model(ModelCard card, String fallback) {
            ModelCard prev = models.get(card.name());
            if (prev == null) {
                models.put(card.name(), card);
                return card.name();
            }
            if (prev.body().equals(card.body())) return card.name();
            models.putIfAbsent(fallback, new ModelCard(fallback, card.body()));
            return fallback;
        }
    }

    private void emitComponent(ComponentInstance c, Emission em, List<String> out) {
        String card = catalog.cardName(c);
        String value = c.value().trim();
        switch (c.type()) {
            case GROUND -> { }
            case RESISTOR, CAPACITOR, INDUCTOR -> {
                String line = card + " " + nodes(c, em) + " " + value;
                if (c.type().acceptsInitialCondition() && c.initialCondition() != null) {
                    line += " IC=" + c.initialCondition();
                }
                out.add(line);
            }
            case VOLTAGE_SOURCE, CURRENT_SOURCE -> out.add(card + " " + nodes(c, em) + " " + sourceValue(value));
            case WAVEFORM_SOURCE -> out.add(card + " " + nodes(c, em) + " " + c.spiceValue());
            case OP_AMP -> {
                String model = OpAmpModels.normalize(value);
                em.subcircuit(OpAmpModels.subcktName(model), OpAmpModels.definition(model));
                out.add(card + " " + nodes(c, em) + " " + OpAmpModels.subcktName(model));
            }
            case VCVS, VCCS -> out.add(card + " " + nodes(c, em) + " " + value);
            case CCVS, CCCS -> {
                List<String> n = nodeList(c, em);
                String sense = "Vsense_" + c.id();
                out.add(sense + " " + n.get(2) + " " + n.get(3) + " 0");
                out.add(card + " " + n.get(0) + " " + n.get(1) + " " + sense + " " + value);
            }
            case BJT_NPN, BJT_PNP -> {
                boolean pnp = c.type() == ComponentType.BJT_PNP;
                String model = deviceModel(c, value, pnp ? DeviceModels.DEFAULT_PNP : DeviceModels.DEFAULT_NPN,
                        em, name -> DeviceModels.bjt(name, pnp), pnp ? "PNP" : "NPN");
                out.add(card + " " + nodes(c, em) + " " + model);
            }
            case MOSFET_NMOS, MOSFET_PMOS -> {
                boolean pmos = c.type() == ComponentType.MOSFET_PMOS;
                String model = deviceModel(c, value, pmos ? DeviceModels.DEFAULT_PMOS : DeviceModels.DEFAULT_NMOS,
                        em, name -> DeviceModels.mosfet(name, pmos), pmos ? "PMOS" : "NMOS");
                out.add(card + " " + nodes(c, em) + " " + model);
            }
            case VC_SWITCH -> {
                String model;
                if (value.isEmpty() || DeviceModels.isParameterList(value)) {
                    String params = value.isEmpty() ? catalog.entry(c.type()).defaultValue() : value;
                    model = em.model(DeviceModels.vSwitch(c.id(), params), DeviceModels.switchModelName(c.id()));
                } else {
                    model = value;
                }
                out.add(card + " " + nodes(c, em) + " " + model);
            }
            case DIODE, LED, ZENER_DIODE -> {
                String model;
                if (value.isEmpty() || DeviceModels.isParameterList(value)) {
                    String params = value.isEmpty() ? catalog.entry(c.type()).defaultValue() : value;
                    String base = DeviceModels.diodeModelName(c.type());
                    model = em.model(DeviceModels.diode(base, params), base + "_" + c.id());
                } else {
                    model = value;
                }
                out.add(card + " " + nodes(c, em) + " " + model);
            }
            case TRANSFORMER -> {
                List<String> n = nodeList(c, em);
                String[] parts = value.isEmpty() ? new String[0] : value.split("\\s+");
                String lp = parts.length > 0 ? parts[0] : "10mH";
                String ls = parts.length > 1 ? parts[1] : "10mH";
                String k = parts.length > 2 ? parts[2] : "0.99";
                String prim = "L_prim_" + c.id();
                String sec = "L_sec_" + c.id();
                out.add(prim + " " + n.get(0) + " " + n.get(1) + " " + lp);
                out.add(sec + " " + n.get(2) + " " + n.get(3) + " " + ls);
                out.add("K_" + c.id() + " " + prim + " " + sec + " " + k);
            }
            case SUBCIRCUIT -> {
                String name = c.subcircuitName() != null && !c.subcircuitName().isBlank()
                        ? c.subcircuitName() : value;
                String def = c.subcircuitDefinition();
                if (def == null || def.isBlank()) {
                    def = em.graph.findSubcircuitDefinition(name).map(SubcircuitDefinition::definition).orElse(null);
                }
                if (def != null) {
                    em.subcircuit(name, def);
                } else {
                    out.add("* Warning: no definition for subcircuit " + name);
                    log.warn("Subcircuito sin definición: {} ({})", name, c.id());
                }
                out.add(card + " " + nodes(c, em) + " " + name);
            }
        }
    }

    /** Nombre del modelo de un semiconductor; registra su .model. */
    private static String deviceModel(ComponentInstance c, String value, String fallbackName, Emission em,
                                      Function<String, ModelCard> cardFor, String kind) {
        if (value.isEmpty()) {
            return em.model(cardFor.apply(fallbackName), fallbackName + "_" + c.id());
        }
        if (DeviceModels.isParameterList(value)) {
            String name = kind + "_" + c.id();
            return em.model(new ModelCard(name, kind + "(" + value + ")"), name);
        }
        return em.model(cardFor.apply(value), value + "_" + c.id());
    }

    private static String sourceValue(String value) {
        String up = value.toUpperCase(Locale.ROOT);
        if (up.equals("DC") || up.equals("AC") || up.startsWith("DC ") || up.startsWith("AC ")
                || WaveformSpec.isWaveform(value)) {
            return value;
        }
        return "DC " + value;
    }

    /** Nombres de nodo en el orden de la tarjeta SPICE. */
    private List<String> nodeList(ComponentInstance c, Emission em) {
        PinOrder order = catalog.pinOrder(c);
        List<String> out = new ArrayList<>(order.spiceArity());
        for (int p = 0; p < order.spiceArity(); p++) {
            out.add(nodeName(em.graph, new TerminalRef(c.id(), order.schematicAt(p))));
        }
        return out;
    }

    private String nodes(ComponentInstance c, Emission em) {
        return String.join(" ", nodeList(c, em));
    }

    private static String nodeName(CircuitGraph graph, TerminalRef t) {
        return graph.nodeOf(t).map(Node::spiceName)
                .orElseThrow(() -> new IllegalStateException("Terminal sin nodo: " + t));
    }

    private Optional<String> firstVoltageSource(List<ComponentInstance> sorted) {
        for (ComponentInstance c : sorted) {
            if (c.type() == ComponentType.VOLTAGE_SOURCE) return Optional.of(catalog.cardName(c));
        }
        return Optional.empty();
    }

    /* ===================== Bloque de control ===================== */

    private static List<String> controlBlock(CircuitGraph graph, Analysis a, NetlistOptions opts) {
        List<String> out = new ArrayList<>();
        out.add("* Control block for batch execution");
        out.add(".control");
        out.add("run");
        if (a.type() == AnalysisType.NOISE) {
            out.add("setplot noise1");
            out.add("print onoise_spectrum inoise_spectrum");
        } else {
            TreeSet<String> names = new TreeSet<>();
            for (Node n : graph.getNodes()) {
                if (!n.ground()) names.add(n.spiceName());
            }
            if (!names.isEmpty()) {
                StringBuilder vars = new StringBuilder();
                for (String n : names) {
                    if (vars.length() > 0) vars.append(' ');
                    vars.append("v(").append(n).append(')');
                }
                out.add("print " + vars);
                if (opts.outputFile() != null) {
                    out.add("wrdata " + opts.outputFile().replace('\\', '/') + " " + vars);
                }
            }
        }
        out.add(".endc");
        return out;
    }
}
