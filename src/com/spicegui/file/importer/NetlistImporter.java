package com.spicegui.file.importer;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.circuit.DisjointSet;
import com.spicegui.circuit.TerminalRef;
import com.spicegui.comp.ComponentCatalog;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentInstance.Position;
import com.spicegui.comp.ComponentType;
import com.spicegui.comp.DeviceModels;
import com.spicegui.comp.OpAmpModels;
import com.spicegui.comp.PinOrder;
import com.spicegui.comp.SubcircuitDefinition;
import com.spicegui.comp.WaveformSpec;
import com.spicegui.file.Strings;
import com.spicegui.file.WarningCollector;
import com.spicegui.layout.LayoutRunner;
import com.spicegui.netlist.Analysis;
import com.spicegui.netlist.AnalysisDirectives;
import com.spicegui.param.ParamProcessor;
import com.spicegui.param.SpiceValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Importa una netlist SPICE genérica (.cir / .spice) a un {@link CircuitGraph}.
 * <p>
 * Dos pasadas: la primera aparta los subcircuitos y recoge {@code .model}, {@code .param}
 * y la última directiva de análisis; la segunda lee las tarjetas de componentes. Las redes
 * se agrupan por nombre de nodo; cada red con dos o más terminales se reconstruye como una
 * cadena de cables y cada terminal en el nodo 0 recibe su propia tierra.
 * <p>
 * Las líneas que no se entienden se saltan con un aviso; sólo una netlist vacía o sin
 * componentes es un error.
 */
public final class NetlistImporter {

    private static final Logger log = LoggerFactory.getLogger(NetlistImporter.class);

    static final String GROUND_NET = "0";
    private static final Pattern AUTO_LABEL = Pattern.compile("node[A-Z]+");
    private static final Pattern NUMERIC_NODE = Pattern.compile("\\d+");
    private static final Pattern ZENER_PARAM = Pattern.compile("\\bBV\\s*=", Pattern.CASE_INSENSITIVE);
    private static final String SENSE_PREFIX = "VSENSE";
    /** Redes internas creadas al poner el par de control en serie con una fuente. */
    private static final String SPLICE_PREFIX = "#sense_";

    private final ComponentCatalog catalog;
    private final boolean autoLayout;

    public NetlistImporter() {
        this(ComponentCatalog.standard(), true);
    }

    /**
     * @param catalog    catálogo de tipos
     * @param autoLayout colocar con ELK; si es {@code false} se usa la rejilla fija
     */
    public NetlistImporter(ComponentCatalog catalog, boolean autoLayout) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.autoLayout = autoLayout;
    }

    /** Un {@code .model}: nombre, tipo ("NPN", "D", "SW"...) y parámetros sin paréntesis. */
    private record ModelInfo(String name, String type, String params) { }

    /** Tarjeta leída, antes de pasar al grafo. Los nodos van en el orden SPICE. */
    private static final class Card {
        final String id;
        ComponentType type;
        final List<String> nodes = new ArrayList<>();
        String value = "";
        String initialCondition;
        String waveformType;
        String controlSource;
        String coupledA;
        String coupledB;
        SubcircuitDefinition subcircuit;
        boolean dropped;

        Card(String id, ComponentType type) {
            this.id = id;
            this.type = type;
        }
    }

    /**
     * @throws NetlistParseException si el texto está vacío o no tiene componentes
     */
    public ImportResult importNetlist(String text) {
        if (text == null || text.isBlank()) {
            throw new NetlistParseException(Strings.get("netlist.error.empty"));
        }
        WarningCollector warnings = new WarningCollector();
        CircuitGraph graph = new CircuitGraph(catalog);

        // 1) primera pasada: bloques, modelos, parámetros, análisis
        List<String> all = Arrays.asList(text.strip().split("\\R"));
        List<String> body = new ArrayList<>();
        for (String raw : all.subList(1, all.size())) {   // la primera línea es el título
            String line = raw.strip();
            if (line.startsWith("*")) continue;
            body.add(line);
        }

        SubcktScanner scanner = new SubcktScanner();
        Map<String, ModelInfo> models = new HashMap<>();
        ParamProcessor params = new ParamProcessor();
        Analysis analysis = null;
        List<String> componentLines = new ArrayList<>();
        boolean inControl = false;

        for (String joined : SpiceTokenizer.joinContinuations(body)) {
            if (scanner.state() == SubcktScanner.State.INSIDE_SUBCKT) {
                scanner.accept(joined);
                continue;
            }
            String line = SpiceTokenizer.stripInlineComment(joined);
            if (line.isEmpty()) continue;
            String lower = line.toLowerCase(Locale.ROOT);

            if (lower.startsWith(".control")) { inControl = true; continue; }
            if (lower.startsWith(".endc")) { inControl = false; continue; }
            if (inControl) continue;
            if (scanner.accept(line)) continue;
            if (lower.equals(".end")) break;

            if (lower.startsWith(".")) {
                if (lower.startsWith(".model")) {
                    parseModel(line).ifPresentOrElse(m -> models.put(m.name().toUpperCase(Locale.ROOT), m),
                            () -> warnings.add("netlist.warn.malformed", line));
                } else if (lower.startsWith(".param")) {
                    params.parseDirectives(line);
                } else {
                    Optional<Analysis> a = AnalysisDirectives.parse(line);
                    if (a.isPresent()) analysis = a.get();
                    else log.debug("Directiva ignorada: {}", line);
                }
                continue;
            }
            if (Character.isLetter(line.charAt(0))) {
                componentLines.add(line);
            } else {
                warnings.add("netlist.warn.unsupported", line);
            }
        }

        // 2) segunda pasada: tarjetas
        List<Card> cards = new ArrayList<>();
        for (String line : componentLines) {
            parseCard(line, models, scanner, warnings).ifPresent(cards::add);
        }
        absorbSenseSources(cards, warnings);
        mergeCouplings(cards, warnings);
        cards.removeIf(c -> c.dropped);

        if (cards.isEmpty()) {
            throw new NetlistParseException(Strings.get("netlist.error.noComponents"));
        }

        // 3) componentes y redes
        for (SubcircuitDefinition def : scanner.definitions().values()) {
            if (!isBuiltInOpAmp(def)) graph.putSubcircuitDefinition(def);
        }
        params.rawParams().forEach(graph::defineParameter);

        DisjointSet<String> nets = new DisjointSet<>();
        nets.add(GROUND_NET);
        List<TerminalRef> pendingTerminals = new ArrayList<>();
        List<String> pendingKeys = new ArrayList<>();
        Map<String, String> displayNames = new LinkedHashMap<>();

        for (Card card : cards) {
            ComponentInstance c = materialize(card);
            if (graph.hasComponent(c.id())) {
                warnings.add("netlist.warn.duplicateId", c.id());
                continue;
            }
            graph.addComponent(c);
            if (c.subcircuitDefinition() != null) {
                graph.putSubcircuitDefinition(card.subcircuit);
            }

            PinOrder order = catalog.pinOrder(c);
            for (int t = 0; t < order.terminalCount(); t++) {
                int p = order.spiceAt(t);
                if (p >= card.nodes.size() || card.nodes.get(p) == null) continue;   // sin conectar
                String name = card.nodes.get(p);
                String key = netKey(name);
                nets.add(key);
                if (key.equals("gnd")) nets.union(key, GROUND_NET);
                displayNames.putIfAbsent(key, name);
                pendingTerminals.add(new TerminalRef(c.id(), t));
                pendingKeys.add(key);
            }
        }

        GraphAssembler<String> assembler = new GraphAssembler<>(graph);
        for (int i = 0; i < pendingTerminals.size(); i++) {
            String root = nets.find(pendingKeys.get(i));
            assembler.attach(root, pendingTerminals.get(i));
            if (nets.connected(root, GROUND_NET)) {
                assembler.markGround(root);
            } else {
                String shown = displayNames.get(pendingKeys.get(i));
                if (isUserLabel(shown)) assembler.label(root, shown);
            }
        }
        assembler.wireNets();

        // 4) geometría: los componentes primero, las tierras debajo de su terminal
        if (autoLayout) {
            LayoutRunner.place(graph);
        } else {
            LayoutRunner.placeOnGrid(new ArrayList<>(graph.getComponents()));
        }
        assembler.addGrounds(t -> {
            Position at = graph.getComponent(t.componentId()).map(ComponentInstance::position)
                    .orElse(Position.ORIGIN);
            return new Position(at.x(), LayoutRunner.snap(at.y() + LayoutRunner.GRID_SPACING));
        });

        if (analysis != null) graph.setAnalysis(analysis);
        graph.rebuildNodes();

        for (String w : warnings.warnings()) log.warn(w);
        log.info("Netlist importada: {} componentes, {} cables, {} avisos",
                graph.getComponents().size(), graph.getWires().size(), warnings.size());
        return new ImportResult(graph, Optional.ofNullable(analysis), warnings.warnings());
    }

    /* ===================== Tarjetas ===================== */

    private Optional<Card> parseCard(String line, Map<String, ModelInfo> models,
                                     SubcktScanner scanner, WarningCollector warnings) {
        List<String> tok = SpiceTokenizer.tokenize(line);
        if (tok.size() < 3) {
            warnings.add("netlist.warn.malformed", line);
            return Optional.empty();
        }
        String id = tok.get(0);
        char prefix = Character.toUpperCase(id.charAt(0));

        if (prefix == 'X') return parseInstance(line, tok, scanner, warnings);
        if (prefix == 'K') {
            if (tok.size() < 4) {
                warnings.add("netlist.warn.malformed", line);
                return Optional.empty();
            }
            Card k = new Card(id, ComponentType.TRANSFORMER);
            k.coupledA = tok.get(1);
            k.coupledB = tok.get(2);
            k.value = tok.get(3);
            return Optional.of(k);
        }

        Optional<ComponentType> base = catalog.typeForSpicePrefix(prefix);
        if (base.isEmpty()) {
            warnings.add("netlist.warn.unsupported", line);
            return Optional.empty();
        }
        int nodeCount = switch (prefix) {
            case 'Q' -> 3;
            case 'M', 'E', 'G', 'S' -> 4;
            default -> 2;
        };
        if (tok.size() < nodeCount + 1) {
            warnings.add("netlist.warn.malformed", line);
            return Optional.empty();
        }
        Card card = new Card(id, base.get());
        card.nodes.addAll(tok.subList(1, 1 + nodeCount));
        List<String> rest = tok.subList(1 + nodeCount, tok.size());
        String first = rest.isEmpty() ? null : rest.get(0);

        switch (prefix) {
            case 'R', 'C', 'L' -> {
                card.value = first != null ? first : catalog.entry(card.type).defaultValue();
                for (String r : rest) {
                    if (r.toUpperCase(Locale.ROOT).startsWith("IC=")) card.initialCondition = r.substring(3);
                }
            }
            case 'V', 'I' -> sourceValue(card, rest, prefix == 'V');
            case 'D' -> diode(card, first, models);
            case 'Q' -> {
                String model = tok.size() >= 6 ? rest.get(rest.size() - 1) : first;
                boolean pnp = model != null && (DeviceModels.DEFAULT_PNP.equalsIgnoreCase(model)
                        || modelType(models, model).contains("PNP"));
                card.type = pnp ? ComponentType.BJT_PNP : ComponentType.BJT_NPN;
                card.value = model != null ? model : catalog.entry(card.type).defaultValue();
            }
            case 'M' -> {
                boolean pmos = first != null && (DeviceModels.DEFAULT_PMOS.equalsIgnoreCase(first)
                        || modelType(models, first).contains("PMOS"));
                card.type = pmos ? ComponentType.MOSFET_PMOS : ComponentType.MOSFET_NMOS;
                card.value = first != null ? first : catalog.entry(card.type).defaultValue();
            }
            case 'E', 'G' -> card.value = rest.isEmpty() ? "1" : String.join(" ", rest);
            case 'H', 'F' -> {
                if (first == null) {
                    warnings.add("netlist.warn.malformed", line);
                    return Optional.empty();
                }
                card.controlSource = first;
                card.value = rest.size() > 1 ? rest.get(1) : "1";
            }
            case 'S' -> {
                ModelInfo m = first == null ? null : models.get(first.toUpperCase(Locale.ROOT));
                if (m != null && !m.params().isEmpty()) card.value = m.params();
                else card.value = first != null ? first : catalog.entry(card.type).defaultValue();
            }
            default -> {
                warnings.add("netlist.warn.unsupported", line);
                return Optional.empty();
            }
        }
        return Optional.of(card);
    }

    /** {@code X<id> nodos... nombre [params: ...]}: op-amp conocido o subcircuito. */
    private Optional<Card> parseInstance(String line, List<String> tok, SubcktScanner scanner,
                                         WarningCollector warnings) {
        int end = tok.size();
        for (int i = 2; i < tok.size(); i++) {
            if (tok.get(i).equalsIgnoreCase("params:") || tok.get(i).contains("=")) {
                end = i;
                break;
            }
        }
        String name = tok.get(end - 1);
        List<String> nodes = tok.subList(1, end - 1);
        String id = tok.get(0);

        Optional<String> opamp = OpAmpModels.forSubcktName(name);
        if (opamp.isPresent() && scanner.find(name).map(NetlistImporter::isBuiltInOpAmp).orElse(true)) {
            if (nodes.size() < 3) {
                warnings.add("netlist.warn.malformed", line);
                return Optional.empty();
            }
            Card card = new Card(id, ComponentType.OP_AMP);
            card.nodes.addAll(nodes);
            card.value = opamp.get();
            return Optional.of(card);
        }

        Card card = new Card(id, ComponentType.SUBCIRCUIT);
        card.nodes.addAll(nodes);
        Optional<SubcircuitDefinition> def = scanner.find(name);
        if (def.isPresent()) {
            if (def.get().pins().size() != nodes.size()) {
                warnings.add("netlist.warn.pinMismatch", def.get().name(), id,
                        String.valueOf(nodes.size()), String.valueOf(def.get().pins().size()));
            }
            card.subcircuit = def.get();
            card.value = def.get().name();
        } else {
            warnings.add("netlist.warn.undefinedSubckt", name, id);
            List<String> pins = new ArrayList<>();
            for (int i = 0; i < nodes.size(); i++) pins.add("p" + i);
            card.subcircuit = new SubcircuitDefinition(name, pins, "");
            card.value = name;
        }
        return Optional.of(card);
    }

    /** Valor de una fuente V/I: DC, AC o forma de onda. */
    private void sourceValue(Card card, List<String> rest, boolean voltage) {
        String combined = String.join(" ", rest).strip();
        if (combined.isEmpty()) {
            card.value = catalog.entry(card.type).defaultValue();
            return;
        }
        Optional<WaveformSpec.Match> wf = WaveformSpec.find(combined);
        if (wf.isPresent() && voltage) {
            card.type = ComponentType.WAVEFORM_SOURCE;
            card.waveformType = wf.get().type();
            card.value = wf.get().text();
            return;
        }
        String upper = combined.toUpperCase(Locale.ROOT);
        if (upper.startsWith("DC ")) {
            card.value = combined.substring(3).strip();
        } else if (upper.equals("DC")) {
            card.value = catalog.entry(card.type).defaultValue();
        } else {
            card.value = combined;
        }
    }

    private static void diode(Card card, String modelName, Map<String, ModelInfo> models) {
        if (modelName == null) {
            card.type = ComponentType.DIODE;
            card.value = "IS=1e-14 N=1";
            return;
        }
        boolean led = modelName.toUpperCase(Locale.ROOT).contains("LED");
        ModelInfo m = models.get(modelName.toUpperCase(Locale.ROOT));
        if (m == null || m.params().isEmpty()) {
            // modelo externo: se conserva el nombre
            card.type = led ? ComponentType.LED : ComponentType.DIODE;
            card.value = modelName;
            return;
        }
        if (led) card.type = ComponentType.LED;
        else if (ZENER_PARAM.matcher(m.params()).find()) card.type = ComponentType.ZENER_DIODE;
        else card.type = ComponentType.DIODE;
        card.value = m.params();
    }

    /** El bloque es la definición que el generador emite para un op-amp de la librería. */
    private static boolean isBuiltInOpAmp(SubcircuitDefinition def) {
        Optional<String> model = OpAmpModels.forSubcktName(def.name());
        if (model.isEmpty()) return false;
        String builtIn = OpAmpModels.definition(model.get());
        return builtIn != null && normalizeBlock(builtIn).equals(normalizeBlock(def.definition()));
    }

    // sin comentarios (la primera pasada ya los quitó) ni diferencias de espacios
    private static String normalizeBlock(String text) {
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\\R")) {
            String l = line.strip();
            if (l.isEmpty() || l.startsWith("*")) continue;
            sb.append(l.replaceAll("\\s+", " ").toUpperCase(Locale.ROOT)).append('\n');
        }
        return sb.toString();
    }

    private static String modelType(Map<String, ModelInfo> models, String name) {
        ModelInfo m = models.get(name.toUpperCase(Locale.ROOT));
        return m == null ? "" : m.type();
    }

    /** {@code .model NOMBRE TIPO(params)}, con o sin espacio antes del paréntesis. */
    private static Optional<ModelInfo> parseModel(String line) {
        List<String> tok = SpiceTokenizer.tokenize(line);
        if (tok.size() < 3) return Optional.empty();
        String rest = String.join(" ", tok.subList(2, tok.size())).strip();
        int open = rest.indexOf('(');
        String type;
        String params;
        if (open >= 0) {
            type = rest.substring(0, open).strip();
            int close = rest.lastIndexOf(')');
            params = rest.substring(open + 1, close > open ? close : rest.length()).strip();
        } else {
            String[] parts = rest.split("\\s+", 2);
            type = parts[0];
            params = parts.length > 1 ? parts[1].strip() : "";
        }
        if (type.isEmpty()) return Optional.empty();
        return Optional.of(new ModelInfo(tok.get(1), type.toUpperCase(Locale.ROOT), params));
    }

    /* ===================== Post-proceso ===================== */

    /**
     * Las fuentes de corriente controladas (H/F) toman como pines de control los nodos de
     * su fuente de medida, que desaparece si es un amperímetro (Vsense_* o valor 0).
     * Cualquier otra fuente V se conserva: su terminal + pasa a una red interna y el par
     * de control queda en serie entre la red original y esa red, en el orden [ctrl+, ctrl-].
     */
    private static void absorbSenseSources(List<Card> cards, WarningCollector warnings) {
        Map<String, Card> sources = new HashMap<>();
        for (Card c : cards) {
            if (c.type == ComponentType.VOLTAGE_SOURCE || c.type == ComponentType.WAVEFORM_SOURCE) {
                sources.put(c.id.toUpperCase(Locale.ROOT), c);
            }
        }
        for (Card c : cards) {
            if (c.controlSource == null) continue;
            Card sense = sources.get(c.controlSource.toUpperCase(Locale.ROOT));
            if (sense == null) {
                warnings.add("netlist.warn.missingSense", c.id, c.controlSource);
                c.nodes.add(null);
                c.nodes.add(null);
                continue;
            }
            if (isAmmeter(sense)) {
                c.nodes.add(sense.nodes.get(0));
                c.nodes.add(sense.nodes.get(1));
                sense.dropped = true;
                continue;
            }
            String inner = SPLICE_PREFIX + c.id;
            c.nodes.add(sense.nodes.get(0));
            c.nodes.add(inner);
            sense.nodes.set(0, inner);
            log.debug("{}: par de control en serie con {}", c.id, sense.id);
        }
    }

    private static boolean isAmmeter(Card v) {
        if (v.id.toUpperCase(Locale.ROOT).startsWith(SENSE_PREFIX)) return true;
        return SpiceValues.isNumeric(v.value) && SpiceValues.parse(v.value) == 0.0;
    }

    /**
     * Un acoplamiento {@code K} entre dos bobinas se convierte en un transformador. Las
     * tarjetas generadas ({@code L_prim_X}, {@code L_sec_X}, {@code K_X}) vuelven al id X.
     */
    private static void mergeCouplings(List<Card> cards, WarningCollector warnings) {
        Map<String, Card> inductors = new HashMap<>();
        for (Card c : cards) {
            if (c.type == ComponentType.INDUCTOR) inductors.put(c.id.toUpperCase(Locale.ROOT), c);
        }
        for (Card k : cards) {
            if (k.coupledA == null) continue;
            Card a = inductors.get(k.coupledA.toUpperCase(Locale.ROOT));
            Card b = inductors.get(k.coupledB.toUpperCase(Locale.ROOT));
            if (a == null || b == null || a == b || a.dropped || b.dropped) {
                warnings.add("netlist.warn.unknownCoupling", k.id);
                k.dropped = true;
                continue;
            }
            k.nodes.addAll(a.nodes);
            k.nodes.addAll(b.nodes);
            k.value = a.value + " " + b.value + " " + k.value;
            a.dropped = true;
            b.dropped = true;
        }
    }

    private ComponentInstance materialize(Card card) {
        String id = card.id;
        if (card.type == ComponentType.TRANSFORMER && id.length() > 2
                && id.regionMatches(true, 0, "K_", 0, 2)) {
            id = id.substring(2);
        }
        ComponentInstance c = new ComponentInstance(id, card.type, card.value);
        if (card.initialCondition != null && card.type.acceptsInitialCondition()) {
            c.setInitialCondition(card.initialCondition);
        }
        if (card.type == ComponentType.WAVEFORM_SOURCE) {
            c.setWaveformType(card.waveformType);
            Map<String, Map<String, String>> wp = WaveformSpec.defaultParams();
            Map<String, String> parsed = WaveformSpec.parseParams(card.waveformType, card.value);
            if (!parsed.isEmpty()) wp.put(card.waveformType, parsed);
            c.setWaveformParams(wp);
        }
        if (card.type == ComponentType.SUBCIRCUIT) {
            c.setSubcircuitName(card.subcircuit.name());
            c.setSubcircuitPins(card.subcircuit.pins());
            if (!card.subcircuit.definition().isEmpty()) c.setSubcircuitDefinition(card.subcircuit.definition());
        }
        return c;
    }

    /* ===================== Redes ===================== */

    /** Clave de red: sin distinguir mayúsculas, salvo el nodo 0. */
    static String netKey(String nodeName) {
        return nodeName.equals(GROUND_NET) ? GROUND_NET : nodeName.toLowerCase(Locale.ROOT);
    }

    /** Los nombres puestos a mano (out, vin...) se conservan como etiqueta de red. */
    private static boolean isUserLabel(String name) {
        return name != null
                && !name.startsWith(SPLICE_PREFIX)
                && !NUMERIC_NODE.matcher(name).matches()
                && !AUTO_LABEL.matcher(name).matches();
    }
}
