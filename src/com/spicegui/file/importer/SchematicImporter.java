package com.spicegui.file.importer;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.circuit.DisjointSet;
import com.spicegui.circuit.TerminalRef;
import com.spicegui.comp.ComponentCatalog;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentInstance.Position;
import com.spicegui.comp.ComponentType;
import com.spicegui.comp.WaveformSpec;
import com.spicegui.file.Strings;
import com.spicegui.file.WarningCollector;
import com.spicegui.netlist.Analysis;
import com.spicegui.netlist.AnalysisDirectives;
import com.spicegui.param.ParamProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Importa un esquemático LTspice (.asc).
 * <p>
 * La conectividad es geométrica: los extremos de cada {@code WIRE}, los pines de los
 * símbolos (origen + desplazamiento orientado) y los {@code FLAG} se unen en un
 * union-find de puntos enteros. Un punto que cae dentro de un tramo recto de cable
 * también se une a él. {@code FLAG x y 0} marca la red como tierra; dos flags con la
 * misma etiqueta unen sus redes y le dan nombre.
 */
public final class SchematicImporter {

    private static final Logger log = LoggerFactory.getLogger(SchematicImporter.class);

    /** Las tierras sintetizadas se colocan este tanto por debajo de su pin. */
    static final int GROUND_DROP = 48;

    private final ComponentCatalog catalog;

    public SchematicImporter() {
        this(ComponentCatalog.standard());
    }

    public SchematicImporter(ComponentCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /** Un {@code SYMBOL} con sus {@code SYMATTR}. */
    private static final class Symbol {
        final String name;
        final GridPoint origin;
        final Orientation orientation;
        String instName;
        String value;
        String value2;
        String spiceModel;

        Symbol(String name, GridPoint origin, Orientation orientation) {
            this.name = name;
            this.origin = origin;
            this.orientation = orientation;
        }
    }

    private record Segment(GridPoint a, GridPoint b) { }

    private record Flag(GridPoint at, String label) { }

    /**
     * Lee un archivo .asc. LTspice guarda algunos en UTF-16LE; se detecta por los bytes nulos.
     * @throws AscParseException si no se puede leer o no tiene contenido reconocible
     */
    public ImportResult importFile(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new AscParseException(Strings.get("asc.error.read", String.valueOf(file)), ex);
        }
        boolean utf16 = bytes.length > 1 && (bytes[1] == 0 || (bytes[0] == (byte) 0xFF && bytes[1] == (byte) 0xFE));
        String text = new String(bytes, utf16 ? StandardCharsets.UTF_16LE : StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') text = text.substring(1);
        return importAsc(text);
    }

    /**
     * @throws AscParseException si el texto está vacío o no tiene SYMBOL, WIRE ni FLAG
     */
    public ImportResult importAsc(String text) {
        if (text == null || text.isBlank()) {
            throw new AscParseException(Strings.get("asc.error.empty"));
        }
        WarningCollector warnings = new WarningCollector();
        List<Symbol> symbols = new ArrayList<>();
        List<Segment> segments = new ArrayList<>();
        List<Flag> flags = new ArrayList<>();
        ParamProcessor params = new ParamProcessor();
        Analysis analysis = null;

        // 1) registros
        Symbol current = null;
        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            String[] p = line.split("\\s+");
            String kind = p[0].toUpperCase(Locale.ROOT);
            try {
                switch (kind) {
                    case "WIRE" -> {
                        if (p.length < 5) throw new NumberFormatException(line);
                        segments.add(new Segment(point(p[1], p[2]), point(p[3], p[4])));
                    }
                    case "FLAG" -> {
                        if (p.length < 4) throw new NumberFormatException(line);
                        flags.add(new Flag(point(p[1], p[2]), p[3]));
                    }
                    case "SYMBOL" -> {
                        current = null;
                        if (p.length < 4) throw new NumberFormatException(line);
                        Optional<Orientation> o = Orientation.parse(p.length > 4 ? p[4] : "R0");
                        if (o.isEmpty()) throw new NumberFormatException(line);
                        current = new Symbol(p[1], point(p[2], p[3]), o.get());
                        symbols.add(current);
                    }
                    case "SYMATTR" -> {
                        if (current != null) symattr(current, line);
                    }
                    case "TEXT" -> {
                        String directive = directiveOf(line);
                        if (directive == null) {
                            log.trace("Comentario: {}", line);
                        } else if (directive.toLowerCase(Locale.ROOT).startsWith(".param")) {
                            params.parseDirectives(directive);
                        } else {
                            Optional<Analysis> a = AnalysisDirectives.parse(directive);
                            if (a.isPresent()) analysis = a.get();
                        }
                    }
                    default -> log.trace("Registro ignorado: {}", kind);
                }
            } catch (NumberFormatException ex) {
                warnings.add("asc.warn.badLine", line);
            }
        }

        if (symbols.isEmpty() && segments.isEmpty() && flags.isEmpty()) {
            throw new AscParseException(Strings.get("asc.error.noComponents"));
        }

        // 2) componentes y pines
        CircuitGraph graph = new CircuitGraph(catalog);
        params.rawParams().forEach(graph::defineParameter);
        Map<TerminalRef, GridPoint> pinPoints = new LinkedHashMap<>();

        for (Symbol s : symbols) {
            Optional<ComponentType> type = AscSymbolTable.typeFor(s.name);
            if (type.isEmpty()) {
                warnings.add("asc.warn.unsupported", s.name);
                continue;
            }
            if (s.instName == null || s.instName.isBlank()) {
                warnings.add("asc.warn.noInstName", s.name);
                continue;
            }
            if (graph.hasComponent(s.instName)) {
                warnings.add("netlist.warn.duplicateId", s.instName);
                continue;
            }
            ComponentInstance c = materialize(s, type.get());
            graph.addComponent(c);
            int n = catalog.terminalCount(c);
            for (int t = 0; t < n; t++) {
                pinPoints.put(new TerminalRef(c.id(), t),
                        AscSymbolTable.pinAt(c.type(), t, s.origin, s.orientation));
            }
        }

        // 3) conectividad geométrica
        DisjointSet<GridPoint> points = new DisjointSet<>();
        for (Segment seg : segments) points.union(seg.a(), seg.b());
        pinPoints.values().forEach(points::add);
        flags.forEach(f -> points.add(f.at()));
        joinTJunctions(points, segments);

        Map<String, GridPoint> labelAnchor = new HashMap<>();
        List<GridPoint> groundPoints = new ArrayList<>();
        for (Flag f : flags) {
            if (isGroundLabel(f.label())) {
                groundPoints.add(f.at());
                continue;
            }
            GridPoint first = labelAnchor.putIfAbsent(f.label().toLowerCase(Locale.ROOT), f.at());
            if (first != null) points.union(first, f.at());
        }

        GraphAssembler<GridPoint> assembler = new GraphAssembler<>(graph);
        pinPoints.forEach((t, at) -> assembler.attach(points.find(at), t));
        for (GridPoint g : groundPoints) assembler.markGround(points.find(g));
        for (Flag f : flags) {
            if (!isGroundLabel(f.label())) assembler.label(points.find(f.at()), f.label());
        }
        assembler.wireNets();
        assembler.addGrounds(t -> {
            GridPoint at = pinPoints.get(t);
            return new Position(at.x(), at.y() + GROUND_DROP);
        });

        if (analysis != null) graph.setAnalysis(analysis);
        graph.rebuildNodes();

        for (String w : warnings.warnings()) log.warn(w);
        log.info("Esquemático importado: {} componentes, {} cables, {} avisos",
                graph.getComponents().size(), graph.getWires().size(), warnings.size());
        return new ImportResult(graph, Optional.ofNullable(analysis), warnings.warnings());
    }

    /* ===================== Registros ===================== */

    private static GridPoint point(String x, String y) {
        return new GridPoint(Integer.parseInt(x), Integer.parseInt(y));
    }

    private static void symattr(Symbol s, String line) {
        String[] p = line.split("\\s+", 3);
        if (p.length < 3) return;
        switch (p[1]) {
            case "InstName" -> s.instName = p[2].strip();
            case "Value" -> s.value = p[2].strip();
            case "Value2" -> s.value2 = p[2].strip();
            case "SpiceModel" -> s.spiceModel = p[2].strip();
            default -> { }
        }
    }

    /** {@code TEXT x y alineación tamaño !directiva}; {@code null} si es un comentario. */
    private static String directiveOf(String line) {
        String[] p = line.split("\\s+", 6);
        if (p.length < 6 || !p[5].startsWith("!")) return null;
        return p[5].substring(1).strip();
    }

    private static boolean isGroundLabel(String label) {
        return label.equals("0") || label.equalsIgnoreCase("gnd");
    }

    /** Une a un cable todo punto que cae dentro de uno de sus tramos rectos. */
    private static void joinTJunctions(DisjointSet<GridPoint> points, List<Segment> segments) {
        List<GridPoint> all = new ArrayList<>();
        for (List<GridPoint> g : points.groups()) all.addAll(g);
        for (Segment seg : segments) {
            for (GridPoint pt : all) {
                if (pt.strictlyInside(seg.a(), seg.b())) points.union(pt, seg.a());
            }
        }
    }

    private ComponentInstance materialize(Symbol s, ComponentType detected) {
        ComponentType type = detected;
        String value = s.value != null ? s.value : s.spiceModel;
        String waveform = null;

        if (type == ComponentType.VOLTAGE_SOURCE) {
            Optional<WaveformSpec.Match> wf = WaveformSpec.find(value);
            if (wf.isEmpty()) wf = WaveformSpec.find(s.value2);
            if (wf.isPresent()) {
                type = ComponentType.WAVEFORM_SOURCE;
                waveform = wf.get().type();
                value = wf.get().text();
            }
        }
        if (value == null || value.isBlank()) value = catalog.entry(type).defaultValue();

        ComponentInstance c = new ComponentInstance(s.instName, type, value);
        c.setPosition(s.origin.x(), s.origin.y());
        c.setRotation(s.orientation.degrees());
        c.setFlipH(s.orientation.mirrored());
        if (waveform != null) {
            c.setWaveformType(waveform);
            Map<String, Map<String, String>> wp = WaveformSpec.defaultParams();
            Map<String, String> parsed = WaveformSpec.parseParams(waveform, value);
            if (!parsed.isEmpty()) wp.put(waveform, parsed);
            c.setWaveformParams(wp);
        }
        return c;
    }
}
