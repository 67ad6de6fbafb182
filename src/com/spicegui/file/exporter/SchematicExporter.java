package com.spicegui.file.exporter;

import com.spicegui.circuit.CircuitGraph;
import com.spicegui.circuit.Node;
import com.spicegui.circuit.TerminalRef;
import com.spicegui.circuit.Wire;
import com.spicegui.comp.ComponentInstance;
import com.spicegui.comp.ComponentType;
import com.spicegui.file.CircuitFileException;
import com.spicegui.file.Strings;
import com.spicegui.file.importer.AscSymbolTable;
import com.spicegui.file.importer.GridPoint;
import com.spicegui.file.importer.Orientation;
import com.spicegui.netlist.AnalysisDirectives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Exporta un circuito a un esquemático LTspice (.asc). Es la inversa de
 * {@link com.spicegui.file.importer.SchematicImporter}: mismos símbolos y mismos
 * desplazamientos de pin, las tierras salen como {@code FLAG x y 0}, las etiquetas de red
 * como {@code FLAG x y nombre} y cada cable como un {@code WIRE} recto entre los pines que une.
 */
public final class SchematicExporter {

    private static final Logger log = LoggerFactory.getLogger(SchematicExporter.class);

    static final int TEXT_X = -32;
    static final int TEXT_Y = 280;
    static final int TEXT_STEP = 32;

    public String export(CircuitGraph graph) {
        List<String> lines = new ArrayList<>();
        lines.add("Version 4");
        lines.add("SHEET 1 880 680");

        List<ComponentInstance> sorted = new ArrayList<>(graph.getComponents());
        sorted.sort(Comparator.comparing(ComponentInstance::id));
        Map<TerminalRef, GridPoint> pins = new HashMap<>();

        // símbolos (las tierras van como FLAG)
        for (ComponentInstance c : sorted) {
            if (c.type() == ComponentType.GROUND) continue;
            Optional<String> symbol = AscSymbolTable.symbolFor(c.type());
            if (symbol.isEmpty()) {
                log.warn("{} ({}) no tiene símbolo LTspice; se omite", c.id(), c.type().displayName());
                continue;
            }
            GridPoint origin = origin(c);
            Orientation o = Orientation.of(c.rotation(), c.flipH(), c.flipV());
            lines.add("SYMBOL " + symbol.get() + " " + origin.x() + " " + origin.y() + " " + o.name());
            lines.add("SYMATTR InstName " + c.id());
            String value = c.type() == ComponentType.WAVEFORM_SOURCE ? c.spiceValue() : c.value();
            if (value != null && !value.isBlank()) lines.add("SYMATTR Value " + value.strip());
            int n = AscSymbolTable.pinOffsets(c.type()).size();
            for (int t = 0; t < n; t++) {
                pins.put(new TerminalRef(c.id(), t), AscSymbolTable.pinAt(c.type(), t, origin, o));
            }
        }
        for (ComponentInstance c : sorted) {
            if (c.type() != ComponentType.GROUND) continue;
            GridPoint at = origin(c);
            lines.add("FLAG " + at.x() + " " + at.y() + " 0");
            pins.put(new TerminalRef(c.id(), 0), at);
        }

        for (Wire w : graph.getWires()) {
            GridPoint a = pins.get(w.start());
            GridPoint b = pins.get(w.end());
            if (a == null || b == null) continue;
            lines.add("WIRE " + a.x() + " " + a.y() + " " + b.x() + " " + b.y());
        }

        // etiquetas de red: un FLAG en el primer pin dibujado de cada red con nombre
        for (Node n : graph.getNodes()) {
            if (n.ground() || n.customLabel() == null) continue;
            n.terminals().stream().map(pins::get).filter(Objects::nonNull).findFirst()
                    .ifPresent(at -> lines.add("FLAG " + at.x() + " " + at.y() + " " + n.customLabel()));
        }

        // directivas
        int y = TEXT_Y;
        List<String> directives = new ArrayList<>();
        graph.getParameters().forEach((k, v) -> directives.add(".param " + k + "=" + v));
        Optional<String> firstSource = sorted.stream()
                .filter(c -> c.type() == ComponentType.VOLTAGE_SOURCE)
                .map(ComponentInstance::id).findFirst();
        for (String d : AnalysisDirectives.emit(graph.getAnalysis(), firstSource)) {
            if (!d.startsWith("*")) directives.add(d);
        }
        for (String d : directives) {
            lines.add("TEXT " + TEXT_X + " " + y + " Left 2 !" + d);
            y += TEXT_STEP;
        }

        lines.add("");
        return String.join("\n", lines);
    }

    /** @throws CircuitFileException si no se puede escribir */
    public void write(CircuitGraph graph, Path file) {
        try {
            Files.writeString(file, export(graph), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CircuitFileException(Strings.get("file.error.write", String.valueOf(file)), ex);
        }
    }

    private static GridPoint origin(ComponentInstance c) {
        return new GridPoint((int) Math.round(c.position().x()), (int) Math.round(c.position().y()));
    }
}
