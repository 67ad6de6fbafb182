package com.spicegui.comp;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Bloque {@code .subckt ... .ends} con su nombre y la lista ordenada de pines.
 *
 * @param name       nombre tal como aparece en la cabecera
 * @param pins       pines en el orden de la cabecera (sin los {@code params:})
 * @param definition texto completo del bloque, incluidas cabecera y {@code .ends}
 */
public record SubcircuitDefinition(String name, List<String> pins, String definition) {

    public SubcircuitDefinition {
        Objects.requireNonNull(name, "name");
        pins = List.copyOf(pins);
        Objects.requireNonNull(definition, "definition");
    }

    /**
     * Extrae la primera definición de subcircuito de un texto (un archivo .lib o .sub,
     * o el bloque suelto).
     * @throws IllegalArgumentException si no hay ningún {@code .subckt} o la cabecera no tiene nombre
     */
    public static SubcircuitDefinition parse(String text) {
        List<String> block = new ArrayList<>();
        boolean inBlock = false;
        int depth = 0;
        for (String raw : (text == null ? "" : text).split("\\R")) {
            String line = raw.strip();
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.startsWith(".subckt")) {
                depth++;
                inBlock = true;
                block.add(line);
            } else if (inBlock && lower.startsWith(".ends")) {
                block.add(line);
                if (--depth == 0) break;
            } else if (inBlock) {
                block.add(line);
            }
        }
        if (block.isEmpty()) {
            throw new IllegalArgumentException("No .subckt definition found in text.");
        }
        return fromBlock(block);
    }

    /**
     * Construye la definición a partir de las líneas de un bloque ya delimitado; la primera
     * línea es la cabecera {@code .subckt}.
     */
    public static SubcircuitDefinition fromBlock(List<String> lines) {
        String[] header = lines.get(0).trim().split("\\s+");
        if (header.length < 2) {
            throw new IllegalArgumentException("Invalid .subckt line: missing subcircuit name.");
        }
        List<String> pins = new ArrayList<>();
        for (int i = 2; i < header.length; i++) {
            String tok = header[i];
            if (tok.equalsIgnoreCase("params:") || tok.contains("=")) break;
            pins.add(tok);
        }
        return new SubcircuitDefinition(header[1], pins, String.join("\n", lines));
    }

    /** Clave de búsqueda: SPICE no distingue mayúsculas en los nombres de subcircuito. */
    public String key() {
        return name.toUpperCase(Locale.ROOT);
    }
}
