package com.spicegui.file.importer;

import com.spicegui.comp.SubcircuitDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Aparta los bloques {@code .subckt ... .ends} mientras se recorre una netlist. Los
 * bloques anidados quedan dentro del texto del bloque exterior.
 */
final class SubcktScanner {

    enum State { SCANNING, INSIDE_SUBCKT }

    private State state = State.SCANNING;
    private int depth;
    private final List<String> block = new ArrayList<>();
    private final Map<String, SubcircuitDefinition> definitions = new LinkedHashMap<>();

    /**
     * @return {@code true} si la línea pertenece a un bloque (y no debe procesarse más)
     */
    boolean accept(String line) {
        String lower = line.strip().toLowerCase(Locale.ROOT);
        boolean opens = lower.startsWith(".subckt");
        switch (state) {
            case SCANNING:
                if (!opens) return false;
                state = State.INSIDE_SUBCKT;
                depth = 1;
                block.clear();
                block.add(line.strip());
                return true;
            case INSIDE_SUBCKT:
            default:
                block.add(line.strip());
                if (opens) {
                    depth++;
                } else if (lower.startsWith(".ends") && --depth == 0) {
                    close();
                }
                return true;
        }
    }

    private void close() {
        state = State.SCANNING;
        if (block.get(0).split("\\s+").length < 2) return;   // cabecera sin nombre
        SubcircuitDefinition def = SubcircuitDefinition.fromBlock(block);
        definitions.put(def.key(), def);
    }

    State state() {
        return state;
    }

    Optional<SubcircuitDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name.toUpperCase(Locale.ROOT)));
    }

    Map<String, SubcircuitDefinition> definitions() {
        return Collections.unmodifiableMap(definitions);
    }
}
