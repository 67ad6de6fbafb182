package com.spicegui.file;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Avisos no fatales de una importación: líneas no soportadas, símbolos desconocidos,
 * pines que no cuadran. Los duplicados exactos se descartan.
 */
public final class WarningCollector {
    private final List<String> lines = new ArrayList<>();
    private final Set<String> keys   = new HashSet<>();

    /** Agrega un aviso con clave de recursos y argumentos. */
    public void add(String key, String... args) {
        addGeneric(Strings.get(key, args));
    }

    /** Agrega un aviso genérico, evitando duplicados exactos. */
    public void addGeneric(String text) {
        if (text == null) return;
        String norm = text.trim();
        if (norm.isEmpty()) return;

        if (keys.add(norm)) {
            lines.add(norm);
        }
    }

    public boolean hasWarnings() { return !lines.isEmpty(); }

    public int size() { return lines.size(); }

    /** Avisos en orden de aparición. */
    public List<String> warnings() {
        return List.copyOf(lines);
    }

    /** Resumen de una línea para el usuario; vacío si no hay avisos. */
    public String summary() {
        int n = lines.size();
        if (n == 0) return "";
        if (n == 1) return Strings.get("import.warn.summary.one");
        return Strings.get("import.warn.summary.many", n);
    }

    public String details() {
        StringBuilder sb = new StringBuilder();
        sb.append(Strings.get("import.warn.details.title")).append("\n\n");
        for (String s : lines) sb.append(" • ").append(s).append('\n');
        return sb.toString();
    }
}
