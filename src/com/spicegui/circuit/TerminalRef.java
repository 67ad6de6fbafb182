package com.spicegui.circuit;

import java.util.Comparator;
import java.util.Objects;

/**
 * Un terminal concreto: (componente, índice).
 */
public record TerminalRef(String componentId, int terminal) implements Comparable<TerminalRef> {

    private static final Comparator<TerminalRef> ORDER =
            Comparator.comparing(TerminalRef::componentId).thenComparingInt(TerminalRef::terminal);

    public TerminalRef {
        Objects.requireNonNull(componentId, "componentId");
        if (terminal < 0) throw new IllegalArgumentException("terminal negativo: " + terminal);
    }

    @Override
    public int compareTo(TerminalRef o) {
        return ORDER.compare(this, o);
    }

    /** Forma "R1:0" que usan los archivos de circuito para las etiquetas de red. */
    public String key() {
        return componentId + ":" + terminal;
    }

    /** Inversa de {@link #key()}; el índice va tras el último ':'. */
    public static TerminalRef parseKey(String key) {
        int colon = key == null ? -1 : key.lastIndexOf(':');
        if (colon <= 0 || colon == key.length() - 1) {
            throw new IllegalArgumentException("Clave de terminal inválida: " + key);
        }
        try {
            return new TerminalRef(key.substring(0, colon), Integer.parseInt(key.substring(colon + 1)));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Clave de terminal inválida: " + key, ex);
        }
    }

    @Override
    public String toString() {
        return key();
    }
}
