package com.spicegui.comp;

import java.util.Arrays;

/**
 * Permutación entre el orden de terminales del esquemático y el orden de nodos de
 * la tarjeta SPICE.
 * <p>
 * {@code spiceToSchematic[p]} es el terminal del esquemático que ocupa la posición
 * {@code p} de la tarjeta. Una misma patilla puede repetirse (MOSFET: el bulk se ata a la
 * fuente); la inversa se queda con la primera posición de cada terminal, así que al
 * importar las posiciones repetidas se ignoran.
 */
public final class PinOrder {

    private static final PinOrder[] IDENTITIES = new PinOrder[8];
    static {
        for (int n = 0; n < IDENTITIES.length; n++) IDENTITIES[n] = build(n);
    }

    private final int[] spiceToSchematic;
    private final int[] schematicToSpice;

    private PinOrder(int[] spiceToSchematic, int terminalCount) {
        this.spiceToSchematic = spiceToSchematic;
        this.schematicToSpice = new int[terminalCount];
        Arrays.fill(schematicToSpice, -1);
        for (int p = 0; p < spiceToSchematic.length; p++) {
            int t = spiceToSchematic[p];
            if (t < 0 || t >= terminalCount) {
                throw new IllegalArgumentException("Terminal fuera de rango en la permutación: " + t);
            }
            if (schematicToSpice[t] < 0) schematicToSpice[t] = p;
        }
        for (int t = 0; t < terminalCount; t++) {
            if (schematicToSpice[t] < 0) {
                throw new IllegalArgumentException("El terminal " + t + " no aparece en la permutación");
            }
        }
    }

    /**
     * @param terminalCount número de terminales del componente en el esquemático
     * @param spiceToSchematic terminal del esquemático para cada posición SPICE
     */
    public static PinOrder of(int terminalCount, int... spiceToSchematic) {
        return new PinOrder(spiceToSchematic.clone(), terminalCount);
    }

    public static PinOrder identity(int terminalCount) {
        if (terminalCount < IDENTITIES.length) return IDENTITIES[terminalCount];
        return build(terminalCount);
    }

    private static PinOrder build(int n) {
        int[] p = new int[n];
        for (int i = 0; i < n; i++) p[i] = i;
        return new PinOrder(p, n);
    }

    /** Número de nodos de la tarjeta SPICE. */
    public int spiceArity() { return spiceToSchematic.length; }

    public int terminalCount() { return schematicToSpice.length; }

    public int schematicAt(int spicePosition) { return spiceToSchematic[spicePosition]; }

    public int spiceAt(int terminal) { return schematicToSpice[terminal]; }

    public boolean isIdentity() {
        if (spiceToSchematic.length != schematicToSpice.length) return false;
        for (int i = 0; i < spiceToSchematic.length; i++) {
            if (spiceToSchematic[i] != i) return false;
        }
        return true;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PinOrder other)) return false;
        return Arrays.equals(spiceToSchematic, other.spiceToSchematic)
                && schematicToSpice.length == other.schematicToSpice.length;
    }

    @Override public int hashCode() {
        return 31 * Arrays.hashCode(spiceToSchematic) + schematicToSpice.length;
    }

    @Override public String toString() {
        return "PinOrder" + Arrays.toString(spiceToSchematic);
    }
}
