package com.spicegui.file.importer;

import com.spicegui.comp.ComponentType;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Correspondencia entre símbolos LTspice y tipos de componente, con los desplazamientos
 * de pin de cada símbolo en orientación R0, indexados por terminal.
 */
public final class AscSymbolTable {

    private static final Map<String, ComponentType> BY_SYMBOL = new HashMap<>();
    private static final Map<ComponentType, String> SYMBOL_FOR = new EnumMap<>(ComponentType.class);
    private static final Map<ComponentType, List<GridPoint>> OFFSETS = new EnumMap<>(ComponentType.class);

    private static final List<GridPoint> TWO_PIN = pins(0, 0, 0, 80);
    private static final List<GridPoint> CONTROLLED = pins(-32, 32, -32, -32, 32, -32, 32, 32);

    static {
        symbol(ComponentType.RESISTOR, "res", "res2");
        symbol(ComponentType.CAPACITOR, "cap", "cap2", "polcap");
        symbol(ComponentType.INDUCTOR, "ind", "ind2");
        symbol(ComponentType.VOLTAGE_SOURCE, "voltage");
        symbol(ComponentType.CURRENT_SOURCE, "current");
        symbol(ComponentType.DIODE, "diode", "schottky");
        symbol(ComponentType.ZENER_DIODE, "zener");
        symbol(ComponentType.LED, "LED");
        symbol(ComponentType.BJT_NPN, "npn", "npn2");
        symbol(ComponentType.BJT_PNP, "pnp", "pnp2");
        symbol(ComponentType.MOSFET_NMOS, "nmos", "nmos3");
        symbol(ComponentType.MOSFET_PMOS, "pmos", "pmos3");
        symbol(ComponentType.OP_AMP, "opamp", "opamp2");
        symbol(ComponentType.VCVS, "e", "e2");
        symbol(ComponentType.CCCS, "f", "f2");
        symbol(ComponentType.VCCS, "g", "g2");
        symbol(ComponentType.CCVS, "h", "h2");
        SYMBOL_FOR.put(ComponentType.WAVEFORM_SOURCE, "voltage");

        OFFSETS.put(ComponentType.RESISTOR, TWO_PIN);
        OFFSETS.put(ComponentType.INDUCTOR, TWO_PIN);
        OFFSETS.put(ComponentType.CAPACITOR, pins(0, 0, 0, 64));
        List<GridPoint> source = pins(0, 0, 0, 112);
        OFFSETS.put(ComponentType.VOLTAGE_SOURCE, source);
        OFFSETS.put(ComponentType.CURRENT_SOURCE, source);
        OFFSETS.put(ComponentType.WAVEFORM_SOURCE, source);
        List<GridPoint> diode = pins(0, 0, 0, 64);
        OFFSETS.put(ComponentType.DIODE, diode);
        OFFSETS.put(ComponentType.LED, diode);
        OFFSETS.put(ComponentType.ZENER_DIODE, diode);
        // c/d, b/g, e/s
        List<GridPoint> nType = pins(16, 0, -16, 32, 16, 64);
        List<GridPoint> pType = pins(16, 64, -16, 32, 16, 0);
        OFFSETS.put(ComponentType.BJT_NPN, nType);
        OFFSETS.put(ComponentType.MOSFET_NMOS, nType);
        OFFSETS.put(ComponentType.BJT_PNP, pType);
        OFFSETS.put(ComponentType.MOSFET_PMOS, pType);
        // in-, in+, out
        OFFSETS.put(ComponentType.OP_AMP, pins(-32, -32, -32, 32, 32, 0));
        OFFSETS.put(ComponentType.VCVS, CONTROLLED);
        OFFSETS.put(ComponentType.CCVS, CONTROLLED);
        OFFSETS.put(ComponentType.VCCS, CONTROLLED);
        OFFSETS.put(ComponentType.CCCS, CONTROLLED);
        OFFSETS.put(ComponentType.GROUND, pins(0, 0));
    }

    private AscSymbolTable() { }

    private static void symbol(ComponentType type, String... names) {
        SYMBOL_FOR.put(type, names[0]);
        for (String n : names) BY_SYMBOL.put(n.toLowerCase(Locale.ROOT), type);
    }

    private static List<GridPoint> pins(int... xy) {
        GridPoint[] out = new GridPoint[xy.length / 2];
        for (int i = 0; i < out.length; i++) out[i] = new GridPoint(xy[2 * i], xy[2 * i + 1]);
        return List.of(out);
    }

    /**
     * Tipo de un símbolo. No distingue mayúsculas y descarta la ruta de librería
     * ({@code Opamps\opamp2} → {@code opamp2}).
     */
    public static Optional<ComponentType> typeFor(String symbolName) {
        if (symbolName == null) return Optional.empty();
        String s = symbolName.strip().replace('/', '\\');
        int cut = s.lastIndexOf('\\');
        if (cut >= 0) s = s.substring(cut + 1);
        return Optional.ofNullable(BY_SYMBOL.get(s.toLowerCase(Locale.ROOT)));
    }

    /** Símbolo preferido para exportar; vacío si el tipo no tiene símbolo LTspice. */
    public static Optional<String> symbolFor(ComponentType type) {
        return Optional.ofNullable(SYMBOL_FOR.get(type));
    }

    /** Desplazamientos de pin en R0, indexados por terminal. */
    public static List<GridPoint> pinOffsets(ComponentType type) {
        return OFFSETS.getOrDefault(type, TWO_PIN);
    }

    /** Posición absoluta del pin {@code terminal} de un símbolo colocado en {@code origin}. */
    public static GridPoint pinAt(ComponentType type, int terminal, GridPoint origin, Orientation o) {
        return origin.plus(o.apply(pinOffsets(type).get(terminal)));
    }
}
