package com.spicegui.comp;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Modelos de amplificador operacional incluidos en el editor.
 * <p>
 * Cada modelo es un subcircuito de tres pines {@code inp inn out}. "Ideal" es una fuente
 * controlada de ganancia alta; el resto son macromodelos de un polo.
 */
public final class OpAmpModels {

    public static final String IDEAL = "Ideal";

    /** Modelo → nombre del .subckt emitido. */
    private static final Map<String, String> SUBCKT_NAMES = new LinkedHashMap<>();
    private static final Map<String, String> DEFINITIONS = new LinkedHashMap<>();

    static {
        SUBCKT_NAMES.put(IDEAL, "OPAMP_IDEAL");
        DEFINITIONS.put(IDEAL, String.join("\n",
                ".subckt OPAMP_IDEAL inp inn out",
                "E_amp out 0 inp inn 1e6",
                "R_out out 0 1e-3",
                ".ends"));
        singlePole("LM741", "behavioral model", "GBW ~1 MHz, DC gain ~200k, Rout ~75 ohm",
                "2e6", "2e5", "159e-12", "75");
        singlePole("TL081", "JFET-input behavioral model", "GBW ~4 MHz, DC gain ~200k, Rout ~50 ohm",
                "1e12", "2e5", "39.8e-12", "50");
        singlePole("LM358", "behavioral model", "GBW ~1 MHz, DC gain ~100k, Rout ~50 ohm",
                "2e6", "1e5", "159e-12", "50");
    }

    private OpAmpModels() { }

    private static void singlePole(String name, String kind, String summary,
                                   String rin, String gain, String cpole, String rout) {
        SUBCKT_NAMES.put(name, name);
        DEFINITIONS.put(name, String.join("\n",
                ".subckt " + name + " inp inn out",
                "* Simplified " + name + " " + kind,
                "* " + summary,
                "Rin inp inn " + rin,
                "E1 int1 0 inp inn " + gain,
                "R1 int1 int2 1e6",
                "C1 int2 0 " + cpole,
                "E2 int3 0 int2 0 1",
                "Rout int3 out " + rout,
                ".ends"));
    }

    public static List<String> models() {
        return List.copyOf(SUBCKT_NAMES.keySet());
    }

    /** Modelo normalizado: un valor desconocido cae en {@link #IDEAL}. */
    public static String normalize(String model) {
        if (model != null) {
            for (String m : SUBCKT_NAMES.keySet()) {
                if (m.equalsIgnoreCase(model.trim())) return m;
            }
        }
        return IDEAL;
    }

    public static String subcktName(String model) {
        return SUBCKT_NAMES.get(normalize(model));
    }

    public static String definition(String model) {
        return DEFINITIONS.get(normalize(model));
    }

    /**
     * Modelo cuyo .subckt se llama {@code subcktName} (p.ej. "OPAMP_IDEAL" → "Ideal").
     * Cualquier nombre que contenga "OPAMP" se trata como el ideal.
     */
    public static Optional<String> forSubcktName(String subcktName) {
        if (subcktName == null) return Optional.empty();
        String up = subcktName.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, String> e : SUBCKT_NAMES.entrySet()) {
            if (e.getValue().equalsIgnoreCase(up)) return Optional.of(e.getKey());
        }
        if (up.contains("OPAMP")) return Optional.of(IDEAL);
        return Optional.empty();
    }
}
