package com.spicegui.comp;

import java.util.Map;

/**
 * Tarjetas {@code .model} por defecto de los semiconductores y del interruptor.
 */
public final class DeviceModels {

    public static final String DEFAULT_NPN = "2N3904";
    public static final String DEFAULT_PNP = "2N3906";
    public static final String DEFAULT_NMOS = "NMOS1";
    public static final String DEFAULT_PMOS = "PMOS1";

    private static final Map<String, String> KNOWN_BJT = Map.of(
            DEFAULT_NPN, "NPN(BF=300 IS=1e-14 VAF=100)",
            DEFAULT_PNP, "PNP(BF=200 IS=1e-14 VAF=100)");

    private static final Map<String, String> KNOWN_MOS = Map.of(
            DEFAULT_NMOS, "NMOS(VTO=0.7 KP=110u)",
            DEFAULT_PMOS, "PMOS(VTO=-0.7 KP=50u)");

    private DeviceModels() { }

    /** Una tarjeta .model: nombre + cuerpo "TIPO(params)". */
    public record ModelCard(String name, String body) {
        public String line() { return ".model " + name + " " + body; }
    }

    public static ModelCard bjt(String name, boolean pnp) {
        String known = KNOWN_BJT.get(name);
        if (known != null && known.startsWith(pnp ? "PNP" : "NPN")) return new ModelCard(name, known);
        return new ModelCard(name, (pnp ? "PNP" : "NPN") + "(BF=100 IS=1e-14)");
    }

    public static ModelCard mosfet(String name, boolean pmos) {
        String known = KNOWN_MOS.get(name);
        if (known != null && known.startsWith(pmos ? "PMOS" : "NMOS")) return new ModelCard(name, known);
        return new ModelCard(name, pmos ? "PMOS(VTO=-0.7 KP=50u)" : "NMOS(VTO=0.7 KP=110u)");
    }

    /** Nombre base del modelo de diodo según la variante. */
    public static String diodeModelName(ComponentType type) {
        return switch (type) {
            case LED -> "D_LED";
            case ZENER_DIODE -> "D_Zener";
            default -> "D_Ideal";
        };
    }

    public static ModelCard diode(String name, String params) {
        return new ModelCard(name, "D(" + params.trim() + ")");
    }

    public static String switchModelName(String componentId) {
        return "SW_" + componentId;
    }

    public static ModelCard vSwitch(String componentId, String params) {
        return new ModelCard(switchModelName(componentId), "SW(" + params.trim() + ")");
    }

    /**
     * Indica si un valor es una lista de parámetros de modelo ("IS=1e-14 N=1") o un
     * nombre de modelo suelto ("1N4148").
     */
    public static boolean isParameterList(String value) {
        return value != null && value.contains("=");
    }
}
