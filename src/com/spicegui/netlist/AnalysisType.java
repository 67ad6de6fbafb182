package com.spicegui.netlist;

import java.util.Optional;

/** Análisis que el generador sabe emitir. */
public enum AnalysisType {
    OPERATING_POINT("DC Operating Point"),
    DC_SWEEP("DC Sweep"),
    AC_SWEEP("AC Sweep"),
    TRANSIENT("Transient"),
    TEMPERATURE_SWEEP("Temperature Sweep"),
    NOISE("Noise"),
    SENSITIVITY("Sensitivity"),
    TRANSFER_FUNCTION("Transfer Function"),
    POLE_ZERO("Pole-Zero");

    private final String displayName;

    AnalysisType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }

    /** Acepta el nombre visible, el nombre de la constante y el alias antiguo "Operational Point". */
    public static Optional<AnalysisType> fromName(String name) {
        if (name == null) return Optional.empty();
        String n = name.trim();
        if (n.equalsIgnoreCase("Operational Point")) return Optional.of(OPERATING_POINT);
        for (AnalysisType t : values()) {
            if (t.displayName.equalsIgnoreCase(n) || t.name().equalsIgnoreCase(n)) return Optional.of(t);
        }
        return Optional.empty();
    }

    @Override public String toString() { return displayName; }
}
