package com.spicegui.comp;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Tipos de componente soportados por el editor.
 * <p>
 * El nombre visible ({@link #displayName()}) es el identificador canónico; el nombre de
 * clase ({@link #className()}) es el que usan los archivos de circuito antiguos.
 */
public enum ComponentType {
    RESISTOR("Resistor", "Resistor"),
    CAPACITOR("Capacitor", "Capacitor"),
    INDUCTOR("Inductor", "Inductor"),
    VOLTAGE_SOURCE("Voltage Source", "VoltageSource"),
    CURRENT_SOURCE("Current Source", "CurrentSource"),
    WAVEFORM_SOURCE("Waveform Source", "WaveformVoltageSource"),
    GROUND("Ground", "Ground"),
    OP_AMP("Op-Amp", "OpAmp"),
    VCVS("VCVS", "VoltageControlledVoltageSource"),
    CCVS("CCVS", "CurrentControlledVoltageSource"),
    VCCS("VCCS", "VoltageControlledCurrentSource"),
    CCCS("CCCS", "CurrentControlledCurrentSource"),
    BJT_NPN("BJT NPN", "BJTNPN"),
    BJT_PNP("BJT PNP", "BJTPNP"),
    MOSFET_NMOS("MOSFET NMOS", "MOSFETNMOS"),
    MOSFET_PMOS("MOSFET PMOS", "MOSFETPMOS"),
    VC_SWITCH("VC Switch", "VCSwitch"),
    DIODE("Diode", "Diode"),
    LED("LED", "LED"),
    ZENER_DIODE("Zener Diode", "ZenerDiode"),
    TRANSFORMER("Transformer", "Transformer"),
    SUBCIRCUIT("Subcircuit", "Subcircuit");

    private static final Map<String, ComponentType> BY_NAME = new HashMap<>();
    static {
        for (ComponentType t : values()) {
            BY_NAME.put(t.displayName.toLowerCase(Locale.ROOT), t);
            BY_NAME.put(t.className.toLowerCase(Locale.ROOT), t);
        }
    }

    private final String displayName;
    private final String className;

    ComponentType(String displayName, String className) {
        this.displayName = displayName;
        this.className = className;
    }

    public String displayName() { return displayName; }

    public String className() { return className; }

    public boolean acceptsInitialCondition() {
        return this == CAPACITOR || this == INDUCTOR;
    }

    /**
     * Busca un tipo por nombre visible o por nombre de clase (sin distinguir mayúsculas).
     * @param name "Voltage Source", "VoltageSource", "op-amp"...
     * @return el tipo, o vacío si no se reconoce
     */
    public static Optional<ComponentType> fromName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() { return displayName; }
}
