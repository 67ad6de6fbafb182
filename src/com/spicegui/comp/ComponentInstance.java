package com.spicegui.comp;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Un componente colocado en el circuito.
 * <p>
 * El id y el tipo son inmutables; el resto lo edita el usuario. La posición y la
 * orientación sólo importan a la capa gráfica y al exportador .asc.
 */
public final class ComponentInstance {

    /** Posición en coordenadas de escena. */
    public record Position(double x, double y) {
        public static final Position ORIGIN = new Position(0, 0);
    }

    private final String id;
    private final ComponentType type;
    private String value;
    private Position position = Position.ORIGIN;
    private int rotation;
    private boolean flipH;
    private boolean flipV;
    private boolean locked;
    private String initialCondition;

    // Waveform Source
    private String waveformType;
    private Map<String, Map<String, String>> waveformParams;

    // Subcircuit
    private String subcircuitName;
    private List<String> subcircuitPins = List.of();
    private String subcircuitDefinition;

    public ComponentInstance(String id, ComponentType type, String value) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id vacío");
        this.id = id;
        this.type = Objects.requireNonNull(type, "type");
        this.value = value == null ? "" : value;
        if (type == ComponentType.WAVEFORM_SOURCE) {
            this.waveformType = WaveformSpec.SIN;
            this.waveformParams = WaveformSpec.defaultParams();
        }
    }

    /** Crea el componente con el valor por defecto del catálogo. */
    public static ComponentInstance withDefaults(String id, ComponentType type, ComponentCatalog catalog) {
        return new ComponentInstance(id, type, catalog.entry(type).defaultValue());
    }

    public String id() { return id; }
    public ComponentType type() { return type; }

    public String value() { return value; }
    public void setValue(String value) { this.value = value == null ? "" : value; }

    public Position position() { return position; }
    public void setPosition(Position position) { this.position = Objects.requireNonNull(position); }
    public void setPosition(double x, double y) { this.position = new Position(x, y); }

    public int rotation() { return rotation; }

    /** @param rotation grados; se normaliza a 0/90/180/270 */
    public void setRotation(int rotation) {
        int r = ((rotation % 360) + 360) % 360;
        if (r % 90 != 0) throw new IllegalArgumentException("Rotación no múltiplo de 90: " + rotation);
        this.rotation = r;
    }

    public boolean flipH() { return flipH; }
    public void setFlipH(boolean flipH) { this.flipH = flipH; }

    public boolean flipV() { return flipV; }
    public void setFlipV(boolean flipV) { this.flipV = flipV; }

    public boolean locked() { return locked; }
    public void setLocked(boolean locked) { this.locked = locked; }

    public String initialCondition() { return initialCondition; }

    public void setInitialCondition(String ic) {
        this.initialCondition = (ic == null || ic.isBlank()) ? null : ic.trim();
    }

    public String waveformType() { return waveformType; }
    public void setWaveformType(String waveformType) { this.waveformType = waveformType; }

    public Map<String, Map<String, String>> waveformParams() { return waveformParams; }

    public void setWaveformParams(Map<String, Map<String, String>> params) {
        if (params == null) {
            this.waveformParams = null;
            return;
        }
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        params.forEach((k, v) -> copy.put(k, new LinkedHashMap<>(v)));
        this.waveformParams = copy;
    }

    public String subcircuitName() { return subcircuitName; }
    public void setSubcircuitName(String subcircuitName) { this.subcircuitName = subcircuitName; }

    public List<String> subcircuitPins() { return subcircuitPins; }

    public void setSubcircuitPins(List<String> pins) {
        this.subcircuitPins = pins == null ? List.of() : List.copyOf(pins);
    }

    public String subcircuitDefinition() { return subcircuitDefinition; }
    public void setSubcircuitDefinition(String def) { this.subcircuitDefinition = def; }

    /**
     * Valor SPICE efectivo: para las fuentes de forma de onda se arma la función a partir
     * de los parámetros guardados; en cualquier otro caso es {@link #value()}.
     */
    public String spiceValue() {
        if (type != ComponentType.WAVEFORM_SOURCE || waveformParams == null) return value;
        String fn = waveformType == null ? WaveformSpec.SIN : waveformType;
        Map<String, String> p = waveformParams.get(fn);
        if (p == null) return value;
        return WaveformSpec.toSpice(fn, p).orElse(value);
    }

    @Override
    public String toString() {
        return "ComponentInstance{" + id + ", " + type.displayName() + ", '" + value + "'}";
    }
}
