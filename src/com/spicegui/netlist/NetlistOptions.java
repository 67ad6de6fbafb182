package com.spicegui.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Opciones de generación que no forman parte del circuito.
 */
public final class NetlistOptions {

    public static final String DEFAULT_TITLE = "My Test Circuit";

    private final String title;
    private final Map<String, String> spiceOptions;
    private final List<String> measurements;
    private final String outputFile;
    private final boolean controlBlock;

    private NetlistOptions(Builder b) {
        this.title = b.title;
        this.spiceOptions = Collections.unmodifiableMap(new LinkedHashMap<>(b.spiceOptions));
        this.measurements = List.copyOf(b.measurements);
        this.outputFile = b.outputFile;
        this.controlBlock = b.controlBlock;
    }

    public static NetlistOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Primera línea de la netlist. */
    public String title() { return title; }

    /** Pares para la línea {@code .options}; vacío = no se emite. */
    public Map<String, String> spiceOptions() { return spiceOptions; }

    /** Directivas {@code .meas}, con o sin el prefijo. */
    public List<String> measurements() { return measurements; }

    /** Archivo para {@code wrdata} dentro del bloque de control, o {@code null}. */
    public String outputFile() { return outputFile; }

    /** Si se emite el bloque {@code .control} para ejecución por lotes. */
    public boolean controlBlock() { return controlBlock; }

    public static final class Builder {
        private String title = DEFAULT_TITLE;
        private final Map<String, String> spiceOptions = new LinkedHashMap<>();
        private final List<String> measurements = new ArrayList<>();
        private String outputFile;
        private boolean controlBlock;

        private Builder() { }

        public Builder title(String title) {
            this.title = (title == null || title.isBlank()) ? DEFAULT_TITLE : title.strip();
            return this;
        }

        public Builder option(String key, String value) {
            spiceOptions.put(key, value);
            return this;
        }

        public Builder options(Map<String, String> options) {
            if (options != null) spiceOptions.putAll(options);
            return this;
        }

        public Builder measurement(String directive) {
            if (directive != null && !directive.isBlank()) measurements.add(directive.strip());
            return this;
        }

        public Builder measurements(List<String> directives) {
            if (directives != null) directives.forEach(this::measurement);
            return this;
        }

        /** Activa el bloque de control y escribe los resultados en {@code path}. */
        public Builder outputFile(String path) {
            this.outputFile = path;
            this.controlBlock = path != null;
            return this;
        }

        public Builder controlBlock(boolean enabled) {
            this.controlBlock = enabled;
            return this;
        }

        public NetlistOptions build() {
            return new NetlistOptions(this);
        }
    }
}
