package com.spicegui.netlist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tipo de análisis más sus parámetros textuales ("step", "duration", "fStart"...).
 */
public record Analysis(AnalysisType type, Map<String, String> params) {

    public static final Analysis OPERATING_POINT = new Analysis(AnalysisType.OPERATING_POINT, Map.of());

    public Analysis {
        Objects.requireNonNull(type, "type");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public String param(String key) {
        return params.get(key);
    }

    public String param(String key, String fallback) {
        String v = params.get(key);
        return (v == null || v.isBlank()) ? fallback : v;
    }

    public boolean has(String key) {
        String v = params.get(key);
        return v != null && !v.isBlank();
    }
}
