package com.spicegui.comp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parámetros de una fuente de forma de onda (SIN, PULSE, EXP, PWL).
 * <p>
 * Los importadores comparten {@link #find(String)} para decidir si el valor de una
 * fuente es una forma de onda: una de las funciones conocidas seguida de paréntesis.
 */
public final class WaveformSpec {

    public static final String SIN = "SIN";
    public static final String PULSE = "PULSE";
    public static final String EXP = "EXP";
    public static final String PWL = "PWL";

    /** Orden de los parámetros por función; PWL no tiene plantilla (se usa el valor tal cual). */
    private static final Map<String, List<String>> KEYS = Map.of(
            SIN,   List.of("offset", "amplitude", "frequency", "delay", "theta", "phase"),
            PULSE, List.of("v1", "v2", "td", "tr", "tf", "pw", "per"),
            EXP,   List.of("v1", "v2", "td1", "tau1", "td2", "tau2"));

    private static final Map<String, List<String>> DEFAULTS = Map.of(
            SIN,   List.of("0", "5", "1k", "0", "0", "0"),
            PULSE, List.of("0", "5", "0", "1n", "1n", "500u", "1m"),
            EXP,   List.of("0", "5", "0", "1u", "2u", "2u"));

    // SINE es el alias de LTspice para SIN
    private static final Pattern CALL = Pattern.compile(
            "\\b(SINE|SIN|PULSE|EXP|PWL)\\s*\\(", Pattern.CASE_INSENSITIVE);

    private WaveformSpec() { }

    /** Resultado de {@link #find}: función normalizada y texto desde la función en adelante. */
    public record Match(String type, String text) { }

    /**
     * Busca una llamada de forma de onda dentro de un valor de fuente.
     * @param value p.ej. "AC 1 SIN(0 1 1k)"
     * @return función (SINE se normaliza a SIN) y el sufijo que empieza en ella
     */
    public static Optional<Match> find(String value) {
        if (value == null) return Optional.empty();
        Matcher m = CALL.matcher(value);
        if (!m.find()) return Optional.empty();
        String fn = m.group(1).toUpperCase(Locale.ROOT);
        if (fn.equals("SINE")) fn = SIN;
        return Optional.of(new Match(fn, value.substring(m.start()).trim()));
    }

    public static boolean isWaveform(String value) {
        return find(value).isPresent();
    }

    /** Parámetros por defecto de todas las funciones con plantilla. */
    public static Map<String, Map<String, String>> defaultParams() {
        Map<String, Map<String, String>> all = new LinkedHashMap<>();
        for (String fn : List.of(SIN, PULSE, EXP)) {
            all.put(fn, zip(KEYS.get(fn), DEFAULTS.get(fn)));
        }
        return all;
    }

    /**
     * Extrae los parámetros de un valor como "PULSE(0 5 1u)". Los que faltan toman su
     * valor por defecto.
     * @return mapa nombre → valor, vacío para PWL o funciones desconocidas
     */
    public static Map<String, String> parseParams(String type, String value) {
        List<String> keys = KEYS.get(type);
        if (keys == null) return Map.of();
        List<String> given = parenArgs(value);
        List<String> defaults = DEFAULTS.get(type);
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            out.put(keys.get(i), i < given.size() ? given.get(i) : defaults.get(i));
        }
        return out;
    }

    /**
     * Construye la expresión SPICE de una forma de onda.
     * @param type   SIN / PULSE / EXP
     * @param params valores por nombre (los ausentes usan el defecto)
     * @return "SIN(0 5 1k 0 0 0)", o vacío si la función no tiene plantilla
     */
    public static Optional<String> toSpice(String type, Map<String, String> params) {
        List<String> keys = KEYS.get(type == null ? SIN : type.toUpperCase(Locale.ROOT));
        if (keys == null) return Optional.empty();
        String fn = type == null ? SIN : type.toUpperCase(Locale.ROOT);
        List<String> defaults = DEFAULTS.get(fn);
        Map<String, String> p = params == null ? Map.of() : params;
        StringBuilder sb = new StringBuilder(fn).append('(');
        for (int i = 0; i < keys.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(p.getOrDefault(keys.get(i), defaults.get(i)));
        }
        return Optional.of(sb.append(')').toString());
    }

    /** Argumentos separados por espacios (o comas) dentro del primer par de paréntesis. */
    static List<String> parenArgs(String text) {
        if (text == null) return List.of();
        int open = text.indexOf('(');
        int close = text.lastIndexOf(')');
        if (open < 0) return List.of();
        String inner = close > open ? text.substring(open + 1, close) : text.substring(open + 1);
        List<String> out = new ArrayList<>();
        for (String tok : inner.trim().split("[\\s,]+")) {
            if (!tok.isEmpty()) out.add(tok);
        }
        return out;
    }

    private static Map<String, String> zip(List<String> keys, List<String> values) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) m.put(keys.get(i), values.get(i));
        return m;
    }
}
