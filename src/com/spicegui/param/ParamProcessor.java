package com.spicegui.param;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Definiciones {@code .param} de una netlist parametrizada.
 * <p>
 * Guarda los valores crudos ("1k", "{Rf / Rin}") y los resuelve en pasadas sucesivas: en
 * cada pasada se evalúa lo que ya tiene sus dependencias resueltas. Si una pasada no
 * avanza, los nombres pendientes son circulares o referencian algo sin definir.
 *
 * <pre>
 * ParamProcessor p = new ParamProcessor();
 * p.define("Rin", "1k");
 * p.define("gain", "{Rf / Rin}");
 * p.define("Rf", "10k");
 * p.resolveAll();                  // {Rin=1000, Rf=10000, gain=10}
 * p.substitute("{gain * 2}");      // "20"
 * </pre>
 */
public final class ParamProcessor {

    private static final Logger log = LoggerFactory.getLogger(ParamProcessor.class);

    // .param nombre = valor [nombre = valor ...]
    private static final Pattern DIRECTIVE = Pattern.compile("^\\s*\\.param\\s+(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ASSIGNMENT = Pattern.compile("(\\w+)\\s*=\\s*(\\{[^}]*\\}|'[^']*'|\\S+)");
    private static final Pattern BRACED = Pattern.compile("\\{([^}]+)\\}");

    private final Map<String, String> raw = new LinkedHashMap<>();
    private final Map<String, Double> resolved = new LinkedHashMap<>();

    public ParamProcessor() { }

    /** Crea el procesador con definiciones ya existentes (p.ej. las guardadas en un circuito). */
    public ParamProcessor(Map<String, String> definitions) {
        definitions.forEach(this::define);
    }

    /**
     * Define (o redefine) un parámetro. Invalida la resolución anterior.
     * @param name  identificador
     * @param value valor SPICE o expresión entre llaves
     */
    public void define(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        raw.put(name, value.trim());
        resolved.clear();
    }

    /**
     * Extrae las directivas {@code .param} de un texto y las define. Una línea puede
     * llevar varias asignaciones.
     * @return nombres encontrados, en orden
     */
    public List<String> parseDirectives(String text) {
        List<String> names = new ArrayList<>();
        if (text == null) return names;
        for (String line : text.split("\\R")) {
            Matcher m = DIRECTIVE.matcher(line);
            if (!m.matches()) continue;
            Matcher a = ASSIGNMENT.matcher(m.group(1));
            while (a.find()) {
                String value = a.group(2);
                // 'expr' es la sintaxis de comillas de algunos simuladores
                if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
                    value = "{" + value.substring(1, value.length() - 1) + "}";
                }
                define(a.group(1), value);
                names.add(a.group(1));
            }
        }
        return names;
    }

    /**
     * Resuelve todos los parámetros.
     * @return nombre → valor numérico, en orden de definición
     * @throws ParamResolutionException con los nombres pendientes, ordenados
     */
    public Map<String, Double> resolveAll() {
        resolved.clear();
        Map<String, Double> namespace = new HashMap<>();
        Map<String, String> remaining = new LinkedHashMap<>(raw);

        int maxPasses = remaining.size() + 1;
        for (int pass = 0; pass < maxPasses && !remaining.isEmpty(); pass++) {
            boolean progress = false;
            Map<String, String> still = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : remaining.entrySet()) {
                try {
                    double v = resolveOne(e.getValue(), namespace);
                    resolved.put(e.getKey(), v);
                    namespace.put(e.getKey(), v);
                    progress = true;
                } catch (ExpressionException ex) {
                    log.trace("'{}' pendiente: {}", e.getKey(), ex.getMessage());
                    still.put(e.getKey(), e.getValue());
                }
            }
            remaining = still;
            if (!progress) break;
        }

        if (!remaining.isEmpty()) {
            List<String> stuck = new ArrayList<>(remaining.keySet());
            Collections.sort(stuck);
            resolved.clear();
            throw new ParamResolutionException(stuck);
        }
        // orden de definición, no de resolución
        Map<String, Double> ordered = new LinkedHashMap<>();
        for (String name : raw.keySet()) ordered.put(name, resolved.get(name));
        resolved.clear();
        resolved.putAll(ordered);
        return Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
    }

    private static double resolveOne(String rawValue, Map<String, Double> namespace) {
        String v = rawValue.trim();
        Matcher braced = BRACED.matcher(v);
        if (braced.matches()) return ExpressionEvaluator.evaluate(braced.group(1), namespace);
        if (SpiceValues.isNumeric(v)) return SpiceValues.parse(v);
        // expresión sin llaves ("R1*2")
        return ExpressionEvaluator.evaluate(v, namespace);
    }

    /**
     * Sustituye cada {@code {expr}} del texto por su valor formateado con sufijo. Usa la
     * última resolución; si no la hay, resuelve primero.
     * @throws ExpressionException si una expresión referencia algo sin definir
     */
    public String substitute(String text) {
        if (text == null || !isParametric(text)) return text;
        if (resolved.isEmpty() && !raw.isEmpty()) resolveAll();
        Map<String, Double> namespace = new HashMap<>(resolved);
        Matcher m = BRACED.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            double v = ExpressionEvaluator.evaluate(m.group(1), namespace);
            m.appendReplacement(sb, Matcher.quoteReplacement(SpiceValues.format(v)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Indica si el valor contiene alguna expresión entre llaves. */
    public boolean isParametric(String value) {
        return value != null && BRACED.matcher(value).find();
    }

    /** Líneas {@code .param nombre = valor}, ordenadas por nombre. */
    public List<String> emitDirectives() {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, String> e : new TreeMap<>(raw).entrySet()) {
            lines.add(".param " + e.getKey() + " = " + e.getValue());
        }
        return lines;
    }

    /** Definiciones crudas (copia). */
    public Map<String, String> rawParams() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    /** Última resolución (copia); vacía si no se ha resuelto. */
    public Map<String, Double> params() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }
}
