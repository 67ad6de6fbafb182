package com.spicegui.param;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Números con sufijo SPICE ("4.7k", "2.2meg", "10u").
 */
public final class SpiceValues {

    /** Sufijo → multiplicador, de mayor a menor. */
    private static final Map<String, Double> SUFFIXES = new LinkedHashMap<>();
    static {
        SUFFIXES.put("t", 1e12);
        SUFFIXES.put("g", 1e9);
        SUFFIXES.put("meg", 1e6);
        SUFFIXES.put("k", 1e3);
        SUFFIXES.put("m", 1e-3);
        SUFFIXES.put("u", 1e-6);
        SUFFIXES.put("n", 1e-9);
        SUFFIXES.put("p", 1e-12);
        SUFFIXES.put("f", 1e-15);
    }

    private static final Pattern NUMBER = Pattern.compile(
            "([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)([a-zA-Z]*)");

    private SpiceValues() { }

    /**
     * Convierte un valor SPICE a double. Tras el sufijo se ignoran las letras de unidad,
     * como hace SPICE ("10uF", "5V", "1kohm").
     * @throws IllegalArgumentException si el texto no empieza por un número
     */
    public static double parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Empty value string");
        Matcher m = NUMBER.matcher(text.trim());
        if (!m.matches()) throw new IllegalArgumentException("Cannot parse SPICE value: '" + text + "'");
        return Double.parseDouble(m.group(1)) * multiplier(m.group(2));
    }

    /** Igual que {@link #parse} pero sin excepción. */
    public static boolean isNumeric(String text) {
        return text != null && NUMBER.matcher(text.trim()).matches();
    }

    /**
     * Multiplicador de la cola de letras tras un número: "meg" antes que "m", "mil" son
     * milésimas de pulgada, una letra desconocida es una unidad (×1).
     */
    static double multiplier(String tail) {
        if (tail == null || tail.isEmpty()) return 1.0;
        String t = tail.toLowerCase(Locale.ROOT);
        if (t.startsWith("meg")) return 1e6;
        if (t.startsWith("mil")) return 25.4e-6;
        Double mult = SUFFIXES.get(t.substring(0, 1));
        return mult == null ? 1.0 : mult;
    }

    /**
     * Formato compacto con sufijo: 4700 → "4.7k", 1e-6 → "1u", 0.5 → "500m".
     * Entre 1 y 1000 no hay sufijo; fuera del rango de sufijos se usa notación científica.
     */
    public static String format(double value) {
        if (value == 0) return "0";
        double abs = Math.abs(value);
        for (Map.Entry<String, Double> e : SUFFIXES.entrySet()) {
            double mult = e.getValue();
            if (abs >= mult && abs < mult * 1000) {
                double scaled = value / mult;
                if (scaled == Math.rint(scaled)) return (long) scaled + e.getKey();
                return significant(scaled, 4) + e.getKey();
            }
        }
        if (abs >= 1e-3 && abs < 1e6) {
            if (value == Math.rint(value)) return String.valueOf((long) value);
            return significant(value, 6);
        }
        return String.format(Locale.ROOT, "%.4e", value);
    }

    private static String significant(double v, int digits) {
        BigDecimal bd = new BigDecimal(v).round(new MathContext(digits)).stripTrailingZeros();
        return bd.toPlainString();
    }
}
