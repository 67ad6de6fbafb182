package com.spicegui.netlist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Traducción entre {@link Analysis} y las directivas SPICE ({@code .op}, {@code .tran},
 * {@code .dc}, {@code .ac}, {@code .noise}, ...). La usan el generador y los dos importadores.
 */
public final class AnalysisDirectives {

    /* Valores por defecto del diálogo de análisis */
    static final String DEF_DC_MIN = "0", DEF_DC_MAX = "10", DEF_DC_STEP = "0.1";
    static final String DEF_AC_START = "1", DEF_AC_STOP = "1e6", DEF_AC_POINTS = "100", DEF_SWEEP = "dec";
    static final String DEF_TRAN_STOP = "10m", DEF_TRAN_STEP = "10u";
    static final String DEF_TEMP_START = "-40", DEF_TEMP_STOP = "85", DEF_TEMP_STEP = "25";
    static final String DEF_OUTPUT = "out", DEF_SOURCE = "V1";

    private AnalysisDirectives() { }

    /* ===================== Emisión ===================== */

    /**
     * Líneas de la directiva de análisis.
     * @param a                  análisis
     * @param firstVoltageSource nombre de tarjeta de la primera fuente de tensión, si hay
     */
    public static List<String> emit(Analysis a, Optional<String> firstVoltageSource) {
        List<String> out = new ArrayList<>();
        switch (a.type()) {
            case OPERATING_POINT -> out.add(".op");
            case DC_SWEEP -> {
                Optional<String> src = a.has("source") ? Optional.of(a.param("source")) : firstVoltageSource;
                if (src.isEmpty()) {
                    out.add("* Warning: DC Sweep requires a voltage source");
                    out.add(".op");
                } else {
                    out.add(".dc " + src.get() + " " + a.param("min", DEF_DC_MIN) + " "
                            + a.param("max", DEF_DC_MAX) + " " + a.param("step", DEF_DC_STEP));
                }
            }
            case AC_SWEEP -> out.add(".ac " + sweepType(a) + " " + a.param("points", DEF_AC_POINTS) + " "
                    + a.param("fStart", DEF_AC_START) + " " + a.param("fStop", DEF_AC_STOP));
            case TRANSIENT -> {
                StringBuilder sb = new StringBuilder(".tran ")
                        .append(a.param("step", DEF_TRAN_STEP)).append(' ')
                        .append(a.param("duration", DEF_TRAN_STOP));
                String start = a.has("start") ? a.param("start") : a.param("startTime");
                if (start != null && !start.isBlank()) sb.append(' ').append(start.trim());
                out.add(sb.toString());
            }
            case TEMPERATURE_SWEEP -> {
                out.add(".op");
                out.add(".step temp " + a.param("tempStart", DEF_TEMP_START) + " "
                        + a.param("tempStop", DEF_TEMP_STOP) + " " + a.param("tempStep", DEF_TEMP_STEP));
            }
            case NOISE -> out.add(".noise v(" + a.param("output_node", DEF_OUTPUT) + ") "
                    + a.param("source", firstVoltageSource.orElse(DEF_SOURCE)) + " "
                    + sweepType(a) + " " + a.param("points", DEF_AC_POINTS) + " "
                    + a.param("fStart", DEF_AC_START) + " " + a.param("fStop", DEF_AC_STOP));
            case SENSITIVITY -> out.add(".sens v(" + a.param("output_node", DEF_OUTPUT) + ")");
            case TRANSFER_FUNCTION -> out.add(".tf v(" + a.param("output_node", DEF_OUTPUT) + ") "
                    + a.param("source", firstVoltageSource.orElse(DEF_SOURCE)));
            case POLE_ZERO -> out.add(".pz " + a.param("input_pos", "1") + " " + a.param("input_neg", "0") + " "
                    + a.param("output_pos", "2") + " " + a.param("output_neg", "0") + " "
                    + a.param("transfer_type", "vol") + " " + a.param("pz_type", "pz"));
        }
        return out;
    }

    private static String sweepType(Analysis a) {
        return a.has("sweepType") ? a.param("sweepType") : a.param("sweep_type", DEF_SWEEP);
    }

    /* ===================== Lectura ===================== */

    /**
     * Interpreta una línea de directiva. Las que no son de análisis devuelven vacío.
     * <p>
     * {@code .tran} sigue la sintaxis SPICE ({@code paso parada [inicio]}); con un solo
     * argumento éste es la duración y también el paso.
     */
    public static Optional<Analysis> parse(String line) {
        if (line == null) return Optional.empty();
        String[] tok = line.trim().split("\\s+");
        if (tok.length == 0 || !tok[0].startsWith(".")) return Optional.empty();
        String kw = tok[0].toLowerCase(Locale.ROOT);
        Map<String, String> p = new LinkedHashMap<>();
        switch (kw) {
            case ".op":
                return Optional.of(Analysis.OPERATING_POINT);
            case ".tran": {
                List<String> nums = new ArrayList<>();
                for (int i = 1; i < tok.length; i++) {
                    if (!tok[i].equalsIgnoreCase("uic")) nums.add(tok[i]);
                }
                if (nums.size() == 1) {
                    p.put("step", nums.get(0));
                    p.put("duration", nums.get(0));
                } else if (nums.size() >= 2) {
                    p.put("step", nums.get(0));
                    p.put("duration", nums.get(1));
                    if (nums.size() >= 3) p.put("start", nums.get(2));
                }
                return Optional.of(new Analysis(AnalysisType.TRANSIENT, p));
            }
            case ".ac":
                if (tok.length >= 5) {
                    p.put("sweep_type", tok[1]);
                    p.put("points", tok[2]);
                    p.put("fStart", tok[3]);
                    p.put("fStop", tok[4]);
                }
                return Optional.of(new Analysis(AnalysisType.AC_SWEEP, p));
            case ".dc":
                if (tok.length >= 5) {
                    p.put("source", tok[1]);
                    p.put("min", tok[2]);
                    p.put("max", tok[3]);
                    p.put("step", tok[4]);
                }
                return Optional.of(new Analysis(AnalysisType.DC_SWEEP, p));
            case ".noise":
                if (tok.length >= 7) {
                    p.put("output_node", probe(tok[1]));
                    p.put("source", tok[2]);
                    p.put("sweep_type", tok[3]);
                    p.put("points", tok[4]);
                    p.put("fStart", tok[5]);
                    p.put("fStop", tok[6]);
                }
                return Optional.of(new Analysis(AnalysisType.NOISE, p));
            case ".sens":
                if (tok.length >= 2) p.put("output_node", probe(tok[1]));
                return Optional.of(new Analysis(AnalysisType.SENSITIVITY, p));
            case ".tf":
                if (tok.length >= 3) {
                    p.put("output_node", probe(tok[1]));
                    p.put("source", tok[2]);
                }
                return Optional.of(new Analysis(AnalysisType.TRANSFER_FUNCTION, p));
            case ".pz":
                if (tok.length >= 7) {
                    p.put("input_pos", tok[1]);
                    p.put("input_neg", tok[2]);
                    p.put("output_pos", tok[3]);
                    p.put("output_neg", tok[4]);
                    p.put("transfer_type", tok[5]);
                    p.put("pz_type", tok[6]);
                }
                return Optional.of(new Analysis(AnalysisType.POLE_ZERO, p));
            case ".step":
                if (tok.length >= 5 && tok[1].equalsIgnoreCase("temp")) {
                    p.put("tempStart", tok[2]);
                    p.put("tempStop", tok[3]);
                    p.put("tempStep", tok[4]);
                    return Optional.of(new Analysis(AnalysisType.TEMPERATURE_SWEEP, p));
                }
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    /** "v(out)" → "out"; "v(out,ref)" → "out". */
    private static String probe(String token) {
        String t = token.trim();
        int open = t.indexOf('(');
        int close = t.lastIndexOf(')');
        if (open >= 0 && close > open) t = t.substring(open + 1, close);
        int comma = t.indexOf(',');
        return comma >= 0 ? t.substring(0, comma).trim() : t;
    }
}
