package com.spicegui.file.importer;

import java.util.ArrayList;
import java.util.List;

/**
 * Utilidades léxicas para líneas SPICE.
 */
final class SpiceTokenizer {

    private SpiceTokenizer() { }

    /**
     * Separa por espacios, pero un tramo entre paréntesis es un solo token:
     * {@code "Vin 1 0 SIN(0 5 1k)"} → {@code [Vin, 1, 0, SIN(0 5 1k)]}.
     */
    static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '(') {
                depth++;
                cur.append(ch);
            } else if (ch == ')') {
                depth = Math.max(0, depth - 1);
                cur.append(ch);
            } else if (Character.isWhitespace(ch) && depth == 0) {
                if (cur.length() > 0) {
                    tokens.add(cur.toString());
                    cur.setLength(0);
                }
            } else {
                cur.append(ch);
            }
        }
        if (cur.length() > 0) tokens.add(cur.toString());
        return tokens;
    }

    /** Quita los comentarios en línea: {@code ;} y {@code $} precedido de espacio. */
    static String stripInlineComment(String line) {
        int cut = line.indexOf(';');
        for (int i = 1; i < line.length(); i++) {
            if (line.charAt(i) == '$' && Character.isWhitespace(line.charAt(i - 1))) {
                if (cut < 0 || i < cut) cut = i;
                break;
            }
        }
        return (cut >= 0 ? line.substring(0, cut) : line).strip();
    }

    /**
     * Une las líneas de continuación ({@code +} al principio) con la anterior.
     */
    static List<String> joinContinuations(List<String> lines) {
        List<String> out = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.startsWith("+") && !out.isEmpty()) {
                int last = out.size() - 1;
                out.set(last, out.get(last) + " " + line.substring(1).strip());
            } else {
                out.add(line);
            }
        }
        return out;
    }
}
