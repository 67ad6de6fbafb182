package com.spicegui.util;

import java.util.OptionalInt;

public final class StringUtil {
    private StringUtil() { }

    /* ================== FORMATO ================== */

    /**
     * Sustituye {@code %s} (secuencial) y {@code %$1}..{@code %$9} (posicional) en un
     * mensaje de recursos. {@code %%} produce un '%'; cualquier otro '%' queda literal.
     */
    public static String format(String fmt, String... args) {
        if (fmt == null) return "";
        StringBuilder ret = new StringBuilder(fmt.length() + 16);
        int seq = 0;
        int i = 0;
        while (i < fmt.length()) {
            char c = fmt.charAt(i);
            if (c != '%' || i + 1 >= fmt.length()) {
                ret.append(c);
                i++;
                continue;
            }
            char k = fmt.charAt(i + 1);
            if (k == 's') {
                ret.append(arg(args, seq++));
                i += 2;
            } else if (k == '%') {
                ret.append('%');
                i += 2;
            } else if (k == '$' && i + 2 < fmt.length() && Character.isDigit(fmt.charAt(i + 2))
                    && fmt.charAt(i + 2) != '0') {
                ret.append(arg(args, fmt.charAt(i + 2) - '1'));
                i += 3;
            } else {
                ret.append('%');
                i++;
            }
        }
        return ret.toString();
    }

    private static String arg(String[] args, int idx) {
        if (args == null || idx < 0 || idx >= args.length || args[idx] == null) return "(null)";
        return args[idx];
    }

    /* ================== IDENTIFICADORES ================== */

    /** Número al final de un id: "R12" → 12, "Vin" → vacío. */
    public static OptionalInt trailingNumber(String id) {
        if (id == null || id.isEmpty()) return OptionalInt.empty();
        int end = id.length();
        int start = end;
        while (start > 0 && Character.isDigit(id.charAt(start - 1))) start--;
        if (start == end) return OptionalInt.empty();
        String digits = id.substring(start, end);
        // ids absurdamente largos no cuentan
        if (digits.length() > 9) return OptionalInt.empty();
        return OptionalInt.of(Integer.parseInt(digits));
    }
}
