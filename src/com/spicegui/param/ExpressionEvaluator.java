package com.spicegui.param;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.Function;

/**
 * Evaluador aritmético para expresiones de parámetros ({@code R2/R1}, {@code 1/(2*pi*R*C)}).
 * <p>
 * Sólo admite números (con sufijo SPICE), nombres, {@code + - * / %}, potencia
 * ({@code **} o {@code ^}), paréntesis y las funciones de {@link #FUNCTIONS}. No hay
 * efectos laterales ni acceso a nada fuera del espacio de nombres recibido.
 */
public final class ExpressionEvaluator {

    /** Constantes predefinidas; un parámetro con el mismo nombre las oculta. */
    public static final Map<String, Double> CONSTANTS = Map.of("pi", Math.PI, "e", Math.E);

    static final Map<String, Function<double[], Double>> FUNCTIONS;
    static {
        Map<String, Function<double[], Double>> f = new HashMap<>();
        f.put("sqrt",  a -> Math.sqrt(arity(a, 1, "sqrt")[0]));
        f.put("abs",   a -> Math.abs(arity(a, 1, "abs")[0]));
        f.put("log",   ExpressionEvaluator::log);
        f.put("log10", a -> Math.log10(arity(a, 1, "log10")[0]));
        f.put("exp",   a -> Math.exp(arity(a, 1, "exp")[0]));
        f.put("sin",   a -> Math.sin(arity(a, 1, "sin")[0]));
        f.put("cos",   a -> Math.cos(arity(a, 1, "cos")[0]));
        f.put("tan",   a -> Math.tan(arity(a, 1, "tan")[0]));
        f.put("pow",   a -> pow(arity(a, 2, "pow")[0], a[1]));
        f.put("min",   a -> fold(a, "min", Math::min));
        f.put("max",   a -> fold(a, "max", Math::max));
        FUNCTIONS = Map.copyOf(f);
    }

    private final String src;
    private final Map<String, Double> names;
    private int pos;

    private ExpressionEvaluator(String src, Map<String, Double> names) {
        this.src = src;
        this.names = names;
    }

    /**
     * Evalúa una expresión.
     * @param expression texto sin llaves
     * @param names      parámetros ya resueltos
     * @throws ExpressionException si la sintaxis es inválida, falta un nombre o el resultado no es finito
     */
    public static double evaluate(String expression, Map<String, Double> names) {
        Objects.requireNonNull(expression, "expression");
        ExpressionEvaluator p = new ExpressionEvaluator(expression, names == null ? Map.of() : names);
        double v = p.parseExpr();
        p.skipSpaces();
        if (p.pos < p.src.length()) {
            throw p.error("Unexpected '" + p.src.charAt(p.pos) + "'");
        }
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new ExpressionException("Expression '" + expression + "' does not evaluate to a finite number");
        }
        return v;
    }

    /* ===== Gramática ===== */

    // expr := term (('+'|'-') term)*
    private double parseExpr() {
        double v = parseTerm();
        while (true) {
            if (accept('+')) v += parseTerm();
            else if (accept('-')) v -= parseTerm();
            else return v;
        }
    }

    // term := unary (('*'|'/'|'%') unary)*
    private double parseTerm() {
        double v = parseUnary();
        while (true) {
            skipSpaces();
            if (peekIs("**")) return v;
            if (accept('*')) {
                v *= parseUnary();
            } else if (accept('/')) {
                double d = parseUnary();
                if (d == 0) throw error("Division by zero");
                v /= d;
            } else if (accept('%')) {
                double d = parseUnary();
                if (d == 0) throw error("Modulo by zero");
                v = v - d * Math.floor(v / d);
            } else {
                return v;
            }
        }
    }

    // unary := ('+'|'-') unary | power
    private double parseUnary() {
        if (accept('-')) return -parseUnary();
        if (accept('+')) return parseUnary();
        return parsePower();
    }

    // power := primary (('**'|'^') unary)?   asociativa por la derecha
    private double parsePower() {
        double base = parsePrimary();
        skipSpaces();
        if (peekIs("**")) {
            pos += 2;
            return pow(base, parseUnary());
        }
        if (accept('^')) return pow(base, parseUnary());
        return base;
    }

    private double parsePrimary() {
        skipSpaces();
        if (pos >= src.length()) throw error("Unexpected end of expression");
        char c = src.charAt(pos);
        if (accept('(')) {
            double v = parseExpr();
            expect(')');
            return v;
        }
        if (Character.isDigit(c) || c == '.') return parseNumber();
        if (Character.isLetter(c) || c == '_') {
            String name = parseIdent();
            skipSpaces();
            if (accept('(')) return call(name, parseArgs());
            Double v = names.get(name);
            if (v == null) v = CONSTANTS.get(name);
            if (v == null) throw new ExpressionException("Undefined parameter: '" + name + "'");
            return v;
        }
        throw error("Unexpected '" + c + "'");
    }

    private double parseNumber() {
        int start = pos;
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '.')) pos++;
        // exponente sólo si le sigue un dígito: "2e" es 2 con unidad "e"
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) pos++;
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                while (pos < src.length() && Character.isDigit(src.charAt(pos))) pos++;
            } else {
                pos = save;
            }
        }
        String mantissa = src.substring(start, pos);
        int tailStart = pos;
        while (pos < src.length() && Character.isLetter(src.charAt(pos))) pos++;
        try {
            return Double.parseDouble(mantissa) * SpiceValues.multiplier(src.substring(tailStart, pos));
        } catch (NumberFormatException ex) {
            throw new ExpressionException("Bad number '" + mantissa + "' in '" + src + "'", ex);
        }
    }

    private String parseIdent() {
        int start = pos;
        while (pos < src.length()
                && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        return src.substring(start, pos);
    }

    private double[] parseArgs() {
        List<Double> args = new ArrayList<>();
        skipSpaces();
        if (!accept(')')) {
            do {
                args.add(parseExpr());
            } while (accept(','));
            expect(')');
        }
        double[] out = new double[args.size()];
        for (int i = 0; i < out.length; i++) out[i] = args.get(i);
        return out;
    }

    private double call(String name, double[] args) {
        Function<double[], Double> fn = FUNCTIONS.get(name);
        if (fn == null) throw new ExpressionException("Unknown function: '" + name + "'");
        return fn.apply(args);
    }

    /* ===== Léxico ===== */

    private void skipSpaces() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) pos++;
    }

    private boolean accept(char c) {
        skipSpaces();
        if (pos < src.length() && src.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean peekIs(String s) {
        return src.startsWith(s, pos);
    }

    private void expect(char c) {
        if (!accept(c)) throw error("Expected '" + c + "'");
    }

    private ExpressionException error(String msg) {
        return new ExpressionException("Invalid expression: '" + src + "' (" + msg + " at " + pos + ")");
    }

    /* ===== Funciones ===== */

    private static double[] arity(double[] a, int n, String name) {
        if (a.length != n) {
            throw new ExpressionException(name + "() takes " + n + " argument(s), got " + a.length);
        }
        return a;
    }

    private static double log(double[] a) {
        if (a.length == 1) return Math.log(a[0]);
        if (a.length == 2) return Math.log(a[0]) / Math.log(a[1]);
        throw new ExpressionException("log() takes 1 or 2 arguments, got " + a.length);
    }

    private static double pow(double base, double exp) {
        return Math.pow(base, exp);
    }

    private static double fold(double[] a, String name, DoubleBinaryOperator op) {
        if (a.length == 0) throw new ExpressionException(name + "() needs at least one argument");
        double v = a[0];
        for (int i = 1; i < a.length; i++) v = op.applyAsDouble(v, a[i]);
        return v;
    }
}
