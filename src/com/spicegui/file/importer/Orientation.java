package com.spicegui.file.importer;

import java.util.Locale;
import java.util.Optional;

/**
 * Las ocho orientaciones de un símbolo LTspice: cuatro giros horarios, con o sin espejo.
 * El espejo (x → -x) se aplica antes del giro.
 */
public enum Orientation {
    R0(false, 0), R90(false, 90), R180(false, 180), R270(false, 270),
    M0(true, 0), M90(true, 90), M180(true, 180), M270(true, 270);

    private static final GridPoint UX = new GridPoint(1, 0);
    private static final GridPoint UY = new GridPoint(0, 1);

    private final boolean mirrored;
    private final int degrees;

    Orientation(boolean mirrored, int degrees) {
        this.mirrored = mirrored;
        this.degrees = degrees;
    }

    public boolean mirrored() { return mirrored; }

    public int degrees() { return degrees; }

    /** Código LTspice ("R90", "M0"...); vacío si no es válido. */
    public static Optional<Orientation> parse(String code) {
        if (code == null || code.isBlank()) return Optional.of(R0);
        try {
            return Optional.of(valueOf(code.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    /** Orientación de un componente del editor; el volteo vertical es espejo + 180. */
    public static Orientation of(int rotation, boolean flipH, boolean flipV) {
        int deg = ((rotation % 360) + 360) % 360;
        boolean m = flipH;
        if (flipV) {
            m = !m;
            deg = (deg + 180) % 360;
        }
        for (Orientation o : values()) {
            if (o.mirrored == m && o.degrees == deg) return o;
        }
        throw new IllegalArgumentException("Rotación no múltiplo de 90: " + rotation);
    }

    public GridPoint apply(GridPoint offset) {
        int dx = mirrored ? -offset.x() : offset.x();
        int dy = offset.y();
        return switch (degrees) {
            case 90 -> new GridPoint(dy, -dx);
            case 180 -> new GridPoint(-dx, -dy);
            case 270 -> new GridPoint(-dy, dx);
            default -> new GridPoint(dx, dy);
        };
    }

    /** Orientación equivalente a aplicar primero ésta y después {@code next}. */
    public Orientation then(Orientation next) {
        GridPoint ex = next.apply(apply(UX));
        GridPoint ey = next.apply(apply(UY));
        for (Orientation o : values()) {
            if (o.apply(UX).equals(ex) && o.apply(UY).equals(ey)) return o;
        }
        throw new IllegalStateException("Composición fuera del grupo: " + this + " · " + next);
    }

    public Orientation inverse() {
        for (Orientation o : values()) {
            if (then(o) == R0) return o;
        }
        throw new IllegalStateException("Sin inversa: " + this);
    }
}
