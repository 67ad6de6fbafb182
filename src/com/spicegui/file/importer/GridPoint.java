package com.spicegui.file.importer;

/** Punto entero de un esquemático LTspice (también se usa como desplazamiento de pin). */
public record GridPoint(int x, int y) {

    public GridPoint plus(GridPoint d) {
        return new GridPoint(x + d.x, y + d.y);
    }

    /**
     * Indica si el punto cae dentro del segmento horizontal o vertical {@code a–b},
     * sin contar los extremos.
     */
    public boolean strictlyInside(GridPoint a, GridPoint b) {
        if (a.x == b.x && x == a.x) {
            return y > Math.min(a.y, b.y) && y < Math.max(a.y, b.y);
        }
        if (a.y == b.y && y == a.y) {
            return x > Math.min(a.x, b.x) && x < Math.max(a.x, b.x);
        }
        return false;
    }
}
