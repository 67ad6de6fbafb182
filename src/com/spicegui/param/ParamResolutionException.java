package com.spicegui.param;

import java.util.List;

/**
 * No se pudieron resolver los parámetros: hay dependencias circulares o referencias a
 * nombres sin definir.
 */
public class ParamResolutionException extends RuntimeException {

    private final List<String> unresolved;

    public ParamResolutionException(List<String> unresolved) {
        super("Cannot resolve parameters (circular or undefined): " + String.join(", ", unresolved));
        this.unresolved = List.copyOf(unresolved);
    }

    /** Nombres pendientes, ordenados. */
    public List<String> getUnresolved() {
        return unresolved;
    }
}
