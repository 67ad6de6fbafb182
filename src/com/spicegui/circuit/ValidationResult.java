package com.spicegui.circuit;

import java.util.List;

/**
 * Resultado de {@link CircuitValidator}: los errores impiden simular, los avisos no.
 */
public record ValidationResult(List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
