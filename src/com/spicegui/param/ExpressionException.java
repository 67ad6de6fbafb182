package com.spicegui.param;

/** Expresión mal formada o que no se puede evaluar con los nombres disponibles. */
public class ExpressionException extends IllegalArgumentException {
    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
