package com.spicegui.file;

/**
 * Error fatal al importar un circuito: el texto no produce ningún componente o su
 * estructura no se puede interpretar. Los problemas por línea van al {@link WarningCollector}.
 */
public class CircuitImportException extends RuntimeException {

    public CircuitImportException(String message) {
        super(message);
    }

    public CircuitImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
