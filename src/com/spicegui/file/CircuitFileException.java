package com.spicegui.file;

/** Fallo al leer o escribir un archivo de circuito (.json, .asc). */
public class CircuitFileException extends RuntimeException {

    public CircuitFileException(String message) {
        super(message);
    }

    public CircuitFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
