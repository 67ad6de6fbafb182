package com.spicegui.file.importer;

import com.spicegui.file.CircuitImportException;

/** El esquemático LTspice no se puede leer o no contiene componentes. */
public class AscParseException extends CircuitImportException {

    public AscParseException(String message) {
        super(message);
    }

    public AscParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
