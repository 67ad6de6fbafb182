package com.spicegui.file.importer;

import com.spicegui.file.CircuitImportException;

/** La netlist SPICE está vacía o no contiene componentes reconocibles. */
public class NetlistParseException extends CircuitImportException {

    public NetlistParseException(String message) {
        super(message);
    }
}
