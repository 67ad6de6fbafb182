package com.spicegui.comp;

import java.util.List;
import java.util.Objects;

/**
 * Metadatos de un tipo de componente.
 *
 * @param type          tipo
 * @param spicePrefix   letra de la tarjeta SPICE ("R", "V", "X"...); vacío para Ground
 * @param idPrefix      prefijo para generar identificadores ("R", "VW", "OA", "GND"...)
 * @param terminalCount número de terminales en el esquemático
 * @param defaultValue  valor por defecto
 * @param pinOrder      orden de nodos SPICE respecto a los terminales
 * @param pinNames      nombre de cada terminal, en orden del esquemático
 */
public record CatalogEntry(ComponentType type,
                           String spicePrefix,
                           String idPrefix,
                           int terminalCount,
                           String defaultValue,
                           PinOrder pinOrder,
                           List<String> pinNames) {

    public CatalogEntry {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(spicePrefix, "spicePrefix");
        Objects.requireNonNull(idPrefix, "idPrefix");
        Objects.requireNonNull(defaultValue, "defaultValue");
        Objects.requireNonNull(pinOrder, "pinOrder");
        pinNames = List.copyOf(pinNames);
        if (pinOrder.terminalCount() != terminalCount) {
            throw new IllegalArgumentException("pinOrder de " + type + " no cubre "
                    + terminalCount + " terminales");
        }
        if (pinNames.size() != terminalCount) {
            throw new IllegalArgumentException("pinNames de " + type + " no tiene "
                    + terminalCount + " nombres");
        }
    }
}
