package com.spicegui.comp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tabla inmutable de metadatos por tipo de componente.
 * <p>
 * Se construye una vez ({@link #standard()}) y se pasa por referencia al generador y a
 * los importadores; ambos sentidos de la traducción leen el mismo {@link PinOrder}.
 */
public final class ComponentCatalog {

    private static final ComponentCatalog STANDARD = buildStandard();

    private final Map<ComponentType, CatalogEntry> entries;
    private final Map<Character, ComponentType> bySpicePrefix;

    private ComponentCatalog(Map<ComponentType, CatalogEntry> entries,
                             Map<Character, ComponentType> bySpicePrefix) {
        this.entries = Collections.unmodifiableMap(new EnumMap<>(entries));
        this.bySpicePrefix = Map.copyOf(bySpicePrefix);
    }

    /** Catálogo estándar del editor. */
    public static ComponentCatalog standard() {
        return STANDARD;
    }

    /* ===== Consulta ===== */

    public CatalogEntry entry(ComponentType type) {
        CatalogEntry e = entries.get(Objects.requireNonNull(type, "type"));
        if (e == null) throw new IllegalStateException("Tipo sin registrar: " + type);
        return e;
    }

    public Collection<CatalogEntry> entries() {
        return entries.values();
    }

    /**
     * Terminales de una instancia concreta: los subcircuitos tienen tantos como pines.
     */
    public int terminalCount(ComponentInstance c) {
        if (c.type() == ComponentType.SUBCIRCUIT && !c.subcircuitPins().isEmpty()) {
            return c.subcircuitPins().size();
        }
        return entry(c.type()).terminalCount();
    }

    public PinOrder pinOrder(ComponentInstance c) {
        if (c.type() == ComponentType.SUBCIRCUIT) return PinOrder.identity(terminalCount(c));
        return entry(c.type()).pinOrder();
    }

    public String pinName(ComponentInstance c, int terminal) {
        if (c.type() == ComponentType.SUBCIRCUIT && terminal < c.subcircuitPins().size()) {
            return c.subcircuitPins().get(terminal);
        }
        List<String> names = entry(c.type()).pinNames();
        return terminal < names.size() ? names.get(terminal) : String.valueOf(terminal);
    }

    /**
     * Tipo por defecto para la letra inicial de una tarjeta SPICE. Los prefijos ambiguos
     * (D, Q, M, V) devuelven la variante base; el importador la refina con el modelo o el valor.
     */
    public Optional<ComponentType> typeForSpicePrefix(char prefix) {
        return Optional.ofNullable(bySpicePrefix.get(Character.toUpperCase(prefix)));
    }

    /** Nombre de tarjeta: el id si ya empieza por el prefijo SPICE, si no prefijo + id. */
    public String cardName(ComponentInstance c) {
        String prefix = entry(c.type()).spicePrefix();
        if (prefix.isEmpty()) return c.id();
        String id = c.id();
        if (id.toUpperCase(Locale.ROOT).startsWith(prefix)) return id;
        return prefix + id;
    }

    /* ===== Construcción ===== */

    private static ComponentCatalog buildStandard() {
        Builder b = new Builder();
        List<String> two = List.of("p", "n");
        PinOrder id2 = PinOrder.identity(2);
        PinOrder controlled = PinOrder.of(4, 2, 3, 0, 1);
        List<String> fourPort = List.of("ctrl+", "ctrl-", "out+", "out-");

        b.add(ComponentType.RESISTOR,        "R", "R",  2, "1k",  id2, two);
        b.add(ComponentType.CAPACITOR,       "C", "C",  2, "1u",  id2, two);
        b.add(ComponentType.INDUCTOR,        "L", "L",  2, "1m",  id2, two);
        b.add(ComponentType.VOLTAGE_SOURCE,  "V", "V",  2, "5V",  id2, List.of("+", "-"));
        b.add(ComponentType.CURRENT_SOURCE,  "I", "I",  2, "1A",  id2, List.of("+", "-"));
        b.add(ComponentType.WAVEFORM_SOURCE, "V", "VW", 2, "SIN(0 5 1k)", id2, List.of("+", "-"));
        b.add(ComponentType.GROUND,          "",  "GND", 1, "0V", PinOrder.identity(1), List.of("gnd"));
        // SPICE: X in+ in- out ; esquemático: 0=in-, 1=in+, 2=out
        b.add(ComponentType.OP_AMP,          "X", "OA", 3, OpAmpModels.IDEAL,
                PinOrder.of(3, 1, 0, 2), List.of("in-", "in+", "out"));
        b.add(ComponentType.VCVS,            "E", "E",  4, "1",   controlled, fourPort);
        b.add(ComponentType.CCVS,            "H", "H",  4, "1k",  controlled, fourPort);
        b.add(ComponentType.VCCS,            "G", "G",  4, "1m",  controlled, fourPort);
        b.add(ComponentType.CCCS,            "F", "F",  4, "1",   controlled, fourPort);
        List<String> bjt = List.of("c", "b", "e");
        b.add(ComponentType.BJT_NPN,         "Q", "Q",  3, DeviceModels.DEFAULT_NPN, PinOrder.identity(3), bjt);
        b.add(ComponentType.BJT_PNP,         "Q", "Q",  3, DeviceModels.DEFAULT_PNP, PinOrder.identity(3), bjt);
        // SPICE: M d g s b ; el bulk va a la fuente
        PinOrder mos = PinOrder.of(3, 0, 1, 2, 2);
        List<String> fet = List.of("d", "g", "s");
        b.add(ComponentType.MOSFET_NMOS,     "M", "M",  3, DeviceModels.DEFAULT_NMOS, mos, fet);
        b.add(ComponentType.MOSFET_PMOS,     "M", "M",  3, DeviceModels.DEFAULT_PMOS, mos, fet);
        b.add(ComponentType.VC_SWITCH,       "S", "S",  4, "VT=2.5 RON=1 ROFF=1e6", controlled,
                List.of("ctrl+", "ctrl-", "sw+", "sw-"));
        List<String> diode = List.of("a", "k");
        b.add(ComponentType.DIODE,           "D", "D",  2, "IS=1e-14 N=1", id2, diode);
        b.add(ComponentType.LED,             "D", "D",  2, "IS=1e-20 N=1.8 EG=1.9", id2, diode);
        b.add(ComponentType.ZENER_DIODE,     "D", "D",  2, "IS=1e-14 N=1 BV=5.1 IBV=1e-3", id2, diode);
        b.add(ComponentType.TRANSFORMER,     "K", "K",  4, "10mH 10mH 0.99", PinOrder.identity(4),
                List.of("p+", "p-", "s+", "s-"));
        b.add(ComponentType.SUBCIRCUIT,      "X", "X",  2, "", id2, List.of("p0", "p1"));

        b.prefix('R', ComponentType.RESISTOR);
        b.prefix('C', ComponentType.CAPACITOR);
        b.prefix('L', ComponentType.INDUCTOR);
        b.prefix('V', ComponentType.VOLTAGE_SOURCE);
        b.prefix('I', ComponentType.CURRENT_SOURCE);
        b.prefix('E', ComponentType.VCVS);
        b.prefix('H', ComponentType.CCVS);
        b.prefix('G', ComponentType.VCCS);
        b.prefix('F', ComponentType.CCCS);
        b.prefix('Q', ComponentType.BJT_NPN);
        b.prefix('M', ComponentType.MOSFET_NMOS);
        b.prefix('S', ComponentType.VC_SWITCH);
        b.prefix('D', ComponentType.DIODE);
        b.prefix('K', ComponentType.TRANSFORMER);
        b.prefix('X', ComponentType.SUBCIRCUIT);
        return b.build();
    }

    private static final class Builder {
        private final Map<ComponentType, CatalogEntry> entries = new EnumMap<>(ComponentType.class);
        private final Map<Character, ComponentType> prefixes = new HashMap<>();

        void add(ComponentType type, String spicePrefix, String idPrefix, int terminals,
                 String defaultValue, PinOrder order, List<String> pinNames) {
            entries.put(type, new CatalogEntry(type, spicePrefix, idPrefix, terminals,
                    defaultValue, order, new ArrayList<>(pinNames)));
        }

        void prefix(char c, ComponentType type) {
            prefixes.put(c, type);
        }

        ComponentCatalog build() {
            for (ComponentType t : ComponentType.values()) {
                if (!entries.containsKey(t)) {
                    throw new IllegalStateException("Falta entrada de catálogo para " + t);
                }
            }
            return new ComponentCatalog(entries, prefixes);
        }
    }
}
