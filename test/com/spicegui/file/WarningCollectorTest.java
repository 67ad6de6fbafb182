package com.spicegui.file;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WarningCollectorTest {

    @Test
    void keepsOrderAndDropsExactDuplicates() {
        WarningCollector w = new WarningCollector();
        w.add("netlist.warn.unsupported", "Z1 1 2");
        w.addGeneric("  otro aviso ");
        w.add("netlist.warn.unsupported", "Z1 1 2");
        w.addGeneric("   ");
        w.addGeneric(null);

        assertThat(w.warnings()).containsExactly("Unsupported netlist line skipped: Z1 1 2", "otro aviso");
        assertThat(w.size()).isEqualTo(2);
        assertThat(w.hasWarnings()).isTrue();
    }

    @Test
    void summaryAndDetails() {
        WarningCollector w = new WarningCollector();
        assertThat(w.summary()).isEmpty();

        w.addGeneric("a");
        assertThat(w.summary()).isEqualTo("One element of the file could not be imported.");
        w.addGeneric("b");
        assertThat(w.summary()).isEqualTo("2 elements of the file could not be imported.");
        assertThat(w.details()).startsWith("Import warnings\n\n").contains(" • a\n", " • b\n");
    }

    @Test
    void unknownKeyIsShownAsIs() {
        assertThat(Strings.get("no.such.key")).isEqualTo("no.such.key");
    }
}
