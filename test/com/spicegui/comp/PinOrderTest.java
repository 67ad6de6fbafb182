package com.spicegui.comp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PinOrderTest {

    @Test
    void inverseUndoesPermutation() {
        PinOrder p = PinOrder.of(4, 2, 3, 0, 1);
        for (int t = 0; t < 4; t++) {
            assertThat(p.schematicAt(p.spiceAt(t))).isEqualTo(t);
        }
        assertThat(p.isIdentity()).isFalse();
    }

    @Test
    void repeatedTerminalKeepsFirstPosition() {
        PinOrder mos = PinOrder.of(3, 0, 1, 2, 2);
        assertThat(mos.spiceArity()).isEqualTo(4);
        assertThat(mos.terminalCount()).isEqualTo(3);
        assertThat(mos.spiceAt(2)).isEqualTo(2);
    }

    @Test
    void opAmpSwapsInputs() {
        PinOrder p = PinOrder.of(3, 1, 0, 2);
        assertThat(p.spiceAt(0)).isEqualTo(1);
        assertThat(p.spiceAt(1)).isEqualTo(0);
        assertThat(p.spiceAt(2)).isEqualTo(2);
    }

    @Test
    void rejectsIncompletePermutation() {
        assertThatThrownBy(() -> PinOrder.of(3, 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PinOrder.of(2, 0, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void identityIsShared() {
        assertThat(PinOrder.identity(2)).isSameAs(PinOrder.identity(2));
        assertThat(PinOrder.identity(3).isIdentity()).isTrue();
        assertThat(PinOrder.identity(2)).isEqualTo(PinOrder.of(2, 0, 1));
    }
}
