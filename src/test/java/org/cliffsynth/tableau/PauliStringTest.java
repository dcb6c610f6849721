package org.cliffsynth.tableau;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PauliStringTest {

    @Test
    void parsesSignAndSymbols() {
        PauliString p = PauliString.parse("-XyZI");
        assertThat(p.negative()).isTrue();
        assertThat(p.paulis()).containsExactly(Pauli.X, Pauli.Y, Pauli.Z, Pauli.I);
        assertThat(p).hasToString("-XYZI");
    }

    @Test
    void missingSignIsPositive() {
        assertThat(PauliString.parse("ZZ")).hasToString("+ZZ");
        assertThat(PauliString.parse("+").size()).isZero();
    }

    @Test
    void rejectsUnknownSymbols() {
        assertThatThrownBy(() -> PauliString.parse("+XQ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void symplecticEncoding() {
        for (Pauli p : Pauli.values()) {
            assertThat(Pauli.fromBits(p.x(), p.z())).isEqualTo(p);
        }
        assertThat(Pauli.Y.x()).isTrue();
        assertThat(Pauli.Y.z()).isTrue();
    }
}
