package org.cliffsynth.tableau;

import org.cliffsynth.circuit.Qubit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class QubitIndexMapTest {

    private final Qubit a = new Qubit("a", 3);
    private final Qubit b = new Qubit("b", 0);

    @Test
    void indicesFollowIterationOrder() {
        QubitIndexMap map = new QubitIndexMap(List.of(a, b));
        assertThat(map.indexOf(a)).isZero();
        assertThat(map.indexOf(b)).isEqualTo(1);
        assertThat(map.qubitAt(1)).isEqualTo(b);
        assertThat(map.qubits()).containsExactly(a, b);
        assertThat(map.contains(Qubit.of(0))).isFalse();
    }

    @Test
    void rejectsDuplicatesAndUnknownLookups() {
        assertThatThrownBy(() -> new QubitIndexMap(List.of(a, a))).isInstanceOf(IllegalArgumentException.class);
        QubitIndexMap map = new QubitIndexMap(List.of(a));
        assertThatThrownBy(() -> map.indexOf(b)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> map.qubitAt(1)).isInstanceOf(IllegalArgumentException.class);
    }
}
