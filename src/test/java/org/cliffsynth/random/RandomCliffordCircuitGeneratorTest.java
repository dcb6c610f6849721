package org.cliffsynth.random;

import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.circuit.Command;
import org.cliffsynth.circuit.OpType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RandomCliffordCircuitGeneratorTest {

    @Test
    void sameSeedSameCircuit() {
        Circuit first = new RandomCliffordCircuitGenerator(42L).generate(4, 50);
        Circuit second = new RandomCliffordCircuitGenerator(42L).generate(4, 50);
        Circuit other = new RandomCliffordCircuitGenerator(43L).generate(4, 50);
        assertThat(first).isEqualTo(second);
        assertThat(first).isNotEqualTo(other);
    }

    @Test
    void drawsOnlyGeneratingSetGates() {
        Circuit circ = new RandomCliffordCircuitGenerator(1L).generate(3, 200);
        assertThat(circ.size()).isEqualTo(200);
        assertThat(circ.nQubits()).isEqualTo(3);
        for (Command com : circ.getCommands()) {
            assertThat(com.type().isCliffordGenerator()).isTrue();
        }
        assertThat(circ.gateCount(OpType.CX)).isPositive();
    }

    @Test
    void singleQubitCircuitsHaveNoCx() {
        Circuit circ = new RandomCliffordCircuitGenerator(1L).generate(1, 100);
        assertThat(circ.gateCount(OpType.CX)).isZero();
        assertThat(new RandomCliffordCircuitGenerator(1L).generate(0, 10).size()).isZero();
    }

    @Test
    void rejectsNegativeSizes() {
        assertThatThrownBy(() -> new RandomCliffordCircuitGenerator(1L).generate(-1, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
