package org.cliffsynth.converter;

import org.cliffsynth.api.ConversionErrorCode;
import org.cliffsynth.api.UnsupportedOperationTypeException;
import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.circuit.OpType;
import org.cliffsynth.circuit.Qubit;
import org.cliffsynth.tableau.Tableau;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class CircuitToTableauConverterTest {

    private final CircuitToTableauConverter converter = new CircuitToTableauConverter();

    @Test
    void emptyCircuitGivesIdentity() throws Exception {
        assertThat(converter.convert(new Circuit(3))).isEqualTo(new Tableau(3));
        assertThat(converter.convert(new Circuit(0)).size()).isZero();
    }

    @Test
    void bellPreparation() throws Exception {
        Circuit circ = new Circuit(2).addOp(OpType.H, 0).addOp(OpType.CX, 0, 1);
        Tableau tab = converter.convert(circ);
        assertEquals("+ZI", tab.getDestabilizer(Qubit.of(0)).toString());
        assertEquals("+IX", tab.getDestabilizer(Qubit.of(1)).toString());
        assertEquals("+XX", tab.getStabilizer(Qubit.of(0)).toString());
        assertEquals("+ZZ", tab.getStabilizer(Qubit.of(1)).toString());
    }

    @Test
    void usesCircuitQubitIdentifiers() throws Exception {
        Qubit a = new Qubit("a", 0);
        Qubit b = new Qubit("b", 5);
        Circuit circ = new Circuit(List.of(b, a));
        circ.addOp(OpType.CX, a, b);
        Tableau tab = converter.convert(circ);
        assertThat(tab.getQubits().qubits()).containsExactly(b, a);
        assertEquals("+XX", tab.getDestabilizer(a).toString());
        assertEquals("+ZZ", tab.getStabilizer(b).toString());
    }

    @Test
    void rejectsGatesOutsideGeneratingSet() {
        Circuit circ = new Circuit(1).addOp(OpType.H, 0).addOp(OpType.Rz, 0);
        assertThatThrownBy(() -> converter.convert(circ))
                .isInstanceOfSatisfying(UnsupportedOperationTypeException.class, e -> {
                    assertThat(e.getOpType()).isEqualTo(OpType.Rz);
                    assertThat(e.getErrorCode()).isEqualTo(ConversionErrorCode.UNSUPPORTED_OPERATION);
                });
        assertThat(circ.size()).isEqualTo(2);
    }
}
