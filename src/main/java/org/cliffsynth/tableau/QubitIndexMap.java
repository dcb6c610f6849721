package org.cliffsynth.tableau;

import org.cliffsynth.circuit.Qubit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bijection between qubit identifiers and tableau indices {@code 0 .. n-1}.
 * Entries are fixed at construction; indices follow the order of the given qubits.
 */
public final class QubitIndexMap {

    private final Map<Qubit, Integer> indexByQubit;
    private final List<Qubit> qubitByIndex;

    /**
     * @param qubits The qubits, without duplicates. Qubit {@code k} in iteration order gets index {@code k}.
     */
    public QubitIndexMap(Collection<Qubit> qubits) {
        this.qubitByIndex = new ArrayList<>(qubits);
        this.indexByQubit = new HashMap<>();
        for (int i = 0; i < qubitByIndex.size(); i++) {
            if (indexByQubit.put(qubitByIndex.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate qubit " + qubitByIndex.get(i));
            }
        }
    }

    /**
     * @param qubit A qubit identifier.
     * @return Its index.
     * @throws IllegalArgumentException if the qubit is unknown.
     */
    public int indexOf(Qubit qubit) {
        Integer index = indexByQubit.get(qubit);
        if (index == null) {
            throw new IllegalArgumentException("Qubit " + qubit + " is not part of the tableau");
        }
        return index;
    }

    /**
     * @param index An index in {@code 0 .. n-1}.
     * @return The qubit identifier at that index.
     */
    public Qubit qubitAt(int index) {
        if (index < 0 || index >= qubitByIndex.size()) {
            throw new IllegalArgumentException("Qubit index out of range: " + index);
        }
        return qubitByIndex.get(index);
    }

    public boolean contains(Qubit qubit) {
        return indexByQubit.containsKey(qubit);
    }

    public int size() {
        return qubitByIndex.size();
    }

    /**
     * @return The qubits in index order.
     */
    public List<Qubit> qubits() {
        return Collections.unmodifiableList(qubitByIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QubitIndexMap that)) return false;
        return qubitByIndex.equals(that.qubitByIndex);
    }

    @Override
    public int hashCode() {
        return qubitByIndex.hashCode();
    }

    @Override
    public String toString() {
        return qubitByIndex.toString();
    }
}
