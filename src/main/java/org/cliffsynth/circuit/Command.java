package org.cliffsynth.circuit;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single gate application: an operation type and the ordered qubits it acts on.
 *
 * @param type The gate type.
 * @param args The qubits, in the order the gate expects them (control first for CX).
 */
public record Command(OpType type, List<Qubit> args) {

    public Command {
        Objects.requireNonNull(type, "type");
        args = List.copyOf(args);
        if (args.size() != type.arity()) {
            throw new IllegalArgumentException(
                    type + " expects " + type.arity() + " qubit(s) but got " + args.size());
        }
        if (args.stream().distinct().count() != args.size()) {
            throw new IllegalArgumentException(type + " applied to repeated qubits " + args);
        }
    }

    @Override
    public String toString() {
        return type + " " + args.stream().map(Qubit::toString).collect(Collectors.joining(", ")) + ";";
    }
}
