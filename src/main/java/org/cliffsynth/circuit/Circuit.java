package org.cliffsynth.circuit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered sequence of gate commands over a fixed set of qubits.
 * <p>
 * The qubit set keeps insertion order. Commands are appended only; the circuit is
 * mutable and not thread-safe.
 */
public final class Circuit {

    private final List<Qubit> qubits;
    private final List<Command> commands = new ArrayList<>();

    /**
     * Creates an empty circuit over {@code q[0] .. q[n-1]}.
     * @param n The qubit count.
     */
    public Circuit(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Qubit count must be non-negative: " + n);
        }
        List<Qubit> defaults = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            defaults.add(Qubit.of(i));
        }
        this.qubits = defaults;
    }

    /**
     * Creates an empty circuit over the given qubits.
     * @param qubits The qubit identifiers, without duplicates.
     */
    public Circuit(Collection<Qubit> qubits) {
        Set<Qubit> unique = new LinkedHashSet<>(qubits);
        if (unique.size() != qubits.size()) {
            throw new IllegalArgumentException("Duplicate qubits in " + qubits);
        }
        this.qubits = new ArrayList<>(unique);
    }

    /**
     * Copy constructor.
     * @param other The circuit to copy.
     */
    public Circuit(Circuit other) {
        this.qubits = new ArrayList<>(other.qubits);
        this.commands.addAll(other.commands);
    }

    /**
     * Appends a gate acting on default-register qubits {@code q[i]}.
     *
     * @param type The gate type.
     * @param indices The default-register indices, in gate order.
     * @return This circuit.
     */
    public Circuit addOp(OpType type, int... indices) {
        Qubit[] args = Arrays.stream(indices).mapToObj(Qubit::of).toArray(Qubit[]::new);
        return addOp(type, args);
    }

    /**
     * Appends a gate acting on the given qubits.
     *
     * @param type The gate type.
     * @param args The qubits, in gate order. Each must belong to this circuit.
     * @return This circuit.
     */
    public Circuit addOp(OpType type, Qubit... args) {
        Command command = new Command(type, List.of(args));
        for (Qubit qb : command.args()) {
            if (!qubits.contains(qb)) {
                throw new IllegalArgumentException("Qubit " + qb + " is not part of the circuit");
            }
        }
        commands.add(command);
        return this;
    }

    /**
     * Renames qubits everywhere in the circuit. Qubits absent from the map keep their
     * identifier. All renamings happen simultaneously, so swapping two names is allowed.
     *
     * @param renaming Old identifier to new identifier.
     * @throws IllegalArgumentException if two qubits would end up with the same identifier.
     */
    public void renameUnits(Map<Qubit, Qubit> renaming) {
        List<Qubit> renamed = new ArrayList<>(qubits.size());
        Set<Qubit> seen = new HashSet<>();
        for (Qubit qb : qubits) {
            Qubit target = renaming.getOrDefault(qb, qb);
            if (!seen.add(target)) {
                throw new IllegalArgumentException("Renaming maps two qubits onto " + target);
            }
            renamed.add(target);
        }
        List<Command> rewritten = new ArrayList<>(commands.size());
        for (Command command : commands) {
            List<Qubit> args = command.args().stream().map(qb -> renaming.getOrDefault(qb, qb)).toList();
            rewritten.add(new Command(command.type(), args));
        }
        qubits.clear();
        qubits.addAll(renamed);
        commands.clear();
        commands.addAll(rewritten);
    }

    /**
     * @return The qubits of the circuit, in insertion order.
     */
    public List<Qubit> allQubits() {
        return Collections.unmodifiableList(qubits);
    }

    /**
     * @return The commands, in execution order.
     */
    public List<Command> getCommands() {
        return Collections.unmodifiableList(commands);
    }

    public int nQubits() {
        return qubits.size();
    }

    /**
     * @return The number of commands.
     */
    public int size() {
        return commands.size();
    }

    /**
     * Counts the commands of a given type.
     * @param type The gate type.
     * @return The number of commands of that type.
     */
    public int gateCount(OpType type) {
        return (int) commands.stream().filter(c -> c.type() == type).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Circuit that = (Circuit) o;
        return qubits.equals(that.qubits) && commands.equals(that.commands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qubits, commands);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Circuit").append(qubits).append('\n');
        for (Command command : commands) {
            sb.append(command).append('\n');
        }
        return sb.toString();
    }
}
