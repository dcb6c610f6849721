package org.cliffsynth.cli.commands;

import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.circuit.Command;
import org.cliffsynth.circuit.Qubit;
import org.cliffsynth.tableau.Tableau;

import java.util.ArrayList;
import java.util.List;

/**
 * Gson-friendly views of circuits and tableaux for command output.
 */
final class CircuitJson {

    private CircuitJson() {
    }

    static final class CircuitView {
        final List<String> qubits = new ArrayList<>();
        final List<CommandView> commands = new ArrayList<>();

        CircuitView(Circuit circuit) {
            for (Qubit qb : circuit.allQubits()) {
                qubits.add(qb.toString());
            }
            for (Command command : circuit.getCommands()) {
                commands.add(new CommandView(command));
            }
        }
    }

    static final class CommandView {
        final String op;
        final List<String> args = new ArrayList<>();

        CommandView(Command command) {
            this.op = command.type().name();
            for (Qubit qb : command.args()) {
                args.add(qb.toString());
            }
        }
    }

    static final class TableauView {
        final List<String> qubits = new ArrayList<>();
        final List<String> destabilizers = new ArrayList<>();
        final List<String> stabilizers = new ArrayList<>();

        TableauView(Tableau tableau) {
            for (Qubit qb : tableau.getQubits().qubits()) {
                qubits.add(qb.toString());
                destabilizers.add(tableau.getDestabilizer(qb).toString());
                stabilizers.add(tableau.getStabilizer(qb).toString());
            }
        }
    }
}
