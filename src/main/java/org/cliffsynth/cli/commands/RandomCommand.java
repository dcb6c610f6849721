package org.cliffsynth.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.cliffsynth.api.ConversionException;
import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.cli.CommandLineInterface;
import org.cliffsynth.config.CliffsynthSettings;
import org.cliffsynth.converter.CliffordConverter;
import org.cliffsynth.random.RandomCliffordCircuitGenerator;
import org.cliffsynth.tableau.Tableau;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "random", description = "Generates a random Clifford circuit and converts it both ways.")
public class RandomCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RandomCommand.class);

    @Option(names = {"-n", "--qubits"}, description = "Qubit count (default: cliffsynth.random.qubits).")
    private Integer qubits;

    @Option(names = {"-d", "--depth"}, description = "Gate count (default: cliffsynth.random.depth).")
    private Integer depth;

    @Option(names = {"-s", "--seed"}, description = "Random seed (default: cliffsynth.random.seed).")
    private Long seed;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        CliffsynthSettings settings = parent.getSettings();
        int n = qubits != null ? qubits : settings.randomQubits();
        int d = depth != null ? depth : settings.randomDepth();
        long s = seed != null ? seed : settings.randomSeed();
        if (n < 0 || d < 0) {
            spec.commandLine().getErr().println("--qubits and --depth must be non-negative");
            return 1;
        }
        LOG.debug("Generating random circuit: qubits={}, depth={}, seed={}", n, d, s);

        Circuit input = new RandomCliffordCircuitGenerator(s).generate(n, d);
        CliffordConverter converter = new CliffordConverter();
        Tableau tableau;
        Circuit synthesized;
        boolean verified;
        try {
            tableau = converter.circuitToTableau(input);
            synthesized = converter.tableauToCircuit(tableau);
            verified = converter.circuitToTableau(synthesized).equals(tableau);
        } catch (ConversionException e) {
            LOG.error("Conversion failed ({}): {}", e.getErrorCode(), e.getMessage());
            spec.commandLine().getErr().println("Conversion failed (" + e.getErrorCode() + "): " + e.getMessage());
            return 1;
        }

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("seed", s);
        json.put("input", new CircuitJson.CircuitView(input));
        json.put("tableau", new CircuitJson.TableauView(tableau));
        json.put("synthesized", new CircuitJson.CircuitView(synthesized));
        json.put("roundTrip", verified);
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        PrintWriter out = spec.commandLine().getOut();
        out.println(gson.toJson(json));

        if (!verified) {
            LOG.error("Synthesized circuit does not reproduce the tableau of the random circuit");
            return 1;
        }
        return 0;
    }
}
