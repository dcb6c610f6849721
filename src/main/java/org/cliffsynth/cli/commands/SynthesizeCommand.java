package org.cliffsynth.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.cliffsynth.api.ConversionException;
import org.cliffsynth.circuit.Qubit;
import org.cliffsynth.cli.CommandLineInterface;
import org.cliffsynth.config.CliffsynthSettings;
import org.cliffsynth.converter.CircuitToTableauConverter;
import org.cliffsynth.converter.synthesis.SynthesisLayer;
import org.cliffsynth.converter.synthesis.SynthesisRegistry;
import org.cliffsynth.converter.synthesis.SynthesisResult;
import org.cliffsynth.converter.synthesis.TableauSynthesizer;
import org.cliffsynth.tableau.PauliString;
import org.cliffsynth.tableau.Tableau;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Reads a tableau from a HOCON file and prints a canonical circuit for it as JSON.
 * <pre>
 * tableau {
 *   qubits = ["q[0]", "q[1]"]        # optional, defaults to q[0] .. q[n-1]
 *   destabilizers = ["+XX", "+IX"]
 *   stabilizers = ["+ZI", "+ZZ"]
 * }
 * </pre>
 */
@Command(name = "synthesize", description = "Synthesizes a canonical circuit from a tableau file.")
public class SynthesizeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SynthesizeCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The HOCON file holding the tableau.")
    private File file;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        CliffsynthSettings settings = parent.getSettings();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Tableau tableau;
        try {
            tableau = readTableau(file);
        } catch (IllegalArgumentException | ConfigException e) {
            LOG.error("Could not read tableau from {}: {}", file, e.getMessage());
            err.println("Invalid tableau file: " + e.getMessage());
            return 1;
        }

        SynthesisResult result;
        Boolean verified = null;
        try {
            result = new TableauSynthesizer(SynthesisRegistry.initializeWithDefaults()).synthesize(tableau);
            if (settings.verifyRoundTrip()) {
                verified = new CircuitToTableauConverter().convert(result.circuit()).equals(tableau);
            }
        } catch (ConversionException e) {
            LOG.error("Synthesis failed ({}): {}", e.getErrorCode(), e.getMessage());
            err.println("Synthesis failed (" + e.getErrorCode() + "): " + e.getMessage());
            return 1;
        }

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("circuit", new CircuitJson.CircuitView(result.circuit()));
        Map<String, Integer> layers = new LinkedHashMap<>();
        for (Map.Entry<SynthesisLayer, Integer> e : result.layerCounts().entrySet()) {
            layers.put(e.getKey().name(), e.getValue());
        }
        json.put("layers", layers);
        if (verified != null) {
            json.put("roundTrip", verified);
        }
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        out.println(gson.toJson(json));

        if (Boolean.FALSE.equals(verified)) {
            LOG.error("Synthesized circuit does not reproduce the input tableau");
            return 1;
        }
        return 0;
    }

    static Tableau readTableau(File file) {
        if (!file.isFile()) {
            throw new IllegalArgumentException("File not found: " + file.getAbsolutePath());
        }
        Config config = ConfigFactory.parseFile(file).resolve().getConfig("tableau");
        List<PauliString> destabilizers = parsePaulis(config.getStringList("destabilizers"));
        List<PauliString> stabilizers = parsePaulis(config.getStringList("stabilizers"));
        List<Qubit> qubits = new ArrayList<>();
        if (config.hasPath("qubits")) {
            for (String name : config.getStringList("qubits")) {
                qubits.add(Qubit.parse(name));
            }
        } else {
            for (int i = 0; i < destabilizers.size(); i++) {
                qubits.add(Qubit.of(i));
            }
        }
        return Tableau.fromPauliStrings(qubits, destabilizers, stabilizers);
    }

    private static List<PauliString> parsePaulis(List<String> texts) {
        List<PauliString> paulis = new ArrayList<>(texts.size());
        for (String text : texts) {
            paulis.add(PauliString.parse(text));
        }
        return paulis;
    }
}
