package org.cliffsynth.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.typesafe.config.ConfigFactory;
import org.cliffsynth.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
        LoggingConfigurator.reset();
        cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    void commandName() {
        assertEquals("cliffsynth", cmd.getCommandName());
        assertThat(cmd.getSubcommands()).containsKeys("synthesize", "random");
    }

    @Test
    void randomCommandRoundTrips() {
        int exitCode = cmd.execute("random", "--qubits", "3", "--depth", "25", "--seed", "7");

        assertEquals(0, exitCode);
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.get("roundTrip").getAsBoolean()).isTrue();
        assertThat(json.get("seed").getAsLong()).isEqualTo(7L);
        assertThat(json.getAsJsonObject("input").getAsJsonArray("commands")).hasSize(25);
        assertThat(json.getAsJsonObject("tableau").getAsJsonArray("stabilizers")).hasSize(3);
    }

    @Test
    void randomCommandFallsBackToConfig() throws IOException {
        Path config = tempDir.resolve("custom.conf");
        Files.writeString(config, "cliffsynth.random { qubits = 2, depth = 5, seed = 3 }");

        int exitCode = cmd.execute("--config", config.toString(), "random");

        assertEquals(0, exitCode);
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.getAsJsonObject("input").getAsJsonArray("qubits")).hasSize(2);
        assertThat(json.getAsJsonObject("input").getAsJsonArray("commands")).hasSize(5);
    }

    @Test
    void synthesizeCommandPrintsCircuit() throws URISyntaxException {
        Path fixture = Paths.get(getClass().getResource("bell-tableau.conf").toURI());

        int exitCode = cmd.execute("synthesize", "-f", fixture.toString());

        assertEquals(0, exitCode);
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.get("roundTrip").getAsBoolean()).isTrue();
        assertThat(json.getAsJsonObject("circuit").getAsJsonArray("qubits")).hasSize(2);
        assertThat(json.getAsJsonObject("layers").get("HADAMARD").getAsInt()).isEqualTo(2);
    }

    @Test
    void synthesizeCommandRejectsDependentStabilizers() throws IOException {
        Path file = tempDir.resolve("bad.conf");
        Files.writeString(file, """
            tableau {
              destabilizers = ["+XI", "+IX"]
              stabilizers = ["+ZI", "+ZI"]
            }
            """);

        int exitCode = cmd.execute("synthesize", "-f", file.toString());

        assertEquals(1, exitCode);
        assertThat(err.toString()).contains("STABILIZERS_NOT_INDEPENDENT");
    }

    @Test
    void synthesizeCommandRejectsMissingFile() {
        int exitCode = cmd.execute("synthesize", "-f", tempDir.resolve("absent.conf").toString());
        assertEquals(1, exitCode);
        assertThat(err.toString()).contains("Invalid tableau file");
    }
}
