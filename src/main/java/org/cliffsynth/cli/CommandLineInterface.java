package org.cliffsynth.cli;

import com.typesafe.config.Config;
import org.cliffsynth.cli.commands.RandomCommand;
import org.cliffsynth.cli.commands.SynthesizeCommand;
import org.cliffsynth.config.CliffsynthSettings;
import org.cliffsynth.config.ConfigLoader;
import org.cliffsynth.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "cliffsynth",
    mixinStandardHelpOptions = true,
    version = "cliffsynth 1.0",
    description = "Converts between Clifford circuits and stabilizer tableaux",
    subcommands = {
        SynthesizeCommand.class,
        RandomCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: cliffsynth.conf)"
    )
    private File configFile;

    private Config config;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("cliffsynth");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    public CliffsynthSettings getSettings() {
        return CliffsynthSettings.fromConfig(getConfig());
    }
}
