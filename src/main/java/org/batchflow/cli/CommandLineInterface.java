package org.batchflow.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.batchflow.cli.commands.RunCommand;
import org.batchflow.config.ConfigLoader;
import org.batchflow.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "batchflow",
    mixinStandardHelpOptions = true,
    version = "batchflow 1.0",
    description = "batchflow - groups submitted items into bounded batches and hands them out on demand",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("batchflow");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     *
     * @throws IllegalArgumentException if the configuration file is missing or cannot be parsed
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException e) {
                throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
