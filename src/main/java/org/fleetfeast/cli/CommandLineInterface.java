package org.fleetfeast.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.fleetfeast.cli.commands.DemandCommand;
import org.fleetfeast.cli.commands.ServeCommand;
import org.fleetfeast.cli.config.ConfigLoader;
import org.fleetfeast.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "fleetfeast",
    mixinStandardHelpOptions = true,
    version = "Fleet Feast 1.0",
    description = "Fleet Feast - food truck fleet simulation with an AI dispatcher",
    subcommands = {
        ServeCommand.class,
        DemandCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/fleetfeast.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // Without a subcommand, show usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line as the entry point configures it. Tests use this too.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("fleetfeast");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging levels.
     *
     * @return the full resolved configuration
     * @throws IllegalArgumentException if the configuration cannot be found or parsed
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        try {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
