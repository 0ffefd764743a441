package org.gridsweep.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.gridsweep.cli.commands.RunCommand;
import org.gridsweep.cli.config.ConfigLoader;
import org.gridsweep.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "gridsweep",
    mixinStandardHelpOptions = true,
    version = "GridSweep 1.0",
    description = "GridSweep - multi-agent grid cleaning simulation",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/gridsweep.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("gridsweep");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String appender = "PLAIN".equalsIgnoreCase(config.getString("logging.format"))
                    ? "STDOUT_PLAIN" : "STDOUT";
            // logback.xml defaults to the plain appender
            if (!appender.equals(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT_PLAIN"))) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, appender);
                LoggingConfigurator.reloadLogback();
            }
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    /**
     * Returns the resolved configuration, loading it on first use.
     *
     * @return The application configuration.
     * @throws IllegalArgumentException if an explicitly named config file does not exist.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
