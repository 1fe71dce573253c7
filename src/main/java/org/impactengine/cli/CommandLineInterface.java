package org.impactengine.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.impactengine.cli.commands.InspectCommand;
import org.impactengine.cli.commands.RunCommand;
import org.impactengine.config.ConfigNotFoundException;
import org.impactengine.config.ConfigParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * Entry point of the {@code impact-engine} command.
 * <p>
 * Exit codes: {@value #EXIT_OK} success, {@value #EXIT_CONFIG_ERROR} usage or configuration
 * error, {@value #EXIT_PIPELINE_FAILURE} pipeline failure.
 */
@Command(
    name = "impact-engine",
    mixinStandardHelpOptions = true,
    version = "impact-engine 1.0",
    description = "Configuration-driven causal impact analysis",
    subcommands = {
        RunCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG_ERROR = 1;
    public static final int EXIT_PIPELINE_FAILURE = 2;

    private static final String CONFIG_FILE_NAME = "impact-engine.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to an application configuration file (default: impact-engine.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Creates the command line with usage errors mapped to {@value #EXIT_CONFIG_ERROR}.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("impact-engine");
        commandLine.setParameterExceptionHandler((ex, args) -> {
            ex.getCommandLine().getErr().println(ex.getMessage());
            ex.getCommandLine().usage(ex.getCommandLine().getErr());
            return EXIT_CONFIG_ERROR;
        });
        return commandLine;
    }

    /**
     * Returns the application configuration, loading it on first use.
     * <p>
     * Load order: System Props &gt; Env Vars &gt; file &gt; classpath defaults, where the file is
     * the first of {@code --config}, {@code -Dconfig.file} and {@code ./impact-engine.conf}
     * that is given. Logging is configured from the result.
     *
     * @throws ConfigNotFoundException if an explicitly named file does not exist
     * @throws ConfigParseException    if the configuration cannot be parsed or resolved
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    private Config loadConfig() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        File file = null;
        if (configFile != null) {
            file = requireExists(configFile, "--config");
        } else {
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                file = requireExists(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
            } else if (new File(CONFIG_FILE_NAME).isFile()) {
                file = new File(CONFIG_FILE_NAME).getAbsoluteFile();
            }
        }

        try {
            Config base = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                logger.debug("Using application configuration {}", file.getAbsolutePath());
                base = base.withFallback(ConfigFactory.parseFile(file));
            }
            return base.withFallback(ConfigFactory.load()).resolve();
        } catch (ConfigException e) {
            throw new ConfigParseException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    private static File requireExists(File file, String source) {
        if (!file.isFile()) {
            throw new ConfigNotFoundException(file.toPath());
        }
        LoggerFactory.getLogger(CommandLineInterface.class)
            .debug("Configuration file specified via {}: {}", source, file.getAbsolutePath());
        return file;
    }
}
