package org.nodebook.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.nodebook.cli.commands.CompileCommand;
import org.nodebook.cli.commands.ExportCommand;
import org.nodebook.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "nodebook",
    mixinStandardHelpOptions = true,
    version = "NodeBook CNL 1.0",
    description = "NodeBook - compiles controlled natural language into knowledge graphs",
    subcommands = {
        CompileCommand.class,
        ExportCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/nodebook.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand given
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
        commandLine.setCommandName("nodebook");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException            if an explicit config file is missing.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        final Config resolved = ConfigLoader.resolve(configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.warn(message);
            }
        });

        final String formatPath = "nodebook.logging.format";
        if (resolved.hasPath(formatPath)) {
            final String format = resolved.getString(formatPath);
            final String appender = "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
            if (!appender.equals(System.getProperty(formatPath))) {
                System.setProperty(formatPath, appender);
                reconfigureLogback();
            }
        }
        this.config = resolved;
        return config;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
