package org.brighted.cli;

import org.brighted.config.ConfigLoader;
import org.brighted.config.EngineSettings;
import org.brighted.practicals.PracticalsEngine;
import org.brighted.runtime.decisions.EngineException;
import org.brighted.store.api.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Operator command line for the practicals engine.
 * <p>
 * Useful against a persistent store (H2): every invocation loads the configuration,
 * opens the store, runs one command and closes the store again.
 */
@Command(
    name = "brighted",
    mixinStandardHelpOptions = true,
    version = "BrightEd Practicals Engine 0.1",
    description = "Drive practical sessions and player progression from the shell.",
    subcommands = {
        SessionCommand.class,
        ProgressCommand.class,
        StatusCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(names = {"-c", "--config"}, description = "Path to the configuration file (default: brighted.conf)")
    private File configFile;

    @Option(names = "--at", description = "Instant to act at, ISO-8601 (default: now)")
    private Instant at;

    private PracticalsEngine engine;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        CommandLineInterface cli = new CommandLineInterface();
        int exitCode;
        try {
            exitCode = newCommandLine(cli).execute(args);
        } finally {
            cli.close();
        }
        System.exit(exitCode);
    }

    /**
     * Creates the configured command line. Engine and store errors print their message
     * and exit with code 2 instead of a stack trace.
     */
    public static CommandLine newCommandLine(CommandLineInterface cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCommandName("brighted");
        commandLine.registerConverter(Instant.class, Instant::parse);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof EngineException || ex instanceof StoreException) {
                cmd.getErr().println("Error: " + ex.getMessage());
                return 2;
            }
            throw ex;
        });
        return commandLine;
    }

    /**
     * Returns the engine, creating it on first use.
     */
    PracticalsEngine getEngine() {
        if (engine == null) {
            EngineSettings settings = EngineSettings.from(
                    configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load());
            engine = PracticalsEngine.create(settings);
            log.debug("Engine opened on store '{}'", engine.store().getStoreName());
        }
        return engine;
    }

    Instant now() {
        return at != null ? at : Instant.now();
    }

    void close() {
        if (engine != null) {
            engine.close();
            engine = null;
        }
    }
}
