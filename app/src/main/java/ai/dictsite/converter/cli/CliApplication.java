package ai.dictsite.converter.cli;

import ai.dictsite.converter.audit.AuditReport;
import ai.dictsite.converter.audit.ClassAuditor;
import ai.dictsite.converter.batch.BatchOutcome;
import ai.dictsite.converter.batch.BatchProcessor;
import ai.dictsite.converter.batch.ConfirmationPrompt;
import ai.dictsite.converter.batch.ConversionTask;
import ai.dictsite.converter.batch.DocumentWriter;
import ai.dictsite.converter.batch.InputScanner;
import ai.dictsite.converter.batch.OutputPlanner;
import ai.dictsite.converter.config.Config;
import ai.dictsite.converter.config.ConfigLoader;
import ai.dictsite.converter.config.Mode;
import ai.dictsite.converter.config.SystemEnvironmentReader;
import ai.dictsite.converter.engine.SemanticConverter;
import ai.dictsite.converter.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and batch driver.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final ConfirmationPrompt confirmationPrompt;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new ConfirmationPrompt(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                        new PrintWriter(System.out, true)),
                new PrintWriter(System.out, true));
    }

    CliApplication(ConfigLoader configLoader, ConfirmationPrompt confirmationPrompt, PrintWriter out) {
        this.configLoader = configLoader;
        this.confirmationPrompt = confirmationPrompt;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        try {
            return config.audit() ? audit(config) : convert(config);
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int audit(Config config) {
        AuditReport report = new ClassAuditor().audit(inputs(config));
        out.print(report.format());
        out.flush();
        return EXIT_OK;
    }

    private int convert(Config config) {
        List<Path> inputs = inputs(config);
        if (inputs.isEmpty()) {
            LOGGER.warn("No input files found in {}", config.input());
            return EXIT_OK;
        }
        if (config.replace() && !config.assumeYes()
                && !confirmationPrompt.confirm("This will overwrite " + inputs.size() + " files in " + config.input() + ". Continue?")) {
            LOGGER.info("Aborted, no files were written");
            return EXIT_OK;
        }

        List<ConversionTask> tasks;
        if (config.mode() == Mode.SINGLE) {
            tasks = List.of(new ConversionTask(config.input(), config.output().orElseThrow()));
        } else {
            tasks = new OutputPlanner(config.output(), config.outputSuffix(), config.replace()).planAll(inputs);
        }
        LOGGER.info("Converting {} files with {} threads", tasks.size(), config.threads());

        BatchProcessor processor = new BatchProcessor(new SemanticConverter(config.converterOptions()),
                new DocumentWriter(), config.threads());
        BatchOutcome outcome = processor.process(tasks);
        if (outcome.hasFailures()) {
            LOGGER.warn("Conversion failed for files: {}", outcome.failed());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private List<Path> inputs(Config config) {
        if (config.mode() == Mode.SINGLE) {
            if (!Files.isRegularFile(config.input())) {
                throw new IllegalArgumentException("Input file does not exist: " + config.input());
            }
            return List.of(config.input());
        }
        return new InputScanner(config.extensions(), config.outputSuffix()).scan(config.input());
    }
}
