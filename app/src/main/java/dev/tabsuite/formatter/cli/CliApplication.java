package dev.tabsuite.formatter.cli;

import dev.tabsuite.formatter.config.Config;
import dev.tabsuite.formatter.config.ConfigLoader;
import dev.tabsuite.formatter.config.SystemEnvironmentReader;
import dev.tabsuite.formatter.diff.UnifiedDiffRenderer;
import dev.tabsuite.formatter.format.DocumentFormatter;
import dev.tabsuite.formatter.format.FileFailure;
import dev.tabsuite.formatter.format.FormattedFile;
import dev.tabsuite.formatter.format.FormattingOutcome;
import dev.tabsuite.formatter.format.FormattingService;
import dev.tabsuite.formatter.format.SourceFile;
import dev.tabsuite.formatter.logging.LoggingConfigurator;
import dev.tabsuite.formatter.writer.DocumentWriter;
import dev.tabsuite.formatter.writer.SourceCollector;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and formatting pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_WOULD_CHANGE = 1;
    static final int EXIT_INVALID_INPUT = 2;
    static final int EXIT_FAILURES = 3;

    private final ConfigLoader configLoader;
    private final SourceCollector sourceCollector;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new SourceCollector(), null);
    }

    CliApplication(ConfigLoader configLoader, SourceCollector sourceCollector, PrintWriter out) {
        this.configLoader = configLoader;
        this.sourceCollector = sourceCollector;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.getCommandSpec().exitCodeOnInvalidInput(EXIT_INVALID_INPUT);
        if (out != null) {
            commandLine.setOut(out);
            commandLine.setErr(out);
        }

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
            commandLine.getErr().println("Invalid configuration: " + ex.getMessage());
            return EXIT_INVALID_INPUT;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Formatting {} (check={}, diff={}, overwrite={})",
                config.paths(), config.check(), config.diff(), config.writesFiles());

        List<FileFailure> failures = new ArrayList<>();
        List<SourceFile> sources = readSources(config.paths(), failures);

        FormattingService formattingService = new FormattingService(new DocumentFormatter(config.formatter()));
        FormattingOutcome outcome = formattingService.format(sources);
        failures.addAll(outcome.failedFiles());

        DocumentWriter writer = new DocumentWriter(config.lineEnding());
        UnifiedDiffRenderer diffRenderer = new UnifiedDiffRenderer();
        List<FormattedFile> changed = outcome.changedFiles();
        for (FormattedFile file : changed) {
            if (config.diff()) {
                commandLine.getOut().print(diffRenderer.render(file.path(), file.source().lines(), file.lines()));
            }
            if (config.check()) {
                LOGGER.info("Would reformat {}", file.path());
            } else if (config.writesFiles()) {
                try {
                    writer.write(file);
                    LOGGER.info("Reformatted {}", file.path());
                } catch (UncheckedIOException ex) {
                    LOGGER.error("Failed to write {}", file.path(), ex);
                    failures.add(new FileFailure(file.path(), ex.getMessage()));
                }
            }
        }
        commandLine.getOut().flush();

        LOGGER.info("{} file(s) checked, {} changed, {} failed",
                sources.size(), changed.size(), failures.size());
        if (!failures.isEmpty()) {
            LOGGER.warn("Formatting failed for files: {}",
                    String.join(", ", failures.stream().map(FileFailure::path).toList()));
            return EXIT_FAILURES;
        }
        if (config.check() && !changed.isEmpty()) {
            return EXIT_WOULD_CHANGE;
        }
        return EXIT_OK;
    }

    private List<SourceFile> readSources(List<Path> roots, List<FileFailure> failures) {
        List<SourceFile> sources = new ArrayList<>();
        for (Path path : sourceCollector.collect(roots)) {
            try {
                sources.add(sourceCollector.read(path));
            } catch (UncheckedIOException ex) {
                LOGGER.error("Failed to read {}", path, ex);
                failures.add(new FileFailure(path.toString(), ex.getMessage()));
            }
        }
        return sources;
    }
}
