package dev.tabsuite.formatter.cli;

import static org.assertj.core.api.Assertions.assertThat;

import dev.tabsuite.formatter.config.ConfigLoader;
import dev.tabsuite.formatter.writer.SourceCollector;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    private static final String UNFORMATTED = "*** Test Cases ***\nTest\n    Log          hello\n";
    private static final String FORMATTED = "*** Test Cases ***\nTest\n    Log" + " ".repeat(21) + "hello\n";

    @TempDir
    Path tempDir;

    private Path suite;
    private StringWriter output;
    private CliApplication application;

    @BeforeEach
    void setUp() throws Exception {
        suite = tempDir.resolve("suite.robot");
        Files.writeString(suite, UNFORMATTED, StandardCharsets.UTF_8);
        output = new StringWriter();
        application = new CliApplication(new ConfigLoader(key -> Optional.empty()), new SourceCollector(),
                new PrintWriter(output, true));
    }

    @Test
    void rewritesFilesInPlace() throws Exception {
        int exitCode = application.run(new String[] {"--line-ending", "unix", tempDir.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(suite, StandardCharsets.UTF_8)).isEqualTo(FORMATTED);
    }

    @Test
    void checkModeReportsChangesWithoutWriting() throws Exception {
        int exitCode = application.run(new String[] {"--check", suite.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_WOULD_CHANGE);
        assertThat(Files.readString(suite, StandardCharsets.UTF_8)).isEqualTo(UNFORMATTED);
    }

    @Test
    void checkModeSucceedsOnFormattedFiles() throws Exception {
        Files.writeString(suite, FORMATTED, StandardCharsets.UTF_8);

        int exitCode = application.run(new String[] {"--check", suite.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
    }

    @Test
    void diffIsPrintedToStandardOutput() throws Exception {
        int exitCode = application.run(new String[] {"--diff", "--no-overwrite", suite.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(output.toString())
                .contains("--- a/" + suite)
                .contains("-    Log          hello")
                .contains("+    Log" + " ".repeat(21) + "hello");
        assertThat(Files.readString(suite, StandardCharsets.UTF_8)).isEqualTo(UNFORMATTED);
    }

    @Test
    void unknownOptionIsInvalidInput() {
        int exitCode = application.run(new String[] {"--unknown"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_INPUT);
        assertThat(output.toString()).contains("--unknown");
    }

    @Test
    void invalidConfigurationIsInvalidInput() {
        int exitCode = application.run(new String[] {"--space-count", "0", suite.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_INPUT);
        assertThat(output.toString()).contains("Invalid configuration");
    }

    @Test
    void unreadableFileIsReportedAsFailure() throws Exception {
        Files.write(tempDir.resolve("broken.robot"), new byte[] {(byte) 0xC3, (byte) 0x28});

        int exitCode = application.run(new String[] {"--line-ending", "unix", tempDir.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURES);
        assertThat(Files.readString(suite, StandardCharsets.UTF_8)).isEqualTo(FORMATTED);
    }

    @Test
    void skipCommentsHelpDescribesTheLengthCheck() {
        CommandLine.Model.OptionSpec option = new CommandLine(new CliArguments()).getCommandSpec()
                .findOption("--skip-comments");

        assertThat(option.description()).containsExactly("Leave comments out of the line length check");
    }
}
