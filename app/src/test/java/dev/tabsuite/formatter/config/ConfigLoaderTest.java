package dev.tabsuite.formatter.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.tabsuite.formatter.cli.CliArguments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--check",
                "--diff",
                "--widths", "24,28,0",
                "--alignment-type", "auto",
                "--handle-too-long", "compact-overflow",
                "--compact-overflow-limit", "3",
                "--space-count", "2",
                "--line-length", "100",
                "--no-split-on-every-arg",
                "--no-skip-documentation",
                "--variables-skip-types", "list,dict",
                "--no-align-keywords",
                "--line-ending", "windows",
                "--log-format", "json",
                "suites", "resources/common.resource");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.paths()).containsExactly(Path.of("suites"), Path.of("resources/common.resource"));
        assertThat(config.check()).isTrue();
        assertThat(config.diff()).isTrue();
        assertThat(config.writesFiles()).isFalse();
        assertThat(config.lineEnding()).isEqualTo(LineEnding.WINDOWS);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        FormatterConfig formatter = config.formatter();
        assertThat(formatter.alignment().widths()).containsExactly(24, 28, 0);
        assertThat(formatter.alignment().type()).isEqualTo(AlignmentType.AUTO);
        assertThat(formatter.alignment().overflowPolicy()).isEqualTo(OverflowPolicy.COMPACT_OVERFLOW);
        assertThat(formatter.alignment().compactOverflowLimit()).isEqualTo(3);
        assertThat(formatter.alignment().skipDocumentation()).isFalse();
        assertThat(formatter.whitespace().spaceCount()).isEqualTo(2);
        assertThat(formatter.whitespace().indent()).isEqualTo(2);
        assertThat(formatter.whitespace().continuationIndent()).isEqualTo(2);
        assertThat(formatter.whitespace().lineLength()).isEqualTo(100);
        assertThat(formatter.split().splitOnEveryArg()).isFalse();
        assertThat(formatter.split().splitOnEveryValue()).isTrue();
        assertThat(formatter.variablesSection().skipTypes()).containsExactlyInAnyOrder(VariableType.LIST, VariableType.DICT);
        assertThat(formatter.transforms().alignKeywords()).isFalse();
        assertThat(formatter.transforms().alignTestCases()).isTrue();
    }

    @Test
    void assemblesSkipAndTemplatedOptions() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--skip-keyword-call", "Log Many,should_be_equal",
                "--skip-keyword-call-pattern", "^Run",
                "--skip-keyword-call-pattern", "Wait Until",
                "--skip-setting", "tags,return_statement",
                "--align-templated-test-cases",
                "--templated-only-with-headers",
                "--templated-min-width", "30");

        FormatterConfig formatter = new ConfigLoader(key -> Optional.empty()).load(cliArguments).formatter();

        assertThat(formatter.skip().keywordCalls()).containsExactlyInAnyOrder("Log Many", "should_be_equal");
        assertThat(formatter.skip().keywordCallPatterns()).containsExactly("^Run", "Wait Until");
        assertThat(formatter.skip().settings()).containsExactlyInAnyOrder(SkippedSetting.TAGS, SkippedSetting.RETURN);
        assertThat(formatter.transforms().alignTemplatedTestCases()).isTrue();
        assertThat(formatter.templated()).isEqualTo(new TemplatedConfig(true, 30));
    }

    @Test
    void invalidKeywordCallPatternIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--skip-keyword-call-pattern", "Run(");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("'Run(' is not a valid regular expression");
    }

    @Test
    void settingsSkipCoversEveryBodySetting() {
        assertThat(SkippedSetting.from("settings")).isEqualTo(SkippedSetting.ALL);
        assertThat(SkippedSetting.from(" Setup ")).isEqualTo(SkippedSetting.SETUP);
        assertThat(catchThrowable(() -> SkippedSetting.from("documentation")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("documentation");
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_WIDTHS, "20, 30");
        envValues.put(ConfigLoader.ENV_HANDLE_TOO_LONG, "ignore_line");
        envValues.put(ConfigLoader.ENV_LINE_LENGTH, "90");
        envValues.put(ConfigLoader.ENV_INDENT, "2");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--line-length", "110");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.formatter().alignment().widths()).containsExactly(20, 30);
        assertThat(config.formatter().alignment().overflowPolicy()).isEqualTo(OverflowPolicy.IGNORE_LINE);
        assertThat(config.formatter().whitespace().lineLength()).isEqualTo(110);
        assertThat(config.formatter().whitespace().indent()).isEqualTo(2);
        assertThat(config.formatter().whitespace().spaceCount()).isEqualTo(4);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(environmentReader.requestedKeys()).doesNotContain(ConfigLoader.ENV_LINE_LENGTH);
    }

    @Test
    void appliesDefaultsWhenNothingIsConfigured() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.paths()).containsExactly(Path.of("."));
        assertThat(config.writesFiles()).isTrue();
        assertThat(config.lineEnding()).isEqualTo(LineEnding.NATIVE);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.formatter()).isEqualTo(FormatterConfig.defaults());
    }

    @Test
    void invalidEnvironmentNumberIsRejected() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_SPACE_COUNT, "four"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_SPACE_COUNT);
    }

    @Test
    void negativeWidthIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--widths", "24,-4");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("widths");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
