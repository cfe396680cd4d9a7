package dev.tabsuite.formatter.config;

import dev.tabsuite.formatter.cli.CliArguments;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_WIDTHS = "TABSUITE_WIDTHS";
    static final String ENV_ALIGNMENT_TYPE = "TABSUITE_ALIGNMENT_TYPE";
    static final String ENV_HANDLE_TOO_LONG = "TABSUITE_HANDLE_TOO_LONG";
    static final String ENV_COMPACT_OVERFLOW_LIMIT = "TABSUITE_COMPACT_OVERFLOW_LIMIT";
    static final String ENV_SPACE_COUNT = "TABSUITE_SPACE_COUNT";
    static final String ENV_INDENT = "TABSUITE_INDENT";
    static final String ENV_CONTINUATION_INDENT = "TABSUITE_CONTINUATION_INDENT";
    static final String ENV_LINE_LENGTH = "TABSUITE_LINE_LENGTH";
    static final String ENV_LINE_ENDING = "TABSUITE_LINE_ENDING";
    static final String ENV_LOG_FORMAT = "TABSUITE_LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        List<Path> paths = arguments.paths().isEmpty() ? List.of(Path.of(".")) : arguments.paths();

        LineEnding lineEnding = resolve(arguments.lineEnding(), ENV_LINE_ENDING, LineEnding::from, LineEnding.NATIVE);
        LogFormat logFormat = resolve(arguments.logFormat(), ENV_LOG_FORMAT, LogFormat::from, LogFormat.TEXT);

        FormatterConfig formatter = new FormatterConfig(
                resolveWhitespace(arguments),
                resolveAlignment(arguments),
                resolveSplit(arguments),
                resolveSkip(arguments),
                resolveSettingsSection(arguments),
                resolveVariablesSection(arguments),
                new TemplatedConfig(arguments.templatedOnlyWithHeaders(), orDefault(arguments.templatedMinWidth(), 0)),
                new EnabledTransforms(
                        orDefault(arguments.alignKeywords(), true),
                        orDefault(arguments.alignTestCases(), true),
                        orDefault(arguments.alignSettings(), true),
                        orDefault(arguments.alignVariables(), true),
                        orDefault(arguments.splitTooLongLines(), true),
                        orDefault(arguments.alignTemplatedTestCases(), false)));

        return new Config(paths, arguments.check(), arguments.diff(), !arguments.noOverwrite(),
                lineEnding, logFormat, arguments.verbose(), formatter);
    }

    private WhitespaceConfig resolveWhitespace(CliArguments arguments) {
        int spaceCount = resolveInt(arguments.spaceCount(), ENV_SPACE_COUNT, WhitespaceConfig.DEFAULT_SPACE_COUNT);
        int indent = resolveInt(arguments.indent(), ENV_INDENT, spaceCount);
        int continuationIndent = resolveInt(arguments.continuationIndent(), ENV_CONTINUATION_INDENT, spaceCount);
        int lineLength = resolveInt(arguments.lineLength(), ENV_LINE_LENGTH, WhitespaceConfig.DEFAULT_LINE_LENGTH);
        return new WhitespaceConfig(spaceCount, indent, continuationIndent, lineLength);
    }

    private AlignmentConfig resolveAlignment(CliArguments arguments) {
        List<Integer> widths = arguments.widths() != null
                ? arguments.widths()
                : environmentReader.get(ENV_WIDTHS)
                        .filter(ConfigLoader::isNotBlank)
                        .map(ConfigLoader::parseWidths)
                        .orElse(List.of(AlignmentConfig.DEFAULT_WIDTH));
        AlignmentType type = resolve(arguments.alignmentType(), ENV_ALIGNMENT_TYPE, AlignmentType::from, AlignmentType.FIXED);
        OverflowPolicy policy = resolve(arguments.handleTooLong(), ENV_HANDLE_TOO_LONG, OverflowPolicy::from, OverflowPolicy.OVERFLOW);
        int compactLimit = resolveInt(arguments.compactOverflowLimit(), ENV_COMPACT_OVERFLOW_LIMIT,
                AlignmentConfig.DEFAULT_COMPACT_OVERFLOW_LIMIT);
        return new AlignmentConfig(widths, type, policy, compactLimit,
                arguments.alignComments(),
                arguments.alignSettingsSeparately(),
                orDefault(arguments.skipDocumentation(), true),
                arguments.skipReturnValues());
    }

    private SplitConfig resolveSplit(CliArguments arguments) {
        return new SplitConfig(
                orDefault(arguments.splitOnEveryArg(), true),
                orDefault(arguments.splitOnEveryValue(), true),
                orDefault(arguments.splitOnEverySettingArg(), true),
                arguments.splitSingleValue(),
                arguments.alignNewLine(),
                arguments.skipComments());
    }

    private SkipConfig resolveSkip(CliArguments arguments) {
        Set<SkippedSetting> settings = arguments.skipSettings() == null || arguments.skipSettings().isEmpty()
                ? Set.of()
                : EnumSet.copyOf(arguments.skipSettings());
        return new SkipConfig(
                arguments.skipKeywordCalls() == null ? Set.of() : Set.copyOf(arguments.skipKeywordCalls()),
                orDefault(arguments.skipKeywordCallPatterns(), List.of()),
                settings);
    }

    private SectionAlignConfig resolveSettingsSection(CliArguments arguments) {
        return new SectionAlignConfig(
                orDefault(arguments.settingsUpToColumn(), SectionAlignConfig.DEFAULT_UP_TO_COLUMN),
                orDefault(arguments.settingsArgumentIndent(), SectionAlignConfig.DEFAULT_ARGUMENT_INDENT),
                orDefault(arguments.settingsMinWidth(), 0),
                orDefault(arguments.settingsFixedWidth(), 0),
                Set.of());
    }

    private SectionAlignConfig resolveVariablesSection(CliArguments arguments) {
        Set<VariableType> skipTypes = arguments.variablesSkipTypes() == null || arguments.variablesSkipTypes().isEmpty()
                ? Set.of()
                : EnumSet.copyOf(arguments.variablesSkipTypes());
        return new SectionAlignConfig(
                orDefault(arguments.variablesUpToColumn(), SectionAlignConfig.DEFAULT_UP_TO_COLUMN),
                SectionAlignConfig.DEFAULT_ARGUMENT_INDENT,
                orDefault(arguments.variablesMinWidth(), 0),
                orDefault(arguments.variablesFixedWidth(), 0),
                skipTypes);
    }

    private <T> T resolve(T cliValue, String envKey, Function<String, T> parser, T defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(parser)
                .orElse(defaultValue);
    }

    private int resolveInt(Integer cliValue, String envKey, int defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseInteger(envKey, value))
                .orElse(defaultValue);
    }

    private static <T> T orDefault(T value, T defaultValue) {
        return value != null ? value : defaultValue;
    }

    private static int parseInteger(String name, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    static List<Integer> parseWidths(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> parseInteger(ENV_WIDTHS, value))
                .collect(Collectors.toList());
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
