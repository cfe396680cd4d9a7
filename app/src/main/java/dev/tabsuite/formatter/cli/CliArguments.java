package dev.tabsuite.formatter.cli;

import dev.tabsuite.formatter.config.AlignmentType;
import dev.tabsuite.formatter.config.LineEnding;
import dev.tabsuite.formatter.config.LogFormat;
import dev.tabsuite.formatter.config.OverflowPolicy;
import dev.tabsuite.formatter.config.SkippedSetting;
import dev.tabsuite.formatter.config.VariableType;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "tabsuite-format", mixinStandardHelpOptions = true,
        description = "Aligns columns and splits too long lines of tabular test suite files")
public class CliArguments {

    @CommandLine.Parameters(arity = "0..*", paramLabel = "PATH", description = "Files or directories to format (default: current directory)")
    private List<Path> paths = new ArrayList<>();

    @CommandLine.Option(names = "--check", description = "Report files that would be reformatted without writing them")
    private boolean check;

    @CommandLine.Option(names = "--diff", description = "Print a unified diff of every change")
    private boolean diff;

    @CommandLine.Option(names = "--no-overwrite", description = "Do not write formatted files back to disk")
    private boolean noOverwrite;

    @CommandLine.Option(names = "--widths", split = ",", paramLabel = "WIDTH", description = "Comma-separated column widths; 0 means unbounded")
    private List<Integer> widths;

    @CommandLine.Option(names = "--alignment-type", converter = AlignmentTypeConverter.class, description = "Column widths: fixed or auto")
    private AlignmentType alignmentType;

    @CommandLine.Option(names = "--handle-too-long", converter = OverflowPolicyConverter.class,
            description = "Too long cells: overflow, compact_overflow, ignore_rest or ignore_line")
    private OverflowPolicy handleTooLong;

    @CommandLine.Option(names = "--compact-overflow-limit", paramLabel = "COUNT", description = "Misaligned columns tolerated by compact_overflow")
    private Integer compactOverflowLimit;

    @CommandLine.Option(names = "--align-comments", description = "Align trailing comments with the other columns")
    private boolean alignComments;

    @CommandLine.Option(names = "--align-settings-separately", description = "Compute body setting column widths separately from keyword calls")
    private boolean alignSettingsSeparately;

    @CommandLine.Option(names = "--skip-documentation", negatable = true, description = "Leave documentation lines unaligned (default: true)")
    private Boolean skipDocumentation;

    @CommandLine.Option(names = "--skip-return-values", description = "Keep assignments out of the column grid")
    private boolean skipReturnValues;

    @CommandLine.Option(names = "--skip-keyword-call", split = ",", paramLabel = "NAME",
            description = "Keyword calls left unaligned, matched ignoring case, spaces and underscores")
    private List<String> skipKeywordCalls;

    @CommandLine.Option(names = "--skip-keyword-call-pattern", paramLabel = "REGEX",
            description = "Regular expression; keyword calls whose name contains a match are left unaligned")
    private List<String> skipKeywordCallPatterns;

    @CommandLine.Option(names = "--skip-setting", split = ",", converter = SkippedSettingConverter.class, paramLabel = "SETTING",
            description = "Body settings left unaligned: settings (all of them), arguments, setup, teardown, timeout, template, return, tags")
    private List<SkippedSetting> skipSettings;

    @CommandLine.Option(names = "--space-count", paramLabel = "COUNT", description = "Separator width between cells")
    private Integer spaceCount;

    @CommandLine.Option(names = "--indent", paramLabel = "COUNT", description = "Width of one indentation level")
    private Integer indent;

    @CommandLine.Option(names = "--continuation-indent", paramLabel = "COUNT", description = "Gap after the continuation marker")
    private Integer continuationIndent;

    @CommandLine.Option(names = "--line-length", paramLabel = "COUNT", description = "Maximum line length")
    private Integer lineLength;

    @CommandLine.Option(names = "--split-on-every-arg", negatable = true, description = "Put every keyword argument on its own line when splitting")
    private Boolean splitOnEveryArg;

    @CommandLine.Option(names = "--split-on-every-value", negatable = true, description = "Put every variable value on its own line when splitting")
    private Boolean splitOnEveryValue;

    @CommandLine.Option(names = "--split-on-every-setting-arg", negatable = true, description = "Put every setting argument on its own line when splitting")
    private Boolean splitOnEverySettingArg;

    @CommandLine.Option(names = "--split-single-value", description = "Split variables that hold a single value")
    private boolean splitSingleValue;

    @CommandLine.Option(names = "--align-new-line", description = "Align continuation lines with the first argument")
    private boolean alignNewLine;

    @CommandLine.Option(names = "--skip-comments", description = "Leave comments out of the line length check")
    private boolean skipComments;

    @CommandLine.Option(names = "--settings-up-to-column", paramLabel = "COLUMN", description = "Settings section columns to align; 0 aligns all")
    private Integer settingsUpToColumn;

    @CommandLine.Option(names = "--settings-argument-indent", paramLabel = "COUNT", description = "Extra indentation of continued setting arguments")
    private Integer settingsArgumentIndent;

    @CommandLine.Option(names = "--settings-min-width", paramLabel = "WIDTH", description = "Minimal settings column width")
    private Integer settingsMinWidth;

    @CommandLine.Option(names = "--settings-fixed-width", paramLabel = "WIDTH", description = "Fixed settings column width")
    private Integer settingsFixedWidth;

    @CommandLine.Option(names = "--variables-up-to-column", paramLabel = "COLUMN", description = "Variables section columns to align; 0 aligns all")
    private Integer variablesUpToColumn;

    @CommandLine.Option(names = "--variables-min-width", paramLabel = "WIDTH", description = "Minimal variables column width")
    private Integer variablesMinWidth;

    @CommandLine.Option(names = "--variables-fixed-width", paramLabel = "WIDTH", description = "Fixed variables column width")
    private Integer variablesFixedWidth;

    @CommandLine.Option(names = "--variables-skip-types", split = ",", converter = VariableTypeConverter.class, paramLabel = "TYPE",
            description = "Variable types left unaligned: scalar, list, dict")
    private List<VariableType> variablesSkipTypes;

    @CommandLine.Option(names = "--align-keywords", negatable = true, description = "Align keyword bodies (default: true)")
    private Boolean alignKeywords;

    @CommandLine.Option(names = "--align-test-cases", negatable = true, description = "Align test case and task bodies (default: true)")
    private Boolean alignTestCases;

    @CommandLine.Option(names = "--align-settings", negatable = true, description = "Align the settings section (default: true)")
    private Boolean alignSettings;

    @CommandLine.Option(names = "--align-variables", negatable = true, description = "Align the variables section (default: true)")
    private Boolean alignVariables;

    @CommandLine.Option(names = "--split-too-long-lines", negatable = true, description = "Split statements longer than the line length (default: true)")
    private Boolean splitTooLongLines;

    @CommandLine.Option(names = "--align-templated-test-cases", negatable = true,
            description = "Align test case sections of templated suites as a table (default: false)")
    private Boolean alignTemplatedTestCases;

    @CommandLine.Option(names = "--templated-only-with-headers", description = "Only align templated sections whose header names columns")
    private boolean templatedOnlyWithHeaders;

    @CommandLine.Option(names = "--templated-min-width", paramLabel = "WIDTH", description = "Minimal column width of templated sections")
    private Integer templatedMinWidth;

    @CommandLine.Option(names = "--line-ending", converter = LineEndingConverter.class, description = "Line ending: native, unix, windows or auto")
    private LineEnding lineEnding;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log per-file details")
    private boolean verbose;

    public List<Path> paths() {
        return paths == null ? List.of() : paths;
    }

    public boolean check() {
        return check;
    }

    public boolean diff() {
        return diff;
    }

    public boolean noOverwrite() {
        return noOverwrite;
    }

    public List<Integer> widths() {
        return widths;
    }

    public AlignmentType alignmentType() {
        return alignmentType;
    }

    public OverflowPolicy handleTooLong() {
        return handleTooLong;
    }

    public Integer compactOverflowLimit() {
        return compactOverflowLimit;
    }

    public boolean alignComments() {
        return alignComments;
    }

    public boolean alignSettingsSeparately() {
        return alignSettingsSeparately;
    }

    public Boolean skipDocumentation() {
        return skipDocumentation;
    }

    public boolean skipReturnValues() {
        return skipReturnValues;
    }

    public List<String> skipKeywordCalls() {
        return skipKeywordCalls;
    }

    public List<String> skipKeywordCallPatterns() {
        return skipKeywordCallPatterns;
    }

    public List<SkippedSetting> skipSettings() {
        return skipSettings;
    }

    public Integer spaceCount() {
        return spaceCount;
    }

    public Integer indent() {
        return indent;
    }

    public Integer continuationIndent() {
        return continuationIndent;
    }

    public Integer lineLength() {
        return lineLength;
    }

    public Boolean splitOnEveryArg() {
        return splitOnEveryArg;
    }

    public Boolean splitOnEveryValue() {
        return splitOnEveryValue;
    }

    public Boolean splitOnEverySettingArg() {
        return splitOnEverySettingArg;
    }

    public boolean splitSingleValue() {
        return splitSingleValue;
    }

    public boolean alignNewLine() {
        return alignNewLine;
    }

    public boolean skipComments() {
        return skipComments;
    }

    public Integer settingsUpToColumn() {
        return settingsUpToColumn;
    }

    public Integer settingsArgumentIndent() {
        return settingsArgumentIndent;
    }

    public Integer settingsMinWidth() {
        return settingsMinWidth;
    }

    public Integer settingsFixedWidth() {
        return settingsFixedWidth;
    }

    public Integer variablesUpToColumn() {
        return variablesUpToColumn;
    }

    public Integer variablesMinWidth() {
        return variablesMinWidth;
    }

    public Integer variablesFixedWidth() {
        return variablesFixedWidth;
    }

    public List<VariableType> variablesSkipTypes() {
        return variablesSkipTypes;
    }

    public Boolean alignKeywords() {
        return alignKeywords;
    }

    public Boolean alignTestCases() {
        return alignTestCases;
    }

    public Boolean alignSettings() {
        return alignSettings;
    }

    public Boolean alignVariables() {
        return alignVariables;
    }

    public Boolean splitTooLongLines() {
        return splitTooLongLines;
    }

    public Boolean alignTemplatedTestCases() {
        return alignTemplatedTestCases;
    }

    public boolean templatedOnlyWithHeaders() {
        return templatedOnlyWithHeaders;
    }

    public Integer templatedMinWidth() {
        return templatedMinWidth;
    }

    public LineEnding lineEnding() {
        return lineEnding;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
