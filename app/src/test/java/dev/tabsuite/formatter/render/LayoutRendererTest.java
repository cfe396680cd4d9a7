package dev.tabsuite.formatter.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.tabsuite.formatter.block.Block;
import dev.tabsuite.formatter.block.BlockKind;
import dev.tabsuite.formatter.config.AlignmentConfig;
import dev.tabsuite.formatter.config.AlignmentType;
import dev.tabsuite.formatter.config.EnabledTransforms;
import dev.tabsuite.formatter.config.FormatterConfig;
import dev.tabsuite.formatter.config.OverflowPolicy;
import dev.tabsuite.formatter.config.SkipConfig;
import dev.tabsuite.formatter.config.SkippedSetting;
import dev.tabsuite.formatter.config.SplitConfig;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.CellRole;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import dev.tabsuite.formatter.model.StatementKind;
import dev.tabsuite.formatter.parse.SourceReader;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class LayoutRendererTest {

    private static final String KEYWORD = "Looooooooonger Keyword Name";

    @Test
    void alignsBodyCellsToFixedColumns() {
        List<String> output = format(FormatterConfig.defaults(),
                "*** Test Cases ***",
                "Example",
                "    ${assign}  " + KEYWORD + "    ${argument}\tlast",
                "    Single");

        assertThat(output).containsExactly(
                "*** Test Cases ***",
                "Example",
                "    ${assign}" + spaces(15) + KEYWORD + spaces(21) + "${argument}" + spaces(13) + "last",
                "    Single");
    }

    @Test
    void splitsTooLongStatementOneArgumentPerLine() {
        FormatterConfig config = FormatterConfig.defaults().withWhitespace(new WhitespaceConfig(4, 4, 4, 80));

        List<String> output = format(config,
                "*** Test Cases ***",
                "Example",
                "    ${assign}    " + KEYWORD + "    ${argument}    last");

        assertThat(output).containsExactly(
                "*** Test Cases ***",
                "Example",
                "    ${assign}" + spaces(15) + KEYWORD,
                "    ..." + spaces(21) + "${argument}",
                "    ..." + spaces(21) + "last");
        assertThat(output).allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(80));
    }

    @Test
    void alignedStatementsIgnorePackingAndSplitOneArgumentPerLine() {
        FormatterConfig config = FormatterConfig.defaults()
                .withWhitespace(new WhitespaceConfig(4, 4, 4, 80))
                .withSplit(new SplitConfig(false, true, true, false, false, false));

        List<String> output = format(config,
                "*** Test Cases ***",
                "Example",
                "    Keyword    aaaaaaaaaa    bbbbbbbbbb    cccccccccc    dddddddddd    eeeeeeeeee    ffffffffff");

        assertThat(output).containsExactly(
                "*** Test Cases ***",
                "Example",
                "    Keyword",
                "    ..." + spaces(21) + "aaaaaaaaaa",
                "    ..." + spaces(21) + "bbbbbbbbbb",
                "    ..." + spaces(21) + "cccccccccc",
                "    ..." + spaces(21) + "dddddddddd",
                "    ..." + spaces(21) + "eeeeeeeeee",
                "    ..." + spaces(21) + "ffffffffff");
    }

    @Test
    void alignedCommentsTakeAColumn() {
        FormatterConfig config = FormatterConfig.defaults().withAlignment(new AlignmentConfig(List.of(24),
                AlignmentType.FIXED, OverflowPolicy.OVERFLOW, 2, true, false, true, false));

        List<String> output = format(config,
                "*** Test Cases ***",
                "Example",
                "    Log    hello    # note",
                "    # standalone");

        assertThat(output).containsExactly(
                "*** Test Cases ***",
                "Example",
                "    Log" + spaces(21) + "hello" + spaces(19) + "# note",
                "    # standalone");
    }

    @Test
    void trailingCommentsStayAfterTheLastCellByDefault() {
        List<String> output = format(FormatterConfig.defaults(),
                "*** Test Cases ***",
                "Example",
                "    Log    hello    # note");

        assertThat(output).containsExactly(
                "*** Test Cases ***",
                "Example",
                "    Log" + spaces(21) + "hello    # note");
    }

    @Test
    void skippedCommentsDoNotMakeALineTooLong() {
        String comment = "# comment that pushes this line past sixty";
        FormatterConfig config = FormatterConfig.defaults()
                .withWhitespace(new WhitespaceConfig(4, 4, 4, 60))
                .withSplit(new SplitConfig(true, true, true, false, false, true));

        List<String> output = format(config,
                "*** Test Cases ***",
                "Example",
                "    Log    hello    " + comment);

        assertThat(output).containsExactly(
                "*** Test Cases ***",
                "Example",
                "    Log" + spaces(21) + "hello    " + comment);
    }

    @Test
    void measuredCommentsMakeALineTooLong() {
        String comment = "# comment that pushes this line past sixty";
        FormatterConfig config = FormatterConfig.defaults().withWhitespace(new WhitespaceConfig(4, 4, 4, 60));

        List<String> output = format(config,
                "*** Test Cases ***",
                "Example",
                "    Log    hello    " + comment);

        assertThat(output).containsExactly(
                "*** Test Cases ***",
                "Example",
                "    Log    " + comment,
                "    ..." + spaces(21) + "hello");
    }

    @Test
    void skippedStatementsKeepSingleSeparators() {
        FormatterConfig config = FormatterConfig.defaults().withSkip(new SkipConfig(Set.of("log many"), List.of("^Run "),
                Set.of(SkippedSetting.TAGS)));

        List<String> output = format(config,
                "*** Test Cases ***",
                "Example",
                "    [Tags]    smoke",
                "    [Setup]    Prepare",
                "    Log Many          a    b",
                "    Run Keyword    Log    x",
                "    Log    x");

        assertThat(output).containsExactly(
                "*** Test Cases ***",
                "Example",
                "    [Tags]    smoke",
                "    [Setup]" + spaces(17) + "Prepare",
                "    Log Many    a    b",
                "    Run Keyword    Log    x",
                "    Log" + spaces(21) + "x");
    }

    @Test
    void templatedSuiteIsAlignedAsATable() {
        FormatterConfig config = FormatterConfig.defaults()
                .withTransforms(EnabledTransforms.defaults().withAlignTemplatedTestCases(true));
        String[] source = {
                "*** Settings ***",
                "Test Template    Login With",
                "",
                "*** Test Cases ***    baz    qux",
                "# some comment",
                "test1    hi    hello",
                "test2 long test name    asdfasdf    asdsdfgsdfg",
                "    bar1    bar2"};

        List<String> output = format(config, source);

        assertThat(output).endsWith(
                "*** Test Cases ***      baz         qux",
                "# some comment",
                "test1                   hi          hello",
                "test2 long test name    asdfasdf    asdsdfgsdfg",
                "                        bar1        bar2");
        assertThat(format(config, output.toArray(String[]::new))).isEqualTo(output);
    }

    @Test
    void templatedRowsInsideLoopsKeepTheirColumns() {
        FormatterConfig config = FormatterConfig.defaults()
                .withTransforms(EnabledTransforms.defaults().withAlignTemplatedTestCases(true));

        List<String> output = format(config,
                "*** Settings ***",
                "Test Template    Check",
                "*** Test Cases ***",
                "Loop",
                "    FOR    ${i}    IN RANGE    3",
                "        ${i}  x",
                "    END",
                "Plain",
                "    [Template]    NONE",
                "    Log    hello");

        assertThat(output).endsWith(
                "*** Test Cases ***",
                "Loop",
                "    FOR    ${i}    IN RANGE    3",
                "        ${i}    x",
                "    END",
                "Plain",
                "    [Template]" + spaces(14) + "NONE",
                "    Log" + spaces(21) + "hello");
    }

    @Test
    void templatedAlignmentNeedsATemplatedSuite() {
        FormatterConfig config = FormatterConfig.defaults()
                .withTransforms(EnabledTransforms.defaults().withAlignTemplatedTestCases(true));

        List<String> output = format(config,
                "*** Test Cases ***    baz",
                "test1    hi");

        assertThat(output).containsExactly("*** Test Cases ***    baz", "test1    hi");
    }

    @Test
    void nestedBlocksAreAlignedIndependently() {
        FormatterConfig config = FormatterConfig.defaults()
                .withAlignment(AlignmentConfig.defaults().withType(AlignmentType.AUTO));

        List<String> output = format(config,
                "*** Keywords ***",
                "Example",
                "    Log    a",
                "    FOR    ${item}    IN    @{items}",
                "        Log Many    ${item}",
                "    END",
                "    Log    b");

        assertThat(output).containsExactly(
                "*** Keywords ***",
                "Example",
                "    Log     a",
                "    FOR    ${item}    IN    @{items}",
                "        Log Many    ${item}",
                "    END",
                "    Log     b");
    }

    @Test
    void alignsSettingsAndVariablesSections() {
        List<String> output = format(FormatterConfig.defaults(),
                "*** Settings ***",
                "Library    Collections",
                "Suite Setup    Log    hello",
                "",
                "*** Variables ***",
                "${A}    1",
                "${LONG_NAME}    2");

        assertThat(output).containsExactly(
                "*** Settings ***",
                "Library         Collections",
                "Suite Setup     Log    hello",
                "",
                "*** Variables ***",
                "${A}            1",
                "${LONG_NAME}    2");
    }

    @Test
    void disabledAlignmentOnlyNormalizesSeparators() {
        FormatterConfig config = FormatterConfig.defaults()
                .withTransforms(new EnabledTransforms(true, false, true, true, true, false));

        List<String> output = format(config,
                "*** Test Cases ***",
                "Example",
                "    Log          hello");

        assertThat(output).containsExactly("*** Test Cases ***", "Example", "    Log    hello");
    }

    @Test
    void formattingIsIdempotent() {
        List<String> source = List.of(
                "*** Settings ***",
                "Documentation    Example suite",
                "Library    Collections",
                "Test Tags    smoke    regression",
                "",
                "*** Variables ***",
                "${SHORT}    1",
                "@{LIST}    a    b    c",
                "",
                "*** Test Cases ***",
                "Example",
                "    [Documentation]    Checks things",
                "    ${value} =    Get Value    argument    # note",
                "    Log    ${value}",
                "    FOR    ${item}    IN    @{LIST}",
                "        Log Many    ${item}    another argument",
                "    END",
                "    IF    $value    Log    inline",
                "    Keyword With A Rather Long Name    first argument    second argument    third argument    fourth",
                "",
                "*** Keywords ***",
                "Get Value",
                "    [Arguments]    ${arg}",
                "    RETURN    ${arg}");
        FormatterConfig config = FormatterConfig.defaults();

        List<String> once = format(config, source.toArray(String[]::new));
        List<String> twice = format(config, once.toArray(String[]::new));

        assertThat(twice).isEqualTo(once);
        assertThat(once).contains(
                "Library         Collections",
                "Test Tags       smoke    regression",
                "    ${value} =" + spaces(14) + "Get Value" + spaces(15) + "argument    # note",
                "        Log Many" + spaces(16) + "${item}" + spaces(17) + "another argument",
                "    RETURN" + spaces(18) + "${arg}");
        assertThat(once).allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(120));
    }

    @Test
    void rejectsContinuationMarkerInsideALine() {
        LayoutRenderer renderer = new LayoutRenderer(FormatterConfig.defaults());
        Statement broken = new Statement(StatementKind.KEYWORD_CALL, List.of(Line.of(
                Cell.of("Log", CellRole.NAME), Cell.continuation(), Cell.of("x", CellRole.ARGUMENT))), 7);

        Throwable thrown = catchThrowable(() -> renderer.renderBlock(Block.of(BlockKind.BODY, 1, List.of(broken)), true));

        assertThat(thrown).isInstanceOf(LayoutException.class)
                .hasMessageContaining("line=7");
        assertThat(((LayoutException) thrown).blockKind()).isEqualTo(BlockKind.BODY);
    }

    private static List<String> format(FormatterConfig config, String... lines) {
        return new LayoutRenderer(config).render(new SourceReader().read(List.of(lines)));
    }

    private static String spaces(int count) {
        return " ".repeat(count);
    }
}
