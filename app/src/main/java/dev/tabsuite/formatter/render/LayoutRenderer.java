package dev.tabsuite.formatter.render;

import dev.tabsuite.formatter.align.BlockWidths;
import dev.tabsuite.formatter.align.ColumnWidthCalculator;
import dev.tabsuite.formatter.align.ColumnWidths;
import dev.tabsuite.formatter.align.FixedSeparatorLayout;
import dev.tabsuite.formatter.align.LineLayout;
import dev.tabsuite.formatter.align.OverflowResolver;
import dev.tabsuite.formatter.align.SectionAligner;
import dev.tabsuite.formatter.align.SettingsSectionAligner;
import dev.tabsuite.formatter.align.StatementSkips;
import dev.tabsuite.formatter.align.TemplatedTestAligner;
import dev.tabsuite.formatter.align.VariablesSectionAligner;
import dev.tabsuite.formatter.block.Block;
import dev.tabsuite.formatter.block.BlockElement;
import dev.tabsuite.formatter.block.BlockKind;
import dev.tabsuite.formatter.block.Definition;
import dev.tabsuite.formatter.block.Section;
import dev.tabsuite.formatter.block.SuiteDocument;
import dev.tabsuite.formatter.config.EnabledTransforms;
import dev.tabsuite.formatter.config.FormatterConfig;
import dev.tabsuite.formatter.config.SplitConfig;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import dev.tabsuite.formatter.model.StatementKind;
import dev.tabsuite.formatter.split.LineSplitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the document depth-first and emits the formatted lines. Every block is aligned on its own:
 * column widths are computed from its direct statements only.
 */
public class LayoutRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LayoutRenderer.class);

    private final FormatterConfig config;
    private final WhitespaceConfig whitespace;
    private final ColumnWidthCalculator widthCalculator;
    private final OverflowResolver overflowResolver;
    private final FixedSeparatorLayout fixedLayout;
    private final LineSplitter splitter;
    private final LineSplitter alignedSplitter;
    private final SettingsSectionAligner settingsAligner;
    private final VariablesSectionAligner variablesAligner;
    private final StatementSkips skips;
    private final TemplatedTestAligner templatedAligner;

    public LayoutRenderer(FormatterConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.whitespace = config.whitespace();
        this.skips = new StatementSkips(config.skip());
        this.widthCalculator = new ColumnWidthCalculator(config.alignment(), whitespace, skips);
        this.overflowResolver = new OverflowResolver(config.alignment(), whitespace);
        this.fixedLayout = new FixedSeparatorLayout(whitespace, config.split());
        this.splitter = new LineSplitter(whitespace, config.split());
        SplitConfig split = config.split();
        if (!split.splitOnEveryArg() && aligningBodies(config.transforms()) && config.transforms().splitTooLongLines()) {
            LOGGER.warn("Packing arguments is not supported together with column alignment; aligned statements are split one argument per line");
        }
        this.alignedSplitter = new LineSplitter(whitespace, new SplitConfig(true, split.splitOnEveryValue(),
                split.splitOnEverySettingArg(), split.splitSingleValue(), false, split.skipComments()));
        this.settingsAligner = new SettingsSectionAligner(config.settingsSection(), whitespace,
                config.alignment().skipDocumentation());
        this.variablesAligner = new VariablesSectionAligner(config.variablesSection(), whitespace);
        this.templatedAligner = new TemplatedTestAligner(config.templated(), whitespace);
    }

    public List<String> render(SuiteDocument document) {
        boolean templated = config.transforms().alignTemplatedTestCases() && templatedAligner.isTemplated(document);
        List<String> output = new ArrayList<>();
        for (Section section : document.sections()) {
            if (templated && templatedAligner.aligns(section)) {
                output.addAll(renderTemplated(section));
                continue;
            }
            section.header().ifPresent(header -> output.addAll(renderPlain(header, 0)));
            output.addAll(renderSection(section));
        }
        return output;
    }

    private List<String> renderSection(Section section) {
        EnabledTransforms transforms = config.transforms();
        return switch (section.kind()) {
            case SETTINGS -> renderAlignedSection(section.content(), settingsAligner, transforms.alignSettings());
            case VARIABLES -> renderAlignedSection(section.content(), variablesAligner, transforms.alignVariables());
            case TEST_CASES, TASKS -> renderDefinitions(section, transforms.alignTestCases());
            case KEYWORDS -> renderDefinitions(section, transforms.alignKeywords());
            case PREAMBLE, COMMENTS, UNKNOWN -> renderBlock(section.content(), false);
        };
    }

    private List<String> renderDefinitions(Section section, boolean aligned) {
        List<String> output = new ArrayList<>(renderBlock(section.content(), false));
        for (Definition definition : section.definitions()) {
            output.addAll(renderPlain(definition.name(), 0));
            output.addAll(renderBlock(definition.body(), aligned));
        }
        return output;
    }

    /**
     * Renders a test case section of a templated suite as one table. Rows are never split; tests that
     * switch the template off are rendered like any other test.
     */
    private List<String> renderTemplated(Section section) {
        List<Integer> widths = templatedAligner.columnWidths(section);
        List<String> output = new ArrayList<>();
        section.header().ifPresent(header ->
                output.add(templatedAligner.alignHeader(section.headerLine(), widths).render().stripTrailing()));
        output.addAll(renderBlock(section.content(), false));
        for (Definition definition : section.definitions()) {
            if (!templatedAligner.usesTemplate(definition)) {
                output.addAll(renderPlain(definition.name(), 0));
                output.addAll(renderBlock(definition.body(), config.transforms().alignTestCases()));
                continue;
            }
            Optional<LineLayout> nameRow = templatedAligner.alignNameRow(definition.nameLine(), widths);
            if (nameRow.isPresent()) {
                output.add(nameRow.get().render().stripTrailing());
            } else {
                output.addAll(renderPlain(definition.name(), 0));
            }
            output.addAll(renderTemplatedBlock(definition.body(), widths));
        }
        return output;
    }

    private List<String> renderTemplatedBlock(Block block, List<Integer> widths) {
        List<Integer> levelWidths = templatedAligner.widthsAtDepth(widths, block.level() - 1);
        List<String> output = new ArrayList<>();
        int index = 0;
        for (BlockElement element : block.body()) {
            if (element instanceof Statement statement) {
                checkShape(statement, block.kind(), index);
                if (templatedAligner.alignsStatement(statement)) {
                    for (Line line : statement.lines()) {
                        output.add(templatedAligner.alignRow(line, levelWidths).render().stripTrailing());
                    }
                } else {
                    output.addAll(renderPlain(statement, block.level()));
                }
                index++;
            } else if (element instanceof Block child) {
                child.header().ifPresent(header -> output.addAll(renderPlain(header, child.level() - 1)));
                output.addAll(renderTemplatedBlock(child, widths));
                child.footer().ifPresent(footer -> output.addAll(renderPlain(footer, child.level() - 1)));
            }
        }
        return output;
    }

    /**
     * Renders a block and, recursively, its nested blocks.
     */
    public List<String> renderBlock(Block block, boolean aligned) {
        int indentWidth = block.level() * whitespace.indent();
        List<BlockElement> body = aligned
                ? splitUntilStable(block.body(), alignedSplitter, indentWidth, elements -> {
                    BlockWidths widths = widthCalculator.calculate(Block.statementsOf(elements));
                    return statement -> alignedTooLong(statement, widths, indentWidth);
                })
                : splitOnce(block.body(), indentWidth);
        BlockWidths widths = aligned ? widthCalculator.calculate(Block.statementsOf(body)) : null;

        List<String> output = new ArrayList<>();
        int index = 0;
        for (BlockElement element : body) {
            if (element instanceof Statement statement) {
                checkShape(statement, block.kind(), index);
                output.addAll(aligned ? renderAligned(statement, widths, block.level())
                        : renderPlain(statement, block.level()));
                index++;
            } else if (element instanceof Block child) {
                child.header().ifPresent(header -> output.addAll(renderPlain(header, child.level() - 1)));
                output.addAll(renderBlock(child, aligned));
                child.footer().ifPresent(footer -> output.addAll(renderPlain(footer, child.level() - 1)));
            }
        }
        return output;
    }

    private List<String> renderAlignedSection(Block section, SectionAligner aligner, boolean aligned) {
        List<BlockElement> body = aligned
                ? splitUntilStable(section.body(), splitter, 0, elements -> {
                    Map<Integer, Integer> lookUp = aligner.lookUp(accepted(elements, aligner));
                    return statement -> sectionTooLong(statement, aligner, lookUp);
                })
                : splitOnce(section.body(), 0);
        Map<Integer, Integer> lookUp = aligned ? aligner.lookUp(accepted(body, aligner)) : Map.of();

        List<String> output = new ArrayList<>();
        int index = 0;
        for (BlockElement element : body) {
            if (!(element instanceof Statement statement)) {
                throw new LayoutException("Nested block inside " + section.kind(), section.kind(), index, 0);
            }
            checkShape(statement, section.kind(), index);
            if (aligned && aligner.accepts(statement)) {
                for (LineLayout layout : aligner.align(statement, lookUp)) {
                    output.add(layout.render().stripTrailing());
                }
            } else {
                output.addAll(renderPlain(statement, 0));
            }
            index++;
        }
        return output;
    }

    private List<String> renderAligned(Statement statement, BlockWidths widths, int level) {
        if (skips.skips(statement)) {
            return renderPlain(statement, level);
        }
        return switch (statement.kind()) {
            case KEYWORD_CALL -> renderResolved(statement, widths.keywords(), level, true);
            case SETTING, RETURN, TEMPLATE_SETTING -> renderResolved(statement, widths.settings(), level, false);
            case DOCUMENTATION -> config.alignment().skipDocumentation()
                    ? renderPlain(statement, level)
                    : renderDocumentation(statement, widths.keywords(), level);
            default -> renderPlain(statement, level);
        };
    }

    private List<String> renderResolved(Statement statement, ColumnWidths widths, int level, boolean possibleAssign) {
        String indent = whitespace.indentation(level);
        List<String> output = new ArrayList<>();
        for (Line line : statement.lines()) {
            LineLayout layout = overflowResolver.resolve(line, widths, possibleAssign)
                    .orElseGet(() -> fixedLayout.layout(statement, line));
            output.add(withIndent(indent, layout));
        }
        return output;
    }

    /**
     * Pads the first separator of each documentation line to the first column; the text itself is kept.
     */
    private List<String> renderDocumentation(Statement statement, ColumnWidths widths, int level) {
        String indent = whitespace.indentation(level);
        int width = widths.width(0);
        List<String> output = new ArrayList<>();
        for (Line line : statement.lines()) {
            LineLayout.Builder builder = new LineLayout.Builder();
            List<Cell> cells = line.cells();
            for (int index = 0; index < cells.size(); index++) {
                Cell cell = cells.get(index);
                int padding = whitespace.spaceCount();
                if (index == 0) {
                    padding = width == 0
                            ? ColumnWidths.roundToFour(cell.width() + whitespace.spaceCount()) - cell.width()
                            : Math.max(width - cell.width(), whitespace.spaceCount());
                }
                builder.add(cell.text(), padding);
            }
            output.add(withIndent(indent, builder.build()));
        }
        return output;
    }

    private List<String> renderPlain(Statement statement, int level) {
        String indent = whitespace.indentation(level);
        List<String> output = new ArrayList<>();
        for (Line line : statement.lines()) {
            if (statement.kind() == StatementKind.RAW) {
                output.add(line.cells().isEmpty() ? "" : line.cells().get(0).text().stripTrailing());
            } else if (line.isEmpty()) {
                output.add("");
            } else {
                output.add(withIndent(indent, fixedLayout.layout(statement, line)));
            }
        }
        return output;
    }

    private static String withIndent(String indent, LineLayout layout) {
        String text = layout.render().stripTrailing();
        return text.isEmpty() ? "" : indent + text;
    }

    private boolean alignedTooLong(Statement statement, BlockWidths widths, int indentWidth) {
        if (!isBodySplitCandidate(statement) || !alignedSplitter.canSplit(statement)) {
            return false;
        }
        if (skips.skips(statement)) {
            return alignedSplitter.needsSplit(statement, indentWidth);
        }
        ColumnWidths columns = statement.kind() == StatementKind.KEYWORD_CALL ? widths.keywords() : widths.settings();
        boolean possibleAssign = statement.kind() == StatementKind.KEYWORD_CALL;
        for (Line line : statement.lines()) {
            Line measured = config.split().skipComments() ? new Line(line.withoutComments()) : line;
            Optional<LineLayout> layout = overflowResolver.resolve(measured, columns, possibleAssign);
            int width = layout.map(LineLayout::width)
                    .orElseGet(() -> fixedLayout.layout(statement, measured).width());
            if (alignedSplitter.isTooLong(indentWidth + width)) {
                return true;
            }
        }
        return false;
    }

    private boolean sectionTooLong(Statement statement, SectionAligner aligner, Map<Integer, Integer> lookUp) {
        if (!splitter.canSplit(statement)) {
            return false;
        }
        if (!aligner.accepts(statement)) {
            return splitter.needsSplit(statement, 0);
        }
        Statement measured = config.split().skipComments()
                ? statement.withLines(statement.lines().stream().map(line -> new Line(line.withoutComments())).toList())
                : statement;
        return aligner.align(measured, lookUp).stream()
                .anyMatch(layout -> splitter.isTooLong(layout.width()));
    }

    private static boolean isBodySplitCandidate(Statement statement) {
        return statement.kind() == StatementKind.KEYWORD_CALL || statement.kind() == StatementKind.SETTING;
    }

    /**
     * Splits too long statements until no statement changes. Widths are recomputed after every pass
     * because split statements change the cells measured for each column.
     */
    private List<BlockElement> splitUntilStable(List<BlockElement> body, LineSplitter lineSplitter, int indentWidth,
                                                Function<List<BlockElement>, Predicate<Statement>> tooLong) {
        if (!config.transforms().splitTooLongLines()) {
            return body;
        }
        List<BlockElement> current = body;
        int passes = Block.statementsOf(body).size() + 1;
        for (int pass = 0; pass < passes; pass++) {
            Predicate<Statement> exceeds = tooLong.apply(current);
            List<BlockElement> next = new ArrayList<>();
            boolean changed = false;
            for (BlockElement element : current) {
                if (element instanceof Statement statement && exceeds.test(statement)) {
                    List<Statement> parts = lineSplitter.split(statement, indentWidth);
                    changed |= !(parts.size() == 1 && parts.get(0).equals(statement));
                    next.addAll(parts);
                } else {
                    next.add(element);
                }
            }
            current = next;
            if (!changed) {
                break;
            }
        }
        return current;
    }

    private List<BlockElement> splitOnce(List<BlockElement> body, int indentWidth) {
        if (!config.transforms().splitTooLongLines()) {
            return body;
        }
        List<BlockElement> result = new ArrayList<>();
        for (BlockElement element : body) {
            if (element instanceof Statement statement && splitter.needsSplit(statement, indentWidth)) {
                result.addAll(splitter.split(statement, indentWidth));
            } else {
                result.add(element);
            }
        }
        return result;
    }

    private static List<Statement> accepted(List<BlockElement> elements, SectionAligner aligner) {
        return Block.statementsOf(elements).stream().filter(aligner::accepts).toList();
    }

    private static void checkShape(Statement statement, BlockKind blockKind, int index) {
        if (statement.kind() == StatementKind.RAW) {
            return;
        }
        List<Line> lines = statement.lines();
        for (int lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
            List<Cell> cells = lines.get(lineIndex).cells();
            for (int cellIndex = 1; cellIndex < cells.size(); cellIndex++) {
                if (cells.get(cellIndex).isContinuation()) {
                    throw new LayoutException("Continuation marker in the middle of a line", blockKind, index,
                            statement.sourceLine());
                }
            }
            if (lineIndex == 0 && lines.get(0).isContinuation()) {
                throw new LayoutException("Statement starts with a continuation marker", blockKind, index,
                        statement.sourceLine());
            }
        }
    }

    private static boolean aligningBodies(EnabledTransforms transforms) {
        return transforms.alignKeywords() || transforms.alignTestCases();
    }
}
