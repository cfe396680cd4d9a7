package dev.tabsuite.formatter.align;

import dev.tabsuite.formatter.config.AlignmentConfig;
import dev.tabsuite.formatter.config.AlignmentType;
import dev.tabsuite.formatter.config.OverflowPolicy;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Computes column widths from the statements directly owned by a block.
 *
 * <p>A cell is measured as its length plus the separator, rounded up to a multiple of four.
 * Cells that exceed the configured cap of their column end the measurement of their line;
 * under {@link OverflowPolicy#IGNORE_LINE} the whole line is left out instead. Statements kept out of
 * alignment by {@link StatementSkips} are not measured.</p>
 */
public class ColumnWidthCalculator {

    private final AlignmentConfig alignment;
    private final int spaceCount;
    private final StatementSkips skips;

    public ColumnWidthCalculator(AlignmentConfig alignment, WhitespaceConfig whitespace) {
        this(alignment, whitespace, StatementSkips.none());
    }

    public ColumnWidthCalculator(AlignmentConfig alignment, WhitespaceConfig whitespace, StatementSkips skips) {
        this.alignment = Objects.requireNonNull(alignment, "alignment");
        this.spaceCount = Objects.requireNonNull(whitespace, "whitespace").spaceCount();
        this.skips = Objects.requireNonNull(skips, "skips");
    }

    public BlockWidths calculate(List<Statement> statements) {
        Map<Integer, List<Integer>> keywordLengths = new TreeMap<>();
        Map<Integer, List<Integer>> settingLengths = new TreeMap<>();
        for (Statement statement : statements) {
            if (skips.skips(statement)) {
                continue;
            }
            switch (statement.kind()) {
                case KEYWORD_CALL -> measure(statement, keywordLengths, 0, false);
                case COMMENT -> {
                    if (alignment.alignComments()) {
                        measure(statement, keywordLengths, 0, true);
                    }
                }
                case SETTING, RETURN -> measure(statement, settingLengths, 0, false);
                case TEMPLATE_SETTING -> measure(statement, settingLengths, 1, false);
                case DOCUMENTATION -> {
                    if (!alignment.skipDocumentation()) {
                        String name = statement.leadingText();
                        record(settingLengths, 0, ColumnWidths.roundToFour(name.codePointCount(0, name.length()) + spaceCount));
                    }
                }
                default -> {
                    // not aligned
                }
            }
        }
        if (!alignment.alignSettingsSeparately()) {
            settingLengths.forEach((column, lengths) -> keywordLengths.computeIfAbsent(column, key -> new ArrayList<>()).addAll(lengths));
            ColumnWidths shared = resolve(keywordLengths);
            return new BlockWidths(shared, shared);
        }
        return new BlockWidths(resolve(keywordLengths), resolve(settingLengths));
    }

    private void measure(Statement statement, Map<Integer, List<Integer>> lengths, int upTo, boolean includeComments) {
        for (Line line : statement.lines()) {
            Map<Integer, Integer> lineLengths = new HashMap<>();
            int column = 0;
            for (Cell cell : line.cells()) {
                if (cell.isComment() && !includeComments) {
                    continue;
                }
                if (upTo > 0 && column == upTo) {
                    break;
                }
                if (cell.isContinuation()) {
                    column++;
                    continue;
                }
                int cap = alignment.configuredWidth(column);
                int length = ColumnWidths.roundToFour(cell.width() + spaceCount);
                if (cap == 0 || length <= cap) {
                    lineLengths.put(column, length);
                } else if (alignment.overflowPolicy() == OverflowPolicy.IGNORE_LINE) {
                    lineLengths.clear();
                    break;
                } else {
                    break;
                }
                column++;
            }
            lineLengths.forEach((col, length) -> record(lengths, col, length));
        }
    }

    private static void record(Map<Integer, List<Integer>> lengths, int column, int length) {
        lengths.computeIfAbsent(column, key -> new ArrayList<>()).add(length);
    }

    private ColumnWidths resolve(Map<Integer, List<Integer>> lengths) {
        Map<Integer, Integer> resolved = new HashMap<>();
        lengths.forEach((column, measured) -> {
            int cap = alignment.configuredWidth(column);
            if (alignment.type() == AlignmentType.FIXED && cap != 0) {
                return;
            }
            int widest = 0;
            for (int length : measured) {
                if (cap == 0 || length <= cap) {
                    widest = Math.max(widest, length);
                }
            }
            resolved.put(column, widest == 0 ? cap : widest);
        });
        return new ColumnWidths(alignment, resolved, spaceCount);
    }
}
