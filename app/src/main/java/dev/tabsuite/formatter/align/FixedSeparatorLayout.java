package dev.tabsuite.formatter.align;

import dev.tabsuite.formatter.config.SplitConfig;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import dev.tabsuite.formatter.model.StatementKind;
import java.util.List;
import java.util.Objects;

/**
 * Lays out lines with a single fixed separator between cells, for content that is not column aligned.
 * Continuation lines put the continuation gap after the marker.
 */
public class FixedSeparatorLayout {

    private final WhitespaceConfig whitespace;
    private final SplitConfig split;

    public FixedSeparatorLayout(WhitespaceConfig whitespace, SplitConfig split) {
        this.whitespace = Objects.requireNonNull(whitespace, "whitespace");
        this.split = Objects.requireNonNull(split, "split");
    }

    public LineLayout layout(Statement statement, Line line) {
        return layout(line, continuationGap(statement));
    }

    public LineLayout layout(Line line, int continuationGap) {
        LineLayout.Builder builder = new LineLayout.Builder();
        for (Cell cell : line.cells()) {
            builder.add(cell.text(), cell.isContinuation() ? continuationGap : whitespace.spaceCount());
        }
        return builder.build();
    }

    public int continuationGap(Statement statement) {
        List<Cell> head = statement.lines().isEmpty() ? List.of() : statement.lines().get(0).cells();
        return continuationGap(statement.kind(), head);
    }

    /**
     * Gap after the continuation marker. With {@code align_new_line} continued cells start under the
     * second cell of the head line, unless every item goes to its own line.
     */
    public int continuationGap(StatementKind kind, List<Cell> headCells) {
        if (!split.alignNewLine() || splitsEveryItem(kind)) {
            return whitespace.continuationIndent();
        }
        List<Cell> data = headCells.stream().filter(Cell::isData).toList();
        if (data.size() < 2) {
            return whitespace.continuationIndent();
        }
        return Math.max(1, data.get(0).width() + whitespace.spaceCount() - Cell.CONTINUATION_MARKER.length());
    }

    public boolean splitsEveryItem(StatementKind kind) {
        return switch (kind) {
            case KEYWORD_CALL -> split.splitOnEveryArg();
            case VARIABLE -> split.splitOnEveryValue();
            case SETTING, SECTION_SETTING -> split.splitOnEverySettingArg();
            default -> true;
        };
    }

    /**
     * Width of the line when placed after {@code indentWidth} columns of indentation.
     */
    public int width(Line line, int continuationGap, int indentWidth) {
        String rendered = layout(line, continuationGap).render().stripTrailing();
        return indentWidth + rendered.codePointCount(0, rendered.length());
    }
}
