package dev.tabsuite.formatter.split;

import dev.tabsuite.formatter.align.FixedSeparatorLayout;
import dev.tabsuite.formatter.config.SplitConfig;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.CellRole;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import dev.tabsuite.formatter.model.StatementKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rewrites statements longer than the line length into a head line plus continuation lines.
 * The result depends only on the cells of the statement, so splitting an already split statement
 * returns the same shape.
 */
public class LineSplitter {

    static final String EMPTY_VALUE = "${EMPTY}";

    private static final Set<String> SECTION_SETTINGS = Set.of(
            "library", "force tags", "default tags", "test tags", "keyword tags");
    private static final Set<String> BODY_SETTINGS = Set.of("[tags]", "[arguments]");
    private static final Set<CellRole> SETTING_SPLIT_ROLES = Set.of(
            CellRole.SETTING_VALUE, CellRole.ARGUMENT, CellRole.WITH_NAME_KEYWORD);

    private final WhitespaceConfig whitespace;
    private final SplitConfig split;
    private final FixedSeparatorLayout layout;

    public LineSplitter(WhitespaceConfig whitespace, SplitConfig split) {
        this.whitespace = Objects.requireNonNull(whitespace, "whitespace");
        this.split = Objects.requireNonNull(split, "split");
        this.layout = new FixedSeparatorLayout(whitespace, split);
    }

    /**
     * Whether the statement has a line with more than one data cell to distribute.
     */
    public boolean canSplit(Statement statement) {
        return statement.lines().stream().anyMatch(line -> line.dataCells().size() > 1);
    }

    public boolean isTooLong(int width) {
        return width > whitespace.lineLength();
    }

    /**
     * Whether any line of the statement, laid out with fixed separators, exceeds the line length.
     */
    public boolean needsSplit(Statement statement, int indentWidth) {
        if (!canSplit(statement)) {
            return false;
        }
        int gap = layout.continuationGap(statement);
        for (Line line : statement.lines()) {
            Line measured = split.skipComments() ? new Line(line.withoutComments()) : line;
            if (isTooLong(layout.width(measured, gap, indentWidth))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits the statement. Comments moved out of the statement are returned as separate statements,
     * before the statement for variables and after it for settings.
     */
    public List<Statement> split(Statement statement, int indentWidth) {
        return switch (statement.kind()) {
            case KEYWORD_CALL -> List.of(splitKeywordCall(statement, indentWidth));
            case SETTING -> splitSetting(statement, indentWidth, BODY_SETTINGS);
            case SECTION_SETTING -> splitSetting(statement, indentWidth, SECTION_SETTINGS);
            case VARIABLE -> splitVariable(statement, indentWidth);
            default -> List.of(statement);
        };
    }

    public Statement splitKeywordCall(Statement statement, int indentWidth) {
        List<Cell> cells = payload(statement);
        List<Cell> assignments = new ArrayList<>();
        Cell keyword = null;
        List<Cell> arguments = new ArrayList<>();
        List<Cell> comments = new ArrayList<>();
        for (Cell cell : cells) {
            if (cell.isComment()) {
                comments.add(cell);
            } else if (keyword == null && cell.role() == CellRole.ASSIGNMENT) {
                assignments.add(cell);
            } else if (keyword == null && cell.role() == CellRole.NAME) {
                keyword = cell;
            } else {
                arguments.add(cell);
            }
        }
        if (keyword == null) {
            return statement;
        }

        Distribution distribution = new Distribution(StatementKind.KEYWORD_CALL, indentWidth, split.splitOnEveryArg());
        List<Cell> head = new ArrayList<>(assignments);
        head.add(keyword);
        if (!assignments.isEmpty() && !distribution.fits(head, false)) {
            distribution.startLine(List.of(assignments.get(0)));
            for (Cell assignment : assignments.subList(1, assignments.size())) {
                distribution.breakLine();
                distribution.append(assignment);
            }
            distribution.breakLine();
            distribution.append(keyword);
        } else {
            distribution.startLine(head);
        }
        arguments.forEach(distribution::place);
        List<Line> lines = distribution.finish();
        if (!comments.isEmpty()) {
            List<Cell> first = new ArrayList<>(lines.get(0).cells());
            first.add(mergeComments(comments));
            lines.set(0, new Line(first));
        }
        return statement.withLines(lines);
    }

    private List<Statement> splitSetting(Statement statement, int indentWidth, Set<String> splittable) {
        String name = statement.leadingText().toLowerCase(Locale.ROOT);
        if (!splittable.contains(name)) {
            return List.of(statement);
        }
        List<Cell> cells = payload(statement);
        Distribution distribution = new Distribution(statement.kind(), indentWidth, split.splitOnEverySettingArg());
        List<Cell> comments = new ArrayList<>();
        distribution.startLine(List.of(cells.get(0)));
        for (Cell cell : cells.subList(1, cells.size())) {
            if (cell.isComment()) {
                comments.add(cell);
            } else if (SETTING_SPLIT_ROLES.contains(cell.role())) {
                distribution.place(cell);
            } else {
                distribution.append(cell);
            }
        }
        List<Statement> result = new ArrayList<>();
        result.add(statement.withLines(distribution.finish()));
        comments.forEach(comment -> result.add(Statement.comment(comment)));
        return result;
    }

    private List<Statement> splitVariable(Statement statement, int indentWidth) {
        List<Cell> cells = payload(statement);
        List<Cell> values = cells.subList(1, cells.size()).stream().filter(Cell::isData).collect(Collectors.toList());
        if (values.size() < 2 && !split.splitSingleValue()) {
            return List.of(statement);
        }
        Distribution distribution = new Distribution(StatementKind.VARIABLE, indentWidth, split.splitOnEveryValue());
        distribution.startLine(List.of(cells.get(0)));
        values.forEach(distribution::place);
        List<Statement> result = new ArrayList<>();
        cells.stream().filter(Cell::isComment).forEach(comment -> result.add(Statement.comment(comment)));
        result.add(statement.withLines(distribution.finish()));
        return result;
    }

    private static List<Cell> payload(Statement statement) {
        return statement.cells().stream().filter(cell -> !cell.isContinuation()).collect(Collectors.toList());
    }

    static Cell mergeComments(List<Cell> comments) {
        String merged = comments.stream()
                .map(comment -> stripCommentMarks(comment.text()))
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining(" "));
        return new Cell(merged.isEmpty() ? "#" : "# " + merged, CellRole.COMMENT, comments.get(0).sourceColumn());
    }

    private static String stripCommentMarks(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && (text.charAt(start) == '#' || text.charAt(start) == ' ')) {
            start++;
        }
        while (end > start && (text.charAt(end - 1) == '#' || text.charAt(end - 1) == ' ')) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * Builds the physical lines of one statement while cells are placed.
     */
    private final class Distribution {

        private final StatementKind kind;
        private final int indentWidth;
        private final boolean everyItem;
        private final List<Line> lines = new ArrayList<>();
        private List<Cell> current = new ArrayList<>();
        private Integer gap;

        Distribution(StatementKind kind, int indentWidth, boolean everyItem) {
            this.kind = kind;
            this.indentWidth = indentWidth;
            this.everyItem = everyItem;
        }

        void startLine(List<Cell> cells) {
            current = new ArrayList<>(cells);
        }

        void append(Cell cell) {
            current.add(cell);
        }

        void breakLine() {
            if (gap == null) {
                List<Cell> head = lines.isEmpty() ? current : lines.get(0).cells();
                gap = layout.continuationGap(kind, head);
            }
            lines.add(new Line(current));
            current = new ArrayList<>();
            current.add(Cell.continuation());
        }

        void place(Cell cell) {
            Cell value = cell.text().isEmpty() ? cell.withText(EMPTY_VALUE) : cell;
            if (everyItem || (hasData() && !fits(withCell(value), !lines.isEmpty()))) {
                breakLine();
            }
            current.add(value);
        }

        boolean fits(List<Cell> cells, boolean continued) {
            int continuationGap = continued && gap != null ? gap : whitespace.continuationIndent();
            return !isTooLong(layout.width(new Line(cells), continuationGap, indentWidth));
        }

        /**
         * Whether the current line holds a cell besides the continuation marker.
         */
        private boolean hasData() {
            return current.stream().anyMatch(Cell::isData);
        }

        private List<Cell> withCell(Cell cell) {
            List<Cell> candidate = new ArrayList<>(current);
            candidate.add(cell);
            return candidate;
        }

        List<Line> finish() {
            lines.add(new Line(current));
            return new ArrayList<>(lines);
        }
    }
}
