package dev.tabsuite.formatter.align;

import dev.tabsuite.formatter.config.AlignmentConfig;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.CellRole;
import dev.tabsuite.formatter.model.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Places the cells of a line into the columns of its block and decides what happens to cells
 * wider than their column.
 */
public class OverflowResolver {

    private final AlignmentConfig alignment;
    private final int minSeparator;

    public OverflowResolver(AlignmentConfig alignment, WhitespaceConfig whitespace) {
        this.alignment = Objects.requireNonNull(alignment, "alignment");
        this.minSeparator = Objects.requireNonNull(whitespace, "whitespace").spaceCount();
    }

    /**
     * Resolves the layout of one physical line.
     *
     * @param line           line to align
     * @param widths         column widths of the enclosing block
     * @param possibleAssign whether leading assignments may be kept out of the grid
     * @return the layout, or empty when the line has nothing to align
     */
    public Optional<LineLayout> resolve(Line line, ColumnWidths widths, boolean possibleAssign) {
        List<Cell> cells = alignment.alignComments() ? line.cells() : line.withoutComments();
        List<Cell> comments = alignment.alignComments() ? List.of() : line.comments();

        List<Cell> assignments = new ArrayList<>();
        List<Cell> tokens = new ArrayList<>(cells);
        if (possibleAssign && alignment.skipReturnValues()) {
            while (!tokens.isEmpty() && tokens.get(0).role() == CellRole.ASSIGNMENT) {
                assignments.add(tokens.remove(0));
            }
        }
        if (tokens.isEmpty()) {
            return Optional.empty();
        }

        OverflowState state = new OverflowState();
        startAfterAssignments(state, assignments, widths);

        int last = tokens.size() - 1;
        for (int index = 0; index < last; index++) {
            Cell cell = tokens.get(index);
            int length = cell.width();
            int width = widths.width(state.column());
            int separator;
            if (width == 0) {
                separator = ColumnWidths.roundToFour(length + minSeparator) - length;
            } else {
                separator = width - length - state.carriedOverflow();
                if (separator >= minSeparator) {
                    state.realigned();
                } else {
                    switch (alignment.overflowPolicy()) {
                        case IGNORE_LINE -> {
                            return Optional.of(fixedLayout(assignments, tokens, comments));
                        }
                        case IGNORE_REST -> {
                            return Optional.of(fixedRemainder(state, tokens, index, comments));
                        }
                        case COMPACT_OVERFLOW -> separator = compactOverflow(state, widths, tokens, index, width);
                        case OVERFLOW -> separator = overflow(state, widths, length, width);
                        default -> throw new IllegalStateException("Unknown overflow policy " + alignment.overflowPolicy());
                    }
                }
            }
            state.emit(cell.text(), Math.max(minSeparator, separator));
            state.advanceColumn();
        }
        state.emit(tokens.get(last).text(), 0);
        appendComments(state, comments);
        return Optional.of(state.layout().build());
    }

    private void startAfterAssignments(OverflowState state, List<Cell> assignments, ColumnWidths widths) {
        if (assignments.isEmpty()) {
            return;
        }
        int remaining = 0;
        for (int i = 0; i < assignments.size(); i++) {
            Cell assignment = assignments.get(i);
            remaining += assignment.width();
            if (i < assignments.size() - 1) {
                remaining += minSeparator;
                state.emit(assignment.text(), minSeparator);
            }
        }
        int column = 0;
        while (remaining > 0) {
            remaining -= widths.overflowWidth(column);
            column++;
        }
        int gap = -remaining;
        if (gap < minSeparator) {
            state.carriedOverflow(minSeparator - gap);
            gap = minSeparator;
        }
        state.column(column);
        state.emit(assignments.get(assignments.size() - 1).text(), gap);
    }

    private int overflow(OverflowState state, ColumnWidths widths, int length, int width) {
        int spanned = width;
        while (ColumnWidths.roundToFour(length + minSeparator) > spanned) {
            state.advanceColumn();
            spanned += widths.overflowWidth(state.column());
        }
        return spanned - length;
    }

    private int compactOverflow(OverflowState state, ColumnWidths widths, List<Cell> tokens, int index, int width) {
        int length = tokens.get(index).width();
        int required = length + minSeparator + state.carriedOverflow();
        int separator = minSeparator;
        int overflow = required - width;
        state.countMisaligned();
        int columnWidth = width;
        while (overflow > columnWidth) {
            state.advanceColumn();
            columnWidth = widths.overflowWidth(state.column());
            overflow -= columnWidth;
            state.countMisaligned();
        }
        state.carriedOverflow(overflow);
        if (state.misaligned() >= alignment.compactOverflowLimit() && overflow > 0 && index + 1 < tokens.size()) {
            Cell next = tokens.get(index + 1);
            int nextWidth = widths.overflowWidth(state.column() + 1);
            if (nextWidth - overflow - next.width() < minSeparator) {
                state.advanceColumn();
                separator = nextWidth - overflow + minSeparator;
                state.carriedOverflow(0);
            }
        }
        return separator;
    }

    private LineLayout fixedLayout(List<Cell> assignments, List<Cell> tokens, List<Cell> comments) {
        List<String> texts = new ArrayList<>();
        assignments.forEach(cell -> texts.add(cell.text()));
        tokens.forEach(cell -> texts.add(cell.text()));
        comments.forEach(cell -> texts.add(cell.text()));
        return LineLayout.fixed(texts, minSeparator);
    }

    private LineLayout fixedRemainder(OverflowState state, List<Cell> tokens, int from, List<Cell> comments) {
        for (int index = from; index < tokens.size(); index++) {
            state.emit(tokens.get(index).text(), minSeparator);
        }
        appendComments(state, comments);
        return state.layout().build();
    }

    private void appendComments(OverflowState state, List<Cell> comments) {
        for (Cell comment : comments) {
            state.repadLast(minSeparator);
            state.emit(comment.text(), 0);
        }
    }
}
