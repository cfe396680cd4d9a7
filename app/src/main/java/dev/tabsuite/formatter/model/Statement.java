package dev.tabsuite.formatter.model;

import dev.tabsuite.formatter.block.BlockElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One logical statement, possibly spread over several physical lines.
 *
 * @param kind       statement shape
 * @param lines      physical lines; continuation lines start with the continuation marker
 * @param sourceLine 1-based line the statement started at, or 0 when synthesized
 */
public record Statement(StatementKind kind, List<Line> lines, int sourceLine) implements BlockElement {

    public Statement {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lines, "lines");
        lines = List.copyOf(lines);
    }

    public static Statement comment(Cell comment) {
        return new Statement(StatementKind.COMMENT, List.of(Line.of(comment)), 0);
    }

    public Statement withLines(List<Line> newLines) {
        return new Statement(kind, newLines, sourceLine);
    }

    /**
     * All cells of the statement across its physical lines, in order.
     */
    public List<Cell> cells() {
        List<Cell> cells = new ArrayList<>();
        for (Line line : lines) {
            cells.addAll(line.cells());
        }
        return cells;
    }

    /**
     * Text of the first data cell, used to identify settings such as {@code Library} or {@code [Tags]}.
     */
    public String leadingText() {
        for (Cell cell : cells()) {
            if (cell.isData()) {
                return cell.text();
            }
        }
        return "";
    }
}
