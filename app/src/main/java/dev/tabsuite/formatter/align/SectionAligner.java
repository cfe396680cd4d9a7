package dev.tabsuite.formatter.align;

import dev.tabsuite.formatter.config.SectionAlignConfig;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aligns the leading columns of a settings or variables section to the longest cell in each column.
 */
public abstract class SectionAligner {

    protected final SectionAlignConfig config;
    protected final WhitespaceConfig whitespace;
    /** Number of aligned leading columns, or {@code -1} when every column is aligned. */
    protected final int upTo;

    protected SectionAligner(SectionAlignConfig config, WhitespaceConfig whitespace) {
        this.config = Objects.requireNonNull(config, "config");
        this.whitespace = Objects.requireNonNull(whitespace, "whitespace");
        this.upTo = config.upToColumn() - 1;
    }

    /**
     * Whether the statement takes part in the section alignment.
     */
    public abstract boolean accepts(Statement statement);

    /**
     * Longest cell per column across the given statements, adjusted to the column width.
     */
    public Map<Integer, Integer> lookUp(List<Statement> statements) {
        Map<Integer, Integer> longest = new HashMap<>();
        for (Statement statement : statements) {
            for (Line line : statement.lines()) {
                List<Cell> cells = line.cells();
                int limit = Math.min(measuredColumns(statement, line), cells.size());
                for (int index = 0; index < limit; index++) {
                    longest.merge(index, cells.get(index).width(), Math::max);
                }
            }
        }
        Map<Integer, Integer> lookUp = new HashMap<>();
        longest.forEach((column, length) -> lookUp.put(column, columnWidth(length)));
        return lookUp;
    }

    public List<LineLayout> align(Statement statement, Map<Integer, Integer> lookUp) {
        List<LineLayout> layouts = new ArrayList<>();
        for (Line line : statement.lines()) {
            List<Cell> cells = line.cells();
            LineLayout.Builder builder = new LineLayout.Builder();
            int aligned = upTo != -1 ? upTo : cells.size() - 1;
            boolean indentArguments = indentsArguments(statement, line);
            for (int index = 0; index < cells.size(); index++) {
                Cell cell = cells.get(index);
                int padding = 0;
                if (index < cells.size() - 1) {
                    padding = index < aligned
                            ? alignedSeparator(index, cell, lookUp.getOrDefault(index, 0), indentArguments)
                            : whitespace.spaceCount();
                }
                builder.add(cell.text(), padding);
            }
            layouts.add(builder.build());
        }
        return layouts;
    }

    protected int measuredColumns(Statement statement, Line line) {
        return upTo != -1 ? upTo : line.cells().size();
    }

    protected boolean indentsArguments(Statement statement, Line line) {
        return false;
    }

    protected abstract int columnWidth(int longest);

    protected abstract int alignedSeparator(int index, Cell cell, int columnWidth, boolean indentArguments);
}
