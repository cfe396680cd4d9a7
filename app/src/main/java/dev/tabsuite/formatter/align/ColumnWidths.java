package dev.tabsuite.formatter.align;

import dev.tabsuite.formatter.config.AlignmentConfig;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Target width per column for one block. Widths include the separator that follows a cell.
 */
public final class ColumnWidths {

    private final AlignmentConfig alignment;
    private final Map<Integer, Integer> resolved;
    private final int spaceCount;

    ColumnWidths(AlignmentConfig alignment, Map<Integer, Integer> resolved, int spaceCount) {
        this.alignment = Objects.requireNonNull(alignment, "alignment");
        this.resolved = new TreeMap<>(resolved);
        this.spaceCount = spaceCount;
    }

    /**
     * Configured widths without any measurement.
     */
    public static ColumnWidths configured(AlignmentConfig alignment, int spaceCount) {
        return new ColumnWidths(alignment, Map.of(), spaceCount);
    }

    /**
     * Width of the column, {@code 0} when the column is unbounded and nothing was measured for it.
     */
    public int width(int column) {
        Integer width = resolved.get(column);
        return width != null ? width : alignment.configuredWidth(column);
    }

    /**
     * Width used when a cell spills over into following columns; never zero.
     */
    public int overflowWidth(int column) {
        int width = width(column);
        return width == 0 ? spaceCount : width;
    }

    public static int roundToFour(int value) {
        int remainder = value % 4;
        return remainder == 0 ? value : value + 4 - remainder;
    }

    @Override
    public String toString() {
        return "ColumnWidths" + resolved;
    }
}
