package dev.tabsuite.formatter.config;

import java.util.List;
import java.util.Objects;

/**
 * Column alignment settings for test case and keyword bodies.
 *
 * @param widths                  per-column caps; the last value repeats, {@code 0} means unbounded
 * @param type                    fixed or auto widths
 * @param overflowPolicy          handling of cells wider than their column
 * @param compactOverflowLimit    consecutive misaligned columns tolerated by compact overflow
 * @param alignComments           whether trailing comments take part in alignment
 * @param alignSettingsSeparately whether body settings get their own column widths
 * @param skipDocumentation       whether documentation lines are left as they are
 * @param skipReturnValues        whether assignments are kept out of the column grid
 */
public record AlignmentConfig(List<Integer> widths,
                              AlignmentType type,
                              OverflowPolicy overflowPolicy,
                              int compactOverflowLimit,
                              boolean alignComments,
                              boolean alignSettingsSeparately,
                              boolean skipDocumentation,
                              boolean skipReturnValues) {

    public static final int DEFAULT_WIDTH = 24;
    public static final int DEFAULT_COMPACT_OVERFLOW_LIMIT = 2;

    public AlignmentConfig {
        Objects.requireNonNull(widths, "widths");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        if (widths.isEmpty()) {
            throw new IllegalArgumentException("widths must contain at least one value");
        }
        for (Integer width : widths) {
            if (width == null || width < 0) {
                throw new IllegalArgumentException("widths must be zero or greater: " + widths);
            }
        }
        if (compactOverflowLimit < 1) {
            throw new IllegalArgumentException("compact overflow limit must be at least 1");
        }
        widths = List.copyOf(widths);
    }

    public static AlignmentConfig defaults() {
        return new AlignmentConfig(List.of(DEFAULT_WIDTH), AlignmentType.FIXED, OverflowPolicy.OVERFLOW,
                DEFAULT_COMPACT_OVERFLOW_LIMIT, false, false, true, false);
    }

    /**
     * Configured cap of a column; higher columns reuse the last configured value.
     */
    public int configuredWidth(int column) {
        return widths.get(Math.min(column, widths.size() - 1));
    }

    public AlignmentConfig withWidths(List<Integer> newWidths) {
        return new AlignmentConfig(newWidths, type, overflowPolicy, compactOverflowLimit, alignComments,
                alignSettingsSeparately, skipDocumentation, skipReturnValues);
    }

    public AlignmentConfig withType(AlignmentType newType) {
        return new AlignmentConfig(widths, newType, overflowPolicy, compactOverflowLimit, alignComments,
                alignSettingsSeparately, skipDocumentation, skipReturnValues);
    }

    public AlignmentConfig withOverflowPolicy(OverflowPolicy policy) {
        return new AlignmentConfig(widths, type, policy, compactOverflowLimit, alignComments,
                alignSettingsSeparately, skipDocumentation, skipReturnValues);
    }
}
