package dev.tabsuite.formatter.config;

import java.util.Objects;
import java.util.Set;

/**
 * Alignment of the settings or variables section.
 *
 * @param upToColumn     number of leading columns aligned; {@code 0} aligns every column
 * @param argumentIndent extra indentation of continued setup, teardown and import arguments
 * @param minWidth       minimal column width, {@code 0} when unused
 * @param fixedWidth     fixed column width overriding the computed one, {@code 0} when unused
 * @param skipTypes      variable types left unaligned
 */
public record SectionAlignConfig(int upToColumn, int argumentIndent, int minWidth, int fixedWidth,
                                 Set<VariableType> skipTypes) {

    public static final int DEFAULT_UP_TO_COLUMN = 2;
    public static final int DEFAULT_ARGUMENT_INDENT = 4;

    public SectionAlignConfig {
        Objects.requireNonNull(skipTypes, "skipTypes");
        if (upToColumn < 0) {
            throw new IllegalArgumentException("up to column must be zero or greater");
        }
        if (argumentIndent < 0) {
            throw new IllegalArgumentException("argument indent must be zero or greater");
        }
        if (minWidth < 0 || fixedWidth < 0) {
            throw new IllegalArgumentException("min width and fixed width must be zero or greater");
        }
        skipTypes = Set.copyOf(skipTypes);
    }

    public static SectionAlignConfig defaults() {
        return new SectionAlignConfig(DEFAULT_UP_TO_COLUMN, DEFAULT_ARGUMENT_INDENT, 0, 0, Set.of());
    }
}
