package dev.tabsuite.formatter.config;

/**
 * Global spacing settings shared by every formatting step.
 *
 * @param spaceCount         width of the separator between cells
 * @param indent             width of one indentation level
 * @param continuationIndent gap after the continuation marker
 * @param lineLength         maximum line length
 */
public record WhitespaceConfig(int spaceCount, int indent, int continuationIndent, int lineLength) {

    public static final int DEFAULT_SPACE_COUNT = 4;
    public static final int DEFAULT_LINE_LENGTH = 120;

    public WhitespaceConfig {
        if (spaceCount < 1) {
            throw new IllegalArgumentException("space count must be at least 1");
        }
        if (indent < 1) {
            throw new IllegalArgumentException("indent must be at least 1");
        }
        if (continuationIndent < 1) {
            throw new IllegalArgumentException("continuation indent must be at least 1");
        }
        if (lineLength < 1) {
            throw new IllegalArgumentException("line length must be at least 1");
        }
    }

    public static WhitespaceConfig defaults() {
        return new WhitespaceConfig(DEFAULT_SPACE_COUNT, DEFAULT_SPACE_COUNT, DEFAULT_SPACE_COUNT, DEFAULT_LINE_LENGTH);
    }

    public String indentation(int level) {
        return " ".repeat(Math.max(0, level) * indent);
    }
}
