package dev.tabsuite.formatter.model;

import java.util.Objects;

/**
 * Single token of a statement line.
 *
 * @param text         display text without surrounding separators
 * @param role         role of the token
 * @param sourceColumn 1-based column the token started at, or 0 when the cell was synthesized
 */
public record Cell(String text, CellRole role, int sourceColumn) {

    public static final String CONTINUATION_MARKER = "...";

    public Cell {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(role, "role");
        if (sourceColumn < 0) {
            throw new IllegalArgumentException("sourceColumn must be zero or greater");
        }
    }

    public static Cell of(String text, CellRole role) {
        return new Cell(text, role, 0);
    }

    public static Cell continuation() {
        return new Cell(CONTINUATION_MARKER, CellRole.CONTINUATION, 0);
    }

    /**
     * Display width, one column per code point.
     */
    public int width() {
        return text.codePointCount(0, text.length());
    }

    public boolean isComment() {
        return role == CellRole.COMMENT;
    }

    public boolean isContinuation() {
        return role == CellRole.CONTINUATION;
    }

    public boolean isData() {
        return role.isData();
    }

    public Cell withText(String value) {
        return new Cell(value, role, sourceColumn);
    }
}
