package dev.tabsuite.formatter.align;

import java.util.Objects;

/**
 * Column widths of one block, for keyword calls and for body settings.
 * Both refer to the same widths unless settings are aligned separately.
 */
public record BlockWidths(ColumnWidths keywords, ColumnWidths settings) {

    public BlockWidths {
        Objects.requireNonNull(keywords, "keywords");
        Objects.requireNonNull(settings, "settings");
    }
}
