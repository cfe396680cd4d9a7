package dev.tabsuite.formatter.config;

import java.util.Locale;

/**
 * What to do with a cell that does not fit its column.
 */
public enum OverflowPolicy {
    OVERFLOW,
    COMPACT_OVERFLOW,
    IGNORE_REST,
    IGNORE_LINE;

    public static OverflowPolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Overflow policy must be provided");
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return OverflowPolicy.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported overflow policy: " + raw
                    + " (expected overflow, compact_overflow, ignore_rest or ignore_line)", ex);
        }
    }
}
