package dev.tabsuite.formatter.config;

import java.util.Locale;

/**
 * Line ending written after every output line.
 */
public enum LineEnding {
    NATIVE,
    UNIX,
    WINDOWS,
    AUTO;

    public static LineEnding from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Line ending must be provided");
        }
        try {
            return LineEnding.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported line ending: " + raw, ex);
        }
    }
}
