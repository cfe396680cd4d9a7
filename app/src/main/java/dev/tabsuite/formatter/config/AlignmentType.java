package dev.tabsuite.formatter.config;

import java.util.Locale;

/**
 * How column widths are chosen.
 */
public enum AlignmentType {
    FIXED,
    AUTO;

    public static AlignmentType from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Alignment type must be provided");
        }
        try {
            return AlignmentType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported alignment type: " + raw + " (expected fixed or auto)", ex);
        }
    }
}
