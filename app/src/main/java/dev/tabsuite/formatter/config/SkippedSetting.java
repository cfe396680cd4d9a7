package dev.tabsuite.formatter.config;

import java.util.Locale;

/**
 * Body settings that can be left out of column alignment.
 */
public enum SkippedSetting {
    ALL,
    ARGUMENTS,
    SETUP,
    TEARDOWN,
    TIMEOUT,
    TEMPLATE,
    RETURN,
    TAGS;

    public static SkippedSetting from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Skipped setting must be provided");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "all", "settings" -> ALL;
            case "return", "return_statement" -> RETURN;
            case "arguments", "setup", "teardown", "timeout", "template", "tags" -> valueOf(value.toUpperCase(Locale.ROOT));
            default -> throw new IllegalArgumentException("Unsupported setting: " + raw
                    + " (expected settings, arguments, setup, teardown, timeout, template, return or tags)");
        };
    }
}
