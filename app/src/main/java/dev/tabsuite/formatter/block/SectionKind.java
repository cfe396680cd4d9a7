package dev.tabsuite.formatter.block;

import java.util.Locale;

public enum SectionKind {
    PREAMBLE,
    SETTINGS,
    VARIABLES,
    TEST_CASES,
    TASKS,
    KEYWORDS,
    COMMENTS,
    UNKNOWN;

    /**
     * Resolves a section kind from a header line such as {@code *** Test Cases ***}.
     */
    public static SectionKind fromHeader(String header) {
        if (header == null) {
            return UNKNOWN;
        }
        String name = header.replace("*", " ").trim().toLowerCase(Locale.ROOT);
        int separator = name.indexOf("  ");
        if (separator > 0) {
            name = name.substring(0, separator);
        }
        return switch (name) {
            case "setting", "settings" -> SETTINGS;
            case "variable", "variables" -> VARIABLES;
            case "test case", "test cases" -> TEST_CASES;
            case "task", "tasks" -> TASKS;
            case "keyword", "keywords" -> KEYWORDS;
            case "comment", "comments" -> COMMENTS;
            default -> UNKNOWN;
        };
    }
}
