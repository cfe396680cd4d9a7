package dev.tabsuite.formatter.block;

/**
 * Kinds of independently aligned scopes.
 */
public enum BlockKind {
    BODY,
    FOR,
    IF_BRANCH,
    WHILE,
    TRY_BRANCH,
    SETTINGS_SECTION,
    VARIABLES_SECTION
}
