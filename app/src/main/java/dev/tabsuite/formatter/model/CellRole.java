package dev.tabsuite.formatter.model;

/**
 * Role of a cell within its statement.
 */
public enum CellRole {
    NAME,
    ASSIGNMENT,
    ARGUMENT,
    SETTING_NAME,
    SETTING_VALUE,
    WITH_NAME_KEYWORD,
    COMMENT,
    CONTINUATION;

    public boolean isData() {
        return this != COMMENT && this != CONTINUATION;
    }
}
