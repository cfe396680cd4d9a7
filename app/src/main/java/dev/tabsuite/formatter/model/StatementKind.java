package dev.tabsuite.formatter.model;

/**
 * Closed set of statement shapes the layout engine distinguishes.
 */
public enum StatementKind {
    KEYWORD_CALL,
    SETTING,
    TEMPLATE_SETTING,
    DOCUMENTATION,
    RETURN,
    COMMENT,
    EMPTY,
    BLOCK_HEADER,
    BLOCK_FOOTER,
    INLINE_IF,
    VARIABLE,
    SECTION_SETTING,
    RAW
}
