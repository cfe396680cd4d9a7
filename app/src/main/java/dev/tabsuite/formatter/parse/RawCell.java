package dev.tabsuite.formatter.parse;

/**
 * Cell text as cut out of a source line, before a role is assigned.
 */
record RawCell(String text, int column, boolean comment) {

    boolean isContinuation() {
        return !comment && text.equals("...");
    }
}
