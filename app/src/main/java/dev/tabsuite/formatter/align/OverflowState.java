package dev.tabsuite.formatter.align;

/**
 * Mutable state of a single line while its cells are placed into columns.
 */
final class OverflowState {

    private final LineLayout.Builder layout = new LineLayout.Builder();
    private int column;
    private int misaligned;
    private int carriedOverflow;

    int column() {
        return column;
    }

    void column(int value) {
        column = value;
    }

    void advanceColumn() {
        column++;
    }

    int misaligned() {
        return misaligned;
    }

    void countMisaligned() {
        misaligned++;
    }

    /**
     * Distance the next cell starts past its column boundary.
     */
    int carriedOverflow() {
        return carriedOverflow;
    }

    void carriedOverflow(int value) {
        carriedOverflow = value;
    }

    void realigned() {
        carriedOverflow = 0;
        misaligned = 0;
    }

    void emit(String text, int padding) {
        layout.add(text, padding);
    }

    void repadLast(int padding) {
        layout.repad(padding);
    }

    LineLayout.Builder layout() {
        return layout;
    }
}
