package dev.tabsuite.formatter.render;

import dev.tabsuite.formatter.block.BlockKind;

/**
 * Raised when a statement has a shape the layout engine cannot render.
 */
public class LayoutException extends RuntimeException {

    private final BlockKind blockKind;
    private final int statementIndex;
    private final int sourceLine;

    public LayoutException(String message, BlockKind blockKind, int statementIndex, int sourceLine) {
        super(message);
        this.blockKind = blockKind;
        this.statementIndex = statementIndex;
        this.sourceLine = sourceLine;
    }

    public BlockKind blockKind() {
        return blockKind;
    }

    /**
     * 0-based index of the statement within its block.
     */
    public int statementIndex() {
        return statementIndex;
    }

    public int sourceLine() {
        return sourceLine;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " (block=" + blockKind + ", statement=" + statementIndex + ", line=" + sourceLine + ")";
    }
}
