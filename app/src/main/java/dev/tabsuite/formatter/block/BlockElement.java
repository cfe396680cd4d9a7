package dev.tabsuite.formatter.block;

/**
 * Element of a block body: either a statement or a nested block.
 */
public interface BlockElement {
}
