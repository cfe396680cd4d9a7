package dev.tabsuite.formatter.align;

import dev.tabsuite.formatter.config.SectionAlignConfig;
import dev.tabsuite.formatter.config.VariableType;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.Statement;
import dev.tabsuite.formatter.model.StatementKind;

public class VariablesSectionAligner extends SectionAligner {

    public VariablesSectionAligner(SectionAlignConfig config, WhitespaceConfig whitespace) {
        super(config, whitespace);
    }

    @Override
    public boolean accepts(Statement statement) {
        if (statement.kind() != StatementKind.VARIABLE) {
            return false;
        }
        String name = statement.leadingText();
        for (VariableType type : config.skipTypes()) {
            if (type.matches(name)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected int columnWidth(int longest) {
        int length = longest + whitespace.spaceCount();
        if (config.minWidth() > 0) {
            length = Math.max(length, config.minWidth());
        }
        return ColumnWidths.roundToFour(length);
    }

    @Override
    protected int alignedSeparator(int index, Cell cell, int columnWidth, boolean indentArguments) {
        if (config.fixedWidth() > 0) {
            return Math.max(config.fixedWidth() - cell.width(), whitespace.spaceCount());
        }
        return Math.max(columnWidth - cell.width(), 1);
    }
}
