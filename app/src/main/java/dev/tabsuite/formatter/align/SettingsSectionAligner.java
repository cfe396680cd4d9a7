package dev.tabsuite.formatter.align;

import dev.tabsuite.formatter.config.SectionAlignConfig;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.CellRole;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import dev.tabsuite.formatter.model.StatementKind;
import java.util.Locale;
import java.util.Set;

/**
 * Aligns the settings section. Continued arguments of setups, teardowns and imports are indented
 * by the configured argument indent.
 */
public class SettingsSectionAligner extends SectionAligner {

    private static final Set<String> SETTINGS_WITH_ARGUMENTS = Set.of(
            "suite setup", "suite teardown", "test setup", "test teardown",
            "task setup", "task teardown", "library", "variables");

    private final boolean skipDocumentation;

    public SettingsSectionAligner(SectionAlignConfig config, WhitespaceConfig whitespace, boolean skipDocumentation) {
        super(config, whitespace);
        this.skipDocumentation = skipDocumentation;
    }

    @Override
    public boolean accepts(Statement statement) {
        return statement.kind() == StatementKind.SECTION_SETTING
                || (statement.kind() == StatementKind.DOCUMENTATION && !skipDocumentation);
    }

    @Override
    protected int measuredColumns(Statement statement, Line line) {
        if (statement.kind() == StatementKind.DOCUMENTATION) {
            return 1;
        }
        return super.measuredColumns(statement, line);
    }

    @Override
    protected boolean indentsArguments(Statement statement, Line line) {
        if (!line.isContinuation()) {
            return false;
        }
        String setting = statement.leadingText().toLowerCase(Locale.ROOT);
        if (!SETTINGS_WITH_ARGUMENTS.contains(setting)) {
            return false;
        }
        if (setting.equals("library")) {
            return line.cells().stream().noneMatch(cell -> cell.role() == CellRole.WITH_NAME_KEYWORD);
        }
        return true;
    }

    @Override
    protected int columnWidth(int longest) {
        int length = config.minWidth() > 0 ? Math.max(longest, config.minWidth() - 4) : longest;
        return ColumnWidths.roundToFour(length);
    }

    @Override
    protected int alignedSeparator(int index, Cell cell, int columnWidth, boolean indentArguments) {
        if (config.fixedWidth() > 0) {
            return Math.max(config.fixedWidth() - cell.width(), whitespace.spaceCount());
        }
        int argumentIndent = indentArguments ? config.argumentIndent() : 0;
        if (indentArguments && index != 0) {
            return Math.max(columnWidth - cell.width() - argumentIndent + 4, whitespace.spaceCount());
        }
        return Math.max(columnWidth - cell.width() + argumentIndent + 4, whitespace.spaceCount());
    }
}
