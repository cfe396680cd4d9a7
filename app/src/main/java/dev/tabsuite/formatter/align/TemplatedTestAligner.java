package dev.tabsuite.formatter.align;

import dev.tabsuite.formatter.block.Block;
import dev.tabsuite.formatter.block.BlockElement;
import dev.tabsuite.formatter.block.Definition;
import dev.tabsuite.formatter.block.Section;
import dev.tabsuite.formatter.block.SectionKind;
import dev.tabsuite.formatter.block.SuiteDocument;
import dev.tabsuite.formatter.config.TemplatedConfig;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import dev.tabsuite.formatter.model.StatementKind;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lays out the test case section of a templated suite as a table. The header names the columns,
 * test names fill the first column and every row of template arguments starts in the second one.
 *
 * <p>Column {@code i} spans its widest cell rounded up to a multiple of four plus the separator.
 * Rows are placed from the start of the line, so nested rows only move right when a column is
 * narrower than their indentation.</p>
 */
public class TemplatedTestAligner {

    private static final Set<String> TEMPLATE_SETTINGS = Set.of("test template", "task template");
    private static final Set<StatementKind> UNALIGNED = EnumSet.of(
            StatementKind.COMMENT, StatementKind.EMPTY, StatementKind.BLOCK_HEADER, StatementKind.BLOCK_FOOTER,
            StatementKind.RAW);

    private final TemplatedConfig templated;
    private final int spaceCount;

    public TemplatedTestAligner(TemplatedConfig templated, WhitespaceConfig whitespace) {
        this.templated = Objects.requireNonNull(templated, "templated");
        this.spaceCount = Objects.requireNonNull(whitespace, "whitespace").spaceCount();
    }

    /**
     * Whether the settings section names a default template for every test.
     */
    public boolean isTemplated(SuiteDocument document) {
        for (Section section : document.sections()) {
            if (section.kind() != SectionKind.SETTINGS) {
                continue;
            }
            for (Statement statement : section.content().statements()) {
                if (statement.kind() == StatementKind.SECTION_SETTING
                        && TEMPLATE_SETTINGS.contains(statement.leadingText().toLowerCase(Locale.ROOT))
                        && firstValue(statement).filter(value -> !value.isEmpty()).isPresent()) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean aligns(Section section) {
        if (section.kind() != SectionKind.TEST_CASES && section.kind() != SectionKind.TASKS) {
            return false;
        }
        return !templated.onlyWithHeaders() || section.headerLine().dataCells().size() > 1;
    }

    /**
     * False for tests that switch the template off with {@code [Template]    NONE} or an empty value.
     */
    public boolean usesTemplate(Definition definition) {
        for (Statement statement : definition.body().statements()) {
            if (statement.kind() == StatementKind.TEMPLATE_SETTING) {
                Optional<String> value = firstValue(statement);
                if (value.isEmpty() || value.get().isEmpty() || value.get().equalsIgnoreCase("NONE")) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean alignsStatement(Statement statement) {
        return !UNALIGNED.contains(statement.kind());
    }

    /**
     * Raw column widths of the section, each rounded up to a multiple of four. The first column is
     * zero when neither the header names columns nor any test keeps arguments on its name line.
     */
    public List<Integer> columnWidths(Section section) {
        List<Integer> widths = new ArrayList<>();
        boolean headerWithColumns = false;
        boolean oneLineTest = false;
        List<Cell> header = section.headerLine().dataCells();
        if (header.size() > 1) {
            headerWithColumns = true;
            measure(widths, header, 0);
        }
        for (Definition definition : section.definitions()) {
            if (!usesTemplate(definition)) {
                continue;
            }
            List<Cell> nameCells = definition.nameLine().cells();
            if (!nameCells.isEmpty()) {
                measure(widths, nameCells.subList(0, 1), 0);
                List<Cell> row = nameCells.subList(1, nameCells.size());
                if (row.stream().anyMatch(Cell::isData)) {
                    oneLineTest = true;
                    measure(widths, row, 1);
                }
            }
            measureBlock(widths, definition.body());
        }
        if (!headerWithColumns && !oneLineTest && !widths.isEmpty()) {
            widths.set(0, 0);
        }
        widths.replaceAll(ColumnWidths::roundToFour);
        return widths;
    }

    /**
     * Widths for rows nested {@code depth} blocks deep; no column is narrower than the indentation.
     */
    public List<Integer> widthsAtDepth(List<Integer> widths, int depth) {
        if (depth <= 0) {
            return widths;
        }
        return widths.stream().map(width -> Math.max(width, depth * spaceCount)).toList();
    }

    public LineLayout alignHeader(Line headerLine, List<Integer> widths) {
        LineLayout.Builder builder = new LineLayout.Builder();
        List<Cell> data = headerLine.dataCells();
        for (int index = 0; index < data.size(); index++) {
            Cell cell = data.get(index);
            int separator = templated.minWidth() > 0
                    ? Math.max(spaceCount, templated.minWidth() - cell.width())
                    : Math.max(spaceCount, width(widths, index) - cell.width() + spaceCount);
            builder.add(cell.text(), separator);
        }
        appendComments(builder, headerLine.comments());
        return builder.build();
    }

    /**
     * Aligns the arguments following the test name on its own line; empty when the name stands alone.
     */
    public Optional<LineLayout> alignNameRow(Line nameLine, List<Integer> widths) {
        List<Cell> cells = nameLine.cells();
        if (cells.size() < 2 || cells.subList(1, cells.size()).stream().noneMatch(Cell::isData)) {
            return Optional.empty();
        }
        return Optional.of(place(cells.get(0), cells.subList(1, cells.size()), widths));
    }

    public LineLayout alignRow(Line line, List<Integer> widths) {
        return place(null, line.cells(), widths);
    }

    private LineLayout place(Cell name, List<Cell> cells, List<Integer> widths) {
        LineLayout.Builder builder = new LineLayout.Builder();
        int position = 0;
        if (name != null) {
            builder.add(name.text(), 0);
            position = name.width();
        }
        int expected = 0;
        for (int index = 0; index < cells.size(); index++) {
            Cell cell = cells.get(index);
            int separator = spaceCount;
            if (index < widths.size()) {
                expected += span(widths.get(index));
                separator = expected - position;
            }
            if (separator < spaceCount && (name != null || index > 0)) {
                separator = spaceCount;
            }
            if (name == null && index == 0) {
                builder.add("", separator);
            } else {
                builder.repad(separator);
            }
            builder.add(cell.text(), 0);
            position += separator + cell.width();
        }
        return builder.build();
    }

    private int span(int width) {
        return templated.minWidth() > 0 ? Math.max(width + spaceCount, templated.minWidth()) : width + spaceCount;
    }

    private void measureBlock(List<Integer> widths, Block block) {
        for (BlockElement element : block.body()) {
            if (element instanceof Statement statement) {
                if (alignsStatement(statement)) {
                    statement.lines().forEach(line -> measure(widths, line.cells(), 1));
                }
            } else if (element instanceof Block child) {
                measureBlock(widths, child);
            }
        }
    }

    private static void measure(List<Integer> widths, List<Cell> cells, int firstColumn) {
        for (int index = 0; index < cells.size(); index++) {
            int column = firstColumn + index;
            while (widths.size() <= column) {
                widths.add(0);
            }
            widths.set(column, Math.max(widths.get(column), cells.get(index).width()));
        }
    }

    private void appendComments(LineLayout.Builder builder, List<Cell> comments) {
        for (Cell comment : comments) {
            builder.repad(spaceCount);
            builder.add(comment.text(), 0);
        }
    }

    private static int width(List<Integer> widths, int column) {
        return column < widths.size() ? widths.get(column) : 0;
    }

    private static Optional<String> firstValue(Statement statement) {
        return statement.cells().stream().filter(Cell::isData).skip(1).map(Cell::text).findFirst();
    }
}
