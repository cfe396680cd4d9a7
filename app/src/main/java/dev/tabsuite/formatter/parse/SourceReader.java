package dev.tabsuite.formatter.parse;

import dev.tabsuite.formatter.block.Block;
import dev.tabsuite.formatter.block.BlockElement;
import dev.tabsuite.formatter.block.BlockKind;
import dev.tabsuite.formatter.block.Definition;
import dev.tabsuite.formatter.block.Section;
import dev.tabsuite.formatter.block.SectionKind;
import dev.tabsuite.formatter.block.SuiteDocument;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.CellRole;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import dev.tabsuite.formatter.model.StatementKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads space-separated suite and resource files into the block tree consumed by the layout engine.
 * Lines the reader does not understand are kept verbatim.
 */
public class SourceReader {

    private static final Pattern ASSIGNMENT = Pattern.compile("^[$@&]\\{.+\\}\\s?=?$");
    private static final Set<String> IMPORTS = Set.of("library", "resource", "variables");
    private static final Set<String> WITH_NAME = Set.of("WITH NAME", "AS");

    public SuiteDocument read(List<String> lines) {
        List<Section> sections = new ArrayList<>();
        SectionBuilder current = new SectionBuilder(SectionKind.PREAMBLE, null, new Line(List.of()));
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.startsWith("*")) {
                current.build().ifPresent(sections::add);
                current = new SectionBuilder(SectionKind.fromHeader(line), raw(line, lineNumber), cutLine(line));
            } else {
                current.accept(line, lineNumber);
            }
        }
        current.build().ifPresent(sections::add);
        return new SuiteDocument(sections);
    }

    /**
     * Whether the file uses the pipe-separated format, which this reader does not handle.
     */
    public boolean isPipeSeparated(List<String> lines) {
        return lines.stream().anyMatch(CellTokenizer::isPipeSeparated);
    }

    private static Statement raw(String line, int lineNumber) {
        return new Statement(StatementKind.RAW, List.of(Line.of(new Cell(line.stripTrailing(), CellRole.ARGUMENT, 1))), lineNumber);
    }

    /**
     * Cuts a header or definition name line into cells: the name, then arguments and a trailing comment.
     */
    private static Line cutLine(String line) {
        List<Cell> cells = new ArrayList<>();
        for (RawCell cell : CellTokenizer.tokenize(line)) {
            CellRole role = cell.comment() ? CellRole.COMMENT : cells.isEmpty() ? CellRole.NAME : CellRole.ARGUMENT;
            cells.add(new Cell(cell.text(), role, cell.column()));
        }
        return new Line(cells);
    }

    private static Statement emptyLine(int lineNumber) {
        return new Statement(StatementKind.EMPTY, List.of(new Line(List.of())), lineNumber);
    }

    private static boolean isBlank(String line) {
        return line.isBlank();
    }

    /**
     * Collects the statements of one section.
     */
    private final class SectionBuilder {

        private final SectionKind kind;
        private final Statement header;
        private final Line headerLine;
        private final BlockBuilder content;
        private final List<Definition> definitions = new ArrayList<>();
        private Statement definitionName;
        private Line definitionLine;
        private Deque<BlockBuilder> blocks = new ArrayDeque<>();
        private StatementBuilder last;

        SectionBuilder(SectionKind kind, Statement header, Line headerLine) {
            this.kind = kind;
            this.header = header;
            this.headerLine = headerLine;
            BlockKind blockKind = switch (kind) {
                case SETTINGS -> BlockKind.SETTINGS_SECTION;
                case VARIABLES -> BlockKind.VARIABLES_SECTION;
                default -> BlockKind.BODY;
            };
            this.content = new BlockBuilder(blockKind, null, 0);
        }

        void accept(String line, int lineNumber) {
            switch (kind) {
                case SETTINGS -> acceptSetting(line, lineNumber);
                case VARIABLES -> acceptVariable(line, lineNumber);
                case TEST_CASES, TASKS, KEYWORDS -> acceptDefinitionLine(line, lineNumber);
                default -> content.add(isBlank(line) ? emptyLine(lineNumber) : raw(line, lineNumber));
            }
        }

        private void acceptSetting(String line, int lineNumber) {
            if (isBlank(line)) {
                addFinished(content, emptyLine(lineNumber));
                return;
            }
            List<RawCell> cells = CellTokenizer.tokenize(line);
            RawCell first = cells.get(0);
            if (first.comment()) {
                addFinished(content, comment(first, lineNumber));
            } else if (first.isContinuation()) {
                continueLast(line, cells, lineNumber, content);
            } else if (first.text().equalsIgnoreCase("Documentation")) {
                start(content, StatementKind.DOCUMENTATION, CellTokenizer.tokenizeHead(line), lineNumber);
            } else {
                start(content, StatementKind.SECTION_SETTING, cells, lineNumber);
            }
        }

        private void acceptVariable(String line, int lineNumber) {
            if (isBlank(line)) {
                addFinished(content, emptyLine(lineNumber));
                return;
            }
            List<RawCell> cells = CellTokenizer.tokenize(line);
            RawCell first = cells.get(0);
            if (first.comment()) {
                addFinished(content, comment(first, lineNumber));
            } else if (first.isContinuation()) {
                continueLast(line, cells, lineNumber, content);
            } else {
                start(content, StatementKind.VARIABLE, cells, lineNumber);
            }
        }

        private void acceptDefinitionLine(String line, int lineNumber) {
            if (isBlank(line)) {
                addFinished(innermost(), emptyLine(lineNumber));
                return;
            }
            boolean indented = Character.isWhitespace(line.charAt(0));
            if (!indented) {
                if (line.startsWith("#")) {
                    addFinished(innermost(), raw(line, lineNumber));
                    return;
                }
                finishDefinition();
                definitionName = raw(line, lineNumber);
                definitionLine = cutLine(line);
                blocks = new ArrayDeque<>();
                blocks.push(new BlockBuilder(BlockKind.BODY, null, 1));
                return;
            }
            if (definitionName == null) {
                addFinished(content, raw(line, lineNumber));
                return;
            }
            acceptBodyLine(line, CellTokenizer.tokenize(line), lineNumber);
        }

        private void acceptBodyLine(String line, List<RawCell> cells, int lineNumber) {
            RawCell first = cells.get(0);
            BlockBuilder block = blocks.peek();
            if (first.comment()) {
                addFinished(block, comment(first, lineNumber));
                return;
            }
            if (first.isContinuation()) {
                continueLast(line, cells, lineNumber, block);
                return;
            }
            String word = first.text();
            switch (word) {
                case "FOR" -> open(BlockKind.FOR, cells, lineNumber);
                case "WHILE" -> open(BlockKind.WHILE, cells, lineNumber);
                case "TRY" -> open(BlockKind.TRY_BRANCH, cells, lineNumber);
                case "IF" -> {
                    if (dataCount(cells) > 2) {
                        start(block, StatementKind.INLINE_IF, cells, lineNumber);
                    } else {
                        open(BlockKind.IF_BRANCH, cells, lineNumber);
                    }
                }
                case "ELSE IF", "ELSE", "EXCEPT", "FINALLY" -> branch(cells, lineNumber);
                case "END" -> close(cells, lineNumber);
                case "RETURN" -> start(block, StatementKind.RETURN, cells, lineNumber);
                default -> startBodyStatement(block, line, cells, lineNumber);
            }
        }

        private void startBodyStatement(BlockBuilder block, String line, List<RawCell> cells, int lineNumber) {
            String word = cells.get(0).text();
            if (word.equalsIgnoreCase("[Documentation]")) {
                start(block, StatementKind.DOCUMENTATION, CellTokenizer.tokenizeHead(line), lineNumber);
            } else if (word.equalsIgnoreCase("[Template]")) {
                start(block, StatementKind.TEMPLATE_SETTING, cells, lineNumber);
            } else if (word.startsWith("[") && word.endsWith("]")) {
                start(block, StatementKind.SETTING, cells, lineNumber);
            } else if (isInlineIfAfterAssignments(cells)) {
                start(block, StatementKind.INLINE_IF, cells, lineNumber);
            } else {
                start(block, StatementKind.KEYWORD_CALL, cells, lineNumber);
            }
        }

        private boolean isInlineIfAfterAssignments(List<RawCell> cells) {
            for (RawCell cell : cells) {
                if (cell.comment()) {
                    return false;
                }
                if (!ASSIGNMENT.matcher(cell.text()).matches()) {
                    return cell.text().equals("IF");
                }
            }
            return false;
        }

        private void open(BlockKind kind, List<RawCell> cells, int lineNumber) {
            BlockBuilder parent = blocks.peek();
            StatementBuilder header = new StatementBuilder(StatementKind.BLOCK_HEADER, lineNumber);
            header.addLine(cells);
            BlockBuilder child = new BlockBuilder(kind, header, parent.level + 1);
            parent.elements.add(child);
            blocks.push(child);
            last = header;
        }

        private void branch(List<RawCell> cells, int lineNumber) {
            BlockBuilder current = blocks.peek();
            if (current.kind != BlockKind.IF_BRANCH && current.kind != BlockKind.TRY_BRANCH) {
                start(current, StatementKind.KEYWORD_CALL, cells, lineNumber);
                return;
            }
            blocks.pop();
            open(current.kind, cells, lineNumber);
        }

        private void close(List<RawCell> cells, int lineNumber) {
            StatementBuilder footer = new StatementBuilder(StatementKind.BLOCK_FOOTER, lineNumber);
            footer.addLine(cells);
            if (blocks.size() <= 1) {
                blocks.peek().elements.add(footer);
            } else {
                blocks.pop().footer = footer;
            }
            last = footer;
        }

        private void start(BlockBuilder block, StatementKind statementKind, List<RawCell> cells, int lineNumber) {
            StatementBuilder statement = new StatementBuilder(statementKind, lineNumber);
            statement.addLine(cells);
            block.elements.add(statement);
            last = statement;
        }

        private void addFinished(BlockBuilder block, Statement statement) {
            block.elements.add(statement);
            last = null;
        }

        private void continueLast(String line, List<RawCell> cells, int lineNumber, BlockBuilder block) {
            if (last == null) {
                addFinished(block, raw(line, lineNumber));
                return;
            }
            if (last.kind == StatementKind.DOCUMENTATION) {
                last.addLine(CellTokenizer.tokenizeHead(line));
            } else {
                last.addLine(cells);
            }
        }

        private Statement comment(RawCell cell, int lineNumber) {
            return new Statement(StatementKind.COMMENT,
                    List.of(Line.of(new Cell(cell.text(), CellRole.COMMENT, cell.column()))), lineNumber);
        }

        private BlockBuilder innermost() {
            return definitionName == null || blocks.isEmpty() ? content : blocks.peek();
        }

        private void finishDefinition() {
            if (definitionName != null) {
                definitions.add(new Definition(definitionName, definitionLine, blocks.peekLast().build()));
            }
            definitionName = null;
            definitionLine = null;
            last = null;
        }

        Optional<Section> build() {
            finishDefinition();
            if (header == null && content.elements.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Section(kind, Optional.ofNullable(header), headerLine, content.build(), definitions));
        }

        private int dataCount(List<RawCell> cells) {
            return (int) cells.stream().filter(cell -> !cell.comment()).count();
        }
    }

    private static final class BlockBuilder {

        private final BlockKind kind;
        private final StatementBuilder header;
        private final int level;
        private final List<Object> elements = new ArrayList<>();
        private StatementBuilder footer;

        BlockBuilder(BlockKind kind, StatementBuilder header, int level) {
            this.kind = kind;
            this.header = header;
            this.level = level;
        }

        void add(Statement statement) {
            elements.add(statement);
        }

        Block build() {
            List<BlockElement> body = new ArrayList<>();
            for (Object element : elements) {
                if (element instanceof StatementBuilder statement) {
                    body.add(statement.build());
                } else if (element instanceof BlockBuilder block) {
                    body.add(block.build());
                } else {
                    body.add((Statement) element);
                }
            }
            return new Block(kind, Optional.ofNullable(header).map(StatementBuilder::build), body,
                    Optional.ofNullable(footer).map(StatementBuilder::build), level);
        }
    }

    /**
     * Statement under construction; roles are assigned once every physical line is known.
     */
    private static final class StatementBuilder {

        private final StatementKind kind;
        private final int sourceLine;
        private final List<List<RawCell>> lines = new ArrayList<>();

        StatementBuilder(StatementKind kind, int sourceLine) {
            this.kind = kind;
            this.sourceLine = sourceLine;
        }

        void addLine(List<RawCell> cells) {
            lines.add(cells);
        }

        Statement build() {
            RoleAssigner roles = new RoleAssigner(kind, lines.isEmpty() || lines.get(0).isEmpty() ? "" : lines.get(0).get(0).text());
            List<Line> built = new ArrayList<>();
            for (int lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
                List<RawCell> line = lines.get(lineIndex);
                List<Cell> cells = new ArrayList<>();
                for (int cellIndex = 0; cellIndex < line.size(); cellIndex++) {
                    RawCell cell = line.get(cellIndex);
                    CellRole role = lineIndex > 0 && cellIndex == 0 && cell.isContinuation()
                            ? CellRole.CONTINUATION
                            : roles.next(cell);
                    cells.add(new Cell(cell.text(), role, cell.column()));
                }
                built.add(new Line(cells));
            }
            return new Statement(kind, built, sourceLine);
        }
    }

    /**
     * Assigns cell roles in reading order across all lines of a statement.
     */
    private static final class RoleAssigner {

        private final StatementKind kind;
        private final boolean importSetting;
        private boolean nameSeen;
        private boolean aliasNext;
        private int dataIndex;

        RoleAssigner(StatementKind kind, String leading) {
            this.kind = kind;
            this.importSetting = kind == StatementKind.SECTION_SETTING && IMPORTS.contains(leading.toLowerCase(Locale.ROOT));
        }

        CellRole next(RawCell cell) {
            if (cell.comment()) {
                return CellRole.COMMENT;
            }
            int index = dataIndex++;
            return switch (kind) {
                case KEYWORD_CALL -> keywordRole(cell);
                case SETTING, TEMPLATE_SETTING, DOCUMENTATION -> index == 0 ? CellRole.SETTING_NAME : CellRole.SETTING_VALUE;
                case SECTION_SETTING -> sectionSettingRole(cell, index);
                case VARIABLE -> index == 0 ? CellRole.NAME : CellRole.ARGUMENT;
                default -> index == 0 ? CellRole.NAME : CellRole.ARGUMENT;
            };
        }

        private CellRole keywordRole(RawCell cell) {
            if (nameSeen) {
                return CellRole.ARGUMENT;
            }
            if (ASSIGNMENT.matcher(cell.text()).matches()) {
                return CellRole.ASSIGNMENT;
            }
            nameSeen = true;
            return CellRole.NAME;
        }

        private CellRole sectionSettingRole(RawCell cell, int index) {
            if (index == 0) {
                return CellRole.SETTING_NAME;
            }
            if (importSetting && index == 1) {
                return CellRole.NAME;
            }
            if (importSetting && WITH_NAME.contains(cell.text())) {
                aliasNext = true;
                return CellRole.WITH_NAME_KEYWORD;
            }
            if (aliasNext) {
                // the alias stays on the line of its AS marker when split
                aliasNext = false;
                return CellRole.NAME;
            }
            return CellRole.SETTING_VALUE;
        }
    }
}
