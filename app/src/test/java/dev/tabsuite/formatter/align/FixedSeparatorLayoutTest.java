package dev.tabsuite.formatter.align;

import static org.assertj.core.api.Assertions.assertThat;

import dev.tabsuite.formatter.config.SplitConfig;
import dev.tabsuite.formatter.config.WhitespaceConfig;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.CellRole;
import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import dev.tabsuite.formatter.model.StatementKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class FixedSeparatorLayoutTest {

    private static final SplitConfig ALIGN_NEW_LINE = new SplitConfig(false, false, false, false, true, false);

    @Test
    void continuationLinesUseContinuationIndent() {
        FixedSeparatorLayout layout = new FixedSeparatorLayout(new WhitespaceConfig(4, 4, 2, 120), SplitConfig.defaults());
        Statement statement = statement();

        assertThat(layout.layout(statement, statement.lines().get(1)).render()).isEqualTo("...  second");
    }

    @Test
    void alignNewLinePutsContinuedCellsUnderFirstArgument() {
        FixedSeparatorLayout layout = new FixedSeparatorLayout(WhitespaceConfig.defaults(), ALIGN_NEW_LINE);
        Statement statement = statement();

        String head = layout.layout(statement, statement.lines().get(0)).render();
        String continued = layout.layout(statement, statement.lines().get(1)).render();

        assertThat(head).isEqualTo("Keyword    first");
        assertThat(continued.indexOf("second")).isEqualTo(head.indexOf("first"));
    }

    @Test
    void alignNewLineIsIgnoredWhenEveryItemGetsItsOwnLine() {
        SplitConfig split = new SplitConfig(true, false, false, false, true, false);
        FixedSeparatorLayout layout = new FixedSeparatorLayout(WhitespaceConfig.defaults(), split);

        assertThat(layout.continuationGap(statement())).isEqualTo(4);
        assertThat(layout.continuationGap(StatementKind.VARIABLE, statement().lines().get(0).cells())).isEqualTo(8);
    }

    @Test
    void measuresWidthIncludingIndentation() {
        FixedSeparatorLayout layout = new FixedSeparatorLayout(WhitespaceConfig.defaults(), SplitConfig.defaults());
        Line line = Line.of(Cell.of("Log", CellRole.NAME), Cell.of("x", CellRole.ARGUMENT));

        assertThat(layout.width(line, 4, 8)).isEqualTo(16);
    }

    private static Statement statement() {
        return new Statement(StatementKind.KEYWORD_CALL, List.of(
                Line.of(Cell.of("Keyword", CellRole.NAME), Cell.of("first", CellRole.ARGUMENT)),
                Line.of(Cell.continuation(), Cell.of("second", CellRole.ARGUMENT))), 1);
    }
}
