package dev.tabsuite.formatter.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts a space-separated source line into cells. Cells are separated by two or more spaces or a tab.
 * A cell starting with {@code #} takes the rest of the line as one comment.
 */
final class CellTokenizer {

    private static final Pattern SEPARATOR = Pattern.compile("\\s{2,}|\\t");

    private CellTokenizer() {
    }

    static List<RawCell> tokenize(String line) {
        List<RawCell> cells = new ArrayList<>();
        Matcher matcher = SEPARATOR.matcher(line);
        int position = indentationEnd(line);
        while (position < line.length()) {
            if (line.charAt(position) == '#') {
                cells.add(new RawCell(line.substring(position).stripTrailing(), position + 1, true));
                break;
            }
            if (matcher.find(position)) {
                cells.add(new RawCell(line.substring(position, matcher.start()), position + 1, false));
                position = matcher.end();
            } else {
                cells.add(new RawCell(line.substring(position).stripTrailing(), position + 1, false));
                break;
            }
        }
        return cells;
    }

    /**
     * Splits off the first cell and keeps the rest of the line, right-stripped, as a single cell.
     */
    static List<RawCell> tokenizeHead(String line) {
        List<RawCell> cells = new ArrayList<>();
        int start = indentationEnd(line);
        if (start >= line.length()) {
            return cells;
        }
        Matcher matcher = SEPARATOR.matcher(line);
        if (!matcher.find(start)) {
            cells.add(new RawCell(line.substring(start).stripTrailing(), start + 1, false));
            return cells;
        }
        cells.add(new RawCell(line.substring(start, matcher.start()), start + 1, false));
        String rest = line.substring(matcher.end()).stripTrailing();
        if (!rest.isEmpty()) {
            cells.add(new RawCell(rest, matcher.end() + 1, false));
        }
        return cells;
    }

    static int indentationEnd(String line) {
        int index = 0;
        while (index < line.length() && Character.isWhitespace(line.charAt(index))) {
            index++;
        }
        return index;
    }

    static boolean isPipeSeparated(String line) {
        return line.startsWith("| ") || line.equals("|");
    }
}
