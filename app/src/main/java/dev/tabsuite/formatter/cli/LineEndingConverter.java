package dev.tabsuite.formatter.cli;

import dev.tabsuite.formatter.config.LineEnding;
import picocli.CommandLine;

/**
 * Parses line ending CLI options.
 */
public class LineEndingConverter implements CommandLine.ITypeConverter<LineEnding> {
    @Override
    public LineEnding convert(String value) {
        return LineEnding.from(value);
    }
}
