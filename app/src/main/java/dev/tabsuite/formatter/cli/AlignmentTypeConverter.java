package dev.tabsuite.formatter.cli;

import dev.tabsuite.formatter.config.AlignmentType;
import picocli.CommandLine;

/**
 * Parses alignment type CLI options.
 */
public class AlignmentTypeConverter implements CommandLine.ITypeConverter<AlignmentType> {
    @Override
    public AlignmentType convert(String value) {
        return AlignmentType.from(value);
    }
}
