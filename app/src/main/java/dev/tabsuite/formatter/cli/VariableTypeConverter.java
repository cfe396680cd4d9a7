package dev.tabsuite.formatter.cli;

import dev.tabsuite.formatter.config.VariableType;
import picocli.CommandLine;

/**
 * Parses variable type CLI options.
 */
public class VariableTypeConverter implements CommandLine.ITypeConverter<VariableType> {
    @Override
    public VariableType convert(String value) {
        return VariableType.from(value);
    }
}
