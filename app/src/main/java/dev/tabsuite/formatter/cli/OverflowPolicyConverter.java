package dev.tabsuite.formatter.cli;

import dev.tabsuite.formatter.config.OverflowPolicy;
import picocli.CommandLine;

/**
 * Parses too-long cell policy CLI options.
 */
public class OverflowPolicyConverter implements CommandLine.ITypeConverter<OverflowPolicy> {
    @Override
    public OverflowPolicy convert(String value) {
        return OverflowPolicy.from(value);
    }
}
