package dev.tabsuite.formatter.block;

import java.util.List;
import java.util.Objects;

/**
 * Parsed suite or resource file.
 */
public record SuiteDocument(List<Section> sections) {

    public SuiteDocument {
        Objects.requireNonNull(sections, "sections");
        sections = List.copyOf(sections);
    }
}
