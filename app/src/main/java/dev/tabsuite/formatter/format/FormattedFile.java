package dev.tabsuite.formatter.format;

import java.util.List;
import java.util.Objects;

/**
 * Formatting result of one file.
 */
public record FormattedFile(SourceFile source, List<String> lines) {

    public FormattedFile {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(lines, "lines");
        lines = List.copyOf(lines);
    }

    public String path() {
        return source.path();
    }

    public boolean changed() {
        return !source.lines().equals(lines);
    }
}
