package dev.tabsuite.formatter.block;

import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Top-level section of a suite file.
 *
 * @param kind        section kind
 * @param header      header line, absent for the preamble before the first header
 * @param headerLine  header line cut into cells, empty for the preamble
 * @param content     statements that are not part of a definition; for settings and variables
 *                    sections this is the whole aligned block
 * @param definitions test cases, tasks or keywords declared in the section
 */
public record Section(SectionKind kind, Optional<Statement> header, Line headerLine, Block content,
                      List<Definition> definitions) {

    public Section {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(headerLine, "headerLine");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(definitions, "definitions");
        definitions = List.copyOf(definitions);
    }
}
