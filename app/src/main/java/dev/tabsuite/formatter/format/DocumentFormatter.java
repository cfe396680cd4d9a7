package dev.tabsuite.formatter.format;

import dev.tabsuite.formatter.block.SuiteDocument;
import dev.tabsuite.formatter.config.FormatterConfig;
import dev.tabsuite.formatter.parse.SourceReader;
import dev.tabsuite.formatter.render.LayoutRenderer;
import java.util.List;
import java.util.Objects;

/**
 * Formats the lines of one file: reads them into a block tree and renders the tree again.
 */
public class DocumentFormatter {

    private final SourceReader reader;
    private final LayoutRenderer renderer;

    public DocumentFormatter(FormatterConfig config) {
        this(new SourceReader(), new LayoutRenderer(config));
    }

    public DocumentFormatter(SourceReader reader, LayoutRenderer renderer) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public boolean supports(List<String> lines) {
        return !reader.isPipeSeparated(lines);
    }

    public List<String> format(List<String> lines) {
        SuiteDocument document = reader.read(lines);
        return renderer.render(document);
    }
}
