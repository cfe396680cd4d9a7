package dev.tabsuite.formatter.format;

import dev.tabsuite.formatter.render.LayoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Formats a batch of files. A file that fails is reported and left unmodified; the batch continues.
 */
public class FormattingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormattingService.class);
    static final String MDC_FILE = "file";

    private final DocumentFormatter formatter;

    public FormattingService(DocumentFormatter formatter) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public FormattingOutcome format(List<SourceFile> files) {
        if (files == null || files.isEmpty()) {
            return new FormattingOutcome(List.of(), List.of());
        }
        List<FormattedFile> results = new ArrayList<>();
        List<FileFailure> failedFiles = new ArrayList<>();
        for (SourceFile file : files) {
            MDC.put(MDC_FILE, file.path());
            try {
                results.add(formatFile(file));
            } catch (LayoutException ex) {
                LOGGER.error("Formatting failed for {}: {}", file.path(), ex.getMessage(), ex);
                failedFiles.add(new FileFailure(file.path(), ex.getMessage()));
            } catch (RuntimeException ex) {
                LOGGER.error("Unexpected error while formatting {}", file.path(), ex);
                failedFiles.add(new FileFailure(file.path(), String.valueOf(ex.getMessage())));
            } finally {
                MDC.remove(MDC_FILE);
            }
        }
        return new FormattingOutcome(results, failedFiles);
    }

    public FormattedFile formatFile(SourceFile file) {
        List<String> lines = file.lines();
        if (!formatter.supports(lines)) {
            LOGGER.warn("Skipping {}: pipe-separated files are not supported", file.path());
            return new FormattedFile(file, lines);
        }
        List<String> formatted = formatter.format(lines);
        FormattedFile result = new FormattedFile(file, formatted);
        LOGGER.debug("Formatted {} ({} -> {} lines, changed={})", file.path(), lines.size(), formatted.size(), result.changed());
        return result;
    }
}
