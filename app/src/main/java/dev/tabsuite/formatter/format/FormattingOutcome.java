package dev.tabsuite.formatter.format;

import java.util.List;

/**
 * Results of a batch run: formatted files plus files that failed.
 */
public record FormattingOutcome(List<FormattedFile> results, List<FileFailure> failedFiles) {

    public FormattingOutcome {
        results = results == null ? List.of() : List.copyOf(results);
        failedFiles = failedFiles == null ? List.of() : List.copyOf(failedFiles);
    }

    public List<FormattedFile> changedFiles() {
        return results.stream().filter(FormattedFile::changed).toList();
    }

    public boolean hasFailures() {
        return !failedFiles.isEmpty();
    }
}
