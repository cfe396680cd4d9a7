package dev.tabsuite.formatter.format;

import java.util.List;
import java.util.Objects;

/**
 * Content of one source file as read from disk.
 *
 * @param path    file location, used for reporting and writing back
 * @param content raw text including line endings
 */
public record SourceFile(String path, String content) {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
    }

    /**
     * Logical lines without their line endings. A trailing line ending does not start a new line.
     */
    public List<String> lines() {
        if (content.isEmpty()) {
            return List.of();
        }
        String[] parts = content.split("\\r\\n|\\n|\\r", -1);
        int size = parts.length;
        if (parts[size - 1].isEmpty()) {
            size--;
        }
        return List.of(parts).subList(0, size);
    }
}
