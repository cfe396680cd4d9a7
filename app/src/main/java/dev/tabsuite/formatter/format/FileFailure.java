package dev.tabsuite.formatter.format;

import java.util.Objects;

/**
 * File that could not be formatted and was left unmodified.
 */
public record FileFailure(String path, String reason) {

    public FileFailure {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(reason, "reason");
    }
}
