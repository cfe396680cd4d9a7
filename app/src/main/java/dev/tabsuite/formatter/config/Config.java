package dev.tabsuite.formatter.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Settings of one formatter run.
 *
 * @param paths      files and directories to format
 * @param check      report files that would change without writing them
 * @param diff       print a unified diff of every change
 * @param overwrite  write formatted files back to disk
 * @param lineEnding line ending of written files
 * @param logFormat  log output format
 * @param verbose    log per-file decisions
 * @param formatter  layout configuration
 */
public record Config(List<Path> paths,
                     boolean check,
                     boolean diff,
                     boolean overwrite,
                     LineEnding lineEnding,
                     LogFormat logFormat,
                     boolean verbose,
                     FormatterConfig formatter) {

    public Config {
        Objects.requireNonNull(paths, "paths");
        Objects.requireNonNull(lineEnding, "lineEnding");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(formatter, "formatter");
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("at least one path must be provided");
        }
        paths = List.copyOf(paths);
    }

    /**
     * Whether formatted files are written; check mode never writes.
     */
    public boolean writesFiles() {
        return overwrite && !check;
    }
}
