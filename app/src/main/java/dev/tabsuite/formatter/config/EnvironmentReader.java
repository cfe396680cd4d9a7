package dev.tabsuite.formatter.config;

import java.util.Optional;

/**
 * Source of configuration values keyed by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
