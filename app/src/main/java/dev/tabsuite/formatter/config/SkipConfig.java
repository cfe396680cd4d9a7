package dev.tabsuite.formatter.config;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Statements of test case and keyword bodies that are kept out of column alignment.
 *
 * @param keywordCalls        keyword names, compared case-insensitively and ignoring spaces and underscores
 * @param keywordCallPatterns regular expressions searched for in keyword names
 * @param settings            body settings left unaligned
 */
public record SkipConfig(Set<String> keywordCalls, List<String> keywordCallPatterns, Set<SkippedSetting> settings) {

    public SkipConfig {
        Objects.requireNonNull(keywordCalls, "keywordCalls");
        Objects.requireNonNull(keywordCallPatterns, "keywordCallPatterns");
        Objects.requireNonNull(settings, "settings");
        for (String pattern : keywordCallPatterns) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException ex) {
                throw new IllegalArgumentException("'" + pattern + "' is not a valid regular expression", ex);
            }
        }
        keywordCalls = Set.copyOf(keywordCalls);
        keywordCallPatterns = List.copyOf(keywordCallPatterns);
        settings = Set.copyOf(settings);
    }

    public static SkipConfig none() {
        return new SkipConfig(Set.of(), List.of(), Set.of());
    }
}
