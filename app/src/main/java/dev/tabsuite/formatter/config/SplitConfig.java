package dev.tabsuite.formatter.config;

/**
 * Settings of the too-long line splitter.
 */
public record SplitConfig(boolean splitOnEveryArg,
                          boolean splitOnEveryValue,
                          boolean splitOnEverySettingArg,
                          boolean splitSingleValue,
                          boolean alignNewLine,
                          boolean skipComments) {

    public static SplitConfig defaults() {
        return new SplitConfig(true, true, true, false, false, false);
    }
}
