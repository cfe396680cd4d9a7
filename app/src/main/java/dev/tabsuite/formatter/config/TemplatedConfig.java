package dev.tabsuite.formatter.config;

/**
 * Alignment of test case sections in suites that declare a test template.
 *
 * @param onlyWithHeaders whether sections without column names in their header are left alone
 * @param minWidth        minimal column width, {@code 0} when columns take the width of their widest cell
 */
public record TemplatedConfig(boolean onlyWithHeaders, int minWidth) {

    public TemplatedConfig {
        if (minWidth < 0) {
            throw new IllegalArgumentException("templated min width must be zero or greater");
        }
    }

    public static TemplatedConfig defaults() {
        return new TemplatedConfig(false, 0);
    }
}
