package dev.tabsuite.formatter.config;

import java.util.Objects;

/**
 * Validated layout configuration, built once per run and shared read-only across files.
 */
public record FormatterConfig(WhitespaceConfig whitespace,
                              AlignmentConfig alignment,
                              SplitConfig split,
                              SkipConfig skip,
                              SectionAlignConfig settingsSection,
                              SectionAlignConfig variablesSection,
                              TemplatedConfig templated,
                              EnabledTransforms transforms) {

    public FormatterConfig {
        Objects.requireNonNull(whitespace, "whitespace");
        Objects.requireNonNull(alignment, "alignment");
        Objects.requireNonNull(split, "split");
        Objects.requireNonNull(skip, "skip");
        Objects.requireNonNull(settingsSection, "settingsSection");
        Objects.requireNonNull(variablesSection, "variablesSection");
        Objects.requireNonNull(templated, "templated");
        Objects.requireNonNull(transforms, "transforms");
    }

    public static FormatterConfig defaults() {
        return new FormatterConfig(WhitespaceConfig.defaults(), AlignmentConfig.defaults(), SplitConfig.defaults(),
                SkipConfig.none(), SectionAlignConfig.defaults(), SectionAlignConfig.defaults(), TemplatedConfig.defaults(),
                EnabledTransforms.defaults());
    }

    public FormatterConfig withAlignment(AlignmentConfig newAlignment) {
        return new FormatterConfig(whitespace, newAlignment, split, skip, settingsSection, variablesSection, templated, transforms);
    }

    public FormatterConfig withWhitespace(WhitespaceConfig newWhitespace) {
        return new FormatterConfig(newWhitespace, alignment, split, skip, settingsSection, variablesSection, templated, transforms);
    }

    public FormatterConfig withSplit(SplitConfig newSplit) {
        return new FormatterConfig(whitespace, alignment, newSplit, skip, settingsSection, variablesSection, templated, transforms);
    }

    public FormatterConfig withSkip(SkipConfig newSkip) {
        return new FormatterConfig(whitespace, alignment, split, newSkip, settingsSection, variablesSection, templated, transforms);
    }

    public FormatterConfig withTemplated(TemplatedConfig newTemplated) {
        return new FormatterConfig(whitespace, alignment, split, skip, settingsSection, variablesSection, newTemplated, transforms);
    }

    public FormatterConfig withTransforms(EnabledTransforms newTransforms) {
        return new FormatterConfig(whitespace, alignment, split, skip, settingsSection, variablesSection, templated, newTransforms);
    }
}
