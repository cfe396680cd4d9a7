package dev.tabsuite.formatter.cli;

import dev.tabsuite.formatter.config.SkippedSetting;
import picocli.CommandLine;

public class SkippedSettingConverter implements CommandLine.ITypeConverter<SkippedSetting> {
    @Override
    public SkippedSetting convert(String value) {
        return SkippedSetting.from(value);
    }
}
