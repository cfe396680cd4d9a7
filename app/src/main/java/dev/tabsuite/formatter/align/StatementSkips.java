package dev.tabsuite.formatter.align;

import dev.tabsuite.formatter.config.SkipConfig;
import dev.tabsuite.formatter.config.SkippedSetting;
import dev.tabsuite.formatter.model.Cell;
import dev.tabsuite.formatter.model.CellRole;
import dev.tabsuite.formatter.model.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides which body statements stay out of column alignment. Skipped statements are neither
 * measured nor aligned; they keep single separators.
 */
public class StatementSkips {

    private static final Map<String, SkippedSetting> BODY_SETTINGS = Map.of(
            "[arguments]", SkippedSetting.ARGUMENTS,
            "[setup]", SkippedSetting.SETUP,
            "[teardown]", SkippedSetting.TEARDOWN,
            "[timeout]", SkippedSetting.TIMEOUT,
            "[template]", SkippedSetting.TEMPLATE,
            "[return]", SkippedSetting.RETURN,
            "[tags]", SkippedSetting.TAGS);

    private final Set<String> keywordNames;
    private final List<Pattern> keywordPatterns;
    private final Set<SkippedSetting> settings;

    public StatementSkips(SkipConfig skip) {
        Objects.requireNonNull(skip, "skip");
        this.keywordNames = skip.keywordCalls().stream().map(StatementSkips::normalize).collect(Collectors.toSet());
        this.keywordPatterns = skip.keywordCallPatterns().stream().map(Pattern::compile).toList();
        this.settings = skip.settings();
    }

    public static StatementSkips none() {
        return new StatementSkips(SkipConfig.none());
    }

    public boolean skips(Statement statement) {
        return switch (statement.kind()) {
            case KEYWORD_CALL -> keywordName(statement).map(this::skipsKeyword).orElse(false);
            case RETURN -> skipsSetting(SkippedSetting.RETURN);
            case SETTING, TEMPLATE_SETTING -> settings.contains(SkippedSetting.ALL)
                    || Optional.ofNullable(BODY_SETTINGS.get(statement.leadingText().toLowerCase(Locale.ROOT)))
                            .map(this::skipsSetting)
                            .orElse(false);
            default -> false;
        };
    }

    private boolean skipsKeyword(String name) {
        if (keywordNames.contains(normalize(name))) {
            return true;
        }
        return keywordPatterns.stream().anyMatch(pattern -> pattern.matcher(name).find());
    }

    private boolean skipsSetting(SkippedSetting setting) {
        return settings.contains(SkippedSetting.ALL) || settings.contains(setting);
    }

    private static Optional<String> keywordName(Statement statement) {
        return statement.cells().stream()
                .filter(cell -> cell.role() == CellRole.NAME)
                .map(Cell::text)
                .findFirst();
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
    }
}
