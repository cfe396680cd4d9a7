package dev.tabsuite.formatter.format;

import static org.assertj.core.api.Assertions.assertThat;

import dev.tabsuite.formatter.config.FormatterConfig;
import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Round-trips the suites under {@code golden/} through the default configuration.
 */
class GoldenFormatTest {

    private final DocumentFormatter formatter = new DocumentFormatter(FormatterConfig.defaults());

    @Test
    void formattedSuiteIsLeftUntouched() throws Exception {
        List<String> golden = load("formatted.robot");

        assertThat(formatter.format(golden)).containsExactlyElementsOf(golden);
    }

    @ParameterizedTest
    @ValueSource(strings = {"formatted.robot", "unformatted.robot"})
    void secondPassChangesNothing(String name) throws Exception {
        List<String> once = formatter.format(load(name));
        List<String> twice = formatter.format(once);

        assertThat(twice).containsExactlyElementsOf(once);
        assertThat(once).allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(120));
    }

    @Test
    void unformattedSuiteIsRewritten() throws Exception {
        SourceFile source = new SourceFile("unformatted.robot", Files.readString(resource("unformatted.robot")));

        FormattedFile formatted = new FormattingService(formatter).formatFile(source);

        assertThat(formatted.changed()).isTrue();
        assertThat(formatted.lines()).contains(
                "Library         Collections",
                "    RETURN" + " ".repeat(18) + "${arg}");
    }

    private static List<String> load(String name) throws IOException, URISyntaxException {
        return Files.readAllLines(resource(name), StandardCharsets.UTF_8);
    }

    private static Path resource(String name) throws URISyntaxException {
        URL url = GoldenFormatTest.class.getResource("/golden/" + name);
        assertThat(url).as("resource %s", name).isNotNull();
        return Path.of(url.toURI());
    }
}
