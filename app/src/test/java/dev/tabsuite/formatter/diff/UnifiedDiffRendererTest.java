package dev.tabsuite.formatter.diff;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class UnifiedDiffRendererTest {

    private final UnifiedDiffRenderer renderer = new UnifiedDiffRenderer();

    @Test
    void rendersChangedLinesWithHeaders() {
        String diff = renderer.render("suite.robot",
                List.of("*** Test Cases ***", "Test", "    Log          hello"),
                List.of("*** Test Cases ***", "Test", "    Log    hello"));

        assertThat(diff).startsWith("--- a/suite.robot\n+++ b/suite.robot\n");
        assertThat(diff).contains("@@ -1,3 +1,3 @@");
        assertThat(diff).contains("\n-    Log          hello\n");
        assertThat(diff).contains("\n+    Log    hello\n");
        assertThat(diff).contains("\n Test\n");
    }

    @Test
    void identicalContentHasNoDiff() {
        List<String> lines = List.of("*** Test Cases ***", "Test");

        assertThat(renderer.render("suite.robot", lines, lines)).isEmpty();
    }
}
