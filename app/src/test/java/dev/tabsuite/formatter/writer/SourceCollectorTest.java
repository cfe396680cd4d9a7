package dev.tabsuite.formatter.writer;

import static org.assertj.core.api.Assertions.assertThat;

import dev.tabsuite.formatter.format.SourceFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceCollectorTest {

    @TempDir
    Path tempDir;

    @Test
    void collectsSuiteAndResourceFilesRecursivelyInOrder() throws Exception {
        Path nested = Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("b.robot"), "", StandardCharsets.UTF_8);
        Files.writeString(nested.resolve("a.resource"), "", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("notes.txt"), "", StandardCharsets.UTF_8);

        List<Path> files = new SourceCollector().collect(List.of(tempDir));

        assertThat(files).containsExactly(tempDir.resolve("b.robot"), nested.resolve("a.resource"));
    }

    @Test
    void explicitFilesAreKeptAndMissingPathsSkipped() throws Exception {
        Path explicit = tempDir.resolve("suite.txt");
        Files.writeString(explicit, "", StandardCharsets.UTF_8);

        List<Path> files = new SourceCollector().collect(List.of(explicit, tempDir.resolve("missing.robot")));

        assertThat(files).containsExactly(explicit);
    }

    @Test
    void readsFileContent() throws Exception {
        Path file = tempDir.resolve("suite.robot");
        Files.writeString(file, "*** Test Cases ***\n", StandardCharsets.UTF_8);

        SourceFile source = new SourceCollector().read(file);

        assertThat(source.path()).isEqualTo(file.toString());
        assertThat(source.lines()).containsExactly("*** Test Cases ***");
    }
}
