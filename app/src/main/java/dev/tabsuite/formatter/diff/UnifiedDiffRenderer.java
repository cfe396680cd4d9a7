package dev.tabsuite.formatter.diff;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

/**
 * Renders the difference between original and formatted lines as a unified diff.
 */
public class UnifiedDiffRenderer {

    private static final int CONTEXT_LINES = 3;

    public String render(String path, List<String> original, List<String> formatted) {
        RawText before = toRawText(original);
        RawText after = toRawText(formatted);
        EditList edits = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM)
                .diff(RawTextComparator.DEFAULT, before, after);
        if (edits.isEmpty()) {
            return "";
        }
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(output)) {
            formatter.setContext(CONTEXT_LINES);
            output.write(("--- a/" + path + "\n").getBytes(StandardCharsets.UTF_8));
            output.write(("+++ b/" + path + "\n").getBytes(StandardCharsets.UTF_8));
            formatter.format(edits, before, after);
            formatter.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to render diff for " + path, ex);
        }
        return output.toString(StandardCharsets.UTF_8);
    }

    private static RawText toRawText(List<String> lines) {
        StringBuilder builder = new StringBuilder();
        for (String line : lines) {
            builder.append(line).append('\n');
        }
        return new RawText(builder.toString().getBytes(StandardCharsets.UTF_8));
    }
}
