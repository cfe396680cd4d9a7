package dev.tabsuite.formatter.writer;

import dev.tabsuite.formatter.config.LineEnding;
import dev.tabsuite.formatter.format.FormattedFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes formatted files back to disk with the configured line ending.
 */
public class DocumentWriter {

    private final LineEnding lineEnding;

    public DocumentWriter(LineEnding lineEnding) {
        this.lineEnding = Objects.requireNonNull(lineEnding, "lineEnding");
    }

    public void write(FormattedFile result) {
        if (result == null) {
            throw new IllegalArgumentException("result must be provided");
        }
        Path target = Path.of(result.path());
        String text = join(result.lines(), separatorFor(result.source().content()));
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write formatted document: " + target, ex);
        }
    }

    /**
     * Joins the lines, terminating every line including the last one.
     */
    public String join(List<String> lines, String separator) {
        StringBuilder builder = new StringBuilder();
        for (String line : lines) {
            builder.append(line).append(separator);
        }
        return builder.toString();
    }

    public String separatorFor(String originalContent) {
        return switch (lineEnding) {
            case UNIX -> "\n";
            case WINDOWS -> "\r\n";
            case NATIVE -> System.lineSeparator();
            case AUTO -> detect(originalContent);
        };
    }

    private static String detect(String content) {
        int index = content.indexOf('\n');
        if (index < 0) {
            return content.indexOf('\r') >= 0 ? "\r" : System.lineSeparator();
        }
        return index > 0 && content.charAt(index - 1) == '\r' ? "\r\n" : "\n";
    }
}
