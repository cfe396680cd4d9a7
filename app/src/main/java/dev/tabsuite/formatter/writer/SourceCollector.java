package dev.tabsuite.formatter.writer;

import dev.tabsuite.formatter.format.SourceFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds suite and resource files under the given paths and reads them.
 */
public class SourceCollector {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceCollector.class);
    static final Set<String> EXTENSIONS = Set.of("robot", "resource");

    public List<Path> collect(List<Path> roots) {
        TreeSet<Path> files = new TreeSet<>();
        for (Path root : roots) {
            if (Files.isRegularFile(root)) {
                files.add(root.normalize());
            } else if (Files.isDirectory(root)) {
                try (Stream<Path> stream = Files.walk(root)) {
                    stream.filter(Files::isRegularFile)
                            .filter(SourceCollector::hasSupportedExtension)
                            .map(Path::normalize)
                            .forEach(files::add);
                } catch (IOException ex) {
                    throw new UncheckedIOException("Failed to scan " + root, ex);
                }
            } else {
                LOGGER.warn("Skipping {}: no such file or directory", root);
            }
        }
        return new ArrayList<>(files);
    }

    public SourceFile read(Path path) {
        try {
            return new SourceFile(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + path, ex);
        }
    }

    static boolean hasSupportedExtension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
