package ai.dictsite.converter.batch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the files of a folder that should be converted: regular files with a configured
 * extension, minus earlier outputs recognised by their suffix.
 */
public class InputScanner {

    private final Set<String> extensions;
    private final String outputSuffix;

    public InputScanner(Set<String> extensions, String outputSuffix) {
        Objects.requireNonNull(extensions, "extensions");
        if (extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one extension is required");
        }
        this.extensions = extensions.stream()
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.outputSuffix = Objects.requireNonNull(outputSuffix, "outputSuffix");
    }

    public List<Path> scan(Path folder) {
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("Input folder does not exist: " + folder);
        }
        try (Stream<Path> entries = Files.list(folder)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(this::accepts)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list input folder: " + folder, ex);
        }
    }

    boolean accepts(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return false;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        String stem = fileName.substring(0, dot);
        return extensions.contains(extension) && !stem.endsWith(outputSuffix);
    }
}
