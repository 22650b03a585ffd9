package ai.dictsite.converter.batch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes converted documents to disk as UTF-8, creating missing parent folders.
 */
public class DocumentWriter {

    public void write(Path target, String content) {
        if (target == null || content == null) {
            throw new IllegalArgumentException("target and content must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write converted document: " + target, ex);
        }
    }
}
