package ai.dictsite.converter.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    private final DocumentWriter writer = new DocumentWriter();

    @Test
    void createsParentFoldersAndTruncatesExistingContent() throws IOException {
        Path target = tempDir.resolve("deep/er/entry.html");
        writer.write(target, "a much longer first version");

        writer.write(target, "<p>é</p>");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("<p>é</p>");
    }

    @Test
    void ioFailureIsRethrownUnchecked() throws IOException {
        Path blocker = tempDir.resolve("file");
        Files.writeString(blocker, "x");

        assertThatThrownBy(() -> writer.write(blocker.resolve("child.html"), "x"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("child.html");
    }
}
