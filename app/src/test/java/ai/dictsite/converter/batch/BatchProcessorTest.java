package ai.dictsite.converter.batch;

import static org.assertj.core.api.Assertions.assertThat;

import ai.dictsite.converter.engine.ConversionException;
import ai.dictsite.converter.engine.ConverterOptions;
import ai.dictsite.converter.engine.SemanticConverter;
import ai.dictsite.converter.pass.BracketWrapPass;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchProcessorTest {

    @TempDir
    Path tempDir;

    private final SemanticConverter converter = new SemanticConverter(
            new ConverterOptions(BracketWrapPass.TrailingSpace.NONE, true, false));

    @Test
    void convertsEveryTaskAndWritesUtf8Output() throws IOException {
        Path first = write("a.html", "<span class=\"bold\">á</span>");
        Path second = write("b.html", "<span class=\"italic\">b</span>");
        Path out = tempDir.resolve("out");
        List<ConversionTask> tasks = List.of(
                new ConversionTask(first, out.resolve("a_processed.html")),
                new ConversionTask(second, out.resolve("b_processed.html")));

        BatchOutcome outcome = new BatchProcessor(converter, new DocumentWriter(), 2).process(tasks);

        assertThat(outcome.hasFailures()).isFalse();
        assertThat(outcome.converted()).containsExactly(out.resolve("a_processed.html"), out.resolve("b_processed.html"));
        assertThat(Files.readString(out.resolve("a_processed.html"), StandardCharsets.UTF_8)).isEqualTo("<strong>á</strong>");
        assertThat(Files.readString(out.resolve("b_processed.html"), StandardCharsets.UTF_8)).isEqualTo("<em>b</em>");
    }

    @Test
    void failingFileIsReportedWithoutStoppingTheOthers() throws IOException {
        Path good = write("good.html", "<span class=\"bold\">ok</span>");
        Path missing = tempDir.resolve("missing.html");
        List<ConversionTask> tasks = List.of(
                new ConversionTask(missing, tempDir.resolve("missing_processed.html")),
                new ConversionTask(good, tempDir.resolve("good_processed.html")));

        BatchOutcome outcome = new BatchProcessor(converter, new DocumentWriter(), 1).process(tasks);

        assertThat(outcome.failed()).containsExactly(missing);
        assertThat(outcome.converted()).containsExactly(tempDir.resolve("good_processed.html"));
        assertThat(tempDir.resolve("missing_processed.html")).doesNotExist();
    }

    @Test
    void conversionFailureLeavesNoOutput() throws IOException {
        Path input = write("broken.html", "<p>x</p>");
        Path output = tempDir.resolve("broken_processed.html");
        SemanticConverter failing = new SemanticConverter() {
            @Override
            public String convert(String markup) {
                throw new ConversionException("Pass 'sense' failed: boom", new IllegalStateException("boom"));
            }
        };

        boolean converted = new BatchProcessor(failing, new DocumentWriter(), 1).convert(new ConversionTask(input, output));

        assertThat(converted).isFalse();
        assertThat(output).doesNotExist();
    }

    @Test
    void emptyTaskListYieldsEmptyOutcome() {
        BatchOutcome outcome = new BatchProcessor(converter, new DocumentWriter(), 4).process(List.of());

        assertThat(outcome.converted()).isEmpty();
        assertThat(outcome.failed()).isEmpty();
    }

    @Test
    void replacingOverwritesTheInput() throws IOException {
        Path input = write("entry.html", "<span class=\"bold\">x</span>");
        ConversionTask task = new ConversionTask(input, input);

        new BatchProcessor(converter, new DocumentWriter(), 1).process(List.of(task));

        assertThat(task.inPlace()).isTrue();
        assertThat(Files.readString(input, StandardCharsets.UTF_8)).isEqualTo("<strong>x</strong>");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
