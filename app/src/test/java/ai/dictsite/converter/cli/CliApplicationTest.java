package ai.dictsite.converter.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.dictsite.converter.batch.ConfirmationPrompt;
import ai.dictsite.converter.config.ConfigLoader;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String ENTRY = "<span class=\"bold\">word</span>";

    @TempDir
    Path tempDir;

    private final StringWriter printed = new StringWriter();
    private final StringWriter prompted = new StringWriter();

    private CliApplication application(String answer) {
        return new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new ConfirmationPrompt(new BufferedReader(new StringReader(answer)), new PrintWriter(prompted)),
                new PrintWriter(printed));
    }

    @Test
    void convertsSingleFile() throws IOException {
        Path input = write("entry.html", ENTRY);
        Path output = tempDir.resolve("out/entry.html");

        int exitCode = application("").run(new String[] {"--single", input.toString(), output.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output, StandardCharsets.UTF_8)).contains("<strong>word</strong>");
    }

    @Test
    void convertsFolderIntoOutputFolderWithSuffix() throws IOException {
        write("a.html", ENTRY);
        write("b.html", ENTRY);
        Path out = tempDir.resolve("out");

        int exitCode = application("").run(new String[] {"--multiple", tempDir.toString(), out.toString(), "--threads", "2"});

        assertThat(exitCode).isZero();
        assertThat(out.resolve("a_processed.html")).exists();
        assertThat(out.resolve("b_processed.html")).exists();
    }

    @Test
    void declinedReplaceWritesNothing() throws IOException {
        Path input = write("entry.html", ENTRY);

        int exitCode = application("n\n").run(new String[] {"--multiple", tempDir.toString(), "--replace"});

        assertThat(exitCode).isZero();
        assertThat(prompted.toString()).contains("overwrite 1 files");
        assertThat(Files.readString(input, StandardCharsets.UTF_8)).isEqualTo(ENTRY);
    }

    @Test
    void confirmedReplaceOverwritesInputs() throws IOException {
        Path input = write("entry.html", ENTRY);

        int exitCode = application("y\n").run(new String[] {"--multiple", tempDir.toString(), "--replace"});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(input, StandardCharsets.UTF_8)).contains("<strong>word</strong>");
    }

    @Test
    void yesFlagSkipsThePrompt() throws IOException {
        Path input = write("entry.html", ENTRY);

        int exitCode = application("").run(new String[] {"--multiple", tempDir.toString(), "--replace", "--yes"});

        assertThat(exitCode).isZero();
        assertThat(prompted.toString()).isEmpty();
        assertThat(Files.readString(input, StandardCharsets.UTF_8)).contains("<strong>word</strong>");
    }

    @Test
    void auditPrintsUnknownClassesAndWritesNothing() throws IOException {
        Path input = write("entry.html", "<span class=\"mystery\">x</span>");
        Path output = tempDir.resolve("never.html");

        int exitCode = application("").run(new String[] {"--single", input.toString(), output.toString(), "--audit"});

        assertThat(exitCode).isZero();
        assertThat(printed.toString()).contains("mystery");
        assertThat(output).doesNotExist();
    }

    @Test
    void missingInputFileFails() {
        int exitCode = application("").run(new String[] {
                "--single", tempDir.resolve("absent.html").toString(), tempDir.resolve("out.html").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    @Test
    void folderWithoutOutputOrReplaceFailsValidation() {
        int exitCode = application("").run(new String[] {"--multiple", tempDir.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    @Test
    void missingModeIsAUsageError() {
        assertThat(application("").run(new String[] {"--replace"})).isEqualTo(2);
    }

    @Test
    void singleAndMultipleAreMutuallyExclusive() {
        assertThat(application("").run(new String[] {"--single", "a", "b", "--multiple", "c"})).isEqualTo(2);
    }

    @Test
    void helpExitsCleanly() {
        assertThat(application("").run(new String[] {"--help"})).isZero();
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
