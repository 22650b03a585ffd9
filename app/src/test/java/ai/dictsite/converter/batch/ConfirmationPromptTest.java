package ai.dictsite.converter.batch;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

class ConfirmationPromptTest {

    private final StringWriter written = new StringWriter();

    private ConfirmationPrompt promptAnswering(String answer) {
        return new ConfirmationPrompt(new BufferedReader(new StringReader(answer)), new PrintWriter(written));
    }

    @Test
    void lowerAndUpperCaseYesProceed() {
        assertThat(promptAnswering("y\n").confirm("Overwrite?")).isTrue();
        assertThat(promptAnswering(" Y \n").confirm("Overwrite?")).isTrue();
        assertThat(written.toString()).contains("Overwrite? (y/N)");
    }

    @Test
    void anythingElseDeclines() {
        assertThat(promptAnswering("yes\n").confirm("Overwrite?")).isFalse();
        assertThat(promptAnswering("\n").confirm("Overwrite?")).isFalse();
        assertThat(promptAnswering("").confirm("Overwrite?")).isFalse();
    }
}
