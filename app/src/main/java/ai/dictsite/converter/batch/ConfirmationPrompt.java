package ai.dictsite.converter.batch;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Asks the user to confirm a destructive run. Only {@code y} or {@code Y} counts as consent.
 */
public class ConfirmationPrompt {

    private final BufferedReader input;
    private final PrintWriter output;

    public ConfirmationPrompt(BufferedReader input, PrintWriter output) {
        this.input = Objects.requireNonNull(input, "input");
        this.output = Objects.requireNonNull(output, "output");
    }

    public boolean confirm(String question) {
        output.print(question + " (y/N): ");
        output.flush();
        try {
            String answer = input.readLine();
            return answer != null && answer.strip().equalsIgnoreCase("y");
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read confirmation", ex);
        }
    }
}
