package ai.dictsite.converter.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One file to convert and the path its result is written to.
 */
public record ConversionTask(Path input, Path output) {

    public ConversionTask {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
    }

    public boolean inPlace() {
        return input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize());
    }
}
