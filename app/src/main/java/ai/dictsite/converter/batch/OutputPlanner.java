package ai.dictsite.converter.batch;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides where each converted file goes: {@code name.ext} becomes
 * {@code <outputFolder>/name<suffix>.ext}, or the input itself when replacing.
 */
public class OutputPlanner {

    private final Optional<Path> outputFolder;
    private final String suffix;
    private final boolean replace;

    public OutputPlanner(Optional<Path> outputFolder, String suffix, boolean replace) {
        this.outputFolder = Objects.requireNonNull(outputFolder, "outputFolder");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        this.replace = replace;
        if (!replace && outputFolder.isEmpty()) {
            throw new IllegalArgumentException("output folder must be specified if not replacing");
        }
    }

    public List<ConversionTask> planAll(List<Path> inputs) {
        return inputs.stream().map(this::plan).toList();
    }

    public ConversionTask plan(Path input) {
        if (replace) {
            return new ConversionTask(input, input);
        }
        return new ConversionTask(input, outputFolder.get().resolve(outputName(input.getFileName().toString())));
    }

    String outputName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + suffix;
        }
        return fileName.substring(0, dot) + suffix + fileName.substring(dot);
    }
}
