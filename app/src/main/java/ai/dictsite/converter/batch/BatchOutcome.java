package ai.dictsite.converter.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a batch run: files written and files that could not be converted.
 */
public record BatchOutcome(List<Path> converted, List<Path> failed) {

    public BatchOutcome {
        converted = converted == null ? List.of() : List.copyOf(converted);
        failed = failed == null ? List.of() : List.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
