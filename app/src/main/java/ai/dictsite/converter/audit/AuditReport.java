package ai.dictsite.converter.audit;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Unknown classes found by {@link ClassAuditor}, keyed by class name.
 */
public record AuditReport(SortedMap<String, SortedSet<Path>> filesByClass) {

    public AuditReport {
        SortedMap<String, SortedSet<Path>> copy = new TreeMap<>();
        if (filesByClass != null) {
            filesByClass.forEach((className, files) -> copy.put(className, Collections.unmodifiableSortedSet(new TreeSet<>(files))));
        }
        filesByClass = Collections.unmodifiableSortedMap(copy);
    }

    public boolean isEmpty() {
        return filesByClass.isEmpty();
    }

    public Set<String> unknownClasses() {
        return filesByClass.keySet();
    }

    /**
     * Inverts the report: file to the unknown classes it contains.
     */
    public SortedMap<Path, SortedSet<String>> classesByFile() {
        SortedMap<Path, SortedSet<String>> byFile = new TreeMap<>();
        for (Map.Entry<String, SortedSet<Path>> entry : filesByClass.entrySet()) {
            for (Path file : entry.getValue()) {
                byFile.computeIfAbsent(file, ignored -> new TreeSet<>()).add(entry.getKey());
            }
        }
        return byFile;
    }

    public String format() {
        if (isEmpty()) {
            return "No unknown classes found." + System.lineSeparator();
        }
        StringBuilder builder = new StringBuilder();
        classesByFile().forEach((file, classes) -> {
            builder.append(file).append(':').append(System.lineSeparator());
            for (String className : classes) {
                builder.append("  ").append(className).append(System.lineSeparator());
            }
        });
        return builder.toString();
    }
}
