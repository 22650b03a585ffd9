package ai.dictsite.converter.config;

import ai.dictsite.converter.engine.ConverterOptions;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        Path input,
        Optional<Path> output,
        boolean replace,
        boolean assumeYes,
        boolean audit,
        int threads,
        Set<String> extensions,
        String outputSuffix,
        LogFormat logFormat,
        boolean verbose,
        ConverterOptions converterOptions
) {

    private static final Set<String> DEFAULT_EXTENSIONS = Set.of("html");

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(input, "input");
        output = output == null ? Optional.empty() : output;
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        outputSuffix = requireNonBlank(outputSuffix, "outputSuffix");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        converterOptions = converterOptions == null ? ConverterOptions.defaults() : converterOptions;
        if (mode == Mode.SINGLE && replace) {
            throw new IllegalArgumentException("--replace can only be used with --multiple");
        }
        if (!audit && !replace && output.isEmpty()) {
            throw new IllegalArgumentException("output folder must be specified if not using --replace");
        }
        extensions = extensions == null || extensions.isEmpty()
                ? DEFAULT_EXTENSIONS
                : extensions.stream()
                .map(Config::normalizeExtension)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }

    private static String normalizeExtension(String raw) {
        String normalized = raw.trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
