package ai.dictsite.converter.config;

import ai.dictsite.converter.cli.CliArguments;
import ai.dictsite.converter.engine.ConverterOptions;
import ai.dictsite.converter.pass.BracketWrapPass;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_THREADS = "DICT_CONVERTER_THREADS";
    static final String ENV_EXTENSIONS = "DICT_CONVERTER_EXTENSIONS";
    static final String ENV_SUFFIX = "DICT_CONVERTER_SUFFIX";
    static final String ENV_BRACKET_SPACE = "DICT_CONVERTER_BRACKET_SPACE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_SUFFIX = "_processed";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode;
        Path input;
        Optional<Path> output;
        List<Path> single = arguments.single();
        List<Path> multiple = arguments.multiple();
        if (!single.isEmpty()) {
            mode = Mode.SINGLE;
            input = single.get(0);
            output = single.size() > 1 ? Optional.of(single.get(1)) : Optional.empty();
        } else if (!multiple.isEmpty()) {
            mode = Mode.FOLDER;
            input = multiple.get(0);
            output = multiple.size() > 1 ? Optional.of(multiple.get(1)) : Optional.empty();
        } else {
            throw new IllegalArgumentException("Either --single or --multiple must be provided");
        }

        ConverterOptions converterOptions = new ConverterOptions(
                resolveBracketSpace(arguments),
                !arguments.noHeadwordHints(),
                !arguments.compact());

        return new Config(
                mode,
                input,
                output,
                arguments.replace(),
                arguments.assumeYes(),
                arguments.audit(),
                resolveThreads(arguments),
                resolveExtensions(arguments),
                firstNonBlank(arguments.suffix(), ENV_SUFFIX, DEFAULT_SUFFIX),
                resolveLogFormat(arguments),
                arguments.verbose(),
                converterOptions);
    }

    private int resolveThreads(CliArguments arguments) {
        if (arguments.threads() != null) {
            return arguments.threads();
        }
        return environmentReader.get(ENV_THREADS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parsePositiveInteger)
                .orElseGet(() -> Runtime.getRuntime().availableProcessors());
    }

    private Set<String> resolveExtensions(CliArguments arguments) {
        String raw = isNotBlank(arguments.extensions())
                ? arguments.extensions()
                : environmentReader.get(ENV_EXTENSIONS).filter(ConfigLoader::isNotBlank).orElse(null);
        return raw == null ? Set.of() : parseExtensions(raw);
    }

    private BracketWrapPass.TrailingSpace resolveBracketSpace(CliArguments arguments) {
        if (arguments.bracketSpace()) {
            return BracketWrapPass.TrailingSpace.SPACE;
        }
        boolean fromEnv = environmentReader.get(ENV_BRACKET_SPACE)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> Boolean.parseBoolean(value.trim()))
                .orElse(false);
        return fromEnv ? BracketWrapPass.TrailingSpace.SPACE : BracketWrapPass.TrailingSpace.NONE;
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) {
                throw new IllegalArgumentException("Value must be at least 1: " + raw);
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid integer value: " + raw, ex);
        }
    }

    private static Set<String> parseExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
