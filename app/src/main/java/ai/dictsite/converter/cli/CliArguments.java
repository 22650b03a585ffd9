package ai.dictsite.converter.cli;

import ai.dictsite.converter.config.LogFormat;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "dict-converter", mixinStandardHelpOptions = true,
        description = "Converts dictionary entry HTML into semantic HTML")
public class CliArguments {

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private Target target;

    static class Target {
        @CommandLine.Option(names = "--single", arity = "2", paramLabel = "PATH",
                description = "Convert one file: <input> <output>")
        private List<Path> single;

        @CommandLine.Option(names = "--multiple", arity = "1..2", paramLabel = "FOLDER",
                description = "Convert every matching file of a folder: <inputFolder> [<outputFolder>]")
        private List<Path> multiple;
    }

    @CommandLine.Option(names = "--replace", description = "Overwrite the input files (folder mode only)")
    private boolean replace;

    @CommandLine.Option(names = {"-y", "--yes"}, description = "Do not ask for confirmation before replacing files")
    private boolean assumeYes;

    @CommandLine.Option(names = "--threads", paramLabel = "COUNT", description = "Number of worker threads")
    private Integer threads;

    @CommandLine.Option(names = "--extensions", paramLabel = "LIST", description = "Comma separated file extensions to convert (default: html)")
    private String extensions;

    @CommandLine.Option(names = "--suffix", paramLabel = "SUFFIX", description = "Suffix appended to output file names (default: _processed)")
    private String suffix;

    @CommandLine.Option(names = "--bracket-space", description = "Emit a space after each closing bracket")
    private boolean bracketSpace;

    @CommandLine.Option(names = "--no-headword-hints", description = "Do not insert headword line-break hints")
    private boolean noHeadwordHints;

    @CommandLine.Option(names = "--compact", description = "Write output without pretty printing")
    private boolean compact;

    @CommandLine.Option(names = "--audit", description = "Report unknown classes in the input instead of converting")
    private boolean audit;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every pass at DEBUG level")
    private boolean verbose;

    public List<Path> single() {
        return target == null || target.single == null ? List.of() : target.single;
    }

    public List<Path> multiple() {
        return target == null || target.multiple == null ? List.of() : target.multiple;
    }

    public boolean replace() {
        return replace;
    }

    public boolean assumeYes() {
        return assumeYes;
    }

    public Integer threads() {
        return threads;
    }

    public String extensions() {
        return extensions;
    }

    public String suffix() {
        return suffix;
    }

    public boolean bracketSpace() {
        return bracketSpace;
    }

    public boolean noHeadwordHints() {
        return noHeadwordHints;
    }

    public boolean compact() {
        return compact;
    }

    public boolean audit() {
        return audit;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
