package ai.speakregex.cli;

import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "speakregex", mixinStandardHelpOptions = true, version = "speakregex 1.0.0",
        description = "Describes a regular expression in plain English")
public class CliArguments {

    @CommandLine.Parameters(arity = "0..1", paramLabel = "PATTERN", description = "Regular expression to describe")
    private String pattern;

    @CommandLine.Option(names = "--trace-file", description = "Describe a pre-dumped trace instead of a pattern", paramLabel = "FILE")
    private Path traceFile;

    @CommandLine.Option(names = "--width", description = "Wrap column for the prose, 0 disables wrapping", paramLabel = "N")
    private Integer width;

    @CommandLine.Option(names = "--indent-step", description = "Spaces per nesting level in the trace", paramLabel = "N")
    private Integer indentStep;

    @CommandLine.Option(names = "--show-trace", description = "Print the trace before the description")
    private boolean showTrace;

    @CommandLine.Option(names = "--log-level", description = "Root log level: trace, debug, info, warn, error or off", paramLabel = "LEVEL")
    private String logLevel;

    public String pattern() {
        return pattern;
    }

    public Path traceFile() {
        return traceFile;
    }

    public Integer width() {
        return width;
    }

    public Integer indentStep() {
        return indentStep;
    }

    public boolean showTrace() {
        return showTrace;
    }

    public String logLevel() {
        return logLevel;
    }
}
