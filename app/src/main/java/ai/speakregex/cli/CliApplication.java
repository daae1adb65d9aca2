package ai.speakregex.cli;

import ai.speakregex.config.Config;
import ai.speakregex.config.ConfigLoader;
import ai.speakregex.config.SystemEnvironmentReader;
import ai.speakregex.logging.LoggingConfigurator;
import ai.speakregex.prose.ProseRenderer;
import ai.speakregex.prose.ProseSink;
import ai.speakregex.trace.InvalidPatternException;
import ai.speakregex.trace.JavaPatternTraceSource;
import ai.speakregex.trace.TraceSource;
import ai.speakregex.trace.TraceTreeBuilder;
import ai.speakregex.translate.RegexSpeaker;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and {@link RegexSpeaker}.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final TraceSource traceSource;
    private final PrintWriter out;
    private final PrintWriter err;
    private final ProseSink sink;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new JavaPatternTraceSource(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, TraceSource traceSource, PrintWriter out, PrintWriter err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.traceSource = Objects.requireNonNull(traceSource, "traceSource");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.sink = lines -> {
            lines.forEach(out::println);
            out.flush();
        };
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);
        int invalidInput = commandLine.getCommandSpec().exitCodeOnInvalidInput();

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return invalidInput;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return invalidInput;
        }
        LoggingConfigurator.configure(config.logLevel());
        LOGGER.debug("Running with {}", config);

        RegexSpeaker speaker = new RegexSpeaker(traceSource, new TraceTreeBuilder(config.indentStep()),
                new ProseRenderer(config.wrapWidth()), config.traceCacheSize());

        if (config.traceFile().isPresent()) {
            return describeTraceFile(speaker, config.traceFile().get(), config.showTrace());
        }
        if (cliArguments.pattern() == null) {
            err.println("Missing PATTERN: give a regular expression or --trace-file");
            commandLine.usage(err);
            return invalidInput;
        }
        return describePattern(speaker, stripQuotes(cliArguments.pattern()), config.showTrace());
    }

    private int describePattern(RegexSpeaker speaker, String pattern, boolean showTrace) {
        try {
            if (showTrace) {
                out.println(speaker.trace(pattern));
            }
            sink.emit(speaker.speak(pattern));
            return EXIT_OK;
        } catch (InvalidPatternException ex) {
            LOGGER.debug("Rejected pattern '{}' at index {}", ex.pattern(), ex.errorIndex());
            err.println("That is not a valid regular expression: " + ex.description());
            return EXIT_FAILURE;
        }
    }

    private int describeTraceFile(RegexSpeaker speaker, Path traceFile, boolean showTrace) {
        String trace;
        try {
            trace = Files.readString(traceFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.debug("Failed to read {}", traceFile, ex);
            err.println("Could not read trace file " + traceFile + ": " + ex.getMessage());
            return EXIT_FAILURE;
        }
        if (showTrace) {
            out.println(trace.stripTrailing());
        }
        sink.emit(speaker.speakTrace(trace));
        return EXIT_OK;
    }

    /**
     * Removes one pair of matching surrounding quote characters.
     */
    static String stripQuotes(String raw) {
        if (raw.length() >= 2) {
            char first = raw.charAt(0);
            char last = raw.charAt(raw.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        return raw;
    }
}
