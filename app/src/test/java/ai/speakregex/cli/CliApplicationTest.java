package ai.speakregex.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.speakregex.config.ConfigLoader;
import ai.speakregex.trace.JavaPatternTraceSource;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void describesAQuotedPattern() {
        int exitCode = application(Map.of()).run(new String[] {"--width", "0", "'a+'"});

        assertThat(exitCode).isZero();
        assertThat(outLines())
                .containsExactly("This regular expression will match 1 or more occurrences of the character \"a\".");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void printsTheTraceBeforeTheDescription() {
        int exitCode = application(Map.of()).run(new String[] {"--show-trace", "ab"});

        assertThat(exitCode).isZero();
        assertThat(outLines()).containsExactly(
                "LITERAL 97",
                "LITERAL 98",
                "This regular expression will match the characters \"ab\".");
    }

    @Test
    void reportsInvalidPatterns() {
        int exitCode = application(Map.of()).run(new String[] {"(ab"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("That is not a valid regular expression: Unclosed group");
    }

    @Test
    void describesATraceFile(@TempDir Path tempDir) throws IOException {
        Path traceFile = tempDir.resolve("trace.txt");
        Files.writeString(traceFile, "MAX_REPEAT 0 1\n  LITERAL 120\n", StandardCharsets.UTF_8);

        int exitCode = application(Map.of()).run(new String[] {"--trace-file", traceFile.toString()});

        assertThat(exitCode).isZero();
        assertThat(outLines())
                .containsExactly("This regular expression will match up to 1 occurrence of the character \"x\".");
    }

    @Test
    void reportsUnreadableTraceFiles(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("missing.txt");

        int exitCode = application(Map.of()).run(new String[] {"--trace-file", missing.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(err.toString()).contains("Could not read trace file");
    }

    @Test
    void usageErrorsReturnTheInvalidInputCode() {
        assertThat(application(Map.of()).run(new String[] {"--bogus"})).isEqualTo(2);
        assertThat(application(Map.of()).run(new String[0])).isEqualTo(2);
        assertThat(err.toString()).contains("Missing PATTERN");
    }

    @Test
    void configurationErrorsReturnTheInvalidInputCode() {
        int exitCode = application(Map.of("SPEAKREGEX_WRAP_WIDTH", "wide")).run(new String[] {"a"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("SPEAKREGEX_WRAP_WIDTH must be an integer");
    }

    @Test
    void printsHelpAndVersion() {
        assertThat(application(Map.of()).run(new String[] {"--help"})).isZero();
        assertThat(out.toString()).contains("Usage: speakregex");

        assertThat(application(Map.of()).run(new String[] {"-V"})).isZero();
        assertThat(out.toString()).contains("speakregex 1.0.0");
    }

    @Test
    void stripsOnePairOfMatchingQuotes() {
        assertThat(CliApplication.stripQuotes("\"abc\"")).isEqualTo("abc");
        assertThat(CliApplication.stripQuotes("'abc'")).isEqualTo("abc");
        assertThat(CliApplication.stripQuotes("''")).isEmpty();
        assertThat(CliApplication.stripQuotes("'abc\"")).isEqualTo("'abc\"");
        assertThat(CliApplication.stripQuotes("'")).isEqualTo("'");
    }

    private CliApplication application(Map<String, String> environment) {
        return new CliApplication(new ConfigLoader(key -> Optional.ofNullable(environment.get(key))),
                new JavaPatternTraceSource(), new PrintWriter(out, true), new PrintWriter(err, true));
    }

    private List<String> outLines() {
        return out.toString().lines().collect(Collectors.toList());
    }
}
