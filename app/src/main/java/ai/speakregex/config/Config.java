package ai.speakregex.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Settings for one run, assembled from CLI arguments, environment values and defaults.
 *
 * @param wrapWidth      prose wrap column, {@code 0} disables wrapping
 * @param indentStep     spaces per nesting level in trace text
 * @param traceCacheSize maximum cached traces, {@code 0} disables the cache
 * @param showTrace      whether the trace is printed before the prose
 * @param logLevel       root logger level name
 * @param traceFile      pre-dumped trace to describe instead of a pattern
 */
public record Config(
        int wrapWidth,
        int indentStep,
        int traceCacheSize,
        boolean showTrace,
        String logLevel,
        Optional<Path> traceFile
) {

    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public Config {
        if (wrapWidth < 0) {
            throw new IllegalArgumentException("wrapWidth must be zero or greater");
        }
        if (indentStep < 1) {
            throw new IllegalArgumentException("indentStep must be at least 1");
        }
        if (traceCacheSize < 0) {
            throw new IllegalArgumentException("traceCacheSize must be zero or greater");
        }
        Objects.requireNonNull(logLevel, "logLevel");
        logLevel = logLevel.trim().toUpperCase(Locale.ROOT);
        if (!LOG_LEVELS.contains(logLevel)) {
            throw new IllegalArgumentException("Unsupported log level: " + logLevel);
        }
        traceFile = traceFile == null ? Optional.empty() : traceFile;
    }
}
