package ai.speakregex.config;

import ai.speakregex.cli.CliArguments;
import ai.speakregex.prose.ProseRenderer;
import ai.speakregex.trace.TraceTreeBuilder;
import ai.speakregex.translate.RegexSpeaker;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} from CLI arguments, falling back to environment variables and then defaults.
 */
public class ConfigLoader {

    static final String ENV_WRAP_WIDTH = "SPEAKREGEX_WRAP_WIDTH";
    static final String ENV_INDENT_STEP = "SPEAKREGEX_INDENT_STEP";
    static final String ENV_TRACE_CACHE_SIZE = "SPEAKREGEX_TRACE_CACHE_SIZE";
    static final String ENV_SHOW_TRACE = "SPEAKREGEX_SHOW_TRACE";
    static final String ENV_LOG_LEVEL = "SPEAKREGEX_LOG_LEVEL";

    private static final String DEFAULT_LOG_LEVEL = "WARN";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        int wrapWidth = resolveInteger(arguments.width(), ENV_WRAP_WIDTH, "--width", ProseRenderer.DEFAULT_WIDTH);
        int indentStep = resolveInteger(arguments.indentStep(), ENV_INDENT_STEP, "--indent-step",
                TraceTreeBuilder.DEFAULT_INDENT_STEP);
        int traceCacheSize = environmentReader.get(ENV_TRACE_CACHE_SIZE)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseNonNegativeInteger(value, ENV_TRACE_CACHE_SIZE))
                .orElse(RegexSpeaker.DEFAULT_CACHE_SIZE);
        if (indentStep < 1) {
            throw new IllegalArgumentException("indent step must be at least 1");
        }
        boolean showTrace = resolveShowTrace(arguments);
        String logLevel = firstNonBlank(arguments.logLevel(), ENV_LOG_LEVEL, DEFAULT_LOG_LEVEL);

        return new Config(wrapWidth, indentStep, traceCacheSize, showTrace, logLevel,
                Optional.ofNullable(arguments.traceFile()));
    }

    private int resolveInteger(Integer cliValue, String envKey, String optionName, int defaultValue) {
        if (cliValue != null) {
            if (cliValue < 0) {
                throw new IllegalArgumentException(optionName + " must be zero or greater");
            }
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseNonNegativeInteger(value, envKey))
                .orElse(defaultValue);
    }

    private boolean resolveShowTrace(CliArguments arguments) {
        if (arguments.showTrace()) {
            return true;
        }
        return environmentReader.get(ENV_SHOW_TRACE)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static int parseNonNegativeInteger(String raw, String name) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
