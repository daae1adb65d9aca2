package ai.speakregex.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured root log level to logback at runtime.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level; unknown level names fall back to {@code WARN}.
     */
    public static void configure(String level) {
        rootLogger().setLevel(Level.toLevel(level, Level.WARN));
    }

    public static Level rootLevel() {
        return rootLogger().getLevel();
    }

    private static Logger rootLogger() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }
}
