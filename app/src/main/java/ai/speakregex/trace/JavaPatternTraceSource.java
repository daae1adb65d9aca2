package ai.speakregex.trace;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trace source backed by {@code java.util.regex}: the pattern compiler validates the expression, then its structure
 * is written out in the indented trace layout.
 */
public class JavaPatternTraceSource implements TraceSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(JavaPatternTraceSource.class);

    private final int flags;

    public JavaPatternTraceSource() {
        this(0);
    }

    /**
     * @param flags {@link Pattern} compile flags; {@link Pattern#COMMENTS} also makes the trace skip whitespace
     */
    public JavaPatternTraceSource(int flags) {
        this.flags = flags;
    }

    @Override
    public String trace(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        try {
            Pattern.compile(pattern, flags);
        } catch (PatternSyntaxException ex) {
            LOGGER.debug("Pattern rejected by compiler: {}", ex.getMessage());
            throw new InvalidPatternException(pattern, ex.getDescription(), ex.getIndex(), ex);
        }
        String trace = new PatternTraceWriter(pattern, (flags & Pattern.COMMENTS) != 0).write();
        LOGGER.debug("Trace for '{}':\n{}", pattern, trace);
        return trace;
    }
}
