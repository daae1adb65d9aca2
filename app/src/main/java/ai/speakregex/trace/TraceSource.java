package ai.speakregex.trace;

/**
 * Produces the indented structural trace of a compiled pattern.
 */
@FunctionalInterface
public interface TraceSource {

    /**
     * @throws InvalidPatternException when the pattern does not compile
     */
    String trace(String pattern);
}
