package ai.speakregex.trace;

/**
 * Raised when the pattern compiler rejects an expression.
 */
public class InvalidPatternException extends RuntimeException {

    private final String pattern;
    private final String description;
    private final int errorIndex;

    public InvalidPatternException(String pattern, String description, int errorIndex, Throwable cause) {
        super("Invalid regular expression: " + description, cause);
        this.pattern = pattern;
        this.description = description;
        this.errorIndex = errorIndex;
    }

    public String pattern() {
        return pattern;
    }

    /**
     * The compiler's own explanation of what is wrong.
     */
    public String description() {
        return description;
    }

    /**
     * Position of the offending construct, or -1 when the compiler did not report one.
     */
    public int errorIndex() {
        return errorIndex;
    }
}
