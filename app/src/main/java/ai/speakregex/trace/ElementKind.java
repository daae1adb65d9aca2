package ai.speakregex.trace;

import java.util.List;
import java.util.Locale;

/**
 * Kinds of trace lines, each listing the trace tokens that produce it.
 */
public enum ElementKind {
    REPEAT("max_repeat", "min_repeat", "possessive_repeat"),
    LITERAL("literal"),
    NOT_LITERAL("not_literal"),
    CHAR_CLASS("in"),
    NEGATION("negate"),
    CATEGORY("category"),
    SUBGROUP("subpattern", "atomic_group"),
    BACKREFERENCE("groupref"),
    WILDCARD("any"),
    ASSERTION("assert", "assert_not"),
    BRANCH("branch"),
    ALTERNATIVE("or"),
    ANCHOR("at"),
    CONDITIONAL_GROUP("groupref_exists"),
    RANGE("range"),
    FLAGS("flags"),
    UNRECOGNIZED;

    private final List<String> tokens;

    ElementKind(String... tokens) {
        this.tokens = List.of(tokens);
    }

    public List<String> tokens() {
        return tokens;
    }

    /**
     * Resolves a trace token case-insensitively; unknown tokens map to {@link #UNRECOGNIZED}.
     */
    public static ElementKind fromToken(String token) {
        if (token == null || token.isBlank()) {
            return UNRECOGNIZED;
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (ElementKind kind : values()) {
            if (kind.tokens.contains(normalized)) {
                return kind;
            }
        }
        return UNRECOGNIZED;
    }
}
