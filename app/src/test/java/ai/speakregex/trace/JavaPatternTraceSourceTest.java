package ai.speakregex.trace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class JavaPatternTraceSourceTest {

    private final JavaPatternTraceSource source = new JavaPatternTraceSource();

    @Test
    void tracesLiteralsAndAlternation() {
        assertThat(source.trace("ab")).isEqualTo("LITERAL 97\nLITERAL 98");
        assertThat(source.trace("a|bc")).isEqualTo("BRANCH\n  LITERAL 97\nOR\n  LITERAL 98\n  LITERAL 99");
    }

    @Test
    void tracesQuantifiersWithGreediness() {
        assertThat(source.trace("(a)*?")).isEqualTo("MIN_REPEAT 0 MAXREPEAT\n  SUBPATTERN 1 0 0\n    LITERAL 97");
        assertThat(source.trace("a{2,4}+")).isEqualTo("POSSESSIVE_REPEAT 2 4\n  LITERAL 97");
        assertThat(source.trace("x{3}")).isEqualTo("MAX_REPEAT 3 3\n  LITERAL 120");
        assertThat(source.trace("x?")).isEqualTo("MAX_REPEAT 0 1\n  LITERAL 120");
    }

    @Test
    void tracesCharacterClasses() {
        assertThat(source.trace("[^a-z\\d]"))
                .isEqualTo("IN\n  NEGATE None\n  RANGE (97, 122)\n  CATEGORY CATEGORY_DIGIT");
        assertThat(source.trace("\\W")).isEqualTo("CATEGORY CATEGORY_NOT_WORD");
    }

    @Test
    void tracesGroupsAndLookarounds() {
        assertThat(source.trace("(?=x)")).isEqualTo("ASSERT 1\n  LITERAL 120");
        assertThat(source.trace("(?<!x)")).isEqualTo("ASSERT_NOT -1\n  LITERAL 120");
        assertThat(source.trace("(?:x)")).isEqualTo("SUBPATTERN None 0 0\n  LITERAL 120");
        assertThat(source.trace("(?>x)")).isEqualTo("ATOMIC_GROUP\n  LITERAL 120");
        assertThat(source.trace("(a)\\1")).isEqualTo("SUBPATTERN 1 0 0\n  LITERAL 97\nGROUPREF 1");
        assertThat(source.trace("(?<word>a)\\k<word>")).isEqualTo("SUBPATTERN 1 0 0\n  LITERAL 97\nGROUPREF 1");
    }

    @Test
    void tracesAnchorsAndQuotedText() {
        assertThat(source.trace("^\\bx$")).isEqualTo("AT AT_BEGINNING\nAT AT_BOUNDARY\nLITERAL 120\nAT AT_END");
        assertThat(source.trace("\\Qa.b\\E")).isEqualTo("LITERAL 97\nLITERAL 46\nLITERAL 98");
        assertThat(source.trace("\\t\\x41")).isEqualTo("LITERAL 9\nLITERAL 65");
    }

    @Test
    void ignoresWhitespaceAndCommentsInCommentsMode() {
        JavaPatternTraceSource commentsSource = new JavaPatternTraceSource(Pattern.COMMENTS);

        assertThat(commentsSource.trace("a b # trailing")).isEqualTo("LITERAL 97\nLITERAL 98");
        assertThat(source.trace("(?x)a b")).isEqualTo("FLAGS x\nLITERAL 97\nLITERAL 98");
    }

    @Test
    void inlineFlagsEndWithTheirEnclosingGroup() {
        assertThat(source.trace("(?x:a b)c d"))
                .isEqualTo("SUBPATTERN None 0 0\n  LITERAL 97\n  LITERAL 98\nLITERAL 99\nLITERAL 32\nLITERAL 100");
        assertThat(source.trace("((?x)a b)c d"))
                .isEqualTo("SUBPATTERN 1 0 0\n  FLAGS x\n  LITERAL 97\n  LITERAL 98\nLITERAL 99\nLITERAL 32\nLITERAL 100");
        assertThat(new JavaPatternTraceSource(Pattern.COMMENTS).trace("(?-x:a b)c d"))
                .isEqualTo("SUBPATTERN None 0 0\n  LITERAL 97\n  LITERAL 32\n  LITERAL 98\nLITERAL 99\nLITERAL 100");
    }

    @Test
    void emptyQuotesDoNotSeparateAnAtomFromItsQuantifier() {
        assertThat(source.trace("a\\Q\\E*")).isEqualTo("MAX_REPEAT 0 MAXREPEAT\n  LITERAL 97");
        assertThat(source.trace("\\Q\\Eb\\Q\\E{2}")).isEqualTo("MAX_REPEAT 2 2\n  LITERAL 98");
    }

    @Test
    void reportsSyntaxErrorsAsInvalidPattern() {
        Throwable thrown = catchThrowable(() -> source.trace("(ab"));

        assertThat(thrown).isInstanceOf(InvalidPatternException.class);
        InvalidPatternException invalid = (InvalidPatternException) thrown;
        assertThat(invalid.pattern()).isEqualTo("(ab");
        assertThat(invalid.description()).isEqualTo("Unclosed group");
        assertThat(invalid.getMessage()).isEqualTo("Invalid regular expression: Unclosed group");
        assertThat(invalid.getCause()).isNotNull();
    }
}
