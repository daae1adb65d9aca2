package ai.speakregex.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.speakregex.prose.ProseRenderer;
import ai.speakregex.trace.InvalidPatternException;
import ai.speakregex.trace.JavaPatternTraceSource;
import ai.speakregex.trace.TraceSource;
import ai.speakregex.trace.TraceTreeBuilder;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RegexSpeakerTest {

    private final RegexSpeaker speaker = new RegexSpeaker(new JavaPatternTraceSource(), new TraceTreeBuilder(),
            new ProseRenderer(0), 8);

    @Test
    void speaksASimplePatternInline() {
        assertThat(speaker.speak("a*"))
                .containsExactly("This regular expression will match 0 or more occurrences of the character \"a\".");
    }

    @Test
    void speaksAlternationAsNestedBullets() {
        assertThat(speaker.speak("ab|c")).containsExactly(
                "This regular expression will match:",
                "  - one of the following alternatives:",
                "    - either the characters \"ab\",",
                "    - or the character \"c\".");
    }

    @Test
    void speaksSequencesWithFollowedBy() {
        assertThat(speaker.speak("^\\d+x$")).containsExactly(
                "This regular expression will match:",
                "  - the start of a line,",
                "  - followed by 1 or more occurrences of a digit,",
                "  - followed by the character \"x\",",
                "  - followed by the end of a line.");
    }

    @Test
    void scopedCommentsModeKeepsLaterWhitespace() {
        assertThat(speaker.speak("(?x:a b)c d")).containsExactly(
                "This regular expression will match:",
                "  - a non-captured subgroup consisting of the characters \"ab\",",
                "  - followed by the character \"c\",",
                "  - followed by a space,",
                "  - followed by the character \"d\".");
    }

    @Test
    void emptyQuoteBeforeAQuantifierIsIgnored() {
        assertThat(speaker.speak("a\\Q\\E*"))
                .containsExactly("This regular expression will match 0 or more occurrences of the character \"a\".");
    }

    @Test
    void speaksInlineFlags() {
        assertThat(speaker.speak("(?i)abc")).containsExactly(
                "This regular expression will match:",
                "  - (from here on, with case-insensitive matching),",
                "  - followed by the characters \"abc\".");
    }

    @Test
    void leavesTraceLoggingToTheSource() {
        Logger logger = (Logger) LoggerFactory.getLogger(RegexSpeaker.class);
        Level previous = logger.getLevel();
        ListAppender<ILoggingEvent> events = new ListAppender<>();
        events.start();
        logger.addAppender(events);
        logger.setLevel(Level.DEBUG);
        try {
            speaker.speak("a+b");
        } finally {
            logger.detachAppender(events);
            logger.setLevel(previous);
        }

        assertThat(events.list).extracting(ILoggingEvent::getLevel).doesNotContain(Level.DEBUG);
        assertThat(events.list).extracting(ILoggingEvent::getFormattedMessage)
                .noneMatch(message -> message.contains("MAX_REPEAT"));
    }

    @Test
    void speaksAPreDumpedTrace() {
        assertThat(speaker.speakTrace("LITERAL 97\nLITERAL 98"))
                .containsExactly("This regular expression will match the characters \"ab\".");
        assertThat(speaker.speakTrace("")).containsExactly("This regular expression will match nothing.");
    }

    @Test
    void invalidPatternsAreReportedNotTranslated() {
        Throwable thrown = catchThrowable(() -> speaker.speak("(ab"));

        assertThat(thrown).isInstanceOf(InvalidPatternException.class);
    }

    @Test
    void cachesTracesPerInstance() {
        AtomicInteger calls = new AtomicInteger();
        TraceSource source = pattern -> {
            calls.incrementAndGet();
            return "LITERAL 97";
        };
        RegexSpeaker cached = new RegexSpeaker(source, new TraceTreeBuilder(), new ProseRenderer(), 2);

        cached.speak("a");
        cached.speak("a");

        assertThat(calls.get()).isEqualTo(1);
        assertThat(cached.cachedTraces()).isEqualTo(1);
    }

    @Test
    void evictsTheLeastRecentlyUsedTrace() {
        AtomicInteger calls = new AtomicInteger();
        RegexSpeaker cached = new RegexSpeaker(pattern -> {
            calls.incrementAndGet();
            return "ANY None";
        }, new TraceTreeBuilder(), new ProseRenderer(), 2);

        cached.trace("a");
        cached.trace("b");
        cached.trace("a");
        cached.trace("c");
        cached.trace("a");
        assertThat(calls.get()).isEqualTo(3);

        cached.trace("b");
        assertThat(calls.get()).isEqualTo(4);
        assertThat(cached.cachedTraces()).isEqualTo(2);
    }

    @Test
    void zeroCacheSizeAlwaysAsksTheSource() {
        AtomicInteger calls = new AtomicInteger();
        RegexSpeaker uncached = new RegexSpeaker(pattern -> {
            calls.incrementAndGet();
            return "ANY None";
        }, new TraceTreeBuilder(), new ProseRenderer(), 0);

        uncached.trace("a");
        uncached.trace("a");

        assertThat(calls.get()).isEqualTo(2);
        assertThat(uncached.cachedTraces()).isZero();
    }
}
