package ai.speakregex.translate;

import ai.speakregex.prose.FragmentList;
import ai.speakregex.prose.ProseRenderer;
import ai.speakregex.trace.InvalidPatternException;
import ai.speakregex.trace.JavaPatternTraceSource;
import ai.speakregex.trace.ParseElement;
import ai.speakregex.trace.TraceSource;
import ai.speakregex.trace.TraceTreeBuilder;
import ai.speakregex.tree.TreeNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns regular expressions into English prose.
 *
 * <p>Traces are cached per instance in a least-recently-used map. Instances are not thread-safe.
 */
public class RegexSpeaker {

    public static final String INTRO = "This regular expression will match";
    public static final String OUTRO = ".";
    public static final int DEFAULT_CACHE_SIZE = 64;

    private static final Logger LOGGER = LoggerFactory.getLogger(RegexSpeaker.class);

    private final TraceSource traceSource;
    private final TraceTreeBuilder treeBuilder;
    private final TranslationDispatcher dispatcher;
    private final ProseRenderer renderer;
    private final Map<String, String> traceCache;
    private final int cacheSize;

    public RegexSpeaker() {
        this(new JavaPatternTraceSource(), new TraceTreeBuilder(), new ProseRenderer(), DEFAULT_CACHE_SIZE);
    }

    public RegexSpeaker(TraceSource traceSource, TraceTreeBuilder treeBuilder, ProseRenderer renderer, int cacheSize) {
        if (cacheSize < 0) {
            throw new IllegalArgumentException("cacheSize must be zero or greater");
        }
        this.traceSource = Objects.requireNonNull(traceSource, "traceSource");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.dispatcher = new TranslationDispatcher();
        this.cacheSize = cacheSize;
        this.traceCache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > RegexSpeaker.this.cacheSize;
            }
        };
    }

    /**
     * Describes {@code pattern}, one rendered line per list element.
     *
     * @throws InvalidPatternException when the pattern does not compile
     */
    public List<String> speak(String pattern) {
        return describe(treeBuilder.build(trace(pattern)));
    }

    /**
     * Describes an already produced trace.
     */
    public List<String> speakTrace(String traceText) {
        Objects.requireNonNull(traceText, "traceText");
        return describe(treeBuilder.build(traceText));
    }

    /**
     * Returns the trace of {@code pattern}, from the cache when possible.
     */
    public String trace(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (cacheSize == 0) {
            return traceSource.trace(pattern);
        }
        String cached = traceCache.get(pattern);
        if (cached != null) {
            LOGGER.info("Trace cache hit for pattern '{}'", pattern);
            return cached;
        }
        String trace = traceSource.trace(pattern);
        traceCache.put(pattern, trace);
        LOGGER.info("Cached trace for pattern '{}' ({} of {} entries)", pattern, traceCache.size(), cacheSize);
        return trace;
    }

    public List<String> describe(TreeNode<ParseElement> root) {
        Objects.requireNonNull(root, "root");
        FragmentList sentence = FragmentList.of(INTRO, dispatcher.translate(root, TranslationContext.GENERIC))
                .withOutro(OUTRO);
        return renderer.render(sentence);
    }

    int cachedTraces() {
        return traceCache.size();
    }
}
