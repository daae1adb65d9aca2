package ai.speakregex.trace;

import ai.speakregex.tree.TreeNode;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a tree of {@link ParseElement}s from a trace whose indentation encodes nesting.
 *
 * <p>Indentation is expected to grow and shrink in a uniform step. Irregular steps are not corrected: a deeper line
 * always nests exactly one level below the previous line, and a shallower one climbs
 * {@code (previousIndent - indent) / step} levels.
 */
public class TraceTreeBuilder {

    public static final int DEFAULT_INDENT_STEP = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(TraceTreeBuilder.class);

    private final int indentStep;

    public TraceTreeBuilder() {
        this(DEFAULT_INDENT_STEP);
    }

    public TraceTreeBuilder(int indentStep) {
        if (indentStep < 1) {
            throw new IllegalArgumentException("indentStep must be at least 1");
        }
        this.indentStep = indentStep;
    }

    /**
     * Returns a synthetic root without payload whose children are the top-level trace lines.
     */
    public TreeNode<ParseElement> build(String trace) {
        return build(trace == null ? List.of() : trace.lines().collect(Collectors.toList()));
    }

    public TreeNode<ParseElement> build(List<String> lines) {
        TreeNode<ParseElement> root = new TreeNode<>(null);
        TreeNode<ParseElement> current = root;
        int previousIndent = 0;

        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            String content = line.stripLeading();
            int indent = line.length() - content.length();

            if (indent > previousIndent) {
                TreeNode<ParseElement> parent = current;
                current = current.lastChild().orElseGet(() -> {
                    LOGGER.warn("Trace line '{}' is indented but has no preceding element; keeping it at the same level", content);
                    return parent;
                });
            } else if (indent < previousIndent) {
                int levels = (previousIndent - indent) / indentStep;
                for (int i = 0; i < levels && current.parent().isPresent(); i++) {
                    current = current.parent().get();
                }
            }

            current.add(new TreeNode<>(ParseElement.parse(content)));
            previousIndent = indent;
        }

        LOGGER.debug("Built trace tree:\n{}", root.dump());
        return root;
    }

    public int indentStep() {
        return indentStep;
    }
}
