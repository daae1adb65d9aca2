package ai.speakregex.prose;

import ai.speakregex.sequence.PushbackSequence;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lays out a {@link FragmentList} as prose.
 *
 * <p>A list holding exactly one item, where that item is text or again such a list, is written inline as
 * {@code "<intro> <item><outro>"}. Any other list becomes an introductory line ending in a colon followed by one
 * bullet per item, two spaces deeper. Non-final bullets end with a comma and the final one with the outro. The lines
 * are word-wrapped last.
 */
public class ProseRenderer {

    public static final int DEFAULT_WIDTH = 79;

    private static final String BULLET = "- ";
    private static final String INDENT = "  ";

    private final LineWrapper wrapper;

    public ProseRenderer() {
        this(DEFAULT_WIDTH);
    }

    public ProseRenderer(int width) {
        this(new LineWrapper(width));
    }

    public ProseRenderer(LineWrapper wrapper) {
        this.wrapper = Objects.requireNonNull(wrapper, "wrapper");
    }

    public List<String> render(FragmentList list) {
        return wrapper.wrap(layout(list));
    }

    /**
     * Same as {@link #render(FragmentList)} without the wrapping pass.
     */
    public List<String> layout(FragmentList list) {
        Objects.requireNonNull(list, "list");
        List<String> lines = new ArrayList<>();
        if (rendersInline(list)) {
            lines.add(inline(list));
        } else {
            layoutBlock(list, "", 0, lines);
        }
        return lines;
    }

    public boolean isCollapsible(Fragment fragment) {
        if (fragment instanceof TextFragment) {
            return true;
        }
        if (fragment instanceof FragmentList list) {
            PushbackSequence<Fragment> items = list.items();
            return items.atLeast(1) && !items.atLeast(2) && isCollapsible(items.peek());
        }
        return false;
    }

    /**
     * Writes a collapsible fragment as a single phrase. An empty list reads as "nothing".
     */
    public String inline(Fragment fragment) {
        if (fragment instanceof TextFragment text) {
            return text.text();
        }
        FragmentList list = (FragmentList) fragment;
        String body = list.items().atLeast(1) ? inline(list.items().peek()) : "nothing";
        return joinWords(list.intro(), body) + list.outro();
    }

    private boolean rendersInline(FragmentList list) {
        return !list.items().atLeast(1) || isCollapsible(list);
    }

    private void layoutBlock(FragmentList list, String lead, int depth, List<String> lines) {
        String intro = list.intro();
        lines.add(INDENT.repeat(depth) + lead + (intro.endsWith(":") ? intro : intro + ":"));

        PushbackSequence<Fragment> items = list.items();
        int position = 0;
        while (items.hasNext()) {
            Fragment item = items.pull();
            boolean last = !items.hasNext();
            String conjunction = conjunctionFor(list, position, last);
            String itemLead = conjunction == null || conjunction.isBlank() ? BULLET : BULLET + conjunction + " ";
            String punctuation = last ? list.outro() : ",";

            if (item instanceof FragmentList nested && !rendersInline(nested)) {
                layoutBlock(nested, itemLead, depth + 1, lines);
                int lastLine = lines.size() - 1;
                lines.set(lastLine, lines.get(lastLine) + punctuation);
            } else {
                lines.add(INDENT.repeat(depth + 1) + itemLead + inline(item) + punctuation);
            }
            position++;
        }
    }

    private static String conjunctionFor(FragmentList list, int position, boolean last) {
        if (position == 0) {
            return null;
        }
        if (last && list.coordinatingConjunction() != null) {
            return list.coordinatingConjunction();
        }
        return list.subordinatingConjunction();
    }

    private static String joinWords(String first, String second) {
        if (first.isEmpty()) {
            return second;
        }
        return second.isEmpty() ? first : first + " " + second;
    }
}
