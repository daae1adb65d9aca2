package ai.speakregex.prose;

import java.util.ArrayList;
import java.util.List;

/**
 * Word-wraps lines at a fixed column. Continuation lines are indented two spaces deeper than the line they continue,
 * which places them under the text of a {@code "- "} bullet. Words longer than the width are never split.
 */
public class LineWrapper {

    private static final int CONTINUATION_INDENT = 2;

    private final int width;

    /**
     * @param width maximum line length; zero disables wrapping
     */
    public LineWrapper(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("width must be zero or greater");
        }
        this.width = width;
    }

    public List<String> wrap(List<String> lines) {
        List<String> wrapped = new ArrayList<>();
        for (String line : lines) {
            wrapLine(line, wrapped);
        }
        return wrapped;
    }

    private void wrapLine(String line, List<String> wrapped) {
        if (width == 0 || line.length() <= width) {
            wrapped.add(line);
            return;
        }
        String content = line.stripLeading();
        int leading = line.length() - content.length();
        String continuation = " ".repeat(leading + CONTINUATION_INDENT);

        StringBuilder current = new StringBuilder(line.substring(0, leading));
        boolean hasWord = false;
        for (String word : content.split(" ", -1)) {
            if (hasWord && current.length() + 1 + word.length() > width) {
                wrapped.add(current.toString());
                current = new StringBuilder(continuation);
                hasWord = false;
            }
            if (hasWord) {
                current.append(' ');
            }
            current.append(word);
            hasWord = true;
        }
        wrapped.add(current.toString());
    }

    public int width() {
        return width;
    }
}
