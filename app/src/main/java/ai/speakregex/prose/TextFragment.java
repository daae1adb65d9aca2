package ai.speakregex.prose;

import java.util.Objects;

/**
 * Leaf fragment holding a finished phrase.
 */
public record TextFragment(String text) implements Fragment {

    public TextFragment {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
        return text;
    }
}
