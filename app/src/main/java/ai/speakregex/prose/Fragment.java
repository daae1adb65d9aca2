package ai.speakregex.prose;

/**
 * A piece of prose: either plain text or a nested {@link FragmentList}.
 */
public interface Fragment {

    static Fragment text(String text) {
        return new TextFragment(text);
    }
}
