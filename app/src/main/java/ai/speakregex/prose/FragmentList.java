package ai.speakregex.prose;

import ai.speakregex.sequence.PushbackSequence;
import java.util.Objects;

/**
 * Sequence of fragments introduced by a phrase and closed by an outro.
 *
 * <p>When rendered as a list, items after the first are joined with the subordinating conjunction, except the final
 * item, which takes the coordinating conjunction when one is set. Either conjunction may be {@code null} for none.
 * The items are consumed by rendering, so a list is rendered once.
 */
public final class FragmentList implements Fragment {

    public static final String DEFAULT_SUBORDINATING_CONJUNCTION = "followed by";

    private final String intro;
    private final String outro;
    private final String subordinatingConjunction;
    private final String coordinatingConjunction;
    private final PushbackSequence<Fragment> items;

    public FragmentList(String intro, String outro, String subordinatingConjunction, String coordinatingConjunction,
                        PushbackSequence<Fragment> items) {
        this.intro = intro == null ? "" : intro;
        this.outro = outro == null ? "" : outro;
        this.subordinatingConjunction = subordinatingConjunction;
        this.coordinatingConjunction = coordinatingConjunction;
        this.items = Objects.requireNonNull(items, "items");
    }

    public static FragmentList of(String intro, PushbackSequence<Fragment> items) {
        return new FragmentList(intro, "", DEFAULT_SUBORDINATING_CONJUNCTION, null, items);
    }

    public static FragmentList of(String intro, Iterable<? extends Fragment> items) {
        return of(intro, PushbackSequence.<Fragment>of(items));
    }

    public static FragmentList of(String intro, Fragment... items) {
        return of(intro, PushbackSequence.<Fragment>of(items));
    }

    public FragmentList withOutro(String newOutro) {
        return new FragmentList(intro, newOutro, subordinatingConjunction, coordinatingConjunction, items);
    }

    public FragmentList withConjunctions(String subordinating, String coordinating) {
        return new FragmentList(intro, outro, subordinating, coordinating, items);
    }

    public String intro() {
        return intro;
    }

    public String outro() {
        return outro;
    }

    public String subordinatingConjunction() {
        return subordinatingConjunction;
    }

    public String coordinatingConjunction() {
        return coordinatingConjunction;
    }

    public PushbackSequence<Fragment> items() {
        return items;
    }

    @Override
    public String toString() {
        return "FragmentList[" + intro + "]";
    }
}
