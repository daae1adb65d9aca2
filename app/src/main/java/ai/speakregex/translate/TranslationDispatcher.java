package ai.speakregex.translate;

import ai.speakregex.prose.Fragment;
import ai.speakregex.prose.FragmentList;
import ai.speakregex.sequence.PushbackSequence;
import ai.speakregex.trace.ElementKind;
import ai.speakregex.trace.ParseElement;
import ai.speakregex.tree.TreeNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a trace tree and describes every element as a prose fragment.
 *
 * <p>Siblings are consumed through a {@link PushbackSequence}: a handler may pull the siblings that belong to it (the
 * rest of a literal run, the alternatives of a branch) and the first sibling that does not is pushed back for the
 * next handler. Elements without a translation never stop the walk; they are reported as text instead.
 */
public class TranslationDispatcher {

    static final long UNBOUNDED_REPEAT = 4294967295L;

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationDispatcher.class);
    private static final String UNBOUNDED_TOKEN = "MAXREPEAT";

    /**
     * Lazily translates {@code node}. A root without payload stands for its children, translated in order.
     */
    public PushbackSequence<Fragment> translate(TreeNode<ParseElement> node, TranslationContext context) {
        Objects.requireNonNull(node, "node");
        TranslationContext effective = context == null ? TranslationContext.GENERIC : context;
        List<TreeNode<ParseElement>> nodes = node.data() == null ? node.children() : List.of(node);
        return translateAll(nodes, effective);
    }

    private PushbackSequence<Fragment> translateAll(List<TreeNode<ParseElement>> nodes, TranslationContext context) {
        return PushbackSequence.over(new FragmentIterator(PushbackSequence.of(nodes), context));
    }

    private List<Fragment> dispatch(TreeNode<ParseElement> node,
                                    PushbackSequence<TreeNode<ParseElement>> siblings,
                                    TranslationContext context) {
        ParseElement element = node.data();
        if (element == null) {
            return translateAll(node.children(), context).drainToList();
        }
        LOGGER.trace("Translating {} in {} context", element, context);
        return switch (element.kind()) {
            case REPEAT -> repeat(node);
            case LITERAL -> literals(node, siblings, context);
            case NOT_LITERAL -> single(notLiteral(element));
            case CHAR_CLASS -> charClass(node);
            case CATEGORY -> single(Fragment.text(Phrasebook.category(element.field(0))));
            case SUBGROUP -> subgroup(node);
            case BACKREFERENCE -> single(Fragment.text("subgroup #" + element.field(0) + " again"));
            case WILDCARD -> single(Fragment.text("any character"));
            case ASSERTION -> single(assertion(node));
            case BRANCH -> single(branch(node, siblings));
            case ANCHOR -> single(Fragment.text(Phrasebook.anchor(element.field(0))));
            case CONDITIONAL_GROUP -> single(conditionalGroup(node));
            case RANGE -> single(range(element));
            case FLAGS -> single(Fragment.text(Phrasebook.flags(element.field(0))));
            case NEGATION, ALTERNATIVE, UNRECOGNIZED -> single(fallback(element));
        };
    }

    private List<Fragment> repeat(TreeNode<ParseElement> node) {
        ParseElement element = node.data();
        OptionalInt min = parseCount(element.field(0));
        String rawMax = element.field(1);
        boolean unbounded = isUnbounded(rawMax);
        OptionalInt max = unbounded ? OptionalInt.empty() : parseCount(rawMax);
        if (min.isEmpty() || (!unbounded && max.isEmpty())) {
            return single(fallback(element));
        }

        int lower = min.getAsInt();
        if (!unbounded && lower == 1 && max.getAsInt() == 1) {
            return translateAll(node.children(), TranslationContext.GENERIC).drainToList();
        }

        String qualifier = switch (element.token()) {
            case "min_repeat" -> " (non-greedy)";
            case "possessive_repeat" -> " (possessive)";
            default -> "";
        };
        String intro;
        if (unbounded) {
            intro = lower + " or more" + qualifier + " occurrences of";
        } else if (lower == max.getAsInt()) {
            intro = lower + " occurrences of";
        } else if (lower == 0) {
            int upper = max.getAsInt();
            intro = "up to " + upper + qualifier + (upper == 1 ? " occurrence of" : " occurrences of");
        } else {
            intro = "between " + lower + " and " + max.getAsInt() + qualifier + " occurrences of";
        }
        return single(FragmentList.of(intro, translateAll(node.children(), TranslationContext.GENERIC)));
    }

    private List<Fragment> literals(TreeNode<ParseElement> node,
                                    PushbackSequence<TreeNode<ParseElement>> siblings,
                                    TranslationContext context) {
        OptionalInt first = ordinal(node.data());
        if (first.isEmpty()) {
            return single(fallback(node.data()));
        }
        if (context == TranslationContext.SET_MEMBER) {
            return single(Fragment.text(Phrasebook.quoted(first.getAsInt())));
        }

        List<Integer> run = new ArrayList<>();
        run.add(first.getAsInt());
        for (TreeNode<ParseElement> next : siblings.takeWhile(TranslationDispatcher::isUsableLiteral)) {
            run.add(ordinal(next.data()).getAsInt());
        }
        return describeRun(run);
    }

    private List<Fragment> describeRun(List<Integer> run) {
        if (run.size() == 1) {
            Optional<String> punctuation = Phrasebook.punctuation(run.get(0));
            if (punctuation.isPresent()) {
                return single(Fragment.text(punctuation.get()));
            }
        }
        List<Fragment> fragments = new ArrayList<>();
        StringBuilder characters = new StringBuilder();
        for (int codePoint : run) {
            Optional<String> special = Phrasebook.specialCharacter(codePoint);
            if (special.isPresent()) {
                flushCharacters(characters, fragments);
                fragments.add(Fragment.text(special.get()));
            } else {
                characters.appendCodePoint(codePoint);
            }
        }
        flushCharacters(characters, fragments);
        return fragments;
    }

    private static void flushCharacters(StringBuilder characters, List<Fragment> fragments) {
        if (characters.length() == 0) {
            return;
        }
        String text = characters.toString();
        String noun = text.codePointCount(0, text.length()) == 1 ? "the character" : "the characters";
        fragments.add(Fragment.text(noun + " \"" + text + "\""));
        characters.setLength(0);
    }

    private Fragment notLiteral(ParseElement element) {
        OptionalInt codePoint = ordinal(element);
        if (codePoint.isEmpty()) {
            return fallback(element);
        }
        return Fragment.text("any character except " + Phrasebook.quoted(codePoint.getAsInt()));
    }

    private List<Fragment> charClass(TreeNode<ParseElement> node) {
        List<TreeNode<ParseElement>> members = new ArrayList<>(node.children());
        boolean negated = !members.isEmpty() && members.get(0).data().is(ElementKind.NEGATION);
        if (negated) {
            members.remove(0);
        }

        if (members.size() == 1) {
            ParseElement member = members.get(0).data();
            if (negated && member.is(ElementKind.CATEGORY)) {
                Optional<String> complement = Phrasebook.complementOf(member.field(0));
                if (complement.isPresent()) {
                    return single(Fragment.text(Phrasebook.category(complement.get())));
                }
            }
            if (!negated) {
                return translateAll(members, TranslationContext.GENERIC).drainToList();
            }
        }

        String intro = negated ? "any character except" : "one of the following";
        return single(new FragmentList(intro, "", null, "or", translateAll(members, TranslationContext.SET_MEMBER)));
    }

    private List<Fragment> subgroup(TreeNode<ParseElement> node) {
        ParseElement element = node.data();
        String id = element.field(0);
        boolean atomic = "atomic_group".equals(element.token());
        boolean captured = !atomic && !id.isEmpty() && !"none".equalsIgnoreCase(id);
        List<TreeNode<ParseElement>> children = node.children();

        if (!captured && !atomic && children.size() == 1 && children.get(0).data().is(ElementKind.CONDITIONAL_GROUP)) {
            return single(conditionalGroup(children.get(0)));
        }

        String intro;
        if (atomic) {
            intro = "an atomic subgroup consisting of";
        } else if (captured) {
            intro = "subgroup #" + id + ", consisting of";
        } else {
            intro = "a non-captured subgroup consisting of";
        }
        return single(FragmentList.of(intro, translateAll(children, TranslationContext.GENERIC)));
    }

    private Fragment assertion(TreeNode<ParseElement> node) {
        ParseElement element = node.data();
        boolean negative = "assert_not".equals(element.token());
        boolean lookbehind = element.field(0).startsWith("-");
        String intro = "(if we could " + (negative ? "not " : "") + (lookbehind ? "have just matched:" : "now match:");
        return FragmentList.of(intro, translateAll(node.children(), TranslationContext.GENERIC)).withOutro(")");
    }

    private Fragment branch(TreeNode<ParseElement> node, PushbackSequence<TreeNode<ParseElement>> siblings) {
        List<TreeNode<ParseElement>> alternatives = new ArrayList<>();
        alternatives.add(node);
        for (TreeNode<ParseElement> alternative : siblings.takeWhile(sibling -> sibling.data() != null
                && sibling.data().is(ElementKind.ALTERNATIVE))) {
            alternatives.add(alternative);
        }

        List<Fragment> described = new ArrayList<>();
        for (int i = 0; i < alternatives.size(); i++) {
            String intro = i == 0 ? "either" : "or";
            described.add(FragmentList.of(intro, translateAll(alternatives.get(i).children(), TranslationContext.GENERIC)));
        }
        return new FragmentList("one of the following alternatives", "", null, null, PushbackSequence.of(described));
    }

    private Fragment conditionalGroup(TreeNode<ParseElement> node) {
        String intro = "the subgroup (only if group #" + node.data().field(0) + " was found earlier)";
        return FragmentList.of(intro, translateAll(node.children(), TranslationContext.GENERIC));
    }

    private Fragment range(ParseElement element) {
        String[] bounds = String.join(" ", element.fields()).replaceAll("[(),]", " ").trim().split("\\s+");
        if (bounds.length != 2) {
            return fallback(element);
        }
        try {
            int low = Integer.parseInt(bounds[0]);
            int high = Integer.parseInt(bounds[1]);
            return Fragment.text("a character between " + Phrasebook.quoted(low) + " and " + Phrasebook.quoted(high));
        } catch (IllegalArgumentException ex) {
            LOGGER.debug("Malformed range bounds in '{}': {}", element, ex.getMessage());
            return fallback(element);
        }
    }

    private Fragment fallback(ParseElement element) {
        LOGGER.warn("No translation for trace element '{}'", element.rawLine());
        return Fragment.text("something I don't understand: " + element.rawLine());
    }

    private static List<Fragment> single(Fragment fragment) {
        return List.of(fragment);
    }

    private static boolean isUsableLiteral(TreeNode<ParseElement> node) {
        return node.data() != null && node.data().is(ElementKind.LITERAL) && ordinal(node.data()).isPresent();
    }

    private static OptionalInt ordinal(ParseElement element) {
        try {
            int value = Integer.parseInt(element.field(0));
            return Character.isValidCodePoint(value) ? OptionalInt.of(value) : OptionalInt.empty();
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    private static OptionalInt parseCount(String raw) {
        try {
            return OptionalInt.of(Integer.parseInt(raw));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    private static boolean isUnbounded(String raw) {
        if (UNBOUNDED_TOKEN.equalsIgnoreCase(raw)) {
            return true;
        }
        try {
            return Long.parseLong(raw) >= UNBOUNDED_REPEAT;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private final class FragmentIterator implements Iterator<Fragment> {

        private final PushbackSequence<TreeNode<ParseElement>> siblings;
        private final TranslationContext context;
        private Iterator<Fragment> current = Collections.emptyIterator();

        private FragmentIterator(PushbackSequence<TreeNode<ParseElement>> siblings, TranslationContext context) {
            this.siblings = siblings;
            this.context = context;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (!siblings.hasNext()) {
                    return false;
                }
                current = dispatch(siblings.pull(), siblings, context).iterator();
            }
            return true;
        }

        @Override
        public Fragment next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
