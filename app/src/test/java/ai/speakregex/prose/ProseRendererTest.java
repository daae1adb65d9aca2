package ai.speakregex.prose;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProseRendererTest {

    private final ProseRenderer renderer = new ProseRenderer(0);

    @Test
    void singleItemListRendersInline() {
        FragmentList list = FragmentList.of("This regular expression will match", Fragment.text("any character"))
                .withOutro(".");

        assertThat(renderer.render(list)).containsExactly("This regular expression will match any character.");
    }

    @Test
    void twoItemsRenderAsBullets() {
        FragmentList list = FragmentList.of("This regular expression will match",
                Fragment.text("any character"), Fragment.text("a digit")).withOutro(".");

        assertThat(renderer.render(list)).containsExactly(
                "This regular expression will match:",
                "  - any character,",
                "  - followed by a digit.");
    }

    @Test
    void nestedSingletonListsCollapseRecursively() {
        FragmentList inner = FragmentList.of("2 occurrences of", Fragment.text("a digit"));
        FragmentList outer = FragmentList.of("subgroup #1, consisting of", inner);
        FragmentList list = FragmentList.of("This regular expression will match", outer).withOutro(".");

        assertThat(renderer.isCollapsible(list)).isTrue();
        assertThat(renderer.render(list))
                .containsExactly("This regular expression will match subgroup #1, consisting of 2 occurrences of a digit.");
    }

    @Test
    void nestedBlocksCarryTheParentPunctuation() {
        FragmentList alternatives = FragmentList.of("either", Fragment.text("x"), Fragment.text("y"));
        FragmentList list = FragmentList.of("intro", Fragment.text("a digit"), alternatives).withOutro(".");

        assertThat(renderer.render(list)).containsExactly(
                "intro:",
                "  - a digit,",
                "  - followed by either:",
                "    - x,",
                "    - followed by y.");
    }

    @Test
    void coordinatingConjunctionIntroducesTheFinalItem() {
        FragmentList list = new FragmentList("one of the following", ")", null, "or",
                FragmentList.of("", Fragment.text("a"), Fragment.text("b"), Fragment.text("c")).items());

        assertThat(renderer.render(list)).containsExactly(
                "one of the following:",
                "  - a,",
                "  - b,",
                "  - or c)");
    }

    @Test
    void emptyListReadsAsNothing() {
        FragmentList list = FragmentList.of("a non-captured subgroup consisting of", List.of()).withOutro(".");

        assertThat(renderer.render(list)).containsExactly("a non-captured subgroup consisting of nothing.");
    }

    @Test
    void introColonIsNotDoubled() {
        FragmentList list = FragmentList.of("(if we could now match:", Fragment.text("a"), Fragment.text("b"))
                .withOutro(")");

        assertThat(renderer.render(list)).containsExactly(
                "(if we could now match:",
                "  - a,",
                "  - followed by b)");
    }

    @Test
    void wrapsLongLinesUnderTheBulletText() {
        ProseRenderer narrow = new ProseRenderer(20);
        FragmentList list = FragmentList.of("intro", Fragment.text("x"), Fragment.text("the characters abc"));

        assertThat(narrow.render(list)).containsExactly(
                "intro:",
                "  - x,",
                "  - followed by the",
                "    characters abc");
    }
}
