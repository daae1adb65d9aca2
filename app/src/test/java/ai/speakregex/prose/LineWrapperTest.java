package ai.speakregex.prose;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import org.junit.jupiter.api.Test;

class LineWrapperTest {

    @Test
    void breaksAtWordBoundaries() {
        List<String> wrapped = new LineWrapper(20).wrap(List.of("  - followed by the characters abc"));

        assertThat(wrapped).containsExactly("  - followed by the", "    characters abc");
    }

    @Test
    void neverSplitsLongWords() {
        assertThat(new LineWrapper(5).wrap(List.of("abcdefghij"))).containsExactly("abcdefghij");
    }

    @Test
    void zeroWidthDisablesWrapping() {
        String line = "a".repeat(200) + " b";

        assertThat(new LineWrapper(0).wrap(List.of(line))).containsExactly(line);
    }

    @Test
    void rejectsNegativeWidth() {
        assertThat(catchThrowable(() -> new LineWrapper(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
