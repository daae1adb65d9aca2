package ai.speakregex.prose;

import java.util.List;

/**
 * Receives finished, wrapped prose.
 */
@FunctionalInterface
public interface ProseSink {

    void emit(List<String> lines);
}
