package ai.speakregex.sequence;

import java.util.NoSuchElementException;

/**
 * Raised when a value is pulled from a sequence that has none left.
 */
public class SequenceExhaustedException extends NoSuchElementException {

    public SequenceExhaustedException() {
        super("sequence is exhausted");
    }
}
