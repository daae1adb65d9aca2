package ai.speakregex.sequence;

/**
 * Raised when {@link PushbackSequence#rewind()} has no freshly pulled value to put back.
 */
public class NoPreviousValueException extends IllegalStateException {

    public NoPreviousValueException() {
        super("no previous value to rewind to");
    }
}
