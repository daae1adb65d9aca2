package ai.speakregex.translate;

/**
 * Role of the caller of a translation, which changes how descendants are phrased.
 */
public enum TranslationContext {
    /** Ordinary position in a sequence of elements. */
    GENERIC,
    /** Member of a character class, listed as one of several alternatives. */
    SET_MEMBER
}
