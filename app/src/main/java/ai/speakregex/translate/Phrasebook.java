package ai.speakregex.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed English phrases for characters, categories and anchors.
 */
final class Phrasebook {

    private static final String PROPERTY_PREFIX = "category_property_";
    private static final String NOT_PROPERTY_PREFIX = "category_not_property_";

    /** Characters spelled out wherever they appear. */
    private static final Map<Integer, String> SPECIAL_CHARACTERS = Map.ofEntries(
            Map.entry(0, "a null character"),
            Map.entry(7, "a bell character"),
            Map.entry(8, "a backspace"),
            Map.entry(9, "a tab"),
            Map.entry(10, "a newline"),
            Map.entry(11, "a vertical tab"),
            Map.entry(12, "a form feed"),
            Map.entry(13, "a carriage return"),
            Map.entry(27, "an escape character"),
            Map.entry(32, "a space"),
            Map.entry((int) '"', "a double quote"),
            Map.entry((int) '\'', "a single quote"),
            Map.entry((int) '\\', "a backslash"));

    /** Punctuation spelled out only when it is the whole literal. */
    private static final Map<Integer, String> PUNCTUATION = Map.ofEntries(
            Map.entry((int) '.', "a period"),
            Map.entry((int) ',', "a comma"),
            Map.entry((int) ':', "a colon"),
            Map.entry((int) ';', "a semicolon"),
            Map.entry((int) '!', "an exclamation mark"),
            Map.entry((int) '?', "a question mark"),
            Map.entry((int) '-', "a hyphen"),
            Map.entry((int) '_', "an underscore"),
            Map.entry((int) '(', "an opening parenthesis"),
            Map.entry((int) ')', "a closing parenthesis"),
            Map.entry((int) '[', "an opening square bracket"),
            Map.entry((int) ']', "a closing square bracket"),
            Map.entry((int) '{', "an opening curly brace"),
            Map.entry((int) '}', "a closing curly brace"),
            Map.entry((int) '<', "a less-than sign"),
            Map.entry((int) '>', "a greater-than sign"),
            Map.entry((int) '=', "an equals sign"),
            Map.entry((int) '+', "a plus sign"),
            Map.entry((int) '*', "an asterisk"),
            Map.entry((int) '/', "a forward slash"),
            Map.entry((int) '|', "a vertical bar"),
            Map.entry((int) '^', "a caret"),
            Map.entry((int) '$', "a dollar sign"),
            Map.entry((int) '#', "a hash sign"),
            Map.entry((int) '%', "a percent sign"),
            Map.entry((int) '&', "an ampersand"),
            Map.entry((int) '@', "an at sign"),
            Map.entry((int) '~', "a tilde"),
            Map.entry((int) '`', "a backtick"));

    private static final Map<String, String> CATEGORIES = Map.ofEntries(
            Map.entry("category_digit", "a digit"),
            Map.entry("category_not_digit", "a non-digit character"),
            Map.entry("category_space", "a whitespace character"),
            Map.entry("category_not_space", "a non-whitespace character"),
            Map.entry("category_word", "an alphanumeric character or underscore"),
            Map.entry("category_not_word", "a character other than a letter, digit or underscore"),
            Map.entry("category_linebreak", "a line break"),
            Map.entry("category_not_linebreak", "a character other than a line break"),
            Map.entry("category_horizontal_space", "a horizontal whitespace character"),
            Map.entry("category_not_horizontal_space", "a character other than horizontal whitespace"),
            Map.entry("category_vertical_space", "a vertical whitespace character"),
            Map.entry("category_not_vertical_space", "a character other than vertical whitespace"),
            Map.entry("category_grapheme_cluster", "a grapheme cluster"));

    private static final Map<String, String> COMPLEMENTS = Map.ofEntries(
            Map.entry("category_digit", "category_not_digit"),
            Map.entry("category_not_digit", "category_digit"),
            Map.entry("category_space", "category_not_space"),
            Map.entry("category_not_space", "category_space"),
            Map.entry("category_word", "category_not_word"),
            Map.entry("category_not_word", "category_word"),
            Map.entry("category_linebreak", "category_not_linebreak"),
            Map.entry("category_not_linebreak", "category_linebreak"),
            Map.entry("category_horizontal_space", "category_not_horizontal_space"),
            Map.entry("category_not_horizontal_space", "category_horizontal_space"),
            Map.entry("category_vertical_space", "category_not_vertical_space"),
            Map.entry("category_not_vertical_space", "category_vertical_space"));

    private static final Map<String, String> ANCHORS = Map.of(
            "at_beginning", "the start of a line",
            "at_beginning_line", "the start of a line",
            "at_end", "the end of a line",
            "at_end_line", "the end of a line",
            "at_boundary", "a word boundary",
            "at_non_boundary", "a position that is not a word boundary",
            "at_beginning_string", "the start of the string",
            "at_end_string", "the end of the string",
            "at_grapheme_boundary", "a grapheme cluster boundary",
            "at_end_of_previous_match", "the end of the previous match");

    private static final Map<Character, String> FLAGS = Map.of(
            'i', "case-insensitive matching",
            'd', "Unix line endings",
            'm', "multi-line mode",
            's', "dot-matches-all mode",
            'u', "Unicode-aware case folding",
            'x', "whitespace and comments ignored",
            'U', "Unicode character classes");

    private Phrasebook() {
    }

    /**
     * Phrase for a character that is always spelled out: the fixed table, then any non-printable character.
     */
    static Optional<String> specialCharacter(int codePoint) {
        String phrase = SPECIAL_CHARACTERS.get(codePoint);
        if (phrase != null) {
            return Optional.of(phrase);
        }
        if (!isPrintable(codePoint)) {
            return Optional.of(String.format(Locale.ROOT, "the character with code U+%04X", codePoint));
        }
        return Optional.empty();
    }

    static Optional<String> punctuation(int codePoint) {
        return Optional.ofNullable(PUNCTUATION.get(codePoint));
    }

    /**
     * Quoted form of a single character, or its spelled-out name when it has one.
     */
    static String quoted(int codePoint) {
        return specialCharacter(codePoint).orElseGet(() -> "\"" + new String(Character.toChars(codePoint)) + "\"");
    }

    static String category(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        if (key.startsWith(NOT_PROPERTY_PREFIX)) {
            return "a character without the Unicode property " + name.substring(NOT_PROPERTY_PREFIX.length());
        }
        if (key.startsWith(PROPERTY_PREFIX)) {
            return "a character with the Unicode property " + name.substring(PROPERTY_PREFIX.length());
        }
        String phrase = CATEGORIES.get(key);
        return phrase != null ? phrase : "an unknown category: " + name;
    }

    /**
     * Name of the category matching exactly the characters {@code name} does not match, when there is one.
     */
    static Optional<String> complementOf(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        if (key.startsWith(NOT_PROPERTY_PREFIX)) {
            return Optional.of("category_property_" + name.substring(NOT_PROPERTY_PREFIX.length()));
        }
        if (key.startsWith(PROPERTY_PREFIX)) {
            return Optional.of("category_not_property_" + name.substring(PROPERTY_PREFIX.length()));
        }
        return Optional.ofNullable(COMPLEMENTS.get(key));
    }

    static String anchor(String name) {
        String phrase = ANCHORS.get(name.toLowerCase(Locale.ROOT));
        return phrase != null ? phrase : "an unknown location: " + name;
    }

    /**
     * Describes inline flags such as {@code im-s}: letters before the hyphen are switched on, letters after it off.
     */
    static String flags(String letters) {
        int negation = letters.indexOf('-');
        String enabled = negation < 0 ? letters : letters.substring(0, negation);
        String disabled = negation < 0 ? "" : letters.substring(negation + 1);
        List<String> parts = new ArrayList<>();
        if (!enabled.isEmpty()) {
            parts.add("with " + flagNames(enabled));
        }
        if (!disabled.isEmpty()) {
            parts.add("without " + flagNames(disabled));
        }
        if (parts.isEmpty()) {
            return "(no change to the matching flags)";
        }
        return "(from here on, " + String.join("; ", parts) + ")";
    }

    private static String flagNames(String letters) {
        List<String> names = new ArrayList<>();
        for (char letter : letters.toCharArray()) {
            names.add(FLAGS.getOrDefault(letter, "flag '" + letter + "'"));
        }
        return String.join(", ", names);
    }

    private static boolean isPrintable(int codePoint) {
        if (!Character.isValidCodePoint(codePoint) || Character.isISOControl(codePoint)) {
            return false;
        }
        int type = Character.getType(codePoint);
        return type != Character.UNASSIGNED
                && type != Character.FORMAT
                && type != Character.SURROGATE
                && type != Character.PRIVATE_USE
                && type != Character.LINE_SEPARATOR
                && type != Character.PARAGRAPH_SEPARATOR
                && (type != Character.SPACE_SEPARATOR || codePoint == ' ');
    }
}
