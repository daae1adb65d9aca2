package ai.speakregex.trace;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent walk over a {@code java.util.regex} pattern that writes the indented structural trace.
 *
 * <p>The pattern must already have been accepted by {@link java.util.regex.Pattern#compile(String)}; malformed input
 * is not diagnosed here. Group numbers follow Java's rule of counting opening parentheses.
 */
final class PatternTraceWriter {

    static final String UNBOUNDED = "MAXREPEAT";

    private final String pattern;
    private final int limit;
    private final Map<String, Integer> groupNames = new HashMap<>();
    private int pos;
    private int groupCount;
    private boolean commentsMode;

    PatternTraceWriter(String pattern, boolean commentsMode) {
        this.pattern = pattern;
        this.limit = pattern.length();
        this.commentsMode = commentsMode;
    }

    String write() {
        pos = 0;
        List<TraceItem> items = parseAlternation();
        if (pos < limit) {
            throw new IllegalStateException("Unexpected '" + pattern.charAt(pos) + "' at index " + pos);
        }
        List<String> lines = new ArrayList<>();
        for (TraceItem item : items) {
            item.appendTo(lines, 0);
        }
        return String.join("\n", lines);
    }

    private List<TraceItem> parseAlternation() {
        List<List<TraceItem>> alternatives = new ArrayList<>();
        alternatives.add(parseSequence());
        while (pos < limit && pattern.charAt(pos) == '|') {
            pos++;
            alternatives.add(parseSequence());
        }
        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        List<TraceItem> items = new ArrayList<>();
        items.add(new TraceItem("BRANCH", alternatives.get(0)));
        for (List<TraceItem> alternative : alternatives.subList(1, alternatives.size())) {
            items.add(new TraceItem("OR", alternative));
        }
        return items;
    }

    private List<TraceItem> parseSequence() {
        List<TraceItem> items = new ArrayList<>();
        while (pos < limit) {
            char ch = pattern.charAt(pos);
            if (ch == '|' || ch == ')') {
                break;
            }
            if (skipIgnorable()) {
                continue;
            }
            List<TraceItem> atoms = parseAtom();
            if (atoms.isEmpty()) {
                continue;
            }
            items.addAll(atoms.subList(0, atoms.size() - 1));
            items.add(parseQuantifiers(atoms.get(atoms.size() - 1)));
        }
        return items;
    }

    private List<TraceItem> parseAtom() {
        char ch = pattern.charAt(pos);
        switch (ch) {
            case '(':
                return parseGroup();
            case '[':
                return List.of(parseCharClass());
            case '.':
                pos++;
                return List.of(TraceItem.leaf("ANY None"));
            case '^':
                pos++;
                return List.of(TraceItem.leaf("AT AT_BEGINNING"));
            case '$':
                pos++;
                return List.of(TraceItem.leaf("AT AT_END"));
            case '\\':
                return parseEscape(false);
            default:
                return List.of(TraceItem.literal(nextCodePoint()));
        }
    }

    private TraceItem parseQuantifiers(TraceItem atom) {
        TraceItem result = atom;
        while (pos < limit) {
            int mark = pos;
            while (skipIgnorable() || skipEmptyQuote()) {
                // comments and empty quotes may sit between an atom and its quantifier
            }
            if (pos >= limit) {
                pos = mark;
                return result;
            }
            String min;
            String max;
            switch (pattern.charAt(pos)) {
                case '*' -> {
                    min = "0";
                    max = UNBOUNDED;
                    pos++;
                }
                case '+' -> {
                    min = "1";
                    max = UNBOUNDED;
                    pos++;
                }
                case '?' -> {
                    min = "0";
                    max = "1";
                    pos++;
                }
                case '{' -> {
                    pos++;
                    min = readDigits();
                    if (pos < limit && pattern.charAt(pos) == ',') {
                        pos++;
                        String upper = readDigits();
                        max = upper.isEmpty() ? UNBOUNDED : upper;
                    } else {
                        max = min;
                    }
                    expect('}');
                }
                default -> {
                    pos = mark;
                    return result;
                }
            }
            while (skipEmptyQuote()) {
                // an empty quote may also separate a quantifier from its lazy or possessive suffix
            }
            String token = "MAX_REPEAT";
            if (pos < limit && pattern.charAt(pos) == '?') {
                token = "MIN_REPEAT";
                pos++;
            } else if (pos < limit && pattern.charAt(pos) == '+') {
                token = "POSSESSIVE_REPEAT";
                pos++;
            }
            result = new TraceItem(token + " " + min + " " + max, List.of(result));
        }
        return result;
    }

    private List<TraceItem> parseGroup() {
        pos++;
        if (!lookingAt("?")) {
            groupCount++;
            return List.of(group("SUBPATTERN " + groupCount + " 0 0"));
        }
        if (consume("?:")) {
            return List.of(group("SUBPATTERN None 0 0"));
        }
        if (consume("?=")) {
            return List.of(group("ASSERT 1"));
        }
        if (consume("?!")) {
            return List.of(group("ASSERT_NOT 1"));
        }
        if (consume("?<=")) {
            return List.of(group("ASSERT -1"));
        }
        if (consume("?<!")) {
            return List.of(group("ASSERT_NOT -1"));
        }
        if (consume("?>")) {
            return List.of(group("ATOMIC_GROUP"));
        }
        if (consume("?<")) {
            int end = pattern.indexOf('>', pos);
            String name = pattern.substring(pos, end);
            pos = end + 1;
            groupCount++;
            groupNames.put(name, groupCount);
            return List.of(group("SUBPATTERN " + groupCount + " 0 0"));
        }

        pos++;
        int start = pos;
        while (pos < limit && (Character.isLetter(pattern.charAt(pos)) || pattern.charAt(pos) == '-')) {
            pos++;
        }
        String flags = pattern.substring(start, pos);
        boolean enclosingCommentsMode = commentsMode;
        applyFlags(flags);
        if (consume(")")) {
            return List.of(TraceItem.leaf("FLAGS " + flags));
        }
        expect(':');
        return List.of(group("SUBPATTERN None 0 0", enclosingCommentsMode));
    }

    private TraceItem group(String header) {
        return group(header, commentsMode);
    }

    /**
     * Parses a group body up to its closing parenthesis. Flags switched inside the group, or on its opening, end with
     * it.
     */
    private TraceItem group(String header, boolean enclosingCommentsMode) {
        List<TraceItem> children = parseAlternation();
        expect(')');
        commentsMode = enclosingCommentsMode;
        return new TraceItem(header, children);
    }

    private TraceItem parseCharClass() {
        pos++;
        List<TraceItem> members = new ArrayList<>();
        if (consume("^")) {
            members.add(TraceItem.leaf("NEGATE None"));
        }
        parseClassMembers(members);
        return new TraceItem("IN", members);
    }

    /**
     * Reads members up to and including the closing bracket. A bracket directly after the opening one is a literal.
     */
    private void parseClassMembers(List<TraceItem> members) {
        boolean first = true;
        while (pos < limit) {
            char ch = pattern.charAt(pos);
            if (ch == ']' && !first) {
                pos++;
                return;
            }
            first = false;
            if (commentsMode && Character.isWhitespace(ch)) {
                pos++;
                continue;
            }
            if (ch == '[') {
                TraceItem nested = parseCharClass();
                if (!nested.children().isEmpty() && nested.children().get(0).line().startsWith("NEGATE")) {
                    members.add(nested);
                } else {
                    members.addAll(nested.children());
                }
                continue;
            }
            if (lookingAt("&&")) {
                pos += 2;
                List<TraceItem> intersected = new ArrayList<>();
                parseClassMembers(intersected);
                members.add(new TraceItem("INTERSECTION", intersected));
                return;
            }

            List<TraceItem> lower = classAtom();
            if (lower.size() == 1 && lower.get(0).isLiteral()
                    && pos + 1 < limit && pattern.charAt(pos) == '-' && pattern.charAt(pos + 1) != ']') {
                pos++;
                List<TraceItem> upper = classAtom();
                if (upper.size() == 1 && upper.get(0).isLiteral()) {
                    members.add(TraceItem.leaf("RANGE (" + lower.get(0).codePoint() + ", " + upper.get(0).codePoint() + ")"));
                } else {
                    members.addAll(lower);
                    members.add(TraceItem.literal('-'));
                    members.addAll(upper);
                }
            } else {
                members.addAll(lower);
            }
        }
    }

    private List<TraceItem> classAtom() {
        if (pattern.charAt(pos) == '\\') {
            return parseEscape(true);
        }
        return List.of(TraceItem.literal(nextCodePoint()));
    }

    private List<TraceItem> parseEscape(boolean inClass) {
        pos++;
        char ch = pattern.charAt(pos);
        pos++;
        switch (ch) {
            case 'd':
                return category("CATEGORY_DIGIT");
            case 'D':
                return category("CATEGORY_NOT_DIGIT");
            case 's':
                return category("CATEGORY_SPACE");
            case 'S':
                return category("CATEGORY_NOT_SPACE");
            case 'w':
                return category("CATEGORY_WORD");
            case 'W':
                return category("CATEGORY_NOT_WORD");
            case 'h':
                return category("CATEGORY_HORIZONTAL_SPACE");
            case 'H':
                return category("CATEGORY_NOT_HORIZONTAL_SPACE");
            case 'v':
                return category("CATEGORY_VERTICAL_SPACE");
            case 'V':
                return category("CATEGORY_NOT_VERTICAL_SPACE");
            case 'R':
                return category("CATEGORY_LINEBREAK");
            case 'X':
                return category("CATEGORY_GRAPHEME_CLUSTER");
            case 'p':
                return category("CATEGORY_PROPERTY_" + readPropertyName());
            case 'P':
                return category("CATEGORY_NOT_PROPERTY_" + readPropertyName());
            case 'b':
                if (inClass) {
                    return List.of(TraceItem.literal('\b'));
                }
                if (consume("{g}")) {
                    return anchor("AT_GRAPHEME_BOUNDARY");
                }
                return anchor("AT_BOUNDARY");
            case 'B':
                return anchor("AT_NON_BOUNDARY");
            case 'A':
                return anchor("AT_BEGINNING_STRING");
            case 'z':
            case 'Z':
                return anchor("AT_END_STRING");
            case 'G':
                return anchor("AT_END_OF_PREVIOUS_MATCH");
            case 't':
                return List.of(TraceItem.literal('\t'));
            case 'n':
                return List.of(TraceItem.literal('\n'));
            case 'r':
                return List.of(TraceItem.literal('\r'));
            case 'f':
                return List.of(TraceItem.literal('\f'));
            case 'a':
                return List.of(TraceItem.literal(7));
            case 'e':
                return List.of(TraceItem.literal(27));
            case '0':
                return List.of(TraceItem.literal(readOctal()));
            case 'x':
                return List.of(TraceItem.literal(readHex()));
            case 'u':
                return List.of(TraceItem.literal(readHexDigits(4)));
            case 'c':
                return List.of(TraceItem.literal(pattern.charAt(pos++) ^ 64));
            case 'N': {
                expect('{');
                int end = pattern.indexOf('}', pos);
                String name = pattern.substring(pos, end);
                pos = end + 1;
                return List.of(TraceItem.literal(Character.codePointOf(name)));
            }
            case 'k': {
                expect('<');
                int end = pattern.indexOf('>', pos);
                String name = pattern.substring(pos, end);
                pos = end + 1;
                return List.of(TraceItem.leaf("GROUPREF " + groupNames.getOrDefault(name, 0)));
            }
            case 'Q':
                return quoted();
            case 'E':
                return List.of();
            default:
                if (ch >= '1' && ch <= '9' && !inClass) {
                    return List.of(TraceItem.leaf("GROUPREF " + readBackReference(ch - '0')));
                }
                pos--;
                return List.of(TraceItem.literal(nextCodePoint()));
        }
    }

    private List<TraceItem> quoted() {
        int end = pattern.indexOf("\\E", pos);
        if (end < 0) {
            end = limit;
        }
        List<TraceItem> literals = new ArrayList<>();
        while (pos < end) {
            literals.add(TraceItem.literal(nextCodePoint()));
        }
        pos = Math.min(limit, end + 2);
        return literals;
    }

    private int readBackReference(int first) {
        int reference = first;
        while (pos < limit && Character.isDigit(pattern.charAt(pos))) {
            int candidate = reference * 10 + (pattern.charAt(pos) - '0');
            if (candidate > groupCount) {
                break;
            }
            reference = candidate;
            pos++;
        }
        return reference;
    }

    private String readPropertyName() {
        if (consume("{")) {
            int end = pattern.indexOf('}', pos);
            String name = pattern.substring(pos, end);
            pos = end + 1;
            return name;
        }
        return String.valueOf(pattern.charAt(pos++));
    }

    private int readOctal() {
        int value = 0;
        int digits = 0;
        while (pos < limit && digits < 3 && pattern.charAt(pos) >= '0' && pattern.charAt(pos) <= '7') {
            int candidate = value * 8 + (pattern.charAt(pos) - '0');
            if (candidate > 0377) {
                break;
            }
            value = candidate;
            digits++;
            pos++;
        }
        return value;
    }

    private int readHex() {
        if (consume("{")) {
            int end = pattern.indexOf('}', pos);
            int value = Integer.parseInt(pattern.substring(pos, end), 16);
            pos = end + 1;
            return value;
        }
        return readHexDigits(2);
    }

    private int readHexDigits(int count) {
        int value = Integer.parseInt(pattern.substring(pos, pos + count), 16);
        pos += count;
        return value;
    }

    private String readDigits() {
        int start = pos;
        while (pos < limit && Character.isDigit(pattern.charAt(pos))) {
            pos++;
        }
        return pattern.substring(start, pos);
    }

    private int nextCodePoint() {
        int codePoint = pattern.codePointAt(pos);
        pos += Character.charCount(codePoint);
        return codePoint;
    }

    private boolean skipIgnorable() {
        if (!commentsMode || pos >= limit) {
            return false;
        }
        char ch = pattern.charAt(pos);
        if (Character.isWhitespace(ch)) {
            pos++;
            return true;
        }
        if (ch == '#') {
            while (pos < limit && pattern.charAt(pos) != '\n') {
                pos++;
            }
            return true;
        }
        return false;
    }

    /**
     * Skips a {@code \Q\E} pair with nothing quoted, or a stray {@code \E}; the compiler removes both before
     * parsing.
     */
    private boolean skipEmptyQuote() {
        if (consume("\\Q\\E") || consume("\\E")) {
            return true;
        }
        if (pos + 2 == limit && lookingAt("\\Q")) {
            pos = limit;
            return true;
        }
        return false;
    }

    private void applyFlags(String flags) {
        int negation = flags.indexOf('-');
        String enabled = negation < 0 ? flags : flags.substring(0, negation);
        String disabled = negation < 0 ? "" : flags.substring(negation + 1);
        if (enabled.indexOf('x') >= 0) {
            commentsMode = true;
        }
        if (disabled.indexOf('x') >= 0) {
            commentsMode = false;
        }
    }

    private boolean lookingAt(String text) {
        return pattern.startsWith(text, pos);
    }

    private boolean consume(String text) {
        if (lookingAt(text)) {
            pos += text.length();
            return true;
        }
        return false;
    }

    private void expect(char ch) {
        if (pos >= limit || pattern.charAt(pos) != ch) {
            throw new IllegalStateException("Expected '" + ch + "' at index " + pos);
        }
        pos++;
    }

    private static List<TraceItem> category(String name) {
        return List.of(TraceItem.leaf("CATEGORY " + name));
    }

    private static List<TraceItem> anchor(String name) {
        return List.of(TraceItem.leaf("AT " + name));
    }

    /**
     * One trace line and the lines nested under it. {@code codePoint} is set for literals only.
     */
    record TraceItem(String line, List<TraceItem> children, int codePoint) {

        TraceItem(String line, List<TraceItem> children) {
            this(line, children, -1);
        }

        static TraceItem leaf(String line) {
            return new TraceItem(line, List.of());
        }

        static TraceItem literal(int codePoint) {
            return new TraceItem("LITERAL " + codePoint, List.of(), codePoint);
        }

        boolean isLiteral() {
            return codePoint >= 0;
        }

        void appendTo(List<String> lines, int level) {
            lines.add("  ".repeat(level) + line);
            for (TraceItem child : children) {
                child.appendTo(lines, level + 1);
            }
        }
    }
}
