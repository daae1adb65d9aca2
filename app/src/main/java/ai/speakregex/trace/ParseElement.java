package ai.speakregex.trace;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One decoded trace line: its kind, the token it was spelled with, and its data fields.
 */
public record ParseElement(ElementKind kind, String token, List<String> fields, String rawLine) {

    public ParseElement {
        Objects.requireNonNull(kind, "kind");
        token = token == null ? "" : token.toLowerCase(Locale.ROOT);
        fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
        rawLine = rawLine == null ? "" : rawLine;
    }

    /**
     * Splits a trace line (without its indentation) into token and whitespace-separated fields.
     */
    public static ParseElement parse(String line) {
        String content = Objects.requireNonNull(line, "line").strip();
        if (content.isEmpty()) {
            return new ParseElement(ElementKind.UNRECOGNIZED, "", List.of(), line);
        }
        String[] parts = content.split("\\s+");
        String token = parts[0];
        List<String> fields = Arrays.asList(parts).subList(1, parts.length);
        return new ParseElement(ElementKind.fromToken(token), token, fields, content);
    }

    public static ParseElement of(ElementKind kind, String token, String... fields) {
        String raw = (token + " " + String.join(" ", fields)).strip();
        return new ParseElement(kind, token, Arrays.asList(fields), raw);
    }

    public boolean is(ElementKind expected) {
        return kind == expected;
    }

    /**
     * Returns the field at {@code position}, or an empty string when the line is shorter.
     */
    public String field(int position) {
        return position < fields.size() ? fields.get(position) : "";
    }

    @Override
    public String toString() {
        return rawLine;
    }
}
