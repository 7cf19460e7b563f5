package io.mathspeech.core.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.MatchResult;

/**
 * Parsed replacement template of a regex pattern.
 *
 * <p>
 * Group references: {@code $n} and {@code \n} (single digit) and {@code ${n}} (any number).
 * {@code $$} is a literal dollar. A {@code \} or {@code $} not starting a reference is kept
 * as-is, so LaTeX-looking output such as {@code \,} passes through. A reference to an optional
 * group that did not participate in the match expands to the empty string.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class OutputTemplate {

    private final String source;
    private final List<Segment> segments;
    private final int maxGroupReference;

    private OutputTemplate(String source, List<Segment> segments) {
        this.source = source;
        this.segments = List.copyOf(segments);
        this.maxGroupReference = segments.stream()
                .filter(s -> s.group() >= 0)
                .mapToInt(Segment::group)
                .max()
                .orElse(-1);
    }

    /** A template whose text is emitted verbatim, for literal patterns. */
    public static OutputTemplate verbatim(String source) {
        Objects.requireNonNull(source, "template must not be null");
        return new OutputTemplate(source, List.of(Segment.literal(source)));
    }

    /**
     * Parses a regex replacement template.
     *
     * @throws IllegalArgumentException if a {@code ${...}} reference is unterminated or not a
     *     number
     */
    public static OutputTemplate parse(String source) {
        Objects.requireNonNull(source, "template must not be null");
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            char next = i + 1 < n ? source.charAt(i + 1) : '\0';
            if (c == '$' && next == '$') {
                literal.append('$');
                i += 2;
            } else if (c == '$' && next == '{') {
                int close = source.indexOf('}', i + 2);
                if (close < 0) {
                    throw new IllegalArgumentException("unterminated group reference at offset " + i);
                }
                String digits = source.substring(i + 2, close);
                if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
                    throw new IllegalArgumentException("invalid group reference '${" + digits + "}'");
                }
                flush(literal, segments);
                segments.add(Segment.group(Integer.parseInt(digits)));
                i = close + 1;
            } else if ((c == '$' || c == '\\') && Character.isDigit(next)) {
                flush(literal, segments);
                segments.add(Segment.group(next - '0'));
                i += 2;
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(literal, segments);
        return new OutputTemplate(source, segments);
    }

    private static void flush(StringBuilder literal, List<Segment> segments) {
        if (literal.length() > 0) {
            segments.add(Segment.literal(literal.toString()));
            literal.setLength(0);
        }
    }

    /** The unparsed template text. */
    public String source() {
        return source;
    }

    /** Highest group number referenced, or -1 if the template has no references. */
    public int maxGroupReference() {
        return maxGroupReference;
    }

    /** Expands the template for one match. */
    public String expand(MatchResult match) {
        StringBuilder out = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.group() < 0) {
                out.append(segment.text());
            } else {
                String value = match.group(segment.group());
                if (value != null) {
                    out.append(value);
                }
            }
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return source;
    }

    /** Literal text ({@code group == -1}) or a group reference. */
    private record Segment(String text, int group) {

        static Segment literal(String text) {
            return new Segment(text, -1);
        }

        static Segment group(int group) {
            return new Segment(null, group);
        }
    }
}
