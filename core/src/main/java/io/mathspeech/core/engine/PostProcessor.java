package io.mathspeech.core.engine;

import io.mathspeech.core.model.AudienceLevel;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Final clean-up of rewritten text: whitespace collapse, audience phrasing, capitalisation and
 * punctuation spacing.
 *
 * <p>
 * Idempotent: running it on its own output changes nothing. Every substitution's output is out
 * of reach of every substitution's input. Stateless and thread-safe.
 */
public final class PostProcessor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile(" ([.,;:])");

    /** Simplifying substitutions for elementary and high-school audiences. */
    static final List<Map.Entry<Pattern, String>> BASIC_PHRASES = List.of(
            Map.entry(Pattern.compile("with respect to"), "by"),
            Map.entry(Pattern.compile("such that"), "where"),
            Map.entry(Pattern.compile("implies"), "means"),
            Map.entry(Pattern.compile("if and only if"), "exactly when"));

    /** Formal substitutions for graduate and research audiences. */
    static final List<Map.Entry<Pattern, String>> ADVANCED_PHRASES = List.of(
            Map.entry(Pattern.compile("(?<= )dot(?= )"), "inner product"),
            Map.entry(Pattern.compile("natural log(?!arithm)"), "natural logarithm"));

    public String process(String text, AudienceLevel audience) {
        String result = WHITESPACE.matcher(text).replaceAll(" ").trim();
        if (audience != null && audience.isBasic()) {
            result = substitute(result, BASIC_PHRASES);
        } else if (audience != null && audience.isAdvanced()) {
            result = substitute(result, ADVANCED_PHRASES);
        }
        result = capitalizeFirst(result);
        result = SPACE_BEFORE_PUNCTUATION.matcher(result).replaceAll("$1");
        return result.trim();
    }

    private static String substitute(String text, List<Map.Entry<Pattern, String>> phrases) {
        String result = text;
        for (Map.Entry<Pattern, String> phrase : phrases) {
            result = phrase.getKey().matcher(result).replaceAll(phrase.getValue());
        }
        return result;
    }

    private static String capitalizeFirst(String text) {
        if (text.isEmpty()) {
            return text;
        }
        int first = text.codePointAt(0);
        if (!Character.isLowerCase(first)) {
            return text;
        }
        return new StringBuilder(text.length())
                .appendCodePoint(Character.toUpperCase(first))
                .append(text, Character.charCount(first), text.length())
                .toString();
    }
}
