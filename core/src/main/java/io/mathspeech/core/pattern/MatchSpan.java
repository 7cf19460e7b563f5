package io.mathspeech.core.pattern;

/**
 * One occurrence of a pattern's matcher in a text.
 *
 * @param start start offset, inclusive
 * @param end   end offset, exclusive
 * @param text  the matched text
 */
public record MatchSpan(int start, int end, String text) {

    public MatchSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
