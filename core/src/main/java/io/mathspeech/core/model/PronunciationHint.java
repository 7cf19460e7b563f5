package io.mathspeech.core.model;

/**
 * Optional synthesis hints attached to a pattern's output. Carried through to callers; the
 * rewrite engine never evaluates them. Any component may be {@code null}.
 *
 * @param emphasis    emphasis level, e.g. {@code strong}
 * @param pauseBefore pause before the fragment in milliseconds
 * @param pauseAfter  pause after the fragment in milliseconds
 * @param rate        speaking rate multiplier
 * @param pitch       pitch multiplier
 * @param volume      volume multiplier
 */
public record PronunciationHint(
        String emphasis, Integer pauseBefore, Integer pauseAfter, Double rate, Double pitch, Double volume) {

    public static final PronunciationHint NONE = new PronunciationHint(null, null, null, null, null, null);

    public PronunciationHint {
        if (pauseBefore != null && pauseBefore < 0) {
            throw new IllegalArgumentException("pauseBefore must not be negative, got: " + pauseBefore);
        }
        if (pauseAfter != null && pauseAfter < 0) {
            throw new IllegalArgumentException("pauseAfter must not be negative, got: " + pauseAfter);
        }
    }

    public boolean isEmpty() {
        return emphasis == null
                && pauseBefore == null
                && pauseAfter == null
                && rate == null
                && pitch == null
                && volume == null;
    }
}
