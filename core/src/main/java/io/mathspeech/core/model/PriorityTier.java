package io.mathspeech.core.model;

/**
 * Named priority bands. The integer mapping is the single source of truth for tier thresholds;
 * never compare priorities against bare numbers.
 */
public enum PriorityTier {
    LOW(250),
    MEDIUM(500),
    HIGH(1000),
    CRITICAL(1500);

    private final int threshold;

    PriorityTier(int threshold) {
        this.threshold = threshold;
    }

    /** Lower bound (inclusive) of this tier; also the default priority for the tier. */
    public int threshold() {
        return threshold;
    }

    /** The highest tier whose threshold is at or below {@code value}; values below LOW map to LOW. */
    public static PriorityTier forValue(int value) {
        PriorityTier result = LOW;
        for (PriorityTier tier : values()) {
            if (value >= tier.threshold) {
                result = tier;
            }
        }
        return result;
    }
}
