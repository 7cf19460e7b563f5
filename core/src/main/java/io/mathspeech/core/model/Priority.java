package io.mathspeech.core.model;

/**
 * Pattern priority, bounded to {@value #MIN}..{@value #MAX}. Higher values are applied first.
 *
 * @param value the integer priority
 */
public record Priority(int value) implements Comparable<Priority> {

    public static final int MIN = 0;
    public static final int MAX = 2000;

    public Priority {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException("Priority must be between " + MIN + " and " + MAX + ", got: " + value);
        }
    }

    public static Priority of(int value) {
        return new Priority(value);
    }

    public static Priority of(PriorityTier tier) {
        return new Priority(tier.threshold());
    }

    public static Priority low() {
        return of(PriorityTier.LOW);
    }

    public static Priority medium() {
        return of(PriorityTier.MEDIUM);
    }

    public static Priority high() {
        return of(PriorityTier.HIGH);
    }

    public static Priority critical() {
        return of(PriorityTier.CRITICAL);
    }

    /** The named band this value falls into. */
    public PriorityTier tier() {
        return PriorityTier.forValue(value);
    }

    /**
     * Returns this priority shifted by {@code offset}.
     *
     * @throws IllegalArgumentException if the result leaves the allowed range
     */
    public Priority plus(int offset) {
        return new Priority(value + offset);
    }

    @Override
    public int compareTo(Priority other) {
        return Integer.compare(value, other.value);
    }
}
