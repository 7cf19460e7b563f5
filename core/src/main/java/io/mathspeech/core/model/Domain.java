package io.mathspeech.core.model;

import java.util.Locale;

/**
 * Mathematical subject tag used to scope which patterns are considered. Closed vocabulary;
 * {@link #GENERAL} patterns are candidates for every domain.
 */
public enum Domain {
    GENERAL,
    ALGEBRA,
    CALCULUS,
    LINEAR_ALGEBRA,
    STATISTICS,
    SET_THEORY,
    LOGIC,
    NUMBER_THEORY,
    COMPLEX_ANALYSIS,
    TOPOLOGY,
    REAL_ANALYSIS,
    COMBINATORICS,
    DIFFERENTIAL_EQUATIONS;

    /** Lower-case wire name, e.g. {@code linear_algebra}. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Analysis-flavoured domains. */
    public boolean isAnalysisRelated() {
        return this == CALCULUS || this == REAL_ANALYSIS || this == COMPLEX_ANALYSIS || this == DIFFERENTIAL_EQUATIONS;
    }

    /**
     * Parses a wire name (case-insensitive, {@code -} accepted for {@code _}).
     *
     * @throws IllegalArgumentException if the name is not in the vocabulary
     */
    public static Domain fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }
        String normalized = id.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (Domain d : values()) {
            if (d.name().equals(normalized)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Invalid mathematical domain: " + id);
    }
}
