package io.mathspeech.core.analysis;

/** Coarse bands of the 0-10 complexity score. */
public enum ComplexityLevel {
    SIMPLE,
    MODERATE,
    COMPLEX,
    VERY_COMPLEX;

    /** Below 2 simple, below 4 moderate, below 6 complex, otherwise very complex. */
    public static ComplexityLevel forScore(double score) {
        if (score < 2.0) {
            return SIMPLE;
        }
        if (score < 4.0) {
            return MODERATE;
        }
        if (score < 6.0) {
            return COMPLEX;
        }
        return VERY_COMPLEX;
    }
}
