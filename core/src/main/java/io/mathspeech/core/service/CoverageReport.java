package io.mathspeech.core.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How well the loaded patterns cover a corpus of expressions.
 *
 * @param total            expressions analysed
 * @param matched          valid expressions at least one candidate pattern matches
 * @param rejected         expressions that failed validation
 * @param patternUsage     per pattern id, the number of expressions it matched, most used first
 * @param unmatchedSamples up to {@link #MAX_UNMATCHED_SAMPLES} valid expressions nothing matched,
 *                         in input order
 */
public record CoverageReport(
        int total, int matched, int rejected, Map<String, Long> patternUsage, List<String> unmatchedSamples) {

    public static final int MAX_UNMATCHED_SAMPLES = 10;

    public CoverageReport {
        patternUsage = Collections.unmodifiableMap(new LinkedHashMap<>(patternUsage));
        unmatchedSamples = List.copyOf(unmatchedSamples);
    }

    /** Valid expressions no pattern matched. */
    public int unmatched() {
        return total - matched - rejected;
    }

    /** Matched share of all analysed expressions, 0 to 100; 0 for an empty corpus. */
    public double coveragePercentage() {
        return total == 0 ? 0.0 : matched * 100.0 / total;
    }
}
