package io.mathspeech.core.loader;

import io.mathspeech.core.pattern.Pattern;
import java.util.List;

/**
 * Outcome of loading a pattern library.
 *
 * @param patterns    patterns that were built, in load order
 * @param rejected    patterns or files that were skipped (lenient mode only)
 * @param filesLoaded number of pattern files read
 */
public record LoadReport(List<Pattern> patterns, List<Rejection> rejected, int filesLoaded) {

    public LoadReport {
        patterns = List.copyOf(patterns);
        rejected = List.copyOf(rejected);
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    /**
     * One skipped item.
     *
     * @param source    file the item came from
     * @param patternId the pattern id, or {@code null} when the whole file was rejected
     * @param reason    why it was skipped
     */
    public record Rejection(String source, String patternId, String reason) {}
}
