package io.mathspeech.core.loader;

import io.mathspeech.core.error.PatternLoadException;
import io.mathspeech.core.pattern.Pattern;
import java.util.List;

/**
 * One parsed pattern file.
 *
 * @param source      the file path
 * @param description the file's {@code metadata.description}, or empty
 * @param patterns    entries that built successfully, in file order
 * @param failures    entries that could not be built, in file order
 */
public record PatternFile(
        String source, String description, List<Pattern> patterns, List<PatternLoadException> failures) {

    public PatternFile {
        patterns = List.copyOf(patterns);
        failures = List.copyOf(failures);
    }
}
