package io.mathspeech.core.pattern;

import java.util.Objects;

/**
 * Documented input/output pair for a pattern.
 *
 * @param input  sample LaTeX input
 * @param output the expected speech fragment
 */
public record PatternExample(String input, String output) {

    public PatternExample {
        Objects.requireNonNull(input, "example input must not be null");
        Objects.requireNonNull(output, "example output must not be null");
    }
}
