package io.mathspeech.core.engine;

/**
 * Rewrite engine settings. Immutable and thread-safe.
 *
 * @param maxIterations upper bound on fixpoint passes per expression (default: 10). Bounds the
 *                      work of a non-confluent pattern set; hitting it is logged, not fatal
 */
public record EngineConfig(int maxIterations) {

    /** Default: 10 passes. */
    public static final EngineConfig DEFAULT = new EngineConfig(10);

    public EngineConfig {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got: " + maxIterations);
        }
    }
}
