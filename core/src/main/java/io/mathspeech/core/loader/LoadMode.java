package io.mathspeech.core.loader;

/** How the loader reacts to a pattern that cannot be built. */
public enum LoadMode {
    /** The first bad pattern or file aborts the load with a {@code PatternLoadException}. */
    STRICT,
    /** Bad patterns and files are logged, recorded in the {@link LoadReport} and skipped. */
    LENIENT
}
