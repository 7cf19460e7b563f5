package io.mathspeech.core.pattern;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Cache of compiled regular expressions keyed by (regex, flags). Owned by whoever builds
 * patterns (typically the pattern loader) and passed to {@link Pattern.Builder#compileCache};
 * there is no shared global instance, so tests can start from an empty cache.
 *
 * <p>
 * Thread-safe.
 */
public final class PatternCompileCache {

    private final ConcurrentMap<Key, java.util.regex.Pattern> compiled = new ConcurrentHashMap<>();

    /**
     * Returns the compiled form of {@code regex}, compiling it on first use.
     *
     * @throws java.util.regex.PatternSyntaxException if the regex is invalid; nothing is cached
     */
    public java.util.regex.Pattern compile(String regex, int flags) {
        return compiled.computeIfAbsent(new Key(regex, flags), k -> java.util.regex.Pattern.compile(k.regex, k.flags));
    }

    public int size() {
        return compiled.size();
    }

    public void clear() {
        compiled.clear();
    }

    private record Key(String regex, int flags) {}
}
