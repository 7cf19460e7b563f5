package io.mathspeech.core.loader;

import io.mathspeech.core.error.PatternApplyException;
import io.mathspeech.core.model.RewriteContext;
import io.mathspeech.core.pattern.ApplyOutcome;
import io.mathspeech.core.pattern.Pattern;
import io.mathspeech.core.pattern.PatternExample;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs each pattern on its documented examples and reports the ones whose output differs.
 *
 * <p>
 * A pattern is applied alone, once, with a context carrying its own domain, so an example
 * documents the pattern rather than a full rewrite. Both sides are compared after whitespace
 * runs are collapsed and the ends trimmed, since templates pad their output with spaces.
 * Stateless and thread-safe.
 */
public final class ExampleVerifier {

    /**
     * One failed example.
     *
     * @param patternId the pattern the example belongs to
     * @param input     example input
     * @param expected  documented output
     * @param actual    what the pattern produced, or the failure message
     */
    public record Mismatch(String patternId, String input, String expected, String actual) {}

    /** Mismatches across {@code patterns}, in pattern then example order. */
    public List<Mismatch> verify(Collection<Pattern> patterns) {
        List<Mismatch> mismatches = new ArrayList<>();
        for (Pattern pattern : patterns) {
            mismatches.addAll(verify(pattern));
        }
        return mismatches;
    }

    /** Mismatches for the examples of one pattern; empty when it has none. */
    public List<Mismatch> verify(Pattern pattern) {
        List<Mismatch> mismatches = new ArrayList<>();
        for (PatternExample example : pattern.examples()) {
            String actual = run(pattern, example.input());
            if (!normalize(actual).equals(normalize(example.output()))) {
                mismatches.add(new Mismatch(pattern.id(), example.input(), example.output(), actual));
            }
        }
        return mismatches;
    }

    private static String run(Pattern pattern, String input) {
        RewriteContext context = new RewriteContext(null, pattern.domain(), null, input, input, null, 0.0, null, null);
        try {
            ApplyOutcome outcome = pattern.apply(input, context);
            return outcome.text();
        } catch (PatternApplyException e) {
            return "error: " + e.getMessage();
        }
    }

    static String normalize(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
