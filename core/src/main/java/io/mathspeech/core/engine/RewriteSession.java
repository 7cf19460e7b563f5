package io.mathspeech.core.engine;

import io.mathspeech.core.model.PronunciationHint;
import io.mathspeech.core.model.RewriteContext;
import io.mathspeech.core.pattern.Pattern;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one {@code process} call: current text, applied pattern ids in order,
 * iteration count, per-pattern error tally and the context seen by preconditions.
 *
 * <p>
 * Created per call and discarded afterwards; never shared between threads or expressions.
 */
final class RewriteSession {

    private RewriteContext context;
    private final List<String> applied = new ArrayList<>();
    private final Set<String> appliedIds = new HashSet<>();
    private final Map<String, Integer> errors = new LinkedHashMap<>();
    private final Map<String, PronunciationHint> hints = new LinkedHashMap<>();
    private int iteration;

    RewriteSession(RewriteContext context) {
        this.context = context;
    }

    String currentText() {
        return context.currentText();
    }

    RewriteContext context() {
        return context;
    }

    int iteration() {
        return iteration;
    }

    int nextIteration() {
        return ++iteration;
    }

    boolean isApplied(String patternId) {
        return appliedIds.contains(patternId);
    }

    void recordApplied(Pattern pattern, String newText) {
        if (appliedIds.add(pattern.id())) {
            applied.add(pattern.id());
        }
        if (!pattern.hint().isEmpty()) {
            hints.put(pattern.id(), pattern.hint());
        }
        context = context.withCurrentText(newText);
    }

    void recordError(String patternId) {
        errors.merge(patternId, 1, Integer::sum);
    }

    List<String> appliedPatternIds() {
        return Collections.unmodifiableList(applied);
    }

    Map<String, Integer> errors() {
        return Collections.unmodifiableMap(errors);
    }

    Map<String, PronunciationHint> hints() {
        return Collections.unmodifiableMap(hints);
    }
}
