package io.mathspeech.core.spi;

import io.mathspeech.core.model.AudienceLevel;
import io.mathspeech.core.model.Domain;

/**
 * SPI for observability hooks on the rewrite engine.
 *
 * <p>
 * Adapters provide implementations that bridge to a metrics or tracing system; the core has no
 * telemetry dependency. All methods receive immutable event objects. Implementations MUST be
 * thread-safe and non-blocking. Exceptions thrown by listeners are caught by the engine and
 * logged; they do not affect the rewrite.
 */
public interface RewriteListener {

    /** Called before candidate selection. */
    void onRewriteStarted(RewriteStartedEvent event);

    /** Called when speech text was produced, converged or not. */
    void onRewriteCompleted(RewriteCompletedEvent event);

    /** Called when the rewrite call fails, e.g. no candidate patterns. */
    void onRewriteFailed(RewriteFailedEvent event);

    /** Called each time a pattern fires. */
    void onPatternApplied(PatternAppliedEvent event);

    /** Called when a pattern raises during matching or application. */
    void onPatternFailed(PatternFailedEvent event);

    // --- Event records ---

    /** Event emitted when a rewrite starts. */
    record RewriteStartedEvent(int expressionLength, Domain domain, AudienceLevel audience) {}

    /** Event emitted when a rewrite completes. */
    record RewriteCompletedEvent(
            Domain domain, int appliedCount, int iterationsUsed, boolean converged, long durationMs) {}

    /** Event emitted when a rewrite fails. */
    record RewriteFailedEvent(Domain domain, String stage, String errorDetail, long durationMs) {}

    /** Event emitted when a pattern fires. */
    record PatternAppliedEvent(String patternId, String patternVersion, int priority, int iteration) {}

    /** Event emitted when a pattern fails. */
    record PatternFailedEvent(String patternId, String patternVersion, String errorDetail) {}
}
