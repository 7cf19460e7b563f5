package io.mathspeech.core.engine;

import io.mathspeech.core.analysis.ExpressionAnalyzer;
import io.mathspeech.core.error.NoPatternsFoundException;
import io.mathspeech.core.error.PatternException;
import io.mathspeech.core.expression.Expression;
import io.mathspeech.core.model.AudienceLevel;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.model.RewriteContext;
import io.mathspeech.core.model.SpeechText;
import io.mathspeech.core.pattern.ApplyOutcome;
import io.mathspeech.core.pattern.Pattern;
import io.mathspeech.core.pattern.PatternUsage;
import io.mathspeech.core.spi.RewriteListener;
import io.mathspeech.core.store.PatternStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a validated {@link Expression} into speech text by applying candidate patterns until
 * the text stops changing.
 *
 * <p>
 * Per call:
 * <ol>
 * <li>take a snapshot of the store and select candidates: patterns of the session domain plus
 * {@code general} patterns, de-duplicated by id (first wins), enabled, applicable to the context
 * type, stably sorted by priority descending;</li>
 * <li>group candidates into tiers of equal priority;</li>
 * <li>run up to {@link EngineConfig#maxIterations()} passes; each pass tries, tier by tier, every
 * pattern not yet applied in this session and applies those that match;</li>
 * <li>stop at the first pass that leaves the text unchanged; exhausting the budget is logged
 * and reported as {@code converged=false};</li>
 * <li>post-process for the audience.</li>
 * </ol>
 *
 * <p>
 * A pattern that raises is counted against its id and skipped; the pass continues. An empty
 * candidate set raises {@link NoPatternsFoundException}.
 *
 * <p>
 * Thread-safe: holds no per-call state. Order of pattern application is fully determined by
 * store order and priority.
 */
public final class RewriteEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteEngine.class);
    private static final int LOG_SNIPPET_LENGTH = 100;

    private final PatternStore store;
    private final ExpressionAnalyzer analyzer;
    private final PostProcessor postProcessor;
    private final EngineConfig config;
    private final PatternUsage usage;
    private final RewriteListener listener;

    /** Engine with default config, no usage tracking and no listener. */
    public RewriteEngine(PatternStore store) {
        this(store, new ExpressionAnalyzer(), new PostProcessor(), EngineConfig.DEFAULT, null, null);
    }

    /**
     * Creates an engine with all collaborators.
     *
     * @param store         source of candidate patterns
     * @param analyzer      domain detection when no hint is given
     * @param postProcessor final text clean-up
     * @param config        iteration budget
     * @param usage         optional hit/miss/error counters, may be {@code null}
     * @param listener      optional telemetry listener, may be {@code null}
     */
    public RewriteEngine(
            PatternStore store,
            ExpressionAnalyzer analyzer,
            PostProcessor postProcessor,
            EngineConfig config,
            PatternUsage usage,
            RewriteListener listener) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.usage = usage; // nullable
        this.listener = listener; // nullable
    }

    public EngineConfig config() {
        return config;
    }

    public SpeechText process(Expression expression, AudienceLevel audience) {
        return process(expression, audience, null, null);
    }

    public SpeechText process(Expression expression, AudienceLevel audience, Domain domainHint) {
        return process(expression, audience, domainHint, null);
    }

    /**
     * Rewrites {@code expression}.
     *
     * @param expression  validated input
     * @param audience    target audience; {@code null} means undergraduate
     * @param domainHint  domain to use instead of detection, or {@code null}
     * @param contextType syntactic setting, or {@code null} for inline
     * @throws NoPatternsFoundException if no pattern is a candidate for the expression
     */
    public SpeechText process(
            Expression expression, AudienceLevel audience, Domain domainHint, ExpressionContext contextType) {
        Objects.requireNonNull(expression, "expression must not be null");
        long start = System.nanoTime();
        AudienceLevel effectiveAudience = audience != null ? audience : AudienceLevel.UNDERGRADUATE;
        Domain domain = domainHint != null ? domainHint : analyzer.detectDomain(expression);
        ExpressionContext effectiveContext = contextType != null ? contextType : ExpressionContext.INLINE;
        notifyStarted(expression, domain, effectiveAudience);

        List<Pattern> candidates = selectCandidates(store.snapshot(), domain, effectiveContext);
        if (candidates.isEmpty()) {
            NoPatternsFoundException e = new NoPatternsFoundException(domain.id(), expression.content());
            LOG.warn("rewrite.failed stage={} domain={} reason={}", e.stage(), domain.id(), e.getMessage());
            notifyFailed(domain, e.stage(), e.getMessage(), elapsedMs(start));
            throw e;
        }

        RewriteSession session =
                new RewriteSession(initialContext(expression, domain, effectiveAudience, effectiveContext));
        boolean converged = iterate(session, groupByPriority(candidates));
        int iterationsUsed = converged ? session.iteration() - 1 : session.iteration();
        if (!converged) {
            LOG.warn(
                    "rewrite.not_converged max_iterations={} domain={} applied={}",
                    config.maxIterations(),
                    domain.id(),
                    session.appliedPatternIds().size());
        }

        String text = postProcessor.process(session.currentText(), effectiveAudience);
        SpeechText result = new SpeechText(
                text,
                session.appliedPatternIds(),
                iterationsUsed,
                converged,
                domain,
                session.errors(),
                session.hints());

        long durationMs = elapsedMs(start);
        LOG.info(
                "rewrite.completed expression_length={} domain={} audience={} applied={} iterations={} "
                        + "converged={} pattern_errors={} duration_ms={}",
                expression.length(),
                domain.id(),
                effectiveAudience.id(),
                result.appliedPatternIds().size(),
                iterationsUsed,
                converged,
                result.patternErrors().size(),
                durationMs);
        notifyCompleted(result, durationMs);
        return result;
    }

    /**
     * Ids of the candidates that match {@code expression} as given, in candidate order, without
     * rewriting anything. Candidates are selected as in {@link #process}; a pattern that fails
     * while matching is left out. Usage counters and the listener are not touched.
     *
     * @param domainHint  domain to use instead of detection, or {@code null}
     * @param contextType syntactic setting, or {@code null} for inline
     */
    public List<String> matchingPatternIds(Expression expression, Domain domainHint, ExpressionContext contextType) {
        Objects.requireNonNull(expression, "expression must not be null");
        Domain domain = domainHint != null ? domainHint : analyzer.detectDomain(expression);
        ExpressionContext effectiveContext = contextType != null ? contextType : ExpressionContext.INLINE;
        RewriteContext context = initialContext(expression, domain, AudienceLevel.UNDERGRADUATE, effectiveContext);

        List<String> matching = new ArrayList<>();
        for (Pattern pattern : selectCandidates(store.snapshot(), domain, effectiveContext)) {
            try {
                if (pattern.matches(expression.content(), context)) {
                    matching.add(pattern.id());
                }
            } catch (PatternException e) {
                LOG.debug("pattern.match_failed id={} reason={}", pattern.id(), e.getMessage());
            }
        }
        return matching;
    }

    private static RewriteContext initialContext(
            Expression expression, Domain domain, AudienceLevel audience, ExpressionContext contextType) {
        return new RewriteContext(
                contextType,
                domain,
                audience,
                expression.content(),
                expression.content(),
                expression.variables(),
                expression.complexityScore(),
                null,
                null);
    }

    /**
     * Domain patterns then general patterns, de-duplicated by id (first occurrence wins), enabled
     * and applicable to {@code context}, stably sorted by priority descending.
     */
    static List<Pattern> selectCandidates(PatternStore snapshot, Domain domain, ExpressionContext context) {
        Map<String, Pattern> unique = new LinkedHashMap<>();
        for (Pattern p : snapshot.findByDomain(domain)) {
            unique.putIfAbsent(p.id(), p);
        }
        if (domain != Domain.GENERAL) {
            for (Pattern p : snapshot.findByDomain(Domain.GENERAL)) {
                unique.putIfAbsent(p.id(), p);
            }
        }
        List<Pattern> candidates = new ArrayList<>();
        for (Pattern p : unique.values()) {
            if (p.enabled() && p.appliesTo(context)) {
                candidates.add(p);
            }
        }
        // List.sort is stable: equal priorities keep store order
        candidates.sort(Comparator.comparing(Pattern::priority).reversed());
        return candidates;
    }

    /** Consecutive runs of equal priority, highest first. Input must already be sorted. */
    static List<List<Pattern>> groupByPriority(List<Pattern> sorted) {
        Map<Integer, List<Pattern>> tiers = new LinkedHashMap<>();
        for (Pattern p : sorted) {
            tiers.computeIfAbsent(p.priority().value(), k -> new ArrayList<>()).add(p);
        }
        return List.copyOf(tiers.values());
    }

    /** Runs passes until one changes nothing or the budget is spent. Returns whether it converged. */
    private boolean iterate(RewriteSession session, List<List<Pattern>> tiers) {
        while (session.iteration() < config.maxIterations()) {
            int iteration = session.nextIteration();
            String before = session.currentText();
            for (List<Pattern> tier : tiers) {
                for (Pattern pattern : tier) {
                    if (!session.isApplied(pattern.id())) {
                        attempt(session, pattern, iteration);
                    }
                }
            }
            if (session.currentText().equals(before)) {
                return true;
            }
        }
        return false;
    }

    private void attempt(RewriteSession session, Pattern pattern, int iteration) {
        String text = session.currentText();
        try {
            ApplyOutcome outcome = pattern.apply(text, session.context());
            if (!outcome.applied()) {
                if (usage != null) {
                    usage.recordMiss(pattern.id());
                }
                return;
            }
            session.recordApplied(pattern, outcome.text());
            if (usage != null) {
                usage.recordHit(pattern.id());
            }
            LOG.debug(
                    "pattern.applied id={} priority={} iteration={} result={}",
                    pattern.id(),
                    pattern.priority().value(),
                    iteration,
                    truncate(outcome.text()));
            notifyPatternApplied(pattern, iteration);
        } catch (PatternException e) {
            session.recordError(pattern.id());
            if (usage != null) {
                usage.recordError(pattern.id());
            }
            LOG.warn("pattern.failed id={} version={} reason={}", pattern.id(), pattern.version(), e.getMessage());
            notifyPatternFailed(pattern, e.getMessage());
        }
    }

    private static String truncate(String text) {
        return text.length() <= LOG_SNIPPET_LENGTH ? text : text.substring(0, LOG_SNIPPET_LENGTH) + "...";
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Telemetry notification helpers ---
    // Listener exceptions are caught and logged; they never affect the rewrite.

    private void notifyStarted(Expression expression, Domain domain, AudienceLevel audience) {
        if (listener == null) return;
        try {
            listener.onRewriteStarted(new RewriteListener.RewriteStartedEvent(expression.length(), domain, audience));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onRewriteStarted failed", e);
        }
    }

    private void notifyCompleted(SpeechText result, long durationMs) {
        if (listener == null) return;
        try {
            listener.onRewriteCompleted(new RewriteListener.RewriteCompletedEvent(
                    result.domain(),
                    result.appliedPatternIds().size(),
                    result.iterationsUsed(),
                    result.converged(),
                    durationMs));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onRewriteCompleted failed", e);
        }
    }

    private void notifyFailed(Domain domain, String stage, String detail, long durationMs) {
        if (listener == null) return;
        try {
            listener.onRewriteFailed(new RewriteListener.RewriteFailedEvent(domain, stage, detail, durationMs));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onRewriteFailed failed", e);
        }
    }

    private void notifyPatternApplied(Pattern pattern, int iteration) {
        if (listener == null) return;
        try {
            listener.onPatternApplied(new RewriteListener.PatternAppliedEvent(
                    pattern.id(), pattern.version(), pattern.priority().value(), iteration));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onPatternApplied failed", e);
        }
    }

    private void notifyPatternFailed(Pattern pattern, String detail) {
        if (listener == null) return;
        try {
            listener.onPatternFailed(new RewriteListener.PatternFailedEvent(pattern.id(), pattern.version(), detail));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onPatternFailed failed", e);
        }
    }
}
