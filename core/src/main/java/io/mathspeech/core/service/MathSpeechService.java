package io.mathspeech.core.service;

import io.mathspeech.core.engine.RewriteEngine;
import io.mathspeech.core.error.ExpressionValidationException;
import io.mathspeech.core.error.RewriteProcessingException;
import io.mathspeech.core.expression.Expression;
import io.mathspeech.core.expression.ExpressionValidator;
import io.mathspeech.core.expression.ValidationResult;
import io.mathspeech.core.model.SpeechText;
import io.mathspeech.core.pattern.PatternUsage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point tying validation, rewriting and result caching together.
 *
 * <p>
 * {@link #convert} never throws for bad input: validation failures come back as
 * {@link ConversionResult.Type#REJECTED} and processing failures as
 * {@link ConversionResult.Type#FALLBACK} carrying the sanitized raw LaTeX, so callers can choose
 * between hard failure and speaking the source. Only successful rewrites are cached.
 *
 * <p>
 * Thread-safe if the cache is (the bundled {@link CaffeineResultCache} is).
 */
public final class MathSpeechService {

    private static final Logger LOG = LoggerFactory.getLogger(MathSpeechService.class);

    private final ExpressionValidator validator;
    private final RewriteEngine engine;
    private final ResultCache cache;

    /**
     * Creates a service.
     *
     * @param validator input validator
     * @param engine    rewrite engine
     * @param cache     optional result cache, may be {@code null}
     */
    public MathSpeechService(ExpressionValidator validator, RewriteEngine engine, ResultCache cache) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.cache = cache; // nullable
    }

    public Optional<ResultCache> cache() {
        return Optional.ofNullable(cache);
    }

    public ConversionResult convert(String latex) {
        return convert(ConversionRequest.of(latex));
    }

    public ConversionResult convert(ConversionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        ValidationResult validation = validator.validate(request.latex());
        if (!validation.isValid()) {
            ExpressionValidationException error = validation.error().orElseThrow();
            LOG.info("conversion.rejected kind={} reason={}", error.kind(), error.getMessage());
            return ConversionResult.rejected(request, error);
        }
        Expression expression = validation.expression().orElseThrow();

        CacheKey key = cache != null ? CacheKey.of(expression.content(), request) : null;
        if (key != null) {
            Optional<SpeechText> hit = cache.get(key);
            if (hit.isPresent()) {
                LOG.debug("conversion.cache_hit length={}", expression.length());
                return ConversionResult.success(request, hit.get(), true);
            }
        }

        try {
            SpeechText speech =
                    engine.process(expression, request.audience(), request.domainHint(), request.contextType());
            if (key != null) {
                cache.put(key, speech);
            }
            return ConversionResult.success(request, speech, false);
        } catch (RewriteProcessingException e) {
            LOG.info("conversion.fallback stage={} reason={}", e.stage(), e.getMessage());
            return ConversionResult.fallback(request, fallbackText(expression), e);
        }
    }

    /**
     * Converts every request in order. A request that fails unexpectedly yields a FALLBACK for
     * that item only.
     */
    public List<ConversionResult> convertAll(List<ConversionRequest> requests) {
        List<ConversionResult> results = new ArrayList<>(requests.size());
        for (ConversionRequest request : requests) {
            try {
                results.add(convert(request));
            } catch (RuntimeException e) {
                LOG.error("conversion.failed reason={}", e.getMessage(), e);
                String raw = request.latex() != null ? request.latex() : "";
                results.add(ConversionResult.fallback(request, raw, e));
            }
        }
        return results;
    }

    /**
     * Reports which patterns match {@code expressions} as written, without converting them. Each
     * valid expression counts once per matching candidate; invalid ones are counted as rejected.
     */
    public CoverageReport analyzeCoverage(List<String> expressions) {
        Objects.requireNonNull(expressions, "expressions must not be null");
        PatternUsage usage = new PatternUsage();
        int matched = 0;
        int rejected = 0;
        List<String> unmatchedSamples = new ArrayList<>();
        for (String latex : expressions) {
            ValidationResult validation = validator.validate(latex);
            if (!validation.isValid()) {
                rejected++;
                continue;
            }
            List<String> ids = engine.matchingPatternIds(validation.expression().orElseThrow(), null, null);
            if (ids.isEmpty()) {
                if (unmatchedSamples.size() < CoverageReport.MAX_UNMATCHED_SAMPLES) {
                    unmatchedSamples.add(latex);
                }
                continue;
            }
            matched++;
            ids.forEach(usage::recordHit);
        }

        // snapshotAll is ordered by id; the stable sort keeps that order among equal counts
        Map<String, Long> patternUsage = new LinkedHashMap<>();
        usage.snapshotAll().entrySet().stream()
                .sorted(Comparator.comparingLong(
                                (Map.Entry<String, PatternUsage.Snapshot> e) -> e.getValue().hits())
                        .reversed())
                .forEach(e -> patternUsage.put(e.getKey(), e.getValue().hits()));
        CoverageReport report =
                new CoverageReport(expressions.size(), matched, rejected, patternUsage, unmatchedSamples);
        LOG.info(
                "coverage.analyzed total={} matched={} rejected={} patterns_used={}",
                report.total(),
                report.matched(),
                report.rejected(),
                patternUsage.size());
        return report;
    }

    /** Drops cached results, e.g. after the pattern library changed. */
    public void invalidateCache() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    private static String fallbackText(Expression expression) {
        try {
            return expression.sanitize().content();
        } catch (ExpressionValidationException e) {
            LOG.debug("conversion.sanitize_failed reason={}", e.getMessage());
            return expression.content();
        }
    }
}
