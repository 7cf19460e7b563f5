package io.mathspeech.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.mathspeech.core.analysis.ExpressionAnalyzer;
import io.mathspeech.core.error.NoPatternsFoundException;
import io.mathspeech.core.error.PatternApplyException;
import io.mathspeech.core.expression.Expression;
import io.mathspeech.core.expression.ExpressionValidator;
import io.mathspeech.core.model.AudienceLevel;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.model.Priority;
import io.mathspeech.core.model.PronunciationHint;
import io.mathspeech.core.model.SpeechText;
import io.mathspeech.core.pattern.Pattern;
import io.mathspeech.core.pattern.PatternUsage;
import io.mathspeech.core.store.InMemoryPatternStore;
import io.mathspeech.core.testkit.TestPatterns;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RewriteEngine")
class RewriteEngineTest {

    private static final ExpressionValidator VALIDATOR = ExpressionValidator.withDefaults();

    private static Expression expr(String raw) {
        return VALIDATOR.validateOrThrow(raw);
    }

    private static RewriteEngine engineWith(Pattern... patterns) {
        return new RewriteEngine(new InMemoryPatternStore(List.of(patterns)));
    }

    @Nested
    @DisplayName("Walkthroughs")
    class Walkthroughs {

        @Test
        @DisplayName("simple fraction becomes '1 over 2'")
        void fraction() {
            SpeechText speech = engineWith(TestPatterns.fracBasic()).process(expr("\\frac{1}{2}"), null);

            assertThat(speech.text()).isEqualTo("1 over 2");
            assertThat(speech.appliedPatternIds()).containsExactly("frac_basic");
            assertThat(speech.converged()).isTrue();
        }

        @Test
        @DisplayName("two independent patterns converge after one changing pass")
        void greekLetters() {
            RewriteEngine engine = engineWith(
                    TestPatterns.regex("alpha", "\\\\alpha", "alpha"), TestPatterns.regex("beta", "\\\\beta", "beta"));

            SpeechText speech = engine.process(expr("\\alpha + \\beta"), AudienceLevel.UNDERGRADUATE);

            assertThat(speech.text()).isEqualTo("Alpha + beta");
            assertThat(speech.appliedPatternIds()).containsExactly("alpha", "beta");
            assertThat(speech.iterationsUsed()).isEqualTo(1);
            assertThat(speech.converged()).isTrue();
            assertThat(speech.domain()).isEqualTo(ExpressionAnalyzer.FALLBACK_DOMAIN);
        }

        @Test
        @DisplayName("no candidates for the detected domain and no general patterns")
        void noPatterns() {
            RewriteEngine engine = engineWith(
                    TestPatterns.regex("int", "\\\\int", "integral", Priority.medium(), Domain.CALCULUS));

            assertThatThrownBy(() -> engine.process(expr("x + y"), null))
                    .isInstanceOf(NoPatternsFoundException.class)
                    .hasMessage("no patterns found for domain 'algebra'");
        }

        @Test
        @DisplayName("empty store fails the same way")
        void emptyStore() {
            assertThatThrownBy(() -> engineWith().process(expr("x"), null))
                    .isInstanceOf(NoPatternsFoundException.class);
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("higher priority runs first and consumes the match")
        void priorityWins() {
            RewriteEngine engine = engineWith(
                    TestPatterns.regex("low", "\\\\pi", "pie", Priority.low(), Domain.GENERAL),
                    TestPatterns.regex("high", "\\\\pi", "pi", Priority.high(), Domain.GENERAL));

            SpeechText speech = engine.process(expr("2\\pi"), null);

            assertThat(speech.text()).isEqualTo("2pi");
            assertThat(speech.appliedPatternIds()).containsExactly("high");
        }

        @Test
        @DisplayName("equal priority keeps store order")
        void storeOrderBreaksTies() {
            RewriteEngine engine = engineWith(
                    TestPatterns.regex("first", "x", "one"), TestPatterns.regex("second", "x", "two"));

            assertThat(engine.process(expr("x"), null).text()).isEqualTo("One");
        }

        @Test
        @DisplayName("a pattern enabled by an earlier rewrite fires on the next pass")
        void chainedRewrite() {
            RewriteEngine engine = engineWith(
                    TestPatterns.regex("to_z", "y", "z", Priority.high(), Domain.GENERAL),
                    TestPatterns.regex("to_y", "x", "y", Priority.low(), Domain.GENERAL));

            SpeechText speech = engine.process(expr("1 + x"), null);

            assertThat(speech.text()).isEqualTo("1 + z");
            assertThat(speech.appliedPatternIds()).containsExactly("to_y", "to_z");
            assertThat(speech.iterationsUsed()).isEqualTo(2);
        }

        @Test
        @DisplayName("iteration budget exhausted reports converged=false with the partial text")
        void notConverged() {
            RewriteEngine engine = new RewriteEngine(
                    new InMemoryPatternStore(List.of(
                            TestPatterns.regex("to_z", "y", "z", Priority.high(), Domain.GENERAL),
                            TestPatterns.regex("to_y", "x", "y", Priority.low(), Domain.GENERAL))),
                    new ExpressionAnalyzer(),
                    new PostProcessor(),
                    new EngineConfig(1),
                    null,
                    null);

            SpeechText speech = engine.process(expr("1 + x"), null);

            assertThat(speech.converged()).isFalse();
            assertThat(speech.iterationsUsed()).isEqualTo(1);
            assertThat(speech.text()).isEqualTo("1 + y");
        }

        @Test
        @DisplayName("same input twice produces the same result")
        void deterministic() {
            RewriteEngine engine = engineWith(
                    TestPatterns.fracBasic(),
                    TestPatterns.regex("alpha", "\\\\alpha", "alpha"),
                    TestPatterns.regex("plus", "\\+", "plus"));
            Expression e = expr("\\frac{1}{2} + \\alpha");

            assertThat(engine.process(e, null)).isEqualTo(engine.process(e, null));
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("domain hint overrides detection and general patterns are included")
        void domainHint() {
            RewriteEngine engine = engineWith(
                    TestPatterns.regex("int", "\\\\int", "the integral of", Priority.high(), Domain.CALCULUS),
                    TestPatterns.regex("plus", "\\+", "plus"));

            SpeechText speech = engine.process(expr("\\int x + 1"), null, Domain.CALCULUS);

            assertThat(speech.domain()).isEqualTo(Domain.CALCULUS);
            assertThat(speech.text()).isEqualTo("The integral of x plus 1");
            assertThat(speech.appliedPatternIds()).containsExactly("int", "plus");
        }

        @Test
        @DisplayName("disabled patterns and patterns for other contexts are skipped")
        void contextAndEnabledFilter() {
            Pattern displayOnly = Pattern.builder()
                    .id("display_alpha")
                    .matcher("\\\\alpha")
                    .template("ALPHA")
                    .priority(Priority.high())
                    .context(ExpressionContext.DISPLAY)
                    .build();
            Pattern disabled = TestPatterns.regex("off", "\\\\alpha", "off").revise(b -> b.enabled(false));
            RewriteEngine engine =
                    engineWith(displayOnly, disabled, TestPatterns.regex("alpha", "\\\\alpha", "alpha"));

            assertThat(engine.process(expr("\\alpha"), null, null, ExpressionContext.INLINE).text())
                    .isEqualTo("Alpha");
            assertThat(engine.process(expr("\\alpha"), null, null, ExpressionContext.DISPLAY).text())
                    .isEqualTo("ALPHA");
        }

        @Test
        @DisplayName("matching ids follow candidate order and leave usage counters alone")
        void matchingPatternIds() {
            PatternUsage usage = new PatternUsage();
            RewriteEngine engine = new RewriteEngine(
                    new InMemoryPatternStore(List.of(
                            TestPatterns.regex("plus", "\\+", "plus", Priority.low(), Domain.GENERAL),
                            TestPatterns.regex("int", "\\\\int", "integral", Priority.high(), Domain.CALCULUS),
                            TestPatterns.regex("sum", "\\\\sum", "sum", Priority.high(), Domain.CALCULUS))),
                    new ExpressionAnalyzer(),
                    new PostProcessor(),
                    EngineConfig.DEFAULT,
                    usage,
                    null);

            assertThat(engine.matchingPatternIds(expr("\\int x + 1"), Domain.CALCULUS, null))
                    .containsExactly("int", "plus");
            assertThat(engine.matchingPatternIds(expr("\\int x + 1"), Domain.GENERAL, null))
                    .containsExactly("plus");
            assertThat(usage.snapshotAll()).isEmpty();
        }

        @Test
        @DisplayName("candidates are sorted by priority descending, stably")
        void selectCandidates() {
            Pattern a = TestPatterns.regex("a", "a", "a", Priority.low(), Domain.GENERAL);
            Pattern b = TestPatterns.regex("b", "b", "b", Priority.high(), Domain.ALGEBRA);
            Pattern c = TestPatterns.regex("c", "c", "c", Priority.low(), Domain.ALGEBRA);
            var store = new InMemoryPatternStore(List.of(a, b, c));

            List<Pattern> candidates =
                    RewriteEngine.selectCandidates(store.snapshot(), Domain.ALGEBRA, ExpressionContext.INLINE);

            assertThat(candidates).containsExactly(b, c, a);
            assertThat(RewriteEngine.groupByPriority(candidates)).containsExactly(List.of(b), List.of(c, a));
        }
    }

    @Nested
    @DisplayName("Failures and extras")
    class Extras {

        @Test
        @DisplayName("a failing pattern is counted and the rest still apply")
        void errorIsolation() {
            Pattern failing = mock(Pattern.class);
            when(failing.id()).thenReturn("boom");
            when(failing.version()).thenReturn("1.0.0");
            when(failing.domain()).thenReturn(Domain.GENERAL);
            when(failing.priority()).thenReturn(Priority.critical());
            when(failing.enabled()).thenReturn(true);
            when(failing.appliesTo(any())).thenReturn(true);
            when(failing.apply(anyString(), any()))
                    .thenThrow(new PatternApplyException("error applying pattern: boom", null, "boom"));
            PatternUsage usage = new PatternUsage();
            RewriteEngine engine = new RewriteEngine(
                    new InMemoryPatternStore(List.of(failing, TestPatterns.fracBasic())),
                    new ExpressionAnalyzer(),
                    new PostProcessor(),
                    EngineConfig.DEFAULT,
                    usage,
                    null);

            SpeechText speech = engine.process(expr("\\frac{1}{2}"), null);

            assertThat(speech.text()).isEqualTo("1 over 2");
            assertThat(speech.hasPatternErrors()).isTrue();
            assertThat(speech.patternErrors()).containsEntry("boom", 2);
            assertThat(usage.snapshot("boom").errors()).isEqualTo(2);
            assertThat(usage.snapshot("frac_basic").hits()).isEqualTo(1);
        }

        @Test
        @DisplayName("pronunciation hints of applied patterns are collected")
        void hints() {
            Pattern withHint = TestPatterns.fracBasic()
                    .revise(b -> b.hint(new PronunciationHint("moderate", null, 200, null, null, null)));

            SpeechText speech = engineWith(withHint).process(expr("\\frac{1}{2}"), null);

            assertThat(speech.hints()).containsOnlyKeys("frac_basic");
            assertThat(speech.hints().get("frac_basic").pauseAfter()).isEqualTo(200);
        }

        @Test
        @DisplayName("audience drives post-processing")
        void audience() {
            RewriteEngine engine = engineWith(
                    TestPatterns.regex("wrt", "\\\\frac\\{d\\}\\{dx\\}", "the derivative with respect to x of"));

            assertThat(engine.process(expr("\\frac{d}{dx} y"), AudienceLevel.ELEMENTARY, Domain.GENERAL).text())
                    .isEqualTo("The derivative by x of y");
            assertThat(engine.process(expr("\\frac{d}{dx} y"), AudienceLevel.GRADUATE, Domain.GENERAL).text())
                    .isEqualTo("The derivative with respect to x of y");
        }
    }
}
