package io.mathspeech.core.analysis;

import io.mathspeech.core.expression.Expression;
import io.mathspeech.core.model.Domain;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives domain hints and structural classification from a validated {@link Expression}.
 *
 * <p>
 * Domain detection scores each candidate domain by how many of its indicators occur in the
 * expression. An indicator starting with a backslash is a command and must be in the command
 * set; any other indicator is a fragment searched in the lower-cased text. The highest
 * non-zero score wins; ties go to the domain declared first. With no indicator at all the
 * result is {@link #FALLBACK_DOMAIN}.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class ExpressionAnalyzer {

    /** Returned when no domain indicator is present. */
    public static final Domain FALLBACK_DOMAIN = Domain.ALGEBRA;

    private static final Set<String> FUNCTIONS = Set.of("sin", "cos", "tan", "log", "ln", "exp", "sqrt");

    /** Indicators per domain, in tie-break order. */
    static final Map<Domain, List<String>> DOMAIN_INDICATORS = indicators();

    private static Map<Domain, List<String>> indicators() {
        Map<Domain, List<String>> m = new LinkedHashMap<>();
        m.put(Domain.CALCULUS, List.of("\\int", "\\partial", "\\lim", "\\nabla", "\\infty", "frac{d", "dx", "dy", "dt"));
        m.put(Domain.LINEAR_ALGEBRA, List.of(
                "\\matrix", "\\pmatrix", "\\bmatrix", "\\vmatrix", "\\det", "\\vec", "\\mathbf", "\\cdot", "\\times"));
        m.put(Domain.STATISTICS, List.of(
                "\\sum", "\\prod", "\\mu", "\\sigma", "\\bar", "\\hat", "mathbb{e}", "text{var}", "text{cov}", "p("));
        m.put(Domain.SET_THEORY, List.of(
                "\\cup", "\\cap", "\\subset", "\\supset", "\\subseteq", "\\supseteq", "\\in", "\\notin", "\\emptyset"));
        m.put(Domain.LOGIC, List.of("\\forall", "\\exists", "\\land", "\\lor", "\\neg", "\\implies", "\\iff"));
        m.put(Domain.NUMBER_THEORY, List.of("\\mod", "\\gcd", "\\lcm", "\\equiv", "\\mid", "\\nmid", "\\phi", "pmod"));
        m.put(Domain.ALGEBRA, List.of("\\sqrt", "\\frac", "\\pm", "^", "="));
        return Collections.unmodifiableMap(m);
    }

    /** Detects the most likely domain, or {@link #FALLBACK_DOMAIN}. */
    public Domain detectDomain(Expression expression) {
        String lower = expression.content().toLowerCase(Locale.ROOT);
        Set<String> commands = expression.commands();
        Domain best = null;
        int bestScore = 0;
        for (Map.Entry<Domain, List<String>> entry : DOMAIN_INDICATORS.entrySet()) {
            int score = score(entry.getValue(), lower, commands);
            // strict '>' keeps the earlier domain on ties
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
            }
        }
        return best != null ? best : FALLBACK_DOMAIN;
    }

    private static int score(List<String> indicators, String lowerContent, Set<String> commands) {
        int score = 0;
        for (String indicator : indicators) {
            boolean present = indicator.startsWith("\\")
                    ? commands.contains(indicator.substring(1))
                    : lowerContent.contains(indicator);
            if (present) {
                score++;
            }
        }
        return score;
    }

    /**
     * Classifies the dominant structure. Checks run from most to least specific; an expression
     * with a score of 6 or more that matches nothing specific is {@link ExpressionType#COMPLEX}.
     */
    public ExpressionType classify(Expression expression) {
        String content = expression.content();
        Set<String> commands = expression.commands();
        if (content.contains("\\frac{d") || content.contains("\\frac{\\partial")) {
            return ExpressionType.DERIVATIVE;
        }
        if (commands.contains("int")) {
            return ExpressionType.INTEGRAL;
        }
        if (commands.contains("lim")) {
            return ExpressionType.LIMIT;
        }
        if (commands.contains("sum")) {
            return ExpressionType.SUMMATION;
        }
        if (commands.contains("prod")) {
            return ExpressionType.PRODUCT;
        }
        if (content.contains("matrix}")) {
            return ExpressionType.MATRIX;
        }
        if (commands.contains("frac")) {
            return ExpressionType.FRACTION;
        }
        if (commands.contains("leq") || commands.contains("geq") || commands.contains("neq")
                || content.indexOf('<') >= 0 || content.indexOf('>') >= 0) {
            return ExpressionType.INEQUALITY;
        }
        if (content.indexOf('=') >= 0) {
            return ExpressionType.EQUATION;
        }
        if (commands.stream().anyMatch(FUNCTIONS::contains)) {
            return ExpressionType.FUNCTION;
        }
        if (ComplexityLevel.forScore(expression.complexityScore()) == ComplexityLevel.VERY_COMPLEX) {
            return ExpressionType.COMPLEX;
        }
        return ExpressionType.SIMPLE;
    }

    /** Complexity band of the expression's score. */
    public ComplexityLevel complexityLevel(Expression expression) {
        return ComplexityLevel.forScore(expression.complexityScore());
    }

    /** Complexity score of arbitrary text, computed the same way the validator does. */
    public double complexity(String content) {
        return LatexStructure.complexity(content);
    }
}
