package io.mathspeech.core.expression;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validated, immutable LaTeX source plus the structural facts derived from it.
 *
 * <p>
 * Instances exist only as the output of {@link ExpressionValidator}: there is no public
 * constructor, so holding an {@code Expression} proves the text passed every check exactly once.
 * "Modifying" operations such as {@link #sanitize()} return a new, re-validated instance.
 */
public final class Expression {

    private static final Pattern COMMENT = Pattern.compile("(?<!\\\\)%.*$", Pattern.MULTILINE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int DISPLAY_LENGTH = 50;

    private final String content;
    private final Set<String> commands;
    private final Set<String> variables;
    private final int maxNestingDepth;
    private final double complexityScore;
    private final ValidationLimits limits;

    Expression(
            String content,
            Set<String> commands,
            Set<String> variables,
            int maxNestingDepth,
            double complexityScore,
            ValidationLimits limits) {
        this.content = content;
        this.commands = commands;
        this.variables = variables;
        this.maxNestingDepth = maxNestingDepth;
        this.complexityScore = complexityScore;
        this.limits = limits;
    }

    /** The raw LaTeX text. */
    public String content() {
        return content;
    }

    /** Command names (without backslash) in order of first appearance. */
    public Set<String> commands() {
        return commands;
    }

    /** Single-letter variables in order of first appearance. */
    public Set<String> variables() {
        return variables;
    }

    /** Maximum concurrent brace depth. */
    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    /** Complexity score in {@code [0, 10]}. */
    public double complexityScore() {
        return complexityScore;
    }

    /** The limits this expression was validated against. */
    public ValidationLimits limits() {
        return limits;
    }

    public int length() {
        return content.length();
    }

    /**
     * Returns a new expression with unescaped {@code %} comments removed and whitespace runs
     * collapsed to single spaces. The result is validated again under the same limits.
     *
     * @throws io.mathspeech.core.error.ExpressionValidationException if the stripped text is no
     *     longer valid (for example, a comment hid a closing brace)
     */
    public Expression sanitize() {
        String stripped = COMMENT.matcher(content).replaceAll("");
        String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ").trim();
        if (collapsed.equals(content)) {
            return this;
        }
        return new ExpressionValidator(limits).validateOrThrow(collapsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Expression other)) {
            return false;
        }
        return content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content);
    }

    @Override
    public String toString() {
        return content.length() > DISPLAY_LENGTH ? content.substring(0, DISPLAY_LENGTH - 3) + "..." : content;
    }
}
