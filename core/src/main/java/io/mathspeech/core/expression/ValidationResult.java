package io.mathspeech.core.expression;

import io.mathspeech.core.error.ExpressionValidationException;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link ExpressionValidator#validate(String)}: exactly one of a valid
 * {@link Expression} or the first {@link ExpressionValidationException} found.
 */
public final class ValidationResult {

    private final Expression expression;
    private final ExpressionValidationException error;

    private ValidationResult(Expression expression, ExpressionValidationException error) {
        this.expression = expression;
        this.error = error;
    }

    static ValidationResult valid(Expression expression) {
        return new ValidationResult(Objects.requireNonNull(expression, "expression must not be null"), null);
    }

    static ValidationResult invalid(ExpressionValidationException error) {
        return new ValidationResult(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isValid() {
        return expression != null;
    }

    /** The validated expression, if validation succeeded. */
    public Optional<Expression> expression() {
        return Optional.ofNullable(expression);
    }

    /** The validation error, if validation failed. */
    public Optional<ExpressionValidationException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the expression or throws the recorded error.
     *
     * @throws ExpressionValidationException if validation failed
     */
    public Expression orElseThrow() {
        if (error != null) {
            throw error;
        }
        return expression;
    }

    @Override
    public String toString() {
        return isValid()
                ? "ValidationResult[valid]"
                : "ValidationResult[" + error.kind() + ": " + error.getMessage() + "]";
    }
}
