package io.mathspeech.core.analysis;

/** Dominant structural shape of an expression, as reported by {@link ExpressionAnalyzer#classify}. */
public enum ExpressionType {
    FRACTION,
    INTEGRAL,
    DERIVATIVE,
    LIMIT,
    SUMMATION,
    PRODUCT,
    MATRIX,
    FUNCTION,
    EQUATION,
    INEQUALITY,
    COMPLEX,
    SIMPLE
}
