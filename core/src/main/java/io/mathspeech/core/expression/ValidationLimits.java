package io.mathspeech.core.expression;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Limits applied by {@link ExpressionValidator}. Immutable and thread-safe.
 *
 * @param maxLength            maximum input length in characters (default 10,000)
 * @param maxNesting           maximum concurrent brace depth (default 20)
 * @param repetitionThreshold  maximum occurrences of each of {@code { } \ $} (default 1,000)
 * @param maxCommandLength     maximum command name length, backslash excluded (default 50)
 * @param allowedCommands      the command allow-list, names without the backslash
 */
public record ValidationLimits(
        int maxLength, int maxNesting, int repetitionThreshold, int maxCommandLength, Set<String> allowedCommands) {

    /** Commands accepted by default. */
    public static final Set<String> DEFAULT_ALLOWED_COMMANDS = Set.of(
            // basic functions
            "frac", "sqrt", "sin", "cos", "tan", "log", "ln", "exp", "lim", "sum", "prod", "int",
            // greek, lower case
            "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta", "iota", "kappa",
            "lambda", "mu", "nu", "xi", "pi", "rho", "sigma", "tau", "upsilon", "phi", "chi", "psi", "omega",
            // greek, upper case
            "Alpha", "Beta", "Gamma", "Delta", "Epsilon", "Zeta", "Eta", "Theta", "Iota", "Kappa",
            "Lambda", "Mu", "Nu", "Xi", "Pi", "Rho", "Sigma", "Tau", "Upsilon", "Phi", "Chi", "Psi", "Omega",
            // operators
            "cdot", "times", "div", "pm", "mp", "leq", "geq", "neq", "approx", "equiv", "subset", "supset",
            "subseteq", "supseteq", "cup", "cap", "emptyset", "in", "notin", "forall", "exists",
            // formatting
            "mathbf", "mathit", "mathbb", "mathcal", "mathfrak", "text", "textbf", "textit",
            "overline", "underline", "hat", "tilde", "bar", "vec", "dot", "ddot",
            // delimiters
            "left", "right", "big", "bigg", "Big", "Bigg",
            // environments
            "begin", "end", "matrix", "pmatrix", "bmatrix", "vmatrix", "Vmatrix",
            // calculus
            "partial", "nabla", "infty", "sup", "inf",
            // arrows
            "to", "rightarrow", "leftarrow", "leftrightarrow", "mapsto");

    /** Default limits: 10,000 chars, depth 20, repetition 1,000, command names up to 50. */
    public static final ValidationLimits DEFAULT = new ValidationLimits(10_000, 20, 1_000, 50, DEFAULT_ALLOWED_COMMANDS);

    public ValidationLimits {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
        }
        if (maxNesting <= 0) {
            throw new IllegalArgumentException("maxNesting must be positive, got: " + maxNesting);
        }
        if (repetitionThreshold <= 0) {
            throw new IllegalArgumentException("repetitionThreshold must be positive, got: " + repetitionThreshold);
        }
        if (maxCommandLength <= 0) {
            throw new IllegalArgumentException("maxCommandLength must be positive, got: " + maxCommandLength);
        }
        Objects.requireNonNull(allowedCommands, "allowedCommands must not be null");
        allowedCommands = Set.copyOf(allowedCommands);
    }

    /** Returns a copy with a different length limit. */
    public ValidationLimits withMaxLength(int maxLength) {
        return new ValidationLimits(maxLength, maxNesting, repetitionThreshold, maxCommandLength, allowedCommands);
    }

    /** Returns a copy with a different nesting limit. */
    public ValidationLimits withMaxNesting(int maxNesting) {
        return new ValidationLimits(maxLength, maxNesting, repetitionThreshold, maxCommandLength, allowedCommands);
    }

    /** Returns a copy whose allow-list is exactly {@code commands}. */
    public ValidationLimits withAllowedCommands(Set<String> commands) {
        return new ValidationLimits(maxLength, maxNesting, repetitionThreshold, maxCommandLength, commands);
    }

    /** Returns a copy whose allow-list additionally contains {@code commands}. */
    public ValidationLimits withAdditionalCommands(Set<String> commands) {
        Set<String> widened = new LinkedHashSet<>(allowedCommands);
        widened.addAll(commands);
        return withAllowedCommands(widened);
    }
}
