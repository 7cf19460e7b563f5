package io.mathspeech.core.expression;

import io.mathspeech.core.analysis.LatexStructure;
import io.mathspeech.core.error.ExpressionValidationException;
import io.mathspeech.core.error.LatexSyntaxException;
import io.mathspeech.core.error.LimitExceededException;
import io.mathspeech.core.error.SecurityViolationException;
import io.mathspeech.core.error.SecurityViolationException.Threat;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gatekeeper for untrusted LaTeX. Runs fail-fast checks, cheapest first, and stops at the first
 * violation:
 * <ol>
 * <li>non-empty, within the length limit, no null bytes, no flood of one of
 * {@code { } \ $} beyond the repetition threshold;</li>
 * <li>equal counts of {@code {}}, {@code []} and {@code ()};</li>
 * <li>brace nesting walk (unmatched closing/opening brace, depth limit);</li>
 * <li>security: dangerous commands, command name length, allow-list.</li>
 * </ol>
 *
 * <p>
 * The repetition guard runs with the basic checks, ahead of the balance count, so a flood of
 * opening braces is reported as {@code excessive repetition} rather than as unbalanced input.
 *
 * <p>
 * {@link #validate(String)} is total: it never throws, every path returns a
 * {@link ValidationResult}. Thread-safe; one instance can be shared.
 */
public final class ExpressionValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionValidator.class);

    /** File I/O, macro (re)definition, catcode manipulation and case folding primitives. */
    static final List<String> DANGEROUS_COMMANDS = List.of(
            "input",
            "include",
            "write",
            "immediate",
            "expandafter",
            "csname",
            "def",
            "gdef",
            "edef",
            "xdef",
            "catcode",
            "uppercase",
            "lowercase");

    private static final List<Pattern> DANGEROUS_PATTERNS = DANGEROUS_COMMANDS.stream()
            .map(name -> Pattern.compile("\\\\" + name + "(?![a-zA-Z])", Pattern.CASE_INSENSITIVE))
            .toList();

    private static final char[] REPETITION_CHARS = {'{', '}', '\\', '$'};
    private static final int SNIPPET_CONTEXT = 50;

    private final ValidationLimits limits;

    public ExpressionValidator(ValidationLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    /** Validator with {@link ValidationLimits#DEFAULT}. */
    public static ExpressionValidator withDefaults() {
        return new ExpressionValidator(ValidationLimits.DEFAULT);
    }

    public ValidationLimits limits() {
        return limits;
    }

    /**
     * Validates {@code raw} and returns either the {@link Expression} or the first violation.
     * Never throws.
     */
    public ValidationResult validate(String raw) {
        try {
            return ValidationResult.valid(check(raw));
        } catch (ExpressionValidationException e) {
            LOG.debug("expression.rejected kind={} reason={}", e.kind(), e.getMessage());
            return ValidationResult.invalid(e);
        }
    }

    /**
     * Validates {@code raw}, throwing the first violation.
     *
     * @throws ExpressionValidationException if any check fails
     */
    public Expression validateOrThrow(String raw) {
        return check(raw);
    }

    private Expression check(String raw) {
        checkBasics(raw);
        checkRepetition(raw);
        checkBalance(raw);
        int depth = checkNesting(raw);
        checkDangerousCommands(raw);
        checkCommandLengths(raw);
        checkAllowList(raw);

        Set<String> commands = LatexStructure.extractCommands(raw);

        Set<String> variables = LatexStructure.extractVariables(raw);
        double complexity = LatexStructure.complexity(raw, commands, depth);
        return new Expression(raw, commands, variables, depth, complexity, limits);
    }

    // --- 1. basics ---

    private void checkBasics(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new LatexSyntaxException("empty expression", "");
        }
        if (raw.length() > limits.maxLength()) {
            throw new LimitExceededException(
                    "expression exceeds maximum length of " + limits.maxLength() + " (length: " + raw.length() + ")",
                    raw,
                    raw.length(),
                    limits.maxLength());
        }
        int nul = raw.indexOf('\0');
        if (nul >= 0) {
            throw new SecurityViolationException(
                    "null bytes not allowed", Threat.NULL_BYTE, snippetAround(raw, nul), nul);
        }
    }

    // --- 2. delimiter balance ---

    private static void checkBalance(String raw) {
        requireBalanced(raw, '{', '}', "braces");
        requireBalanced(raw, '[', ']', "brackets");
        requireBalanced(raw, '(', ')', "parentheses");
    }

    private static void requireBalanced(String raw, char open, char close, String kind) {
        int opens = 0;
        int closes = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == open) {
                opens++;
            } else if (c == close) {
                closes++;
            }
        }
        if (opens != closes) {
            throw new LatexSyntaxException("unbalanced " + kind, raw);
        }
    }

    // --- 3. nesting walk ---

    private int checkNesting(String raw) {
        Deque<Integer> stack = new ArrayDeque<>();
        int maxDepth = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '{') {
                stack.push(i);
                maxDepth = Math.max(maxDepth, stack.size());
            } else if (c == '}') {
                if (stack.isEmpty()) {
                    throw new LatexSyntaxException(
                            "closing brace without matching opening brace", snippetAround(raw, i), i);
                }
                stack.pop();
            }
        }
        if (!stack.isEmpty()) {
            int first = stack.peekLast();
            throw new LatexSyntaxException(
                    "opening brace without matching closing brace", snippetAround(raw, first), first);
        }
        if (maxDepth > limits.maxNesting()) {
            throw new LimitExceededException(
                    "expression too deeply nested (depth: " + maxDepth + ", max: " + limits.maxNesting() + ")",
                    raw,
                    maxDepth,
                    limits.maxNesting());
        }
        return maxDepth;
    }

    // --- 4. security ---

    private static void checkDangerousCommands(String raw) {
        for (int i = 0; i < DANGEROUS_PATTERNS.size(); i++) {
            Matcher m = DANGEROUS_PATTERNS.get(i).matcher(raw);
            if (m.find()) {
                throw new SecurityViolationException(
                        "dangerous command: " + DANGEROUS_COMMANDS.get(i),
                        Threat.DANGEROUS_COMMAND,
                        snippetAround(raw, m.start()),
                        m.start());
            }
        }
    }

    private void checkRepetition(String raw) {
        for (char target : REPETITION_CHARS) {
            int count = 0;
            for (int i = 0; i < raw.length(); i++) {
                if (raw.charAt(i) == target) {
                    count++;
                }
            }
            if (count > limits.repetitionThreshold()) {
                throw new SecurityViolationException("excessive repetition", Threat.REPETITION_ATTACK, raw);
            }
        }
    }

    private void checkCommandLengths(String raw) {
        Matcher m = LatexStructure.COMMAND_TOKEN.matcher(raw);
        while (m.find()) {
            if (m.group(1).length() > limits.maxCommandLength()) {
                throw new SecurityViolationException(
                        "command name too long", Threat.LONG_COMMAND, snippetAround(raw, m.start()), m.start());
            }
        }
    }

    private void checkAllowList(String raw) {
        Matcher m = LatexStructure.COMMAND_TOKEN.matcher(raw);
        while (m.find()) {
            String command = m.group(1);
            if (!limits.allowedCommands().contains(command)) {
                throw new SecurityViolationException(
                        "disallowed command: " + command,
                        Threat.DISALLOWED_COMMAND,
                        snippetAround(raw, m.start()),
                        m.start());
            }
        }
    }

    /** Up to 100 characters around {@code offset}, starting {@value #SNIPPET_CONTEXT} before it. */
    static String snippetAround(String raw, int offset) {
        int start = Math.max(0, offset - SNIPPET_CONTEXT);
        int end = Math.min(raw.length(), start + ExpressionValidationException.MAX_SNIPPET_LENGTH);
        return raw.substring(start, end);
    }
}
