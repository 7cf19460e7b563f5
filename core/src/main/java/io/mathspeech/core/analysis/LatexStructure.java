package io.mathspeech.core.analysis;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural facts derived from raw LaTeX text: command tokens, single-letter variables, brace
 * nesting depth and the complexity score. Shared by the validator and the analyzer so both see
 * the same numbers.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class LatexStructure {

    /** A backslash followed by one or more ASCII letters. */
    public static final Pattern COMMAND_TOKEN = Pattern.compile("\\\\([a-zA-Z]+)");

    /** Commands that weigh extra in the complexity score. */
    public static final Set<String> SPECIAL_FUNCTIONS = Set.of("int", "sum", "prod", "lim", "frac");

    /** Upper bound of the complexity score. */
    public static final double MAX_COMPLEXITY = 10.0;

    private LatexStructure() {}

    /**
     * Extracts every {@code \letters} command name, without the backslash, in order of first
     * appearance.
     */
    public static Set<String> extractCommands(String content) {
        Set<String> commands = new LinkedHashSet<>();
        Matcher m = COMMAND_TOKEN.matcher(content);
        while (m.find()) {
            commands.add(m.group(1));
        }
        return Collections.unmodifiableSet(commands);
    }

    /**
     * Extracts single-letter variables: letters that are not part of a command token and are not
     * adjacent to other letters. Ordered by first appearance.
     */
    public static Set<String> extractVariables(String content) {
        Set<String> variables = new LinkedHashSet<>();
        int n = content.length();
        int i = 0;
        while (i < n) {
            char c = content.charAt(i);
            if (c == '\\') {
                i++;
                while (i < n && Character.isLetter(content.charAt(i))) {
                    i++;
                }
                continue;
            }
            if (Character.isLetter(c)) {
                boolean leftClear = i == 0 || !Character.isLetter(content.charAt(i - 1));
                boolean rightClear = i == n - 1 || !Character.isLetter(content.charAt(i + 1));
                if (leftClear && rightClear) {
                    variables.add(String.valueOf(c));
                }
            }
            i++;
        }
        return Collections.unmodifiableSet(variables);
    }

    /** Maximum concurrent brace depth. Unbalanced input is measured as-is. */
    public static int maxNestingDepth(String content) {
        int depth = 0;
        int max = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '{') {
                depth++;
                max = Math.max(max, depth);
            } else if (c == '}') {
                depth--;
            }
        }
        return max;
    }

    /**
     * Weighted complexity score, capped at {@value #MAX_COMPLEXITY}:
     * {@code 0.01*length + 0.5*|commands| + 0.3*depth + 0.8*|commands in SPECIAL_FUNCTIONS|}.
     */
    public static double complexity(String content, Set<String> commands, int maxNestingDepth) {
        double score = content.length() * 0.01;
        score += commands.size() * 0.5;
        score += maxNestingDepth * 0.3;
        long special = commands.stream().filter(SPECIAL_FUNCTIONS::contains).count();
        score += special * 0.8;
        return Math.min(score, MAX_COMPLEXITY);
    }

    /** Convenience overload that derives commands and depth from the content. */
    public static double complexity(String content) {
        return complexity(content, extractCommands(content), maxNestingDepth(content));
    }
}
