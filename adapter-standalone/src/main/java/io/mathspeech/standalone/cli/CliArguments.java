package io.mathspeech.standalone.cli;

import io.mathspeech.core.model.AudienceLevel;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 *
 * <pre>
 * [--config FILE] [--audience LEVEL] [--domain DOMAIN] [--context TYPE] [--format text|json]
 *     [--coverage] [--] [EXPRESSION...]
 * </pre>
 *
 * Everything that is not an option is an expression. {@code --} ends option parsing, for
 * expressions that themselves start with {@code --}.
 *
 * @param configPath  explicit config file, or {@code null}
 * @param audience    audience override, or {@code null} for the configured default
 * @param domain      domain hint, or {@code null} for detection
 * @param contextType context type, or {@code null} for inline
 * @param format      output format
 * @param coverage    report pattern coverage of the expressions instead of converting them
 * @param expressions expressions given on the command line; empty means read standard input
 */
public record CliArguments(
        Path configPath,
        AudienceLevel audience,
        Domain domain,
        ExpressionContext contextType,
        OutputFormat format,
        boolean coverage,
        List<String> expressions) {

    public CliArguments {
        format = format != null ? format : OutputFormat.TEXT;
        expressions = List.copyOf(expressions);
    }

    /**
     * Parses {@code args}.
     *
     * @throws IllegalArgumentException on an unknown option, a missing option value or a value
     *     outside its vocabulary
     */
    public static CliArguments parse(String[] args) {
        Path configPath = null;
        AudienceLevel audience = null;
        Domain domain = null;
        ExpressionContext contextType = null;
        OutputFormat format = null;
        boolean coverage = false;
        List<String> expressions = new ArrayList<>();
        boolean optionsEnded = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (optionsEnded || !arg.startsWith("--")) {
                expressions.add(arg);
                continue;
            }
            switch (arg) {
                case "--" -> optionsEnded = true;
                case "--config" -> configPath = Path.of(value(args, i++));
                case "--audience" -> audience = AudienceLevel.fromId(value(args, i++));
                case "--domain" -> domain = Domain.fromId(value(args, i++));
                case "--context" -> contextType = ExpressionContext.fromId(value(args, i++));
                case "--format" -> format = OutputFormat.fromId(value(args, i++));
                case "--coverage" -> coverage = true;
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return new CliArguments(configPath, audience, domain, contextType, format, coverage, expressions);
    }

    private static String value(String[] args, int optionIndex) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(args[optionIndex] + " requires a value");
        }
        return args[optionIndex + 1];
    }
}
