package io.mathspeech.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mathspeech.core.error.ExpressionValidationException;
import io.mathspeech.core.error.LatexSyntaxException;
import io.mathspeech.core.error.LimitExceededException;
import io.mathspeech.core.error.SecurityViolationException;
import io.mathspeech.core.error.SecurityViolationException.Threat;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ExpressionValidator")
class ExpressionValidatorTest {

    private final ExpressionValidator validator = ExpressionValidator.withDefaults();

    private ExpressionValidationException errorOf(String raw) {
        ValidationResult result = validator.validate(raw);
        assertThat(result.isValid()).as("expected %s to be rejected", raw).isFalse();
        return result.error().orElseThrow();
    }

    @Nested
    @DisplayName("Accepted input")
    class Accepted {

        @Test
        @DisplayName("simple fraction yields an expression with derived facts")
        void simpleFraction() {
            Expression expr = validator.validate("\\frac{1}{2}").orElseThrow();

            assertThat(expr.content()).isEqualTo("\\frac{1}{2}");
            assertThat(expr.commands()).containsExactly("frac");
            assertThat(expr.maxNestingDepth()).isEqualTo(1);
            assertThat(expr.complexityScore()).isBetween(0.0, 10.0);
            assertThat(expr.limits()).isEqualTo(ValidationLimits.DEFAULT);
        }

        @Test
        @DisplayName("variables are single letters in order of first appearance")
        void variablesInOrder() {
            Expression expr = validator.validateOrThrow("y = \\sin x + y");

            assertThat(expr.variables()).containsExactly("y", "x");
            assertThat(expr.commands()).containsExactly("sin");
        }

        @Test
        @DisplayName("nesting exactly at the limit is accepted")
        void nestingAtLimit() {
            String raw = "{".repeat(20) + "x" + "}".repeat(20);

            assertThat(validator.validate(raw).isValid()).isTrue();
            assertThat(validator.validateOrThrow(raw).maxNestingDepth()).isEqualTo(20);
        }

        @Test
        @DisplayName("additional commands extend the allow-list")
        void additionalCommands() {
            var custom = new ExpressionValidator(ValidationLimits.DEFAULT.withAdditionalCommands(Set.of("foo")));

            assertThat(custom.validate("\\foo{x}").isValid()).isTrue();
            assertThat(validator.validate("\\foo{x}").isValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class Syntax {

        @Test
        @DisplayName("missing closing brace is unbalanced")
        void missingClosingBrace() {
            var error = errorOf("\\frac{1}{2");

            assertThat(error).isInstanceOf(LatexSyntaxException.class);
            assertThat(error.getMessage()).isEqualTo("unbalanced braces");
        }

        @Test
        @DisplayName("brackets and parentheses are counted separately")
        void bracketsAndParentheses() {
            assertThat(errorOf("[x").getMessage()).isEqualTo("unbalanced brackets");
            assertThat(errorOf("(x").getMessage()).isEqualTo("unbalanced parentheses");
        }

        @Test
        @DisplayName("balanced counts in the wrong order report the stray closing brace offset")
        void closingBeforeOpening() {
            var error = errorOf("a}{b");

            assertThat(error.getMessage()).isEqualTo("closing brace without matching opening brace");
            assertThat(error.offset()).isEqualTo(1);
        }

        @ParameterizedTest
        @ValueSource(strings = {""})
        @DisplayName("empty input is rejected")
        void emptyInput(String raw) {
            var error = errorOf(raw);

            assertThat(error.getMessage()).isEqualTo("empty expression");
            assertThat(error.kind()).isEqualTo(ExpressionValidationException.Kind.SYNTAX);
        }

        @Test
        @DisplayName("null input is rejected without throwing")
        void nullInput() {
            assertThat(errorOf(null).getMessage()).isEqualTo("empty expression");
        }
    }

    @Nested
    @DisplayName("Limits")
    class Limits {

        @Test
        @DisplayName("length above the limit")
        void tooLong() {
            var error = errorOf("x".repeat(10_001));

            assertThat(error).isInstanceOf(LimitExceededException.class);
            assertThat(error.getMessage()).contains("maximum length of 10000");
            assertThat(((LimitExceededException) error).actual()).isEqualTo(10_001);
        }

        @Test
        @DisplayName("nesting one beyond the limit")
        void tooDeep() {
            var error = errorOf("{".repeat(21) + "x" + "}".repeat(21));

            assertThat(error).isInstanceOf(LimitExceededException.class);
            assertThat(error.getMessage()).isEqualTo("expression too deeply nested (depth: 21, max: 20)");
        }

        @Test
        @DisplayName("custom length limit is honoured")
        void customLength() {
            var strict = new ExpressionValidator(ValidationLimits.DEFAULT.withMaxLength(5));

            assertThat(strict.validate("x+y+z").isValid()).isTrue();
            assertThat(strict.validate("x+y+z+w").isValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Security")
    class Security {

        @Test
        @DisplayName("file input is a dangerous command")
        void inputCommand() {
            var error = errorOf("\\input{/etc/passwd}");

            assertThat(error).isInstanceOf(SecurityViolationException.class);
            assertThat(error.getMessage()).isEqualTo("dangerous command: input");
            assertThat(((SecurityViolationException) error).threat()).isEqualTo(Threat.DANGEROUS_COMMAND);
            assertThat(error.offset()).isZero();
        }

        @ParameterizedTest
        @ValueSource(strings = {"\\def\\x{1}", "\\catcode`\\@=11", "x \\WRITE y", "\\csname foo\\endcsname"})
        @DisplayName("macro and catcode primitives are rejected regardless of case")
        void dangerousPrimitives(String raw) {
            var error = errorOf(raw);

            assertThat(error.getMessage()).startsWith("dangerous command: ");
        }

        @ParameterizedTest
        @CsvSource({"'\\write18{rm x}', write", "'\\input_x', input", "'\\def1', def"})
        @DisplayName("a dangerous name followed by a digit or underscore is still dangerous")
        void dangerousPrefix(String raw, String command) {
            var error = errorOf(raw);

            assertThat(error.getMessage()).isEqualTo("dangerous command: " + command);
            assertThat(((SecurityViolationException) error).threat()).isEqualTo(Threat.DANGEROUS_COMMAND);
        }

        @Test
        @DisplayName("a longer command that starts with a dangerous name falls to the allow-list")
        void dangerousNameAsPrefixOfLetters() {
            var error = errorOf("\\inputs");

            assertThat(error.getMessage()).isEqualTo("disallowed command: inputs");
        }

        @Test
        @DisplayName("a flood of opening braces is excessive repetition, not unbalanced")
        void repetitionAttack() {
            var error = errorOf("{".repeat(1001));

            assertThat(error.getMessage()).isEqualTo("excessive repetition");
            assertThat(((SecurityViolationException) error).threat()).isEqualTo(Threat.REPETITION_ATTACK);
        }

        @Test
        @DisplayName("null byte reports its offset")
        void nullByte() {
            var error = errorOf("x+\0y");

            assertThat(error.getMessage()).isEqualTo("null bytes not allowed");
            assertThat(error.offset()).isEqualTo(2);
        }

        @Test
        @DisplayName("command name longer than 50 characters")
        void longCommand() {
            var error = errorOf("\\" + "a".repeat(51));

            assertThat(error.getMessage()).isEqualTo("command name too long");
        }

        @Test
        @DisplayName("command outside the allow-list names the command and its offset")
        void disallowed() {
            var error = errorOf("x + \\foo{y}");

            assertThat(error.getMessage()).isEqualTo("disallowed command: foo");
            assertThat(error.offset()).isEqualTo(4);
        }
    }

    @Test
    @DisplayName("validateOrThrow throws the same error validate reports")
    void validateOrThrow() {
        assertThatThrownBy(() -> validator.validateOrThrow("\\frac{1}{2"))
                .isInstanceOf(LatexSyntaxException.class)
                .hasMessage("unbalanced braces");
    }

    @Test
    @DisplayName("snippet is bounded to 100 characters around the offset")
    void snippetAround() {
        String raw = "a".repeat(200);

        String snippet = ExpressionValidator.snippetAround(raw, 120);

        assertThat(snippet).hasSize(100);
        assertThat(ExpressionValidator.snippetAround("abc", 1)).isEqualTo("abc");
    }
}
