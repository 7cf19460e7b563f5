package io.mathspeech.standalone.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/**
 * End-to-end runs of {@link ConverterApp} against a pattern library written to a temp directory,
 * with standard streams captured in memory.
 */
@DisplayName("ConverterApp")
class ConverterAppTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final String BASIC_PATTERNS = """
            metadata:
              category: basic
            patterns:
              - id: frac_basic
                pattern: '\\\\frac\\{(\\d+)\\}\\{(\\d+)\\}'
                output_template: '$1 over $2'
                priority: high
              - id: alpha
                pattern: '\\\\alpha'
                output_template: 'alpha'
              - id: plus
                pattern: '\\+'
                output_template: ' plus '
            """;

    private static final String CALCULUS_ONLY = """
            metadata:
              domain: calculus
            patterns:
              - id: integral
                pattern: '\\\\int'
                output_template: 'the integral of'
            """;

    @TempDir
    Path workDir;

    private final Map<String, String> envVars = new HashMap<>();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void writeLibrary() throws IOException {
        writeLibrary("patterns", BASIC_PATTERNS);
        Files.writeString(workDir.resolve("math-speech.yaml"), """
                patterns:
                  dir: patterns
                  load-mode: strict
                logging:
                  level: WARN
                """);
    }

    private void writeLibrary(String dir, String patternFile) throws IOException {
        Path library = Files.createDirectories(workDir.resolve(dir));
        Files.writeString(library.resolve("basic.yaml"), patternFile);
        Files.writeString(library.resolve("master_patterns.yaml"), """
                pattern_files:
                  - path: basic.yaml
                """);
    }

    private int run(String... args) {
        return run(new ByteArrayInputStream(new byte[0]), args);
    }

    private int run(InputStream in, String... args) {
        ConverterApp app = new ConverterApp(envVars::get, workDir);
        return app.run(
                args,
                in,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private List<String> stdoutLines() {
        return out.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Text output")
    class TextOutput {

        @Test
        @DisplayName("converts each argument to one line and exits 0")
        void converts() {
            int status = run("\\frac{1}{2}", "\\alpha + x");

            assertThat(status).isEqualTo(ConverterApp.EXIT_OK);
            assertThat(stdoutLines()).containsExactly("1 over 2", "Alpha plus x");
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("rejected input is marked, the rest still converts, exit 2")
        void rejected() {
            int status = run("\\frac{1}{2", "\\alpha");

            assertThat(status).isEqualTo(ConverterApp.EXIT_CONVERSION_FAILURES);
            assertThat(stdoutLines()).hasSize(2);
            assertThat(stdoutLines().get(0)).startsWith("[rejected] ");
            assertThat(stdoutLines().get(1)).isEqualTo("Alpha");
        }

        @Test
        @DisplayName("reads non-blank lines from standard input when no expression is given")
        void standardInput() {
            InputStream in = new ByteArrayInputStream(
                    "\\frac{3}{4}\n\n   \n\\alpha\n".getBytes(StandardCharsets.UTF_8));

            int status = run(in);

            assertThat(status).isEqualTo(ConverterApp.EXIT_OK);
            assertThat(stdoutLines()).containsExactly("3 over 4", "Alpha");
        }
    }

    @Nested
    @DisplayName("JSON output")
    class JsonOutput {

        @Test
        @DisplayName("success carries domain, applied patterns and the cache flag")
        void success() throws IOException {
            int status = run("--format", "json", "\\frac{1}{2}", "\\frac{1}{2}");

            assertThat(status).isEqualTo(ConverterApp.EXIT_OK);
            List<String> lines = stdoutLines();
            assertThat(lines).hasSize(2);

            JsonNode first = JSON.readTree(lines.get(0));
            assertThat(first.get("input").asText()).isEqualTo("\\frac{1}{2}");
            assertThat(first.get("status").asText()).isEqualTo("success");
            assertThat(first.get("text").asText()).isEqualTo("1 over 2");
            assertThat(first.get("applied_patterns").get(0).asText()).isEqualTo("frac_basic");
            assertThat(first.get("converged").asBoolean()).isTrue();
            assertThat(first.get("cached").asBoolean()).isFalse();
            assertThat(first.has("error")).isFalse();

            JsonNode second = JSON.readTree(lines.get(1));
            assertThat(second.get("cached").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("rejection reports the validation kind")
        void rejectedKind() throws IOException {
            int status = run("--format", "json", "\\input{secrets}");

            assertThat(status).isEqualTo(ConverterApp.EXIT_CONVERSION_FAILURES);
            JsonNode node = JSON.readTree(stdoutLines().get(0));
            assertThat(node.get("status").asText()).isEqualTo("rejected");
            assertThat(node.get("text").isNull()).isTrue();
            assertThat(node.get("error").get("kind").asText()).isEqualTo("security");
            assertThat(node.get("error").get("message").asText()).contains("input");
        }

        @Test
        @DisplayName("no candidate patterns falls back to the sanitized input with the failing stage")
        void fallback() throws IOException {
            writeLibrary("calculus-only", CALCULUS_ONLY);
            envVars.put("PATTERNS_DIR", "calculus-only");

            int status = run("--format", "json", "x + y");

            assertThat(status).isEqualTo(ConverterApp.EXIT_CONVERSION_FAILURES);
            JsonNode node = JSON.readTree(stdoutLines().get(0));
            assertThat(node.get("status").asText()).isEqualTo("fallback");
            assertThat(node.get("text").asText()).isEqualTo("x + y");
            assertThat(node.get("error").get("stage").asText()).isEqualTo("pattern_selection");
        }
    }

    @Nested
    @DisplayName("Request options")
    class RequestOptions {

        @Test
        @DisplayName("--domain selects domain patterns instead of detection")
        void domainHint() throws IOException {
            writeLibrary("calculus-only", CALCULUS_ONLY);
            envVars.put("PATTERNS_DIR", "calculus-only");

            int status = run("--domain", "calculus", "\\int x");

            assertThat(status).isEqualTo(ConverterApp.EXIT_OK);
            assertThat(stdoutLines()).containsExactly("The integral of x");
        }
    }

    @Nested
    @DisplayName("Coverage report")
    class CoverageOutput {

        @Test
        @DisplayName("--coverage writes one report instead of converting")
        void text() {
            int status = run("--coverage", "\\frac{1}{2}", "\\alpha + x", "y", "\\frac{1}{2");

            assertThat(status).isEqualTo(ConverterApp.EXIT_OK);
            assertThat(stdoutLines()).containsExactly(
                    "coverage 50.0% matched=2 unmatched=1 rejected=1 total=4",
                    "pattern alpha 1",
                    "pattern frac_basic 1",
                    "pattern plus 1",
                    "unmatched y");
        }

        @Test
        @DisplayName("--coverage with --format json writes one JSON object")
        void json() throws IOException {
            int status = run("--coverage", "--format", "json", "\\frac{1}{2}", "\\frac{3}{4}", "z");

            assertThat(status).isEqualTo(ConverterApp.EXIT_OK);
            assertThat(stdoutLines()).hasSize(1);
            JsonNode node = JSON.readTree(stdoutLines().get(0));
            assertThat(node.get("total").asInt()).isEqualTo(3);
            assertThat(node.get("matched").asInt()).isEqualTo(2);
            assertThat(node.get("coverage_percentage").asDouble()).isCloseTo(66.67, within(0.01));
            assertThat(node.get("pattern_usage").get("frac_basic").asLong()).isEqualTo(2);
            assertThat(node.get("unmatched_samples").get(0).asText()).isEqualTo("z");
        }
    }

    @Test
    @DisplayName("a pattern whose documented example fails is reported at startup, conversion continues")
    void exampleMismatchWarning() throws IOException {
        writeLibrary("patterns", """
                patterns:
                  - id: alpha
                    pattern: '\\\\alpha'
                    output_template: 'alpha'
                    examples:
                      - input: '\\alpha'
                        output: beta
                """);
        Logger appLogger = (Logger) LoggerFactory.getLogger(ConverterApp.class);
        ListAppender<ILoggingEvent> logs = new ListAppender<>();
        logs.start();
        appLogger.addAppender(logs);
        try {
            assertThat(run("\\alpha")).isEqualTo(ConverterApp.EXIT_OK);
        } finally {
            appLogger.detachAppender(logs);
        }

        assertThat(stdoutLines()).containsExactly("Alpha");
        assertThat(logs.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .contains("patterns.example_mismatch id=alpha input=\\alpha expected=beta actual=alpha");
    }

    @Nested
    @DisplayName("Startup failures")
    class StartupFailures {

        @Test
        @DisplayName("explicit config that does not exist exits 1")
        void missingConfig() {
            int status = run("--config", workDir.resolve("absent.yaml").toString(), "x");

            assertThat(status).isEqualTo(ConverterApp.EXIT_STARTUP_FAILURE);
            assertThat(stderr()).startsWith("error: Configuration file not found");
            assertThat(out.size()).isZero();
        }

        @Test
        @DisplayName("unknown option exits 1")
        void unknownOption() {
            assertThat(run("--verbose")).isEqualTo(ConverterApp.EXIT_STARTUP_FAILURE);
            assertThat(stderr()).contains("Unknown option: --verbose");
        }

        @Test
        @DisplayName("missing pattern directory exits 1")
        void missingPatterns() {
            envVars.put("PATTERNS_DIR", "nowhere");

            assertThat(run("x")).isEqualTo(ConverterApp.EXIT_STARTUP_FAILURE);
            assertThat(stderr()).contains("Pattern directory does not exist");
        }

        @Test
        @DisplayName("a broken pattern in strict mode exits 1")
        void strictBrokenPattern() throws IOException {
            Files.writeString(workDir.resolve("patterns").resolve("basic.yaml"), """
                    patterns:
                      - id: broken
                        pattern: '(unclosed'
                        output_template: 'x'
                    """);

            assertThat(run("x")).isEqualTo(ConverterApp.EXIT_STARTUP_FAILURE);
            assertThat(stderr()).startsWith("error: ");
        }

        @Test
        @DisplayName("lenient mode skips the broken pattern and keeps converting")
        void lenientBrokenPattern() throws IOException {
            Files.writeString(workDir.resolve("patterns").resolve("basic.yaml"), """
                    patterns:
                      - id: broken
                        pattern: '(unclosed'
                        output_template: 'x'
                      - id: alpha
                        pattern: '\\\\alpha'
                        output_template: 'alpha'
                    """);
            envVars.put("PATTERNS_LOAD_MODE", "lenient");

            assertThat(run("\\alpha")).isEqualTo(ConverterApp.EXIT_OK);
            assertThat(stdoutLines()).containsExactly("Alpha");
        }
    }

    @Test
    @DisplayName("without a config file in the working directory the defaults apply")
    void noConfigFile() throws IOException {
        Files.delete(workDir.resolve("math-speech.yaml"));

        assertThat(run("\\alpha")).isEqualTo(ConverterApp.EXIT_OK);
        assertThat(stdoutLines()).containsExactly("Alpha");
    }
}
