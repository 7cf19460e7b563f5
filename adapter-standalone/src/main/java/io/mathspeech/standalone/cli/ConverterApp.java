package io.mathspeech.standalone.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mathspeech.core.analysis.ExpressionAnalyzer;
import io.mathspeech.core.engine.PostProcessor;
import io.mathspeech.core.engine.RewriteEngine;
import io.mathspeech.core.error.ExpressionValidationException;
import io.mathspeech.core.error.PatternLoadException;
import io.mathspeech.core.error.RewriteProcessingException;
import io.mathspeech.core.expression.ExpressionValidator;
import io.mathspeech.core.loader.ExampleVerifier;
import io.mathspeech.core.loader.LoadReport;
import io.mathspeech.core.loader.PatternLibraryLoader;
import io.mathspeech.core.model.SpeechText;
import io.mathspeech.core.pattern.PatternUsage;
import io.mathspeech.core.service.CaffeineResultCache;
import io.mathspeech.core.service.ConversionRequest;
import io.mathspeech.core.service.ConversionResult;
import io.mathspeech.core.service.CoverageReport;
import io.mathspeech.core.service.MathSpeechService;
import io.mathspeech.core.service.ResultCache;
import io.mathspeech.core.store.InMemoryPatternStore;
import io.mathspeech.standalone.config.ConfigLoadException;
import io.mathspeech.standalone.config.ConfigLoader;
import io.mathspeech.standalone.config.ConverterConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line converter: loads configuration and the pattern library, then converts each
 * expression given as an argument (or each non-blank line of standard input) and writes one
 * result line per expression.
 *
 * <p>
 * Startup sequence:
 * <ol>
 * <li>parse arguments;</li>
 * <li>load configuration: {@code --config} file, else {@value ConfigLoader#DEFAULT_CONFIG_FILE}
 * if present, else defaults; environment overrides apply in every case;</li>
 * <li>configure logging;</li>
 * <li>load the pattern library into the store and check each pattern's documented examples;</li>
 * <li>assemble validator, engine, cache and service.</li>
 * </ol>
 *
 * <p>
 * Exit codes: {@value #EXIT_OK} when every expression converted, {@value #EXIT_CONVERSION_FAILURES}
 * when any was rejected or fell back, {@value #EXIT_STARTUP_FAILURE} when startup failed.
 *
 * <p>
 * With {@code --coverage} nothing is converted: the expressions are matched against the loaded
 * patterns and a single coverage report is written instead, exiting {@value #EXIT_OK}.
 */
public final class ConverterApp {

    private static final Logger LOG = LoggerFactory.getLogger(ConverterApp.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    public static final int EXIT_OK = 0;
    public static final int EXIT_STARTUP_FAILURE = 1;
    public static final int EXIT_CONVERSION_FAILURES = 2;

    private final Function<String, String> envLookup;
    private final Path workingDirectory;

    /** App reading the process environment and the current directory. */
    public ConverterApp() {
        this(System::getenv, Path.of(""));
    }

    /**
     * @param envLookup        environment variable lookup, {@code null} for undefined
     * @param workingDirectory where {@value ConfigLoader#DEFAULT_CONFIG_FILE} is looked up
     */
    public ConverterApp(Function<String, String> envLookup, Path workingDirectory) {
        this.envLookup = envLookup;
        this.workingDirectory = workingDirectory;
    }

    /**
     * Runs the converter.
     *
     * @return the process exit code
     */
    public int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        CliArguments cli;
        ConverterConfig config;
        MathSpeechService service;
        PatternUsage usage = new PatternUsage();
        try {
            cli = CliArguments.parse(args);
            config = loadConfig(cli.configPath());
            LogbackConfigurator.configure(config);
            service = startService(config, usage);
        } catch (ConfigLoadException | PatternLoadException | IllegalArgumentException e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            err.println("error: " + e.getMessage());
            return EXIT_STARTUP_FAILURE;
        }

        List<String> expressions;
        try {
            expressions = cli.expressions().isEmpty() ? readLines(in) : cli.expressions();
        } catch (IOException e) {
            LOG.error("Failed to read standard input: {}", e.getMessage(), e);
            err.println("error: failed to read standard input: " + e.getMessage());
            return EXIT_STARTUP_FAILURE;
        }

        if (cli.coverage()) {
            CoverageReport report = service.analyzeCoverage(expressions);
            out.println(cli.format() == OutputFormat.JSON ? toJson(report) : toText(report));
            out.flush();
            return EXIT_OK;
        }

        List<ConversionRequest> requests = new ArrayList<>(expressions.size());
        for (String latex : expressions) {
            requests.add(new ConversionRequest(
                    latex,
                    cli.audience() != null ? cli.audience() : config.audience(),
                    cli.domain(),
                    cli.contextType()));
        }
        List<ConversionResult> results = service.convertAll(requests);

        int failures = 0;
        for (ConversionResult result : results) {
            if (!result.isSuccess()) {
                failures++;
            }
            out.println(cli.format() == OutputFormat.JSON ? toJson(result) : toText(result));
        }
        out.flush();
        logSummary(results.size(), failures, usage, service);
        return failures == 0 ? EXIT_OK : EXIT_CONVERSION_FAILURES;
    }

    private ConverterConfig loadConfig(Path explicitPath) {
        if (explicitPath != null) {
            return ConfigLoader.load(explicitPath, envLookup);
        }
        Path defaultPath = workingDirectory.resolve(ConfigLoader.DEFAULT_CONFIG_FILE);
        if (Files.exists(defaultPath)) {
            return ConfigLoader.load(defaultPath, envLookup);
        }
        LOG.debug("config.defaults reason=no {} in working directory", ConfigLoader.DEFAULT_CONFIG_FILE);
        return ConfigLoader.defaults(envLookup);
    }

    private MathSpeechService startService(ConverterConfig config, PatternUsage usage) {
        Path patternsDir = workingDirectory.resolve(config.patternsDir());
        InMemoryPatternStore store = new InMemoryPatternStore();
        LoadReport report = new PatternLibraryLoader(config.loadMode()).loadInto(store, patternsDir);
        if (report.patterns().isEmpty()) {
            LOG.warn("patterns.empty directory={} rejected={}", patternsDir, report.rejected().size());
        }
        for (ExampleVerifier.Mismatch m : new ExampleVerifier().verify(report.patterns())) {
            LOG.warn(
                    "patterns.example_mismatch id={} input={} expected={} actual={}",
                    m.patternId(),
                    m.input(),
                    m.expected(),
                    m.actual());
        }

        RewriteEngine engine = new RewriteEngine(
                store, new ExpressionAnalyzer(), new PostProcessor(), config.engineConfig(), usage, null);
        ResultCache cache = config.cacheEnabled()
                ? new CaffeineResultCache(config.cacheMaxSize(), config.cacheTtl())
                : null;
        LOG.info(
                "converter.started patterns={} mode={} max_iterations={} cache={}",
                store.size(),
                config.loadMode(),
                config.engineMaxIterations(),
                config.cacheEnabled());
        return new MathSpeechService(new ExpressionValidator(config.validationLimits()), engine, cache);
    }

    private static List<String> readLines(InputStream in) throws IOException {
        List<String> lines = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        return lines;
    }

    static String toText(ConversionResult result) {
        if (result.isRejected()) {
            return "[rejected] " + result.error().getMessage();
        }
        return result.text();
    }

    static String toJson(ConversionResult result) {
        ObjectNode node = JSON_MAPPER.createObjectNode();
        node.put("input", result.request().latex());
        node.put("status", result.type().name().toLowerCase(Locale.ROOT));
        node.put("text", result.text());
        SpeechText speech = result.speech();
        if (speech != null) {
            node.put("domain", speech.domain().id());
            ArrayNode applied = node.putArray("applied_patterns");
            speech.appliedPatternIds().forEach(applied::add);
            node.put("iterations", speech.iterationsUsed());
            node.put("converged", speech.converged());
            node.put("cached", result.cached());
        }
        RuntimeException error = result.error();
        if (error != null) {
            ObjectNode errorNode = node.putObject("error");
            if (error instanceof ExpressionValidationException validation) {
                errorNode.put("kind", validation.kind().name().toLowerCase(Locale.ROOT));
            } else if (error instanceof RewriteProcessingException processing) {
                errorNode.put("stage", processing.stage());
            }
            errorNode.put("message", error.getMessage());
        }
        try {
            return JSON_MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversion result", e);
        }
    }

    static String toText(CoverageReport report) {
        StringBuilder text = new StringBuilder(String.format(
                Locale.ROOT,
                "coverage %.1f%% matched=%d unmatched=%d rejected=%d total=%d",
                report.coveragePercentage(),
                report.matched(),
                report.unmatched(),
                report.rejected(),
                report.total()));
        report.patternUsage().forEach((id, count) -> text.append(System.lineSeparator())
                .append("pattern ")
                .append(id)
                .append(' ')
                .append(count));
        report.unmatchedSamples().forEach(sample -> text.append(System.lineSeparator())
                .append("unmatched ")
                .append(sample));
        return text.toString();
    }

    static String toJson(CoverageReport report) {
        ObjectNode node = JSON_MAPPER.createObjectNode();
        node.put("total", report.total());
        node.put("matched", report.matched());
        node.put("unmatched", report.unmatched());
        node.put("rejected", report.rejected());
        node.put("coverage_percentage", report.coveragePercentage());
        ObjectNode usage = node.putObject("pattern_usage");
        report.patternUsage().forEach((id, count) -> usage.put(id, count.longValue()));
        ArrayNode samples = node.putArray("unmatched_samples");
        report.unmatchedSamples().forEach(samples::add);
        try {
            return JSON_MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize coverage report", e);
        }
    }

    private static void logSummary(int total, int failures, PatternUsage usage, MathSpeechService service) {
        LOG.info("conversion.summary total={} succeeded={} failed={}", total, total - failures, failures);
        if (LOG.isDebugEnabled()) {
            for (Map.Entry<String, PatternUsage.Snapshot> e : usage.snapshotAll().entrySet()) {
                PatternUsage.Snapshot s = e.getValue();
                LOG.debug(
                        "pattern.usage id={} hits={} misses={} errors={}", e.getKey(), s.hits(), s.misses(), s.errors());
            }
            service.cache().ifPresent(c -> LOG.debug("cache.statistics {}", c.statistics()));
        }
    }
}
