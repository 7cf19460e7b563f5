package io.mathspeech.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link ConverterConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Layout:
 *
 * <pre>
 * patterns:
 *   dir: ./patterns
 *   load-mode: lenient
 * engine:
 *   max-iterations: 10
 * validation:
 *   max-length: 10000
 *   max-nesting: 20
 * cache:
 *   enabled: true
 *   max-size: 1000
 *   ttl-seconds: 3600
 * output:
 *   default-audience: undergraduate
 * logging:
 *   format: text
 *   level: INFO
 *   pattern: "%d{HH:mm:ss.SSS} %-5level %logger{24} - %msg%n"
 *   rewrite-trace: false
 * </pre>
 *
 * Missing keys receive the defaults from {@link ConverterConfig.Builder}.
 *
 * <p>
 * Every key can be overridden by an environment variable, which takes precedence over the
 * YAML value. A variable counts as set only if it is defined and non-blank after trimming;
 * blank values leave the YAML value in place.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file looked up in the working directory when {@code --config} is absent. */
    public static final String DEFAULT_CONFIG_FILE = "math-speech.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the file at {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, not valid YAML or holds bad values
     */
    public static ConverterConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the file at {@code configPath}, applying overrides from {@code envLookup}. The lookup
     * returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, not valid YAML or holds bad values
     */
    public static ConverterConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return map(root != null ? root : MissingNode.getInstance(), envLookup, configPath.toString());
    }

    /** Defaults plus environment overrides, for runs without a config file. */
    public static ConverterConfig defaults(Function<String, String> envLookup) {
        return map(MissingNode.getInstance(), envLookup, "defaults");
    }

    private static ConverterConfig map(JsonNode root, Function<String, String> envLookup, String source) {
        try {
            ConverterConfig.Builder builder = ConverterConfig.builder();
            applyYaml(builder, root);
            applyEnvOverrides(builder, envLookup);
            return builder.build();
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid configuration (" + source + "): " + e.getMessage(), e);
        }
    }

    private static void applyYaml(ConverterConfig.Builder builder, JsonNode root) {
        JsonNode patterns = root.path("patterns");
        if (patterns.has("dir")) builder.patternsDir(patterns.get("dir").asText());
        if (patterns.has("load-mode")) builder.patternsLoadMode(patterns.get("load-mode").asText());

        JsonNode engine = root.path("engine");
        if (engine.has("max-iterations")) builder.engineMaxIterations(engine.get("max-iterations").asInt());

        JsonNode validation = root.path("validation");
        if (validation.has("max-length")) builder.validationMaxLength(validation.get("max-length").asInt());
        if (validation.has("max-nesting")) builder.validationMaxNesting(validation.get("max-nesting").asInt());

        JsonNode cache = root.path("cache");
        if (cache.has("enabled")) builder.cacheEnabled(cache.get("enabled").asBoolean());
        if (cache.has("max-size")) builder.cacheMaxSize(cache.get("max-size").asInt());
        if (cache.has("ttl-seconds")) builder.cacheTtlSeconds(cache.get("ttl-seconds").asLong());

        JsonNode output = root.path("output");
        if (output.has("default-audience")) builder.defaultAudience(output.get("default-audience").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        if (logging.has("pattern")) builder.loggingPattern(logging.get("pattern").asText());
        if (logging.has("rewrite-trace")) builder.loggingRewriteTrace(logging.get("rewrite-trace").asBoolean());
    }

    private static void applyEnvOverrides(ConverterConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "PATTERNS_DIR", builder::patternsDir);
        envString(envLookup, "PATTERNS_LOAD_MODE", builder::patternsLoadMode);
        envString(envLookup, "DEFAULT_AUDIENCE", builder::defaultAudience);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "LOG_PATTERN", builder::loggingPattern);

        envInt(envLookup, "ENGINE_MAX_ITERATIONS", builder::engineMaxIterations);
        envInt(envLookup, "VALIDATION_MAX_LENGTH", builder::validationMaxLength);
        envInt(envLookup, "VALIDATION_MAX_NESTING", builder::validationMaxNesting);
        envInt(envLookup, "CACHE_MAX_SIZE", builder::cacheMaxSize);
        envLong(envLookup, "CACHE_TTL_SECONDS", builder::cacheTtlSeconds);

        envBool(envLookup, "CACHE_ENABLED", builder::cacheEnabled);
        envBool(envLookup, "LOG_REWRITE_TRACE", builder::loggingRewriteTrace);
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseNumber(envVar, envLookup.apply(envVar), Integer::parseInt));
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseNumber(envVar, envLookup.apply(envVar), Long::parseLong));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static <T> T parseNumber(String envVar, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(envVar + " is not a number: " + raw.trim(), e);
        }
    }
}
