package io.mathspeech.standalone.config;

import io.mathspeech.core.engine.EngineConfig;
import io.mathspeech.core.expression.ValidationLimits;
import io.mathspeech.core.loader.LoadMode;
import io.mathspeech.core.model.AudienceLevel;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Root configuration for the command-line converter.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param patternsDir         directory holding the pattern library
 * @param patternsLoadMode    {@code strict} or {@code lenient}
 * @param engineMaxIterations fixpoint iteration budget per expression
 * @param validationMaxLength maximum expression length in characters
 * @param validationMaxNesting maximum brace nesting depth
 * @param cacheEnabled        whether results are cached across expressions of one run
 * @param cacheMaxSize        maximum number of cached results
 * @param cacheTtlSeconds     cached result lifetime, 0 for no expiry
 * @param defaultAudience     audience used when {@code --audience} is absent
 * @param loggingFormat       {@code json} or {@code text}
 * @param loggingLevel        root log level
 * @param loggingPattern      Logback pattern for text format
 * @param loggingRewriteTrace whether the rewrite engine logs each applied pattern at DEBUG,
 *                            independent of the root level
 */
public record ConverterConfig(
        String patternsDir,
        String patternsLoadMode,
        int engineMaxIterations,
        int validationMaxLength,
        int validationMaxNesting,
        boolean cacheEnabled,
        int cacheMaxSize,
        long cacheTtlSeconds,
        String defaultAudience,
        String loggingFormat,
        String loggingLevel,
        String loggingPattern,
        boolean loggingRewriteTrace) {

    /** Text layout used when {@code logging.pattern} is absent. */
    public static final String DEFAULT_LOGGING_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{24} - %msg%n";

    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");
    private static final String LOG_LEVELS_TEXT = "TRACE, DEBUG, INFO, WARN, ERROR, OFF";

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parsed load mode.
     *
     * @throws IllegalArgumentException if the value is neither strict nor lenient
     */
    public LoadMode loadMode() {
        return LoadMode.valueOf(patternsLoadMode.trim().toUpperCase(Locale.ROOT));
    }

    /** Engine settings derived from this configuration. */
    public EngineConfig engineConfig() {
        return new EngineConfig(engineMaxIterations);
    }

    /** Validator limits: the defaults with length and nesting replaced. */
    public ValidationLimits validationLimits() {
        return ValidationLimits.DEFAULT.withMaxLength(validationMaxLength).withMaxNesting(validationMaxNesting);
    }

    public AudienceLevel audience() {
        return AudienceLevel.fromId(defaultAudience);
    }

    /** Cache entry lifetime, or {@code null} when entries never expire. */
    public Duration cacheTtl() {
        return cacheTtlSeconds > 0 ? Duration.ofSeconds(cacheTtlSeconds) : null;
    }

    /** Whether logs are written as JSON lines rather than with {@link #loggingPattern()}. */
    public boolean jsonLogging() {
        return "json".equalsIgnoreCase(loggingFormat);
    }

    /** Root log level name, upper case. */
    public String rootLogLevel() {
        return loggingLevel.trim().toUpperCase(Locale.ROOT);
    }

    /** Builder for {@link ConverterConfig}. */
    public static final class Builder {
        private String patternsDir = "./patterns";
        private String patternsLoadMode = "lenient";
        private int engineMaxIterations = EngineConfig.DEFAULT.maxIterations();
        private int validationMaxLength = ValidationLimits.DEFAULT.maxLength();
        private int validationMaxNesting = ValidationLimits.DEFAULT.maxNesting();
        private boolean cacheEnabled = true;
        private int cacheMaxSize = 1000;
        private long cacheTtlSeconds = 3600;
        private String defaultAudience = "undergraduate";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private String loggingPattern = DEFAULT_LOGGING_PATTERN;
        private boolean loggingRewriteTrace = false;

        Builder() {}

        public Builder patternsDir(String patternsDir) {
            this.patternsDir = patternsDir;
            return this;
        }

        public Builder patternsLoadMode(String patternsLoadMode) {
            this.patternsLoadMode = patternsLoadMode;
            return this;
        }

        public Builder engineMaxIterations(int engineMaxIterations) {
            this.engineMaxIterations = engineMaxIterations;
            return this;
        }

        public Builder validationMaxLength(int validationMaxLength) {
            this.validationMaxLength = validationMaxLength;
            return this;
        }

        public Builder validationMaxNesting(int validationMaxNesting) {
            this.validationMaxNesting = validationMaxNesting;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheMaxSize(int cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder cacheTtlSeconds(long cacheTtlSeconds) {
            this.cacheTtlSeconds = cacheTtlSeconds;
            return this;
        }

        public Builder defaultAudience(String defaultAudience) {
            this.defaultAudience = defaultAudience;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder loggingPattern(String loggingPattern) {
            this.loggingPattern = loggingPattern;
            return this;
        }

        public Builder loggingRewriteTrace(boolean loggingRewriteTrace) {
            this.loggingRewriteTrace = loggingRewriteTrace;
            return this;
        }

        /**
         * Builds the configuration, checking every value the converter will parse later.
         *
         * @throws IllegalArgumentException if a value is out of range or not in its vocabulary
         */
        public ConverterConfig build() {
            ConverterConfig config = new ConverterConfig(
                    patternsDir,
                    patternsLoadMode,
                    engineMaxIterations,
                    validationMaxLength,
                    validationMaxNesting,
                    cacheEnabled,
                    cacheMaxSize,
                    cacheTtlSeconds,
                    defaultAudience,
                    loggingFormat,
                    loggingLevel,
                    loggingPattern,
                    loggingRewriteTrace);
            config.loadMode();
            config.engineConfig();
            config.validationLimits();
            config.audience();
            if (cacheMaxSize <= 0) {
                throw new IllegalArgumentException("cache max-size must be positive, got: " + cacheMaxSize);
            }
            if (cacheTtlSeconds < 0) {
                throw new IllegalArgumentException("cache ttl-seconds must not be negative, got: " + cacheTtlSeconds);
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new IllegalArgumentException("logging format must be json or text, got: " + loggingFormat);
            }
            if (loggingLevel == null || !LOG_LEVELS.contains(config.rootLogLevel())) {
                throw new IllegalArgumentException(
                        "logging level must be one of " + LOG_LEVELS_TEXT + ", got: " + loggingLevel);
            }
            if (loggingPattern == null || loggingPattern.isBlank()) {
                throw new IllegalArgumentException("logging pattern must not be blank");
            }
            return config;
        }
    }
}
