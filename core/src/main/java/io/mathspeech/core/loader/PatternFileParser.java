package io.mathspeech.core.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.mathspeech.core.error.PatternException;
import io.mathspeech.core.error.PatternLoadException;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.model.Priority;
import io.mathspeech.core.model.PriorityTier;
import io.mathspeech.core.model.PronunciationHint;
import io.mathspeech.core.pattern.MatchType;
import io.mathspeech.core.pattern.Pattern;
import io.mathspeech.core.pattern.PatternCompileCache;
import io.mathspeech.core.pattern.PatternCondition;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses YAML pattern files into {@link Pattern} instances.
 *
 * <p>
 * A file has an optional {@code metadata} block and a {@code patterns} list. The document is
 * validated against the bundled {@code schema/pattern-file.schema.json} before any entry is
 * mapped; a structural violation, like unreadable YAML, fails the whole file with a
 * {@link PatternLoadException}. Entries that pass the schema but cannot be built (bad regex,
 * unknown domain, template referencing a missing group) are collected in
 * {@link PatternFile#failures()} so the caller can choose between strict and lenient loading.
 *
 * <p>
 * Unknown context names map to {@code ANY}; unknown domains are errors. An entry without a
 * domain takes {@code metadata.domain}, or {@code general}.
 *
 * <p>
 * Thread-safe if the supplied {@link PatternCompileCache} is (it is).
 */
public final class PatternFileParser {

    private static final String SCHEMA_RESOURCE = "/schema/pattern-file.schema.json";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final JsonSchema FILE_SCHEMA = loadSchema();

    private final PatternCompileCache compileCache;

    public PatternFileParser(PatternCompileCache compileCache) {
        this.compileCache = Objects.requireNonNull(compileCache, "compileCache must not be null");
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = PatternFileParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }

    public PatternFile parse(Path path) {
        return parse(path, 0);
    }

    /**
     * Parses the file at {@code path}, shifting every entry's priority by {@code priorityOffset}.
     *
     * @throws PatternLoadException if the file cannot be read or violates the schema
     */
    public PatternFile parse(Path path, int priorityOffset) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root = readYaml(path, source);
        validateStructure(root, source);

        JsonNode metadata = root.path("metadata");
        String description = metadata.path("description").asText("");
        Domain defaultDomain = Domain.GENERAL;
        if (metadata.hasNonNull("domain")) {
            defaultDomain = parseDomain(metadata.get("domain").asText(), null, source);
        }

        List<Pattern> patterns = new ArrayList<>();
        List<PatternLoadException> failures = new ArrayList<>();
        for (JsonNode entry : root.path("patterns")) {
            String id = entry.path("id").asText();
            try {
                patterns.add(toPattern(entry, defaultDomain, priorityOffset, source));
            } catch (PatternLoadException e) {
                failures.add(e);
            } catch (PatternException | IllegalArgumentException e) {
                failures.add(new PatternLoadException(
                        "Invalid pattern '" + id + "': " + e.getMessage(), e, id, source));
            }
        }
        return new PatternFile(source, description, patterns, failures);
    }

    private Pattern toPattern(JsonNode entry, Domain defaultDomain, int priorityOffset, String source) {
        String id = entry.get("id").asText();
        Domain domain = entry.hasNonNull("domain")
                ? parseDomain(entry.get("domain").asText(), id, source)
                : defaultDomain;
        Pattern.Builder b = Pattern.builder()
                .compileCache(compileCache)
                .id(id)
                .name(optionalString(entry, "name"))
                .description(optionalString(entry, "description"))
                .matcher(entry.get("pattern").asText())
                .matchType(parseMatchType(optionalString(entry, "pattern_type")))
                .template(entry.get("output_template").asText())
                .priority(parsePriority(entry.get("priority")).plus(priorityOffset))
                .domain(domain)
                .contexts(parseContexts(entry.get("contexts")))
                .enabled(entry.path("enabled").asBoolean(true));

        for (JsonNode c : entry.path("conditions")) {
            b.condition(new PatternCondition(
                    PatternCondition.Type.fromId(c.get("type").asText()),
                    c.get("value").asText(),
                    c.path("negate").asBoolean(false)));
        }
        for (JsonNode t : entry.path("tags")) {
            b.tag(t.asText());
        }
        for (JsonNode ex : entry.path("examples")) {
            b.example(ex.get("input").asText(), ex.get("output").asText());
        }
        if (entry.hasNonNull("pronunciation_hints")) {
            b.hint(parseHint(entry.get("pronunciation_hints")));
        }
        if (entry.hasNonNull("version")) {
            b.version(entry.get("version").asText());
        }
        if (entry.hasNonNull("naturalness_score")) {
            b.naturalnessScore(entry.get("naturalness_score").asDouble());
        }
        return b.build();
    }

    private static MatchType parseMatchType(String value) {
        if (value == null) {
            return MatchType.REGEX;
        }
        return MatchType.valueOf(value.toUpperCase(Locale.ROOT));
    }

    private static Priority parsePriority(JsonNode node) {
        if (node == null || node.isNull()) {
            return Priority.medium();
        }
        if (node.isTextual()) {
            return Priority.of(PriorityTier.valueOf(node.asText().toUpperCase(Locale.ROOT)));
        }
        return Priority.of(node.asInt());
    }

    private static Domain parseDomain(String value, String patternId, String source) {
        try {
            return Domain.fromId(value);
        } catch (IllegalArgumentException e) {
            throw new PatternLoadException(e.getMessage(), e, patternId, source);
        }
    }

    private static Set<ExpressionContext> parseContexts(JsonNode node) {
        Set<ExpressionContext> contexts = new LinkedHashSet<>();
        if (node == null || node.isNull()) {
            return contexts;
        }
        if (node.isTextual()) {
            contexts.add(ExpressionContext.lookup(node.asText()).orElse(ExpressionContext.ANY));
            return contexts;
        }
        for (JsonNode c : node) {
            contexts.add(ExpressionContext.lookup(c.asText()).orElse(ExpressionContext.ANY));
        }
        return contexts;
    }

    private static PronunciationHint parseHint(JsonNode node) {
        return new PronunciationHint(
                optionalString(node, "emphasis"),
                node.hasNonNull("pause_before") ? node.get("pause_before").asInt() : null,
                node.hasNonNull("pause_after") ? node.get("pause_after").asInt() : null,
                node.hasNonNull("rate") ? node.get("rate").asDouble() : null,
                node.hasNonNull("pitch") ? node.get("pitch").asDouble() : null,
                node.hasNonNull("volume") ? node.get("volume").asDouble() : null);
    }

    private static JsonNode readYaml(Path path, String source) {
        try {
            JsonNode root = YAML_MAPPER.readTree(path.toFile());
            if (root == null || !root.isObject()) {
                throw new PatternLoadException("Pattern file must be a YAML mapping", null, source);
            }
            return root;
        } catch (IOException e) {
            throw new PatternLoadException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
    }

    private static void validateStructure(JsonNode root, String source) {
        Set<ValidationMessage> errors = FILE_SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new PatternLoadException("Pattern file violates schema: " + detail, null, source);
        }
    }

    private static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
