package io.mathspeech.core.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.mathspeech.core.error.PatternLoadException;
import io.mathspeech.core.pattern.Pattern;
import io.mathspeech.core.pattern.PatternCompileCache;
import io.mathspeech.core.store.InMemoryPatternStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a pattern library directory.
 *
 * <p>
 * The directory's {@value #MASTER_FILE} lists the pattern files to load, in order:
 *
 * <pre>
 * pattern_files:
 *   - path: basic/fractions.yaml
 *     enabled: true
 *     priority_offset: 0
 * </pre>
 *
 * Unknown keys in the master file are rejected. Paths are resolved against the directory and may
 * not escape it. Without a master file every {@code *.yaml}/{@code *.yml} file under the
 * directory is loaded in path order. A pattern id defined again by a later file replaces the
 * earlier definition.
 *
 * <p>
 * In {@link LoadMode#STRICT} the first failure aborts the load; in {@link LoadMode#LENIENT} bad
 * patterns and unreadable files are logged, reported and skipped.
 */
public final class PatternLibraryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PatternLibraryLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Name of the index file inside a library directory. */
    public static final String MASTER_FILE = "master_patterns.yaml";

    private static final Set<String> KNOWN_MASTER_KEYS = Set.of("metadata", "pattern_files");
    private static final Set<String> KNOWN_ENTRY_KEYS = Set.of("path", "enabled", "priority_offset");

    private final PatternFileParser parser;
    private final LoadMode mode;

    public PatternLibraryLoader(LoadMode mode) {
        this(new PatternFileParser(new PatternCompileCache()), mode);
    }

    public PatternLibraryLoader(PatternFileParser parser, LoadMode mode) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public LoadMode mode() {
        return mode;
    }

    /**
     * Loads the library in {@code directory}.
     *
     * @throws PatternLoadException if the directory or master file is unusable, or, in strict
     *     mode, on the first bad file or pattern
     */
    public LoadReport load(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        if (!Files.isDirectory(directory)) {
            throw new PatternLoadException("Pattern directory does not exist: " + directory, null, directory.toString());
        }
        List<FileEntry> entries = Files.exists(directory.resolve(MASTER_FILE))
                ? readMaster(directory)
                : scanDirectory(directory);

        Map<String, Pattern> patterns = new LinkedHashMap<>();
        List<LoadReport.Rejection> rejected = new ArrayList<>();
        int filesLoaded = 0;
        for (FileEntry entry : entries) {
            if (!entry.enabled()) {
                LOG.debug("patterns.file_skipped path={} reason=disabled", entry.path());
                continue;
            }
            PatternFile file;
            try {
                file = parser.parse(entry.path(), entry.priorityOffset());
            } catch (PatternLoadException e) {
                if (mode == LoadMode.STRICT) {
                    throw e;
                }
                LOG.warn("patterns.file_rejected path={} reason={}", entry.path(), e.getMessage());
                rejected.add(new LoadReport.Rejection(entry.path().toString(), null, e.getMessage()));
                continue;
            }
            filesLoaded++;
            for (PatternLoadException failure : file.failures()) {
                if (mode == LoadMode.STRICT) {
                    throw failure;
                }
                LOG.warn(
                        "patterns.pattern_rejected path={} id={} reason={}",
                        file.source(),
                        failure.patternId(),
                        failure.getMessage());
                rejected.add(new LoadReport.Rejection(file.source(), failure.patternId(), failure.getMessage()));
            }
            for (Pattern p : file.patterns()) {
                if (patterns.put(p.id(), p) != null) {
                    LOG.info("patterns.overridden id={} path={}", p.id(), file.source());
                }
            }
            LOG.debug("patterns.file_loaded path={} count={}", file.source(), file.patterns().size());
        }
        LOG.info(
                "patterns.loaded directory={} files={} patterns={} rejected={} mode={}",
                directory,
                filesLoaded,
                patterns.size(),
                rejected.size(),
                mode);
        return new LoadReport(new ArrayList<>(patterns.values()), rejected, filesLoaded);
    }

    /**
     * Loads {@code directory} and atomically replaces the content of {@code store} with the
     * result. On failure the store keeps its previous content.
     */
    public LoadReport loadInto(InMemoryPatternStore store, Path directory) {
        LoadReport report = load(directory);
        store.reload(report.patterns());
        return report;
    }

    private List<FileEntry> readMaster(Path directory) {
        Path master = directory.resolve(MASTER_FILE);
        String source = master.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(master.toFile());
        } catch (IOException e) {
            throw new PatternLoadException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        if (root == null || !root.isObject()) {
            throw new PatternLoadException("Master file must be a YAML mapping", null, source);
        }
        rejectUnknownKeys(root, KNOWN_MASTER_KEYS, "master", source);
        JsonNode files = root.get("pattern_files");
        if (files == null || !files.isArray()) {
            throw new PatternLoadException("Missing or invalid required field: 'pattern_files'", null, source);
        }

        Path base = directory.toAbsolutePath().normalize();
        List<FileEntry> entries = new ArrayList<>();
        for (JsonNode node : files) {
            rejectUnknownKeys(node, KNOWN_ENTRY_KEYS, "pattern_files[]", source);
            JsonNode pathNode = node.get("path");
            if (pathNode == null || !pathNode.isTextual() || pathNode.asText().isBlank()) {
                throw new PatternLoadException("Missing or invalid required field: 'path'", null, source);
            }
            Path resolved = base.resolve(pathNode.asText()).normalize();
            if (!resolved.startsWith(base)) {
                throw new PatternLoadException(
                        "Pattern file path escapes the library directory: " + pathNode.asText(), null, source);
            }
            entries.add(new FileEntry(
                    resolved, node.path("enabled").asBoolean(true), node.path("priority_offset").asInt(0)));
        }
        return entries;
    }

    private static List<FileEntry> scanDirectory(Path directory) {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .map(p -> new FileEntry(p, true, 0))
                    .toList();
        } catch (IOException e) {
            throw new PatternLoadException(
                    "Failed to list pattern directory: " + e.getMessage(), e, null, directory.toString());
        }
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> knownKeys, String blockName, String source) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new PatternLoadException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + "; recognized keys are: " + knownKeys.stream().sorted().toList(),
                    null,
                    source);
        }
    }

    private record FileEntry(Path path, boolean enabled, int priorityOffset) {}
}
