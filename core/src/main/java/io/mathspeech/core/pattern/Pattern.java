package io.mathspeech.core.pattern;

import io.mathspeech.core.error.PatternApplyException;
import io.mathspeech.core.error.PatternCompileException;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.model.Priority;
import io.mathspeech.core.model.PronunciationHint;
import io.mathspeech.core.model.RewriteContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable rewrite rule: a matcher (regex or literal), an output template and the metadata that
 * decides when the rule is a candidate.
 *
 * <p>
 * All structural checks run in {@link Builder#build()}: a pattern that exists has a compiled
 * matcher and a template whose group references the matcher can satisfy. {@link #matches} and
 * {@link #apply} are pure; usage counters live in {@link PatternUsage}.
 *
 * <p>
 * Thread-safe.
 */
public final class Pattern {

    /** Version given to patterns that do not declare one. */
    public static final String DEFAULT_VERSION = "1.0.0";

    private static final java.util.regex.Pattern VERSION_FORMAT =
            java.util.regex.Pattern.compile("(\\d+)\\.(\\d+)\\.(\\d+)");

    private final String id;
    private final String name;
    private final String description;
    private final String matcher;
    private final MatchType matchType;
    private final int flags;
    private final java.util.regex.Pattern regex;
    private final OutputTemplate template;
    private final Priority priority;
    private final Domain domain;
    private final Set<ExpressionContext> contexts;
    private final List<PatternCondition> conditions;
    private final PronunciationHint hint;
    private final Set<String> tags;
    private final List<PatternExample> examples;
    private final String version;
    private final boolean enabled;
    private final Double naturalnessScore;

    private Pattern(Builder b, java.util.regex.Pattern regex, OutputTemplate template) {
        this.id = b.id;
        this.name = b.name != null && !b.name.isBlank() ? b.name : "pattern_" + b.id;
        this.description = b.description != null ? b.description : "";
        this.matcher = b.matcher;
        this.matchType = b.matchType;
        this.flags = b.flags;
        this.regex = regex;
        this.template = template;
        this.priority = b.priority;
        this.domain = b.domain;
        this.contexts = b.contexts.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.of(ExpressionContext.ANY))
                : Collections.unmodifiableSet(EnumSet.copyOf(b.contexts));
        this.conditions = List.copyOf(b.conditions);
        this.hint = b.hint != null ? b.hint : PronunciationHint.NONE;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(b.tags));
        this.examples = List.copyOf(b.examples);
        this.version = b.version;
        this.enabled = b.enabled;
        this.naturalnessScore = b.naturalnessScore;
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- matching ---

    /**
     * Whether this pattern fires on {@code text}: every precondition holds (each possibly
     * negated), then the matcher is found in the text.
     *
     * @throws PatternApplyException if the regex engine fails on this input
     */
    public boolean matches(String text, RewriteContext context) {
        for (PatternCondition condition : conditions) {
            if (!condition.evaluate(context)) {
                return false;
            }
        }
        return textMatches(text);
    }

    private boolean textMatches(String text) {
        if (matchType == MatchType.LITERAL) {
            return text.contains(matcher);
        }
        try {
            return regex.matcher(text).find();
        } catch (RuntimeException | StackOverflowError e) {
            throw new PatternApplyException("error matching pattern: " + e, e, id);
        }
    }

    /**
     * Replaces every non-overlapping occurrence of the matcher with the expanded template. Returns
     * the input unchanged, with {@code applied == false}, if {@link #matches} is false.
     *
     * @throws PatternApplyException if expansion fails
     */
    public ApplyOutcome apply(String text, RewriteContext context) {
        if (!matches(text, context)) {
            return ApplyOutcome.unchanged(text);
        }
        if (matchType == MatchType.LITERAL) {
            return new ApplyOutcome(text.replace(matcher, template.source()), true);
        }
        try {
            Matcher m = regex.matcher(text);
            StringBuilder out = new StringBuilder(text.length());
            int last = 0;
            while (m.find()) {
                out.append(text, last, m.start());
                out.append(template.expand(m));
                last = m.end();
            }
            out.append(text, last, text.length());
            return new ApplyOutcome(out.toString(), true);
        } catch (RuntimeException | StackOverflowError e) {
            throw new PatternApplyException("error applying pattern: " + e, e, id);
        }
    }

    /**
     * Every non-overlapping occurrence of the matcher, left to right. Preconditions are ignored.
     *
     * @throws PatternApplyException if the regex engine fails on this input
     */
    public List<MatchSpan> findAllMatches(String text) {
        List<MatchSpan> spans = new ArrayList<>();
        if (matchType == MatchType.LITERAL) {
            int from = 0;
            int at;
            while ((at = text.indexOf(matcher, from)) >= 0) {
                spans.add(new MatchSpan(at, at + matcher.length(), matcher));
                from = at + matcher.length();
            }
            return spans;
        }
        try {
            Matcher m = regex.matcher(text);
            while (m.find()) {
                spans.add(new MatchSpan(m.start(), m.end(), m.group()));
            }
        } catch (RuntimeException | StackOverflowError e) {
            throw new PatternApplyException("error matching pattern: " + e, e, id);
        }
        return spans;
    }

    /** Whether this pattern may run in {@code context}. {@code ANY} on either side always applies. */
    public boolean appliesTo(ExpressionContext context) {
        return context == null
                || context == ExpressionContext.ANY
                || contexts.contains(ExpressionContext.ANY)
                || contexts.contains(context);
    }

    /**
     * Returns an updated copy: {@code changes} edits a builder seeded with this pattern, and the
     * result gets this pattern's version with the patch number bumped.
     *
     * @throws PatternCompileException if the edited pattern is invalid
     */
    public Pattern revise(UnaryOperator<Builder> changes) {
        Builder b = changes.apply(toBuilder());
        return b.version(nextPatchVersion(version)).build();
    }

    /** A builder pre-filled with this pattern's values. */
    public Builder toBuilder() {
        Builder b = new Builder()
                .id(id)
                .name(name)
                .description(description)
                .matcher(matcher)
                .matchType(matchType)
                .flags(flags)
                .template(template.source())
                .priority(priority)
                .domain(domain)
                .contexts(contexts)
                .conditions(conditions)
                .hint(hint)
                .tags(tags)
                .examples(examples)
                .version(version)
                .enabled(enabled)
                .naturalnessScore(naturalnessScore);
        return b;
    }

    static String nextPatchVersion(String version) {
        Matcher m = VERSION_FORMAT.matcher(version);
        if (!m.matches()) {
            throw new IllegalArgumentException("version is not MAJOR.MINOR.PATCH: " + version);
        }
        return m.group(1) + "." + m.group(2) + "." + (Integer.parseInt(m.group(3)) + 1);
    }

    // --- accessors ---

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    /** The matcher as written (regex source or literal text). */
    public String matcher() {
        return matcher;
    }

    public MatchType matchType() {
        return matchType;
    }

    /** The output template as written. */
    public String template() {
        return template.source();
    }

    public Priority priority() {
        return priority;
    }

    public Domain domain() {
        return domain;
    }

    public Set<ExpressionContext> contexts() {
        return contexts;
    }

    public List<PatternCondition> conditions() {
        return conditions;
    }

    public PronunciationHint hint() {
        return hint;
    }

    public Set<String> tags() {
        return tags;
    }

    public List<PatternExample> examples() {
        return examples;
    }

    public String version() {
        return version;
    }

    public boolean enabled() {
        return enabled;
    }

    /** Author-assigned naturalness rating of the output, or {@code null}. */
    public Double naturalnessScore() {
        return naturalnessScore;
    }

    @Override
    public String toString() {
        return "Pattern[" + id + "@" + version + ", " + matchType + ", priority=" + priority.value() + ", domain="
                + domain.id() + "]";
    }

    /** Builder for {@link Pattern}. Not thread-safe. */
    public static final class Builder {

        private String id;
        private String name;
        private String description;
        private String matcher;
        private MatchType matchType = MatchType.REGEX;
        private int flags;
        private String template;
        private Priority priority = Priority.medium();
        private Domain domain = Domain.GENERAL;
        private final Set<ExpressionContext> contexts = new LinkedHashSet<>();
        private final List<PatternCondition> conditions = new ArrayList<>();
        private PronunciationHint hint;
        private final Set<String> tags = new LinkedHashSet<>();
        private final List<PatternExample> examples = new ArrayList<>();
        private String version = DEFAULT_VERSION;
        private boolean enabled = true;
        private Double naturalnessScore;
        private PatternCompileCache compileCache;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Regex source or literal text, depending on {@link #matchType}. */
        public Builder matcher(String matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder matchType(MatchType matchType) {
            this.matchType = Objects.requireNonNull(matchType, "matchType must not be null");
            return this;
        }

        /** {@link java.util.regex.Pattern} flags for regex matchers. */
        public Builder flags(int flags) {
            this.flags = flags;
            return this;
        }

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = Objects.requireNonNull(priority, "priority must not be null");
            return this;
        }

        public Builder priority(int priority) {
            return priority(Priority.of(priority));
        }

        public Builder domain(Domain domain) {
            this.domain = Objects.requireNonNull(domain, "domain must not be null");
            return this;
        }

        /** Replaces the applicability contexts. Empty means {@code {ANY}}. */
        public Builder contexts(Collection<ExpressionContext> contexts) {
            this.contexts.clear();
            this.contexts.addAll(contexts);
            return this;
        }

        public Builder context(ExpressionContext context) {
            this.contexts.add(context);
            return this;
        }

        public Builder conditions(Collection<PatternCondition> conditions) {
            this.conditions.clear();
            this.conditions.addAll(conditions);
            return this;
        }

        public Builder condition(PatternCondition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder hint(PronunciationHint hint) {
            this.hint = hint;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags.clear();
            this.tags.addAll(tags);
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder examples(Collection<PatternExample> examples) {
            this.examples.clear();
            this.examples.addAll(examples);
            return this;
        }

        public Builder example(String input, String output) {
            this.examples.add(new PatternExample(input, output));
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder naturalnessScore(Double naturalnessScore) {
            this.naturalnessScore = naturalnessScore;
            return this;
        }

        /** Cache used to compile the regex; without one the regex is compiled directly. */
        public Builder compileCache(PatternCompileCache compileCache) {
            this.compileCache = compileCache;
            return this;
        }

        /**
         * Validates and builds the pattern.
         *
         * @throws PatternCompileException if the id, matcher or template is empty, the regex does
         *     not compile, the template is malformed or references a group the regex lacks, or
         *     the version is not {@code MAJOR.MINOR.PATCH}
         */
        public Pattern build() {
            if (id == null || id.isBlank()) {
                throw new PatternCompileException("pattern id must not be empty", null);
            }
            if (matcher == null || matcher.isEmpty()) {
                throw new PatternCompileException("pattern matcher must not be empty", id);
            }
            if (template == null || template.isEmpty()) {
                throw new PatternCompileException("output template must not be empty", id);
            }
            if (version == null || !VERSION_FORMAT.matcher(version).matches()) {
                throw new PatternCompileException("version is not MAJOR.MINOR.PATCH: " + version, id);
            }
            if (matchType == MatchType.LITERAL) {
                return new Pattern(this, null, OutputTemplate.verbatim(template));
            }

            java.util.regex.Pattern compiled;
            try {
                compiled = compileCache != null
                        ? compileCache.compile(matcher, flags)
                        : java.util.regex.Pattern.compile(matcher, flags);
            } catch (PatternSyntaxException e) {
                throw new PatternCompileException("invalid regex: " + e.getDescription(), e, id);
            }

            OutputTemplate parsed;
            try {
                parsed = OutputTemplate.parse(template);
            } catch (IllegalArgumentException e) {
                throw new PatternCompileException("invalid output template: " + e.getMessage(), e, id);
            }
            int groups = compiled.matcher("").groupCount();
            if (parsed.maxGroupReference() > groups) {
                throw new PatternCompileException(
                        "output template references group " + parsed.maxGroupReference() + " but matcher has "
                                + groups + " group(s)",
                        id);
            }
            return new Pattern(this, compiled, parsed);
        }
    }
}
