package io.mathspeech.core.model;

import java.util.Locale;

/** Coarse complexity/formality target that controls post-processing phrasing. */
public enum AudienceLevel {
    ELEMENTARY,
    HIGH_SCHOOL,
    UNDERGRADUATE,
    GRADUATE,
    RESEARCH;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Elementary and high-school listeners get simplified phrasing. */
    public boolean isBasic() {
        return this == ELEMENTARY || this == HIGH_SCHOOL;
    }

    /** Graduate and research listeners get formal phrasing. */
    public boolean isAdvanced() {
        return this == GRADUATE || this == RESEARCH;
    }

    /**
     * Parses a wire name such as {@code high_school} (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AudienceLevel fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("audience level must not be blank");
        }
        String normalized = id.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (AudienceLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Invalid audience level: " + id);
    }
}
