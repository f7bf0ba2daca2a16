package com.codearena.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * The closed set of execution paths a submission can take.
 *
 * <p>Each constant owns the tags a caller may use to select it. Tag matching
 * is case-insensitive.
 */
public enum Language {

    /** Interpreted/transpiled path (TypeScript via ts-node). */
    SCRIPT("script", Set.of("script", "typescript", "javascript", "ts", "js")),

    /** Compiled path (Go), native toolchain or precompiled container executor. */
    COMPILED("compiled", Set.of("compiled", "go", "golang")),

    /** Server-side interpreter path (PHP). */
    SERVER_SIDE("server-side", Set.of("server-side", "serverside", "php"));

    private final String tag;
    private final Set<String> aliases;

    Language(String tag, Set<String> aliases) {
        this.tag = tag;
        this.aliases = aliases;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a caller-supplied tag.
     *
     * @return the matching language, or {@code null} when the tag is unknown
     */
    public static Language fromTag(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.aliases.contains(normalized)) {
                return language;
            }
        }
        return null;
    }
}
