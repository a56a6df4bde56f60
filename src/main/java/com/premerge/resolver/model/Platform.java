package com.premerge.resolver.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Platforms the premerge checks run on.
 *
 * The display name is the value callers pass on the command line and the key
 * used by the exclusion tables.
 */
public enum Platform {
    LINUX("Linux"),
    WINDOWS("Windows"),
    DARWIN("Darwin"),

    /**
     * Any platform name that is not recognized. Carries no exclusions.
     */
    UNKNOWN("Unknown");

    private final String displayName;

    Platform(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Looks up a platform by its display name (case sensitive, as the CI scripts pass it).
     */
    public static Optional<Platform> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (Platform platform : values()) {
            if (platform != UNKNOWN && platform.displayName.equals(name.trim())) {
                return Optional.of(platform);
            }
        }
        return Optional.empty();
    }

    /**
     * Same as {@link #fromName(String)} but degrades to {@link #UNKNOWN}.
     */
    public static Platform fromNameOrUnknown(String name) {
        return fromName(name).orElse(UNKNOWN);
    }

    /**
     * Platform of the running JVM, derived from the {@code os.name} system property.
     */
    public static Platform current() {
        return fromOsName(System.getProperty("os.name"));
    }

    static Platform fromOsName(String osName) {
        if (osName == null) {
            return UNKNOWN;
        }
        String lower = osName.toLowerCase(Locale.ROOT);
        if (lower.startsWith("linux")) {
            return LINUX;
        }
        if (lower.startsWith("windows")) {
            return WINDOWS;
        }
        if (lower.startsWith("mac") || lower.startsWith("darwin")) {
            return DARWIN;
        }
        return UNKNOWN;
    }
}
