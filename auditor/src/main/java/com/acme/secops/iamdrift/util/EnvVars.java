package com.acme.secops.iamdrift.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 */
public final class EnvVars {
    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "y", "on");
    private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no", "n", "off");

    private EnvVars() {
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        return parseBoolean(env.get(name), defaultValue);
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public static Path getPath(Map<String, String> env, String name, String defaultValue) {
        return Path.of(getOrDefault(env, name, defaultValue));
    }

    /**
     * Accepts {@code 1/true/yes/y/on} and {@code 0/false/no/n/off}, case-insensitive.
     * Anything else yields the default.
     */
    public static boolean parseBoolean(String raw, boolean defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(v)) {
            return true;
        }
        if (FALSE_VALUES.contains(v)) {
            return false;
        }
        return defaultValue;
    }
}
