package com.queryforge.config;

import org.springframework.core.env.Environment;

import java.util.Arrays;
import java.util.List;

/**
 * Property-then-environment-variable lookups shared by the settings records.
 */
public final class EnvironmentValues {

    private EnvironmentValues() {
    }

    /**
     * Read a value from a Spring property, falling back to an environment-style key.
     *
     * @return trimmed value, or null when neither key is set
     */
    public static String getTrimmed(Environment environment, String propKey, String envKey) {
        if (environment == null) {
            return null;
        }
        String v = null;
        if (propKey != null && !propKey.isBlank()) {
            v = environment.getProperty(propKey);
        }
        if ((v == null || v.isBlank()) && envKey != null && !envKey.isBlank()) {
            v = environment.getProperty(envKey);
        }
        if (v == null) {
            return null;
        }
        return v.trim();
    }

    public static String getString(Environment environment, String propKey, String envKey, String defaultValue) {
        String v = getTrimmed(environment, propKey, envKey);
        return v == null || v.isBlank() ? defaultValue : v;
    }

    /**
     * Integers fall back to the default when missing or unparsable.
     */
    public static int getInt(Environment environment, String propKey, String envKey, int defaultValue) {
        String v = getTrimmed(environment, propKey, envKey);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static double getDouble(Environment environment, String propKey, String envKey, double defaultValue) {
        String v = getTrimmed(environment, propKey, envKey);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Comma-separated list; blank entries are dropped.
     */
    public static List<String> getList(Environment environment, String propKey, String envKey, List<String> defaultValue) {
        String v = getTrimmed(environment, propKey, envKey);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        List<String> items = Arrays.stream(v.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return items.isEmpty() ? defaultValue : items;
    }
}
