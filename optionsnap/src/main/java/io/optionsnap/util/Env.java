package io.optionsnap.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Environment variable utilities.
 * Falls back to system properties so tests and local runs can use -D flags.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    /**
     * Integer value. Unlike a silent fallback, a malformed value is a startup error.
     */
    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    /**
     * Comma separated list, trimmed, empty items dropped.
     */
    public static List<String> getList(String key, String defaultValue) {
        String value = get(key, defaultValue);
        List<String> items = new ArrayList<>();
        if (value == null) return items;
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    private Env() {}
}
