package in.pollwall.util;

/**
 * Reads settings from environment variables, falling back to system properties.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String raw = get(key, null);
        if (raw == null) return defaultValue;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Setting " + key + " is not an integer: " + raw, e);
        }
    }

    public static long getLong(String key, long defaultValue) {
        String raw = get(key, null);
        if (raw == null) return defaultValue;
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Setting " + key + " is not a number: " + raw, e);
        }
    }

    private Env() {}
}
