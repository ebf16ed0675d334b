package in.cryptai.util;

import java.util.Locale;
import java.util.function.Function;

/**
 * Typed lookup of configuration values.
 *
 * Environment variables win; JVM system properties (-DKEY=value) are the
 * fallback for local runs. A blank value counts as unset. A value that is set
 * but malformed is a startup error, never silently replaced by the default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = lookup(key);
        return value != null ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::parseInt);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::parseLong);
    }

    /**
     * Accepts true/false, 1/0 and yes/no, case-insensitive.
     */
    public static boolean getBool(String key, boolean defaultValue) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes":
                return true;
            case "false", "0", "no":
                return false;
            default:
                throw new IllegalStateException(key + " must be a boolean, got '" + value + "'");
        }
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static String lookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private Env() {}
}
