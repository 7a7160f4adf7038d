package in.pollwall.util;

import java.util.Locale;
import java.util.UUID;

/**
 * Opaque identifier generation: a type prefix followed by a random UUID fragment.
 */
public final class Ids {

    public static String poll() {
        return "P" + fragment(12);
    }

    public static String option() {
        return "O" + fragment(12);
    }

    public static String vote() {
        return "V" + fragment(12);
    }

    public static String user() {
        return "U" + fragment(12);
    }

    private static String fragment(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length).toUpperCase(Locale.ROOT);
    }

    private Ids() {}
}
