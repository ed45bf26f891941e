package decentralabs.gmp.util;

import java.util.regex.Pattern;

/**
 * Utility helpers to make sure relay and caller supplied values are safe for logging.
 * Removes control characters to prevent log injection and shortens 32-byte
 * identifiers so intent ids stay readable in log lines.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Removes control characters that could be abused for log injection.
     *
     * @param value caller provided value
     * @return sanitized value safe for log statements
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Shortens a hex identifier to its first and last bytes, e.g. {@code 0x1234ab..cdef}.
     */
    public static String shortHex(String hex) {
        String sanitized = sanitize(hex);
        if (sanitized.length() <= 14) {
            return sanitized;
        }
        return sanitized.substring(0, 8) + ".." + sanitized.substring(sanitized.length() - 4);
    }

    /**
     * Shortened form of a 32-byte value.
     */
    public static String shortHex(Bytes32 value) {
        return value == null ? "" : shortHex(value.toHex());
    }
}
