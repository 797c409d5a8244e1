package oscar.provisioning.util;

import java.util.regex.Pattern;

/**
 * Helpers to make user controlled values safe for logging.
 * Removes control characters to prevent log injection and masks identifiers
 * such as subjects so that they can be correlated without being disclosed.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Removes control characters that could be abused for log injection.
     *
     * @param value User provided value
     * @return Sanitized value safe for log statements
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Masks an identifier while keeping a short prefix and suffix for debugging.
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (sanitized.length() <= 4) {
            return "*".repeat(sanitized.length());
        }
        int prefixLength = Math.min(6, sanitized.length() / 2);
        int suffixLength = Math.min(4, Math.max(1, sanitized.length() - prefixLength));
        return sanitized.substring(0, prefixLength) + "..." + sanitized.substring(sanitized.length() - suffixLength);
    }
}
