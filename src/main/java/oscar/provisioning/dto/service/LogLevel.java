package oscar.provisioning.dto.service;

import java.util.Locale;

/**
 * Log levels understood by the function supervisor running inside the workload.
 */
public enum LogLevel {
    NOTSET,
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Parses {@code raw} case-insensitively, returning {@code fallback} for anything outside the enumeration.
     */
    public static LogLevel parseOrDefault(String raw, LogLevel fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return LogLevel.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
