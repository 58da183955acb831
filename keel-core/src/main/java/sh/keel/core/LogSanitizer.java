// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts secret key material and signed transaction payloads</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Matches "secretKey":"..." and "key_material":"..." JSON values. */
    private static final Pattern SECRET_PATTERN =
            Pattern.compile("\"(secretKey|key_material)\"\\s*:\\s*\"[^\"]+\"");

    private static final String SECRET_REPLACEMENT = "\"$1\":\"***[REDACTED]***\"";

    /** Matches "signedTransaction":"..." JSON values (base64 or base58 wire bytes). */
    private static final Pattern SIGNED_TX_PATTERN =
            Pattern.compile("\"signedTransaction\"\\s*:\\s*\"[^\"]+\"");

    private static final String SIGNED_TX_REPLACEMENT = "\"signedTransaction\":\"***[REDACTED]***\"";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"secretKey\"") || sanitized.contains("\"key_material\"")) {
            sanitized = SECRET_PATTERN.matcher(sanitized).replaceAll(SECRET_REPLACEMENT);
        }

        if (sanitized.contains("\"signedTransaction\"")) {
            sanitized = SIGNED_TX_PATTERN.matcher(sanitized).replaceAll(SIGNED_TX_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
