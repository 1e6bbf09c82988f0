// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from command traces before they are logged.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Masks the credentials of {@code AUTH} and {@code HELLO ... AUTH} commands</li>
 * <li>Truncates excessively long traces</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Longer traces are truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String REDACTED = "***[REDACTED]***";

    // AUTH password | AUTH username password; arguments never span a line break
    private static final Pattern AUTH = Pattern.compile(
            "(?i)\\b(AUTH)[ \\t]+(\\S+)([ \\t]+\\S+)?");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (containsIgnoreCase(sanitized, "AUTH")) {
            sanitized = redactAuth(sanitized);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }

    private static String redactAuth(final String input) {
        final Matcher matcher = AUTH.matcher(input);
        final StringBuilder sb = new StringBuilder(input.length());
        while (matcher.find()) {
            final String replacement = matcher.group(3) == null
                    ? matcher.group(1) + " " + REDACTED
                    : matcher.group(1) + " " + matcher.group(2) + " " + REDACTED;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static boolean containsIgnoreCase(final String input, final String token) {
        final int max = input.length() - token.length();
        for (int i = 0; i <= max; i++) {
            if (input.regionMatches(true, i, token, 0, token.length())) {
                return true;
            }
        }
        return false;
    }
}
