// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core;

import java.util.regex.Pattern;

/**
 * Removes secrets from diagnostic traces of JSON-RPC traffic.
 *
 * <ul>
 * <li>Private keys in provider configuration ({@code "secretKey"}, {@code "privateKey"})</li>
 * <li>The signed payload of {@code eth_sendRawTransaction}</li>
 * <li>Overlong payloads are truncated</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String REDACTED = "0x***[REDACTED]***";

    /** Matches "privateKey":"0x..." and "secretKey":"0x..." values. */
    private static final Pattern KEY_PATTERN =
            Pattern.compile("\"(privateKey|secretKey)\"\\s*:\\s*\"0x[^\"]+\"");

    /** Matches the params array of eth_sendRawTransaction. */
    private static final Pattern RAW_TX_PATTERN =
            Pattern.compile("(\"method\"\\s*:\\s*\"eth_sendRawTransaction\"\\s*,\\s*\"params\"\\s*:\\s*\\[\\s*)\"0x[^\"]+\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("Key\"")) {
            sanitized = KEY_PATTERN.matcher(sanitized).replaceAll("\"$1\":\"" + REDACTED + "\"");
        }

        if (sanitized.contains("eth_sendRawTransaction")) {
            sanitized = RAW_TX_PATTERN.matcher(sanitized).replaceAll("$1\"" + REDACTED + "\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
