// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in diagnostic tracing for JSON-RPC requests and bridge round trips.
 *
 * <p>Output goes to the {@code sh.devnode.debug} SLF4J logger at INFO level and is
 * always passed through {@link LogSanitizer} first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.devnode.debug");

    private DebugLogger() {
    }

    public static void logRequest(final String message, final Object... args) {
        if (!DevnodeDebug.isRequestTracingEnabled()) {
            return;
        }
        emit(message, args);
    }

    public static void logBridge(final String message, final Object... args) {
        if (!DevnodeDebug.isBridgeTracingEnabled()) {
            return;
        }
        emit(message, args);
    }

    /**
     * Logs when any tracing is enabled.
     */
    public static void log(final String message, final Object... args) {
        if (!DevnodeDebug.isEnabled()) {
            return;
        }
        emit(message, args);
    }

    private static void emit(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
