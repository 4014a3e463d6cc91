// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core;

/**
 * Process-wide switches for verbose diagnostic tracing.
 *
 * <p>These flags only govern {@link DebugLogger} output (request and bridge traces on
 * the {@code sh.devnode.debug} logger). They have no effect on the activity narrative,
 * which is configured per provider.
 *
 * <p>Thread safety: each flag is volatile. {@link #isEnabled()} reads both flags
 * non-atomically, which is fine for best-effort tracing.
 */
public final class DevnodeDebug {

    private static volatile boolean requestTracing = false;
    private static volatile boolean bridgeTracing = false;

    private DevnodeDebug() {
    }

    /**
     * @return true if either request or bridge tracing is enabled
     */
    public static boolean isEnabled() {
        return requestTracing || bridgeTracing;
    }

    public static void setEnabled(final boolean enabled) {
        requestTracing = enabled;
        bridgeTracing = enabled;
    }

    public static void setRequestTracing(final boolean enabled) {
        requestTracing = enabled;
    }

    public static boolean isRequestTracingEnabled() {
        return requestTracing;
    }

    public static void setBridgeTracing(final boolean enabled) {
        bridgeTracing = enabled;
    }

    public static boolean isBridgeTracingEnabled() {
        return bridgeTracing;
    }
}
