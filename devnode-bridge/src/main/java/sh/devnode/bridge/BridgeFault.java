// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge;

/**
 * A broken contract between worker threads and the host: the host handler threw,
 * the bridge was used after {@link HostScheduler#shutdown()}, or the host called
 * its own bridge.
 *
 * <p>This is an {@link Error}. Callers must not catch it and carry on.
 */
public final class BridgeFault extends Error {

    private static final long serialVersionUID = 1L;

    public BridgeFault(final String message) {
        super(message);
    }

    public BridgeFault(final String message, final Throwable cause) {
        super(message, cause);
    }
}
