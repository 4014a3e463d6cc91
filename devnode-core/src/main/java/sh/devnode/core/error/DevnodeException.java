// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.error;

/**
 * Base runtime exception for ordinary devnode failures.
 *
 * <p>Ordinary failures abort the current operation and are reported to its caller.
 * Broken contracts between components are not part of this hierarchy; they surface
 * as {@link Error}s or {@link IllegalStateException}s and are never caught.
 *
 * <pre>
 * DevnodeException
 * ├── {@link LoggerException} - a host print callback reported failure
 * ├── {@link ScenarioException} - the scenario file could not be written
 * └── {@link ProviderException} - a JSON-RPC method failed
 *     ├── {@link UnsupportedMethodException}
 *     ├── {@link TransactionFailedException}
 *     └── {@link ChainMismatchException}
 * </pre>
 *
 * @since 0.1.0
 */
public sealed class DevnodeException extends RuntimeException
        permits LoggerException, ScenarioException, ProviderException {

    public DevnodeException(final String message) {
        super(message);
    }

    public DevnodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
