// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.error;

/**
 * The activity logger could not deliver a line to the host.
 */
public final class LoggerException extends DevnodeException {

    public LoggerException(final String message) {
        super(message);
    }
}
