// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.error;

/**
 * Writing to the scenario recording file failed.
 */
public final class ScenarioException extends DevnodeException {

    public ScenarioException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
