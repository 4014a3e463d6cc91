// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

/**
 * Whether the host managed to display a line.
 */
public enum PrintOutcome {
    PRINTED,
    FAILED
}
