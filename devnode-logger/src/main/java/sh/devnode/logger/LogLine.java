// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

/**
 * A buffered line awaiting flush.
 */
sealed interface LogLine {

    /** Already indented text. */
    record Single(String text) implements LogLine {}

    /** Indented title, aligned against the other titles of the same flush. */
    record WithTitle(String title, String message) implements LogLine {}
}
