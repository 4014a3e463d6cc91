// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

/**
 * Host function that displays one line of the activity narrative.
 */
@FunctionalInterface
public interface LinePrinter {

    /**
     * @param message the line, possibly containing ANSI colour codes and newlines
     * @param replace overwrite the previously printed line instead of appending
     * @return {@link PrintOutcome#FAILED} if the line could not be displayed
     */
    PrintOutcome printLine(String message, boolean replace);
}
