// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import java.io.PrintStream;
import java.util.Objects;

/**
 * {@link LinePrinter} writing to a terminal stream. Replacing moves the cursor to the
 * start of the previous line and clears it before writing.
 */
public final class ConsoleLinePrinter implements LinePrinter {

    static final String CLEAR_PREVIOUS_LINE = "\u001B[1F\u001B[2K";

    private final PrintStream out;

    public ConsoleLinePrinter(final PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public static ConsoleLinePrinter stdout() {
        return new ConsoleLinePrinter(System.out);
    }

    @Override
    public PrintOutcome printLine(final String message, final boolean replace) {
        if (replace) {
            out.print(CLEAR_PREVIOUS_LINE);
        }
        out.println(message);
        out.flush();
        return out.checkError() ? PrintOutcome.FAILED : PrintOutcome.PRINTED;
    }
}
