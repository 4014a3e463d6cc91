// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core;

/**
 * ANSI palette shared by the activity logger and the debug logger.
 *
 * <p>The palette keeps the classic node-console meaning of each color:
 * <ul>
 * <li><b>TEAL</b> - successful method calls
 * <li><b>CORAL</b> - failed method calls and alerts
 * <li><b>AMBER</b> - warnings and hints
 * <li><b>BOLD</b> - emphasis, e.g. the hash of the transaction that was just sent
 * </ul>
 *
 * <p>Unlike a fixed set of pre-rendered constants, coloring is decided per call through
 * {@link #paint(String, String, boolean)} so that each logger instance can opt in or out
 * independently of the process TTY. {@link #isTty()} is the default choice.
 *
 * @since 0.1.0
 * @see DebugLogger
 */
public final class AnsiColors {

    private static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** Reset code. */
    public static final String RESET = "0";

    /** Success color. */
    public static final String TEAL = "38;5;44";

    /** Error and alert color. */
    public static final String CORAL = "38;5;204";

    /** Warning color. */
    public static final String AMBER = "38;5;214";

    /** Metadata color. */
    public static final String SLATE = "38;5;247";

    /** Bold text. */
    public static final String BOLD = "1";

    private AnsiColors() {
    }

    /**
     * Returns whether stdout looks like a terminal, or {@code FORCE_COLOR=true} is set.
     *
     * @return true when colored output is appropriate by default
     */
    public static boolean isTty() {
        return IS_TTY;
    }

    /**
     * Wraps text in the given SGR code when {@code enabled}; returns it unchanged otherwise.
     *
     * @param code    one of the palette codes
     * @param text    the text to color
     * @param enabled whether to emit escape sequences
     * @return the colored or plain text
     */
    public static String paint(final String code, final String text, final boolean enabled) {
        if (!enabled) {
            return text;
        }
        return "\u001B[" + code + "m" + text + "\u001B[" + RESET + "m";
    }

    /**
     * Formats a key-value pair with a slate key, colored only on a TTY.
     *
     * @param key   the key name
     * @param value the value
     * @return "{@code key value}"
     */
    public static String kv(final String key, final String value) {
        return paint(SLATE, key, IS_TTY) + " " + value;
    }
}
