// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.error;

/**
 * A raw transaction was signed for a different chain id than the node's.
 *
 * @since 0.1.0
 */
public final class ChainMismatchException extends ProviderException {

    private final long expected;
    private final long actual;

    public ChainMismatchException(final long expected, final long actual) {
        super(INVALID_INPUT, "Trying to send an incompatible EIP-155 transaction, signed for another chain.",
                "expected chain id " + expected + " but transaction was signed for " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
