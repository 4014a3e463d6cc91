// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.error;

import sh.devnode.core.model.TransactionFailure;

/**
 * A sent transaction reverted or halted.
 *
 * <p>The failure detail was already rendered with the transaction, so the logger
 * prints only the method name for this error.
 */
public final class TransactionFailedException extends ProviderException {

    private final TransactionFailure failure;

    public TransactionFailedException(final TransactionFailure failure) {
        super(TRANSACTION_REJECTED, failure.message(),
                failure.transactionHash() == null ? null : failure.transactionHash().value());
        this.failure = failure;
    }

    public TransactionFailure failure() {
        return failure;
    }
}
