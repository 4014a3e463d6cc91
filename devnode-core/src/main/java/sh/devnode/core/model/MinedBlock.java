// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A block and the transactions mined into it, in inclusion order.
 */
public record MinedBlock(BlockHeader header, List<BlockTransaction> transactions) {

    public MinedBlock {
        Objects.requireNonNull(header, "header");
        transactions = List.copyOf(Objects.requireNonNull(transactions, "transactions"));
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }
}
