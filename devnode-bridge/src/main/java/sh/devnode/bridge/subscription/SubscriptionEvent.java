// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge.subscription;

import java.util.List;
import java.util.Objects;

import sh.devnode.core.model.BlockHeader;
import sh.devnode.core.model.LogEntry;
import sh.devnode.core.types.Hash;

/**
 * A notification for one {@code eth_subscribe} filter.
 *
 * @param filterId id returned to the client when it subscribed
 * @param payload  what happened
 */
public record SubscriptionEvent(String filterId, Payload payload) {

    public SubscriptionEvent {
        Objects.requireNonNull(filterId, "filterId");
        Objects.requireNonNull(payload, "payload");
    }

    public sealed interface Payload permits Logs, NewHeads, NewPendingTransactions {}

    public record Logs(List<LogEntry> logs) implements Payload {
        public Logs {
            logs = List.copyOf(logs);
        }
    }

    public record NewHeads(BlockHeader header) implements Payload {
        public NewHeads {
            Objects.requireNonNull(header, "header");
        }
    }

    public record NewPendingTransactions(Hash transactionHash) implements Payload {
        public NewPendingTransactions {
            Objects.requireNonNull(transactionHash, "transactionHash");
        }
    }
}
