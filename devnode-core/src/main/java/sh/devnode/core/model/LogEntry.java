// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.List;
import java.util.Objects;

import sh.devnode.core.types.Address;
import sh.devnode.core.types.Hash;
import sh.devnode.core.types.HexData;

/**
 * Event log emitted by a contract, as delivered to {@code logs} subscriptions.
 */
public record LogEntry(
        Address address,
        HexData data,
        Hash blockHash,
        Hash transactionHash,
        List<Hash> topics,
        long logIndex,
        boolean removed) {

    public LogEntry {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(blockHash, "blockHash");
        Objects.requireNonNull(transactionHash, "transactionHash");
        topics = List.copyOf(Objects.requireNonNull(topics, "topics"));
    }
}
