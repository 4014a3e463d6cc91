// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered trace messages of one transaction.
 */
public record Trace(List<TraceMessage> messages) {

    public static final Trace EMPTY = new Trace(List.of());

    public Trace {
        messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
    }

    public Optional<TraceMessage> first() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(0));
    }

    public Optional<TraceMessage> last() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }
}
