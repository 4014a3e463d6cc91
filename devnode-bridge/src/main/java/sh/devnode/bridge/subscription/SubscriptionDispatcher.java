// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge.subscription;

import java.util.Objects;

import sh.devnode.bridge.CallbackBridge;
import sh.devnode.bridge.HostScheduler;

/**
 * Forwards subscription events from the engine to the host, one blocking bridge
 * call per event. Events reach the host in emission order; nothing is batched,
 * deduplicated or filtered.
 */
public final class SubscriptionDispatcher {

    private final CallbackBridge<SubscriptionEvent, Void> bridge;

    public SubscriptionDispatcher(final HostScheduler scheduler, final SubscriptionCallback callback) {
        Objects.requireNonNull(callback, "callback");
        this.bridge = scheduler.register("subscription", event -> {
            callback.onEvent(event);
            return null;
        });
    }

    public void notify(final SubscriptionEvent event) {
        bridge.invoke(Objects.requireNonNull(event, "event"));
    }
}
