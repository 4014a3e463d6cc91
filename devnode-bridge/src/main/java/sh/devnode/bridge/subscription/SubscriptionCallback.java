// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge.subscription;

/**
 * Host function receiving subscription events. Runs on the host dispatch thread.
 */
@FunctionalInterface
public interface SubscriptionCallback {

    void onEvent(SubscriptionEvent event);
}
