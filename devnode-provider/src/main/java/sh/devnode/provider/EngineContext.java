// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import java.util.Optional;
import java.util.function.Supplier;

import sh.devnode.bridge.override.CallOverrideDispatcher;
import sh.devnode.bridge.subscription.SubscriptionDispatcher;
import sh.devnode.logger.ActivityLogger;

/**
 * Host-facing collaborators of one provider, handed to its engine.
 */
public final class EngineContext {

    private final ActivityLogger logger;
    private final SubscriptionDispatcher subscriptions;
    private final Supplier<Optional<CallOverrideDispatcher>> callOverride;

    EngineContext(final ActivityLogger logger, final SubscriptionDispatcher subscriptions,
            final Supplier<Optional<CallOverrideDispatcher>> callOverride) {
        this.logger = logger;
        this.subscriptions = subscriptions;
        this.callOverride = callOverride;
    }

    public ActivityLogger logger() {
        return logger;
    }

    public SubscriptionDispatcher subscriptions() {
        return subscriptions;
    }

    /**
     * The call override currently installed with {@link Provider#setCallOverrideCallback}.
     */
    public Optional<CallOverrideDispatcher> callOverride() {
        return callOverride.get();
    }
}
