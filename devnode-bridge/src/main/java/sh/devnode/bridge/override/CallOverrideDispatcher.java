// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge.override;

import java.util.Objects;
import java.util.Optional;

import sh.devnode.bridge.CallbackBridge;
import sh.devnode.bridge.HostScheduler;
import sh.devnode.core.types.Address;
import sh.devnode.core.types.HexData;

/**
 * Asks the host whether a contract call should be overridden. One blocking bridge
 * call per eligible call; the host's asynchronous answer is awaited on the worker.
 */
public final class CallOverrideDispatcher {

    private final CallbackBridge<OverrideRequest, Optional<CallOverrideResult>> bridge;

    public CallOverrideDispatcher(final HostScheduler scheduler, final CallOverrideCallback callback) {
        Objects.requireNonNull(callback, "callback");
        this.bridge = scheduler.registerAsync("call-override",
                request -> callback.override(request.contractAddress(), request.callData()));
    }

    /**
     * @return the host's replacement, or empty to execute the call normally
     */
    public Optional<CallOverrideResult> maybeOverride(final Address contractAddress, final HexData callData) {
        Optional<CallOverrideResult> result = bridge.invoke(new OverrideRequest(contractAddress, callData));
        return result == null ? Optional.empty() : result;
    }

    private record OverrideRequest(Address contractAddress, HexData callData) {
        OverrideRequest {
            Objects.requireNonNull(contractAddress, "contractAddress");
            Objects.requireNonNull(callData, "callData");
        }
    }
}
