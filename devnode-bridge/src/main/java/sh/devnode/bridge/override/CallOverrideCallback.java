// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge.override;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

import sh.devnode.core.types.Address;
import sh.devnode.core.types.HexData;

/**
 * Host function that may replace the result of a contract call.
 *
 * <p>Invoked on the host dispatch thread; the returned stage may complete later on
 * any thread. An empty result means "execute normally".
 */
@FunctionalInterface
public interface CallOverrideCallback {

    CompletionStage<Optional<CallOverrideResult>> override(Address contractAddress, HexData callData);
}
