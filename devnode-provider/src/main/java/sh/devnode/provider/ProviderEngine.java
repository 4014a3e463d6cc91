// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import sh.devnode.core.error.ProviderException;
import sh.devnode.core.model.DebugMineBlockResult;

/**
 * The blocking execution engine behind a {@link Provider}.
 *
 * <p>All methods are called on the provider's single worker thread. The engine reports
 * its activity through the logger of the {@link EngineContext} it was created with.
 */
public interface ProviderEngine extends AutoCloseable {

    /**
     * Executes one JSON-RPC method.
     *
     * @return the {@code result} member of the response
     * @throws ProviderException if the method failed
     */
    JsonNode handle(JsonRpcRequest request);

    /**
     * Mines the next interval block, or returns empty if mining is currently paused.
     */
    Optional<DebugMineBlockResult> mineIntervalBlock();

    @Override
    default void close() {}
}
