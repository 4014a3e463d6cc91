// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response: exactly one of {@code result} and {@code error} applies.
 */
public record JsonRpcResponse(@Nullable JsonNode id, @Nullable JsonNode result, @Nullable JsonRpcError error) {

    public static JsonRpcResponse success(final @Nullable JsonNode id, final @Nullable JsonNode result) {
        return new JsonRpcResponse(id, result, null);
    }

    public static JsonRpcResponse failure(final @Nullable JsonNode id, final JsonRpcError error) {
        return new JsonRpcResponse(id, null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
