// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.devnode.core.error.ProviderException;

/**
 * Renders responses as JSON text, falling back to the tree form for responses longer
 * than the configured ceiling.
 */
final class ResponseSerializer {

    private final ObjectMapper mapper;
    private final int maxResponseLength;

    ResponseSerializer(final ObjectMapper mapper, final int maxResponseLength) {
        this.mapper = mapper;
        this.maxResponseLength = maxResponseLength;
    }

    ProviderResponse serialize(final JsonRpcResponse response) {
        final JsonNode tree = toTree(response);
        final String json;
        try {
            json = mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.INTERNAL_ERROR, "Failed to serialize response", null, e);
        }
        if (json.length() > maxResponseLength) {
            return new ProviderResponse.Structured(tree);
        }
        return new ProviderResponse.Json(json);
    }

    JsonNode toTree(final JsonRpcResponse response) {
        final ObjectNode node = mapper.createObjectNode();
        node.put("jsonrpc", "2.0");
        node.set("id", response.id() == null ? NullNode.getInstance() : response.id());
        if (response.hasError()) {
            node.set("error", mapper.valueToTree(response.error()));
        } else {
            node.set("result", response.result() == null ? NullNode.getInstance() : response.result());
        }
        return node;
    }
}
