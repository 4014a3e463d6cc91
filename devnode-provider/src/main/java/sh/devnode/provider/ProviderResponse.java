// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A serialized response, as JSON text or, when the text would exceed
 * {@link ProviderConfig#maxResponseLength()}, as a JSON tree.
 */
public sealed interface ProviderResponse permits ProviderResponse.Json, ProviderResponse.Structured {

    record Json(String json) implements ProviderResponse {}

    record Structured(JsonNode node) implements ProviderResponse {}
}
