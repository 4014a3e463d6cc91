// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRequest(String jsonrpc, String method, @Nullable JsonNode params, @Nullable JsonNode id) {}
