// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import java.util.List;

import sh.devnode.core.types.HexData;

/**
 * Host function that turns the ABI-encoded arguments of Solidity {@code console.log}
 * calls into display strings, one per call.
 */
@FunctionalInterface
public interface ConsoleLogDecoder {

    List<String> decode(List<HexData> inputs);
}
