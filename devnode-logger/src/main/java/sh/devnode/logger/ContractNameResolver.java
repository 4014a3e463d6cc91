// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import org.jspecify.annotations.Nullable;

import sh.devnode.core.types.HexData;

/**
 * Host function that identifies a contract and the function being called.
 */
@FunctionalInterface
public interface ContractNameResolver {

    /**
     * @param code     deployed code, or init code for a deployment
     * @param calldata call data, {@code null} for a deployment
     */
    ContractAndFunctionName resolve(HexData code, @Nullable HexData calldata);
}
