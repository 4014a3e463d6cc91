// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Result of resolving bytecode and calldata against the project's compiled contracts.
 *
 * @param contractName name of the matched contract, or a placeholder for unknown code
 * @param functionName called function; absent for deployments and unmatched selectors
 */
public record ContractAndFunctionName(String contractName, @Nullable String functionName) {

    public ContractAndFunctionName {
        Objects.requireNonNull(contractName, "contractName");
    }

    String label() {
        return functionName == null || functionName.isEmpty() ? contractName : contractName + "#" + functionName;
    }
}
