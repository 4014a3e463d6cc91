// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge.override;

import java.util.Objects;

import sh.devnode.core.types.HexData;

/**
 * Replacement outcome for a call, supplied by the host.
 *
 * @param output       returned data, or revert data when {@code shouldRevert}
 * @param shouldRevert whether the call reverts with {@code output}
 */
public record CallOverrideResult(HexData output, boolean shouldRevert) {

    public CallOverrideResult {
        Objects.requireNonNull(output, "output");
    }
}
