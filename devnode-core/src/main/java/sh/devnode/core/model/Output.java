// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.devnode.core.types.Address;
import sh.devnode.core.types.HexData;

/**
 * Output of a successful execution.
 */
public sealed interface Output permits Output.Call, Output.Create {

    HexData data();

    record Call(HexData data) implements Output {
        public Call {
            Objects.requireNonNull(data, "data");
        }
    }

    /**
     * @param address the deployed contract, absent when none was created
     */
    record Create(HexData data, @Nullable Address address) implements Output {
        public Create {
            Objects.requireNonNull(data, "data");
        }
    }
}
