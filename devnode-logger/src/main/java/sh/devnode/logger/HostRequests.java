// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.logger;

import org.jspecify.annotations.Nullable;

import sh.devnode.core.types.HexData;

/**
 * Bridge payloads for host callbacks taking more than one argument.
 */
final class HostRequests {
    private HostRequests() {}

    record Print(String message, boolean replace) {}

    record Resolve(HexData code, @Nullable HexData calldata) {}
}
