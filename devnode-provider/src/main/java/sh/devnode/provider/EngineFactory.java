// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

/**
 * Creates the engine of a new {@link Provider}.
 */
@FunctionalInterface
public interface EngineFactory {

    ProviderEngine create(ProviderConfig config, EngineContext context);
}
