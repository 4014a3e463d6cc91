// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.provider;

import com.fasterxml.jackson.annotation.JsonIgnore;

import sh.devnode.core.model.SpecId;

/**
 * Configuration of a {@link Provider}. Serialized as the first line of scenario files.
 *
 * <p>Zero or {@code null} values are replaced by defaults:
 * <ul>
 * <li>{@code chainId}: 31337</li>
 * <li>{@code hardfork}: {@link SpecId#CANCUN}</li>
 * <li>{@code maxResponseLength}: 536870888 characters</li>
 * </ul>
 *
 * @param chainId              chain id of the node
 * @param hardfork             active hardfork
 * @param intervalMiningMillis period of the interval mining timer; 0 disables it
 * @param maxResponseLength    longest response returned as JSON text
 */
public record ProviderConfig(long chainId, SpecId hardfork, long intervalMiningMillis, int maxResponseLength) {

    private static final long DEFAULT_CHAIN_ID = 31337L;
    private static final int DEFAULT_MAX_RESPONSE_LENGTH = 536_870_888;

    public ProviderConfig {
        if (chainId <= 0)
            chainId = DEFAULT_CHAIN_ID;
        if (hardfork == null)
            hardfork = SpecId.CANCUN;
        if (maxResponseLength <= 0)
            maxResponseLength = DEFAULT_MAX_RESPONSE_LENGTH;

        if (intervalMiningMillis < 0) {
            throw new IllegalArgumentException("intervalMiningMillis must be >= 0, got: " + intervalMiningMillis);
        }
    }

    @JsonIgnore
    public boolean isIntervalMiningEnabled() {
        return intervalMiningMillis > 0;
    }

    public static ProviderConfig defaults() {
        return new ProviderConfig(0, null, 0, 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long chainId = 0;
        private SpecId hardfork = null;
        private long intervalMiningMillis = 0;
        private int maxResponseLength = 0;

        private Builder() {}

        public Builder chainId(long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder hardfork(SpecId hardfork) {
            this.hardfork = hardfork;
            return this;
        }

        public Builder intervalMiningMillis(long intervalMiningMillis) {
            this.intervalMiningMillis = intervalMiningMillis;
            return this;
        }

        public Builder maxResponseLength(int maxResponseLength) {
            this.maxResponseLength = maxResponseLength;
            return this;
        }

        public ProviderConfig build() {
            return new ProviderConfig(chainId, hardfork, intervalMiningMillis, maxResponseLength);
        }
    }
}
