// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.bridge;

/**
 * Configuration for a {@link HostScheduler}.
 *
 * <p>Zero or {@code null} values are replaced by defaults:
 * <ul>
 * <li>{@code ringBufferSize}: 1024 slots, must be a power of two</li>
 * <li>{@code waitStrategy}: {@link WaitStrategyType#BLOCKING}</li>
 * <li>{@code threadName}: {@code devnode-host}</li>
 * </ul>
 *
 * @param ringBufferSize capacity of the call mailbox
 * @param waitStrategy   how the dispatch thread waits for calls
 * @param threadName     name of the daemon dispatch thread
 */
public record HostSchedulerConfig(int ringBufferSize, WaitStrategyType waitStrategy, String threadName) {

    /**
     * Strategy the dispatch thread uses while the mailbox is empty.
     */
    public enum WaitStrategyType {
        /** Lowest latency; burns a core. */
        BUSY_SPIN,
        YIELDING,
        LITE_BLOCKING,
        /** Lowest CPU use. Default, since host callbacks are rare compared to engine work. */
        BLOCKING
    }

    private static final int DEFAULT_RING_SIZE = 1024;
    private static final String DEFAULT_THREAD_NAME = "devnode-host";

    public HostSchedulerConfig {
        if (ringBufferSize <= 0)
            ringBufferSize = DEFAULT_RING_SIZE;
        if (waitStrategy == null)
            waitStrategy = WaitStrategyType.BLOCKING;
        if (threadName == null || threadName.isBlank())
            threadName = DEFAULT_THREAD_NAME;

        if ((ringBufferSize & (ringBufferSize - 1)) != 0) {
            throw new IllegalArgumentException(
                    "ringBufferSize must be a power of 2, got: " + ringBufferSize
                            + ", try: " + Integer.highestOneBit(ringBufferSize) * 2);
        }
    }

    public static HostSchedulerConfig defaults() {
        return new HostSchedulerConfig(0, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int ringBufferSize = 0;
        private WaitStrategyType waitStrategy = null;
        private String threadName = null;

        private Builder() {}

        public Builder ringBufferSize(int ringBufferSize) {
            this.ringBufferSize = ringBufferSize;
            return this;
        }

        public Builder waitStrategy(WaitStrategyType waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        public HostSchedulerConfig build() {
            return new HostSchedulerConfig(ringBufferSize, waitStrategy, threadName);
        }
    }
}
