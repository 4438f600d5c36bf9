package com.example.ttlcache.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the auto-configured cache.
 */
@ConfigurationProperties(prefix = "ttl-cache")
public class TtlCacheProperties {

    /**
     * Whether to register the auto-configured cache bean.
     */
    private boolean enabled = true;

    /**
     * Maximum number of entries held before the least recently used one is evicted.
     */
    private int capacity = 10_000;

    /**
     * Delay between background sweeps for expired entries.
     */
    private Duration sweepInterval = Duration.ofSeconds(1);

    /**
     * Entries examined per lock hold during a sweep. 0 sweeps the whole cache under one lock hold.
     */
    private int sweepBatchSize = 0;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public int getSweepBatchSize() {
        return sweepBatchSize;
    }

    public void setSweepBatchSize(int sweepBatchSize) {
        this.sweepBatchSize = sweepBatchSize;
    }

    int effectiveSweepBatchSize() {
        return sweepBatchSize > 0 ? sweepBatchSize : Integer.MAX_VALUE;
    }
}
