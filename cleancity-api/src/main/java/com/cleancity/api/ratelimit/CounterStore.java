package com.cleancity.api.ratelimit;

import java.time.Duration;

/**
 * Shared key-value store for fixed-window counters.
 */
public interface CounterStore {

    /**
     * Atomically increments the counter at {@code key}, starting a window of
     * {@code window} when the key is new.
     *
     * @return the counter value after the increment
     */
    long incrementWithExpiry(String key, Duration window);

    /**
     * Remaining lifetime of the counter, or {@link Duration#ZERO} if it does not exist.
     */
    Duration timeToLive(String key);

    void reset(String key);
}
