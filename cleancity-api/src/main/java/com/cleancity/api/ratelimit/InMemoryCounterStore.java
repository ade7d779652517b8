package com.cleancity.api.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-node counter store. Windows expire on access, and every
 * {@value #SWEEP_INTERVAL} increments the whole map is swept.
 */
public class InMemoryCounterStore implements CounterStore {

    static final int SWEEP_INTERVAL = 1024;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final AtomicLong increments = new AtomicLong();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long incrementWithExpiry(String key, Duration window) {
        Instant now = clock.instant();
        Window updated = windows.compute(key, (k, existing) ->
                existing == null || existing.isExpired(now)
                        ? new Window(1, now.plus(window))
                        : new Window(existing.count() + 1, existing.expiresAt()));
        if (increments.incrementAndGet() % SWEEP_INTERVAL == 0) {
            evictExpired();
        }
        return updated.count();
    }

    @Override
    public Duration timeToLive(String key) {
        Instant now = clock.instant();
        Window window = windows.get(key);
        if (window == null) {
            return Duration.ZERO;
        }
        if (window.isExpired(now)) {
            windows.remove(key, window);
            return Duration.ZERO;
        }
        return Duration.between(now, window.expiresAt());
    }

    /**
     * Drops every expired window.
     *
     * @return number of windows removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Window> entry : windows.entrySet()) {
            if (entry.getValue().isExpired(now) && windows.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void reset(String key) {
        windows.remove(key);
    }

    private record Window(long count, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
