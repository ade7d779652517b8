package com.cleancity.api.ratelimit;

import com.cleancity.api.config.RateLimitConfig;
import com.cleancity.api.config.RateLimitConfig.Limit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Fixed-window request limiter keyed by {@code ratelimit:{scope}:{identity}}.
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    private static final String KEY_PREFIX = "ratelimit:";

    private final CounterStore counterStore;
    private final RateLimitConfig config;

    public RateLimiter(CounterStore counterStore, RateLimitConfig config) {
        this.counterStore = counterStore;
        this.config = config;
    }

    public Decision tryAcquire(String scope, String identity) {
        Limit limit = config.limitFor(scope);
        String key = key(scope, identity);
        long count = counterStore.incrementWithExpiry(key, limit.getWindow());
        if (count <= limit.getMaxRequests()) {
            return new Decision(true, limit.getMaxRequests() - count, 0);
        }
        Duration ttl = counterStore.timeToLive(key);
        long retryAfter = Math.max(1, (ttl.toMillis() + 999) / 1000);
        log.warn("Rate limit exceeded for scope={} identity={} count={}", scope, identity, count);
        return new Decision(false, 0, retryAfter);
    }

    public void reset(String scope, String identity) {
        counterStore.reset(key(scope, identity));
    }

    private static String key(String scope, String identity) {
        return KEY_PREFIX + scope + ":" + identity;
    }

    public record Decision(boolean allowed, long remaining, long retryAfterSeconds) {}
}
