package com.cleancity.api.ratelimit;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Counter store backed by Redis. INCR and PEXPIRE run in one Lua script so the
 * window is always set for a fresh key even under concurrent first hits.
 */
public class RedisCounterStore implements CounterStore {

    private static final String INCREMENT_SCRIPT =
            "local current = redis.call('INCR', KEYS[1]) " +
            "if current == 1 then redis.call('PEXPIRE', KEYS[1], ARGV[1]) end " +
            "return current";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> incrementScript;

    public RedisCounterStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.incrementScript = new DefaultRedisScript<>();
        this.incrementScript.setScriptText(INCREMENT_SCRIPT);
        this.incrementScript.setResultType(Long.class);
    }

    @Override
    public long incrementWithExpiry(String key, Duration window) {
        Long result = redisTemplate.execute(
                incrementScript,
                Collections.singletonList(key),
                String.valueOf(window.toMillis()));
        if (result == null) {
            throw new IllegalStateException("Redis returned no counter value for " + key);
        }
        return result;
    }

    @Override
    public Duration timeToLive(String key) {
        Long millis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
        return millis == null || millis < 0 ? Duration.ZERO : Duration.ofMillis(millis);
    }

    @Override
    public void reset(String key) {
        redisTemplate.delete(key);
    }
}
