package com.cleancity.api.config;

import com.cleancity.api.ratelimit.CounterStore;
import com.cleancity.api.ratelimit.InMemoryCounterStore;
import com.cleancity.api.ratelimit.RedisCounterStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the rate-limit counter backend from {@code cleancity.cache.type}.
 */
@Configuration
public class CounterStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "cleancity.cache.type", havingValue = "redis", matchIfMissing = true)
    public CounterStore redisCounterStore(StringRedisTemplate redisTemplate) {
        return new RedisCounterStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "cleancity.cache.type", havingValue = "memory")
    public CounterStore inMemoryCounterStore(Clock clock) {
        return new InMemoryCounterStore(clock);
    }
}
