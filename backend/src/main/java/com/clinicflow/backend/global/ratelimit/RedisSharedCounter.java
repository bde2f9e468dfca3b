package com.clinicflow.backend.global.ratelimit;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

@Component
public class RedisSharedCounter implements SharedCounter {

    /**
     * INCR and PEXPIRE in one server-side step. A key found without a TTL gets its window
     * re-armed, so a counter can never outlive its window.
     */
    static final RedisScript<Long> INCREMENT_IN_WINDOW = new DefaultRedisScript<>("""
            local count = redis.call('INCR', KEYS[1])
            if count == 1 or redis.call('PTTL', KEYS[1]) == -1 then
              redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return count
            """, Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisSharedCounter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public long increment(String key, Duration window) {
        Long value = redisTemplate.execute(INCREMENT_IN_WINDOW, List.of(key), String.valueOf(window.toMillis()));
        if (value == null) {
            throw new IllegalStateException("Redis INCR returned no value for " + key);
        }
        return value;
    }

    @Override
    public Duration timeToLive(String key) {
        Long seconds = redisTemplate.getExpire(key, TimeUnit.SECONDS);
        if (seconds == null || seconds < 0) {
            return Duration.ZERO;
        }
        return Duration.ofSeconds(seconds);
    }
}
