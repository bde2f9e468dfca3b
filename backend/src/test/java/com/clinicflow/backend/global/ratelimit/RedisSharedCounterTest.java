package com.clinicflow.backend.global.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;

@ExtendWith(MockitoExtension.class)
class RedisSharedCounterTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    private RedisSharedCounter counter;

    @BeforeEach
    void setUp() {
        counter = new RedisSharedCounter(redisTemplate);
    }

    @Test
    @DisplayName("increment and window expiry run as one script with the window in milliseconds")
    void incrementRunsAtomically() {
        when(redisTemplate.execute(same(RedisSharedCounter.INCREMENT_IN_WINDOW), eq(List.of("k")), eq("60000")))
                .thenReturn(1L);

        assertThat(counter.increment("k", Duration.ofMinutes(1))).isEqualTo(1L);
        verify(redisTemplate, never()).expire(any(String.class), any(Duration.class));
        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    @DisplayName("the script re-arms a counter that lost its expiry")
    void scriptRepairsMissingExpiry() {
        String script = RedisSharedCounter.INCREMENT_IN_WINDOW.getScriptAsString();

        assertThat(script).contains("redis.call('INCR', KEYS[1])");
        assertThat(script).contains("count == 1 or redis.call('PTTL', KEYS[1]) == -1");
        assertThat(script).contains("redis.call('PEXPIRE', KEYS[1], ARGV[1])");
        assertThat(RedisSharedCounter.INCREMENT_IN_WINDOW.getResultType()).isEqualTo(Long.class);
    }

    @Test
    @DisplayName("a missing reply from Redis is an error, not a zero count")
    void missingReply() {
        when(redisTemplate.execute(same(RedisSharedCounter.INCREMENT_IN_WINDOW), eq(List.of("k")), eq("1000")))
                .thenReturn(null);

        assertThatThrownBy(() -> counter.increment("k", Duration.ofSeconds(1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("keys without expiry report no remaining time")
    void timeToLive() {
        when(redisTemplate.getExpire("k", TimeUnit.SECONDS)).thenReturn(-1L);
        when(redisTemplate.getExpire("j", TimeUnit.SECONDS)).thenReturn(30L);

        assertThat(counter.timeToLive("k")).isEqualTo(Duration.ZERO);
        assertThat(counter.timeToLive("j")).isEqualTo(Duration.ofSeconds(30));
    }
}
