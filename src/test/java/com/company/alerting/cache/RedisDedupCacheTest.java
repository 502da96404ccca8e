package com.company.alerting.cache;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisDedupCacheTest {

    private static final Duration WINDOW = Duration.ofMinutes(5);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private SimpleMeterRegistry meterRegistry;
    private RedisDedupCache cache;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        cache = new RedisDedupCache(redisTemplate, meterRegistry);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void firstClaimWins() {
        when(valueOperations.setIfAbsent("alert:dedup:abc", "evt-1", WINDOW)).thenReturn(true);
        when(valueOperations.setIfAbsent("alert:dedup:abc", "evt-2", WINDOW)).thenReturn(false);

        assertThat(cache.claim("alert:dedup:abc", "evt-1", WINDOW)).isTrue();
        assertThat(cache.claim("alert:dedup:abc", "evt-2", WINDOW)).isFalse();
    }

    @Test
    void unavailableRedisLetsEventsThrough() {
        when(valueOperations.setIfAbsent("alert:dedup:abc", "evt-1", WINDOW))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(cache.claim("alert:dedup:abc", "evt-1", WINDOW)).isTrue();
        assertThat(meterRegistry.counter("alerts.dedup.errors").count()).isEqualTo(1.0);
    }

    @Test
    void nullReplyInsidePipelineCountsAsClaimed() {
        when(valueOperations.setIfAbsent("alert:dedup:abc", "evt-1", WINDOW)).thenReturn(null);

        assertThat(cache.claim("alert:dedup:abc", "evt-1", WINDOW)).isTrue();
    }
}
