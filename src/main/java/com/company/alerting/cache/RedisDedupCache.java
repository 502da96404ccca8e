package com.company.alerting.cache;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * SETNX-with-TTL window shared by every engine instance.
 * When Redis is unreachable the cache fails open: a duplicate is preferable to a lost alert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisDedupCache {

    private final StringRedisTemplate redisTemplate;
    private final MeterRegistry meterRegistry;

    /**
     * @return true if this caller claimed the key, false if it was already claimed within the window
     */
    public boolean claim(String key, String owner, Duration window) {
        try {
            Boolean claimed = redisTemplate.opsForValue().setIfAbsent(key, owner, window);
            if (Boolean.FALSE.equals(claimed)) {
                log.debug("Dedup key {} already claimed, owner {} skipped", key, owner);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            log.warn("Dedup cache unavailable, letting {} through: {}", owner, e.getMessage());
            meterRegistry.counter("alerts.dedup.errors").increment();
            return true;
        }
    }
}
