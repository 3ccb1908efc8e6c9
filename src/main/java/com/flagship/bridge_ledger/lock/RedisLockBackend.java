package com.flagship.bridge_ledger.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Redis lock backend.
 *
 * Acquisition is {@code SET key owner NX PX ttl}; release deletes the key only
 * when it still holds the caller's owner value, so an expired lock taken over
 * by another worker is never released by the previous holder.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisLockBackend implements LockBackend {

    private static final long MIN_BACKOFF_MS = 25;
    private static final long MAX_BACKOFF_MS = 500;

    private static final RedisScript<Long> ACQUIRE_SCRIPT = new DefaultRedisScript<>("""
        if redis.call('SET', KEYS[1], ARGV[1], 'NX', 'PX', ARGV[2]) then
            return 1
        else
            return 0
        end
        """, Long.class);

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
        if redis.call('GET', KEYS[1]) == ARGV[1] then
            return redis.call('DEL', KEYS[1])
        else
            return 0
        end
        """, Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    public boolean acquire(String key, String ownerValue, Duration ttl, Duration blockingTimeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + blockingTimeout.toNanos();
        long backoff = MIN_BACKOFF_MS;
        while (true) {
            Long acquired = redisTemplate.execute(ACQUIRE_SCRIPT, List.of(key),
                ownerValue, String.valueOf(ttl.toMillis()));
            if (acquired != null && acquired == 1L) {
                return true;
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return false;
            }
            Thread.sleep(Math.min(backoff, remainingMs));
            backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
        }
    }

    @Override
    public boolean release(String key, String ownerValue) {
        Long released = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), ownerValue);
        return released != null && released > 0;
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    }

    @Override
    public Optional<String> holder(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public Map<String, Duration> activeLocks(String pattern) {
        Set<String> keys = redisTemplate.keys(pattern);
        if (keys == null || keys.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Duration> active = new LinkedHashMap<>();
        for (String key : new TreeSet<>(keys)) {
            Long ttlMs = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
            if (ttlMs != null && ttlMs > 0) {
                active.put(key, Duration.ofMillis(ttlMs));
            }
        }
        return active;
    }

    @Override
    public long clear(String pattern) {
        Set<String> keys = redisTemplate.keys(pattern);
        if (keys == null || keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        log.warn("Cleared {} locks matching {}", deleted, pattern);
        return deleted != null ? deleted : 0;
    }
}
