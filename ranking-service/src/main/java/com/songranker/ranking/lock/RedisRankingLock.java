package com.songranker.ranking.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RankingLock} on Redis: {@code SET key token NX PX ttl} to acquire, compare-and-delete
 * to release, so a process never deletes a lock that expired and was taken by another one.
 */
@Component
public class RedisRankingLock implements RankingLock {

    private static final Logger log = LoggerFactory.getLogger(RedisRankingLock.class);

    static final RedisScript<Long> UNLOCK_SCRIPT = RedisScript.of("""
        if redis.call('get', KEYS[1]) == ARGV[1] then
            return redis.call('del', KEYS[1])
        end
        return 0
        """, Long.class);

    private final ReactiveStringRedisTemplate redis;
    private final Clock                       clock;

    /**
     * Locks this process acquired, by key. A successful run leaves its lock to expire,
     * so entries past their TTL are pruned on every acquire.
     */
    private final Map<String, HeldLock> held = new ConcurrentHashMap<>();

    public RedisRankingLock(ReactiveStringRedisTemplate redis, Clock clock) {
        this.redis = redis;
        this.clock = clock;
    }

    @Override
    public Mono<Boolean> tryAcquire(String key, Duration ttl) {
        pruneExpired();
        String token = UUID.randomUUID().toString();
        return redis.opsForValue().setIfAbsent(key, token, ttl)
            .map(Boolean.TRUE::equals)
            .defaultIfEmpty(false)
            .doOnNext(acquired -> {
                if (acquired) {
                    held.put(key, new HeldLock(token, clock.instant().plus(ttl)));
                    log.debug("[Lock] Acquired. key={} ttl={}s", key, ttl.toSeconds());
                } else {
                    log.debug("[Lock] Held elsewhere. key={}", key);
                }
            });
    }

    @Override
    public Mono<Void> release(String key) {
        HeldLock lock = held.remove(key);
        if (lock == null) {
            return Mono.empty();
        }
        return redis.execute(UNLOCK_SCRIPT, List.of(key), List.of(lock.token()))
            .next()
            .doOnNext(deleted -> {
                if (deleted == 0L) {
                    log.warn("[Lock] Release found the lock expired or taken over. key={}", key);
                } else {
                    log.debug("[Lock] Released. key={}", key);
                }
            })
            .then();
    }

    /** Number of locks this process still considers held; pruned lazily. */
    int heldCount() {
        return held.size();
    }

    private void pruneExpired() {
        Instant now = clock.instant();
        held.values().removeIf(lock -> !lock.expiresAt().isAfter(now));
    }

    private record HeldLock(String token, Instant expiresAt) {}
}
