package com.songranker.ranking.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Cross-process mutual exclusion keyed by a string. A lock that is never released
 * expires after its TTL.
 */
public interface RankingLock {

    /** Emits {@code true} when this process now holds {@code key}, {@code false} when someone else does. */
    Mono<Boolean> tryAcquire(String key, Duration ttl);

    /** Releases {@code key} if this process still holds it; no-op otherwise. */
    Mono<Void> release(String key);
}
