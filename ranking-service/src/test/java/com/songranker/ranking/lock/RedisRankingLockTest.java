package com.songranker.ranking.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisRankingLockTest {

    private static final String KEY = "global_update_lock:muse";
    private static final Duration TTL = Duration.ofSeconds(120);
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ReactiveStringRedisTemplate redis;
    private ReactiveValueOperations<String, String> ops;
    private Clock clock;
    private RedisRankingLock lock;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(ReactiveStringRedisTemplate.class);
        ops = mock(ReactiveValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(redis.execute(any(RedisScript.class), anyList(), anyList())).thenReturn(Flux.just(1L));
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW);
        lock = new RedisRankingLock(redis, clock);
    }

    @Test
    @DisplayName("SET NX with TTL; release deletes only with the same token")
    @SuppressWarnings("unchecked")
    void acquireThenRelease() {
        when(ops.setIfAbsent(eq(KEY), anyString(), eq(TTL))).thenReturn(Mono.just(true));

        assertTrue(lock.tryAcquire(KEY, TTL).block());
        lock.release(KEY).block();

        ArgumentCaptor<String> token = ArgumentCaptor.forClass(String.class);
        verify(ops).setIfAbsent(eq(KEY), token.capture(), eq(TTL));
        ArgumentCaptor<List> args = ArgumentCaptor.forClass(List.class);
        verify(redis).execute(eq(RedisRankingLock.UNLOCK_SCRIPT), eq(List.of(KEY)), args.capture());
        assertEquals(List.of(token.getValue()), args.getValue());
    }

    @Test
    @DisplayName("held elsewhere → false, and release is a no-op")
    void contention() {
        when(ops.setIfAbsent(eq(KEY), anyString(), eq(TTL))).thenReturn(Mono.just(false));

        assertFalse(lock.tryAcquire(KEY, TTL).block());
        lock.release(KEY).block();

        verify(redis, never()).execute(any(RedisScript.class), anyList(), anyList());
    }

    @Test
    @DisplayName("empty reply from Redis counts as not acquired")
    void emptyReply() {
        when(ops.setIfAbsent(eq(KEY), anyString(), eq(TTL))).thenReturn(Mono.empty());

        assertFalse(lock.tryAcquire(KEY, TTL).block());
    }

    @Test
    @DisplayName("expired lock on release is tolerated")
    void releaseAfterExpiry() {
        when(ops.setIfAbsent(eq(KEY), anyString(), eq(TTL))).thenReturn(Mono.just(true));
        when(redis.execute(any(RedisScript.class), anyList(), anyList())).thenReturn(Flux.just(0L));

        lock.tryAcquire(KEY, TTL).block();

        assertDoesNotThrow(() -> lock.release(KEY).block());
    }

    @Test
    @DisplayName("locks left to expire after a successful run are forgotten once their TTL passes")
    void expiredLocksArePruned() {
        when(ops.setIfAbsent(anyString(), anyString(), eq(TTL))).thenReturn(Mono.just(true));

        lock.tryAcquire("global_update_lock:muse", TTL).block();
        lock.tryAcquire("global_update_lock:blur", TTL).block();
        assertEquals(2, lock.heldCount());

        when(clock.instant()).thenReturn(NOW.plus(TTL).plusSeconds(1));
        lock.tryAcquire("global_update_lock:oasis", TTL).block();

        assertEquals(1, lock.heldCount());
        lock.release("global_update_lock:muse").block();
        verify(redis, never()).execute(any(RedisScript.class), anyList(), anyList());
    }

    @Test
    @DisplayName("a lock still within its TTL is kept and released with its token")
    void liveLockSurvivesPruning() {
        when(ops.setIfAbsent(anyString(), anyString(), eq(TTL))).thenReturn(Mono.just(true));

        lock.tryAcquire(KEY, TTL).block();
        when(clock.instant()).thenReturn(NOW.plusSeconds(60));
        lock.tryAcquire("global_update_lock:blur", TTL).block();

        assertEquals(2, lock.heldCount());
        lock.release(KEY).block();
        verify(redis).execute(eq(RedisRankingLock.UNLOCK_SCRIPT), eq(List.of(KEY)), anyList());
    }
}
