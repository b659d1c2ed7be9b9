package com.songranker.ranking.service;

import com.songranker.common.exception.RankingException;
import com.songranker.common.model.ItemRating;
import com.songranker.common.model.Outcome;
import com.songranker.ranking.config.RankingSettings;
import com.songranker.ranking.dto.RankingRunResult;
import com.songranker.ranking.lock.RankingLock;
import com.songranker.ranking.store.RankingScope;
import com.songranker.ranking.store.RankingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit test for {@link GlobalAggregationService}: lock handling, idle initialization,
 * vote accounting and the re-aggregation gate.
 */
class GlobalAggregationServiceTest {

    private static final String ARTIST = "Radiohead";
    private static final String KEY    = "global_update_lock:radiohead";
    private static final Instant NOW   = Instant.parse("2024-06-01T12:00:00Z");
    private static final RankingScope SCOPE = RankingScope.artist(ARTIST);

    private RankingStore store;
    private RankingLock lock;
    private TransactionalOperator transactionalOperator;
    private GlobalAggregationService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        store = mock(RankingStore.class);
        lock = mock(RankingLock.class);
        transactionalOperator = mock(TransactionalOperator.class);
        when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        when(lock.tryAcquire(anyString(), any(Duration.class))).thenReturn(Mono.just(true));
        when(lock.release(anyString())).thenReturn(Mono.empty());
        when(store.writeStrengths(any(), anyList(), any())).thenReturn(Mono.empty());
        when(store.writeAggregationStats(anyString(), anyLong(), any())).thenReturn(Mono.empty());
        service = new GlobalAggregationService(store, lock, transactionalOperator,
            RankingSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenArtist(List<ItemRating> items, List<Outcome> outcomes) {
        when(store.getItems(SCOPE)).thenReturn(Mono.just(items));
        when(store.getOutcomes(SCOPE)).thenReturn(Mono.just(outcomes));
    }

    @Nested
    @DisplayName("aggregateArtist() — locking")
    class Locking {

        @Test
        @DisplayName("lock held elsewhere → skipped silently, nothing read")
        void contention() {
            when(lock.tryAcquire(anyString(), any(Duration.class))).thenReturn(Mono.just(false));

            assertNull(service.aggregateArtist(ARTIST).block());

            verify(store, never()).getOutcomes(any());
            verify(store, never()).writeStrengths(any(), anyList(), any());
        }

        @Test
        @DisplayName("lock key is prefix + trimmed lower-case artist, TTL from settings")
        void normalizedKey() {
            assertEquals(KEY, service.lockKey("  RadioHead "));
            when(store.getItems(any())).thenReturn(Mono.just(List.of()));
            when(store.getOutcomes(any())).thenReturn(Mono.just(List.of()));

            service.aggregateArtist("  RadioHead ").block();

            verify(lock).tryAcquire(KEY, Duration.ofSeconds(120));
        }

        @Test
        @DisplayName("success leaves the lock to expire")
        void successKeepsLock() {
            givenArtist(List.of(ItemRating.neutral("A"), ItemRating.neutral("B")),
                List.of(Outcome.win("A", "B")));

            service.aggregateArtist(ARTIST).block();

            verify(lock, never()).release(anyString());
        }

        @Test
        @DisplayName("write failure releases the lock and surfaces RankingException")
        void failureReleasesLock() {
            givenArtist(List.of(ItemRating.neutral("A"), ItemRating.neutral("B")),
                List.of(Outcome.win("A", "B")));
            when(store.writeStrengths(any(), anyList(), any()))
                .thenReturn(Mono.error(new IllegalStateException("deadlock detected")));

            RankingException e = assertThrows(RankingException.class,
                () -> service.aggregateArtist(ARTIST).block());

            assertEquals(ARTIST, e.getScope());
            verify(lock).release(KEY);
            verify(store, never()).writeAggregationStats(anyString(), anyLong(), any());
        }

        @Test
        @DisplayName("failing release does not hide the original failure")
        void releaseFailure() {
            when(store.getItems(SCOPE)).thenReturn(Mono.error(new IllegalStateException("db down")));
            when(store.getOutcomes(SCOPE)).thenReturn(Mono.just(List.of()));
            when(lock.release(KEY)).thenReturn(Mono.error(new IllegalStateException("redis down")));

            RankingException e = assertThrows(RankingException.class,
                () -> service.aggregateArtist(ARTIST).block());

            assertEquals("db down", e.getCause().getMessage());
        }
    }

    @Nested
    @DisplayName("aggregateArtist() — computation")
    class Computation {

        @Test
        @DisplayName("songs without outcomes → neutral defaults, no solve, stats with 0 outcomes")
        void idleInitialization() {
            givenArtist(List.of(ItemRating.of("A", 2.0, 7), ItemRating.of("B", -2.0, 7)), List.of());

            RankingRunResult result = service.aggregateArtist(ARTIST).block();

            assertEquals(List.of(ItemRating.neutral("A"), ItemRating.neutral("B")), result.ratings());
            verify(store).writeStrengths(SCOPE, result.ratings(), null);
            verify(store).writeAggregationStats(ARTIST, 0L, NOW);
        }

        @Test
        @DisplayName("votes count every referencing outcome, skips included")
        void voteAccounting() {
            givenArtist(List.of(ItemRating.neutral("A"), ItemRating.neutral("B"), ItemRating.neutral("C")),
                List.of(Outcome.win("A", "B"), Outcome.skip("A", "C"), Outcome.tie("B", "C"),
                        Outcome.win("A", "B", 1_500L)));

            RankingRunResult result = service.aggregateArtist(ARTIST).block();

            Map<String, Long> votes = result.ratings().stream()
                .collect(Collectors.toMap(ItemRating::itemId, ItemRating::votesCount));
            assertEquals(Map.of("A", 3L, "B", 3L, "C", 2L), votes);
            verify(store).writeStrengths(eq(SCOPE), eq(result.ratings()), isNull());
            verify(store).writeAggregationStats(ARTIST, 4L, NOW);
        }

        @Test
        @DisplayName("artist-wide strengths follow the cross-session outcomes")
        void strengthsOrdered() {
            givenArtist(List.of(ItemRating.neutral("A"), ItemRating.neutral("B"), ItemRating.neutral("C")),
                List.of(Outcome.win("A", "B"), Outcome.win("B", "C"), Outcome.win("A", "C")));

            RankingRunResult result = service.aggregateArtist(ARTIST).block();

            Map<String, Double> s = result.ratings().stream()
                .collect(Collectors.toMap(ItemRating::itemId, ItemRating::strength));
            assertEquals(5.3082429, s.get("A"), 1e-6);
            assertEquals(-5.3082429, s.get("C"), 1e-6);
            assertEquals(46, result.convergence().score());
        }

        @Test
        @DisplayName("artist without songs → nothing written")
        void noSongs() {
            givenArtist(List.of(), List.of());

            RankingRunResult result = service.aggregateArtist(ARTIST).block();

            assertTrue(result.ratings().isEmpty());
            verify(store, never()).writeStrengths(any(), anyList(), any());
        }
    }

    @Nested
    @DisplayName("shouldTrigger()")
    class Gate {

        @Test
        @DisplayName("nothing pending → false")
        void nothingPending() {
            assertFalse(service.shouldTrigger(0, null));
        }

        @Test
        @DisplayName("pending and never aggregated → true")
        void neverAggregated() {
            assertTrue(service.shouldTrigger(2, null));
        }

        @Test
        @DisplayName("pending, last run 1 min ago → false; 3 min ago → true")
        void interval() {
            assertFalse(service.shouldTrigger(2, NOW.minus(Duration.ofMinutes(1))));
            assertTrue(service.shouldTrigger(2, NOW.minus(Duration.ofMinutes(3))));
        }
    }
}
