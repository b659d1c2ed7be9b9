package com.songranker.ranking.service;

import com.songranker.common.convergence.ConvergenceResult;
import com.songranker.common.exception.RankingException;
import com.songranker.common.model.ItemRating;
import com.songranker.common.model.Outcome;
import com.songranker.common.trigger.RankingTriggerPolicy;
import com.songranker.ranking.config.RankingSettings;
import com.songranker.ranking.dto.RankingRunResult;
import com.songranker.ranking.lock.RankingLock;
import com.songranker.ranking.store.RankingScope;
import com.songranker.ranking.store.RankingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Artist-wide ranking: one solve over every outcome between two songs of the artist,
 * across all sessions.
 *
 * <h3>Locking</h3>
 * A run starts only after taking the artist's lock ({@code prefix + normalized artist}).
 * If another process holds it the run is skipped and the returned Mono completes empty.
 * On failure the lock is released so the next trigger may retry at once; on success it
 * is left to expire, which enforces a cooldown of one lock TTL between runs.
 *
 * <h3>Writes</h3>
 * Global strength, rating and vote count of every song plus the artist stats row are
 * written in one transaction. An artist with songs but no outcomes gets neutral
 * defaults without a solve.
 */
@Service
public class GlobalAggregationService {

    private static final Logger log = LoggerFactory.getLogger(GlobalAggregationService.class);

    private final RankingStore          store;
    private final RankingLock           lock;
    private final TransactionalOperator transactionalOperator;
    private final RankingSettings       settings;
    private final Clock                 clock;

    public GlobalAggregationService(RankingStore store,
                                    RankingLock lock,
                                    TransactionalOperator transactionalOperator,
                                    RankingSettings settings,
                                    Clock clock) {
        this.store                 = store;
        this.lock                  = lock;
        this.transactionalOperator = transactionalOperator;
        this.settings              = settings;
        this.clock                 = clock;
    }

    /**
     * @return the written ratings, or empty when another process is aggregating the artist;
     *         errors with {@link RankingException} when the run fails
     */
    public Mono<RankingRunResult> aggregateArtist(String artist) {
        String key = lockKey(artist);

        return lock.tryAcquire(key, settings.lockTtl())
            .flatMap(acquired -> {
                if (!acquired) {
                    log.info("[GlobalRank] Skipped, aggregation already running. artist={} key={}", artist, key);
                    return Mono.<RankingRunResult>empty();
                }
                return runLocked(artist)
                    .onErrorResume(e -> lock.release(key)
                        .onErrorResume(releaseError -> {
                            log.warn("[GlobalRank] Lock release failed, lock will expire. key={} reason={}",
                                key, releaseError.getMessage());
                            return Mono.empty();
                        })
                        .then(Mono.<RankingRunResult>error(e)));
            })
            .onErrorMap(e -> !(e instanceof RankingException),
                e -> new RankingException(artist, "Global aggregation failed: " + e.getMessage(), e));
    }

    /** Lock key for the artist: trimmed and lower-cased so spelling variants share one lock. */
    public String lockKey(String artist) {
        return settings.lockKeyPrefix() + RankingScope.normalizeArtist(artist);
    }

    /**
     * True when outcomes arrived since the last aggregation and that aggregation is
     * missing or at least one interval old.
     */
    public boolean shouldTrigger(long pendingOutcomes, Instant lastAggregatedAt) {
        return RankingTriggerPolicy.isGlobalUpdateDue(
            pendingOutcomes, lastAggregatedAt, clock.instant(), settings.globalInterval());
    }

    /** Fire-and-forget aggregation; failures are logged, never propagated. */
    public void triggerInBackground(String artist) {
        aggregateArtist(artist)
            .subscribe(
                result -> log.info("[GlobalRank] Background aggregation done. artist={} items={}",
                    artist, result.ratings().size()),
                err -> log.warn("[GlobalRank] Background aggregation failed (non-critical). artist={} reason={}",
                    artist, err.getMessage()));
    }

    // ── Run ─────────────────────────────────────────────────────────────────

    private Mono<RankingRunResult> runLocked(String artist) {
        RankingScope scope = RankingScope.artist(artist);
        long startTime = System.currentTimeMillis();

        return Mono.zip(store.getItems(scope), store.getOutcomes(scope))
            .flatMap(t -> {
                List<ItemRating> items = t.getT1();
                List<Outcome> outcomes = t.getT2();
                if (items.isEmpty()) {
                    log.info("[GlobalRank] No songs for artist, nothing to aggregate. artist={}", artist);
                    return Mono.just(new RankingRunResult(artist, List.of(), ConvergenceResult.settled(),
                        outcomes.size(), 0, false));
                }
                if (outcomes.isEmpty()) {
                    return initializeIdle(scope, items);
                }
                return solveAndWrite(scope, items, outcomes);
            })
            .doOnSuccess(result -> log.info(
                "[GlobalRank] Aggregated. artist={} items={} outcomes={} convergence={} latencyMs={}",
                artist, result.ratings().size(), result.outcomes(),
                result.convergence().score(), System.currentTimeMillis() - startTime))
            .doOnError(e -> log.error("[GlobalRank] Failed. artist={}", artist, e));
    }

    private Mono<RankingRunResult> initializeIdle(RankingScope scope, List<ItemRating> items) {
        List<ItemRating> neutral = items.stream()
            .map(item -> ItemRating.neutral(item.itemId()))
            .collect(Collectors.toList());
        log.info("[GlobalRank] No outcomes yet, writing neutral defaults. artist={} items={}",
            scope.key(), neutral.size());
        RankingRunResult result = new RankingRunResult(scope.key(), neutral, ConvergenceResult.empty(), 0, 0, false);
        return write(scope, result);
    }

    private Mono<RankingRunResult> solveAndWrite(RankingScope scope, List<ItemRating> items, List<Outcome> outcomes) {
        return Mono.fromCallable(() -> RankingComputation.compute(scope.key(), items, outcomes, settings, true))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(computed -> {
                RunDiagnostics.report(log, "[GlobalRank]", scope, computed.solver());
                return write(scope, computed.result());
            });
    }

    private Mono<RankingRunResult> write(RankingScope scope, RankingRunResult result) {
        Instant now = clock.instant();
        Mono<Void> writes = store.writeStrengths(scope, result.ratings(), null)
            .then(store.writeAggregationStats(scope.key(), result.outcomes(), now));
        return transactionalOperator.transactional(writes).thenReturn(result);
    }
}
