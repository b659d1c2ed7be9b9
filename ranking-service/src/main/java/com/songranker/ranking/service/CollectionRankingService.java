package com.songranker.ranking.service;

import com.songranker.common.exception.RankingException;
import com.songranker.common.model.ItemRating;
import com.songranker.common.model.Outcome;
import com.songranker.ranking.config.RankingSettings;
import com.songranker.ranking.dto.RankingRunResult;
import com.songranker.ranking.store.RankingScope;
import com.songranker.ranking.store.RankingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.UUID;

/**
 * Re-ranks one session from its full outcome history.
 *
 * <p>Reads the session's songs (their stored strengths seed the solver) and outcomes,
 * solves and scores on {@code boundedElastic}, then writes every song's strength and
 * rating plus the session's convergence score in one transaction.
 *
 * <p>Runs for different sessions may overlap. Runs for the same session are not
 * ordered here; callers serialize them.
 */
@Service
public class CollectionRankingService {

    private static final Logger log = LoggerFactory.getLogger(CollectionRankingService.class);

    private final RankingStore          store;
    private final TransactionalOperator transactionalOperator;
    private final RankingSettings       settings;

    public CollectionRankingService(RankingStore store,
                                    TransactionalOperator transactionalOperator,
                                    RankingSettings settings) {
        this.store                 = store;
        this.transactionalOperator = transactionalOperator;
        this.settings              = settings;
    }

    /**
     * @return the written ratings and convergence; errors with {@link RankingException}
     *         when reading or writing fails (nothing is written in that case)
     */
    public Mono<RankingRunResult> rankSession(UUID sessionId) {
        RankingScope scope = RankingScope.session(sessionId);
        long startTime = System.currentTimeMillis();

        return Mono.zip(store.getItems(scope), store.getOutcomes(scope))
            .flatMap(t -> compute(scope, t.getT1(), t.getT2()))
            .flatMap(result -> transactionalOperator.transactional(
                    store.writeStrengths(scope, result.ratings(), result.convergence().score()))
                .thenReturn(result))
            .doOnSuccess(result -> log.info(
                "[SessionRank] Ranked. sessionId={} items={} outcomes={} convergence={} latencyMs={}",
                sessionId, result.ratings().size(), result.outcomes(),
                result.convergence().score(), System.currentTimeMillis() - startTime))
            .doOnError(e -> log.error("[SessionRank] Failed. sessionId={}", sessionId, e))
            .onErrorMap(e -> !(e instanceof RankingException),
                e -> new RankingException(scope.key(), "Session ranking failed: " + e.getMessage(), e));
    }

    private Mono<RankingRunResult> compute(RankingScope scope, List<ItemRating> items, List<Outcome> outcomes) {
        return Mono.fromCallable(() -> RankingComputation.compute(scope.key(), items, outcomes, settings, false))
            .subscribeOn(Schedulers.boundedElastic())
            .map(computed -> {
                RunDiagnostics.report(log, "[SessionRank]", scope, computed.solver());
                return computed.result();
            });
    }
}
