package com.songranker.ranking.store;

import com.songranker.common.model.ItemRating;
import com.songranker.common.model.Outcome;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Persistence seen by the ranking runs. Implementations only read outcomes and write
 * back strengths; outcomes themselves are created elsewhere.
 */
public interface RankingStore {

    /** Items of the scope with their currently stored strength and rating. */
    Mono<List<ItemRating>> getItems(RankingScope scope);

    /** Outcomes of the scope, oldest first. */
    Mono<List<Outcome>> getOutcomes(RankingScope scope);

    /** Number of outcomes recorded for the scope, skips included. */
    Mono<Long> getOutcomeCount(RankingScope scope);

    /**
     * Overwrites strength and rating of the given items (plus the vote count for artist
     * scopes) and, when {@code convergenceScore} is not null, the session's score.
     */
    Mono<Void> writeStrengths(RankingScope scope, List<ItemRating> ratings, Integer convergenceScore);

    /** Completion time of the last artist aggregation; empty when there was none. */
    Mono<Instant> getLastAggregationTime(String artist);

    Mono<Void> writeAggregationStats(String artist, long outcomeCount, Instant aggregatedAt);
}
