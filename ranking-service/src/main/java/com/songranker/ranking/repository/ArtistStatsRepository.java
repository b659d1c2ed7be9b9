package com.songranker.ranking.repository;

import com.songranker.ranking.model.ArtistStats;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ArtistStatsRepository extends ReactiveCrudRepository<ArtistStats, String> {

    /**
     * Atomic UPSERT of the aggregation bookkeeping. {@code created_at} is only set on
     * the first insert.
     *
     * @param artist      normalized artist key
     * @param outcomes    outcomes folded into this aggregation
     * @param aggregated  completion time of the aggregation (UTC)
     */
    @Modifying
    @Query("""
        INSERT INTO artist_stats (artist, last_global_update_at, total_comparisons_count, created_at)
        VALUES (:artist, :aggregated, :outcomes, :aggregated)
        ON CONFLICT (artist) DO UPDATE SET
            last_global_update_at   = :aggregated,
            total_comparisons_count = :outcomes
        """)
    Mono<Integer> upsertAggregation(String artist, long outcomes, LocalDateTime aggregated);
}
