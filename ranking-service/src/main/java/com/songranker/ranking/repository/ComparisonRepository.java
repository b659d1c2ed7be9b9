package com.songranker.ranking.repository;

import com.songranker.ranking.model.Comparison;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Read side of the duel history. Every list is chronological ({@code created_at, id}):
 * the stability check withholds the most recent outcomes and depends on that order.
 */
@Repository
public interface ComparisonRepository extends ReactiveCrudRepository<Comparison, UUID> {

    @Query("""
        SELECT * FROM comparisons
        WHERE session_id = :sessionId
        ORDER BY created_at ASC, id ASC
        """)
    Flux<Comparison> findBySessionChronological(UUID sessionId);

    Mono<Long> countBySessionId(UUID sessionId);

    /** All duels between two songs of the artist, across every session. */
    @Query("""
        SELECT c.* FROM comparisons c
        JOIN songs a ON a.id = c.song_a_id
        JOIN songs b ON b.id = c.song_b_id
        WHERE LOWER(TRIM(a.artist)) = LOWER(TRIM(:artist))
          AND LOWER(TRIM(b.artist)) = LOWER(TRIM(:artist))
        ORDER BY c.created_at ASC, c.id ASC
        """)
    Flux<Comparison> findByArtistChronological(String artist);

    @Query("""
        SELECT COUNT(*) FROM comparisons c
        JOIN songs a ON a.id = c.song_a_id
        JOIN songs b ON b.id = c.song_b_id
        WHERE LOWER(TRIM(a.artist)) = LOWER(TRIM(:artist))
          AND LOWER(TRIM(b.artist)) = LOWER(TRIM(:artist))
        """)
    Mono<Long> countByArtist(String artist);
}
