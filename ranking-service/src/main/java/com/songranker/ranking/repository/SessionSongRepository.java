package com.songranker.ranking.repository;

import com.songranker.ranking.model.SessionSong;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface SessionSongRepository extends ReactiveCrudRepository<SessionSong, UUID> {

    Flux<SessionSong> findBySessionIdOrderBySongId(UUID sessionId);

    @Modifying
    @Query("""
        UPDATE session_songs
        SET bt_strength = :strength,
            local_elo   = :rating
        WHERE session_id = :sessionId
          AND song_id    = :songId
        """)
    Mono<Integer> updateLocalRating(UUID sessionId, UUID songId, double strength, double rating);
}
