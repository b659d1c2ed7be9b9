package com.songranker.ranking.repository;

import com.songranker.ranking.model.Song;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface SongRepository extends ReactiveCrudRepository<Song, UUID> {

    /** Artist match is case- and whitespace-insensitive, same as the lock key. */
    @Query("""
        SELECT * FROM songs
        WHERE LOWER(TRIM(artist)) = LOWER(TRIM(:artist))
        ORDER BY id
        """)
    Flux<Song> findByArtistNormalized(String artist);

    @Query("""
        SELECT * FROM songs
        WHERE LOWER(TRIM(artist)) = LOWER(TRIM(:artist))
        ORDER BY global_elo DESC, name ASC, id ASC
        LIMIT :limit
        """)
    Flux<Song> findLeaderboard(String artist, int limit);

    @Modifying
    @Query("""
        UPDATE songs
        SET global_bt_strength = :strength,
            global_elo         = :rating,
            global_votes_count = :votes
        WHERE id = :id
        """)
    Mono<Integer> updateGlobalRating(UUID id, double strength, double rating, long votes);
}
