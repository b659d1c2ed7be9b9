package com.songranker.ranking.repository;

import com.songranker.ranking.model.RankingSession;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface RankingSessionRepository extends ReactiveCrudRepository<RankingSession, UUID> {

    @Modifying
    @Query("UPDATE sessions SET convergence_score = :score WHERE id = :id")
    Mono<Integer> updateConvergenceScore(UUID id, int score);
}
