package com.songranker.ranking.controller;

import com.songranker.ranking.dto.ArtistStatsView;
import com.songranker.ranking.dto.LeaderboardView;
import com.songranker.ranking.dto.RankingRunResult;
import com.songranker.ranking.service.CollectionRankingService;
import com.songranker.ranking.service.GlobalAggregationService;
import com.songranker.ranking.service.LeaderboardService;
import com.songranker.ranking.service.RankingTriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/rankings")
public class RankingController {

    private static final Logger log = LoggerFactory.getLogger(RankingController.class);

    private final CollectionRankingService collectionRankingService;
    private final GlobalAggregationService globalAggregationService;
    private final RankingTriggerService    rankingTriggerService;
    private final LeaderboardService       leaderboardService;

    public RankingController(CollectionRankingService collectionRankingService,
                             GlobalAggregationService globalAggregationService,
                             RankingTriggerService rankingTriggerService,
                             LeaderboardService leaderboardService) {
        this.collectionRankingService = collectionRankingService;
        this.globalAggregationService = globalAggregationService;
        this.rankingTriggerService    = rankingTriggerService;
        this.leaderboardService       = leaderboardService;
    }

    @PostMapping("/sessions/{sessionId}/rank")
    public Mono<RankingRunResult> rankSession(@PathVariable UUID sessionId) {
        log.info("Session rank requested. sessionId={}", sessionId);
        return collectionRankingService.rankSession(sessionId);
    }

    /** Called by the duel recorder after each outcome. */
    @PostMapping("/sessions/{sessionId}/outcome-recorded")
    public Mono<Map<String, Boolean>> outcomeRecorded(@PathVariable UUID sessionId) {
        return rankingTriggerService.onOutcomeRecorded(sessionId)
            .map(ranked -> Map.of("ranked", ranked));
    }

    /** 202 with the result, or 409 when another process is already aggregating the artist. */
    @PostMapping("/artists/{artist}/aggregate")
    public Mono<ResponseEntity<RankingRunResult>> aggregate(@PathVariable String artist) {
        log.info("Artist aggregation requested. artist={}", artist);
        return globalAggregationService.aggregateArtist(artist)
            .map(result -> ResponseEntity.status(HttpStatus.ACCEPTED).body(result))
            .defaultIfEmpty(ResponseEntity.status(HttpStatus.CONFLICT).build());
    }

    @GetMapping("/artists/{artist}/leaderboard")
    public Mono<ResponseEntity<LeaderboardView>> leaderboard(@PathVariable String artist,
                                                             @RequestParam(defaultValue = "100") int limit) {
        return leaderboardService.getLeaderboard(artist, limit)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Leaderboard endpoint error. artist={}", artist, e));
    }

    @GetMapping("/artists/{artist}/stats")
    public Mono<ArtistStatsView> stats(@PathVariable String artist) {
        return leaderboardService.getStats(artist);
    }
}
