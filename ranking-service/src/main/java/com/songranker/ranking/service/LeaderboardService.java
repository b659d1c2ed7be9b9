package com.songranker.ranking.service;

import com.songranker.common.trigger.RankingTriggerPolicy;
import com.songranker.ranking.dto.ArtistStatsView;
import com.songranker.ranking.dto.LeaderboardEntry;
import com.songranker.ranking.dto.LeaderboardView;
import com.songranker.ranking.model.ArtistStats;
import com.songranker.ranking.model.Song;
import com.songranker.ranking.repository.ArtistStatsRepository;
import com.songranker.ranking.repository.SongRepository;
import com.songranker.ranking.store.RankingScope;
import com.songranker.ranking.store.RankingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the artist-wide ranking.
 *
 * <p>A read that finds the leaderboard stale (pending outcomes and an old or missing
 * aggregation) starts an aggregation in the background and still answers with the
 * current, stale data.
 */
@Service
public class LeaderboardService {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardService.class);

    static final int MIN_LIMIT = 1;
    static final int MAX_LIMIT = 500;

    private final SongRepository           songRepository;
    private final ArtistStatsRepository    artistStatsRepository;
    private final RankingStore             store;
    private final GlobalAggregationService globalAggregationService;

    public LeaderboardService(SongRepository songRepository,
                              ArtistStatsRepository artistStatsRepository,
                              RankingStore store,
                              GlobalAggregationService globalAggregationService) {
        this.songRepository           = songRepository;
        this.artistStatsRepository    = artistStatsRepository;
        this.store                    = store;
        this.globalAggregationService = globalAggregationService;
    }

    /**
     * Songs of the artist by global rating, best first.
     *
     * @param limit clamped to 1..500
     * @return empty when the artist has no songs
     */
    public Mono<LeaderboardView> getLeaderboard(String artist, int limit) {
        int clamped = Math.max(MIN_LIMIT, Math.min(MAX_LIMIT, limit));

        return songRepository.findLeaderboard(artist, clamped)
            .collectList()
            .filter(songs -> !songs.isEmpty())
            .flatMap(songs -> freshness(artist).map(f -> {
                if (globalAggregationService.shouldTrigger(f.pending(), f.lastUpdated())) {
                    log.info("[Leaderboard] Stale, triggering aggregation. artist={} pending={} lastUpdated={}",
                        artist, f.pending(), f.lastUpdated());
                    globalAggregationService.triggerInBackground(artist);
                }
                return new LeaderboardView(artist, toEntries(songs), f.processed(), f.pending(), f.lastUpdated());
            }));
    }

    /** Aggregation bookkeeping of the artist; processed 0 and null times before the first run. */
    public Mono<ArtistStatsView> getStats(String artist) {
        return freshness(artist)
            .map(f -> new ArtistStatsView(artist, f.processed(), f.pending(), f.lastUpdated(), f.createdAt()));
    }

    private Mono<Freshness> freshness(String artist) {
        Mono<ArtistStats> stats = artistStatsRepository.findById(RankingScope.normalizeArtist(artist))
            .defaultIfEmpty(new ArtistStats());
        return Mono.zip(stats, store.getOutcomeCount(RankingScope.artist(artist)))
            .map(t -> {
                ArtistStats s = t.getT1();
                long processed = s.getTotalComparisonsCount();
                return new Freshness(
                    processed,
                    RankingTriggerPolicy.pendingOutcomes(t.getT2(), processed),
                    toInstant(s.getLastGlobalUpdateAt()),
                    toInstant(s.getCreatedAt()));
            });
    }

    static List<LeaderboardEntry> toEntries(List<Song> songs) {
        List<LeaderboardEntry> entries = new ArrayList<>(songs.size());
        for (int i = 0; i < songs.size(); i++) {
            Song song = songs.get(i);
            entries.add(new LeaderboardEntry(i + 1, song.getId().toString(), song.getName(),
                song.getGlobalBtStrength(), song.getGlobalElo(), song.getGlobalVotesCount()));
        }
        return entries;
    }

    private static Instant toInstant(LocalDateTime time) {
        return time != null ? time.toInstant(ZoneOffset.UTC) : null;
    }

    private record Freshness(long processed, long pending, Instant lastUpdated, Instant createdAt) {}
}
