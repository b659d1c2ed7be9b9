package com.songranker.ranking.store;

import com.songranker.common.model.ItemRating;
import com.songranker.common.model.Outcome;
import com.songranker.ranking.model.Comparison;
import com.songranker.ranking.model.SessionSong;
import com.songranker.ranking.model.Song;
import com.songranker.ranking.repository.ArtistStatsRepository;
import com.songranker.ranking.repository.ComparisonRepository;
import com.songranker.ranking.repository.RankingSessionRepository;
import com.songranker.ranking.repository.SessionSongRepository;
import com.songranker.ranking.repository.SongRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * {@link RankingStore} over the relational schema. Session scopes read
 * {@code session_songs}; artist scopes read {@code songs} and every comparison between
 * two songs of the artist. Transactions are opened by the callers so one run's writes
 * commit together.
 */
@Component
public class R2dbcRankingStore implements RankingStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcRankingStore.class);

    private final SongRepository           songRepository;
    private final SessionSongRepository    sessionSongRepository;
    private final ComparisonRepository     comparisonRepository;
    private final RankingSessionRepository sessionRepository;
    private final ArtistStatsRepository    artistStatsRepository;

    public R2dbcRankingStore(SongRepository songRepository,
                             SessionSongRepository sessionSongRepository,
                             ComparisonRepository comparisonRepository,
                             RankingSessionRepository sessionRepository,
                             ArtistStatsRepository artistStatsRepository) {
        this.songRepository        = songRepository;
        this.sessionSongRepository = sessionSongRepository;
        this.comparisonRepository  = comparisonRepository;
        this.sessionRepository     = sessionRepository;
        this.artistStatsRepository = artistStatsRepository;
    }

    @Override
    public Mono<List<ItemRating>> getItems(RankingScope scope) {
        if (scope.isSession()) {
            return sessionSongRepository.findBySessionIdOrderBySongId(scope.sessionId())
                .map(R2dbcRankingStore::toItem)
                .collectList();
        }
        return songRepository.findByArtistNormalized(scope.key())
            .map(R2dbcRankingStore::toItem)
            .collectList();
    }

    @Override
    public Mono<List<Outcome>> getOutcomes(RankingScope scope) {
        Flux<Comparison> comparisons = scope.isSession()
            ? comparisonRepository.findBySessionChronological(scope.sessionId())
            : comparisonRepository.findByArtistChronological(scope.key());
        return comparisons.map(R2dbcRankingStore::toOutcome).collectList();
    }

    @Override
    public Mono<Long> getOutcomeCount(RankingScope scope) {
        Mono<Long> count = scope.isSession()
            ? comparisonRepository.countBySessionId(scope.sessionId())
            : comparisonRepository.countByArtist(scope.key());
        return count.defaultIfEmpty(0L);
    }

    @Override
    public Mono<Void> writeStrengths(RankingScope scope, List<ItemRating> ratings, Integer convergenceScore) {
        if (!scope.isSession()) {
            return Flux.fromIterable(ratings)
                .concatMap(r -> songRepository.updateGlobalRating(
                    UUID.fromString(r.itemId()), r.strength(), r.rating(), r.votesCount()))
                .reduce(0, Integer::sum)
                .doOnNext(rows -> log.debug("[Store] Global ratings written. artist={} rows={}", scope.key(), rows))
                .then();
        }

        UUID sessionId = scope.sessionId();
        Mono<Integer> items = Flux.fromIterable(ratings)
            .concatMap(r -> sessionSongRepository.updateLocalRating(
                sessionId, UUID.fromString(r.itemId()), r.strength(), r.rating()))
            .reduce(0, Integer::sum);
        Mono<Integer> score = convergenceScore == null
            ? Mono.just(0)
            : sessionRepository.updateConvergenceScore(sessionId, convergenceScore);

        return items.zipWith(score)
            .doOnNext(rows -> log.debug("[Store] Session ratings written. sessionId={} rows={} convergence={}",
                sessionId, rows.getT1(), convergenceScore))
            .then();
    }

    @Override
    public Mono<Instant> getLastAggregationTime(String artist) {
        return artistStatsRepository.findById(RankingScope.normalizeArtist(artist))
            .filter(stats -> stats.getLastGlobalUpdateAt() != null)
            .map(stats -> stats.getLastGlobalUpdateAt().toInstant(ZoneOffset.UTC));
    }

    @Override
    public Mono<Void> writeAggregationStats(String artist, long outcomeCount, Instant aggregatedAt) {
        return artistStatsRepository.upsertAggregation(
                RankingScope.normalizeArtist(artist), outcomeCount,
                LocalDateTime.ofInstant(aggregatedAt, ZoneOffset.UTC))
            .then();
    }

    // ── Mapping ─────────────────────────────────────────────────────────────

    static ItemRating toItem(SessionSong row) {
        double strength = row.getBtStrength() != null ? row.getBtStrength() : 0.0;
        return ItemRating.of(row.getSongId().toString(), strength);
    }

    static ItemRating toItem(Song song) {
        return ItemRating.of(song.getId().toString(), song.getGlobalBtStrength(), song.getGlobalVotesCount());
    }

    static Outcome toOutcome(Comparison c) {
        return new Outcome(
            idOrNull(c.getSongAId()),
            idOrNull(c.getSongBId()),
            idOrNull(c.getWinnerId()),
            c.isTie(),
            c.getDecisionTimeMs());
    }

    private static String idOrNull(UUID id) {
        return id != null ? id.toString() : null;
    }
}
