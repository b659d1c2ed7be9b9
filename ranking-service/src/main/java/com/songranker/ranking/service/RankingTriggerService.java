package com.songranker.ranking.service;

import com.songranker.common.trigger.RankingTriggerPolicy;
import com.songranker.ranking.config.RankingSettings;
import com.songranker.ranking.store.RankingScope;
import com.songranker.ranking.store.RankingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Called after every recorded outcome; re-ranks the session on every N-th one.
 */
@Service
public class RankingTriggerService {

    private static final Logger log = LoggerFactory.getLogger(RankingTriggerService.class);

    private final RankingStore             store;
    private final CollectionRankingService collectionRankingService;
    private final RankingSettings          settings;

    public RankingTriggerService(RankingStore store,
                                 CollectionRankingService collectionRankingService,
                                 RankingSettings settings) {
        this.store                    = store;
        this.collectionRankingService = collectionRankingService;
        this.settings                 = settings;
    }

    /** @return true when the session was re-ranked */
    public Mono<Boolean> onOutcomeRecorded(UUID sessionId) {
        return store.getOutcomeCount(RankingScope.session(sessionId))
            .flatMap(count -> {
                if (!RankingTriggerPolicy.isSessionRankDue(count, settings.everyNOutcomes())) {
                    log.debug("[Trigger] Not due. sessionId={} outcomes={}", sessionId, count);
                    return Mono.just(false);
                }
                log.info("[Trigger] Re-ranking session. sessionId={} outcomes={}", sessionId, count);
                return collectionRankingService.rankSession(sessionId).thenReturn(true);
            });
    }
}
