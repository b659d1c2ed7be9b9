package com.songranker.common.trigger;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides when a ranking run is worth doing.
 *
 * <ul>
 *   <li>A session is re-ranked on every {@code everyN}-th recorded outcome
 *       (5th, 10th, 15th …).</li>
 *   <li>An artist-wide aggregation is due when outcomes are pending and the last
 *       aggregation is missing or at least {@code interval} old.</li>
 * </ul>
 */
public final class RankingTriggerPolicy {

    public static final int      DEFAULT_EVERY_N_OUTCOMES = 5;
    public static final Duration DEFAULT_GLOBAL_INTERVAL  = Duration.ofMinutes(2);

    private RankingTriggerPolicy() {}

    public static boolean isSessionRankDue(long outcomeCount, int everyN) {
        if (everyN <= 0 || outcomeCount <= 0) return false;
        return outcomeCount % everyN == 0;
    }

    /** Outcomes recorded for the artist but not yet folded into the last aggregation. */
    public static long pendingOutcomes(long totalOutcomes, long processedOutcomes) {
        return Math.max(0L, totalOutcomes - processedOutcomes);
    }

    public static boolean isGlobalUpdateDue(long pendingOutcomes, Instant lastAggregatedAt,
                                            Instant now, Duration interval) {
        if (pendingOutcomes <= 0) return false;
        if (lastAggregatedAt == null) return true;
        return !Duration.between(lastAggregatedAt, now).minus(interval).isNegative();
    }
}
