package com.songranker.ranking.config;

import com.songranker.common.convergence.ConvergenceScorer;
import com.songranker.common.solver.SolverSettings;
import com.songranker.common.trigger.RankingTriggerPolicy;

import java.time.Duration;

/**
 * Tuning shared by every ranking run, bound from {@code ranking.*} in application.yml.
 *
 * @param solver          regularization, iteration cap and tolerance of the strength solver
 * @param lookback        outcomes withheld by the stability check
 * @param everyNOutcomes  session re-rank cadence
 * @param globalInterval  minimum age of the last artist aggregation before a stale read re-triggers it
 * @param lockTtl         artist lock lifetime; left to expire on success, so it doubles as a cooldown
 * @param lockKeyPrefix   prefix of the artist lock key
 */
public record RankingSettings(
    SolverSettings solver,
    int            lookback,
    int            everyNOutcomes,
    Duration       globalInterval,
    Duration       lockTtl,
    String         lockKeyPrefix
) {

    public static RankingSettings defaults() {
        return new RankingSettings(
            SolverSettings.DEFAULTS,
            ConvergenceScorer.DEFAULT_LOOKBACK,
            RankingTriggerPolicy.DEFAULT_EVERY_N_OUTCOMES,
            RankingTriggerPolicy.DEFAULT_GLOBAL_INTERVAL,
            Duration.ofSeconds(120),
            "global_update_lock:");
    }
}
