package com.songranker.ranking.service;

import com.songranker.common.convergence.ConvergenceResult;
import com.songranker.common.convergence.ConvergenceScorer;
import com.songranker.common.model.ItemRating;
import com.songranker.common.model.Outcome;
import com.songranker.common.solver.SolverResult;
import com.songranker.common.solver.StrengthSolver;
import com.songranker.ranking.config.RankingSettings;
import com.songranker.ranking.dto.RankingRunResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CPU-bound part of a ranking run shared by session and artist runs:
 * solve → rate → score. Blocking; callers schedule it off the event loop.
 */
final class RankingComputation {

    private RankingComputation() {}

    /**
     * @param stored     items of the run with their stored strengths (warm start)
     * @param outcomes   outcomes of the run, oldest first
     * @param countVotes attach per-item vote counts (artist runs)
     */
    static Computed compute(String scope, List<ItemRating> stored, List<Outcome> outcomes,
                            RankingSettings settings, boolean countVotes) {
        List<String> ids = new ArrayList<>(stored.size());
        Map<String, Double> warmStart = new LinkedHashMap<>();
        for (ItemRating item : stored) {
            ids.add(item.itemId());
            warmStart.put(item.itemId(), item.strength());
        }

        SolverResult solved = StrengthSolver.solve(ids, outcomes, warmStart, settings.solver());

        // With no determinate outcome the solver has nothing to say; keep what is stored.
        Map<String, Double> strengths = solved.comparisons() == 0 && !solved.degraded()
            ? warmStart
            : solved.strengths();

        Map<String, Long> votes = countVotes ? votes(ids, outcomes) : Map.of();
        List<ItemRating> ratings = new ArrayList<>(ids.size());
        for (String id : ids) {
            ratings.add(ItemRating.of(id, strengths.getOrDefault(id, 0.0), votes.getOrDefault(id, 0L)));
        }

        ConvergenceResult convergence = ConvergenceScorer.score(
            outcomes, ids.size(), strengths, settings.lookback(), settings.solver());

        RankingRunResult result = new RankingRunResult(scope, List.copyOf(ratings), convergence,
            outcomes.size(), solved.skippedOutcomes(), solved.degraded());
        return new Computed(result, solved);
    }

    /** Outcomes referencing each item, determinate or not. */
    static Map<String, Long> votes(List<String> ids, List<Outcome> outcomes) {
        Map<String, Long> votes = new HashMap<>();
        for (String id : ids) votes.put(id, 0L);
        for (Outcome o : outcomes) {
            if (o == null) continue;
            if (o.itemA() != null) votes.computeIfPresent(o.itemA(), (k, v) -> v + 1);
            if (o.itemB() != null && !o.itemB().equals(o.itemA())) {
                votes.computeIfPresent(o.itemB(), (k, v) -> v + 1);
            }
        }
        return votes;
    }

    record Computed(RankingRunResult result, SolverResult solver) {}
}
