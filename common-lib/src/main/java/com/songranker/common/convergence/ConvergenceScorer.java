package com.songranker.common.convergence;

import com.songranker.common.model.Outcome;
import com.songranker.common.solver.SolverResult;
import com.songranker.common.solver.SolverSettings;
import com.songranker.common.solver.StrengthSolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure stateless scorer answering "is this ranking trustworthy yet?".
 *
 * <p>Three factors are computed from the outcome history and the solver output:
 * <ol>
 *   <li><strong>Coverage</strong> — {@code sqrt(min3Fraction × quantity)}: the fraction of
 *       items with at least 3 determinate comparisons, and total determinate volume
 *       against a target of {@code 1.5 × items}. Both must be present.</li>
 *   <li><strong>Separation</strong> — range adequacy (0.3), gap uniformity (0.2) and
 *       per-item data confidence (0.5). Zero when all strengths lie within 0.01.</li>
 *   <li><strong>Stability</strong> — the current top 10 graded against the top 10 solved
 *       without the most recent {@code lookback} outcomes.</li>
 * </ol>
 *
 * <h3>Combination</h3>
 * <pre>
 *   raw   = 0.4 × coverage + 0.4 × separation + 0.2 × stability
 *   score = floor(min(100, raw^0.7 × 100))
 * </pre>
 * followed by {@link #applyGuardRails guard rails}: low per-item data caps the score,
 * high stability floors it, and a cap always wins over a floor.
 *
 * <p>No Spring dependencies. No I/O. Pure function.
 */
public final class ConvergenceScorer {

    public static final int DEFAULT_LOOKBACK = 5;

    static final int    TOP_N                  = 10;
    static final int    TOP_HEAD               = 5;
    static final int    MIN_COMPARISONS        = 3;
    static final double QUANTITY_FACTOR        = 1.5;

    static final double COVERAGE_WEIGHT        = 0.4;
    static final double SEPARATION_WEIGHT      = 0.4;
    static final double STABILITY_WEIGHT       = 0.2;
    static final double CURVE_EXPONENT         = 0.7;

    static final double MIN_RANGE              = 0.01;
    static final double FULL_RANGE             = 4.0;
    static final double RANGE_WEIGHT           = 0.3;
    static final double UNIFORMITY_WEIGHT      = 0.2;
    static final double CONFIDENCE_WEIGHT      = 0.5;

    static final int    SPARSE_CAP             = 65;
    static final int    THIN_CAP               = 85;

    private ConvergenceScorer() { /* utility class */ }

    public static ConvergenceResult score(List<Outcome> outcomes, int itemCount,
                                          Map<String, Double> strengths) {
        return score(outcomes, itemCount, strengths, DEFAULT_LOOKBACK, SolverSettings.DEFAULTS);
    }

    /**
     * Scores a ranking run.
     *
     * @param outcomes  full outcome history of the run, oldest first
     * @param itemCount number of items in the run
     * @param strengths solver output for the run (item id → log-strength)
     * @param lookback  number of most recent outcomes withheld for the stability check
     * @param settings  solver settings used for the stability re-solve
     * @return the combined result; never null
     */
    public static ConvergenceResult score(List<Outcome> outcomes, int itemCount,
                                          Map<String, Double> strengths,
                                          int lookback, SolverSettings settings) {
        if (itemCount <= 1) {
            return ConvergenceResult.settled();
        }
        if (outcomes == null || outcomes.isEmpty()) {
            return ConvergenceResult.empty();
        }

        Map<String, Integer> counts = determinateCounts(outcomes, strengths.keySet());
        int meaningful = meaningfulCount(outcomes, strengths.keySet());

        double coverage   = coverage(counts, itemCount, meaningful);
        double separation = separation(strengths, counts);
        double stability  = stability(outcomes, strengths, lookback, settings);

        int minComparisons = minComparisons(counts, itemCount);
        int curved = combine(coverage, separation, stability);
        int score  = applyGuardRails(curved, minComparisons, stability);

        return new ConvergenceResult(score, coverage, separation, stability);
    }

    // ── Coverage ───────────────────────────────────────────────────

    /**
     * Determinate comparisons per item. Every item in {@code items} gets an entry,
     * zero when it was never compared. Outcomes naming other items are ignored.
     */
    public static Map<String, Integer> determinateCounts(List<Outcome> outcomes, Set<String> items) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String id : items) counts.put(id, 0);
        for (Outcome o : outcomes) {
            if (!isUsable(o, items)) continue;
            counts.merge(o.itemA(), 1, Integer::sum);
            counts.merge(o.itemB(), 1, Integer::sum);
        }
        return counts;
    }

    public static double coverage(Map<String, Integer> counts, int itemCount, int meaningfulCount) {
        if (itemCount <= 0) return 0.0;

        long wellCovered = counts.values().stream()
            .filter(c -> c >= MIN_COMPARISONS)
            .count();
        double min3Fraction = Math.min(1.0, (double) wellCovered / itemCount);
        double quantity = Math.min(1.0, meaningfulCount / (itemCount * QUANTITY_FACTOR));

        return Math.sqrt(min3Fraction * quantity);
    }

    // ── Separation ─────────────────────────────────────────────────

    public static double separation(Map<String, Double> strengths, Map<String, Integer> counts) {
        if (strengths.isEmpty()) return 0.0;

        List<Double> sorted = strengths.values().stream().sorted().collect(Collectors.toList());
        double range = sorted.get(sorted.size() - 1) - sorted.get(0);
        if (range < MIN_RANGE) return 0.0;

        double rangeScore = Math.min(1.0, range / FULL_RANGE);
        double uniformity = gapUniformity(sorted);
        double confidence = strengths.keySet().stream()
            .mapToDouble(id -> Math.min(1.0, counts.getOrDefault(id, 0) / (double) MIN_COMPARISONS))
            .average()
            .orElse(0.0);

        return RANGE_WEIGHT * rangeScore
             + UNIFORMITY_WEIGHT * uniformity
             + CONFIDENCE_WEIGHT * confidence;
    }

    /**
     * {@code 1 / (1 + cv²)} over consecutive gaps of the sorted strengths, where
     * {@code cv²} is the gap variance normalized by the squared mean gap.
     * Evenly spaced strengths give 1.0; a few large jumps push it toward 0.
     */
    static double gapUniformity(List<Double> sortedAscending) {
        int gapCount = sortedAscending.size() - 1;
        if (gapCount < 2) return 1.0;

        double[] gaps = new double[gapCount];
        double sum = 0.0;
        for (int i = 0; i < gapCount; i++) {
            gaps[i] = sortedAscending.get(i + 1) - sortedAscending.get(i);
            sum += gaps[i];
        }
        double mean = sum / gapCount;
        if (mean <= 0.0) return 0.0;

        double variance = 0.0;
        for (double gap : gaps) {
            variance += (gap - mean) * (gap - mean);
        }
        variance /= gapCount;

        return 1.0 / (1.0 + variance / (mean * mean));
    }

    // ── Stability ──────────────────────────────────────────────────

    /**
     * Grades the current top 10 against the top 10 solved without the last
     * {@code lookback} outcomes. Needs {@code lookback + 10} outcomes; below that
     * the history is too short to judge and stability is 0.
     */
    public static double stability(List<Outcome> outcomes, Map<String, Double> strengths,
                                   int lookback, SolverSettings settings) {
        if (outcomes.size() < lookback + TOP_N) return 0.0;

        List<Outcome> earlier = outcomes.subList(0, outcomes.size() - lookback);
        SolverResult previous = StrengthSolver.solve(
            new ArrayList<>(strengths.keySet()), earlier, seedFor(earlier, strengths), settings);

        return gradeStability(topN(previous.strengths(), TOP_N), topN(strengths, TOP_N));
    }

    /**
     * Warm start for the truncated re-solve: current strengths of items compared in
     * {@code earlier} only. Items first compared in the dropped outcomes start at 0.0,
     * so they cannot carry their new position into the earlier ranking.
     */
    static Map<String, Double> seedFor(List<Outcome> earlier, Map<String, Double> strengths) {
        Map<String, Double> seed = new HashMap<>();
        for (Outcome o : earlier) {
            if (!isUsable(o, strengths.keySet())) continue;
            seed.put(o.itemA(), strengths.get(o.itemA()));
            seed.put(o.itemB(), strengths.get(o.itemB()));
        }
        return seed;
    }

    /**
     * Grade buckets, strictest first:
     * <pre>
     *   identical order                                    → 1.00
     *   same top-5 order, same top-10 membership           → 0.95
     *   same top-10 and top-5 membership, order differs    → 0.85
     *   same top-10 membership                             → 0.75
     *   same top-5 membership                              → 0.60
     *   otherwise                                          → overlap / 10 × 0.5
     * </pre>
     */
    public static double gradeStability(List<String> previousTop, List<String> currentTop) {
        if (previousTop.equals(currentTop)) return 1.0;

        List<String> previousHead = head(previousTop, TOP_HEAD);
        List<String> currentHead  = head(currentTop, TOP_HEAD);

        boolean sameMembers     = new HashSet<>(previousTop).equals(new HashSet<>(currentTop));
        boolean sameHeadOrder   = previousHead.equals(currentHead);
        boolean sameHeadMembers = new HashSet<>(previousHead).equals(new HashSet<>(currentHead));

        if (sameHeadOrder && sameMembers) return 0.95;
        if (sameMembers && sameHeadMembers) return 0.85;
        if (sameMembers) return 0.75;
        if (sameHeadMembers) return 0.6;

        Set<String> overlap = new HashSet<>(previousTop);
        overlap.retainAll(currentTop);
        return overlap.size() / (double) TOP_N * 0.5;
    }

    /** Item ids ordered by strength descending, ties broken by id. */
    public static List<String> topN(Map<String, Double> strengths, int n) {
        return strengths.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.<String, Double>comparingByKey()))
            .limit(n)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    // ── Combination & guard rails ──────────────────────────────────

    public static int combine(double coverage, double separation, double stability) {
        double raw = COVERAGE_WEIGHT * coverage
                   + SEPARATION_WEIGHT * separation
                   + STABILITY_WEIGHT * stability;
        double curved = Math.pow(Math.max(0.0, raw), CURVE_EXPONENT);
        return (int) Math.floor(Math.min(100.0, curved * 100.0));
    }

    /**
     * Caps for thin data, then floors for a stable top 10; the cap is re-applied last
     * so a floor can never lift a score above what the data supports.
     *
     * <pre>
     *   minComparisons &lt; 2                      → cap 65
     *   minComparisons &lt; 3                      → cap 85
     *   stability ≥ 0.95 and minComparisons ≥ 2 → floor 92
     *   stability ≥ 0.85                        → floor 90
     *   stability ≥ 0.75                        → floor 88
     * </pre>
     */
    public static int applyGuardRails(int score, int minComparisons, double stability) {
        int cap = 100;
        if (minComparisons < 2) {
            cap = SPARSE_CAP;
        } else if (minComparisons < MIN_COMPARISONS) {
            cap = THIN_CAP;
        }

        int result = Math.min(score, cap);

        if (stability >= 0.95 && minComparisons >= 2) {
            result = Math.max(result, 92);
        } else if (stability >= 0.85) {
            result = Math.max(result, 90);
        } else if (stability >= 0.75) {
            result = Math.max(result, 88);
        }

        return Math.min(result, cap);
    }

    // ── Helpers ────────────────────────────────────────────────────

    static int minComparisons(Map<String, Integer> counts, int itemCount) {
        if (counts.size() < itemCount) return 0;
        return counts.values().stream().mapToInt(Integer::intValue).min().orElse(0);
    }

    private static int meaningfulCount(List<Outcome> outcomes, Set<String> items) {
        int count = 0;
        for (Outcome o : outcomes) {
            if (isUsable(o, items)) count++;
        }
        return count;
    }

    private static boolean isUsable(Outcome o, Set<String> items) {
        return o != null && o.isWellFormed() && o.isDeterminate()
            && items.contains(o.itemA()) && items.contains(o.itemB());
    }

    private static List<String> head(List<String> ranking, int n) {
        return ranking.subList(0, Math.min(n, ranking.size()));
    }
}
