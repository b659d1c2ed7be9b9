package com.songranker.common.solver;

import com.songranker.common.model.Outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Paired-comparison strength estimator (Bradley-Terry model).
 *
 * <h3>Model</h3>
 * <pre>
 *   P(i beats j) = p_i / (p_i + p_j),   strength_i = θ_i = ln(p_i)
 * </pre>
 *
 * <h3>Comparison records</h3>
 * Every determinate outcome is expanded into directed "winner beat loser" records;
 * the repetition count comes from {@link ComparisonWeighting} (3 fast / 2 normal /
 * 1 slow). A tie adds that many records in each direction. Skips, malformed
 * outcomes and outcomes naming items outside the run add nothing.
 *
 * <h3>Regularization</h3>
 * Each item plays {@code λ} virtual wins and {@code λ} virtual losses against a fixed
 * average opponent ({@code p = 1}). The prior is the same for every item, needs no
 * detection of disconnected or one-sided items, and pins the scale so the fixed point
 * is unique: a warm start only changes how fast it is reached.
 *
 * <h3>Fixed point</h3>
 * The estimate is the maximum of the regularized likelihood, i.e. the point where the
 * MM ratio update leaves every strength unchanged:
 * <pre>
 *   p_i = (W_i + λ) / ( Σ_j N_ij / (p_i + p_j)  +  2λ / (p_i + 1) )
 * </pre>
 * with {@code W_i} the records won by i and {@code N_ij} the records between i and j.
 * Plain MM crawls toward that point when an item has only wins or only losses, so each
 * iteration takes a Newton step on the (strictly concave) log-likelihood instead,
 * solved matrix-free by conjugate gradients and guarded by step halving. Iteration stops
 * once no strength moves by more than the tolerance or the cap is hit. Items without
 * any record keep their warm-start strength (0.0 when none was supplied).
 *
 * <h3>Failure</h3>
 * A singular system (only possible with {@code λ = 0} and a one-sided item) or a
 * non-finite step does not propagate: the run degrades to all-zero strengths and
 * reports {@link SolverResult#degraded()}.
 *
 * <p>Pure static utility — no Spring dependencies, no state, no logging.
 * Single-threaded; independent runs may execute in parallel.
 */
public final class StrengthSolver {

    /** Bound on |θ| for warm-start values. */
    private static final double MAX_ABS_STRENGTH = 50.0;

    private static final double MIN_STEP = 1e-6;

    private StrengthSolver() {}

    public static SolverResult solve(List<String> items, List<Outcome> outcomes) {
        return solve(items, outcomes, Map.of(), SolverSettings.DEFAULTS);
    }

    public static SolverResult solve(List<String> items, List<Outcome> outcomes,
                                     Map<String, Double> warmStart) {
        return solve(items, outcomes, warmStart, SolverSettings.DEFAULTS);
    }

    /**
     * Estimates log-strengths for {@code items} from {@code outcomes}.
     *
     * @param items     item ids of the run; duplicates and nulls are ignored
     * @param outcomes  recorded judgments in any order
     * @param warmStart previously computed log-strengths used as the starting point (nullable)
     * @param settings  regularization, iteration cap and tolerance
     * @return one strength per item; never {@code null}
     */
    public static SolverResult solve(List<String> items,
                                     List<Outcome> outcomes,
                                     Map<String, Double> warmStart,
                                     SolverSettings settings) {
        Map<String, Integer> index = indexItems(items);
        List<String> ids = new ArrayList<>(index.keySet());
        Map<String, Double> prior = warmStart != null ? warmStart : Map.of();

        ComparisonTally tally = ComparisonTally.build(index, outcomes);

        if (ids.isEmpty()) {
            return new SolverResult(Map.of(), 0, true, 0, tally.skipped, false, null);
        }
        if (ids.size() == 1) {
            return new SolverResult(Map.of(ids.get(0), 0.0), 0, true,
                                    tally.records, tally.skipped, false, null);
        }
        if (tally.records == 0) {
            return new SolverResult(neutral(ids), 0, true, 0, tally.skipped, false, null);
        }

        try {
            return iterate(ids, tally, prior, settings);
        } catch (ArithmeticException e) {
            return new SolverResult(neutral(ids), 0, false, tally.records, tally.skipped,
                                    true, e.getMessage());
        }
    }

    // ── Iteration ───────────────────────────────────────────────────────────

    private static SolverResult iterate(List<String> ids, ComparisonTally tally,
                                        Map<String, Double> prior, SolverSettings settings) {
        int n = ids.size();
        double lambda = settings.regularization();

        if (lambda <= 0.0) {
            requireTwoSided(ids, tally);
        }

        double[] theta = new double[n];
        for (int k = 0; k < n; k++) {
            theta[k] = initialStrength(prior.get(ids.get(k)));
        }

        int iterations = 0;
        boolean converged = false;

        while (iterations < settings.maxIterations()) {
            iterations++;

            double[] gradient  = new double[n];
            double[] diagonal  = new double[n];
            double[] pairCurve = new double[tally.pairI.length];
            gradientAndCurvature(theta, tally, lambda, gradient, diagonal, pairCurve);

            double[] direction = conjugateGradient(tally, diagonal, pairCurve, gradient);

            double current = logLikelihood(theta, tally, lambda);
            double step = 1.0;
            double[] candidate = offset(theta, direction, step);
            while (logLikelihood(candidate, tally, lambda) < current - 1e-12 * Math.abs(current)
                    && step > MIN_STEP) {
                step /= 2.0;
                candidate = offset(theta, direction, step);
            }

            double maxDelta = 0.0;
            for (int k = 0; k < n; k++) {
                if (!Double.isFinite(candidate[k])) {
                    throw new ArithmeticException("strength of '" + ids.get(k)
                        + "' became " + candidate[k] + " at iteration " + iterations);
                }
                maxDelta = Math.max(maxDelta, Math.abs(candidate[k] - theta[k]));
            }
            theta = candidate;

            if (maxDelta < settings.tolerance()) {
                converged = true;
                break;
            }
        }

        Map<String, Double> strengths = new LinkedHashMap<>();
        for (int k = 0; k < n; k++) {
            String id = ids.get(k);
            strengths.put(id, tally.active[k] ? theta[k] : priorOrZero(prior.get(id)));
        }
        return new SolverResult(Collections.unmodifiableMap(strengths), iterations, converged,
                                tally.records, tally.skipped, false, null);
    }

    /** Without a prior an item that never lost (or never won) has no finite strength. */
    private static void requireTwoSided(List<String> ids, ComparisonTally tally) {
        for (int k = 0; k < ids.size(); k++) {
            if (!tally.active[k]) continue;
            if (tally.wins[k] <= 0.0 || tally.wins[k] >= tally.played[k]) {
                throw new ArithmeticException("singular update: '" + ids.get(k)
                    + "' is one-sided and regularization is 0");
            }
        }
    }

    /**
     * Fills the log-likelihood gradient and the entries of its negated Hessian:
     * {@code diagonal[k]} and, per pair, {@code pairCurve[e] = N_ij q (1 - q)}.
     */
    private static void gradientAndCurvature(double[] theta, ComparisonTally tally, double lambda,
                                             double[] gradient, double[] diagonal,
                                             double[] pairCurve) {
        for (int k = 0; k < theta.length; k++) {
            if (!tally.active[k]) continue;
            double s = sigmoid(theta[k]);
            gradient[k] = tally.wins[k] + lambda - 2.0 * lambda * s;
            diagonal[k] = 2.0 * lambda * s * (1.0 - s);
        }
        for (int e = 0; e < tally.pairI.length; e++) {
            int i = tally.pairI[e];
            int j = tally.pairJ[e];
            double c = tally.pairCount[e];
            double q = sigmoid(theta[i] - theta[j]);
            gradient[i] -= c * q;
            gradient[j] -= c * (1.0 - q);
            double w = c * q * (1.0 - q);
            diagonal[i] += w;
            diagonal[j] += w;
            pairCurve[e] = w;
        }
    }

    /** Solves {@code A x = b} for the negated Hessian {@code A} without materializing it. */
    private static double[] conjugateGradient(ComparisonTally tally, double[] diagonal,
                                              double[] pairCurve, double[] b) {
        int n = b.length;
        double[] x = new double[n];
        double[] r = b.clone();
        double[] p = r.clone();
        double rr = dot(r, r);
        double threshold = 1e-30 * Math.max(1.0, rr);
        int limit = Math.max(1, 2 * n);

        for (int it = 0; it < limit && rr > threshold; it++) {
            double[] ap = multiply(tally, diagonal, pairCurve, p);
            double pap = dot(p, ap);
            if (!(pap > 0.0)) {
                throw new ArithmeticException("singular update: non-positive curvature " + pap);
            }
            double alpha = rr / pap;
            for (int k = 0; k < n; k++) {
                x[k] += alpha * p[k];
                r[k] -= alpha * ap[k];
            }
            double next = dot(r, r);
            double beta = next / rr;
            for (int k = 0; k < n; k++) {
                p[k] = r[k] + beta * p[k];
            }
            rr = next;
        }
        return x;
    }

    private static double[] multiply(ComparisonTally tally, double[] diagonal,
                                     double[] pairCurve, double[] v) {
        double[] out = new double[v.length];
        for (int k = 0; k < v.length; k++) {
            out[k] = diagonal[k] * v[k];
        }
        for (int e = 0; e < tally.pairI.length; e++) {
            int i = tally.pairI[e];
            int j = tally.pairJ[e];
            out[i] -= pairCurve[e] * v[j];
            out[j] -= pairCurve[e] * v[i];
        }
        return out;
    }

    private static double logLikelihood(double[] theta, ComparisonTally tally, double lambda) {
        double sum = 0.0;
        for (int k = 0; k < theta.length; k++) {
            if (!tally.active[k]) continue;
            sum += (tally.wins[k] + lambda) * theta[k] - 2.0 * lambda * logSumExp(theta[k], 0.0);
        }
        for (int e = 0; e < tally.pairI.length; e++) {
            sum -= tally.pairCount[e] * logSumExp(theta[tally.pairI[e]], theta[tally.pairJ[e]]);
        }
        return sum;
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private static Map<String, Integer> indexItems(List<String> items) {
        Map<String, Integer> index = new LinkedHashMap<>();
        if (items == null) return index;
        for (String id : items) {
            if (id != null) index.putIfAbsent(id, index.size());
        }
        return index;
    }

    private static Map<String, Double> neutral(List<String> ids) {
        Map<String, Double> strengths = new LinkedHashMap<>();
        for (String id : ids) strengths.put(id, 0.0);
        return Collections.unmodifiableMap(strengths);
    }

    private static double initialStrength(Double logStrength) {
        if (logStrength == null || !Double.isFinite(logStrength)) return 0.0;
        return Math.max(-MAX_ABS_STRENGTH, Math.min(MAX_ABS_STRENGTH, logStrength));
    }

    private static double[] offset(double[] theta, double[] direction, double step) {
        double[] out = new double[theta.length];
        for (int k = 0; k < theta.length; k++) {
            out[k] = theta[k] + step * direction[k];
        }
        return out;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int k = 0; k < a.length; k++) sum += a[k] * b[k];
        return sum;
    }

    private static double sigmoid(double x) {
        if (x >= 0.0) return 1.0 / (1.0 + Math.exp(-x));
        double e = Math.exp(x);
        return e / (1.0 + e);
    }

    /** {@code ln(e^a + e^b)} without overflow. */
    private static double logSumExp(double a, double b) {
        double max = Math.max(a, b);
        return max + Math.log1p(Math.exp(-Math.abs(a - b)));
    }

    private static double priorOrZero(Double logStrength) {
        return logStrength != null && Double.isFinite(logStrength) ? logStrength : 0.0;
    }

    /**
     * Win totals and symmetric pair counts built from the outcome list.
     * Pairs are stored as parallel arrays ({@code i < j}) for the Hessian products.
     */
    private static final class ComparisonTally {
        final double[]  wins;
        final double[]  played;
        final boolean[] active;
        int[]    pairI    = new int[0];
        int[]    pairJ    = new int[0];
        double[] pairCount = new double[0];
        int records;
        int skipped;

        private ComparisonTally(int n) {
            this.wins   = new double[n];
            this.played = new double[n];
            this.active = new boolean[n];
        }

        static ComparisonTally build(Map<String, Integer> index, List<Outcome> outcomes) {
            int n = index.size();
            ComparisonTally tally = new ComparisonTally(n);
            if (outcomes == null) return tally;

            Map<Long, Double> pairs = new LinkedHashMap<>();
            for (Outcome outcome : outcomes) {
                if (outcome == null || !outcome.isWellFormed()) {
                    tally.skipped++;
                    continue;
                }
                Integer a = index.get(outcome.itemA());
                Integer b = index.get(outcome.itemB());
                if (a == null || b == null) {
                    tally.skipped++;
                    continue;
                }
                if (!outcome.isDeterminate()) {
                    continue;
                }

                int reps = ComparisonWeighting.repetitions(outcome.decisionLatencyMs());
                int pairRecords;
                if (outcome.tie()) {
                    tally.wins[a] += reps;
                    tally.wins[b] += reps;
                    pairRecords = 2 * reps;
                } else {
                    int winner = outcome.winner().equals(outcome.itemA()) ? a : b;
                    tally.wins[winner] += reps;
                    pairRecords = reps;
                }
                tally.records += pairRecords;
                tally.played[a] += pairRecords;
                tally.played[b] += pairRecords;
                tally.active[a] = true;
                tally.active[b] = true;

                long key = (long) Math.min(a, b) * n + Math.max(a, b);
                pairs.merge(key, (double) pairRecords, Double::sum);
            }

            int size = pairs.size();
            tally.pairI     = new int[size];
            tally.pairJ     = new int[size];
            tally.pairCount = new double[size];
            int e = 0;
            for (Map.Entry<Long, Double> entry : pairs.entrySet()) {
                tally.pairI[e]     = (int) (entry.getKey() / n);
                tally.pairJ[e]     = (int) (entry.getKey() % n);
                tally.pairCount[e] = entry.getValue();
                e++;
            }
            return tally;
        }
    }
}
