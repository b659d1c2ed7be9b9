package com.songranker.common.solver;

/**
 * Confidence weighting of a judgment by how long the judge took to decide.
 *
 * <pre>
 *   latency &lt; 3 000 ms   → 1.5  (high confidence)
 *   latency &gt; 10 000 ms  → 0.5  (low confidence)
 *   otherwise / unknown → 1.0
 * </pre>
 *
 * <p>The solver works on whole comparison records, so a weight is turned into a
 * repetition count {@code max(1, round(weight × 2))}: 3 for fast, 2 for normal,
 * 1 for slow decisions.
 */
public final class ComparisonWeighting {

    static final long   FAST_DECISION_MS = 3_000L;
    static final long   SLOW_DECISION_MS = 10_000L;

    static final double HIGH_CONFIDENCE   = 1.5;
    static final double NORMAL_CONFIDENCE = 1.0;
    static final double LOW_CONFIDENCE    = 0.5;

    private ComparisonWeighting() {}

    public static double weight(Long decisionLatencyMs) {
        if (decisionLatencyMs == null) return NORMAL_CONFIDENCE;
        if (decisionLatencyMs < FAST_DECISION_MS) return HIGH_CONFIDENCE;
        if (decisionLatencyMs > SLOW_DECISION_MS) return LOW_CONFIDENCE;
        return NORMAL_CONFIDENCE;
    }

    public static int repetitionsForWeight(double weight) {
        return (int) Math.max(1L, Math.round(weight * 2.0));
    }

    public static int repetitions(Long decisionLatencyMs) {
        return repetitionsForWeight(weight(decisionLatencyMs));
    }
}
